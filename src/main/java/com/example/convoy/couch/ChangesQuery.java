package com.example.convoy.couch;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class ChangesQuery {

    private final String since;
    private final int limit;
    private final String filter;
    private final boolean includeDocs;
}
