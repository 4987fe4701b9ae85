package com.example.convoy.couch;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@ToString
public class ChangesBatch {

    private final List<ChangeRow> results;
    private final String lastSeq;

    public boolean isEmpty() {
        return results.isEmpty();
    }
}
