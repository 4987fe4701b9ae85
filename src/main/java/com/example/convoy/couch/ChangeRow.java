package com.example.convoy.couch;

import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * One result of a changes query: the sequence it was observed at, the
 * document ID and, when requested, the full document body.
 */
@Getter
@AllArgsConstructor
@ToString
public class ChangeRow {

    private final String seq;
    private final String id;
    private final Map<String, Object> doc;
}
