package com.example.accessgate.store.mongo.document;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One condition in its loose form: {@code value} is a scalar, a list, or a single-key
 * operator map ({@code in} / {@code range}). The path is kept out of map keys because it
 * contains dots.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConditionDoc {

    private String path;

    private Object value;
}
