package com.shapecraft.generator.schema;

public enum CollectionKind {
    LIST,
    SET,
    ARRAY,
    /** Any other iterable container, e.g. {@code Collection} or {@code Iterable}. */
    SEQUENCE
}
