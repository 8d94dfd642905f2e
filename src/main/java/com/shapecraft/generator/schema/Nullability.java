package com.shapecraft.generator.schema;

/**
 * Declared nullability of a schema member.
 */
public enum Nullability {
    NULLABLE,
    NON_NULL,
    /** No annotation or marker; nothing is known. */
    UNKNOWN
}
