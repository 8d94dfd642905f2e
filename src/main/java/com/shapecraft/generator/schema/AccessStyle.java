package com.shapecraft.generator.schema;

/**
 * How a member is read or written from generated code.
 */
public enum AccessStyle {
    /** {@code getX()} / {@code isX()} */
    GETTER,
    /** {@code setX(value)} */
    SETTER,
    /** Direct public field access. */
    FIELD,
    /** Record component accessor {@code x()}. */
    RECORD,
    NONE
}
