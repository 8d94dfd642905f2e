package com.shapecraft.generator.codegen;

/**
 * Java form of generated DTO types.
 */
public enum DtoStyle {
    /** Mutable class with getters, setters and value equality. */
    CLASS,
    /** Java record. */
    RECORD
}
