package com.shapecraft.generator.schema;

/**
 * Runtime representation behind an anonymous type.
 */
public enum AnonymousOrigin {
    /** Untyped {@code Map<String, Object>}; members are read through generated key accessors. */
    MAP,
    /** A generated DTO; members are read through its getters. */
    DTO
}
