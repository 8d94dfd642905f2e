package com.shapecraft.generator.codegen.model;

/**
 * How a structure field relates to nested structures.
 */
public enum FieldShape {
    /** Scalar or pass-through value. */
    LEAF,
    /** Shape literal that could not be turned into a nested structure; emitted as an untyped map. */
    OPAQUE,
    NESTED_OBJECT,
    NESTED_COLLECTION
}
