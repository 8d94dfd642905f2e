package com.shapecraft.generator.codegen.variant;

/**
 * How a forward transform is exposed by the generated projections class.
 */
public enum EmissionStrategy {
    /** A method returns a fresh lambda on every call; captures become its parameters. */
    INLINE_CLOSURE,
    /** A {@code private static final Function} built once and returned by every call. */
    PREBUILT_TRANSFORM
}
