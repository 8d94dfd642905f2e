package com.shapecraft.generator.codegen.model;

/**
 * The signal that decided a field's nullability, in precedence order.
 */
public enum NullabilityRule {
    DECLARED_MEMBER,
    MATERIALIZED_COLLECTION,
    NULL_SAFE_ACCESS,
    MULTI_HOP_FALLBACK,
    COLLECTION_COLLAPSE,
    TARGET_MEMBER,
    COALESCE_FALLBACK,
    EXPRESSION
}
