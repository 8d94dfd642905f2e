package com.shapecraft.generator.codegen.variant;

public enum VariantKind {
    ANONYMOUS,
    EXPLICIT_DTO,
    NAMED_TYPE,
    GROUPED
}
