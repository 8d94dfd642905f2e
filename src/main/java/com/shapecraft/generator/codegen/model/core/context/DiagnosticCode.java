package com.shapecraft.generator.codegen.model.core.context;

/**
 * Stable identifiers of everything the generator can report.
 */
public enum DiagnosticCode {
    PARSE_ERROR,
    SCHEMA_ERROR,
    UNRESOLVED_TYPE,
    UNSUPPORTED_EXPRESSION_SHAPE,
    AMBIGUOUS_REVERSE_PATH,
    IDENTITY_COLLISION,
    EMPTY_STRUCTURE,
    DUPLICATE_FIELD,
    MISSING_FIELD_NAME,
    NAME_CONFLICT,
    REVERSE_UNAVAILABLE
}
