package com.shapecraft.generator.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A parsed {@code projection} declaration: one call site of the generator.
 */
@Value
@Builder
public class ProjectionDeclaration {
    /** Declared projection name, null for anonymous projections. */
    String name;
    @Singular
    List<CaptureDeclaration> captures;
    @NonNull TypeExpr sourceType;
    @NonNull String parameterName;
    @NonNull ExprNode body;
    @NonNull SourcePosition position;
}
