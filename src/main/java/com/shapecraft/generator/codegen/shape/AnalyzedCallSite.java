package com.shapecraft.generator.codegen.shape;

import java.util.List;
import java.util.Map;

import com.shapecraft.generator.codegen.model.CallSite;
import com.shapecraft.generator.codegen.model.Structure;
import com.shapecraft.generator.codegen.model.core.context.ToolDiagnostics;
import com.shapecraft.generator.codegen.variant.EmissionStrategy;
import com.shapecraft.generator.codegen.variant.ProjectionVariant;
import com.shapecraft.generator.model.ExprNode;
import com.shapecraft.generator.model.ShapeNode;
import com.shapecraft.generator.schema.TypeRef;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Result of analysing one call site. Immutable once built, so it can be
 * memoized and handed to the code generators of any thread.
 */
@Value
@Builder
public class AnalyzedCallSite {
    @NonNull CallSite callSite;
    /** Null when the site failed before its variant could be chosen. */
    ProjectionVariant variant;
    TypeRef sourceType;
    @Singular
    Map<String, TypeRef> captureTypes;
    /** Root structure; null when the site failed. */
    Structure root;
    /** Every structure of the site, nested ones before their parents. */
    @Singular
    List<Structure> structures;
    /** Structure built for each registered shape literal. */
    Map<ShapeNode, Structure> shapeStructures;
    /** Static type of every typed expression node. */
    Map<ExprNode, TypeRef> types;
    @NonNull ToolDiagnostics diagnostics;
    EmissionStrategy emissionStrategy;
    boolean reverseSupported;
    String methodName;

    public boolean isFailed() {
        return root == null;
    }
}
