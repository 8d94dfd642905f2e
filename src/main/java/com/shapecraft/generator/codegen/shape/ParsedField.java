package com.shapecraft.generator.codegen.shape;

import com.shapecraft.generator.codegen.model.SourcePath;
import com.shapecraft.generator.model.ExprNode;
import com.shapecraft.generator.schema.TypeRef;

import lombok.Value;

/**
 * A shape entry after typing, before nullability and nesting are decided.
 */
@Value
public class ParsedField {
    String name;
    ExprNode expression;
    TypeRef declaredType;
    String lineage;
    /** Member chain relative to the structure's source, null when there is none. */
    SourcePath sourcePath;

    public boolean isUnresolved() {
        return !declaredType.isResolved();
    }
}
