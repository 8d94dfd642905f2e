package com.shapecraft.generator.model;

import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * Shape literal {@code { a: x, b: y }}, or {@code new Type { ... }} when it
 * targets a named type. {@code typeName} is the name as written in the file.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class ShapeNode extends ExprNode {
    String typeName;
    @NonNull List<ShapeEntry> entries;
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    SourcePosition position;

    public ShapeNode(String typeName, List<ShapeEntry> entries, SourcePosition position) {
        this.typeName = typeName;
        this.entries = List.copyOf(entries);
        this.position = position;
    }

    public boolean isNamed() {
        return typeName != null;
    }

    @Override
    public <R> R accept(ExprNodeVisitor<R> visitor) {
        return visitor.visitShape(this);
    }
}
