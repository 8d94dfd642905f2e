package com.shapecraft.generator.model;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * Reference to a captured variable declared on the projection.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class CaptureNode extends ExprNode {
    @NonNull String name;
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    SourcePosition position;

    @Override
    public <R> R accept(ExprNodeVisitor<R> visitor) {
        return visitor.visitCapture(this);
    }
}
