package com.shapecraft.generator.model;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * Reference to the projection parameter or to an enclosing lambda parameter.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class ParameterNode extends ExprNode {
    @NonNull String name;
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    SourcePosition position;

    @Override
    public <R> R accept(ExprNodeVisitor<R> visitor) {
        return visitor.visitParameter(this);
    }
}
