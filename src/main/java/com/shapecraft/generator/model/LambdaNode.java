package com.shapecraft.generator.model;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * Single-parameter lambda {@code p => body}.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class LambdaNode extends ExprNode {
    @NonNull String parameter;
    @NonNull ExprNode body;
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    SourcePosition position;

    @Override
    public <R> R accept(ExprNodeVisitor<R> visitor) {
        return visitor.visitLambda(this);
    }
}
