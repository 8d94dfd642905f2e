package com.shapecraft.generator.model;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

@Value
@EqualsAndHashCode(callSuper = false)
public class BinaryNode extends ExprNode {
    @NonNull BinaryOperator operator;
    @NonNull ExprNode left;
    @NonNull ExprNode right;
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    SourcePosition position;

    @Override
    public <R> R accept(ExprNodeVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }
}
