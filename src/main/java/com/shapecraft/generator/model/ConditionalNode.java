package com.shapecraft.generator.model;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

@Value
@EqualsAndHashCode(callSuper = false)
public class ConditionalNode extends ExprNode {
    @NonNull ExprNode condition;
    @NonNull ExprNode whenTrue;
    @NonNull ExprNode whenFalse;
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    SourcePosition position;

    @Override
    public <R> R accept(ExprNodeVisitor<R> visitor) {
        return visitor.visitConditional(this);
    }
}
