package com.shapecraft.generator.model;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * Explicit null fallback {@code value ?? fallback}.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class CoalesceNode extends ExprNode {
    @NonNull ExprNode value;
    @NonNull ExprNode fallback;
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    SourcePosition position;

    @Override
    public <R> R accept(ExprNodeVisitor<R> visitor) {
        return visitor.visitCoalesce(this);
    }
}
