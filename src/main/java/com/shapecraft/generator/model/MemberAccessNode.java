package com.shapecraft.generator.model;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * Member read {@code target.member}, or {@code target?.member} when null-safe.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class MemberAccessNode extends ExprNode {
    @NonNull ExprNode target;
    @NonNull String member;
    boolean nullSafe;
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    SourcePosition position;

    @Override
    public <R> R accept(ExprNodeVisitor<R> visitor) {
        return visitor.visitMemberAccess(this);
    }
}
