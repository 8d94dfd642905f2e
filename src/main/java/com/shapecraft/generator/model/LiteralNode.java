package com.shapecraft.generator.model;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * Literal value. {@code text} is the literal exactly as written, quotes and
 * suffixes included, and is valid Java source.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class LiteralNode extends ExprNode {
    @NonNull LiteralKind kind;
    @NonNull String text;
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    SourcePosition position;

    @Override
    public <R> R accept(ExprNodeVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }
}
