package com.shapecraft.generator.model;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * Identifier that is neither a parameter nor a capture, emitted verbatim (static class names, constants).
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class IdentifierNode extends ExprNode {
    @NonNull String name;
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    SourcePosition position;

    @Override
    public <R> R accept(ExprNodeVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }
}
