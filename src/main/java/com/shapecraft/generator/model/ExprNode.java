package com.shapecraft.generator.model;

/**
 * Base node of the projection expression tree built by the shape parser.
 *
 * Nodes are immutable. Equality ignores source positions, so two nodes with the
 * same syntax compare equal wherever they were written.
 */
public abstract class ExprNode {

    public abstract SourcePosition getPosition();

    public abstract <R> R accept(ExprNodeVisitor<R> visitor);

    /**
     * Canonical shape-DSL text of this node.
     */
    public String toSource() {
        return ExprPrinter.print(this);
    }
}
