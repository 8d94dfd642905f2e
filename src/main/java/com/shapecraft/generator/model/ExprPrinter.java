package com.shapecraft.generator.model;

import java.util.stream.Collectors;

/**
 * Prints an expression tree back to canonical shape-DSL text. Parentheses are
 * emitted only where precedence requires them, so printing is stable for
 * equal trees.
 */
public final class ExprPrinter implements ExprNodeVisitor<String> {

    private static final ExprPrinter INSTANCE = new ExprPrinter();

    private static final int LAMBDA = 0;
    private static final int CONDITIONAL = 1;
    private static final int COALESCE = 2;
    private static final int UNARY = 9;
    private static final int POSTFIX = 10;

    private ExprPrinter() {
    }

    public static String print(ExprNode node) {
        return node.accept(INSTANCE);
    }

    static int precedence(ExprNode node) {
        if (node instanceof LambdaNode) {
            return LAMBDA;
        }
        if (node instanceof ConditionalNode) {
            return CONDITIONAL;
        }
        if (node instanceof CoalesceNode) {
            return COALESCE;
        }
        if (node instanceof BinaryNode binary) {
            return COALESCE + binary.getOperator().getPrecedence();
        }
        if (node instanceof UnaryNode) {
            return UNARY;
        }
        return POSTFIX;
    }

    private String operand(ExprNode child, int minimum) {
        String text = child.accept(this);
        return precedence(child) < minimum ? "(" + text + ")" : text;
    }

    @Override
    public String visitParameter(ParameterNode node) {
        return node.getName();
    }

    @Override
    public String visitCapture(CaptureNode node) {
        return node.getName();
    }

    @Override
    public String visitIdentifier(IdentifierNode node) {
        return node.getName();
    }

    @Override
    public String visitMemberAccess(MemberAccessNode node) {
        return operand(node.getTarget(), POSTFIX) + (node.isNullSafe() ? "?." : ".") + node.getMember();
    }

    @Override
    public String visitMethodCall(MethodCallNode node) {
        String args = node.getArguments().stream().map(a -> a.accept(this)).collect(Collectors.joining(", "));
        return operand(node.getTarget(), POSTFIX) + (node.isNullSafe() ? "?." : ".")
                + node.getMethod() + "(" + args + ")";
    }

    @Override
    public String visitLambda(LambdaNode node) {
        return node.getParameter() + " => " + node.getBody().accept(this);
    }

    @Override
    public String visitShape(ShapeNode node) {
        String entries = node.getEntries().stream()
                .map(e -> e.isExplicitlyNamed() ? e.getName() + ": " + e.getValue().accept(this) : e.getValue().accept(this))
                .collect(Collectors.joining(", "));
        String body = entries.isEmpty() ? "{}" : "{ " + entries + " }";
        return node.isNamed() ? "new " + node.getTypeName() + " " + body : body;
    }

    @Override
    public String visitConditional(ConditionalNode node) {
        return operand(node.getCondition(), COALESCE) + " ? " + operand(node.getWhenTrue(), CONDITIONAL)
                + " : " + operand(node.getWhenFalse(), CONDITIONAL);
    }

    @Override
    public String visitCoalesce(CoalesceNode node) {
        return operand(node.getValue(), COALESCE + 1) + " ?? " + operand(node.getFallback(), COALESCE);
    }

    @Override
    public String visitBinary(BinaryNode node) {
        int own = precedence(node);
        return operand(node.getLeft(), own) + " " + node.getOperator().getSymbol() + " "
                + operand(node.getRight(), own + 1);
    }

    @Override
    public String visitUnary(UnaryNode node) {
        return node.getOperator().getSymbol() + operand(node.getOperand(), UNARY);
    }

    @Override
    public String visitLiteral(LiteralNode node) {
        return node.getText();
    }
}
