package com.shapecraft.generator.model;

/**
 * Visitor over the projection expression tree.
 */
public interface ExprNodeVisitor<R> {

    R visitParameter(ParameterNode node);

    R visitCapture(CaptureNode node);

    R visitIdentifier(IdentifierNode node);

    R visitMemberAccess(MemberAccessNode node);

    R visitMethodCall(MethodCallNode node);

    R visitLambda(LambdaNode node);

    R visitShape(ShapeNode node);

    R visitConditional(ConditionalNode node);

    R visitCoalesce(CoalesceNode node);

    R visitBinary(BinaryNode node);

    R visitUnary(UnaryNode node);

    R visitLiteral(LiteralNode node);
}
