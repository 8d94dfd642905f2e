package com.shapecraft.generator.model;

import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * Method invocation {@code target.method(args)}, or {@code target?.method(args)}.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class MethodCallNode extends ExprNode {
    @NonNull ExprNode target;
    @NonNull String method;
    @NonNull List<ExprNode> arguments;
    boolean nullSafe;
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    SourcePosition position;

    public MethodCallNode(ExprNode target, String method, List<ExprNode> arguments, boolean nullSafe,
                          SourcePosition position) {
        this.target = target;
        this.method = method;
        this.arguments = List.copyOf(arguments);
        this.nullSafe = nullSafe;
        this.position = position;
    }

    /**
     * The single lambda argument, if the call has exactly one argument and it is a lambda.
     */
    public LambdaNode lambdaArgument() {
        if (arguments.size() == 1 && arguments.get(0) instanceof LambdaNode lambda) {
            return lambda;
        }
        return null;
    }

    @Override
    public <R> R accept(ExprNodeVisitor<R> visitor) {
        return visitor.visitMethodCall(this);
    }
}
