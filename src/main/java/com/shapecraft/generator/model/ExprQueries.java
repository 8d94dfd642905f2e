package com.shapecraft.generator.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

import lombok.experimental.UtilityClass;

/**
 * Syntactic detectors over the expression tree. These never consult the type
 * schema.
 */
@UtilityClass
public class ExprQueries {

    public boolean isPostfix(ExprNode node) {
        return node instanceof MemberAccessNode || node instanceof MethodCallNode;
    }

    /**
     * Receiver of a member access or method call, or null for any other node.
     */
    public ExprNode receiverOf(ExprNode node) {
        if (node instanceof MemberAccessNode member) {
            return member.getTarget();
        }
        if (node instanceof MethodCallNode call) {
            return call.getTarget();
        }
        return null;
    }

    public boolean isNullSafeHop(ExprNode node) {
        return (node instanceof MemberAccessNode member && member.isNullSafe())
                || (node instanceof MethodCallNode call && call.isNullSafe());
    }

    /**
     * Innermost non-postfix node of an access chain; the node itself when it is
     * not a member access or method call.
     */
    public ExprNode chainBase(ExprNode node) {
        ExprNode current = node;
        while (isPostfix(current)) {
            current = receiverOf(current);
        }
        return current;
    }

    /**
     * Member accesses and method calls of a chain, innermost first. The last
     * element is {@code node} itself.
     */
    public List<ExprNode> chainHops(ExprNode node) {
        Deque<ExprNode> hops = new ArrayDeque<>();
        ExprNode current = node;
        while (isPostfix(current)) {
            hops.addFirst(current);
            current = receiverOf(current);
        }
        return new ArrayList<>(hops);
    }

    /**
     * Member names of a pure member chain rooted at the named parameter, e.g.
     * {@code o.customer?.name} gives {@code [customer, name]} for {@code o}.
     */
    public Optional<List<String>> memberPath(ExprNode node, String parameter) {
        List<String> members = new ArrayList<>();
        ExprNode current = node;
        while (current instanceof MemberAccessNode member) {
            members.add(0, member.getMember());
            current = member.getTarget();
        }
        if (current instanceof ParameterNode param && param.getName().equals(parameter)) {
            return Optional.of(members);
        }
        return Optional.empty();
    }

    public boolean isMemberChainFromParameter(ExprNode node) {
        if (!(node instanceof MemberAccessNode)) {
            return false;
        }
        ExprNode current = node;
        while (current instanceof MemberAccessNode member) {
            current = member.getTarget();
        }
        return current instanceof ParameterNode;
    }

    /**
     * True when a null-safe hop appears anywhere outside nested lambdas and
     * nested shapes.
     */
    public boolean hasTopLevelNullSafe(ExprNode node) {
        if (isNullSafeHop(node)) {
            return true;
        }
        if (node instanceof LambdaNode || node instanceof ShapeNode) {
            return false;
        }
        return children(node).stream().anyMatch(ExprQueries::hasTopLevelNullSafe);
    }

    public boolean containsConditional(ExprNode node) {
        boolean[] found = {false};
        walk(node, true, n -> {
            if (n instanceof ConditionalNode) {
                found[0] = true;
            }
        });
        return found[0];
    }

    public List<ShapeNode> shapesOutsideLambdas(ExprNode node) {
        List<ShapeNode> shapes = new ArrayList<>();
        walk(node, false, n -> {
            if (n instanceof ShapeNode shape) {
                shapes.add(shape);
            }
        });
        return shapes;
    }

    /**
     * Field name implied by an unnamed shape entry: the last member of a member
     * access, or the identifier itself.
     */
    public Optional<String> implicitName(ExprNode node) {
        if (node instanceof MemberAccessNode member) {
            return Optional.of(member.getMember());
        }
        if (node instanceof ParameterNode param) {
            return Optional.of(param.getName());
        }
        if (node instanceof CaptureNode capture) {
            return Optional.of(capture.getName());
        }
        if (node instanceof IdentifierNode identifier) {
            return Optional.of(identifier.getName());
        }
        return Optional.empty();
    }

    public List<ExprNode> children(ExprNode node) {
        List<ExprNode> children = new ArrayList<>();
        if (node instanceof MemberAccessNode member) {
            children.add(member.getTarget());
        } else if (node instanceof MethodCallNode call) {
            children.add(call.getTarget());
            children.addAll(call.getArguments());
        } else if (node instanceof LambdaNode lambda) {
            children.add(lambda.getBody());
        } else if (node instanceof ShapeNode shape) {
            shape.getEntries().forEach(e -> children.add(e.getValue()));
        } else if (node instanceof ConditionalNode conditional) {
            children.add(conditional.getCondition());
            children.add(conditional.getWhenTrue());
            children.add(conditional.getWhenFalse());
        } else if (node instanceof CoalesceNode coalesce) {
            children.add(coalesce.getValue());
            children.add(coalesce.getFallback());
        } else if (node instanceof BinaryNode binary) {
            children.add(binary.getLeft());
            children.add(binary.getRight());
        } else if (node instanceof UnaryNode unary) {
            children.add(unary.getOperand());
        }
        return children;
    }

    /**
     * Pre-order traversal. Lambda bodies are skipped unless {@code intoLambdas}.
     */
    public void walk(ExprNode node, boolean intoLambdas, Consumer<ExprNode> visitor) {
        visitor.accept(node);
        if (node instanceof LambdaNode && !intoLambdas) {
            return;
        }
        for (ExprNode child : children(node)) {
            walk(child, intoLambdas, visitor);
        }
    }
}
