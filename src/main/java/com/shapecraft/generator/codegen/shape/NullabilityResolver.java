package com.shapecraft.generator.codegen.shape;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.shapecraft.generator.codegen.model.FieldShape;
import com.shapecraft.generator.codegen.model.NullabilityRule;
import com.shapecraft.generator.model.BinaryNode;
import com.shapecraft.generator.model.CoalesceNode;
import com.shapecraft.generator.model.ConditionalNode;
import com.shapecraft.generator.model.ExprNode;
import com.shapecraft.generator.model.ExprQueries;
import com.shapecraft.generator.model.LambdaNode;
import com.shapecraft.generator.model.LiteralKind;
import com.shapecraft.generator.model.LiteralNode;
import com.shapecraft.generator.model.MemberAccessNode;
import com.shapecraft.generator.model.MethodCallNode;
import com.shapecraft.generator.model.ParameterNode;
import com.shapecraft.generator.model.ShapeNode;
import com.shapecraft.generator.model.UnaryNode;
import com.shapecraft.generator.schema.MemberInfo;
import com.shapecraft.generator.schema.Nullability;
import com.shapecraft.generator.schema.TypeRef;
import com.shapecraft.generator.schema.TypeSchema;

/**
 * Decides whether a field may be absent. Signals are tried in a fixed order and
 * the first one that applies wins:
 * <ol>
 * <li>a member chain inherits its members' declared nullability</li>
 * <li>a materialized collection without top-level {@code ?.} is non-null</li>
 * <li>a top-level {@code ??} takes the nullability of its fallback</li>
 * <li>a top-level {@code ?.} makes the field nullable</li>
 * <li>an unannotated member chain of two or more hops is nullable and guarded</li>
 * <li>a nullable nested collection collapses to non-null with an empty fallback</li>
 * </ol>
 * The same class answers the per-value questions the forward generator asks when
 * placing null guards.
 */
public class NullabilityResolver {

    private final TypeSchema schema;

    public NullabilityResolver(TypeSchema schema) {
        this.schema = schema;
    }

    public NullabilityDecision resolve(ExprNode expression, TypeRef type, FieldShape shape, Scope scope,
                                       MemberInfo targetMember, Map<ExprNode, TypeRef> types,
                                       boolean arrayNullabilityRemoval) {
        NullabilityDecision decision = decide(expression, type, scope, targetMember, types);

        if (decision.isNullable()
                && shape == FieldShape.NESTED_COLLECTION
                && type.isCollection()
                && !ExprQueries.containsConditional(expression)
                && arrayNullabilityRemoval) {
            return new NullabilityDecision(false, NullabilityRule.COLLECTION_COLLAPSE, decision.isDefensiveGuards(),
                    true);
        }
        return decision;
    }

    private NullabilityDecision decide(ExprNode expression, TypeRef type, Scope scope, MemberInfo targetMember,
                                       Map<ExprNode, TypeRef> types) {
        boolean topLevelNullSafe = ExprQueries.hasTopLevelNullSafe(expression);
        boolean memberChain = isMemberChain(expression);

        if (memberChain) {
            Nullability declared = hopNullability(expression, types);
            if (declared == Nullability.NULLABLE || hasNullableIntermediate(expression, types)) {
                return NullabilityDecision.nullable(NullabilityRule.DECLARED_MEMBER);
            }
            if (declared == Nullability.NON_NULL) {
                return topLevelNullSafe
                        ? NullabilityDecision.nullable(NullabilityRule.NULL_SAFE_ACCESS)
                        : NullabilityDecision.nonNull(NullabilityRule.DECLARED_MEMBER);
            }
        }

        if (!topLevelNullSafe && endsWithMaterialization(expression, types)) {
            return NullabilityDecision.nonNull(NullabilityRule.MATERIALIZED_COLLECTION);
        }

        if (targetMember != null && !memberChain && targetMember.getNullability() != Nullability.UNKNOWN) {
            return new NullabilityDecision(targetMember.getNullability() == Nullability.NULLABLE,
                    NullabilityRule.TARGET_MEMBER, false, false);
        }

        // an explicit fallback absorbs the null-safe hops of its value
        if (expression instanceof CoalesceNode coalesce) {
            return new NullabilityDecision(valueNullability(coalesce.getFallback(), types) == Nullability.NULLABLE,
                    NullabilityRule.COALESCE_FALLBACK, false, false);
        }

        if (topLevelNullSafe) {
            return NullabilityDecision.nullable(NullabilityRule.NULL_SAFE_ACCESS);
        }

        Optional<List<String>> path = ExprQueries.memberPath(expression, scope.getStructureParameter());
        if (memberChain && path.isPresent() && path.get().size() >= 2) {
            return new NullabilityDecision(true, NullabilityRule.MULTI_HOP_FALLBACK, true, false);
        }

        if (type.isPrimitive()) {
            return NullabilityDecision.nonNull(NullabilityRule.EXPRESSION);
        }
        return new NullabilityDecision(valueNullability(expression, types) == Nullability.NULLABLE,
                NullabilityRule.EXPRESSION, false, false);
    }

    /**
     * Nullability of the value an expression evaluates to, once null-safe hops
     * and guarded nullable receivers have short-circuited.
     */
    public Nullability valueNullability(ExprNode node, Map<ExprNode, TypeRef> types) {
        if (node instanceof ParameterNode) {
            return Nullability.NON_NULL;
        }
        if (node instanceof LiteralNode literal) {
            return literal.getKind() == LiteralKind.NULL ? Nullability.NULLABLE : Nullability.NON_NULL;
        }
        if (ExprQueries.isPostfix(node)) {
            ExprNode receiver = ExprQueries.receiverOf(node);
            if (ExprQueries.isNullSafeHop(node) || valueNullability(receiver, types) == Nullability.NULLABLE) {
                return Nullability.NULLABLE;
            }
            return hopNullability(node, types);
        }
        if (node instanceof ConditionalNode conditional) {
            Nullability whenTrue = valueNullability(conditional.getWhenTrue(), types);
            Nullability whenFalse = valueNullability(conditional.getWhenFalse(), types);
            if (whenTrue == Nullability.NULLABLE || whenFalse == Nullability.NULLABLE) {
                return Nullability.NULLABLE;
            }
            return whenTrue == Nullability.NON_NULL && whenFalse == Nullability.NON_NULL
                    ? Nullability.NON_NULL
                    : Nullability.UNKNOWN;
        }
        if (node instanceof CoalesceNode coalesce) {
            return valueNullability(coalesce.getFallback(), types);
        }
        if (node instanceof BinaryNode || node instanceof UnaryNode || node instanceof ShapeNode
                || node instanceof LambdaNode) {
            return Nullability.NON_NULL;
        }
        return Nullability.UNKNOWN;
    }

    /**
     * Declared nullability of the result of a single member access or method
     * call, ignoring its receiver.
     */
    public Nullability hopNullability(ExprNode hop, Map<ExprNode, TypeRef> types) {
        TypeRef result = types.get(hop);
        if (result != null && result.isPrimitive()) {
            return Nullability.NON_NULL;
        }
        TypeRef receiver = types.get(ExprQueries.receiverOf(hop));
        if (receiver == null) {
            return Nullability.UNKNOWN;
        }
        if (hop instanceof MemberAccessNode member) {
            if (receiver.isNamed()) {
                return schema.member(receiver, member.getMember())
                        .map(MemberInfo::getNullability)
                        .orElse(Nullability.UNKNOWN);
            }
            if (receiver.isGroup()) {
                return Nullability.NON_NULL;
            }
            return Nullability.UNKNOWN;
        }
        MethodCallNode call = (MethodCallNode) hop;
        if (receiver.isCollection() || receiver.isGroup()) {
            Optional<SequenceOperation> operation = SequenceOperation.byName(call.getMethod());
            if (operation.isPresent()) {
                return switch (operation.get()) {
                    case FIRST, LAST, MIN, MAX -> Nullability.NULLABLE;
                    default -> Nullability.NON_NULL;
                };
            }
            return Nullability.NON_NULL;
        }
        if (receiver.isNamed() && schema.describe(receiver.getName()).isPresent()) {
            return schema.describe(receiver.getName())
                    .flatMap(type -> type.getMembers().stream()
                            .filter(m -> m.accessorName().equals(call.getMethod()))
                            .findFirst())
                    .map(MemberInfo::getNullability)
                    .orElse(Nullability.UNKNOWN);
        }
        return Nullability.NON_NULL;
    }

    private boolean hasNullableIntermediate(ExprNode expression, Map<ExprNode, TypeRef> types) {
        List<ExprNode> hops = ExprQueries.chainHops(expression);
        for (int i = 0; i < hops.size() - 1; i++) {
            if (hopNullability(hops.get(i), types) == Nullability.NULLABLE) {
                return true;
            }
        }
        return false;
    }

    /**
     * A plain member chain such as {@code o.customer?.name}, rooted at a parameter.
     */
    static boolean isMemberChain(ExprNode expression) {
        return ExprQueries.isMemberChainFromParameter(expression);
    }

    private boolean endsWithMaterialization(ExprNode expression, Map<ExprNode, TypeRef> types) {
        if (!(expression instanceof MethodCallNode call)) {
            return false;
        }
        TypeRef receiver = types.get(call.getTarget());
        return receiver != null
                && (receiver.isCollection() || receiver.isGroup())
                && SequenceOperation.byName(call.getMethod()).map(SequenceOperation::isMaterialization).orElse(false);
    }
}
