package com.shapecraft.generator.codegen.shape;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shapecraft.generator.codegen.exception.EmptyStructureException;
import com.shapecraft.generator.codegen.exception.UnresolvedTypeException;
import com.shapecraft.generator.codegen.exception.UnsupportedExpressionShapeException;
import com.shapecraft.generator.codegen.model.FieldShape;
import com.shapecraft.generator.codegen.model.SourcePath;
import com.shapecraft.generator.codegen.model.Structure;
import com.shapecraft.generator.model.CoalesceNode;
import com.shapecraft.generator.model.ConditionalNode;
import com.shapecraft.generator.model.ExprNode;
import com.shapecraft.generator.model.ExprQueries;
import com.shapecraft.generator.model.LambdaNode;
import com.shapecraft.generator.model.MethodCallNode;
import com.shapecraft.generator.model.ShapeEntry;
import com.shapecraft.generator.model.ShapeNode;
import com.shapecraft.generator.schema.TypeRef;

/**
 * Classifies a shape entry as a leaf, a nested object or a nested collection,
 * building the nested structure on the way.
 *
 * A shape literal used directly as a field value (possibly behind a
 * conditional or coalesce) is a nested object. A {@code map} whose lambda yields
 * a shape literal is a nested collection, or a nested object when the chain then
 * picks a single element with {@code first}/{@code last}. Shape literals in any
 * other position make the field unsupported.
 */
public class NestedProjectionResolver {
    private static final Logger log = LoggerFactory.getLogger(NestedProjectionResolver.class);

    private final AnalysisContext ctx;

    public NestedProjectionResolver(AnalysisContext ctx) {
        this.ctx = ctx;
    }

    /**
     * Shape literals an expression evaluates to: the expression itself, or the
     * branches of a conditional or coalesce.
     */
    public static List<ShapeNode> yieldedShapes(ExprNode expression) {
        if (expression instanceof ShapeNode shape) {
            return List.of(shape);
        }
        List<ShapeNode> shapes = new ArrayList<>();
        if (expression instanceof ConditionalNode conditional) {
            shapes.addAll(yieldedShapes(conditional.getWhenTrue()));
            shapes.addAll(yieldedShapes(conditional.getWhenFalse()));
        } else if (expression instanceof CoalesceNode coalesce) {
            shapes.addAll(yieldedShapes(coalesce.getValue()));
            shapes.addAll(yieldedShapes(coalesce.getFallback()));
        }
        return shapes;
    }

    /**
     * @throws UnsupportedExpressionShapeException when shape literals appear in a
     *         position no generated code can represent
     */
    public NestedResolution resolve(String name, ExprNode expression, Scope scope) {
        int mark = ctx.mark();

        List<ShapeNode> direct = yieldedShapes(expression);
        if (!direct.isEmpty()) {
            return resolveDirect(name, expression, direct, scope, mark);
        }

        ParsedField parsed = ctx.getFieldParser().parse(name, expression, scope);
        if (parsed.isUnresolved()) {
            ctx.rollback(mark);
            return NestedResolution.leaf(parsed);
        }

        rejectStrayShapes(name, expression);

        for (ExprNode candidate : chainCandidates(expression)) {
            Optional<NestedResolution> projected = projectedElements(parsed, candidate, scope);
            if (projected.isPresent()) {
                return projected.get();
            }
        }
        return NestedResolution.leaf(parsed);
    }

    private NestedResolution resolveDirect(String name, ExprNode expression, List<ShapeNode> shapes, Scope scope,
                                           int mark) {
        Structure nested = null;
        SourcePath reversePath = null;
        boolean first = true;
        for (ShapeNode shape : shapes) {
            SourcePath absolute = anchorOf(shape, scope);
            SourcePath relative = absolute == null || scope.getAnchor() == null
                    ? null
                    : absolute.relativeTo(scope.getAnchor()).orElse(null);
            Structure built;
            try {
                built = ctx.getStructureBuilder().build(shape, anchorType(scope, absolute),
                        scope.anchoredAt(absolute), name, relative);
            } catch (EmptyStructureException e) {
                throw new UnsupportedExpressionShapeException(
                        "Nested shape of field '" + name + "' has no resolvable fields");
            }
            if (first) {
                nested = built;
                reversePath = relative;
                first = false;
            } else if (!nested.getContentHash().equals(built.getContentHash())) {
                throw new UnsupportedExpressionShapeException(
                        "Branches of field '" + name + "' yield different shapes");
            } else if (reversePath != null && !reversePath.equals(relative)) {
                reversePath = null;
            }
        }

        ParsedField parsed = ctx.getFieldParser().parse(name, expression, scope);
        if (parsed.isUnresolved()) {
            ctx.rollback(mark);
            return NestedResolution.leaf(parsed);
        }
        if (shapes.size() > 1) {
            // a branch choice cannot be written back
            reversePath = null;
        }
        log.debug("Field '{}' is a nested object {} anchored at {}", name, nested.getContentHash(), reversePath);
        return new NestedResolution(parsed, FieldShape.NESTED_OBJECT, nested, reversePath);
    }

    /**
     * Common parent of every member chain the shape reads from the structure
     * parameter, or null when it reads none.
     */
    private SourcePath anchorOf(ShapeNode shape, Scope scope) {
        List<SourcePath> parents = new ArrayList<>();
        collectLeafParents(shape, scope.getStructureParameter(), parents);
        if (parents.isEmpty()) {
            return null;
        }
        return SourcePath.commonPrefix(parents);
    }

    private void collectLeafParents(ShapeNode shape, String parameter, List<SourcePath> parents) {
        for (ShapeEntry entry : shape.getEntries()) {
            if (entry.getValue() instanceof ShapeNode inner) {
                collectLeafParents(inner, parameter, parents);
                continue;
            }
            ExprQueries.memberPath(entry.getValue(), parameter)
                    .filter(members -> !members.isEmpty())
                    .ifPresent(members -> parents.add(SourcePath.of(members).parent()));
        }
    }

    /**
     * Source type of a nested object: the type at its anchor when that is a
     * schema type, otherwise the enclosing structure's source type.
     */
    private TypeRef anchorType(Scope scope, SourcePath absolute) {
        TypeRef type = scope.structureSourceType();
        if (absolute == null) {
            return type;
        }
        try {
            for (String member : absolute.getMembers()) {
                type = ctx.getTypeResolver().memberType(type, member);
            }
        } catch (UnresolvedTypeException e) {
            return scope.structureSourceType();
        }
        return type.isNamed() ? type : scope.structureSourceType();
    }

    private List<ExprNode> chainCandidates(ExprNode expression) {
        List<ExprNode> candidates = new ArrayList<>();
        candidates.add(expression);
        if (expression instanceof ConditionalNode conditional) {
            candidates.addAll(chainCandidates(conditional.getWhenTrue()));
            candidates.addAll(chainCandidates(conditional.getWhenFalse()));
        } else if (expression instanceof CoalesceNode coalesce) {
            candidates.addAll(chainCandidates(coalesce.getValue()));
        }
        return candidates;
    }

    /**
     * Looks for the first {@code map}/{@code flatMap} of a chain whose body
     * yields a nested structure.
     */
    private Optional<NestedResolution> projectedElements(ParsedField parsed, ExprNode chain, Scope scope) {
        List<ExprNode> hops = ExprQueries.chainHops(chain);
        for (int i = 0; i < hops.size(); i++) {
            if (!(hops.get(i) instanceof MethodCallNode call) || !isSequenceReceiver(call)) {
                continue;
            }
            Optional<SequenceOperation> operation = SequenceOperation.byName(call.getMethod());
            if (operation.isEmpty()
                    || (operation.get() != SequenceOperation.MAP && operation.get() != SequenceOperation.FLAT_MAP)) {
                continue;
            }
            LambdaNode lambda = call.lambdaArgument();
            Structure element = lambda == null ? null : registeredYield(lambda.getBody());
            if (element == null && operation.get() == SequenceOperation.FLAT_MAP && lambda != null) {
                element = innerProjection(lambda.getBody());
            }
            if (element == null) {
                // pure flattening or a scalar map; a later step may still project
                continue;
            }

            List<ExprNode> rest = hops.subList(i + 1, hops.size());
            if (picksSingleElement(rest)) {
                return Optional.of(new NestedResolution(parsed, FieldShape.NESTED_OBJECT, element, null));
            }
            if (!rest.stream().allMatch(this::preservesElements)) {
                return Optional.empty();
            }
            SourcePath reversePath = operation.get() == SequenceOperation.MAP
                    ? collectionPath(call.getTarget(), element, scope)
                    : null;
            return Optional.of(new NestedResolution(parsed, FieldShape.NESTED_COLLECTION, element, reversePath));
        }
        return Optional.empty();
    }

    private boolean isSequenceReceiver(MethodCallNode call) {
        TypeRef receiver = ctx.getTypes().get(call.getTarget());
        return receiver != null && (receiver.isCollection() || receiver.isGroup());
    }

    private Structure registeredYield(ExprNode body) {
        for (ShapeNode shape : yieldedShapes(body)) {
            Structure structure = ctx.getStructures().get(shape);
            if (structure != null) {
                return structure;
            }
        }
        return null;
    }

    private Structure innerProjection(ExprNode body) {
        for (ExprNode hop : ExprQueries.chainHops(body)) {
            if (hop instanceof MethodCallNode call && "map".equals(call.getMethod())
                    && call.lambdaArgument() != null) {
                Structure structure = registeredYield(call.lambdaArgument().getBody());
                if (structure != null) {
                    return structure;
                }
            }
        }
        return null;
    }

    private boolean picksSingleElement(List<ExprNode> hops) {
        for (ExprNode hop : hops) {
            if (hop instanceof MethodCallNode call) {
                Optional<SequenceOperation> operation = SequenceOperation.byName(call.getMethod());
                if (operation.isPresent()
                        && (operation.get() == SequenceOperation.FIRST || operation.get() == SequenceOperation.LAST)) {
                    return true;
                }
            }
        }
        return false;
    }

    private boolean preservesElements(ExprNode hop) {
        return hop instanceof MethodCallNode call
                && SequenceOperation.byName(call.getMethod()).map(SequenceOperation::preservesElements).orElse(false);
    }

    /**
     * Member chain of the collection a {@code map} reads from, once operations
     * that keep the elements are stripped.
     */
    private SourcePath collectionPath(ExprNode receiver, Structure element, Scope scope) {
        if (element.getSourceType().isGroup() || scope.getAnchor() == null) {
            return null;
        }
        ExprNode current = receiver;
        while (current instanceof MethodCallNode call
                && SequenceOperation.byName(call.getMethod()).map(SequenceOperation::preservesElements).orElse(false)) {
            current = call.getTarget();
        }
        return ExprQueries.memberPath(current, scope.getStructureParameter())
                .filter(members -> !members.isEmpty())
                .flatMap(members -> SourcePath.of(members).relativeTo(scope.getAnchor()))
                .filter(path -> !path.isEmpty())
                .orElse(null);
    }

    /**
     * Shape literals that are neither nested structures nor grouping keys have
     * no generated type to become.
     */
    private void rejectStrayShapes(String name, ExprNode expression) {
        Set<ShapeNode> groupKeys = Collections.newSetFromMap(new IdentityHashMap<>());
        ExprQueries.walk(expression, true, node -> {
            if (node instanceof MethodCallNode call && "groupBy".equals(call.getMethod())
                    && call.lambdaArgument() != null) {
                groupKeys.addAll(yieldedShapes(call.lambdaArgument().getBody()));
            }
        });
        List<ShapeNode> stray = new ArrayList<>();
        collectStray(expression, groupKeys, stray);
        if (!stray.isEmpty()) {
            throw new UnsupportedExpressionShapeException("Field '" + name + "' builds a shape at "
                    + stray.get(0).getPosition() + " that is not a nested object or collection element");
        }
    }

    private void collectStray(ExprNode node, Set<ShapeNode> groupKeys, List<ShapeNode> stray) {
        if (node instanceof ShapeNode shape) {
            if (ctx.getStructures().containsKey(shape) || groupKeys.contains(shape)) {
                return;
            }
            stray.add(shape);
        }
        for (ExprNode child : ExprQueries.children(node)) {
            collectStray(child, groupKeys, stray);
        }
    }
}
