package com.shapecraft.generator.codegen.shape;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.shapecraft.generator.codegen.exception.UnresolvedTypeException;
import com.shapecraft.generator.codegen.model.Structure;
import com.shapecraft.generator.codegen.model.StructureField;
import com.shapecraft.generator.model.BinaryNode;
import com.shapecraft.generator.model.BinaryOperator;
import com.shapecraft.generator.model.CaptureNode;
import com.shapecraft.generator.model.CoalesceNode;
import com.shapecraft.generator.model.ConditionalNode;
import com.shapecraft.generator.model.ExprNode;
import com.shapecraft.generator.model.ExprQueries;
import com.shapecraft.generator.model.IdentifierNode;
import com.shapecraft.generator.model.LambdaNode;
import com.shapecraft.generator.model.LiteralNode;
import com.shapecraft.generator.model.MemberAccessNode;
import com.shapecraft.generator.model.MethodCallNode;
import com.shapecraft.generator.model.ParameterNode;
import com.shapecraft.generator.model.ShapeEntry;
import com.shapecraft.generator.model.ShapeNode;
import com.shapecraft.generator.model.UnaryNode;
import com.shapecraft.generator.model.UnaryOperator;
import com.shapecraft.generator.schema.MemberInfo;
import com.shapecraft.generator.schema.TypeKind;
import com.shapecraft.generator.schema.TypeRef;

/**
 * Static typing of projection expressions against the schema.
 *
 * Every node typed is recorded in the context so the code generators can
 * render it later without repeating the analysis. Shape literals in the body of
 * {@code map} and {@code flatMap} become nested structures; shape literals
 * anywhere else are typed as untyped maps.
 */
public class TypeResolver {

    private static final TypeRef BOOLEAN = TypeRef.primitive("boolean");
    private static final TypeRef INT = TypeRef.primitive("int");
    private static final TypeRef LONG = TypeRef.primitive("long");
    private static final TypeRef DOUBLE = TypeRef.primitive("double");
    private static final TypeRef CHAR = TypeRef.primitive("char");
    private static final TypeRef STRING = TypeRef.named("java.lang.String");
    private static final TypeRef BIG_DECIMAL = TypeRef.named("java.math.BigDecimal");

    private static final Set<String> STRING_TO_STRING = Set.of("toUpperCase", "toLowerCase", "trim", "strip",
            "stripLeading", "stripTrailing", "substring", "replace", "concat", "repeat", "toString", "intern");
    private static final Set<String> STRING_TO_BOOLEAN = Set.of("isEmpty", "isBlank", "contains", "startsWith",
            "endsWith", "equals", "equalsIgnoreCase", "matches");
    private static final Set<String> STRING_TO_INT = Set.of("length", "indexOf", "lastIndexOf", "compareTo",
            "compareToIgnoreCase", "hashCode");
    private static final Set<String> BIG_DECIMAL_TO_BIG_DECIMAL = Set.of("add", "subtract", "multiply", "divide",
            "negate", "abs", "setScale", "max", "min", "remainder");

    private final AnalysisContext ctx;

    public TypeResolver(AnalysisContext ctx) {
        this.ctx = ctx;
    }

    /**
     * @throws UnresolvedTypeException when the expression cannot be typed
     */
    public TypeRef typeOf(ExprNode node, Scope scope) {
        TypeRef type = compute(node, scope);
        ctx.getTypes().put(node, type);
        return type;
    }

    /**
     * Type a projection body or generated DTO is seen as from other expressions.
     */
    public static TypeRef structureType(Structure structure) {
        if (structure.isNamedTarget()) {
            return TypeRef.named(structure.getTargetType());
        }
        Map<String, TypeRef> fields = new LinkedHashMap<>();
        for (StructureField field : structure.getFields()) {
            fields.put(field.getName(), field.getResolvedType());
        }
        return TypeRef.anonymousDto(structure.getContentHash(), fields);
    }

    private TypeRef compute(ExprNode node, Scope scope) {
        if (node instanceof ParameterNode parameter) {
            TypeRef type = scope.getParameters().get(parameter.getName());
            if (type == null) {
                throw new UnresolvedTypeException("Parameter '" + parameter.getName() + "' is not in scope");
            }
            return type;
        }
        if (node instanceof CaptureNode capture) {
            TypeRef type = scope.getCaptures().get(capture.getName());
            if (type == null) {
                throw new UnresolvedTypeException("Capture '" + capture.getName() + "' is not declared");
            }
            return type;
        }
        if (node instanceof IdentifierNode identifier) {
            throw new UnresolvedTypeException("Unknown identifier '" + identifier.getName() + "'");
        }
        if (node instanceof LiteralNode literal) {
            return literalType(literal);
        }
        if (node instanceof MemberAccessNode member) {
            return memberType(typeOf(member.getTarget(), scope), member.getMember());
        }
        if (node instanceof MethodCallNode call) {
            return methodType(call, scope);
        }
        if (node instanceof ShapeNode shape) {
            return shapeType(shape, scope);
        }
        if (node instanceof ConditionalNode conditional) {
            typeOf(conditional.getCondition(), scope);
            return unify(typeOf(conditional.getWhenTrue(), scope), typeOf(conditional.getWhenFalse(), scope));
        }
        if (node instanceof CoalesceNode coalesce) {
            TypeRef value = typeOf(coalesce.getValue(), scope);
            TypeRef fallback = typeOf(coalesce.getFallback(), scope);
            return unify(value, fallback);
        }
        if (node instanceof BinaryNode binary) {
            return binaryType(binary, scope);
        }
        if (node instanceof UnaryNode unary) {
            TypeRef operand = typeOf(unary.getOperand(), scope);
            if (unary.getOperator() == UnaryOperator.NOT) {
                return BOOLEAN;
            }
            if (!operand.isNumeric()) {
                throw new UnresolvedTypeException("Cannot negate a value of type " + operand);
            }
            return promote(operand.unboxed(), INT);
        }
        if (node instanceof LambdaNode) {
            throw new UnresolvedTypeException("A lambda is only allowed as the argument of a sequence operation");
        }
        throw new UnresolvedTypeException("Unsupported expression " + node.toSource());
    }

    public TypeRef memberType(TypeRef owner, String member) {
        if (owner.isNamed()) {
            if (ctx.getSchema().describe(owner.getName()).isEmpty()) {
                throw new UnresolvedTypeException("Type " + owner.getName() + " is not described by the schema");
            }
            return ctx.getSchema().member(owner, member)
                    .map(MemberInfo::getType)
                    .orElseThrow(() -> new UnresolvedTypeException(
                            "Type " + owner.getName() + " has no member '" + member + "'"));
        }
        if (owner.isGroup() && "key".equals(member)) {
            return owner.getKeyType();
        }
        if (owner.isAnonymous() && owner.getFields().containsKey(member)) {
            return owner.getFields().get(member);
        }
        if (owner.isArray() && "length".equals(member)) {
            return INT;
        }
        throw new UnresolvedTypeException("Cannot read member '" + member + "' of " + owner);
    }

    private TypeRef methodType(MethodCallNode call, Scope scope) {
        TypeRef receiver = typeOf(call.getTarget(), scope);
        if (receiver.isCollection() || receiver.isGroup()) {
            Optional<SequenceOperation> operation = SequenceOperation.byName(call.getMethod());
            if (operation.isPresent()) {
                return sequenceType(call, operation.get(), receiver, scope);
            }
            if (receiver.isCollection() && !receiver.isStream() && !receiver.isArray()) {
                return collectionMethodType(call, receiver, scope);
            }
            throw new UnresolvedTypeException("Unknown sequence operation '" + call.getMethod() + "' on " + receiver);
        }
        return valueMethodType(call, receiver, scope);
    }

    private TypeRef sequenceType(MethodCallNode call, SequenceOperation operation, TypeRef receiver, Scope scope) {
        TypeRef element = receiver.getElementType();
        LambdaNode lambda = call.lambdaArgument();
        switch (operation) {
            case MAP -> {
                TypeRef body = projectionBodyType(requireLambda(call, lambda), element, scope);
                // an inner pipeline is materialized per element
                return TypeRef.sequence(body.isStream() ? TypeRef.list(body.getElementType()) : body);
            }
            case FLAT_MAP -> {
                TypeRef inner = projectionBodyType(requireLambda(call, lambda), element, scope);
                if (!inner.isCollection()) {
                    throw new UnresolvedTypeException("'flatMap' expects a collection but the body yields " + inner);
                }
                return TypeRef.sequence(inner.getElementType());
            }
            case FILTER, SORTED_BY -> {
                typeLambda(requireLambda(call, lambda), element, scope);
                return TypeRef.sequence(element);
            }
            case DISTINCT, SORTED -> {
                requireArguments(call, 0);
                return TypeRef.sequence(element);
            }
            case LIMIT, SKIP -> {
                requireArguments(call, 1);
                TypeRef count = typeOf(call.getArguments().get(0), scope);
                if (!count.isNumeric()) {
                    throw new UnresolvedTypeException("'" + call.getMethod() + "' expects a number");
                }
                return TypeRef.sequence(element);
            }
            case GROUP_BY -> {
                TypeRef key = typeLambda(requireLambda(call, lambda), element, scope);
                return TypeRef.sequence(TypeRef.group(key, element));
            }
            case TO_LIST -> {
                requireArguments(call, 0);
                return TypeRef.list(element);
            }
            case TO_SET -> {
                requireArguments(call, 0);
                return TypeRef.set(element);
            }
            case TO_ARRAY -> {
                requireArguments(call, 0);
                return TypeRef.array(element);
            }
            case COUNT -> {
                optionalLambda(call, lambda, element, scope);
                return LONG;
            }
            case SUM -> {
                TypeRef value = optionalLambda(call, lambda, element, scope);
                return sumType(value);
            }
            case AVERAGE -> {
                TypeRef value = optionalLambda(call, lambda, element, scope);
                if (!value.isNumeric()) {
                    throw new UnresolvedTypeException("Cannot average values of type " + value);
                }
                return DOUBLE;
            }
            case MIN, MAX -> {
                return optionalLambda(call, lambda, element, scope).boxed();
            }
            case FIRST, LAST -> {
                optionalLambda(call, lambda, element, scope);
                return element.boxed();
            }
            case ANY, ALL -> {
                optionalLambda(call, lambda, element, scope);
                return BOOLEAN;
            }
            default -> throw new UnresolvedTypeException("Unsupported sequence operation " + operation);
        }
    }

    /**
     * Types the body of a {@code map}/{@code flatMap} lambda, building a nested
     * structure for each shape literal it yields.
     */
    private TypeRef projectionBodyType(LambdaNode lambda, TypeRef element, Scope scope) {
        Scope elementScope = scope.forElement(lambda.getParameter(), element);
        for (ShapeNode shape : NestedProjectionResolver.yieldedShapes(lambda.getBody())) {
            if (!ctx.isStructuresSuppressed() && !ctx.getStructures().containsKey(shape)) {
                ctx.getStructureBuilder().buildElement(shape, element, elementScope, ctx.currentHint());
            }
        }
        TypeRef body = typeOf(lambda.getBody(), scope.withParameter(lambda.getParameter(), element));
        ctx.getTypes().put(lambda, body);
        return body;
    }

    private TypeRef typeLambda(LambdaNode lambda, TypeRef parameterType, Scope scope) {
        TypeRef body = typeOf(lambda.getBody(), scope.withParameter(lambda.getParameter(), parameterType));
        ctx.getTypes().put(lambda, body);
        return body;
    }

    private TypeRef optionalLambda(MethodCallNode call, LambdaNode lambda, TypeRef element, Scope scope) {
        if (lambda != null) {
            return typeLambda(lambda, element, scope);
        }
        requireArguments(call, 0);
        return element;
    }

    private LambdaNode requireLambda(MethodCallNode call, LambdaNode lambda) {
        if (lambda == null) {
            throw new UnresolvedTypeException("'" + call.getMethod() + "' expects a single lambda argument");
        }
        return lambda;
    }

    private void requireArguments(MethodCallNode call, int count) {
        if (call.getArguments().size() != count) {
            throw new UnresolvedTypeException("'" + call.getMethod() + "' expects " + count + " argument(s)");
        }
    }

    private TypeRef sumType(TypeRef value) {
        if (BIG_DECIMAL.equals(value)) {
            return BIG_DECIMAL;
        }
        if (!value.isNumeric()) {
            throw new UnresolvedTypeException("Cannot sum values of type " + value);
        }
        String primitive = value.unboxed().getName();
        return switch (primitive) {
            case "long" -> LONG;
            case "float", "double" -> DOUBLE;
            default -> INT;
        };
    }

    private TypeRef collectionMethodType(MethodCallNode call, TypeRef receiver, Scope scope) {
        typeArguments(call, scope);
        return switch (call.getMethod()) {
            case "size" -> INT;
            case "isEmpty", "contains" -> BOOLEAN;
            default -> throw new UnresolvedTypeException(
                    "Unknown method '" + call.getMethod() + "' on " + receiver);
        };
    }

    private TypeRef valueMethodType(MethodCallNode call, TypeRef receiver, Scope scope) {
        typeArguments(call, scope);
        String method = call.getMethod();

        if (receiver.isString()) {
            if (STRING_TO_STRING.contains(method)) {
                return STRING;
            }
            if (STRING_TO_BOOLEAN.contains(method)) {
                return BOOLEAN;
            }
            if (STRING_TO_INT.contains(method)) {
                return INT;
            }
            if ("charAt".equals(method)) {
                return CHAR;
            }
        }
        if (BIG_DECIMAL.equals(receiver) && BIG_DECIMAL_TO_BIG_DECIMAL.contains(method)) {
            return BIG_DECIMAL;
        }
        if (receiver.isNumeric() && !receiver.isPrimitive()) {
            switch (method) {
                case "intValue" -> {
                    return INT;
                }
                case "longValue" -> {
                    return LONG;
                }
                case "doubleValue" -> {
                    return DOUBLE;
                }
                case "compareTo" -> {
                    return INT;
                }
                default -> {
                    // fall through to the methods every object has
                }
            }
        }
        switch (method) {
            case "toString" -> {
                return STRING;
            }
            case "equals" -> {
                return BOOLEAN;
            }
            case "hashCode" -> {
                return INT;
            }
            default -> {
                // try the schema below
            }
        }
        if (receiver.isNamed() && call.getArguments().isEmpty()) {
            Optional<MemberInfo> getter = ctx.getSchema().describe(receiver.getName())
                    .flatMap(type -> type.getMembers().stream()
                            .filter(m -> m.accessorName().equals(method))
                            .findFirst());
            if (getter.isPresent()) {
                return getter.get().getType();
            }
        }
        throw new UnresolvedTypeException("Unknown method '" + method + "' on " + receiver);
    }

    private void typeArguments(MethodCallNode call, Scope scope) {
        for (ExprNode argument : call.getArguments()) {
            typeOf(argument, scope);
        }
    }

    private TypeRef shapeType(ShapeNode shape, Scope scope) {
        Structure structure = ctx.getStructures().get(shape);
        if (structure != null) {
            return structureType(structure);
        }
        Map<String, TypeRef> fields = new LinkedHashMap<>();
        List<ShapeEntry> entries = shape.getEntries();
        for (int i = 0; i < entries.size(); i++) {
            ShapeEntry entry = entries.get(i);
            String name = entry.isExplicitlyNamed()
                    ? entry.getName()
                    : ExprQueries.implicitName(entry.getValue()).orElse("field" + i);
            fields.put(name, typeOf(entry.getValue(), scope).boxed());
        }
        return TypeRef.anonymous(fields);
    }

    private TypeRef binaryType(BinaryNode binary, Scope scope) {
        TypeRef left = typeOf(binary.getLeft(), scope);
        TypeRef right = typeOf(binary.getRight(), scope);
        BinaryOperator operator = binary.getOperator();

        if (operator.isRelational() && !(left.isNumeric() && right.isNumeric()
                && left.unboxed().isPrimitive() && right.unboxed().isPrimitive())) {
            throw new UnresolvedTypeException(
                    "Operator " + operator.getSymbol() + " needs primitive numbers, found " + left + " and " + right);
        }
        if (operator.isLogical() || operator.isEquality() || operator.isRelational()) {
            return BOOLEAN;
        }
        if (operator == BinaryOperator.ADD && (left.isString() || right.isString())) {
            return STRING;
        }
        if (!left.isNumeric() || !right.isNumeric()) {
            throw new UnresolvedTypeException(
                    "Operator " + operator.getSymbol() + " is not defined for " + left + " and " + right);
        }
        if (!left.unboxed().isPrimitive() || !right.unboxed().isPrimitive()) {
            throw new UnresolvedTypeException(
                    "Operator " + operator.getSymbol() + " needs primitive numbers, found " + left + " and " + right);
        }
        return promote(left.unboxed(), right.unboxed());
    }

    private TypeRef literalType(LiteralNode literal) {
        return switch (literal.getKind()) {
            case INT -> INT;
            case LONG -> LONG;
            case DOUBLE -> DOUBLE;
            case STRING -> STRING;
            case CHAR -> CHAR;
            case BOOLEAN -> BOOLEAN;
            case NULL -> TypeRef.NULL;
        };
    }

    /**
     * Common type of two branches of a conditional or coalesce.
     */
    TypeRef unify(TypeRef a, TypeRef b) {
        if (a.equals(b)) {
            return a;
        }
        if (a.getKind() == TypeKind.NULL) {
            return b.boxed();
        }
        if (b.getKind() == TypeKind.NULL) {
            return a.boxed();
        }
        if (a.boxed().equals(b.boxed())) {
            return a.boxed();
        }
        if (a.isNumeric() && b.isNumeric() && a.unboxed().isPrimitive() && b.unboxed().isPrimitive()) {
            return promote(a.unboxed(), b.unboxed());
        }
        throw new UnresolvedTypeException("Incompatible branch types " + a + " and " + b);
    }

    private static TypeRef promote(TypeRef a, TypeRef b) {
        int rank = Math.max(rank(a.getName()), rank(b.getName()));
        return switch (rank) {
            case 4 -> DOUBLE;
            case 3 -> TypeRef.primitive("float");
            case 2 -> LONG;
            default -> INT;
        };
    }

    private static int rank(String primitive) {
        return switch (primitive) {
            case "double" -> 4;
            case "float" -> 3;
            case "long" -> 2;
            default -> 1;
        };
    }
}
