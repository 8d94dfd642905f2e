package com.shapecraft.generator.codegen.forward;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.shapecraft.generator.codegen.dto.DtoNaming;
import com.shapecraft.generator.codegen.generator.EmissionContext;
import com.shapecraft.generator.codegen.generator.TypeRenderer;
import com.shapecraft.generator.codegen.model.FieldShape;
import com.shapecraft.generator.codegen.model.Structure;
import com.shapecraft.generator.codegen.model.StructureField;
import com.shapecraft.generator.codegen.shape.AnalyzedCallSite;
import com.shapecraft.generator.codegen.shape.NullabilityResolver;
import com.shapecraft.generator.codegen.shape.SequenceOperation;
import com.shapecraft.generator.codegen.util.NamingUtil;
import com.shapecraft.generator.model.BinaryNode;
import com.shapecraft.generator.model.CaptureNode;
import com.shapecraft.generator.model.CoalesceNode;
import com.shapecraft.generator.model.ConditionalNode;
import com.shapecraft.generator.model.ExprNode;
import com.shapecraft.generator.model.ExprQueries;
import com.shapecraft.generator.model.IdentifierNode;
import com.shapecraft.generator.model.LambdaNode;
import com.shapecraft.generator.model.LiteralKind;
import com.shapecraft.generator.model.LiteralNode;
import com.shapecraft.generator.model.MemberAccessNode;
import com.shapecraft.generator.model.MethodCallNode;
import com.shapecraft.generator.model.ParameterNode;
import com.shapecraft.generator.model.ShapeEntry;
import com.shapecraft.generator.model.ShapeNode;
import com.shapecraft.generator.model.UnaryNode;
import com.shapecraft.generator.model.UnaryOperator;
import com.shapecraft.generator.schema.AnonymousOrigin;
import com.shapecraft.generator.schema.CollectionKind;
import com.shapecraft.generator.schema.MemberInfo;
import com.shapecraft.generator.schema.Nullability;
import com.shapecraft.generator.schema.TypeRef;

/**
 * Rewrites projection expressions as Java expressions.
 *
 * Access chains are null-guarded: a hop is guarded when it is written
 * null-safe, when its receiver is declared nullable, or, for fields in
 * defensive mode, when its receiver's nullability is unknown. Guards collect
 * into a single conditional {@code (g1 != null && g2 != null ? access : default)}.
 * Inside a stream pipeline nothing is guarded; guarding resumes once the
 * pipeline yields a value again.
 */
public class JavaExpressionWriter {

    private final EmissionContext ctx;
    private final AnalyzedCallSite site;
    private final TypeRenderer types;
    private final NullabilityResolver nullability;
    private final Map<ExprNode, TypeRef> typeOf;

    private final Map<String, String> renames = new HashMap<>();
    private final Set<String> inScope = new HashSet<>();

    private boolean defensive;
    private boolean opaque;

    public JavaExpressionWriter(EmissionContext ctx, AnalyzedCallSite site) {
        this.ctx = ctx;
        this.site = site;
        this.types = ctx.getTypes();
        this.nullability = new NullabilityResolver(ctx.getSchema());
        this.typeOf = site.getTypes();
        site.getCaptureTypes().keySet().forEach(name -> inScope.add(NamingUtil.safeIdentifier(name)));
    }

    /**
     * Declares a parameter of the projection, returning the Java name it is
     * written as.
     */
    public String bind(String parameter) {
        String javaName = freshName(parameter);
        renames.put(parameter, javaName);
        inScope.add(javaName);
        return javaName;
    }

    /**
     * Construction of the structure built for {@code shape}.
     */
    public String construct(ShapeNode shape) {
        return writeShape(shape);
    }

    /**
     * Value of a structure field, falling back to the field's default when a
     * guard fails.
     */
    public String fieldValue(StructureField field) {
        boolean savedDefensive = defensive;
        boolean savedOpaque = opaque;
        defensive = field.isDefensiveGuards();
        opaque = opaque || field.getShape() == FieldShape.OPAQUE;
        try {
            String fallback = field.isNullable() ? "null" : DefaultValues.forField(field.getResolvedType(), types);
            ExprNode expression = field.getExpression();
            if (ExprQueries.isPostfix(expression)) {
                return writeChain(expression, fallback, false).close();
            }
            return write(expression);
        } finally {
            defensive = savedDefensive;
            opaque = savedOpaque;
        }
    }

    public String write(ExprNode node) {
        if (node instanceof ParameterNode parameter) {
            return renames.getOrDefault(parameter.getName(), NamingUtil.safeIdentifier(parameter.getName()));
        }
        if (node instanceof CaptureNode capture) {
            return NamingUtil.safeIdentifier(capture.getName());
        }
        if (node instanceof IdentifierNode identifier) {
            return identifier.getName();
        }
        if (node instanceof LiteralNode literal) {
            return literal.getText();
        }
        if (ExprQueries.isPostfix(node)) {
            return writeChain(node, DefaultValues.forValue(typeOf.get(node)), false).close();
        }
        if (node instanceof ShapeNode shape) {
            return writeShape(shape);
        }
        if (node instanceof ConditionalNode conditional) {
            return "(" + write(conditional.getCondition()) + " ? " + write(conditional.getWhenTrue()) + " : "
                    + write(conditional.getWhenFalse()) + ")";
        }
        if (node instanceof CoalesceNode coalesce) {
            return writeCoalesce(coalesce);
        }
        if (node instanceof BinaryNode binary) {
            return writeBinary(binary);
        }
        if (node instanceof UnaryNode unary) {
            String operand = write(unary.getOperand());
            return (unary.getOperator() == UnaryOperator.NOT ? "!" : "-") + wrap(unary.getOperand(), operand);
        }
        if (node instanceof LambdaNode lambda) {
            return writeLambda(lambda);
        }
        throw new IllegalArgumentException("Cannot write " + node.toSource());
    }

    // ---- access chains -----------------------------------------------------

    /**
     * Java text of a chain plus the guards it needs. {@link #close()} applies
     * the guards; {@link #stream} tells whether the access is still an open
     * stream pipeline.
     */
    private final class Chain {
        String access;
        boolean stream;
        TypeRef type;
        final Set<String> guards = new LinkedHashSet<>();
        String fallback;

        String close() {
            String value = stream ? access + ".collect(" + collectors() + ".toList())" : access;
            return guarded(value, fallback);
        }

        String guarded(String value, String otherwise) {
            if (guards.isEmpty()) {
                return value;
            }
            return "(" + String.join(" && ", guards) + " ? " + value + " : " + otherwise + ")";
        }
    }

    private Chain writeChain(ExprNode node, String fallback, boolean leafTest) {
        Chain chain = new Chain();
        chain.fallback = fallback;
        ExprNode base = ExprQueries.chainBase(node);
        chain.access = wrap(base, write(base));
        chain.type = typeOf.get(base);

        for (ExprNode hop : ExprQueries.chainHops(node)) {
            ExprNode receiver = ExprQueries.receiverOf(hop);
            TypeRef receiverType = typeOf.get(receiver);
            if (!chain.stream && needsGuard(hop, receiver, receiverType)) {
                chain.guards.add(chain.access + " != null");
            }
            if (hop instanceof MemberAccessNode member) {
                chain.access = readMember(chain.access, receiverType, member.getMember());
                chain.stream = false;
            } else {
                MethodCallNode call = (MethodCallNode) hop;
                Optional<SequenceOperation> operation = SequenceOperation.byName(call.getMethod());
                if (receiverType != null && (receiverType.isCollection() || receiverType.isGroup())
                        && operation.isPresent()) {
                    sequenceStep(chain, receiverType, operation.get(), call);
                } else {
                    chain.access = callMethod(chain.access, receiverType, call);
                    chain.stream = false;
                }
            }
            chain.type = typeOf.get(hop);
        }

        if (leafTest && !chain.stream && (chain.type == null || !chain.type.isPrimitive())) {
            chain.guards.add(chain.access + " != null");
        }
        return chain;
    }

    private boolean needsGuard(ExprNode hop, ExprNode receiver, TypeRef receiverType) {
        if (ExprQueries.isNullSafeHop(hop)) {
            return true;
        }
        if (receiverType != null && receiverType.isPrimitive()) {
            return false;
        }
        if (!ExprQueries.isPostfix(receiver)) {
            return false;
        }
        Nullability declared = nullability.hopNullability(receiver, typeOf);
        return declared == Nullability.NULLABLE || (defensive && declared == Nullability.UNKNOWN);
    }

    private String readMember(String target, TypeRef owner, String member) {
        if (owner == null || !owner.isResolved()) {
            return target + ".get" + capitalize(member) + "()";
        }
        if (owner.isNamed()) {
            return ctx.getSchema().member(owner, member)
                    .map(info -> info.readExpression(target))
                    .orElse(target + ".get" + capitalize(member) + "()");
        }
        if (owner.isGroup()) {
            return target + ".getKey()";
        }
        if (owner.isArray()) {
            return target + ".length";
        }
        if (owner.isAnonymous() && owner.getOrigin() == AnonymousOrigin.DTO) {
            TypeRef fieldType = owner.getFields().getOrDefault(member, TypeRef.UNRESOLVED);
            return DtoNaming.readExpression(target, member, fieldType, ctx.getConfig().getDtoStyle());
        }
        if (owner.isAnonymous()) {
            return keyAccessor(owner, member) + "(" + target + ")";
        }
        return target + ".get" + capitalize(member) + "()";
    }

    private String callMethod(String target, TypeRef receiverType, MethodCallNode call) {
        String arguments = call.getArguments().stream().map(this::write).collect(Collectors.joining(", "));
        if (receiverType != null && receiverType.isPrimitive()) {
            if ("toString".equals(call.getMethod())) {
                return "String.valueOf(" + target + ")";
            }
            return "((Object) " + target + ")." + call.getMethod() + "(" + arguments + ")";
        }
        return target + "." + call.getMethod() + "(" + arguments + ")";
    }

    // ---- sequence operations -------------------------------------------------

    private void sequenceStep(Chain chain, TypeRef receiverType, SequenceOperation operation, MethodCallNode call) {
        TypeRef element = receiverType.getElementType();
        LambdaNode lambda = call.lambdaArgument();
        String target = chain.access;
        String stream = chain.stream ? target : openStream(target, receiverType);

        String result;
        boolean open;
        switch (operation) {
            case MAP -> {
                result = stream + ".map(" + writeLambda(lambda) + ")";
                open = true;
            }
            case FLAT_MAP -> {
                result = stream + ".flatMap(" + writeFlatLambda(lambda) + ")";
                open = true;
            }
            case FILTER -> {
                result = stream + ".filter(" + writeLambda(lambda) + ")";
                open = true;
            }
            case DISTINCT -> {
                result = stream + ".distinct()";
                open = true;
            }
            case SORTED -> {
                result = stream + ".sorted()";
                open = true;
            }
            case SORTED_BY -> {
                result = stream + ".sorted(" + comparator() + ".comparing(" + writeLambda(lambda) + "))";
                open = true;
            }
            case LIMIT, SKIP -> {
                result = stream + "." + (operation == SequenceOperation.LIMIT ? "limit" : "skip") + "("
                        + write(call.getArguments().get(0)) + ")";
                open = true;
            }
            case GROUP_BY -> {
                result = stream + ".collect(" + collectors() + ".groupingBy(" + writeLambda(lambda) + ", "
                        + ctx.reference("java.util.LinkedHashMap") + "::new, " + collectors()
                        + ".toList())).entrySet().stream()";
                open = true;
            }
            case TO_LIST -> {
                result = stream + ".collect(" + collectors() + ".toList())";
                open = false;
            }
            case TO_SET -> {
                result = stream + ".collect(" + collectors() + ".toCollection("
                        + ctx.reference("java.util.LinkedHashSet") + "::new))";
                open = false;
            }
            case TO_ARRAY -> {
                result = toArray(stream, element);
                open = false;
            }
            case COUNT -> {
                result = count(chain, receiverType, stream, lambda);
                open = false;
            }
            case SUM -> {
                result = sum(stream, element, lambda);
                open = false;
            }
            case AVERAGE -> {
                result = stream + ".mapToDouble(" + valueFunction(lambda) + ").average().orElse(0.0)";
                open = false;
            }
            case MIN, MAX -> {
                String values = lambda != null ? stream + ".map(" + writeLambda(lambda) + ")" : stream;
                result = values + "." + (operation == SequenceOperation.MIN ? "min" : "max") + "("
                        + comparator() + ".naturalOrder()).orElse(null)";
                open = false;
            }
            case FIRST -> {
                result = filtered(stream, lambda) + ".findFirst().orElse(null)";
                open = false;
            }
            case LAST -> {
                result = filtered(stream, lambda) + ".reduce((first_, last_) -> last_).orElse(null)";
                open = false;
            }
            case ANY -> {
                result = lambda != null
                        ? stream + ".anyMatch(" + writeLambda(lambda) + ")"
                        : stream + ".findAny().isPresent()";
                open = false;
            }
            case ALL -> {
                result = lambda != null
                        ? stream + ".allMatch(" + writeLambda(lambda) + ")"
                        : stream + ".allMatch(" + ctx.reference("java.util.Objects") + "::nonNull)";
                open = false;
            }
            default -> throw new IllegalStateException("Unhandled sequence operation " + operation);
        }
        chain.access = result;
        chain.stream = open;
    }

    private String openStream(String target, TypeRef type) {
        if (type.isGroup()) {
            return target + ".getValue().stream()";
        }
        if (type.getCollectionKind() == CollectionKind.ARRAY) {
            TypeRef element = type.getElementType();
            if (element.isPrimitive()) {
                return switch (element.getName()) {
                    case "int", "long", "double" -> ctx.reference("java.util.Arrays") + ".stream(" + target
                            + ").boxed()";
                    default -> ctx.reference("java.util.stream.IntStream") + ".range(0, " + target
                            + ".length).mapToObj(i_ -> " + target + "[i_])";
                };
            }
            return ctx.reference("java.util.Arrays") + ".stream(" + target + ")";
        }
        if ("java.util.stream.Stream".equals(type.getName())) {
            return target;
        }
        if ("java.lang.Iterable".equals(type.getName())) {
            return ctx.reference("java.util.stream.StreamSupport") + ".stream(" + target + ".spliterator(), false)";
        }
        return target + ".stream()";
    }

    private String count(Chain chain, TypeRef receiverType, String stream, LambdaNode lambda) {
        if (lambda != null) {
            return stream + ".filter(" + writeLambda(lambda) + ").count()";
        }
        if (!chain.stream) {
            if (receiverType.isGroup()) {
                return "((long) " + chain.access + ".getValue().size())";
            }
            if (receiverType.getCollectionKind() == CollectionKind.ARRAY) {
                return "((long) " + chain.access + ".length)";
            }
            if (receiverType.getCollectionKind() != CollectionKind.SEQUENCE) {
                return "((long) " + chain.access + ".size())";
            }
        }
        return stream + ".count()";
    }

    private String sum(String stream, TypeRef element, LambdaNode lambda) {
        TypeRef value = lambda != null ? typeOf.getOrDefault(lambda, element) : element;
        if ("java.math.BigDecimal".equals(value.getName())) {
            String decimal = ctx.reference("java.math.BigDecimal");
            String values = lambda != null ? stream + ".map(" + writeLambda(lambda) + ")" : stream;
            return values + ".reduce(" + decimal + ".ZERO, " + decimal + "::add)";
        }
        String mapping = switch (value.unboxed().getName()) {
            case "long" -> "mapToLong";
            case "float", "double" -> "mapToDouble";
            default -> "mapToInt";
        };
        return stream + "." + mapping + "(" + valueFunction(lambda) + ").sum()";
    }

    private String toArray(String stream, TypeRef element) {
        if (element.isPrimitive()) {
            switch (element.getName()) {
                case "int" -> {
                    return stream + ".mapToInt(v_ -> v_).toArray()";
                }
                case "long" -> {
                    return stream + ".mapToLong(v_ -> v_).toArray()";
                }
                case "double" -> {
                    return stream + ".mapToDouble(v_ -> v_).toArray()";
                }
                default -> {
                    return stream + ".toArray(" + types.renderBoxed(element) + "[]::new)";
                }
            }
        }
        return stream + ".toArray(" + types.renderErased(element) + "[]::new)";
    }

    private String filtered(String stream, LambdaNode lambda) {
        return lambda != null ? stream + ".filter(" + writeLambda(lambda) + ")" : stream;
    }

    private String valueFunction(LambdaNode lambda) {
        return lambda != null ? writeLambda(lambda) : "v_ -> v_";
    }

    // ---- lambdas -------------------------------------------------------------

    private String writeLambda(LambdaNode lambda) {
        return withParameter(lambda.getParameter(), javaName -> javaName + " -> " + write(lambda.getBody()));
    }

    /**
     * {@code flatMap} body: opened as a stream, an absent collection contributes nothing.
     */
    private String writeFlatLambda(LambdaNode lambda) {
        return withParameter(lambda.getParameter(), javaName -> {
            ExprNode body = lambda.getBody();
            String empty = ctx.reference("java.util.stream.Stream") + ".empty()";
            if (ExprQueries.isPostfix(body)) {
                Chain chain = writeChain(body, empty, false);
                String stream = chain.stream ? chain.access : openStream(chain.access, typeOf.get(body));
                return javaName + " -> " + chain.guarded(stream, empty);
            }
            return javaName + " -> " + openStream("(" + write(body) + ")", typeOf.get(body));
        });
    }

    private String withParameter(String parameter, Function<String, String> body) {
        String previous = renames.get(parameter);
        String javaName = freshName(parameter);
        renames.put(parameter, javaName);
        inScope.add(javaName);
        try {
            return body.apply(javaName);
        } finally {
            inScope.remove(javaName);
            if (previous == null) {
                renames.remove(parameter);
            } else {
                renames.put(parameter, previous);
            }
        }
    }

    private String freshName(String parameter) {
        String base = NamingUtil.safeIdentifier(parameter);
        String candidate = base;
        int suffix = 2;
        while (inScope.contains(candidate)) {
            candidate = base + suffix++;
        }
        return candidate;
    }

    // ---- shapes ----------------------------------------------------------------

    private String writeShape(ShapeNode shape) {
        Structure structure = opaque ? null : site.getShapeStructures().get(shape);
        if (structure == null) {
            return untypedShape(shape);
        }
        List<String> arguments = new ArrayList<>();
        for (StructureField field : structure.getFields()) {
            arguments.add(fieldValue(field));
        }
        if (structure.isNamedTarget()) {
            return namedFactory(structure) + "(" + String.join(", ", arguments) + ")";
        }
        String type = types.reference(ctx.getRegistry().typeFor(structure.getContentHash()).qualifiedName());
        return "new " + type + "(" + String.join(", ", arguments) + ")";
    }

    private String untypedShape(ShapeNode shape) {
        requireShapeHelper();
        List<String> arguments = new ArrayList<>();
        List<ShapeEntry> entries = shape.getEntries();
        for (int i = 0; i < entries.size(); i++) {
            ShapeEntry entry = entries.get(i);
            String name = entry.isExplicitlyNamed()
                    ? entry.getName()
                    : ExprQueries.implicitName(entry.getValue()).orElse("field" + i);
            arguments.add("\"" + name + "\"");
            arguments.add(write(entry.getValue()));
        }
        return "newShape(" + String.join(", ", arguments) + ")";
    }

    private void requireShapeHelper() {
        if (ctx.hasHelper("newShape")) {
            return;
        }
        String map = ctx.reference("java.util.Map");
        String linked = ctx.reference("java.util.LinkedHashMap");
        ctx.addHelper("newShape", ""
                + "    private static " + map + "<String, Object> newShape(Object... entries) {\n"
                + "        " + map + "<String, Object> shape = new " + linked + "<>();\n"
                + "        for (int i = 0; i < entries.length; i += 2) {\n"
                + "            shape.put((String) entries[i], entries[i + 1]);\n"
                + "        }\n"
                + "        return shape;\n"
                + "    }\n");
    }

    /**
     * Accessor reading one key of an untyped shape such as a grouping key.
     */
    private String keyAccessor(TypeRef mapType, String member) {
        String name = "groupKey_" + ctx.getCalculator().shortHash(mapType.descriptor()) + "_" + member;
        if (!ctx.hasHelper(name)) {
            TypeRef fieldType = mapType.getFields().getOrDefault(member, TypeRef.UNRESOLVED);
            String returnType = types.renderBoxed(fieldType);
            String map = ctx.reference("java.util.Map");
            ctx.addHelper(name, ""
                    + "    private static " + returnType + " " + name + "(Object key) {\n"
                    + "        return key == null ? null : (" + returnType + ") ((" + map + "<?, ?>) key).get(\""
                    + member + "\");\n"
                    + "    }\n");
        }
        return name;
    }

    /**
     * Factory filling a named target type through its no-argument constructor and setters.
     */
    private String namedFactory(Structure structure) {
        String simple = NamingUtil.simpleName(structure.getTargetType());
        String name = "new" + simple + "_" + structure.getContentHash();
        if (ctx.hasHelper(name)) {
            return name;
        }
        String target = types.reference(structure.getTargetType());
        TypeRef targetRef = TypeRef.named(structure.getTargetType());
        List<String> parameters = new ArrayList<>();
        StringBuilder body = new StringBuilder();
        body.append("        ").append(target).append(" target_ = new ").append(target).append("();\n");
        for (StructureField field : structure.getFields()) {
            String parameter = DtoNaming.fieldName(field.getName());
            parameters.add(types.render(field.getResolvedType()) + " " + parameter);
            MemberInfo member = ctx.getSchema().member(targetRef, field.getName()).orElse(null);
            if (member == null) {
                continue;
            }
            String statement = member.writeStatement("target_", parameter);
            if (member.getType().isPrimitive() && !field.getResolvedType().isPrimitive()) {
                body.append("        if (").append(parameter).append(" != null) {\n")
                        .append("            ").append(statement).append("\n")
                        .append("        }\n");
            } else {
                body.append("        ").append(statement).append("\n");
            }
        }
        body.append("        return target_;\n");
        ctx.addHelper(name, "    private static " + target + " " + name + "(" + String.join(", ", parameters)
                + ") {\n" + body + "    }\n");
        return name;
    }

    // ---- operators -------------------------------------------------------------

    private String writeCoalesce(CoalesceNode coalesce) {
        ExprNode value = coalesce.getValue();
        String fallback = write(coalesce.getFallback());
        TypeRef valueType = typeOf.get(value);
        if (valueType != null && valueType.isPrimitive()) {
            return write(value);
        }
        if (ExprQueries.isPostfix(value)) {
            return writeChain(value, fallback, true).close();
        }
        return ctx.reference("java.util.Optional") + ".ofNullable(" + write(value) + ").orElse(" + fallback + ")";
    }

    private String writeBinary(BinaryNode binary) {
        String left = write(binary.getLeft());
        String right = write(binary.getRight());
        if (binary.getOperator().isEquality() && !isNullLiteral(binary.getLeft()) && !isNullLiteral(binary.getRight())
                && !(isPrimitive(binary.getLeft()) && isPrimitive(binary.getRight()))) {
            String equals = ctx.reference("java.util.Objects") + ".equals(" + left + ", " + right + ")";
            return binary.getOperator().getSymbol().equals("==") ? equals : "!" + equals;
        }
        return "(" + left + " " + binary.getOperator().getSymbol() + " " + right + ")";
    }

    private boolean isNullLiteral(ExprNode node) {
        return node instanceof LiteralNode literal && literal.getKind() == LiteralKind.NULL;
    }

    private boolean isPrimitive(ExprNode node) {
        TypeRef type = typeOf.get(node);
        return type != null && type.isPrimitive();
    }

    private String wrap(ExprNode node, String code) {
        if (node instanceof ParameterNode || node instanceof CaptureNode || node instanceof IdentifierNode
                || node instanceof LiteralNode || node instanceof ShapeNode || ExprQueries.isPostfix(node)
                || code.startsWith("(")) {
            return code;
        }
        return "(" + code + ")";
    }

    private String collectors() {
        return ctx.reference("java.util.stream.Collectors");
    }

    private String comparator() {
        return ctx.reference("java.util.Comparator");
    }

    private static String capitalize(String name) {
        return name.isEmpty() ? name : Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }
}
