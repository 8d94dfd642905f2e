package com.shapecraft.generator.codegen.reverse;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shapecraft.generator.codegen.dto.DtoNaming;
import com.shapecraft.generator.codegen.exception.AmbiguousReversePathException;
import com.shapecraft.generator.codegen.forward.DefaultValues;
import com.shapecraft.generator.codegen.generator.EmissionContext;
import com.shapecraft.generator.codegen.generator.TypeRenderer;
import com.shapecraft.generator.codegen.model.SourcePath;
import com.shapecraft.generator.codegen.model.Structure;
import com.shapecraft.generator.codegen.model.StructureField;
import com.shapecraft.generator.codegen.model.core.context.DiagnosticCode;
import com.shapecraft.generator.codegen.shape.AnalyzedCallSite;
import com.shapecraft.generator.codegen.shape.TypeResolver;
import com.shapecraft.generator.schema.CollectionKind;
import com.shapecraft.generator.schema.MemberInfo;
import com.shapecraft.generator.schema.TypeRef;
import com.shapecraft.generator.schema.TypeSchema;

/**
 * Emits the inverse of forward transforms: a source object rebuilt from a DTO.
 *
 * Helpers are generated once per distinct (structure, source type, write-back
 * paths) combination as a {@code fromDto_<HASH>_<Source>} and
 * {@code apply_<HASH>_<Source>} pair. Fields that cannot be written back are
 * left out of the inverse.
 */
public class ReverseCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(ReverseCodeGenerator.class);

    private final EmissionContext ctx;
    private final TypeSchema schema;
    private final TypeRenderer types;

    /** Helper suffix per reverse signature. */
    private final Map<String, String> suffixes = new HashMap<>();
    private final Set<String> usedSuffixes = new HashSet<>();
    private final Set<String> factories = new HashSet<>();

    public ReverseCodeGenerator(EmissionContext ctx) {
        this.ctx = ctx;
        this.schema = ctx.getSchema();
        this.types = ctx.getTypes();
    }

    public void generate(AnalyzedCallSite site, String forwardMethod) {
        Structure root = site.getRoot();
        TypeRef sourceType = site.getSourceType();
        String suffix = reverseOf(root, sourceType);
        requireFactory(suffix, root, sourceType);

        String source = types.render(sourceType);
        String dto = types.render(TypeResolver.structureType(root));
        String list = ctx.reference("java.util.List");
        String method = ctx.claimMemberName(forwardMethod + "Reverse");
        String allMethod = ctx.claimMemberName(forwardMethod + "ReverseAll");

        ctx.addPublicMember(""
                + "    /**\n"
                + "     * Rebuilds a {@code " + sourceType.simpleName() + "} from the result of {@link #"
                + forwardMethod + "}. Fields that cannot be written back are left unset.\n"
                + "     */\n"
                + "    public static " + source + " " + method + "(" + dto + " dto) {\n"
                + "        return fromDto_" + suffix + "(dto);\n"
                + "    }\n");
        ctx.addPublicMember(""
                + "    public static " + list + "<" + source + "> " + allMethod + "("
                + ctx.reference("java.util.Collection") + "<? extends " + dto + "> dtos) {\n"
                + "        if (dtos == null) {\n"
                + "            return new " + ctx.reference("java.util.ArrayList") + "<>();\n"
                + "        }\n"
                + "        return dtos.stream().map(dto -> fromDto_" + suffix + "(dto)).collect("
                + ctx.reference("java.util.stream.Collectors") + ".toList());\n"
                + "    }\n");
        log.debug("Reverse transform {}.{} via apply_{}", ctx.getClassName(), method, suffix);
    }

    /**
     * Ensures the {@code apply_} helper of a structure read from {@code sourceType} exists.
     *
     * @return the helper name suffix
     */
    private String reverseOf(Structure structure, TypeRef sourceType) {
        String signature = reverseSignature(structure, sourceType);
        String existing = suffixes.get(signature);
        if (existing != null) {
            return existing;
        }
        String base = structure.getContentHash() + "_" + sourceType.simpleName();
        String suffix = base;
        int counter = 2;
        while (usedSuffixes.contains(suffix)) {
            suffix = base + "_" + counter++;
        }
        usedSuffixes.add(suffix);
        suffixes.put(signature, suffix);

        String dto = types.render(TypeResolver.structureType(structure));
        String source = types.render(sourceType);
        StringBuilder body = new StringBuilder();
        for (StructureField field : structure.getFields()) {
            try {
                body.append(writeBack(field, sourceType));
            } catch (AmbiguousReversePathException e) {
                ctx.getDiagnostics().info(DiagnosticCode.AMBIGUOUS_REVERSE_PATH, ctx.getClassName() + ".apply_" + suffix,
                        "Field '" + field.getName() + "' is not written back: " + e.getMessage());
                log.debug("Reverse of {} omits field '{}': {}", suffix, field.getName(), e.getMessage());
            }
        }
        ctx.addHelper("apply_" + suffix, ""
                + "    private static void apply_" + suffix + "(" + dto + " dto, " + source + " entity) {\n"
                + body
                + "    }\n");
        return suffix;
    }

    private void requireFactory(String suffix, Structure structure, TypeRef sourceType) {
        if (!factories.add(suffix)) {
            return;
        }
        String dto = types.render(TypeResolver.structureType(structure));
        String source = types.render(sourceType);
        ctx.addHelper("fromDto_" + suffix, ""
                + "    private static " + source + " fromDto_" + suffix + "(" + dto + " dto) {\n"
                + "        if (dto == null) {\n"
                + "            return null;\n"
                + "        }\n"
                + "        " + source + " entity = new " + source + "();\n"
                + "        apply_" + suffix + "(dto, entity);\n"
                + "        return entity;\n"
                + "    }\n");
    }

    private String writeBack(StructureField field, TypeRef sourceType) {
        if (!field.isReversible()) {
            throw new AmbiguousReversePathException("value is not a member chain of the source");
        }
        String value = DtoNaming.readExpression("dto", field.getName(), field.getResolvedType(),
                ctx.getConfig().getDtoStyle());
        return switch (field.getShape()) {
            case LEAF -> leaf(field, sourceType, value);
            case NESTED_OBJECT -> nestedObject(field, sourceType, value);
            case NESTED_COLLECTION -> nestedCollection(field, sourceType, value);
            case OPAQUE -> throw new AmbiguousReversePathException("untyped value");
        };
    }

    private String leaf(StructureField field, TypeRef sourceType, String value) {
        ResolvedPath path = resolve(sourceType, field.getSourcePath());
        MemberInfo leaf = path.leaf();
        if (!leaf.isWritable()) {
            throw new AmbiguousReversePathException("member '" + leaf.getName() + "' is read-only");
        }
        if (!leaf.getType().boxed().equals(field.getResolvedType().boxed())) {
            throw new AmbiguousReversePathException("member '" + leaf.getName() + "' is " + leaf.getType()
                    + " but the field is " + field.getResolvedType());
        }
        String assignment = leaf.writeStatement(path.ownerOfLeaf(), value);
        boolean valueNeverNull = field.getResolvedType().isPrimitive();
        if (path.length() == 1) {
            if (leaf.getType().isPrimitive() && !valueNeverNull) {
                return guarded(value, assignment);
            }
            return "        " + assignment + "\n";
        }
        if (valueNeverNull) {
            return path.ensureIntermediates("        ") + "        " + assignment + "\n";
        }
        return "        if (" + value + " != null) {\n"
                + path.ensureIntermediates("            ")
                + "            " + assignment + "\n"
                + "        }\n";
    }

    private String nestedObject(StructureField field, TypeRef sourceType, String value) {
        Structure nested = field.getNestedStructure();
        if (nested.isNamedTarget()) {
            throw new AmbiguousReversePathException("nested object targets the named type " + nested.getTargetType());
        }
        SourcePath anchor = field.getSourcePath();
        if (anchor.isEmpty()) {
            if (!nested.getSourceType().equals(sourceType)) {
                throw new AmbiguousReversePathException("nested object is not read from " + sourceType);
            }
            String suffix = reverseOf(nested, sourceType);
            return guarded(value, "apply_" + suffix + "(" + value + ", entity);");
        }
        ResolvedPath path = resolve(sourceType, anchor);
        TypeRef anchorType = path.leaf().getType();
        if (!anchorType.equals(nested.getSourceType())) {
            throw new AmbiguousReversePathException("nested object is read from " + nested.getSourceType()
                    + " but '" + anchor + "' is " + anchorType);
        }
        requireConstructible(path.leaf());
        String suffix = reverseOf(nested, anchorType);
        return "        if (" + value + " != null) {\n"
                + path.ensureAll("            ")
                + "            apply_" + suffix + "(" + value + ", " + path.readAll() + ");\n"
                + "        }\n";
    }

    private String nestedCollection(StructureField field, TypeRef sourceType, String value) {
        Structure element = field.getNestedStructure();
        if (element.isNamedTarget()) {
            throw new AmbiguousReversePathException("elements target the named type " + element.getTargetType());
        }
        ResolvedPath path = resolve(sourceType, field.getSourcePath());
        MemberInfo leaf = path.leaf();
        TypeRef memberType = leaf.getType();
        if (!leaf.isWritable()) {
            throw new AmbiguousReversePathException("member '" + leaf.getName() + "' is read-only");
        }
        if (!memberType.isCollection() || memberType.isStream()) {
            throw new AmbiguousReversePathException("member '" + leaf.getName() + "' is not a collection");
        }
        TypeRef elementType = memberType.getElementType();
        if (!elementType.equals(element.getSourceType()) || !schema.isDefaultConstructible(elementType)) {
            throw new AmbiguousReversePathException("elements of '" + leaf.getName() + "' cannot be constructed");
        }

        String suffix = reverseOf(element, elementType);
        requireFactory(suffix, element, elementType);

        TypeRef dtoCollection = field.getResolvedType();
        String stream = dtoCollection.getCollectionKind() == CollectionKind.ARRAY
                ? ctx.reference("java.util.Arrays") + ".stream(" + value + ")"
                : value + ".stream()";
        String mapped = stream + ".map(e_ -> fromDto_" + suffix + "(e_))";
        String rebuilt;
        if (memberType.getCollectionKind() == CollectionKind.ARRAY) {
            rebuilt = mapped + ".toArray(" + types.render(elementType) + "[]::new)";
        } else {
            rebuilt = mapped + ".collect(" + ctx.reference("java.util.stream.Collectors") + ".toCollection("
                    + ctx.reference(DefaultValues.implementationOf(memberType.getName())) + "::new))";
        }
        String assignment = leaf.writeStatement(path.ownerOfLeaf(), rebuilt);
        return "        if (" + value + " != null) {\n"
                + path.ensureIntermediates("            ")
                + "            " + assignment + "\n"
                + "        }\n";
    }

    private static String guarded(String value, String statement) {
        return "        if (" + value + " != null) {\n"
                + "            " + statement + "\n"
                + "        }\n";
    }

    private ResolvedPath resolve(TypeRef sourceType, SourcePath path) {
        if (!sourceType.isNamed()) {
            throw new AmbiguousReversePathException("source " + sourceType + " is not a schema type");
        }
        ResolvedPath resolved = new ResolvedPath();
        TypeRef current = sourceType;
        List<String> members = path.getMembers();
        for (int i = 0; i < members.size(); i++) {
            String name = members.get(i);
            TypeRef owner = current;
            MemberInfo member = schema.member(owner, name).orElseThrow(() -> new AmbiguousReversePathException(
                    owner + " has no member '" + name + "'"));
            if (i < members.size() - 1) {
                requireConstructible(member);
            }
            resolved.members.add(member);
            current = member.getType();
        }
        return resolved;
    }

    private void requireConstructible(MemberInfo member) {
        if (!member.isWritable() || !member.getType().isNamed() || !schema.isDefaultConstructible(member.getType())) {
            throw new AmbiguousReversePathException("intermediate '" + member.getName()
                    + "' cannot be instantiated and assigned");
        }
    }

    /**
     * Canonical text of everything the helpers of a structure depend on.
     */
    private String reverseSignature(Structure structure, TypeRef sourceType) {
        StringBuilder sb = new StringBuilder(sourceType.descriptor()).append('|').append(structure.getContentHash());
        for (StructureField field : structure.getFields()) {
            sb.append('|').append(field.getName()).append('=').append(field.getSourcePath());
            Optional<Structure> nested = field.nested();
            nested.ifPresent(n -> sb.append("{").append(reverseSignature(n, n.getSourceType())).append("}"));
        }
        return sb.toString();
    }

    /**
     * Members along a write-back path, starting at {@code entity}.
     */
    private final class ResolvedPath {
        final List<MemberInfo> members = new ArrayList<>();

        int length() {
            return members.size();
        }

        MemberInfo leaf() {
            return members.get(members.size() - 1);
        }

        String ownerOfLeaf() {
            return read(members.size() - 1);
        }

        String readAll() {
            return read(members.size());
        }

        private String read(int count) {
            String expression = "entity";
            for (int i = 0; i < count; i++) {
                expression = members.get(i).readExpression(expression);
            }
            return expression;
        }

        String ensureIntermediates(String indent) {
            return ensure(members.size() - 1, indent);
        }

        String ensureAll(String indent) {
            return ensure(members.size(), indent);
        }

        /**
         * Instantiates the first {@code count} members when they are null, in path order.
         */
        private String ensure(int count, String indent) {
            StringBuilder sb = new StringBuilder();
            String owner = "entity";
            for (int i = 0; i < count; i++) {
                MemberInfo member = members.get(i);
                String read = member.readExpression(owner);
                sb.append(indent).append("if (").append(read).append(" == null) {\n")
                        .append(indent).append("    ")
                        .append(member.writeStatement(owner, "new " + types.render(member.getType()) + "()"))
                        .append("\n")
                        .append(indent).append("}\n");
                owner = read;
            }
            return sb.toString();
        }
    }
}
