package com.shapecraft.generator.codegen.shape;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shapecraft.generator.codegen.exception.EmptyStructureException;
import com.shapecraft.generator.codegen.exception.UnresolvedTypeException;
import com.shapecraft.generator.codegen.exception.UnsupportedExpressionShapeException;
import com.shapecraft.generator.codegen.model.FieldShape;
import com.shapecraft.generator.codegen.model.NullabilityRule;
import com.shapecraft.generator.codegen.model.SourcePath;
import com.shapecraft.generator.codegen.model.Structure;
import com.shapecraft.generator.codegen.model.StructureField;
import com.shapecraft.generator.codegen.model.core.context.DiagnosticCode;
import com.shapecraft.generator.model.ExprNode;
import com.shapecraft.generator.model.ExprQueries;
import com.shapecraft.generator.model.ShapeEntry;
import com.shapecraft.generator.model.ShapeNode;
import com.shapecraft.generator.schema.MemberInfo;
import com.shapecraft.generator.schema.Nullability;
import com.shapecraft.generator.schema.TypeInfo;
import com.shapecraft.generator.schema.TypeRef;

/**
 * Turns a shape literal into a {@link Structure}. Nested structures are built
 * first, so a structure is only hashed once everything it contains is final.
 */
public class StructureBuilder {
    private static final Logger log = LoggerFactory.getLogger(StructureBuilder.class);

    private final AnalysisContext ctx;

    public StructureBuilder(AnalysisContext ctx) {
        this.ctx = ctx;
    }

    /**
     * Builds the structure a projection body evaluates to.
     *
     * @throws EmptyStructureException when no field of the shape survives
     */
    public Structure buildRoot(ShapeNode shape, TypeRef sourceType, Scope scope, String hint) {
        return build(shape, sourceType, scope, hint, SourcePath.EMPTY);
    }

    /**
     * Builds the structure of each element produced by a {@code map} lambda.
     */
    public Structure buildElement(ShapeNode shape, TypeRef elementType, Scope elementScope, String hint) {
        try {
            return build(shape, elementType, elementScope, hint, SourcePath.EMPTY);
        } catch (EmptyStructureException e) {
            throw new UnsupportedExpressionShapeException(e.getMessage());
        }
    }

    public Structure build(ShapeNode shape, TypeRef sourceType, Scope scope, String hint, SourcePath anchor) {
        String targetType = null;
        TypeInfo target = null;
        if (shape.isNamed()) {
            targetType = ctx.getNames().resolveName(shape.getTypeName());
            String resolved = targetType;
            target = ctx.getSchema().describe(targetType).orElseThrow(() -> new UnresolvedTypeException(
                    "Target type " + resolved + " is not described by the schema"));
            if (!target.isDefaultConstructible()) {
                throw new UnresolvedTypeException(
                        "Target type " + targetType + " has no public no-argument constructor");
            }
        }

        List<StructureField> fields = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (ShapeEntry entry : shape.getEntries()) {
            Optional<String> name = entry.isExplicitlyNamed()
                    ? Optional.of(entry.getName())
                    : ExprQueries.implicitName(entry.getValue());
            if (name.isEmpty()) {
                ctx.getDiagnostics().warning(DiagnosticCode.MISSING_FIELD_NAME, ctx.location(entry.getValue()),
                        "Entry '" + entry.getValue().toSource() + "' needs an explicit name; skipped");
                continue;
            }
            if (!names.add(name.get())) {
                ctx.getDiagnostics().warning(DiagnosticCode.DUPLICATE_FIELD, ctx.location(entry.getValue()),
                        "Field '" + name.get() + "' is already defined; later entry skipped");
                continue;
            }
            MemberInfo targetMember = null;
            if (target != null) {
                targetMember = target.member(name.get()).filter(MemberInfo::isWritable).orElse(null);
                if (targetMember == null) {
                    ctx.getDiagnostics().warning(DiagnosticCode.UNRESOLVED_TYPE, ctx.location(entry.getValue()),
                            "Target type " + targetType + " has no writable member '" + name.get() + "'; skipped");
                    continue;
                }
            }
            fields.add(buildField(name.get(), entry.getValue(), scope, targetMember, target != null));
        }

        if (fields.stream().noneMatch(field -> field.getResolvedType().isResolved())) {
            throw new EmptyStructureException("Shape at " + ctx.location(shape) + " has no resolvable fields");
        }

        Structure structure = Structure.builder()
                .sourceType(sourceType)
                .fields(fields)
                .contentHash(ctx.getCalculator().contentHash(fields, targetType))
                .signature(ctx.getCalculator().signatureText(fields, targetType))
                .targetType(targetType)
                .hintName(hint)
                .parameterName(scope.getStructureParameter())
                .anchor(anchor)
                .build();
        ctx.register(shape, structure);
        log.debug("Built structure {} with {} field(s) for '{}'", structure.getContentHash(), fields.size(), hint);
        return structure;
    }

    private StructureField buildField(String name, ExprNode expression, Scope scope, MemberInfo targetMember,
                                      boolean namedTarget) {
        int mark = ctx.mark();
        try {
            NestedResolution resolution = ctx.getNestedResolver().resolve(name, expression, scope);
            return toField(resolution, scope, targetMember, namedTarget);
        } catch (UnsupportedExpressionShapeException | EmptyStructureException e) {
            ctx.rollback(mark);
            ctx.getDiagnostics().info(DiagnosticCode.UNSUPPORTED_EXPRESSION_SHAPE, ctx.location(expression),
                    e.getMessage() + "; field '" + name + "' is emitted as an untyped map value");
            log.debug("Opaque field '{}': {}", name, e.getMessage());
            return opaqueField(name, expression, scope, namedTarget);
        } catch (UnresolvedTypeException e) {
            ctx.rollback(mark);
            ctx.getDiagnostics().warning(DiagnosticCode.UNRESOLVED_TYPE, ctx.location(expression),
                    "Field '" + name + "': " + e.getMessage() + "; passed through as Object");
            log.warn("Unresolved nested type for field '{}': {}", name, e.getMessage());
            return StructureField.builder()
                    .name(name)
                    .expression(expression)
                    .resolvedType(TypeRef.UNRESOLVED)
                    .nullable(true)
                    .fromNamedSubtype(namedTarget)
                    .shape(FieldShape.LEAF)
                    .nullabilityRule(NullabilityRule.EXPRESSION)
                    .lineage(ShapeFieldParser.lineage(expression, scope))
                    .build();
        }
    }

    private StructureField toField(NestedResolution resolution, Scope scope, MemberInfo targetMember,
                                   boolean namedTarget) {
        ParsedField parsed = resolution.getParsed();
        TypeRef type = parsed.getDeclaredType();
        if (targetMember != null && resolution.getShape() == FieldShape.LEAF && !parsed.isUnresolved()) {
            type = targetMember.getType();
        }

        NullabilityDecision decision;
        if (parsed.isUnresolved()) {
            decision = new NullabilityDecision(true, NullabilityRule.EXPRESSION, false, false);
        } else {
            decision = ctx.getNullabilityResolver().resolve(parsed.getExpression(), type, resolution.getShape(),
                    scope, targetMember, ctx.getTypes(), ctx.getConfig().isArrayNullabilityRemoval());
        }
        if (decision.isNullable()) {
            type = type.boxed();
        }

        return StructureField.builder()
                .name(parsed.getName())
                .expression(parsed.getExpression())
                .resolvedType(type)
                .nullable(decision.isNullable())
                .nestedStructure(resolution.getNested())
                .fromNamedSubtype(namedTarget)
                .shape(resolution.getShape())
                .nullabilityRule(decision.getRule())
                .defensiveGuards(decision.isDefensiveGuards())
                .emptyCollectionFallback(decision.isEmptyCollectionFallback())
                .lineage(parsed.getLineage())
                .sourcePath(resolution.getReversePath())
                .build();
    }

    /**
     * A field whose shape literals are rendered as untyped maps.
     */
    private StructureField opaqueField(String name, ExprNode expression, Scope scope, boolean namedTarget) {
        TypeRef type;
        ctx.setStructuresSuppressed(true);
        try {
            type = ctx.getTypeResolver().typeOf(expression, scope);
            if (type.isStream()) {
                type = TypeRef.list(type.getElementType());
            }
        } catch (UnresolvedTypeException e) {
            type = TypeRef.anonymous(Map.of());
        } finally {
            ctx.setStructuresSuppressed(false);
        }
        boolean nullable = !type.isPrimitive()
                && ctx.getNullabilityResolver().valueNullability(expression, ctx.getTypes()) == Nullability.NULLABLE;
        return StructureField.builder()
                .name(name)
                .expression(expression)
                .resolvedType(nullable ? type.boxed() : type)
                .nullable(nullable)
                .fromNamedSubtype(namedTarget)
                .shape(FieldShape.OPAQUE)
                .nullabilityRule(NullabilityRule.EXPRESSION)
                .lineage(ShapeFieldParser.lineage(expression, scope))
                .build();
    }
}
