package com.shapecraft.generator.codegen.shape;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shapecraft.generator.codegen.GeneratorConfig;
import com.shapecraft.generator.codegen.exception.EmptyStructureException;
import com.shapecraft.generator.codegen.exception.UnresolvedTypeException;
import com.shapecraft.generator.codegen.exception.UnsupportedExpressionShapeException;
import com.shapecraft.generator.codegen.model.CallSite;
import com.shapecraft.generator.codegen.model.Structure;
import com.shapecraft.generator.codegen.model.core.context.DiagnosticCode;
import com.shapecraft.generator.codegen.variant.ProjectionVariant;
import com.shapecraft.generator.codegen.variant.ProjectionVariants;
import com.shapecraft.generator.model.CaptureDeclaration;
import com.shapecraft.generator.model.ShapeNode;
import com.shapecraft.generator.schema.TypeRef;
import com.shapecraft.generator.schema.TypeSchema;

/**
 * Analyses a call site into its structures. A pure function of the schema, the
 * configuration and the call site: it never touches shared mutable state, so
 * call sites can be analysed in parallel.
 */
public class ProjectionAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(ProjectionAnalyzer.class);

    private final TypeSchema schema;
    private final GeneratorConfig config;

    public ProjectionAnalyzer(TypeSchema schema, GeneratorConfig config) {
        this.schema = schema;
        this.config = config;
    }

    public AnalyzedCallSite analyze(CallSite site) {
        AnalysisContext ctx = new AnalysisContext(site, schema, config);
        AnalyzedCallSite.AnalyzedCallSiteBuilder result = AnalyzedCallSite.builder()
                .callSite(site)
                .diagnostics(ctx.getDiagnostics());

        TypeRef sourceType;
        Map<String, TypeRef> captureTypes = new LinkedHashMap<>();
        try {
            sourceType = ctx.getNames().toTypeRef(site.getSourceType());
            if (!sourceType.isNamed() && !sourceType.isGroup()) {
                throw new UnresolvedTypeException("Source type " + sourceType + " is neither a schema type nor a group");
            }
            if (sourceType.isNamed() && schema.describe(sourceType.getName()).isEmpty()) {
                throw new UnresolvedTypeException("Source type " + sourceType.getName()
                        + " is not described by the schema");
            }
            for (CaptureDeclaration capture : site.getCaptures()) {
                captureTypes.put(capture.getName(), ctx.getNames().toTypeRef(capture.getType()));
            }
        } catch (UnresolvedTypeException e) {
            return fail(ctx, result, DiagnosticCode.UNRESOLVED_TYPE, e.getMessage());
        }
        result.sourceType(sourceType).captureTypes(captureTypes);

        ProjectionVariant variant = ProjectionVariants.select(site, sourceType);
        result.variant(variant);

        if (!(site.getBody() instanceof ShapeNode body)) {
            return fail(ctx, result, DiagnosticCode.UNSUPPORTED_EXPRESSION_SHAPE,
                    "Projection body must be a shape literal, found " + site.getBody().toSource());
        }

        Structure root;
        try {
            Scope scope = Scope.root(site.getParameterName(), sourceType, captureTypes);
            root = ctx.getStructureBuilder().buildRoot(body, sourceType, scope, variant.rootHint(site, sourceType));
            ctx.getTypes().put(body, TypeResolver.structureType(root));
        } catch (EmptyStructureException e) {
            return fail(ctx, result, DiagnosticCode.EMPTY_STRUCTURE, e.getMessage());
        } catch (UnresolvedTypeException e) {
            return fail(ctx, result, DiagnosticCode.UNRESOLVED_TYPE, e.getMessage());
        } catch (UnsupportedExpressionShapeException e) {
            return fail(ctx, result, DiagnosticCode.UNSUPPORTED_EXPRESSION_SHAPE, e.getMessage());
        }

        boolean reverse = !root.isNamedTarget() && variant.supportsReverse(sourceType, schema);
        if (!reverse && !root.isNamedTarget()) {
            ctx.getDiagnostics().info(DiagnosticCode.REVERSE_UNAVAILABLE, site.location(),
                    "No reverse transform: source " + sourceType + " cannot be constructed");
        }

        log.debug("Analysed {} as {} with root {} ({} structure(s))", site.location(), variant,
                root.getContentHash(), ctx.structuresInOrder().size());

        return result
                .root(root)
                .structures(ctx.structuresInOrder())
                .shapeStructures(Collections.unmodifiableMap(new IdentityHashMap<>(ctx.getStructures())))
                .types(Collections.unmodifiableMap(new IdentityHashMap<>(ctx.getTypes())))
                .emissionStrategy(variant.emissionStrategy(site, config))
                .reverseSupported(reverse)
                .methodName(variant.methodName(site, root))
                .build();
    }

    private AnalyzedCallSite fail(AnalysisContext ctx, AnalyzedCallSite.AnalyzedCallSiteBuilder result,
                                  DiagnosticCode code, String message) {
        ctx.getDiagnostics().error(code, ctx.getCallSite().location(), message);
        log.warn("Skipping call site {}: {}", ctx.getCallSite().location(), message);
        return result
                .shapeStructures(Map.of())
                .types(Map.of())
                .build();
    }
}
