package com.shapecraft.generator.codegen.variant;

import com.shapecraft.generator.codegen.GeneratorConfig;
import com.shapecraft.generator.codegen.model.CallSite;
import com.shapecraft.generator.codegen.model.Structure;
import com.shapecraft.generator.codegen.util.NamingUtil;
import com.shapecraft.generator.schema.TypeRef;
import com.shapecraft.generator.schema.TypeSchema;

/**
 * Behaviour that differs between kinds of call site. One instance is selected
 * per call site by {@link ProjectionVariants#select}; instances are stateless.
 */
public abstract class ProjectionVariant {

    public abstract VariantKind kind();

    /**
     * Base name the root structure's generated type is derived from.
     */
    public abstract String rootHint(CallSite site, TypeRef sourceType);

    /**
     * Simple name the root DTO must be given, or null when it is named by hash.
     */
    public String explicitRootName(CallSite site) {
        return null;
    }

    /**
     * Name of the forward method in the projections class.
     */
    public String methodName(CallSite site, Structure root) {
        return NamingUtil.safeIdentifier(NamingUtil.toCamelCase(site.getName()));
    }

    public EmissionStrategy emissionStrategy(CallSite site, GeneratorConfig config) {
        return EmissionStrategy.INLINE_CLOSURE;
    }

    /**
     * Whether a reverse transform can rebuild the source from the projection.
     */
    public boolean supportsReverse(TypeRef sourceType, TypeSchema schema) {
        return sourceType.isNamed() && schema.isDefaultConstructible(sourceType);
    }

    /**
     * Shared rule for the variants that may be prebuilt: opted in and free of captures.
     */
    protected EmissionStrategy prebuiltWhenPossible(CallSite site, GeneratorConfig config) {
        return config.isPrebuiltTransforms() && !site.hasCaptures()
                ? EmissionStrategy.PREBUILT_TRANSFORM
                : EmissionStrategy.INLINE_CLOSURE;
    }

    @Override
    public String toString() {
        return kind().name();
    }
}
