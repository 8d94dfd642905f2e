package com.shapecraft.generator.codegen.variant;

import com.shapecraft.generator.codegen.GeneratorConfig;
import com.shapecraft.generator.codegen.model.CallSite;
import com.shapecraft.generator.codegen.util.NamingUtil;
import com.shapecraft.generator.schema.TypeRef;

/**
 * Named projection with an anonymous body: the root DTO takes the projection's name.
 */
public class ExplicitDtoProjection extends ProjectionVariant {

    @Override
    public VariantKind kind() {
        return VariantKind.EXPLICIT_DTO;
    }

    @Override
    public String rootHint(CallSite site, TypeRef sourceType) {
        return NamingUtil.toPascalCase(site.getName());
    }

    @Override
    public String explicitRootName(CallSite site) {
        return NamingUtil.toPascalCase(site.getName());
    }

    @Override
    public EmissionStrategy emissionStrategy(CallSite site, GeneratorConfig config) {
        return prebuiltWhenPossible(site, config);
    }
}
