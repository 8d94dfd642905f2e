package com.shapecraft.generator.codegen.variant;

import com.shapecraft.generator.codegen.GeneratorConfig;
import com.shapecraft.generator.codegen.model.CallSite;
import com.shapecraft.generator.codegen.model.Structure;
import com.shapecraft.generator.codegen.util.NamingUtil;
import com.shapecraft.generator.model.ShapeNode;
import com.shapecraft.generator.schema.TypeRef;

/**
 * Body of the form {@code new T { ... }}: fields are written into an existing
 * type and no root DTO is generated.
 */
public class NamedTypeProjection extends ProjectionVariant {

    @Override
    public VariantKind kind() {
        return VariantKind.NAMED_TYPE;
    }

    @Override
    public String rootHint(CallSite site, TypeRef sourceType) {
        ShapeNode body = (ShapeNode) site.getBody();
        return NamingUtil.simpleName(body.getTypeName());
    }

    @Override
    public String methodName(CallSite site, Structure root) {
        if (site.getName() != null) {
            return super.methodName(site, root);
        }
        return "to" + NamingUtil.simpleName(root.getTargetType()) + "_" + root.getContentHash();
    }

    @Override
    public EmissionStrategy emissionStrategy(CallSite site, GeneratorConfig config) {
        return prebuiltWhenPossible(site, config);
    }
}
