package com.shapecraft.generator.codegen.variant;

import com.shapecraft.generator.codegen.model.CallSite;
import com.shapecraft.generator.codegen.model.Structure;
import com.shapecraft.generator.codegen.util.NamingUtil;
import com.shapecraft.generator.schema.TypeRef;

/**
 * Unnamed projection with an anonymous body: the DTO and the method are named
 * after the source type and the structure hash.
 */
public class AnonymousProjection extends ProjectionVariant {

    @Override
    public VariantKind kind() {
        return VariantKind.ANONYMOUS;
    }

    @Override
    public String rootHint(CallSite site, TypeRef sourceType) {
        return sourceType.simpleName();
    }

    @Override
    public String methodName(CallSite site, Structure root) {
        return "project" + NamingUtil.toPascalCase(root.getSourceType().simpleName()) + "_" + root.getContentHash();
    }
}
