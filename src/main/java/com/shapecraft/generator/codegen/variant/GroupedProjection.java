package com.shapecraft.generator.codegen.variant;

import com.shapecraft.generator.codegen.model.CallSite;
import com.shapecraft.generator.codegen.model.Structure;
import com.shapecraft.generator.codegen.util.NamingUtil;
import com.shapecraft.generator.schema.TypeRef;
import com.shapecraft.generator.schema.TypeSchema;

/**
 * Projection over a {@code group<K, E>} source. Aggregates on the group operate
 * on its element list; a group cannot be rebuilt from its projection.
 */
public class GroupedProjection extends ProjectionVariant {

    @Override
    public VariantKind kind() {
        return VariantKind.GROUPED;
    }

    @Override
    public String rootHint(CallSite site, TypeRef sourceType) {
        if (site.getName() != null) {
            return NamingUtil.toPascalCase(site.getName());
        }
        return sourceType.getElementType().simpleName() + "Group";
    }

    @Override
    public String explicitRootName(CallSite site) {
        return site.getName() != null ? NamingUtil.toPascalCase(site.getName()) : null;
    }

    @Override
    public String methodName(CallSite site, Structure root) {
        if (site.getName() != null) {
            return super.methodName(site, root);
        }
        return "project" + root.getSourceType().getElementType().simpleName() + "Group_" + root.getContentHash();
    }

    @Override
    public boolean supportsReverse(TypeRef sourceType, TypeSchema schema) {
        return false;
    }
}
