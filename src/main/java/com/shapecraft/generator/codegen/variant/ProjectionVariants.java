package com.shapecraft.generator.codegen.variant;

import com.shapecraft.generator.codegen.model.CallSite;
import com.shapecraft.generator.model.ShapeNode;
import com.shapecraft.generator.schema.TypeRef;

import lombok.experimental.UtilityClass;

/**
 * Chooses the variant of a call site. The first rule that matches wins: grouped
 * source, named target type, named projection, anonymous.
 */
@UtilityClass
public class ProjectionVariants {

    private static final ProjectionVariant GROUPED = new GroupedProjection();
    private static final ProjectionVariant NAMED_TYPE = new NamedTypeProjection();
    private static final ProjectionVariant EXPLICIT_DTO = new ExplicitDtoProjection();
    private static final ProjectionVariant ANONYMOUS = new AnonymousProjection();

    public ProjectionVariant select(CallSite site, TypeRef sourceType) {
        if (sourceType.isGroup()) {
            return GROUPED;
        }
        if (site.getBody() instanceof ShapeNode shape && shape.isNamed()) {
            return NAMED_TYPE;
        }
        if (site.getName() != null) {
            return EXPLICIT_DTO;
        }
        return ANONYMOUS;
    }
}
