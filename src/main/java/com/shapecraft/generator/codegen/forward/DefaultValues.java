package com.shapecraft.generator.codegen.forward;

import com.shapecraft.generator.codegen.generator.TypeRenderer;
import com.shapecraft.generator.schema.CollectionKind;
import com.shapecraft.generator.schema.TypeNames;
import com.shapecraft.generator.schema.TypeRef;

import lombok.experimental.UtilityClass;

/**
 * Values a guarded access falls back to when a receiver on the way is null.
 */
@UtilityClass
public class DefaultValues {

    /**
     * Fallback of a non-null field: zero for primitives, the empty string, an
     * empty collection of the declared kind, null for anything else.
     */
    public String forField(TypeRef type, TypeRenderer types) {
        if (type.isPrimitive()) {
            return TypeNames.primitiveDefault(type.getName());
        }
        if (type.isString()) {
            return "\"\"";
        }
        if (type.isCollection()) {
            if (type.getCollectionKind() == CollectionKind.ARRAY) {
                TypeRef element = type.getElementType();
                return "new " + types.renderErased(element) + "[0]";
            }
            if (type.isStream()) {
                return types.reference("java.util.stream.Stream") + ".empty()";
            }
            return "new " + types.reference(implementationOf(type.getName())) + "<"
                    + types.renderBoxed(type.getElementType()) + ">()";
        }
        return "null";
    }

    /**
     * Fallback of a guarded sub-expression: zero for primitives, null otherwise.
     */
    public String forValue(TypeRef type) {
        if (type != null && type.isPrimitive()) {
            return TypeNames.primitiveDefault(type.getName());
        }
        return "null";
    }

    /**
     * Concrete class instantiated for a declared collection container.
     */
    public String implementationOf(String container) {
        return switch (container) {
            case "java.util.LinkedList" -> "java.util.LinkedList";
            case "java.util.Set", "java.util.HashSet", "java.util.LinkedHashSet" -> "java.util.LinkedHashSet";
            case "java.util.SortedSet", "java.util.NavigableSet", "java.util.TreeSet" -> "java.util.TreeSet";
            default -> "java.util.ArrayList";
        };
    }
}
