package com.shapecraft.generator.codegen.dto;

import com.shapecraft.generator.codegen.DtoStyle;
import com.shapecraft.generator.codegen.util.NamingUtil;
import com.shapecraft.generator.schema.TypeRef;

import lombok.experimental.UtilityClass;

/**
 * Java member names of generated DTOs, shared by the DTO generator and by the
 * code that reads DTOs back.
 */
@UtilityClass
public class DtoNaming {

    public String fieldName(String name) {
        return NamingUtil.safeIdentifier(name);
    }

    public String getterName(String name, TypeRef type) {
        String prefix = type.isPrimitive() && "boolean".equals(type.getName()) ? "is" : "get";
        return prefix + capitalize(fieldName(name));
    }

    public String setterName(String name) {
        return "set" + capitalize(fieldName(name));
    }

    /**
     * Expression reading a field of a DTO held in {@code target}.
     */
    public String readExpression(String target, String name, TypeRef type, DtoStyle style) {
        if (style == DtoStyle.RECORD) {
            return target + "." + fieldName(name) + "()";
        }
        return target + "." + getterName(name, type) + "()";
    }

    private String capitalize(String name) {
        return name.substring(0, 1).toUpperCase() + name.substring(1);
    }
}
