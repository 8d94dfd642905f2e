package com.shapecraft.generator.schema;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One readable (and possibly writable) member of a schema type.
 */
@Value
@Builder
public class MemberInfo {
    @NonNull String name;
    @NonNull TypeRef type;
    @Builder.Default
    Nullability nullability = Nullability.UNKNOWN;
    @Builder.Default
    AccessStyle readAccess = AccessStyle.GETTER;
    /** Explicit getter name; derived from the member name when null. */
    String getterName;
    @Builder.Default
    AccessStyle writeAccess = AccessStyle.NONE;
    /** Explicit setter name; derived from the member name when null. */
    String setterName;

    public boolean isReadable() {
        return readAccess != AccessStyle.NONE;
    }

    public boolean isWritable() {
        return writeAccess == AccessStyle.SETTER || writeAccess == AccessStyle.FIELD;
    }

    public String accessorName() {
        if (getterName != null) {
            return getterName;
        }
        return ("boolean".equals(type.getName()) ? "is" : "get") + capitalize(name);
    }

    public String mutatorName() {
        return setterName != null ? setterName : "set" + capitalize(name);
    }

    /**
     * Java expression reading this member from {@code target}.
     */
    public String readExpression(String target) {
        return switch (readAccess) {
            case FIELD -> target + "." + name;
            case RECORD -> target + "." + name + "()";
            default -> target + "." + accessorName() + "()";
        };
    }

    /**
     * Java statement writing {@code value} into this member of {@code target}.
     */
    public String writeStatement(String target, String value) {
        if (writeAccess == AccessStyle.FIELD) {
            return target + "." + name + " = " + value + ";";
        }
        return target + "." + mutatorName() + "(" + value + ");";
    }

    private static String capitalize(String s) {
        return s.isEmpty() ? s : Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
