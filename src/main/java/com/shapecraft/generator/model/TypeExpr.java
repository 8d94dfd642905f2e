package com.shapecraft.generator.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import lombok.Value;

/**
 * Type as written in a shape or schema file: a (possibly qualified) name with
 * type arguments and array dimensions, or an anonymous type {@code { a: T }}.
 */
@Value
public class TypeExpr {
    String name;
    List<TypeExpr> arguments;
    int arrayDimensions;
    Map<String, TypeExpr> anonymousFields;

    public static TypeExpr named(String name, List<TypeExpr> arguments, int arrayDimensions) {
        return new TypeExpr(name, List.copyOf(arguments), arrayDimensions, Map.of());
    }

    public static TypeExpr anonymous(Map<String, TypeExpr> fields, int arrayDimensions) {
        return new TypeExpr(null, List.of(), arrayDimensions,
                java.util.Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
    }

    public boolean isAnonymous() {
        return name == null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (isAnonymous()) {
            sb.append(anonymousFields.entrySet().stream()
                    .map(e -> e.getKey() + ": " + e.getValue())
                    .collect(Collectors.joining(", ", "{ ", " }")));
        } else {
            sb.append(name);
            if (!arguments.isEmpty()) {
                sb.append(arguments.stream().map(TypeExpr::toString).collect(Collectors.joining(", ", "<", ">")));
            }
        }
        sb.append("[]".repeat(arrayDimensions));
        return sb.toString();
    }
}
