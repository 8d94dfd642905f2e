package com.shapecraft.generator.schema;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import com.shapecraft.generator.codegen.exception.UnresolvedTypeException;
import com.shapecraft.generator.model.TypeExpr;

/**
 * Turns type expressions as written in shape and schema files into
 * {@link TypeRef}s.
 *
 * Simple names resolve in this order: primitives, single-type imports,
 * well-known JDK types, the current package, wildcard imports, and finally any
 * unique known type with that simple name.
 */
public class TypeNameResolver {

    public static final String GROUP_TYPE = "group";

    private final List<String> imports;
    private final String packageName;
    private final Collection<String> knownTypes;
    private final Predicate<String> typeExists;

    public TypeNameResolver(List<String> imports, String packageName, Collection<String> knownTypes,
                            Predicate<String> typeExists) {
        this.imports = List.copyOf(imports);
        this.packageName = packageName;
        this.knownTypes = knownTypes;
        this.typeExists = typeExists;
    }

    public static TypeNameResolver forSchema(List<String> imports, String packageName, TypeSchema schema) {
        return new TypeNameResolver(imports, packageName, schema.typeNames(),
                name -> schema.typeNames().contains(name) || schema.describe(name).isPresent());
    }

    public TypeRef toTypeRef(TypeExpr expr) {
        TypeRef base;
        if (expr.isAnonymous()) {
            Map<String, TypeRef> fields = new LinkedHashMap<>();
            // declared member types stay primitive; only the map values are boxed
            expr.getAnonymousFields().forEach((name, type) -> fields.put(name, toTypeRef(type)));
            base = TypeRef.anonymous(fields);
        } else if (GROUP_TYPE.equals(expr.getName()) && expr.getArguments().size() == 2) {
            base = TypeRef.group(toTypeRef(expr.getArguments().get(0)), toTypeRef(expr.getArguments().get(1)));
        } else {
            String qualified = resolveName(expr.getName());
            if (TypeNames.isPrimitive(qualified)) {
                base = TypeRef.primitive(qualified);
            } else {
                Optional<CollectionKind> container = TypeNames.containerKind(qualified);
                if (container.isPresent()) {
                    TypeRef element = expr.getArguments().isEmpty()
                            ? TypeRef.named("java.lang.Object")
                            : toTypeRef(expr.getArguments().get(0));
                    base = TypeRef.collection(container.get(), qualified, element.boxed());
                } else {
                    base = TypeRef.named(qualified);
                }
            }
        }
        for (int i = 0; i < expr.getArrayDimensions(); i++) {
            base = TypeRef.array(base);
        }
        return base;
    }

    /**
     * Fully qualified name for a simple or qualified name.
     *
     * @throws UnresolvedTypeException when a simple name matches nothing
     */
    public String resolveName(String name) {
        int dot = name.indexOf('.');
        if (dot > 0) {
            String head = name.substring(0, dot);
            if (Character.isUpperCase(head.charAt(0))) {
                Optional<String> outer = resolveSimple(head);
                if (outer.isPresent()) {
                    return outer.get() + name.substring(dot);
                }
            }
            return name;
        }
        return resolveSimple(name)
                .orElseThrow(() -> new UnresolvedTypeException("Cannot resolve type '" + name + "'"));
    }

    private Optional<String> resolveSimple(String simpleName) {
        if (TypeNames.isPrimitive(simpleName)) {
            return Optional.of(simpleName);
        }
        for (String imported : imports) {
            if (!imported.endsWith(".*") && imported.endsWith("." + simpleName)) {
                return Optional.of(imported);
            }
        }
        Optional<String> wellKnown = TypeNames.wellKnown(simpleName);
        if (wellKnown.isPresent()) {
            return wellKnown;
        }
        if (packageName != null && !packageName.isEmpty() && typeExists.test(packageName + "." + simpleName)) {
            return Optional.of(packageName + "." + simpleName);
        }
        for (String imported : imports) {
            if (imported.endsWith(".*")) {
                String candidate = imported.substring(0, imported.length() - 1) + simpleName;
                if (typeExists.test(candidate)) {
                    return Optional.of(candidate);
                }
            }
        }
        List<String> matches = knownTypes.stream()
                .filter(known -> known.equals(simpleName) || known.endsWith("." + simpleName))
                .distinct()
                .collect(Collectors.toList());
        if (matches.size() == 1) {
            return Optional.of(matches.get(0));
        }
        if (matches.size() > 1) {
            throw new UnresolvedTypeException("Type '" + simpleName + "' is ambiguous: " + matches);
        }
        return Optional.empty();
    }
}
