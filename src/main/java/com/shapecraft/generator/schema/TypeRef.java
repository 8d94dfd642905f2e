package com.shapecraft.generator.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Statically known type of a member or expression.
 *
 * {@code name} holds the fully qualified name for primitive and named types, the
 * container class for collections (null for arrays) and the content hash of the
 * backing structure for anonymous DTO types.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TypeRef {
    public static final TypeRef UNRESOLVED = new TypeRef(TypeKind.UNRESOLVED, null, null, null, null, Map.of(), null);
    public static final TypeRef NULL = new TypeRef(TypeKind.NULL, null, null, null, null, Map.of(), null);

    TypeKind kind;
    String name;
    CollectionKind collectionKind;
    TypeRef elementType;
    TypeRef keyType;
    Map<String, TypeRef> fields;
    AnonymousOrigin origin;

    public static TypeRef primitive(String name) {
        return new TypeRef(TypeKind.PRIMITIVE, name, null, null, null, Map.of(), null);
    }

    public static TypeRef named(String qualifiedName) {
        return new TypeRef(TypeKind.NAMED, qualifiedName, null, null, null, Map.of(), null);
    }

    public static TypeRef collection(CollectionKind kind, String container, TypeRef element) {
        return new TypeRef(TypeKind.COLLECTION, kind == CollectionKind.ARRAY ? null : container, kind,
                element, null, Map.of(), null);
    }

    public static TypeRef list(TypeRef element) {
        return collection(CollectionKind.LIST, "java.util.List", element.boxed());
    }

    public static TypeRef set(TypeRef element) {
        return collection(CollectionKind.SET, "java.util.Set", element.boxed());
    }

    public static TypeRef array(TypeRef element) {
        return collection(CollectionKind.ARRAY, null, element);
    }

    /**
     * Lazy sequence produced by a pipeline step that was not materialized yet.
     */
    public static TypeRef sequence(TypeRef element) {
        return collection(CollectionKind.SEQUENCE, "java.util.stream.Stream", element.boxed());
    }

    public static TypeRef group(TypeRef key, TypeRef element) {
        return new TypeRef(TypeKind.GROUP, null, null, element.boxed(), key.boxed(), Map.of(), null);
    }

    public static TypeRef anonymous(Map<String, TypeRef> fields) {
        return new TypeRef(TypeKind.ANONYMOUS, null, null, null, null,
                Collections.unmodifiableMap(new LinkedHashMap<>(fields)), AnonymousOrigin.MAP);
    }

    public static TypeRef anonymousDto(String structureHash, Map<String, TypeRef> fields) {
        return new TypeRef(TypeKind.ANONYMOUS, structureHash, null, null, null,
                Collections.unmodifiableMap(new LinkedHashMap<>(fields)), AnonymousOrigin.DTO);
    }

    public boolean isPrimitive() {
        return kind == TypeKind.PRIMITIVE;
    }

    public boolean isNamed() {
        return kind == TypeKind.NAMED;
    }

    public boolean isCollection() {
        return kind == TypeKind.COLLECTION;
    }

    public boolean isArray() {
        return isCollection() && collectionKind == CollectionKind.ARRAY;
    }

    public boolean isStream() {
        return isCollection() && "java.util.stream.Stream".equals(name);
    }

    public boolean isGroup() {
        return kind == TypeKind.GROUP;
    }

    public boolean isAnonymous() {
        return kind == TypeKind.ANONYMOUS;
    }

    public boolean isResolved() {
        return kind != TypeKind.UNRESOLVED;
    }

    public boolean isString() {
        return isNamed() && "java.lang.String".equals(name);
    }

    public boolean isBoolean() {
        return "boolean".equals(name) || "java.lang.Boolean".equals(name);
    }

    public boolean isNumeric() {
        TypeRef unboxed = unboxed();
        return (unboxed.isPrimitive() && !"boolean".equals(unboxed.name))
                || "java.math.BigDecimal".equals(name) || "java.math.BigInteger".equals(name);
    }

    /**
     * Reference types, including boxes of primitives, may hold null.
     */
    public boolean isReference() {
        return kind != TypeKind.PRIMITIVE;
    }

    public TypeRef boxed() {
        if (isPrimitive()) {
            return named(TypeNames.box(name));
        }
        return this;
    }

    public TypeRef unboxed() {
        if (isNamed() && TypeNames.isBox(name)) {
            return primitive(TypeNames.unbox(name));
        }
        return this;
    }

    public String simpleName() {
        if (name == null) {
            return kind.name().toLowerCase();
        }
        return name.substring(name.lastIndexOf('.') + 1);
    }

    /**
     * Canonical, location-free description used for hashing and comparison.
     */
    public String descriptor() {
        return switch (kind) {
            case PRIMITIVE, NAMED -> name;
            case COLLECTION -> collectionKind == CollectionKind.ARRAY
                    ? elementType.descriptor() + "[]"
                    : name + "<" + elementType.descriptor() + ">";
            case GROUP -> "group<" + keyType.descriptor() + "," + elementType.descriptor() + ">";
            case ANONYMOUS -> origin == AnonymousOrigin.DTO
                    ? "#" + name
                    : fields.entrySet().stream()
                            .map(e -> e.getKey() + ":" + e.getValue().descriptor())
                            .collect(Collectors.joining(",", "{", "}"));
            case UNRESOLVED -> "?";
            case NULL -> "null";
        };
    }

    @Override
    public String toString() {
        return descriptor();
    }
}
