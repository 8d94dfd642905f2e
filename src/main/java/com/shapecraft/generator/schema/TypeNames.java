package com.shapecraft.generator.schema;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import lombok.experimental.UtilityClass;

/**
 * Well-known Java type names: primitives and their boxes, simple names that
 * resolve without an import, and the containers treated as collections.
 */
@UtilityClass
public class TypeNames {

    private final Map<String, String> BOXES = Map.of(
            "boolean", "java.lang.Boolean",
            "byte", "java.lang.Byte",
            "short", "java.lang.Short",
            "int", "java.lang.Integer",
            "long", "java.lang.Long",
            "float", "java.lang.Float",
            "double", "java.lang.Double",
            "char", "java.lang.Character");

    private final Map<String, String> WELL_KNOWN = new LinkedHashMap<>();

    private final Map<String, CollectionKind> CONTAINERS = Map.ofEntries(
            Map.entry("java.util.List", CollectionKind.LIST),
            Map.entry("java.util.ArrayList", CollectionKind.LIST),
            Map.entry("java.util.LinkedList", CollectionKind.LIST),
            Map.entry("java.util.Set", CollectionKind.SET),
            Map.entry("java.util.HashSet", CollectionKind.SET),
            Map.entry("java.util.LinkedHashSet", CollectionKind.SET),
            Map.entry("java.util.SortedSet", CollectionKind.SET),
            Map.entry("java.util.TreeSet", CollectionKind.SET),
            Map.entry("java.util.Collection", CollectionKind.SEQUENCE),
            Map.entry("java.lang.Iterable", CollectionKind.SEQUENCE),
            Map.entry("java.util.stream.Stream", CollectionKind.SEQUENCE));

    static {
        for (String name : Set.of("String", "Object", "Integer", "Long", "Double", "Float", "Short", "Byte",
                "Character", "Boolean", "Number", "Iterable", "CharSequence")) {
            WELL_KNOWN.put(name, "java.lang." + name);
        }
        for (String name : Set.of("List", "ArrayList", "LinkedList", "Set", "HashSet", "LinkedHashSet",
                "SortedSet", "TreeSet", "Collection", "Map", "UUID")) {
            WELL_KNOWN.put(name, "java.util." + name);
        }
        for (String name : Set.of("BigDecimal", "BigInteger")) {
            WELL_KNOWN.put(name, "java.math." + name);
        }
        for (String name : Set.of("LocalDate", "LocalDateTime", "LocalTime", "Instant", "OffsetDateTime",
                "ZonedDateTime", "Duration")) {
            WELL_KNOWN.put(name, "java.time." + name);
        }
        WELL_KNOWN.put("Stream", "java.util.stream.Stream");
    }

    public boolean isPrimitive(String name) {
        return BOXES.containsKey(name);
    }

    public String box(String primitive) {
        return BOXES.get(primitive);
    }

    public boolean isBox(String qualifiedName) {
        return BOXES.containsValue(qualifiedName);
    }

    public String unbox(String qualifiedName) {
        return BOXES.entrySet().stream()
                .filter(e -> e.getValue().equals(qualifiedName))
                .map(Map.Entry::getKey)
                .findFirst()
                .orElse(qualifiedName);
    }

    public Optional<String> wellKnown(String simpleName) {
        return Optional.ofNullable(WELL_KNOWN.get(simpleName));
    }

    public Optional<CollectionKind> containerKind(String qualifiedName) {
        return Optional.ofNullable(CONTAINERS.get(qualifiedName));
    }

    public boolean isJdkType(String qualifiedName) {
        return qualifiedName.startsWith("java.") || qualifiedName.startsWith("javax.");
    }

    /**
     * Default value literal of a primitive type.
     */
    public String primitiveDefault(String primitive) {
        return switch (primitive) {
            case "boolean" -> "false";
            case "char" -> "'\\0'";
            case "long" -> "0L";
            case "float" -> "0.0f";
            case "double" -> "0.0";
            default -> "0";
        };
    }
}
