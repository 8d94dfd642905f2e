package com.shapecraft.generator.codegen.model;

import java.util.Optional;

import com.shapecraft.generator.model.ExprNode;
import com.shapecraft.generator.schema.TypeRef;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A resolved field of a {@link Structure}.
 */
@Value
@Builder
public class StructureField {
    @NonNull String name;
    /** Source expression the field is computed from. */
    @NonNull ExprNode expression;
    /** Type of the DTO field; for nested fields the DTO type or a collection of it. */
    @NonNull TypeRef resolvedType;
    boolean nullable;
    /** Nested structure for nested object and nested collection fields, otherwise null. */
    Structure nestedStructure;
    /** Whether the owning structure targets a named type instead of a generated DTO. */
    boolean fromNamedSubtype;
    @NonNull FieldShape shape;
    @NonNull NullabilityRule nullabilityRule;
    /** Guard every hop of unknown nullability when rewriting the forward access. */
    boolean defensiveGuards;
    /** A null source collection becomes an empty collection instead of null. */
    boolean emptyCollectionFallback;
    /** Human-readable origin, e.g. {@code Order.customer?.name}. */
    String lineage;
    /**
     * Member chain from the owning structure's source object, or null when the
     * value is not a pure member chain and cannot be written back.
     */
    SourcePath sourcePath;

    public Optional<Structure> nested() {
        return Optional.ofNullable(nestedStructure);
    }

    public boolean isNested() {
        return nestedStructure != null;
    }

    /**
     * Whether the reverse transform can write this field back. Nested objects
     * may have an empty path: they are applied to the owning source object.
     */
    public boolean isReversible() {
        return sourcePath != null;
    }
}
