package com.shapecraft.generator.codegen.model;

import java.util.List;
import java.util.Optional;

import com.shapecraft.generator.schema.TypeRef;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Canonical, immutable model of a shape. Built bottom-up: nested structures are
 * complete before their parent is hashed.
 *
 * Two structures are the same shape when their content hashes are equal;
 * everything else (source type, parameter name, anchor, hint) describes where
 * this instance came from and never enters the hash.
 */
@Value
@Builder(toBuilder = true)
public class Structure {
    @NonNull TypeRef sourceType;
    @Singular
    List<StructureField> fields;
    @NonNull String contentHash;
    /** Canonical text the hash was computed from. */
    @NonNull String signature;
    /** Fully qualified name of a named target type, null for generated DTOs. */
    String targetType;
    /** Preferred base name of the generated type. */
    @NonNull String hintName;
    /** Parameter the field expressions are written against. */
    @NonNull String parameterName;
    /**
     * Member chain from the parent structure's source to this structure's source;
     * empty for roots and collection elements, null when no common source exists.
     */
    SourcePath anchor;

    public boolean isNamedTarget() {
        return targetType != null;
    }

    public Optional<StructureField> field(String name) {
        return fields.stream().filter(f -> f.getName().equals(name)).findFirst();
    }
}
