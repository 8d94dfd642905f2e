package com.shapecraft.generator.schema;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Chains several schemas; the first one describing a type wins.
 */
public class CompositeTypeSchema implements TypeSchema {

    private final List<TypeSchema> delegates;

    public CompositeTypeSchema(List<TypeSchema> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    @Override
    public Optional<TypeInfo> describe(String typeName) {
        for (TypeSchema delegate : delegates) {
            Optional<TypeInfo> info = delegate.describe(typeName);
            if (info.isPresent()) {
                return info;
            }
        }
        return Optional.empty();
    }

    @Override
    public Set<String> typeNames() {
        Set<String> names = new LinkedHashSet<>();
        delegates.forEach(d -> names.addAll(d.typeNames()));
        return names;
    }

    @Override
    public String fingerprint() {
        return delegates.stream().map(TypeSchema::fingerprint).collect(Collectors.joining("+"));
    }
}
