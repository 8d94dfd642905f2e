package com.shapecraft.generator.schema;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Schema backed by explicit {@link TypeInfo} descriptions.
 */
public class InMemoryTypeSchema implements TypeSchema {

    private final Map<String, TypeInfo> types;
    private final String fingerprint;

    private InMemoryTypeSchema(Map<String, TypeInfo> types) {
        this.types = Collections.unmodifiableMap(new LinkedHashMap<>(types));
        this.fingerprint = computeFingerprint(this.types);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Optional<TypeInfo> describe(String typeName) {
        return Optional.ofNullable(types.get(typeName));
    }

    @Override
    public Set<String> typeNames() {
        return types.keySet();
    }

    @Override
    public String fingerprint() {
        return fingerprint;
    }

    private static String computeFingerprint(Map<String, TypeInfo> types) {
        StringBuilder sb = new StringBuilder();
        types.values().stream()
                .sorted((a, b) -> a.getName().compareTo(b.getName()))
                .forEach(type -> {
                    sb.append("TYPE:").append(type.getName())
                            .append(":CTOR=").append(type.isDefaultConstructible()).append('\n');
                    for (MemberInfo member : type.getMembers()) {
                        sb.append("  MEMBER:").append(member.getName())
                                .append(':').append(member.getType().descriptor())
                                .append(':').append(member.getNullability())
                                .append(':').append(member.getReadAccess())
                                .append(':').append(member.getWriteAccess()).append('\n');
                    }
                });
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(sb.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static class Builder {
        private final Map<String, TypeInfo> types = new LinkedHashMap<>();

        public Builder type(TypeInfo type) {
            types.put(type.getName(), type);
            return this;
        }

        public InMemoryTypeSchema build() {
            return new InMemoryTypeSchema(types);
        }
    }
}
