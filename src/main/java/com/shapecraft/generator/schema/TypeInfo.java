package com.shapecraft.generator.schema;

import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Schema description of a source type.
 */
@Value
@Builder
public class TypeInfo {
    @NonNull String name;
    @Singular
    List<MemberInfo> members;
    /** Whether generated code may call a public no-argument constructor. */
    @Builder.Default
    boolean defaultConstructible = true;

    public Optional<MemberInfo> member(String memberName) {
        return members.stream().filter(m -> m.getName().equals(memberName)).findFirst();
    }

    public String simpleName() {
        return name.substring(name.lastIndexOf('.') + 1);
    }
}
