package com.shapecraft.generator.schema;

import java.util.Optional;
import java.util.Set;

/**
 * Read-only oracle describing source types: their members, member nullability
 * and constructibility. Implementations are never mutated by the generator and
 * may be shared between threads.
 */
public interface TypeSchema {

    Optional<TypeInfo> describe(String typeName);

    /**
     * Fully qualified names this schema knows about up front. Used to resolve
     * simple names; a schema that discovers types lazily may return only a subset.
     */
    Set<String> typeNames();

    /**
     * Content hash of the schema. Two schemas with the same fingerprint describe
     * the same types.
     */
    String fingerprint();

    default Optional<MemberInfo> member(TypeRef owner, String memberName) {
        if (owner == null || !owner.isNamed()) {
            return Optional.empty();
        }
        return describe(owner.getName()).flatMap(type -> type.member(memberName));
    }

    default boolean isDefaultConstructible(TypeRef type) {
        if (type == null || !type.isNamed()) {
            return false;
        }
        return describe(type.getName()).map(TypeInfo::isDefaultConstructible).orElse(false);
    }
}
