package com.shapecraft.generator.codegen.dedup;

import java.util.List;

import com.shapecraft.generator.codegen.model.Structure;

import lombok.Value;

/**
 * The single DTO type generated for one content hash.
 */
@Value
public class GeneratedType {
    String packageName;
    String simpleName;
    /** Representative structure; every structure with this hash has the same fields. */
    Structure structure;
    /** Whether the name was declared by a projection rather than derived from the hash. */
    boolean explicit;
    /** Other declared DTO names that resolved to this type. */
    List<String> aliases;

    public String qualifiedName() {
        return packageName.isEmpty() ? simpleName : packageName + "." + simpleName;
    }
}
