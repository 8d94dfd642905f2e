package com.shapecraft.generator.schema;

public enum TypeKind {
    PRIMITIVE,
    NAMED,
    COLLECTION,
    GROUP,
    ANONYMOUS,
    UNRESOLVED,
    NULL
}
