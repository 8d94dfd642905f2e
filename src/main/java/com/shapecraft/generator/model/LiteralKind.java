package com.shapecraft.generator.model;

public enum LiteralKind {
    INT,
    LONG,
    DOUBLE,
    STRING,
    CHAR,
    BOOLEAN,
    NULL
}
