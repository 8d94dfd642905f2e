package com.shapecraft.generator.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum UnaryOperator {
    NOT("!"),
    NEGATE("-");

    private final String symbol;
}
