package com.shapecraft.generator.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Binary operators of the shape DSL with their precedence (higher binds tighter).
 */
@Getter
@AllArgsConstructor
public enum BinaryOperator {
    OR("||", 1),
    AND("&&", 2),
    EQUAL("==", 3),
    NOT_EQUAL("!=", 3),
    LESS("<", 4),
    LESS_OR_EQUAL("<=", 4),
    GREATER(">", 4),
    GREATER_OR_EQUAL(">=", 4),
    ADD("+", 5),
    SUBTRACT("-", 5),
    MULTIPLY("*", 6),
    DIVIDE("/", 6),
    REMAINDER("%", 6);

    private final String symbol;
    private final int precedence;

    public boolean isLogical() {
        return this == OR || this == AND;
    }

    public boolean isEquality() {
        return this == EQUAL || this == NOT_EQUAL;
    }

    public boolean isRelational() {
        return this == LESS || this == LESS_OR_EQUAL || this == GREATER || this == GREATER_OR_EQUAL;
    }

    public boolean isArithmetic() {
        return precedence >= 5;
    }
}
