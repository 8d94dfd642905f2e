package com.shapecraft.generator.codegen.shape;

import java.util.Arrays;
import java.util.Optional;

import lombok.Getter;

/**
 * The sequence combinators understood on collection and group receivers.
 * Operations are matched on the resolved receiver type, never on text alone.
 */
@Getter
public enum SequenceOperation {
    MAP("map", Category.PROJECT),
    FLAT_MAP("flatMap", Category.FLATTEN),
    FILTER("filter", Category.SHAPE_PRESERVING),
    DISTINCT("distinct", Category.SHAPE_PRESERVING),
    SORTED("sorted", Category.SHAPE_PRESERVING),
    SORTED_BY("sortedBy", Category.SHAPE_PRESERVING),
    LIMIT("limit", Category.SHAPE_PRESERVING),
    SKIP("skip", Category.SHAPE_PRESERVING),
    GROUP_BY("groupBy", Category.GROUP),
    TO_LIST("toList", Category.MATERIALIZE),
    TO_SET("toSet", Category.MATERIALIZE),
    TO_ARRAY("toArray", Category.MATERIALIZE),
    COUNT("count", Category.AGGREGATE),
    SUM("sum", Category.AGGREGATE),
    AVERAGE("average", Category.AGGREGATE),
    MIN("min", Category.AGGREGATE),
    MAX("max", Category.AGGREGATE),
    FIRST("first", Category.ELEMENT),
    LAST("last", Category.ELEMENT),
    ANY("any", Category.AGGREGATE),
    ALL("all", Category.AGGREGATE);

    public enum Category {
        PROJECT,
        FLATTEN,
        SHAPE_PRESERVING,
        GROUP,
        MATERIALIZE,
        AGGREGATE,
        ELEMENT
    }

    private final String methodName;
    private final Category category;

    SequenceOperation(String methodName, Category category) {
        this.methodName = methodName;
        this.category = category;
    }

    public static Optional<SequenceOperation> byName(String methodName) {
        return Arrays.stream(values()).filter(op -> op.methodName.equals(methodName)).findFirst();
    }

    public boolean isMaterialization() {
        return category == Category.MATERIALIZE;
    }

    /**
     * Operations after which elements are still the projected elements.
     */
    public boolean preservesElements() {
        return category == Category.SHAPE_PRESERVING || category == Category.MATERIALIZE;
    }
}
