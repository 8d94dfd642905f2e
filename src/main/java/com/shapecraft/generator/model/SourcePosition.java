package com.shapecraft.generator.model;

import lombok.Value;

/**
 * Line and column of a node in a shape file. Both are 1-based.
 */
@Value
public class SourcePosition {
    public static final SourcePosition UNKNOWN = new SourcePosition(0, 0);

    int line;
    int column;

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
