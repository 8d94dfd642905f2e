package com.shapecraft.generator.model;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * One entry of a shape literal. {@code name} is null when the entry was written
 * without a name and must be derived from its value.
 */
@Value
public class ShapeEntry {
    String name;
    @NonNull ExprNode value;
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    SourcePosition position;

    public boolean isExplicitlyNamed() {
        return name != null;
    }
}
