package com.shapecraft.generator.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Captured variable declared on a projection, e.g. {@code String prefix}.
 */
@Value
public class CaptureDeclaration {
    @NonNull TypeExpr type;
    @NonNull String name;
}
