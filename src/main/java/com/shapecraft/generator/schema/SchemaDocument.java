package com.shapecraft.generator.schema;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;

/**
 * Result of parsing a text schema: the schema plus per-line errors.
 */
@Data
public class SchemaDocument {
    private TypeSchema schema;
    private final List<String> errors = new ArrayList<>();

    public void addError(String error) {
        errors.add(error);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
