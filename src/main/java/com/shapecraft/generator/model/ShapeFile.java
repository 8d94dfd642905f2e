package com.shapecraft.generator.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Parsed content of one shape file.
 */
@Value
@Builder
public class ShapeFile {
    @NonNull String sourceFile;
    String packageName;
    @Singular("importEntry")
    List<String> imports;
    @Singular
    List<ProjectionDeclaration> projections;

    /**
     * File name without directories and extension, used to name the generated
     * projections class.
     */
    public String baseName() {
        String name = sourceFile.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        int dot = name.indexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
