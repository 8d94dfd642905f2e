package com.shapecraft.generator.codegen.model.output;

public enum GeneratedFileType {
    DTO,
    PROJECTIONS
}
