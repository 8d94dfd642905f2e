package com.shapecraft.generator.codegen.model.output;

import java.nio.file.Path;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Represents a generated file artifact (path relative to the output directory + contents).
 *
 * Pure structure only.
 */
@Value
@Builder(toBuilder = true)
public class GeneratedFile {

    @NonNull
    Path path;

    @NonNull
    String contents;

    @NonNull
    GeneratedFileType type;

    /** Fully qualified name of the top-level type declared in the file. */
    @NonNull
    String typeName;
}
