package com.shapecraft.generator.codegen;

import java.nio.file.Path;
import java.util.List;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for the projection generator.
 */
@Data
@Builder
public class GeneratorConfig {
    public static final String DEFAULT_PACKAGE = "generated.projections";
    public static final int DEFAULT_HASH_LENGTH = 8;

    /** Text schema file; optional when the class path describes every source type. */
    private Path schemaFile;
    /** Class path entries inspected by reflection for source types. */
    private List<Path> classpath;
    /** A shape file or a directory searched recursively for {@code *.shape} files. */
    private Path shapesPath;
    private Path outputDir;

    /** Package of shape files that declare none. */
    @Builder.Default
    private String defaultPackage = DEFAULT_PACKAGE;
    @Builder.Default
    private DtoStyle dtoStyle = DtoStyle.CLASS;
    /** Allow static reusable transforms for named projections without captures. */
    private boolean prebuiltTransforms;
    /** Collapse null-safe nested collections to non-null with an empty fallback. */
    @Builder.Default
    private boolean arrayNullabilityRemoval = true;
    /** Place each hash-named DTO in its own {@code shape_<hash>} sub-package. */
    private boolean nestedDtoHashPackage;
    @Builder.Default
    private int hashLength = DEFAULT_HASH_LENGTH;
    @Builder.Default
    private boolean lineageComments = true;
    /** Analyse call sites on a parallel stream. */
    private boolean parallel;
    private boolean force;
    /** Compute everything but write nothing. */
    private boolean dryRun;

    /**
     * Configuration with all defaults, for library use and tests.
     */
    public static GeneratorConfig defaults() {
        return GeneratorConfig.builder().build();
    }

    /**
     * Digest of the settings that shape analysis and naming read. Runs that
     * differ here never share cached call sites.
     */
    public String analysisFingerprint() {
        return String.join(";",
                "package=" + defaultPackage,
                "style=" + dtoStyle,
                "prebuilt=" + prebuiltTransforms,
                "arrays=" + arrayNullabilityRemoval,
                "hashPackage=" + nestedDtoHashPackage,
                "hash=" + hashLength,
                "lineage=" + lineageComments);
    }
}
