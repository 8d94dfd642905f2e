package com.shapecraft.generator.codegen;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.shapecraft.generator.codegen.model.core.context.ToolDiagnostics;
import com.shapecraft.generator.codegen.model.output.GeneratedFile;

import lombok.Builder;
import lombok.Data;

/**
 * Result of a generation run.
 */
@Data
@Builder
public class GeneratorResult {
    private boolean success;
    private String errorMessage;
    private Path outputPath;
    private boolean dryRun;

    private int shapeFilesParsed;
    private int callSites;
    private int failedCallSites;
    private int structuresAnalysed;
    private int dtoTypesGenerated;
    private int projectionClassesGenerated;

    @Builder.Default
    private List<GeneratedFile> files = new ArrayList<>();
    @Builder.Default
    private ToolDiagnostics diagnostics = new ToolDiagnostics();

    public static GeneratorResult failure(String errorMessage) {
        return GeneratorResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }

    public static GeneratorResult failure(String errorMessage, ToolDiagnostics diagnostics) {
        return GeneratorResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .diagnostics(diagnostics)
                .build();
    }
}
