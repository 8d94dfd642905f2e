package com.shapecraft.generator.codegen;

import java.util.List;

import com.shapecraft.generator.codegen.model.core.context.ToolDiagnostics;
import com.shapecraft.generator.codegen.model.output.GeneratedFile;
import com.shapecraft.generator.codegen.model.output.GeneratedFileType;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Everything one compilation produced, before anything is written.
 */
@Value
@Builder
public class CompilationOutput {
    @Singular
    List<GeneratedFile> files;
    @NonNull ToolDiagnostics diagnostics;
    int callSites;
    int failedCallSites;
    /** Structures registered across all call sites, before deduplication. */
    int structures;

    public long count(GeneratedFileType type) {
        return files.stream().filter(f -> f.getType() == type).count();
    }
}
