package com.shapecraft.generator.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shapecraft.generator.cli.model.GenerateOptions;
import com.shapecraft.generator.cli.model.ValidatedGenerateOptions;
import com.shapecraft.generator.codegen.GeneratorResult;
import com.shapecraft.generator.codegen.model.core.context.Diagnostic;
import com.shapecraft.generator.codegen.model.core.context.ToolDiagnostics;
import com.shapecraft.generator.codegen.model.output.GeneratedFile;

/**
 * Responsible only for printing CLI output for the "generate" command.
 * No validation, no execution, no prompting.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    public void printBanner(GenerateOptions o, ValidatedGenerateOptions v) {
        log.info("=================================================");
        log.info("Shapecraft Projection Generator");
        log.info("=================================================");
        log.info("Shapes: {}", v.getNormalizedShapesPath());
        log.info("Schema File: {}", o.getSchemaFile() != null ? o.getSchemaFile().toAbsolutePath() : "None");
        log.info("Class Path: {}", v.getClasspath().isEmpty() ? "None" : v.getClasspath());
        log.info("Default Package: {}", o.getDefaultPackage());
        log.info("DTO Style: {}", o.getDtoStyle());
        log.info("Hash Length: {}", o.getHashLength());
        log.info("Output Directory: {}", v.getNormalizedOutputDir() != null ? v.getNormalizedOutputDir() : "None");
        if (o.isDryRun()) {
            log.info("Dry Run: nothing will be written");
        }
        log.info("=================================================");
    }

    public void printSuccess(GeneratorResult result) {
        log.info("");
        log.info("=================================================");
        log.info(result.getDiagnostics().hasErrors() ? "GENERATION COMPLETED WITH ERRORS" : "GENERATION SUCCESSFUL");
        log.info("=================================================");
        log.info("Output Path: {}", result.isDryRun() ? "None (dry run)" : result.getOutputPath().toAbsolutePath());
        log.info("Shape Files Parsed: {}", result.getShapeFilesParsed());
        log.info("Call Sites: {} ({} failed)", result.getCallSites(), result.getFailedCallSites());
        log.info("Structures Analysed: {}", result.getStructuresAnalysed());
        log.info("DTO Types Generated: {}", result.getDtoTypesGenerated());
        log.info("Projection Classes Generated: {}", result.getProjectionClassesGenerated());

        if (result.isDryRun()) {
            log.info("");
            log.info("Files (not written):");
            for (GeneratedFile file : result.getFiles()) {
                log.info("  {}", file.getPath());
            }
        }

        printDiagnostics(result.getDiagnostics());
        log.info("=================================================");
    }

    public void printFailure(GeneratorResult result) {
        log.error("Generation failed: {}", result.getErrorMessage());
        printDiagnostics(result.getDiagnostics());
    }

    private void printDiagnostics(ToolDiagnostics diagnostics) {
        if (diagnostics == null || diagnostics.getEntries().isEmpty()) {
            return;
        }
        log.info("");
        log.info("Diagnostics: {} error(s), {} warning(s), {} info",
                diagnostics.getErrors().size(), diagnostics.getWarnings().size(), diagnostics.getInfos().size());
        for (Diagnostic d : diagnostics.getErrors()) {
            log.error("  {}", d);
        }
        for (Diagnostic d : diagnostics.getWarnings()) {
            log.warn("  {}", d);
        }
        for (Diagnostic d : diagnostics.getInfos()) {
            log.info("  {}", d);
        }
    }
}
