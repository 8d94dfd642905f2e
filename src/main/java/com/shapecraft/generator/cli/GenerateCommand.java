package com.shapecraft.generator.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shapecraft.generator.cli.exception.OptionsValidationException;
import com.shapecraft.generator.cli.model.GenerateOptions;
import com.shapecraft.generator.cli.model.ValidatedGenerateOptions;
import com.shapecraft.generator.cli.output.GenerateResultsPrinter;
import com.shapecraft.generator.cli.validation.GenerateOptionsValidator;
import com.shapecraft.generator.codegen.GeneratorConfig;
import com.shapecraft.generator.codegen.GeneratorResult;
import com.shapecraft.generator.codegen.ProjectionGenerator;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command generating DTOs and projection transforms from shape files.
 */
@Command(
        name = "generate",
        mixinStandardHelpOptions = true,
        version = "shapecraft-projection-generator 1.0.0",
        description = "Generates DTO types and forward/reverse projection transforms from shape files."
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_GENERATION_FAILED = 1;
    public static final int EXIT_INVALID_OPTIONS = 2;

    @Mixin
    private GenerateOptions options;

    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();
    private final GenerateResultsPrinter printer = new GenerateResultsPrinter();

    @Override
    public Integer call() {
        ValidatedGenerateOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error(error));
            return EXIT_INVALID_OPTIONS;
        }

        printer.printBanner(options, validated);

        try {
            GeneratorResult result = new ProjectionGenerator(toConfig(validated)).generate();
            if (!result.isSuccess()) {
                printer.printFailure(result);
                return EXIT_GENERATION_FAILED;
            }
            printer.printSuccess(result);
            return result.getDiagnostics().hasErrors() ? EXIT_GENERATION_FAILED : EXIT_OK;
        } catch (Exception e) {
            log.error("Generation failed with exception", e);
            return EXIT_GENERATION_FAILED;
        }
    }

    private GeneratorConfig toConfig(ValidatedGenerateOptions v) {
        return GeneratorConfig.builder()
                .schemaFile(options.getSchemaFile())
                .classpath(v.getClasspath())
                .shapesPath(v.getNormalizedShapesPath())
                .outputDir(v.getNormalizedOutputDir())
                .defaultPackage(options.getDefaultPackage())
                .dtoStyle(options.getDtoStyle())
                .prebuiltTransforms(options.isPrebuiltTransforms())
                .arrayNullabilityRemoval(!options.isNoArrayNullabilityRemoval())
                .nestedDtoHashPackage(options.isNestedHashPackage())
                .hashLength(options.getHashLength())
                .lineageComments(!options.isNoLineageComments())
                .parallel(options.isParallel())
                .force(options.isForce())
                .dryRun(options.isDryRun())
                .build();
    }
}
