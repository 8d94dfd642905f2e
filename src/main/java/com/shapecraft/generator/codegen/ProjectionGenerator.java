package com.shapecraft.generator.codegen;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shapecraft.generator.codegen.cache.CompilationCache;
import com.shapecraft.generator.codegen.exception.IdentityCollisionException;
import com.shapecraft.generator.codegen.model.core.context.DiagnosticCode;
import com.shapecraft.generator.codegen.model.core.context.ToolDiagnostics;
import com.shapecraft.generator.codegen.model.output.GeneratedFileType;
import com.shapecraft.generator.codegen.util.FileWriteUtil;
import com.shapecraft.generator.model.ShapeFile;
import com.shapecraft.generator.parser.ShapeFileLoader;
import com.shapecraft.generator.schema.CompositeTypeSchema;
import com.shapecraft.generator.schema.ReflectionTypeSchema;
import com.shapecraft.generator.schema.SchemaDocument;
import com.shapecraft.generator.schema.SchemaParser;
import com.shapecraft.generator.schema.TypeSchema;

/**
 * Main generator that orchestrates a run: loads the type schema, parses the
 * shape files, compiles them and writes the generated sources.
 */
public class ProjectionGenerator {
    private static final Logger log = LoggerFactory.getLogger(ProjectionGenerator.class);

    private final GeneratorConfig config;
    private final CompilationCache cache;

    public ProjectionGenerator(GeneratorConfig config) {
        this(config, new CompilationCache());
    }

    /**
     * @param cache memo table shared with later runs, e.g. by a watch loop or a build plugin
     */
    public ProjectionGenerator(GeneratorConfig config, CompilationCache cache) {
        this.config = config;
        this.cache = cache;
    }

    /**
     * Generate the DTO and projection sources.
     */
    public GeneratorResult generate() {
        ToolDiagnostics diagnostics = new ToolDiagnostics();
        try {
            log.info("Starting projection generation...");

            // Step 1: Load the type schema
            log.info("Step 1: Loading type schema...");
            TypeSchema schema = loadSchema(diagnostics);
            if (schema == null) {
                return GeneratorResult.failure("Type schema has errors", diagnostics);
            }

            // Step 2: Parse shape files
            log.info("Step 2: Parsing shape files...");
            List<ShapeFile> shapeFiles = new ShapeFileLoader().loadAll(config.getShapesPath(), diagnostics);
            if (shapeFiles.isEmpty()) {
                return GeneratorResult.failure("No shape files found in " + config.getShapesPath(), diagnostics);
            }

            // Step 3: Analyse, deduplicate and emit
            log.info("Step 3: Compiling projections...");
            CompilationOutput output = new ProjectionCompiler(config, schema, cache).compile(shapeFiles);
            diagnostics.addAll(output.getDiagnostics());

            // Step 4: Write sources
            if (config.isDryRun()) {
                log.info("Step 4: Dry run, {} file(s) not written", output.getFiles().size());
            } else {
                log.info("Step 4: Writing {} file(s) to {}...", output.getFiles().size(), config.getOutputDir());
                prepareOutputDirectory();
                FileWriteUtil.writeAll(config.getOutputDir(), output.getFiles());
            }

            log.info("Projection generation complete!");

            return GeneratorResult.builder()
                    .success(true)
                    .outputPath(config.getOutputDir())
                    .dryRun(config.isDryRun())
                    .shapeFilesParsed(shapeFiles.size())
                    .callSites(output.getCallSites())
                    .failedCallSites(output.getFailedCallSites())
                    .structuresAnalysed(output.getStructures())
                    .dtoTypesGenerated((int) output.count(GeneratedFileType.DTO))
                    .projectionClassesGenerated((int) output.count(GeneratedFileType.PROJECTIONS))
                    .files(output.getFiles())
                    .diagnostics(diagnostics)
                    .build();

        } catch (IdentityCollisionException e) {
            log.error("Generation aborted: {}", e.getMessage());
            diagnostics.error(DiagnosticCode.IDENTITY_COLLISION, null, e.getMessage());
            return GeneratorResult.failure(e.getMessage(), diagnostics);
        } catch (Exception e) {
            log.error("Generation failed", e);
            return GeneratorResult.failure(e.getMessage(), diagnostics);
        }
    }

    /**
     * Schema from the text schema file and the class path, the text schema taking
     * precedence; null when the text schema has errors.
     */
    TypeSchema loadSchema(ToolDiagnostics diagnostics) throws IOException {
        List<TypeSchema> schemas = new ArrayList<>();
        if (config.getSchemaFile() != null) {
            SchemaDocument doc = new SchemaParser().parse(config.getSchemaFile());
            if (doc.hasErrors()) {
                doc.getErrors().forEach(error -> diagnostics.error(DiagnosticCode.SCHEMA_ERROR,
                        config.getSchemaFile().toString(), error));
                log.error("Schema file has errors: {}", doc.getErrors());
                return null;
            }
            schemas.add(doc.getSchema());
        }
        List<Path> classpath = config.getClasspath() != null ? config.getClasspath() : List.of();
        if (!classpath.isEmpty()) {
            URL[] urls = new URL[classpath.size()];
            for (int i = 0; i < classpath.size(); i++) {
                urls[i] = toUrl(classpath.get(i));
            }
            ClassLoader loader = new URLClassLoader(urls, getClass().getClassLoader());
            schemas.add(new ReflectionTypeSchema(loader, classpathFingerprint(classpath)));
        }
        log.info("Type schema from {} source(s)", schemas.size());
        return schemas.size() == 1 ? schemas.get(0) : new CompositeTypeSchema(schemas);
    }

    private static URL toUrl(Path entry) {
        try {
            return entry.toUri().toURL();
        } catch (MalformedURLException e) {
            throw new IllegalArgumentException("Invalid class path entry: " + entry, e);
        }
    }

    /**
     * Entries with the latest modification time found below each of them.
     */
    private static String classpathFingerprint(List<Path> classpath) throws IOException {
        StringBuilder sb = new StringBuilder();
        for (Path entry : classpath) {
            long lastModified = 0;
            if (Files.exists(entry)) {
                try (Stream<Path> walk = Files.walk(entry)) {
                    lastModified = walk.mapToLong(ProjectionGenerator::lastModified).max().orElse(0);
                }
            }
            sb.append(entry.toAbsolutePath()).append('@').append(lastModified).append(';');
        }
        return StructuralSignatureCalculator.sha256Hex(sb.toString());
    }

    private static long lastModified(Path path) {
        try {
            return Files.getLastModifiedTime(path).toMillis();
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read modification time of " + path, e);
        }
    }

    private void prepareOutputDirectory() throws IOException {
        Path outputDir = config.getOutputDir();
        if (Files.exists(outputDir)) {
            if (config.isForce()) {
                FileWriteUtil.deleteDirectory(outputDir);
            } else if (!isEmptyDirectory(outputDir)) {
                throw new IOException("Output directory already exists: " + outputDir);
            }
        }
        Files.createDirectories(outputDir);
    }

    private static boolean isEmptyDirectory(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            return false;
        }
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.findAny().isEmpty();
        }
    }
}
