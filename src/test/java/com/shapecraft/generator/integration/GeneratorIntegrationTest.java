package com.shapecraft.generator.integration;

import com.shapecraft.generator.GeneratorApplication;
import com.shapecraft.generator.ShapeFixtures;
import com.shapecraft.generator.cli.GenerateCommand;
import com.shapecraft.generator.codegen.GeneratorConfig;
import com.shapecraft.generator.codegen.GeneratorResult;
import com.shapecraft.generator.codegen.ProjectionGenerator;
import com.shapecraft.generator.codegen.model.core.context.DiagnosticCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for the complete generation process.
 */
class GeneratorIntegrationTest {

    @TempDir
    Path tempDir;

    private Path schemaFile;
    private Path shapesDir;
    private Path outputDir;

    @BeforeEach
    void setUp() throws IOException {
        schemaFile = Files.writeString(tempDir.resolve("domain.schema"), ShapeFixtures.ORDER_SCHEMA);
        shapesDir = Files.createDirectories(tempDir.resolve("shapes"));
        outputDir = tempDir.resolve("generated");

        Files.writeString(shapesDir.resolve("orders.shape"), """
            package com.acme.views;
            import com.acme.*;

            projection OrderRow from Order o => {
                o.id,
                customerName: o.customer?.name,
                lines: o.items.map(i => { i.sku, i.quantity }).toList()
            };
            projection from Order o => { o.number, o.total };
            """);

        Files.createDirectories(shapesDir.resolve("reports"));
        Files.writeString(shapesDir.resolve("reports/customers.shape"), """
            package com.acme.reports;
            import com.acme.*;

            projection CustomerCard from Customer c => { c.name, city: c.address?.city };
            """);

        // ignored, wrong extension
        Files.writeString(shapesDir.resolve("notes.txt"), "projection Broken from");
    }

    @Test
    void testGenerateFromShapeDirectory() throws IOException {
        GeneratorResult result = new ProjectionGenerator(config().build()).generate();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getDiagnostics().hasErrors()).isFalse();
        assertThat(result.getShapeFilesParsed()).isEqualTo(2);
        assertThat(result.getCallSites()).isEqualTo(3);
        assertThat(result.getFailedCallSites()).isZero();
        assertThat(result.getDtoTypesGenerated()).isGreaterThanOrEqualTo(4);
        assertThat(result.getProjectionClassesGenerated()).isEqualTo(2);

        assertThat(outputDir.resolve("com/acme/views/OrderRow.java")).exists();
        assertThat(outputDir.resolve("com/acme/views/OrdersProjections.java")).exists();
        assertThat(outputDir.resolve("com/acme/reports/CustomerCard.java")).exists();
        assertThat(outputDir.resolve("com/acme/reports/CustomersProjections.java")).exists();

        String projections = Files.readString(outputDir.resolve("com/acme/views/OrdersProjections.java"));
        assertThat(projections)
                .contains("public static Function<Order, OrderRow> orderRow()")
                .contains("public static Order orderRowReverse(OrderRow dto)");

        try (Stream<Path> files = Files.walk(outputDir)) {
            assertThat(files.filter(Files::isRegularFile).count()).isEqualTo(result.getFiles().size());
        }
    }

    @Test
    void testDryRunWritesNothing() {
        GeneratorResult result = new ProjectionGenerator(config().dryRun(true).build()).generate();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.isDryRun()).isTrue();
        assertThat(result.getFiles()).isNotEmpty();
        assertThat(outputDir).doesNotExist();
    }

    @Test
    void testForceReplacesOutputDirectory() throws IOException {
        Files.createDirectories(outputDir);
        Path stale = Files.writeString(outputDir.resolve("Stale.java"), "class Stale {}");

        GeneratorResult result = new ProjectionGenerator(config().force(true).build()).generate();

        assertThat(result.isSuccess()).isTrue();
        assertThat(stale).doesNotExist();
        assertThat(outputDir.resolve("com/acme/views/OrderRow.java")).exists();
    }

    @Test
    void testNonEmptyOutputDirectoryWithoutForceFails() throws IOException {
        Files.createDirectories(outputDir);
        Files.writeString(outputDir.resolve("Stale.java"), "class Stale {}");

        GeneratorResult result = new ProjectionGenerator(config().build()).generate();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).contains("Output directory already exists");
        assertThat(outputDir.resolve("Stale.java")).exists();
    }

    @Test
    void testSchemaErrorsStopGeneration() throws IOException {
        Files.writeString(schemaFile, "type com.acme.Order access=magic\n  id: long\n");

        GeneratorResult result = new ProjectionGenerator(config().build()).generate();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getDiagnostics().has(DiagnosticCode.SCHEMA_ERROR)).isTrue();
        assertThat(outputDir).doesNotExist();
    }

    @Test
    void testNoShapeFilesFails() throws IOException {
        Path empty = Files.createDirectories(tempDir.resolve("empty"));

        GeneratorResult result = new ProjectionGenerator(config().shapesPath(empty).build()).generate();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).startsWith("No shape files found");
    }

    @Test
    void testCommandLineExitCodes() throws IOException {
        assertThat(GeneratorApplication.run("-s", schemaFile.toString(), "-i", shapesDir.toString(), "-o",
                outputDir.toString())).isEqualTo(GenerateCommand.EXIT_OK);
        assertThat(outputDir.resolve("com/acme/views/OrderRow.java")).exists();

        assertThat(GeneratorApplication.run("-i", shapesDir.toString(), "--dry-run"))
                .isEqualTo(GenerateCommand.EXIT_INVALID_OPTIONS);

        Files.writeString(shapesDir.resolve("broken.shape"), """
            package com.acme.views;
            import com.acme.*;
            projection Lost from Invoice i => { i.id };
            """);
        assertThat(GeneratorApplication.run("-s", schemaFile.toString(), "-i", shapesDir.toString(), "--dry-run"))
                .isEqualTo(GenerateCommand.EXIT_GENERATION_FAILED);
    }

    @Test
    void testCommandLineAcceptsRecordStyle() {
        assertThat(GeneratorApplication.run("-s", schemaFile.toString(), "-i", shapesDir.toString(), "-o",
                outputDir.toString(), "--dto-style", "record", "--prebuilt-transforms", "--hash-length", "12"))
                .isEqualTo(GenerateCommand.EXIT_OK);
        assertThat(outputDir.resolve("com/acme/views/OrderRow.java")).content().contains("public record OrderRow(");
    }

    private GeneratorConfig.GeneratorConfigBuilder config() {
        return GeneratorConfig.builder()
                .schemaFile(schemaFile)
                .shapesPath(shapesDir)
                .outputDir(outputDir);
    }
}
