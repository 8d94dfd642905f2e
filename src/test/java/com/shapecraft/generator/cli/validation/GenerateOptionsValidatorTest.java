package com.shapecraft.generator.cli.validation;

import com.shapecraft.generator.cli.exception.OptionsValidationException;
import com.shapecraft.generator.cli.model.GenerateOptions;
import com.shapecraft.generator.cli.model.ValidatedGenerateOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for GenerateOptionsValidator.
 */
class GenerateOptionsValidatorTest {

	@TempDir
	Path tempDir;

	private final GenerateOptionsValidator validator = new GenerateOptionsValidator();

	private Path schema;
	private Path shapes;

	@BeforeEach
	void setUp() throws IOException {
		schema = Files.writeString(tempDir.resolve("domain.schema"), "type com.acme.Order\n  id: long\nend\n");
		shapes = Files.createDirectories(tempDir.resolve("shapes"));
	}

	@Test
	void testValidOptions() {
		ValidatedGenerateOptions validated = validator.validate(
				parse("-s", schema.toString(), "-i", shapes.toString(), "-o", tempDir.resolve("out").toString()));

		assertThat(validated.getNormalizedOutputDir()).isEqualTo(tempDir.resolve("out").toAbsolutePath().normalize());
		assertThat(validated.getNormalizedShapesPath()).isEqualTo(shapes.toAbsolutePath().normalize());
		assertThat(validated.getClasspath()).isEmpty();
	}

	@Test
	void testShapesAreRequired() {
		assertThat(errors("-s", schema.toString(), "-o", tempDir.resolve("out").toString()))
				.containsExactly("Shape files are required (--shapes / -i).");
		assertThat(errors("-s", schema.toString(), "-i", tempDir.resolve("missing").toString(), "--dry-run"))
				.singleElement().asString().startsWith("Shapes path does not exist: ");
	}

	@Test
	void testSchemaOrClasspathIsRequired() {
		assertThat(errors("-i", shapes.toString(), "--dry-run"))
				.singleElement().asString().startsWith("Either --schema or --classpath must be provided");
		assertThat(errors("-s", tempDir.resolve("nope.schema").toString(), "-i", shapes.toString(), "--dry-run"))
				.singleElement().asString().startsWith("Schema file does not exist: ");
	}

	@Test
	void testClasspathEntriesMustExist() throws IOException {
		Path classes = Files.createDirectories(tempDir.resolve("classes"));
		Path missing = tempDir.resolve("missing.jar");

		assertThat(errors("-cp", classes + "," + missing, "-i", shapes.toString(), "--dry-run"))
				.containsExactly("Class path entry does not exist: " + missing);

		ValidatedGenerateOptions validated = validator.validate(
				parse("-cp", classes.toString(), "-i", shapes.toString(), "--dry-run"));
		assertThat(validated.getClasspath()).containsExactly(classes);
	}

	@Test
	void testPackageMustBeValid() {
		assertThat(errors("-s", schema.toString(), "-i", shapes.toString(), "--dry-run", "-p", "com.9acme"))
				.containsExactly("Package must be a valid Java package name. Got: com.9acme");
		assertThat(validator.validate(parse("-s", schema.toString(), "-i", shapes.toString(), "--dry-run", "-p",
				"com.acme.views"))).isNotNull();
	}

	@Test
	void testHashLengthRange() {
		assertThat(errors("-s", schema.toString(), "-i", shapes.toString(), "--dry-run", "--hash-length", "7"))
				.containsExactly("Hash length must be in range 8-64. Got: 7");
		assertThat(errors("-s", schema.toString(), "-i", shapes.toString(), "--dry-run", "--hash-length", "65"))
				.hasSize(1);
		assertThat(validator.validate(parse("-s", schema.toString(), "-i", shapes.toString(), "--dry-run",
				"--hash-length", "64"))).isNotNull();
	}

	@ParameterizedTest
	@ValueSource(strings = { "com..acme", "1com", "com.acme-views", "com.acme." })
	void testMalformedPackagesAreRejected(String packageName) {
		assertThat(errors("-s", schema.toString(), "-i", shapes.toString(), "--dry-run", "-p", packageName))
				.containsExactly("Package must be a valid Java package name. Got: " + packageName);
	}

	@Test
	void testOutputDirectoryRequiredUnlessDryRun() {
		assertThat(errors("-s", schema.toString(), "-i", shapes.toString()))
				.containsExactly("Output directory is required (--output-dir / -o) unless --dry-run is set.");

		ValidatedGenerateOptions validated = validator.validate(
				parse("-s", schema.toString(), "-i", shapes.toString(), "--dry-run"));
		assertThat(validated.getNormalizedOutputDir()).isNull();
	}

	@Test
	void testNonEmptyOutputDirectoryNeedsForce() throws IOException {
		Path out = Files.createDirectories(tempDir.resolve("out"));
		Files.writeString(out.resolve("Existing.java"), "class Existing {}");

		assertThat(errors("-s", schema.toString(), "-i", shapes.toString(), "-o", out.toString()))
				.singleElement().asString()
				.startsWith("Output directory already exists: ")
				.endsWith("Use --force to overwrite.");
		assertThat(validator.validate(parse("-s", schema.toString(), "-i", shapes.toString(), "-o", out.toString(),
				"--force"))).isNotNull();
		assertThat(validator.validate(parse("-s", schema.toString(), "-i", shapes.toString(), "-o", out.toString(),
				"--dry-run"))).isNotNull();
	}

	@Test
	void testAllErrorsAreReportedTogether() {
		assertThat(errors("--hash-length", "2", "-p", "bad-package")).hasSize(5);
	}

	private static GenerateOptions parse(String... args) {
		GenerateOptions options = new GenerateOptions();
		new CommandLine(options).parseArgs(args);
		return options;
	}

	private List<String> errors(String... args) {
		GenerateOptions options = parse(args);
		try {
			validator.validate(options);
		} catch (OptionsValidationException e) {
			return new ArrayList<>(e.getErrors());
		}
		return List.of();
	}
}
