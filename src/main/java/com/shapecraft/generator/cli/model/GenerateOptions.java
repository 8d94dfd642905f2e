package com.shapecraft.generator.cli.model;

import java.nio.file.Path;
import java.util.List;

import com.shapecraft.generator.codegen.DtoStyle;
import com.shapecraft.generator.codegen.GeneratorConfig;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "generate" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class GenerateOptions {

	@Option(names = { "--schema", "-s" }, description = "Text schema file describing the source types")
	private Path schemaFile;

	@Option(names = { "--classpath",
			"-cp" }, split = ",", description = "Class path entries inspected for source types (comma-separated)")
	private List<Path> classpath;

	@Option(names = { "--shapes", "-i" }, description = "Shape file, or directory searched for *.shape files")
	private Path shapesPath;

	@Option(names = { "--output-dir", "-o" }, description = "Directory receiving the generated sources")
	private Path outputDir;

	@Option(names = { "--package",
			"-p" }, defaultValue = GeneratorConfig.DEFAULT_PACKAGE, description = "Package of shape files that declare none (default: ${DEFAULT-VALUE})")
	private String defaultPackage;

	@Option(names = {
			"--dto-style" }, defaultValue = "CLASS", description = "Generated DTO form: CLASS or RECORD (default: ${DEFAULT-VALUE})")
	private DtoStyle dtoStyle;

	@Option(names = {
			"--prebuilt-transforms" }, description = "Emit reusable static transforms for named projections without captures")
	private boolean prebuiltTransforms;

	@Option(names = {
			"--no-array-nullability-removal" }, description = "Keep null-safe nested collections nullable instead of defaulting them to empty")
	private boolean noArrayNullabilityRemoval;

	@Option(names = {
			"--nested-hash-package" }, description = "Place each hash-named DTO in its own shape_<hash> sub-package")
	private boolean nestedHashPackage;

	@Option(names = {
			"--hash-length" }, defaultValue = "8", description = "Hex digits of the structure hash used in names (default: ${DEFAULT-VALUE})")
	private int hashLength;

	@Option(names = { "--no-lineage-comments" }, description = "Omit the source lineage Javadoc on DTO fields")
	private boolean noLineageComments;

	@Option(names = { "--parallel" }, description = "Analyse call sites in parallel")
	private boolean parallel;

	@Option(names = { "--force", "-f" }, description = "Overwrite existing output directory")
	private boolean force;

	@Option(names = { "--dry-run" }, description = "Compile and report without writing any file")
	private boolean dryRun;
}
