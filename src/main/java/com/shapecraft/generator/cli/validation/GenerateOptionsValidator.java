package com.shapecraft.generator.cli.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import com.shapecraft.generator.cli.exception.OptionsValidationException;
import com.shapecraft.generator.cli.model.GenerateOptions;
import com.shapecraft.generator.cli.model.ValidatedGenerateOptions;

public class GenerateOptionsValidator {

	public static final int MIN_HASH_LENGTH = 8;
	public static final int MAX_HASH_LENGTH = 64;

	public ValidatedGenerateOptions validate(GenerateOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getShapesPath() == null) {
			errors.add("Shape files are required (--shapes / -i).");
		} else if (!Files.exists(o.getShapesPath())) {
			errors.add("Shapes path does not exist: " + o.getShapesPath());
		}

		List<Path> classpath = o.getClasspath() == null ? List.of() : List.copyOf(o.getClasspath());
		if (o.getSchemaFile() == null && classpath.isEmpty()) {
			errors.add("Either --schema or --classpath must be provided to describe the source types.");
		}
		if (o.getSchemaFile() != null && !Files.isRegularFile(o.getSchemaFile())) {
			errors.add("Schema file does not exist: " + o.getSchemaFile());
		}
		for (Path entry : classpath) {
			if (!Files.exists(entry)) {
				errors.add("Class path entry does not exist: " + entry);
			}
		}

		if (isBlank(o.getDefaultPackage()) || !o.getDefaultPackage().matches("[A-Za-z_$][\\w$]*(\\.[A-Za-z_$][\\w$]*)*")) {
			errors.add("Package must be a valid Java package name. Got: " + o.getDefaultPackage());
		}

		if (o.getHashLength() < MIN_HASH_LENGTH || o.getHashLength() > MAX_HASH_LENGTH) {
			errors.add("Hash length must be in range " + MIN_HASH_LENGTH + "-" + MAX_HASH_LENGTH + ". Got: "
					+ o.getHashLength());
		}

		Path normalizedOutputDir = null;
		if (o.getOutputDir() == null) {
			if (!o.isDryRun()) {
				errors.add("Output directory is required (--output-dir / -o) unless --dry-run is set.");
			}
		} else {
			normalizedOutputDir = o.getOutputDir().toAbsolutePath().normalize();
			if (!o.isDryRun() && !o.isForce() && isNonEmpty(normalizedOutputDir)) {
				errors.add("Output directory already exists: " + normalizedOutputDir + ". Use --force to overwrite.");
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedGenerateOptions(normalizedOutputDir, o.getShapesPath().toAbsolutePath().normalize(),
				classpath);
	}

	private static boolean isNonEmpty(Path dir) {
		if (!Files.exists(dir)) {
			return false;
		}
		if (!Files.isDirectory(dir)) {
			return true;
		}
		try (Stream<Path> entries = Files.list(dir)) {
			return entries.findAny().isPresent();
		} catch (IOException e) {
			throw new OptionsValidationException("Cannot read output directory " + dir, e);
		}
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
