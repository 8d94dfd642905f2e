package com.shapecraft.generator.cli.model;

import java.nio.file.Path;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps GenerateCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedGenerateOptions {
    Path normalizedOutputDir;
    Path normalizedShapesPath;
    List<Path> classpath;
}
