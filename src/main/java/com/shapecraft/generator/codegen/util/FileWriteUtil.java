package com.shapecraft.generator.codegen.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

import com.shapecraft.generator.codegen.model.output.GeneratedFile;

/**
 * Utility for safe file operations with automatic directory creation.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes content to a file, creating parent directories if needed.
     */
    public static void safeWriteString(Path filePath, String content) throws IOException {
        Path parentDir = filePath.getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        Files.writeString(filePath, content);
    }

    /**
     * Writes every file below {@code outputDir}; file paths are relative to it.
     */
    public static void writeAll(Path outputDir, List<GeneratedFile> files) throws IOException {
        for (GeneratedFile file : files) {
            safeWriteString(outputDir.resolve(file.getPath()), file.getContents());
        }
    }

    /**
     * Relative path of the source file declaring {@code packageName.simpleName}.
     */
    public static Path sourcePath(String packageName, String simpleName) {
        if (packageName.isEmpty()) {
            return Path.of(simpleName + ".java");
        }
        return Path.of(packageName.replace('.', '/'), simpleName + ".java");
    }

    /**
     * Recursively deletes a directory.
     */
    public static void deleteDirectory(Path directory) throws IOException {
        if (!Files.exists(directory)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(directory)) {
            walk.sorted(Comparator.reverseOrder())
                .forEach(path -> {
                    try {
                        Files.delete(path);
                    } catch (IOException e) {
                        throw new IllegalStateException("Failed to delete: " + path, e);
                    }
                });
        }
    }
}
