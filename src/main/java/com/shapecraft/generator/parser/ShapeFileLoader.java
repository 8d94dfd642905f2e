package com.shapecraft.generator.parser;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shapecraft.generator.codegen.model.core.context.ToolDiagnostics;
import com.shapecraft.generator.model.ShapeFile;

import lombok.NoArgsConstructor;

/**
 * Discovers and parses {@code *.shape} files under a file or directory.
 */
@NoArgsConstructor
public class ShapeFileLoader {
    private static final Logger log = LoggerFactory.getLogger(ShapeFileLoader.class);

    public static final String SHAPE_EXTENSION = ".shape";

    public List<Path> discoverShapeFiles(Path shapesPath) throws IOException {
        if (Files.isRegularFile(shapesPath)) {
            return List.of(shapesPath);
        }
        try (Stream<Path> stream = Files.walk(shapesPath)) {
            return stream.filter(Files::isRegularFile)
                    .filter(this::isShapeFile)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    public List<ShapeFile> loadAll(Path shapesPath, ToolDiagnostics diagnostics) throws IOException {
        List<ShapeFile> files = new ArrayList<>();
        for (Path path : discoverShapeFiles(shapesPath)) {
            String content = Files.readString(path);
            String fileName = relativeName(shapesPath, path);
            ShapeFile file = ShapeParser.parseSource(content, fileName, diagnostics);
            log.debug("Loaded {} with {} projection(s)", fileName, file.getProjections().size());
            files.add(file);
        }
        return files;
    }

    private String relativeName(Path root, Path file) {
        if (Files.isDirectory(root)) {
            return root.relativize(file).toString().replace('\\', '/');
        }
        return file.getFileName().toString();
    }

    private boolean isShapeFile(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(SHAPE_EXTENSION);
    }
}
