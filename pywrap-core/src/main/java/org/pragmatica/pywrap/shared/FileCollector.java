package org.pragmatica.pywrap.shared;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Utility for collecting Python source files from paths.
 */
public final class FileCollector {

    private FileCollector() {}

    /**
     * Collect Python files from a list of paths (files or directories).
     * Directories are scanned recursively, results are sorted per directory.
     *
     * @param paths        List of paths to collect from
     * @param errorHandler Handler for errors during collection
     * @return List of Python file paths
     */
    public static List<Path> collectPythonFiles(List<Path> paths, Consumer<String> errorHandler) {
        var files = new ArrayList<Path>();

        for (var path : paths) {
            if (!Files.exists(path)) {
                errorHandler.accept("File not found: " + path);
            } else if (Files.isDirectory(path)) {
                collectFromDirectory(path, files, errorHandler);
            } else if (isPythonFile(path)) {
                files.add(path);
            }
        }

        return files;
    }

    private static void collectFromDirectory(Path directory, List<Path> files, Consumer<String> errorHandler) {
        try (Stream<Path> stream = Files.walk(directory)) {
            files.addAll(stream.filter(Files::isRegularFile)
                               .filter(FileCollector::isPythonFile)
                               .sorted()
                               .collect(Collectors.toList()));
        } catch (IOException | UncheckedIOException e) {
            errorHandler.accept("Error scanning " + directory + ": " + e.getMessage());
        }
    }

    private static boolean isPythonFile(Path path) {
        return path.getFileName() != null && path.getFileName().toString().endsWith(".py");
    }
}
