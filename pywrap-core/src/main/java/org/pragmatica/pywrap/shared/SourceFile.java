package org.pragmatica.pywrap.shared;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Python source file content together with the path it was read from.
 */
public record SourceFile(Path fileName, String content) {

    /**
     * Read a source file as UTF-8.
     */
    public static SourceFile sourceFile(Path path) throws IOException {
        return new SourceFile(path, Files.readString(path, StandardCharsets.UTF_8));
    }

    public static SourceFile sourceFile(Path path, String content) {
        return new SourceFile(path, content);
    }

    public SourceFile withContent(String newContent) {
        return new SourceFile(fileName, newContent);
    }

    /**
     * Write the content back to the file it came from.
     */
    public void write() throws IOException {
        Files.writeString(fileName, content, StandardCharsets.UTF_8);
    }
}
