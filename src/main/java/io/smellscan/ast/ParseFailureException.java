package io.smellscan.ast;

import java.nio.file.Path;

/**
 * Thrown by an {@link AstProvider} when a file cannot be turned into a syntax tree.
 * The failure is isolated to that file.
 */
public class ParseFailureException extends Exception {

    private final Path file;

    public ParseFailureException(Path file, String message) {
        super(message);
        this.file = file;
    }

    public ParseFailureException(Path file, String message, Throwable cause) {
        super(message, cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
