package io.smellscan.ast;

import java.nio.file.Path;

/**
 * Produces syntax trees for source files. The engine consumes trees; it never parses text itself.
 * <p>
 * Implementations are called concurrently from the worker pool, one file per call.
 */
@FunctionalInterface
public interface AstProvider {

    /**
     * Parses the given file.
     *
     * @param file the file to parse
     * @return the parsed tree
     * @throws ParseFailureException if the file cannot be parsed
     */
    SyntaxTree parse(Path file) throws ParseFailureException;
}
