package io.smellscan.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.FileSystems;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Matches normalized file paths against a set of glob patterns, e.g. {@code **}{@code /generated/**}.
 * Invalid patterns are logged and skipped.
 */
final class PathFilter {

    private static final Logger log = LoggerFactory.getLogger(PathFilter.class);

    static final PathFilter NONE = new PathFilter(List.of());

    private final List<PathMatcher> matchers;

    private PathFilter(List<PathMatcher> matchers) {
        this.matchers = matchers;
    }

    static PathFilter of(Collection<String> globs) {
        if (globs.isEmpty()) {
            return NONE;
        }
        List<PathMatcher> compiled = new ArrayList<>();
        for (String glob : globs) {
            try {
                compiled.add(FileSystems.getDefault().getPathMatcher("glob:" + glob));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid exclude pattern '{}': {}", glob, e.getMessage());
            }
        }
        return new PathFilter(List.copyOf(compiled));
    }

    boolean matches(String file) {
        if (matchers.isEmpty()) {
            return false;
        }
        Path path;
        try {
            path = Path.of(file);
        } catch (InvalidPathException e) {
            return false;
        }
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(path)) {
                return true;
            }
        }
        return false;
    }
}
