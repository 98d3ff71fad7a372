package de.bsommerfeld.catalog.cache.declcfg;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;

/**
 * Glob rules of one {@code .indexignore} file. Patterns apply to paths
 * relative to the directory holding the file; a pattern without a slash
 * also matches a bare file or directory name at any depth.
 */
final class IndexIgnore {

    static final String FILE_NAME = ".indexignore";

    private final Path base;
    private final List<Rule> rules;

    private IndexIgnore(Path base, List<Rule> rules) {
        this.base = base;
        this.rules = rules;
    }

    static IndexIgnore read(Path file) throws IOException {
        List<Rule> rules = new ArrayList<>();
        for (String line : Files.readAllLines(file)) {
            String pattern = line.trim();
            if (pattern.isEmpty() || pattern.startsWith("#")) {
                continue;
            }
            if (pattern.startsWith("/")) {
                pattern = pattern.substring(1);
            }
            if (pattern.endsWith("/")) {
                pattern = pattern.substring(0, pattern.length() - 1);
            }
            if (!pattern.isEmpty()) {
                rules.add(new Rule(FileSystems.getDefault().getPathMatcher("glob:" + pattern),
                        !pattern.contains("/")));
            }
        }
        return new IndexIgnore(file.getParent(), rules);
    }

    boolean ignores(Path path) {
        if (!path.startsWith(base)) {
            return false;
        }
        Path relative = base.relativize(path);
        for (Rule rule : rules) {
            if (rule.matcher().matches(relative)) {
                return true;
            }
            if (rule.nameOnly() && relative.getFileName() != null && rule.matcher().matches(relative.getFileName())) {
                return true;
            }
        }
        return false;
    }

    private record Rule(PathMatcher matcher, boolean nameOnly) {
    }
}
