package io.github.eutro.mdsl2ir.translate;

import java.nio.file.Path;
import java.util.*;

/**
 * Configuration of script translation: where imports are looked up.
 * <p>
 * Import paths are named sets of directories. The set named {@value #DEFAULT_DIRS} is searched for
 * imports of files; any other set is a library, whose first directory holds the files imported
 * when the library is imported by name.
 */
public final class TranslationConfig {
    public static final String DEFAULT_DIRS = "default_dirs";
    public static final TranslationConfig DEFAULT = builder().build();

    private final Map<String, List<Path>> importPaths;

    private TranslationConfig(Map<String, List<Path>> importPaths) {
        Map<String, List<Path>> copy = new LinkedHashMap<>();
        importPaths.forEach((name, dirs) -> copy.put(name, Collections.unmodifiableList(new ArrayList<>(dirs))));
        this.importPaths = Collections.unmodifiableMap(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, List<Path>> getImportPaths() {
        return importPaths;
    }

    public List<Path> getDefaultDirs() {
        return importPaths.getOrDefault(DEFAULT_DIRS, Collections.emptyList());
    }

    public Optional<List<Path>> getLibrary(String name) {
        if (DEFAULT_DIRS.equals(name)) return Optional.empty();
        return Optional.ofNullable(importPaths.get(name));
    }

    public static final class Builder {
        private final Map<String, List<Path>> importPaths = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder defaultDir(Path dir) {
            return importPath(DEFAULT_DIRS, dir);
        }

        public Builder library(String name, Path... dirs) {
            for (Path dir : dirs) {
                importPath(name, dir);
            }
            return this;
        }

        public Builder importPath(String set, Path dir) {
            importPaths.computeIfAbsent(set, $ -> new ArrayList<>()).add(dir);
            return this;
        }

        public TranslationConfig build() {
            return new TranslationConfig(importPaths);
        }
    }
}
