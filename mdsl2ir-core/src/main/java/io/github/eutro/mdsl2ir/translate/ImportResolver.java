package io.github.eutro.mdsl2ir.translate;

import io.github.eutro.mdsl2ir.ast.Script;
import io.github.eutro.mdsl2ir.ast.Stmt;
import io.github.eutro.mdsl2ir.ssa.Function;
import io.github.eutro.mdsl2ir.ssa.SourceLocation;
import org.intellij.lang.annotations.PrintFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Resolves imports of other scripts, translating them in place and merging their top-level
 * variables and functions into the importing script under a prefix.
 */
final class ImportResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(ImportResolver.class);
    private static final char PREFIX_DELIMITER = '.';

    private final ScriptTranslator t;

    ImportResolver(ScriptTranslator t) {
        this.t = t;
    }

    void visitImport(Stmt.Import stmt) {
        SourceLocation loc = stmt.location;
        if (t.symbols.getNumScopes() != 1) {
            throw error(loc, "imports can only be done in the main scope");
        }
        TranslationConfig config = t.session.config;
        Path importing = Paths.get(stmt.path);
        boolean hasExtension = hasExtension(importing);
        String prefix = (stmt.alias != null ? stmt.alias : stem(importing)) + PREFIX_DELIMITER;

        Path path = importing;
        List<Path> importPaths = new ArrayList<>();
        if (!importing.isAbsolute()) {
            Path importerDir = t.scriptPath.toAbsolutePath().getParent();
            Path absolute = importerDir == null ? importing.toAbsolutePath() : importerDir.resolve(importing);
            if (Files.exists(absolute)) absolute = canonical(absolute, loc);
            if (hasExtension) {
                for (Path defaultDir : config.getDefaultDirs()) {
                    Path libFile = defaultDir.resolve(importing);
                    if (Files.exists(libFile)) {
                        if (Files.exists(absolute) && !canonical(libFile, loc).equals(absolute)) {
                            throw error(loc,
                                    "Ambiguous import: %s, found another file with the same name in the default import paths: %s",
                                    importing,
                                    libFile);
                        }
                        absolute = libFile;
                    }
                }
            } else {
                Optional<List<Path>> library = config.getLibrary(stmt.path);
                if (library.isPresent() && !library.get().isEmpty()) {
                    importPaths.addAll(listLibrary(library.get().get(0), loc));
                }
            }
            path = absolute;
        }
        if (importPaths.isEmpty()) {
            importPaths.add(path);
        }
        LOGGER.debug("import of {} resolved to {}", stmt.path, importPaths);

        if (canonical(path, loc).equals(canonical(t.scriptPath, loc))) {
            throw error(loc, "You cannot import the file you are currently in: %s", path);
        }
        List<Path> canonicalPaths = new ArrayList<>();
        for (Path importPath : importPaths) {
            Path key = canonical(importPath, loc);
            if (t.session.isOpen(key)) {
                throw error(loc, "Cyclic import of %s", importPath);
            }
            if (t.importedFiles.contains(key)) {
                throw error(loc, "You cannot import the same file twice: %s", importPath);
            }
            t.importedFiles.add(key);
            canonicalPaths.add(key);
        }

        for (int i = 0; i < importPaths.size(); i++) {
            Path importPath = importPaths.get(i);
            if (!Files.exists(importPath)) {
                throw error(loc, "The import path doesn't exist: %s", importPath);
            }
            String finalPrefix = prefix;
            if (!hasExtension) {
                finalPrefix += stem(importPath) + PREFIX_DELIMITER;
            } else if (prefixTaken(finalPrefix)) {
                if (stmt.alias != null) {
                    throw error(loc, "Alias %s results in a name clash with another prefix", stmt.alias);
                }
                Path parent = canonicalPaths.get(i).getParent();
                Path dirName = parent == null ? null : parent.getFileName();
                finalPrefix = (dirName == null ? "" : dirName + String.valueOf(PREFIX_DELIMITER)) + finalPrefix;
            }
            LOGGER.debug("importing {} with prefix {}", importPath, finalPrefix);
            translateImport(canonicalPaths.get(i), importPath, finalPrefix, loc);
        }
    }

    private void translateImport(Path canonicalPath, Path importPath, String prefix, SourceLocation loc) {
        Script script;
        try {
            script = t.session.parser.parse(importPath);
        } catch (IOException e) {
            throw new TranslationException(new TranslationError(
                    TranslationError.Kind.IMPORT_ERROR,
                    loc,
                    "Failed to read the imported file " + importPath + ": " + e.getMessage()), e);
        }

        ScriptTranslator nested = new ScriptTranslator(t.session, t.builder, canonicalPath);
        nested.translateScript(script);

        // names with a prefix were imported by the imported file itself, and are not re-exported
        for (Map.Entry<String, SymbolTable.SymbolInfo> entry : nested.symbols.topScope().entrySet()) {
            if (entry.getKey().indexOf(PREFIX_DELIMITER) == -1) {
                t.symbols.put(prefix + entry.getKey(), entry.getValue());
            }
        }
        for (Map.Entry<String, List<Function>> entry : nested.functions.entries().entrySet()) {
            if (entry.getKey().indexOf(PREFIX_DELIMITER) == -1) {
                for (Function func : entry.getValue()) {
                    t.functions.register(prefix + entry.getKey(), func);
                }
            }
        }
    }

    private boolean prefixTaken(String prefix) {
        Stream<String> names = Stream.concat(
                t.symbols.topScope().keySet().stream(),
                t.functions.entries().keySet().stream());
        return names.anyMatch(name -> name.startsWith(prefix)
                && name.chars().filter(c -> c == PREFIX_DELIMITER).count() == 1);
    }

    private static List<Path> listLibrary(Path dir, SourceLocation loc) {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw new TranslationException(new TranslationError(
                    TranslationError.Kind.IMPORT_ERROR,
                    loc,
                    "Failed to list the library directory " + dir + ": " + e.getMessage()), e);
        }
    }

    /**
     * The canonical form of a path, for comparisons: the real path if the file exists,
     * otherwise the normalized absolute path.
     *
     * @param path The path.
     * @param loc  The location of the import, for errors.
     * @return The canonical path.
     */
    static Path canonical(Path path, SourceLocation loc) {
        if (!Files.exists(path)) return path.toAbsolutePath().normalize();
        try {
            return path.toRealPath();
        } catch (IOException e) {
            throw new TranslationException(new TranslationError(
                    TranslationError.Kind.IMPORT_ERROR,
                    loc,
                    "Failed to resolve " + path + ": " + e.getMessage()), e);
        }
    }

    private static boolean hasExtension(Path path) {
        Path name = path.getFileName();
        if (name == null) return false;
        int dot = name.toString().lastIndexOf('.');
        return dot > 0 && dot < name.toString().length() - 1;
    }

    private static String stem(Path path) {
        Path name = path.getFileName();
        if (name == null) return "";
        String s = name.toString();
        int dot = s.lastIndexOf('.');
        return dot > 0 ? s.substring(0, dot) : s;
    }

    private static TranslationException error(SourceLocation loc, @PrintFormat String fmt, Object... args) {
        return TranslationException.of(TranslationError.Kind.IMPORT_ERROR, loc, fmt, args);
    }
}
