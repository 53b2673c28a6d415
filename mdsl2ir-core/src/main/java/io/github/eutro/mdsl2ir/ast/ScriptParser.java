package io.github.eutro.mdsl2ir.ast;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Parses script files into syntax trees, for resolving imports.
 */
@FunctionalInterface
public interface ScriptParser {
    /**
     * Parse the script at the given path.
     *
     * @param path The path of the script.
     * @return The parsed script.
     * @throws IOException If the file could not be read or parsed.
     */
    Script parse(Path path) throws IOException;
}
