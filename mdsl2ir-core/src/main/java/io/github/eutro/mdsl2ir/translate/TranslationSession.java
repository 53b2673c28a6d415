package io.github.eutro.mdsl2ir.translate;

import io.github.eutro.mdsl2ir.ast.ScriptParser;
import io.github.eutro.mdsl2ir.ssa.Module;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.*;

/**
 * The state shared by the translation of one script and everything it imports.
 */
final class TranslationSession {
    private static final Logger LOGGER = LoggerFactory.getLogger(TranslationSession.class);

    final Module module;
    final TranslationConfig config;
    final ScriptParser parser;
    final Map<String, String> args;
    private final List<Diagnostic> warnings = new ArrayList<>();
    // the scripts currently being translated, innermost last
    private final Deque<Path> openScripts = new ArrayDeque<>();

    TranslationSession(Module module, TranslationConfig config, ScriptParser parser, Map<String, String> args) {
        this.module = module;
        this.config = config;
        this.parser = parser;
        this.args = args;
    }

    void warn(Diagnostic diagnostic) {
        LOGGER.warn("{}", diagnostic);
        warnings.add(diagnostic);
    }

    List<Diagnostic> getWarnings() {
        return warnings;
    }

    void enterScript(Path path) {
        openScripts.addLast(path);
    }

    void exitScript() {
        openScripts.removeLast();
    }

    boolean isOpen(Path path) {
        return openScripts.contains(path);
    }
}
