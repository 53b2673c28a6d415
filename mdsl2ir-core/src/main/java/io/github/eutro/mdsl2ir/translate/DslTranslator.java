package io.github.eutro.mdsl2ir.translate;

import io.github.eutro.mdsl2ir.ast.Script;
import io.github.eutro.mdsl2ir.ast.ScriptParser;
import io.github.eutro.mdsl2ir.passes.IRPass;
import io.github.eutro.mdsl2ir.passes.form.RectifyEarlyReturns;
import io.github.eutro.mdsl2ir.passes.meta.VerifyRegions;
import io.github.eutro.mdsl2ir.passes.misc.ForPass;
import io.github.eutro.mdsl2ir.ssa.IRBuilder;
import io.github.eutro.mdsl2ir.ssa.Module;
import io.github.eutro.mdsl2ir.ssa.SourceLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Translates the syntax tree of a script into a new {@link Module}.
 * <p>
 * The top-level statements of the script, and of the scripts it imports, end up in the
 * {@link Module#getMain() entry function}. Each user-defined function becomes a function of its own.
 * <p>
 * Instances hold no state between translations, so one translator may be used for any number of scripts.
 */
public class DslTranslator implements IRPass<Script, Module> {
    private static final Logger LOGGER = LoggerFactory.getLogger(DslTranslator.class);

    private final TranslationConfig config;
    private final ScriptParser parser;
    private final Map<String, String> args;

    /**
     * Construct a translator.
     *
     * @param config The configuration, for resolving imports.
     * @param parser The parser to parse imported scripts with.
     * @param args   The values of the arguments scripts may reference with {@code $name}.
     */
    public DslTranslator(TranslationConfig config, ScriptParser parser, Map<String, String> args) {
        this.config = config;
        this.parser = parser;
        this.args = Collections.unmodifiableMap(new LinkedHashMap<>(args));
    }

    public DslTranslator(TranslationConfig config, ScriptParser parser) {
        this(config, parser, Collections.emptyMap());
    }

    /**
     * Translate a script, reporting failure in the result instead of throwing.
     *
     * @param script The script.
     * @return The module and the warnings, or the error and the warnings up to it.
     */
    public TranslationResult translate(Script script) {
        TranslationSession session = newSession();
        try {
            return TranslationResult.success(translate(session, script), session.getWarnings());
        } catch (TranslationException e) {
            LOGGER.debug("translation of {} failed", script.path, e);
            return TranslationResult.failure(e.error, session.getWarnings());
        }
    }

    /**
     * Translate a script.
     *
     * @param script The script.
     * @return The module.
     * @throws TranslationException If the script cannot be translated.
     */
    @Override
    public Module run(Script script) {
        return translate(newSession(), script);
    }

    private TranslationSession newSession() {
        return new TranslationSession(new Module(), config, parser, args);
    }

    private Module translate(TranslationSession session, Script script) {
        Module module = session.module;
        ScriptTranslator translator = new ScriptTranslator(
                session,
                new IRBuilder(module.getMain()),
                ImportResolver.canonical(script.path, SourceLocation.UNKNOWN));
        translator.translateScript(script);
        // user-defined functions are rectified as they are defined
        return ForPass.liftMain(new RectifyEarlyReturns(session::warn))
                .then(ForPass.liftFunctions(VerifyRegions.INSTANCE))
                .run(module);
    }
}
