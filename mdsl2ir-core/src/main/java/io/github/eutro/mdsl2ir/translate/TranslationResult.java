package io.github.eutro.mdsl2ir.translate;

import io.github.eutro.mdsl2ir.ssa.Module;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The outcome of translating a script: either a complete module or the error
 * that stopped translation, together with any warnings.
 */
public final class TranslationResult {
    private final @Nullable Module module;
    private final @Nullable TranslationError error;
    private final List<Diagnostic> warnings;

    private TranslationResult(@Nullable Module module, @Nullable TranslationError error, List<Diagnostic> warnings) {
        this.module = module;
        this.error = error;
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    public static TranslationResult success(Module module, List<Diagnostic> warnings) {
        return new TranslationResult(module, null, warnings);
    }

    public static TranslationResult failure(TranslationError error, List<Diagnostic> warnings) {
        return new TranslationResult(null, error, warnings);
    }

    public boolean isSuccess() {
        return module != null;
    }

    public Optional<Module> getModule() {
        return Optional.ofNullable(module);
    }

    public Optional<TranslationError> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * Get the module, or throw the error as a {@link TranslationException}.
     *
     * @return The module.
     */
    public Module orElseThrow() {
        if (module != null) return module;
        throw new TranslationException(error);
    }

    public List<Diagnostic> getWarnings() {
        return warnings;
    }
}
