package io.github.eutro.mdsl2ir.translate;

import io.github.eutro.mdsl2ir.ssa.SourceLocation;
import org.intellij.lang.annotations.PrintFormat;

/**
 * Thrown to abort the translation of a script, carrying the {@link TranslationError} that caused it.
 */
public class TranslationException extends RuntimeException {
    public final TranslationError error;

    public TranslationException(TranslationError error) {
        super(error.toString());
        this.error = error;
    }

    public TranslationException(TranslationError error, Throwable cause) {
        super(error.toString(), cause);
        this.error = error;
    }

    public static TranslationException of(
            TranslationError.Kind kind,
            SourceLocation location,
            @PrintFormat String fmt,
            Object... args
    ) {
        return new TranslationException(new TranslationError(kind, location, String.format(fmt, args)));
    }
}
