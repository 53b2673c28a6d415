package io.github.eutro.mdsl2ir.translate;

import io.github.eutro.mdsl2ir.ssa.SourceLocation;

/**
 * A fatal error in the translation of a script.
 */
public final class TranslationError {
    public enum Kind {
        UNDEFINED_VARIABLE,
        READ_ONLY_ASSIGNMENT,
        TYPE_AMBIGUITY,
        UNSUPPORTED_CONSTRUCT,
        ARITY_MISMATCH,
        INVALID_LITERAL,
        IMPORT_ERROR,
        OVERLOAD_RESOLUTION,
    }

    public final Kind kind;
    public final SourceLocation location;
    public final String message;

    public TranslationError(Kind kind, SourceLocation location, String message) {
        this.kind = kind;
        this.location = location;
        this.message = message;
    }

    @Override
    public String toString() {
        return location + ": " + kind + ": " + message;
    }
}
