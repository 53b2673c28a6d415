package io.github.eutro.mdsl2ir.translate;

import io.github.eutro.mdsl2ir.ssa.SourceLocation;

/**
 * A non-fatal warning produced during translation.
 */
public final class Diagnostic {
    public final SourceLocation location;
    public final String message;

    public Diagnostic(SourceLocation location, String message) {
        this.location = location;
        this.message = message;
    }

    @Override
    public String toString() {
        return location + ": warning: " + message;
    }
}
