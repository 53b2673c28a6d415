package io.github.eutro.mdsl2ir.ssa;

import java.util.Objects;

/**
 * A position in a script, attached to the IR it was translated into.
 */
public final class SourceLocation {
    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", 0, 0);

    public final String file;
    public final int line;
    public final int column;

    public SourceLocation(String file, int line, int column) {
        this.file = file;
        this.line = line;
        this.column = column;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SourceLocation that = (SourceLocation) o;
        return line == that.line && column == that.column && file.equals(that.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, line, column);
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
