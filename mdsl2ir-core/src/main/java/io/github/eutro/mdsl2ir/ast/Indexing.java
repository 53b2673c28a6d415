package io.github.eutro.mdsl2ir.ast;

import org.jetbrains.annotations.Nullable;

/**
 * The {@code [rows, cols]} part of an indexing expression. Either axis may be absent.
 */
public final class Indexing {
    public final @Nullable Range rows;
    public final @Nullable Range cols;

    public Indexing(@Nullable Range rows, @Nullable Range cols) {
        this.rows = rows;
        this.cols = cols;
    }
}
