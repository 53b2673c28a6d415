package io.github.eutro.mdsl2ir.ast;

import org.jetbrains.annotations.Nullable;

/**
 * One axis of an {@link Indexing}: a single position {@code p}, or a range {@code lower:upper}
 * with either bound optional.
 */
public final class Range {
    public final @Nullable Expr pos;
    public final @Nullable Expr lower;
    public final @Nullable Expr upper;

    private Range(@Nullable Expr pos, @Nullable Expr lower, @Nullable Expr upper) {
        this.pos = pos;
        this.lower = lower;
        this.upper = upper;
    }

    public static Range at(Expr pos) {
        return new Range(pos, null, null);
    }

    public static Range between(@Nullable Expr lower, @Nullable Expr upper) {
        return new Range(null, lower, upper);
    }

    public boolean isRange() {
        return pos == null;
    }
}
