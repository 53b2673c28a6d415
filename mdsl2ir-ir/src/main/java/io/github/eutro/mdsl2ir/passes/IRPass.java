package io.github.eutro.mdsl2ir.passes;

import io.github.eutro.mdsl2ir.passes.misc.ChainedPass;

/**
 * A pass over some IR, converting {@code A}s to {@code B}s.
 *
 * @param <A> The input type.
 * @param <B> The output type.
 */
public interface IRPass<A, B> {
    /**
     * Run the pass.
     *
     * @param a The input.
     * @return The output.
     */
    B run(A a);

    /**
     * Compose this pass with another, which is given the output of this one.
     *
     * @param next The next pass.
     * @param <C>  The output type of the next pass.
     * @return The composed pass.
     */
    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
