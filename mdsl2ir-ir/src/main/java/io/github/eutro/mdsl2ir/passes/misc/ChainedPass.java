package io.github.eutro.mdsl2ir.passes.misc;

import io.github.eutro.mdsl2ir.passes.IRPass;

/**
 * A pass which runs one pass, then another on its output.
 *
 * @param <A> The input type.
 * @param <B> The intermediate type.
 * @param <C> The output type.
 */
public class ChainedPass<A, B, C> implements IRPass<A, C> {
    private final IRPass<A, B> firstPass;
    private final IRPass<B, C> nextPass;

    public ChainedPass(IRPass<A, B> firstPass, IRPass<B, C> nextPass) {
        this.firstPass = firstPass;
        this.nextPass = nextPass;
    }

    @Override
    public C run(A a) {
        B b = firstPass.run(a);
        try {
            return nextPass.run(b);
        } catch (RuntimeException e) {
            e.addSuppressed(new RuntimeException("running pass " + nextPass + " in chain"));
            throw e;
        }
    }
}
