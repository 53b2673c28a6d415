package io.github.eutro.mdsl2ir.ops;

import io.github.eutro.mdsl2ir.ext.ExtHolder;

/**
 * An operation key, representing a type of operation, without intermediates.
 */
public abstract class OpKey extends ExtHolder {
    public final String mnemonic;

    public OpKey(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
