package io.github.eutro.mdsl2ir.ops;

/**
 * The key of an operation with no intermediates, which therefore only needs one instance.
 */
public class SimpleOpKey extends OpKey {
    private final Op op = new Op(this);

    public SimpleOpKey(String mnemonic) {
        super(mnemonic);
    }

    public Op create() {
        return op;
    }
}
