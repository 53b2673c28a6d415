package io.github.eutro.mdsl2ir.ops;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.function.Function;

/**
 * The key of an operation with a single intermediate, such as a constant value or a callee.
 *
 * @param <T> The type of the intermediate.
 */
public class UnaryOpKey<T> extends OpKey {
    private final Function<T, String> printer;

    /**
     * @param mnemonic The name of the operation.
     * @param printer  Renders the intermediate for {@link #toString()} and the IR printer.
     */
    public UnaryOpKey(String mnemonic, Function<T, String> printer) {
        super(mnemonic);
        this.printer = printer;
    }

    public UnaryOpKey(String mnemonic) {
        this(mnemonic, Objects::toString);
    }

    public class UnaryOp extends Op {
        public final T arg;

        private UnaryOp(T arg) {
            super(UnaryOpKey.this);
            this.arg = arg;
        }

        @Override
        public String toString() {
            return mnemonic + " " + printer.apply(arg);
        }
    }

    public UnaryOp create(T arg) {
        return new UnaryOp(Objects.requireNonNull(arg, mnemonic));
    }

    public boolean check(Op op) {
        return op.key == this;
    }

    @SuppressWarnings("unchecked")
    public @Nullable UnaryOp checkNullable(Op op) {
        return check(op) ? (UnaryOp) op : null;
    }

    public @Nullable T argNullable(Op op) {
        UnaryOp unary = checkNullable(op);
        return unary == null ? null : unary.arg;
    }

    /**
     * Get {@code op} as an operation of this key.
     *
     * @param op The operation.
     * @return The operation, with its intermediate.
     * @throws ClassCastException If the operation has a different key.
     */
    public UnaryOp cast(Op op) {
        UnaryOp unary = checkNullable(op);
        if (unary == null) throw new ClassCastException(op + " is not " + mnemonic);
        return unary;
    }
}
