package io.github.eutro.mdsl2ir.ops;

import io.github.eutro.mdsl2ir.ext.CommonExts;
import io.github.eutro.mdsl2ir.ssa.Effect;
import io.github.eutro.mdsl2ir.ssa.Insn;
import io.github.eutro.mdsl2ir.ssa.Var;
import org.jetbrains.annotations.Nullable;

/**
 * A collection of {@link Op}s and {@link OpKey}s that any function may contain.
 */
public class CommonOps {
    /**
     * Effect: returns the constant. Integers are {@link Long}s (unsigned ones reinterpreted),
     * floating point numbers are {@link Double}s or {@link Float}s, and booleans and strings are themselves.
     */
    public static final UnaryOpKey<Object> CONST = new UnaryOpKey<>("const", CommonOps::printConstant);

    /**
     * Effect: returns its argument, under a new name.
     */
    public static final Op RENAME = new SimpleOpKey("rename").create();

    /**
     * Terminator: returns its arguments from the function.
     * <p>
     * In the body of a parallel loop, instead returns its arguments from the iteration.
     */
    public static final Op RETURN = new SimpleOpKey("return").create();

    static {
        CommonExts.markPure(CONST);
        CommonExts.markPure(RENAME.key);
        CommonExts.markTerminator(RETURN.key);
    }

    /**
     * Return a constant instruction which returns {@code k}.
     *
     * @param k The constant.
     * @return The instruction.
     */
    public static Insn constant(Object k) {
        return CONST.create(k).insn();
    }

    /**
     * Get the value of a variable assigned by a {@link #CONST} instruction.
     *
     * @param var The variable.
     * @return The constant, or null if the variable is not a constant.
     */
    public static @Nullable Object constantValue(Var var) {
        Effect fx = var.getNullable(CommonExts.ASSIGNED_AT);
        if (fx == null) return null;
        return CONST.argNullable(fx.insn().op);
    }

    private static String printConstant(Object k) {
        if (k instanceof String) {
            StringBuilder sb = new StringBuilder("\"");
            for (char c : ((String) k).toCharArray()) {
                switch (c) {
                    case '"':
                        sb.append("\\\"");
                        break;
                    case '\\':
                        sb.append("\\\\");
                        break;
                    case '\n':
                        sb.append("\\n");
                        break;
                    case '\t':
                        sb.append("\\t");
                        break;
                    default:
                        sb.append(c);
                }
            }
            return sb.append('"').toString();
        }
        return String.valueOf(k);
    }
}
