package io.github.eutro.mdsl2ir.ssa;

import io.github.eutro.mdsl2ir.ext.CommonExts;
import io.github.eutro.mdsl2ir.ext.DelegatingExtHolder;
import io.github.eutro.mdsl2ir.ext.Ext;
import io.github.eutro.mdsl2ir.ext.ExtContainer;
import io.github.eutro.mdsl2ir.ops.Op;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * An instruction, an {@link Op operation} applied to some argument {@link Var variables}.
 */
public final class Insn extends DelegatingExtHolder implements Iterable<Var> {
    /**
     * Whether instructions should record the stack trace of their construction, for debugging.
     */
    public static boolean TRACK_INSN_CREATIONS = System.getenv("MDSL2IR_TRACK_INSN_CREATIONS") != null;

    public final Throwable created = TRACK_INSN_CREATIONS ? new Throwable("constructed") : null;
    /**
     * The operation of this instruction.
     */
    public final Op op;
    private final List<Var> args;

    public Insn(Op op, List<Var> args) {
        this.op = op;
        this.args = new ArrayList<>(args);
    }

    public Insn(Op op, Var... args) {
        this(op, Arrays.asList(args));
    }

    @Override
    protected ExtContainer getDelegate() {
        return op;
    }

    /**
     * Get the mutable list of arguments of this instruction.
     *
     * @return The arguments.
     */
    public List<Var> args() {
        return args;
    }

    @NotNull
    @Override
    public Iterator<Var> iterator() {
        return args.iterator();
    }

    /**
     * Create an effect assigning the results of this instruction to the given variables.
     *
     * @param vars The variables.
     * @return The effect.
     */
    public Effect assignTo(Var... vars) {
        return new Effect(Arrays.asList(vars), this);
    }

    public Effect assignTo(List<Var> vars) {
        return new Effect(vars, this);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(op);
        for (Var arg : args) {
            sb.append(' ').append(arg);
        }
        return sb.toString();
    }

    // exts
    private Effect owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_EFFECT) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_EFFECT) {
            owner = (Effect) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_EFFECT) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
