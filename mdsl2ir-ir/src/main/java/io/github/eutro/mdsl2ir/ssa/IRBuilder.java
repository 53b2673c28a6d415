package io.github.eutro.mdsl2ir.ssa;

import io.github.eutro.mdsl2ir.ext.CommonExts;
import io.github.eutro.mdsl2ir.ops.CommonOps;
import io.github.eutro.mdsl2ir.types.Type;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * An IR, or instruction, builder, which encapsulates a position in a function
 * where instructions are being inserted.
 */
public class IRBuilder {
    /**
     * The function being inserted into.
     */
    public Function func;
    private Region region;
    private @Nullable SourceLocation location;

    /**
     * Construct an instruction builder, inserting at the end of a region of a function.
     *
     * @param func   The function.
     * @param region A region of the function.
     */
    public IRBuilder(Function func, Region region) {
        this.func = func;
        this.region = region;
    }

    /**
     * Construct an instruction builder, inserting at the end of a function's body.
     *
     * @param func The function.
     */
    public IRBuilder(Function func) {
        this(func, func.body);
    }

    /**
     * Get the region this builder is inserting at the end of.
     *
     * @return The region.
     */
    public Region getRegion() {
        return region;
    }

    /**
     * Set the region this builder should insert at the end of.
     *
     * @param region The region.
     */
    public void setRegion(Region region) {
        this.region = region;
    }

    public @Nullable SourceLocation getLocation() {
        return location;
    }

    /**
     * Set the source location attached to effects inserted from now on.
     *
     * @param location The location, or null for none.
     */
    public void setLocation(@Nullable SourceLocation location) {
        this.location = location;
    }

    /**
     * Insert an effect at the end of the region.
     *
     * @param effect The effect.
     * @return The same effect.
     */
    public Effect insert(Effect effect) {
        if (location != null && effect.getNullable(CommonExts.LOCATION) == null) {
            effect.attachExt(CommonExts.LOCATION, location);
        }
        region.addEffect(effect);
        return effect;
    }

    /**
     * Insert an instruction that produces no results.
     *
     * @param insn The instruction.
     * @return The inserted effect.
     */
    public Effect insert(Insn insn) {
        return insert(insn.assignTo());
    }

    /**
     * Assign the result of the instruction to a variable,
     * and insert the effect.
     *
     * @param insn The instruction.
     * @param v    The variable.
     * @return The same variable.
     */
    public Var insert(Insn insn, Var v) {
        insert(insn.assignTo(v));
        return v;
    }

    /**
     * Assign the result of the instruction to a new variable,
     * and insert the effect.
     *
     * @param insn The instruction.
     * @param name The name of the variable.
     * @param type The type of the variable.
     * @return The assigned variable.
     */
    public Var insert(Insn insn, String name, Type type) {
        return insert(insn, func.newVar(name, type));
    }

    /**
     * Assign the results of the instruction to new variables of the given types,
     * and insert the effect.
     *
     * @param insn  The instruction.
     * @param name  The name of the variables.
     * @param types The types of the results.
     * @return The assigned variables.
     */
    public List<Var> insertMulti(Insn insn, String name, List<? extends Type> types) {
        List<Var> vars = new ArrayList<>(types.size());
        for (Type type : types) {
            vars.add(func.newVar(name, type));
        }
        insert(insn.assignTo(vars));
        return vars;
    }

    /**
     * Insert a constant.
     *
     * @param value The value of the constant.
     * @param type  The type of the constant.
     * @return The variable holding the constant.
     */
    public Var constant(Object value, Type type) {
        return insert(CommonOps.constant(value), "k", type);
    }
}
