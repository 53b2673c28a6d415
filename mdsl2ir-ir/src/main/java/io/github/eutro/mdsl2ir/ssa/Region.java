package io.github.eutro.mdsl2ir.ssa;

import io.github.eutro.mdsl2ir.ext.*;
import io.github.eutro.mdsl2ir.ssa.display.IRPrinter;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * A region, an owned sequence of {@link Effect effects} with explicit argument variables.
 * <p>
 * Regions are held either by a {@link Function} as its body, or by the operation
 * of an effect, such as the branches of a conditional or the body of a loop.
 * The last effect of a well-formed region is a terminator, which passes values
 * to the construct owning the region.
 * <p>
 * Effects may use variables defined earlier in the same region, or anywhere before
 * the owning effect in an enclosing region.
 */
public final class Region extends ExtHolder {
    private final List<Var> args = new TrackedList<Var>(new ArrayList<>()) {
        @Override
        protected void onAdded(Var elt) {
            elt.attachExt(CommonExts.ARG_OF, Region.this);
        }

        @Override
        protected void onRemoved(Var elt) {
            if (elt.getNullable(CommonExts.ARG_OF) == Region.this) {
                elt.removeExt(CommonExts.ARG_OF);
            }
        }
    };
    private final List<Effect> effects = new TrackedList<Effect>(new ArrayList<>()) {
        @Override
        protected void onAdded(Effect elt) {
            elt.attachExt(CommonExts.OWNING_REGION, Region.this);
        }

        @Override
        protected void onRemoved(Effect elt) {
            // effects being moved are added to their new region first
            if (elt.getRegion() == Region.this) {
                elt.removeExt(CommonExts.OWNING_REGION);
            }
        }
    };

    /**
     * Get the mutable list of arguments of this region.
     *
     * @return The arguments.
     */
    public List<Var> getArgs() {
        return args;
    }

    /**
     * Get the mutable list of effects in this region.
     *
     * @return The effects.
     */
    public List<Effect> getEffects() {
        return effects;
    }

    public void addEffect(Effect effect) {
        effects.add(effect);
    }

    /**
     * Get the terminator of this region.
     *
     * @return The last effect, if it is a terminator, otherwise null.
     */
    public @Nullable Effect getTerminator() {
        if (effects.isEmpty()) return null;
        Effect last = effects.get(effects.size() - 1);
        return CommonExts.isTerminator(last) ? last : null;
    }

    /**
     * Get the effect whose operation holds this region.
     *
     * @return The effect, or null if this is a function body or detached.
     */
    public @Nullable Effect getOwner() {
        return owner;
    }

    /**
     * Get the region containing the effect that holds this region.
     *
     * @return The parent region, or null.
     */
    public @Nullable Region getParent() {
        return owner == null ? null : owner.getRegion();
    }

    /**
     * Get the function this region is part of, by following parents up to the function body.
     *
     * @return The function, or null if the region is detached.
     */
    public @Nullable Function getFunction() {
        Region r = this;
        while (r.getParent() != null) {
            r = r.getParent();
        }
        return r.function;
    }

    /**
     * Whether this region is {@code other}, or contains it at any depth.
     *
     * @param other The other region.
     * @return Whether this region encloses the other.
     */
    public boolean isAncestorOf(@Nullable Region other) {
        for (Region r = other; r != null; r = r.getParent()) {
            if (r == this) return true;
        }
        return false;
    }

    /**
     * Visit every effect in this region and its nested regions, in program order,
     * each effect before the effects of its regions.
     *
     * @param visitor The visitor.
     */
    public void walk(Consumer<Effect> visitor) {
        for (Effect effect : new ArrayList<>(effects)) {
            visitor.accept(effect);
            for (Region region : effect.getRegions()) {
                region.walk(visitor);
            }
        }
    }

    /**
     * Replace every use of {@code from} with {@code to} in this region and its nested regions.
     *
     * @param from The variable to replace.
     * @param to   The replacement.
     */
    public void replaceUses(Var from, Var to) {
        walk(fx -> {
            List<Var> insnArgs = fx.insn().args();
            for (int i = 0; i < insnArgs.size(); i++) {
                if (insnArgs.get(i) == from) insnArgs.set(i, to);
            }
        });
    }

    /**
     * Whether {@code var} is defined in this region or one of its nested regions.
     *
     * @param var The variable.
     * @return Whether it is defined here.
     */
    public boolean defines(Var var) {
        return isAncestorOf(var.getDefiningRegion());
    }

    @Override
    public String toString() {
        return IRPrinter.print(this);
    }

    // exts
    private Effect owner = null;
    private Function function = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_EFFECT) {
            return (T) owner;
        }
        if (ext == CommonExts.OWNING_FUNCTION) {
            return (T) function;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_EFFECT) {
            owner = (Effect) value;
            return;
        }
        if (ext == CommonExts.OWNING_FUNCTION) {
            function = (Function) value;
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
        if (ext == CommonExts.OWNING_FUNCTION) {
            function = null;
            return;
        }
        super.removeExt(ext);
    }
}
