package io.github.eutro.mdsl2ir.ssa;

import io.github.eutro.mdsl2ir.ext.CommonExts;
import io.github.eutro.mdsl2ir.ext.Ext;
import io.github.eutro.mdsl2ir.ext.ExtHolder;
import io.github.eutro.mdsl2ir.types.Type;
import org.jetbrains.annotations.Nullable;

/**
 * A typed SSA value.
 * <p>
 * Each variable is either assigned by exactly one {@link Effect}, or is
 * one of the arguments of a {@link Region}.
 */
public final class Var extends ExtHolder {
    /**
     * A name hint, for debugging. Not necessarily unique.
     */
    public final String name;
    /**
     * The type of the value.
     */
    public final Type type;

    Var(String name, Type type) {
        this.name = name;
        this.type = type;
    }

    /**
     * Get the region this variable is visible in: the region of its assigning effect,
     * or the region it is an argument of.
     *
     * @return The region, or null if the variable is not (yet) defined anywhere.
     */
    public @Nullable Region getDefiningRegion() {
        if (assignedAt != null) return assignedAt.getNullable(CommonExts.OWNING_REGION);
        return argOf;
    }

    @Override
    public String toString() {
        return '$' + name;
    }

    // exts
    private Effect assignedAt = null;
    private Region argOf = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.ASSIGNED_AT) {
            return (T) assignedAt;
        }
        if (ext == CommonExts.ARG_OF) {
            return (T) argOf;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.ASSIGNED_AT) {
            assignedAt = (Effect) value;
            return;
        }
        if (ext == CommonExts.ARG_OF) {
            argOf = (Region) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.ASSIGNED_AT) {
            assignedAt = null;
            return;
        }
        if (ext == CommonExts.ARG_OF) {
            argOf = null;
            return;
        }
        super.removeExt(ext);
    }
}
