package io.github.eutro.mdsl2ir.ssa;

import io.github.eutro.mdsl2ir.ext.*;
import io.github.eutro.mdsl2ir.ops.RegionOpKey;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An effect, encapsulating an {@link Insn instruction}, and the
 * variables its results are assigned to.
 * <p>
 * Effects are the elements of {@link Region regions}.
 */
public final class Effect extends DelegatingExtHolder {
    private final List<Var> assignsTo;
    private Insn insn;

    Effect(List<Var> assignsTo, Insn insn) {
        this.assignsTo = new TrackedList<Var>(new ArrayList<>(assignsTo.size())) {
            @Override
            protected void onAdded(Var elt) {
                elt.attachExt(CommonExts.ASSIGNED_AT, Effect.this);
            }

            @Override
            protected void onRemoved(Var elt) {
                if (elt.getNullable(CommonExts.ASSIGNED_AT) == Effect.this) {
                    elt.removeExt(CommonExts.ASSIGNED_AT);
                }
            }
        };
        this.assignsTo.addAll(assignsTo);
        setInsn(insn);
    }

    @Override
    protected ExtContainer getDelegate() {
        return insn;
    }

    /**
     * Get the list of variables this effect assigns to.
     *
     * @return The list.
     */
    public List<Var> getAssignsTo() {
        return assignsTo;
    }

    /**
     * Get the {@link Insn underlying instruction} of this effect.
     *
     * @return The instruction.
     */
    public Insn insn() {
        return insn;
    }

    /**
     * Set the {@link Insn underlying instruction} of this effect.
     * <p>
     * Any regions held by the instruction's operation become owned by this effect.
     *
     * @param insn The instruction.
     */
    public void setInsn(Insn insn) {
        insn.attachExt(CommonExts.OWNING_EFFECT, this);
        this.insn = insn;
        for (Region region : getRegions()) {
            region.attachExt(CommonExts.OWNING_EFFECT, this);
        }
    }

    /**
     * Get the regions held by the operation of this effect.
     *
     * @return The regions, empty for operations that hold none.
     */
    public List<Region> getRegions() {
        if (insn.op instanceof RegionOpKey.RegionOp) {
            return ((RegionOpKey.RegionOp) insn.op).regions;
        }
        return Collections.emptyList();
    }

    /**
     * Get the region this effect is in.
     *
     * @return The region, or null if the effect is not in one.
     */
    public @Nullable Region getRegion() {
        return owner;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (!assignsTo.isEmpty()) {
            sb.append(assignsTo.stream()
                    .map(Objects::toString)
                    .collect(Collectors.joining(", ", "", " = ")));
        }
        sb.append(insn);
        return sb.toString();
    }

    // exts
    private Region owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_REGION) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_REGION) {
            owner = (Region) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_REGION) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
