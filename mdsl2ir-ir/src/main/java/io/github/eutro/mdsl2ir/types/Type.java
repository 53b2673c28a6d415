package io.github.eutro.mdsl2ir.types;

/**
 * The type of an IR value.
 * <p>
 * Types are immutable and compared structurally. See {@link Types} for
 * the operations the translator performs on them.
 */
public abstract class Type {
    Type() {
    }

    /**
     * Whether this is the not-yet-known type.
     *
     * @return Whether this is {@link UnknownType#INSTANCE}.
     */
    public boolean isUnknown() {
        return false;
    }

    /**
     * Whether values of this type are data objects (matrices or frames),
     * as opposed to scalars.
     *
     * @return Whether this is a data object type.
     */
    public boolean isDataObject() {
        return false;
    }
}
