package io.github.eutro.mdsl2ir.types;

/**
 * The type of a value whose type will only be inferred by a later stage.
 */
public final class UnknownType extends Type {
    public static final UnknownType INSTANCE = new UnknownType();

    private UnknownType() {
    }

    @Override
    public boolean isUnknown() {
        return true;
    }

    @Override
    public String toString() {
        return "unknown";
    }
}
