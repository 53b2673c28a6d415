package io.github.eutro.mdsl2ir.ext;

import org.jetbrains.annotations.Nullable;

import java.util.Optional;

/**
 * An IR node that {@link Ext}s can be attached to.
 *
 * @see io.github.eutro.mdsl2ir.ext
 */
public interface ExtContainer {
    /**
     * Set {@code ext} on this node, replacing any previous value.
     *
     * @param ext   The ext.
     * @param value The value.
     * @param <T>   The type of the ext.
     */
    <T> void attachExt(Ext<T> ext, T value);

    /**
     * Clear {@code ext} on this node. Does nothing if it was not set.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     */
    <T> void removeExt(Ext<T> ext);

    /**
     * Get the value of {@code ext} on this node.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value, or null if it is not set.
     */
    <T> @Nullable T getNullable(Ext<T> ext);

    default <T> Optional<T> getExt(Ext<T> ext) {
        return Optional.ofNullable(getNullable(ext));
    }

    default <T> T getExtOrThrow(Ext<T> ext) {
        T value = getNullable(ext);
        if (value == null) {
            throw new IllegalStateException(String.format("%s has no %s", this, ext.getName()));
        }
        return value;
    }
}
