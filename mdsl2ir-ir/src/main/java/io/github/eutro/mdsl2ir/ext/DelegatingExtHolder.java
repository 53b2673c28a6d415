package io.github.eutro.mdsl2ir.ext;

import org.jetbrains.annotations.Nullable;

/**
 * An {@link ExtHolder} that falls back to another
 * {@link ExtContainer} for exts it does not hold itself.
 * <p>
 * Instructions delegate to their operations, and operations to their keys,
 * so properties of a whole class of operations can be attached once.
 */
public abstract class DelegatingExtHolder extends ExtHolder {
    /**
     * Get the container to delegate to.
     *
     * @return The delegate, or null.
     */
    protected abstract @Nullable ExtContainer getDelegate();

    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        T localExt = super.getNullable(ext);
        if (localExt != null) return localExt;
        ExtContainer delegate = getDelegate();
        if (delegate != null) return delegate.getNullable(ext);
        return null;
    }
}
