package io.github.eutro.affineir.ext;

import org.jetbrains.annotations.Nullable;

/**
 * An {@link ExtHolder} that falls back to another {@link ExtContainer}
 * for exts it does not hold itself.
 * <p>
 * Operations use this to inherit the behaviour registered on their op kind,
 * while still allowing a single operation to override it.
 */
public abstract class DelegatingExtHolder extends ExtHolder {
    /**
     * Get the container to fall back to.
     *
     * @return The delegate, or null.
     */
    protected abstract @Nullable ExtContainer getDelegate();

    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        T local = super.getNullable(ext);
        if (local != null) return local;
        ExtContainer delegate = getDelegate();
        if (delegate != null) return delegate.getNullable(ext);
        return null;
    }
}
