package io.github.eutro.spv2sl.ext;

import org.jetbrains.annotations.Nullable;

/**
 * An {@link ExtHolder} that falls back to another container for exts it does not have itself.
 * Instructions inherit properties such as purity from their operation this way.
 */
public abstract class DelegatingExtHolder extends ExtHolder {
    protected abstract ExtContainer getDelegate();

    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        T localExt = super.getNullable(ext);
        if (localExt != null) return localExt;
        return getDelegate().getNullable(ext);
    }
}
