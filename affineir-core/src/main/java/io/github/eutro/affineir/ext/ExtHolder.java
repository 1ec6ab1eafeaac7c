package io.github.eutro.affineir.ext;

import org.jetbrains.annotations.Nullable;

import java.util.Arrays;

/**
 * An {@link ExtContainer} storing its exts in a small array kept sorted by {@link Ext} order.
 * <p>
 * Op kinds hold a handful of hooks and traits, and most values and blocks hold none,
 * so nothing is allocated until the first ext is attached.
 */
public class ExtHolder implements ExtContainer {
    private static final Ext<?>[] NO_EXTS = new Ext<?>[0];
    private static final Object[] NO_VALUES = new Object[0];

    private Ext<?>[] exts = NO_EXTS;
    private Object[] values = NO_VALUES;
    private int size = 0;

    private int indexOf(Ext<?> ext) {
        return Arrays.binarySearch(exts, 0, size, ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        int index = indexOf(ext);
        if (index >= 0) {
            values[index] = value;
            return;
        }
        int insertAt = -index - 1;
        if (size == exts.length) {
            int capacity = Math.max(2, size * 2);
            exts = Arrays.copyOf(exts, capacity);
            values = Arrays.copyOf(values, capacity);
        }
        System.arraycopy(exts, insertAt, exts, insertAt + 1, size - insertAt);
        System.arraycopy(values, insertAt, values, insertAt + 1, size - insertAt);
        exts[insertAt] = ext;
        values[insertAt] = value;
        size++;
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        int index = indexOf(ext);
        if (index < 0) return;
        size--;
        System.arraycopy(exts, index + 1, exts, index, size - index);
        System.arraycopy(values, index + 1, values, index, size - index);
        exts[size] = null;
        values[size] = null;
        if (size == 0) {
            exts = NO_EXTS;
            values = NO_VALUES;
        }
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        int index = indexOf(ext);
        return index < 0 ? null : (T) values[index];
    }
}
