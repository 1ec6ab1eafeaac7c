package io.github.eutro.affineir.ext;

import org.jetbrains.annotations.Nullable;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Something {@link Ext}s can be attached to. See the {@link io.github.eutro.affineir.ext package documentation}.
 */
public interface ExtContainer {
    /**
     * Associate {@code ext} with {@code value} in this container, replacing any previous value.
     *
     * @param ext   The ext.
     * @param value The value.
     * @param <T>   The type of the ext.
     */
    <T> void attachExt(Ext<T> ext, T value);

    /**
     * Remove the value of {@code ext} from this container, if any.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     */
    <T> void removeExt(Ext<T> ext);

    /**
     * Get the value of {@code ext} in this container.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value, or null if absent.
     */
    <T> @Nullable T getNullable(Ext<T> ext);

    default <T> Optional<T> getExt(Ext<T> ext) {
        return Optional.ofNullable(getNullable(ext));
    }

    /**
     * Get the value of {@code ext} in this container, throwing if it is absent.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value.
     * @throws IllegalStateException If the ext is absent.
     */
    default <T> T getExtOrThrow(Ext<T> ext) {
        T value = getNullable(ext);
        if (value != null) return value;
        throw new IllegalStateException("Ext " + ext + " not present");
    }

    /**
     * Get the value of {@code ext} in this container, or {@code dflt} if absent.
     *
     * @param ext  The ext.
     * @param dflt The default.
     * @param <T>  The type of the ext.
     * @return The value or the default.
     */
    default <T> T getExtOr(Ext<T> ext, T dflt) {
        T value = getNullable(ext);
        return value == null ? dflt : value;
    }

    /**
     * Get the value of {@code ext} in this container, computing and attaching it if absent.
     *
     * @param ext     The ext.
     * @param compute Computes the value if it is absent.
     * @param <T>     The type of the ext.
     * @return The value.
     */
    default <T> T getExtOrCompute(Ext<T> ext, Supplier<T> compute) {
        T value = getNullable(ext);
        if (value != null) return value;
        value = compute.get();
        attachExt(ext, value);
        return value;
    }

    /**
     * Whether {@code flag} is attached to this container with the value {@code true}.
     *
     * @param flag The flag ext.
     * @return Whether the flag is set.
     */
    default boolean hasFlag(Ext<Boolean> flag) {
        return Boolean.TRUE.equals(getNullable(flag));
    }
}
