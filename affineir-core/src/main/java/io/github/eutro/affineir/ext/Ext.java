package io.github.eutro.affineir.ext;

import org.jetbrains.annotations.NotNull;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A typed key under which a value of type {@code T} can be stored in an {@link ExtContainer}.
 * <p>
 * Exts are compared by identity of creation, so two exts with the same name are still distinct.
 * The order defined by {@link #compareTo(Ext)} is the order in which exts were created,
 * and should not be relied on across runs.
 *
 * @param <T> The type of the value.
 */
public final class Ext<T> implements Comparable<Ext<?>> {
    private static final AtomicInteger ID_COUNTER = new AtomicInteger(0);

    private final Class<? super T> type;
    private final int id = ID_COUNTER.getAndIncrement();
    private final String name;

    private Ext(Class<? super T> type, String name) {
        this.type = type;
        this.name = name;
    }

    /**
     * Create a new ext.
     * <p>
     * The class only aids debugging, since it cannot express a generic type such as
     * {@code List<RewritePattern>}; the actual type of the ext is inferred at the call site.
     *
     * @param type The most specific class of the value type.
     * @param name A human readable name.
     * @param <T>  The class type.
     * @param <R>  The type of the ext.
     * @return The new ext.
     */
    public static <T, R extends T> Ext<R> create(Class<T> type, String name) {
        return new Ext<>(type, name);
    }

    public Class<? super T> getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    /**
     * Look this ext up in the given container.
     *
     * @param ec The container.
     * @return The value, if present.
     * @see ExtContainer#getExt(Ext)
     */
    public Optional<T> getIn(ExtContainer ec) {
        return ec.getExt(this);
    }

    @Override
    public int compareTo(@NotNull Ext<?> o) {
        return Integer.compare(id, o.id);
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        return name + ": " + type.getName();
    }
}
