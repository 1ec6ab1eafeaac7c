package io.github.eutro.affineir.ops;

import io.github.eutro.affineir.ext.ExtHolder;

/**
 * A kind of operation, such as {@code affine.for}.
 * <p>
 * Operations of a kind share the exts attached to the key, which is where dialects register
 * verifiers, folders, printers, parsers, canonicalization patterns and traits.
 */
public class OpKey extends ExtHolder {
    private final String name;
    private final boolean registered;

    public OpKey(String name) {
        this(name, true);
    }

    private OpKey(String name, boolean registered) {
        this.name = name;
        this.registered = registered;
    }

    /**
     * Create a key for an operation no dialect knows about, such as one read from text.
     * Such operations have no behaviour beyond the generic one.
     *
     * @param name The full name.
     * @return The key.
     */
    public static OpKey unregistered(String name) {
        return new OpKey(name, false);
    }

    /**
     * @return The full name, including the dialect namespace.
     */
    public String getName() {
        return name;
    }

    /**
     * @return The part of the name before the first {@code .}, or the empty string.
     */
    public String getDialectNamespace() {
        int dot = name.indexOf('.');
        return dot < 0 ? "" : name.substring(0, dot);
    }

    /**
     * @return The part of the name after the dialect namespace.
     */
    public String getOpName() {
        int dot = name.indexOf('.');
        return dot < 0 ? name : name.substring(dot + 1);
    }

    public boolean isRegistered() {
        return registered;
    }

    @Override
    public String toString() {
        return name;
    }
}
