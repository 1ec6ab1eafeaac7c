package io.github.eutro.affineir.attrs;

/**
 * An immutable compile-time fact attached to an {@link io.github.eutro.affineir.ir.Operation}.
 * <p>
 * Attributes are compared structurally and {@link #toString()} gives their textual form.
 */
public abstract class Attribute {
    @Override
    public abstract boolean equals(Object o);

    @Override
    public abstract int hashCode();

    @Override
    public abstract String toString();
}
