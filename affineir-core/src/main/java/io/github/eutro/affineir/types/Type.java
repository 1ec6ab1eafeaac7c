package io.github.eutro.affineir.types;

/**
 * The type of a {@link io.github.eutro.affineir.ir.Value}.
 * <p>
 * Types are immutable and compared structurally. {@link #toString()} gives the textual form.
 */
public abstract class Type {
    @Override
    public abstract boolean equals(Object o);

    @Override
    public abstract int hashCode();

    @Override
    public abstract String toString();

    public boolean isIndex() {
        return this instanceof IndexType;
    }

    public boolean isIntOrIndex() {
        return this instanceof IndexType || this instanceof IntegerType;
    }
}
