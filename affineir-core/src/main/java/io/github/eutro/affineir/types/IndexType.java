package io.github.eutro.affineir.types;

/**
 * The platform sized integer type used for loop induction variables, affine map operands and memref indices.
 */
public final class IndexType extends Type {
    private static final IndexType INSTANCE = new IndexType();

    private IndexType() {
    }

    public static IndexType get() {
        return INSTANCE;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof IndexType;
    }

    @Override
    public int hashCode() {
        return IndexType.class.hashCode();
    }

    @Override
    public String toString() {
        return "index";
    }
}
