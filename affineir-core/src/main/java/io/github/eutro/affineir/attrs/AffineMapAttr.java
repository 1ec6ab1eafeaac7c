package io.github.eutro.affineir.attrs;

import io.github.eutro.affineir.affine.expr.AffineMap;

public final class AffineMapAttr extends Attribute {
    private final AffineMap value;

    private AffineMapAttr(AffineMap value) {
        this.value = value;
    }

    public static AffineMapAttr get(AffineMap value) {
        return new AffineMapAttr(value);
    }

    public AffineMap getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AffineMapAttr && ((AffineMapAttr) o).value.equals(value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "affine_map<" + value + ">";
    }
}
