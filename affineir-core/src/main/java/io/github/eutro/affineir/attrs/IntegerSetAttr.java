package io.github.eutro.affineir.attrs;

import io.github.eutro.affineir.affine.expr.IntegerSet;

public final class IntegerSetAttr extends Attribute {
    private final IntegerSet value;

    private IntegerSetAttr(IntegerSet value) {
        this.value = value;
    }

    public static IntegerSetAttr get(IntegerSet value) {
        return new IntegerSetAttr(value);
    }

    public IntegerSet getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof IntegerSetAttr && ((IntegerSetAttr) o).value.equals(value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "affine_set<" + value + ">";
    }
}
