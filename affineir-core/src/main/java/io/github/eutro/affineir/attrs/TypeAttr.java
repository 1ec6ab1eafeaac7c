package io.github.eutro.affineir.attrs;

import io.github.eutro.affineir.types.Type;

public final class TypeAttr extends Attribute {
    private final Type value;

    private TypeAttr(Type value) {
        this.value = value;
    }

    public static TypeAttr get(Type value) {
        return new TypeAttr(value);
    }

    public Type getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TypeAttr && ((TypeAttr) o).value.equals(value);
    }

    @Override
    public int hashCode() {
        return value.hashCode() + 7;
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
