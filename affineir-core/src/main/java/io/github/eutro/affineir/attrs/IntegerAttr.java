package io.github.eutro.affineir.attrs;

import io.github.eutro.affineir.types.IndexType;
import io.github.eutro.affineir.types.IntegerType;
import io.github.eutro.affineir.types.Type;

public final class IntegerAttr extends Attribute {
    private final long value;
    private final Type type;

    private IntegerAttr(long value, Type type) {
        this.value = value;
        this.type = type;
    }

    public static IntegerAttr get(long value, Type type) {
        if (!type.isIntOrIndex()) throw new IllegalArgumentException("not an integer type: " + type);
        return new IntegerAttr(value, type);
    }

    public static IntegerAttr index(long value) {
        return new IntegerAttr(value, IndexType.get());
    }

    public static IntegerAttr i64(long value) {
        return new IntegerAttr(value, IntegerType.get(64));
    }

    public long getValue() {
        return value;
    }

    public Type getType() {
        return type;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof IntegerAttr)) return false;
        IntegerAttr that = (IntegerAttr) o;
        return value == that.value && type.equals(that.type);
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value) * 31 + type.hashCode();
    }

    @Override
    public String toString() {
        return value + " : " + type;
    }
}
