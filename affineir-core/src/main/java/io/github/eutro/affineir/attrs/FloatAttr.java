package io.github.eutro.affineir.attrs;

import io.github.eutro.affineir.types.FloatType;

public final class FloatAttr extends Attribute {
    private final double value;
    private final FloatType type;

    private FloatAttr(double value, FloatType type) {
        this.value = value;
        this.type = type;
    }

    public static FloatAttr get(double value, FloatType type) {
        return new FloatAttr(value, type);
    }

    public double getValue() {
        return value;
    }

    public FloatType getType() {
        return type;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof FloatAttr)) return false;
        FloatAttr that = (FloatAttr) o;
        return Double.compare(value, that.value) == 0 && type.equals(that.type);
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value) * 31 + type.hashCode();
    }

    @Override
    public String toString() {
        return value + " : " + type;
    }
}
