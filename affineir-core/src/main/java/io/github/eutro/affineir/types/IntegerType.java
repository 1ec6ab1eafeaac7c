package io.github.eutro.affineir.types;

public final class IntegerType extends Type {
    private final int width;

    private IntegerType(int width) {
        this.width = width;
    }

    public static IntegerType get(int width) {
        if (width <= 0) throw new IllegalArgumentException("integer width must be positive, got " + width);
        return new IntegerType(width);
    }

    public int getWidth() {
        return width;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof IntegerType && ((IntegerType) o).width == width;
    }

    @Override
    public int hashCode() {
        return 31 * width + 1;
    }

    @Override
    public String toString() {
        return "i" + width;
    }
}
