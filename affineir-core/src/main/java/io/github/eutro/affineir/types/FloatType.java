package io.github.eutro.affineir.types;

public final class FloatType extends Type {
    private final int width;

    private FloatType(int width) {
        this.width = width;
    }

    public static FloatType get(int width) {
        switch (width) {
            case 16:
            case 32:
            case 64:
                return new FloatType(width);
            default:
                throw new IllegalArgumentException("unsupported float width " + width);
        }
    }

    public int getWidth() {
        return width;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FloatType && ((FloatType) o).width == width;
    }

    @Override
    public int hashCode() {
        return 37 * width + 2;
    }

    @Override
    public String toString() {
        return "f" + width;
    }
}
