package io.github.eutro.affineir.types;

import java.util.Arrays;

/**
 * A reference to a shaped region of memory, such as {@code memref<4x?xf32, 1>}.
 * <p>
 * Dynamic extents are stored as {@link #DYNAMIC}. The memory space defaults to 0 and is omitted when printed.
 */
public final class MemRefType extends Type {
    public static final long DYNAMIC = -1;

    private final long[] shape;
    private final Type elementType;
    private final int memorySpace;

    private MemRefType(long[] shape, Type elementType, int memorySpace) {
        this.shape = shape;
        this.elementType = elementType;
        this.memorySpace = memorySpace;
    }

    public static MemRefType get(long[] shape, Type elementType) {
        return get(shape, elementType, 0);
    }

    public static MemRefType get(long[] shape, Type elementType, int memorySpace) {
        for (long dim : shape) {
            if (dim < 0 && dim != DYNAMIC) {
                throw new IllegalArgumentException("invalid memref extent " + dim);
            }
        }
        if (elementType instanceof MemRefType || elementType instanceof FunctionType) {
            throw new IllegalArgumentException("invalid memref element type " + elementType);
        }
        return new MemRefType(shape.clone(), elementType, memorySpace);
    }

    public int getRank() {
        return shape.length;
    }

    public long[] getShape() {
        return shape.clone();
    }

    public long getDimSize(int i) {
        return shape[i];
    }

    public boolean isDynamicDim(int i) {
        return shape[i] == DYNAMIC;
    }

    public boolean hasStaticShape() {
        for (long dim : shape) {
            if (dim == DYNAMIC) return false;
        }
        return true;
    }

    public Type getElementType() {
        return elementType;
    }

    public int getMemorySpace() {
        return memorySpace;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MemRefType)) return false;
        MemRefType that = (MemRefType) o;
        return memorySpace == that.memorySpace
                && Arrays.equals(shape, that.shape)
                && elementType.equals(that.elementType);
    }

    @Override
    public int hashCode() {
        return (Arrays.hashCode(shape) * 31 + elementType.hashCode()) * 31 + memorySpace;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("memref<");
        for (long dim : shape) {
            sb.append(dim == DYNAMIC ? "?" : Long.toString(dim)).append('x');
        }
        sb.append(elementType);
        if (memorySpace != 0) sb.append(", ").append(memorySpace);
        return sb.append('>').toString();
    }
}
