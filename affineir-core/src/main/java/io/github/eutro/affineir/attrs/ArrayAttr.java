package io.github.eutro.affineir.attrs;

import java.util.List;
import java.util.stream.Collectors;

public final class ArrayAttr extends Attribute {
    private final List<Attribute> value;

    private ArrayAttr(List<Attribute> value) {
        this.value = value;
    }

    public static ArrayAttr get(List<? extends Attribute> value) {
        return new ArrayAttr(List.copyOf(value));
    }

    public List<Attribute> getValue() {
        return value;
    }

    public int size() {
        return value.size();
    }

    public Attribute get(int index) {
        return value.get(index);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ArrayAttr && ((ArrayAttr) o).value.equals(value);
    }

    @Override
    public int hashCode() {
        return value.hashCode() + 11;
    }

    @Override
    public String toString() {
        return value.stream().map(Attribute::toString).collect(Collectors.joining(", ", "[", "]"));
    }
}
