package io.github.eutro.affineir.attrs;

import java.util.Objects;

/**
 * An attribute together with the name it is stored under on an operation.
 */
public final class NamedAttribute {
    private final String name;
    private final Attribute value;

    public NamedAttribute(String name, Attribute value) {
        this.name = Objects.requireNonNull(name);
        this.value = Objects.requireNonNull(value);
    }

    public String getName() {
        return name;
    }

    public Attribute getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof NamedAttribute)) return false;
        NamedAttribute that = (NamedAttribute) o;
        return name.equals(that.name) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return name.hashCode() * 31 + value.hashCode();
    }

    @Override
    public String toString() {
        return value instanceof UnitAttr ? name : name + " = " + value;
    }
}
