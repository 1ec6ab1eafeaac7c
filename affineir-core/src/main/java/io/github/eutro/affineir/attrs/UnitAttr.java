package io.github.eutro.affineir.attrs;

/**
 * An attribute whose presence is the only fact it carries.
 */
public final class UnitAttr extends Attribute {
    private static final UnitAttr INSTANCE = new UnitAttr();

    private UnitAttr() {
    }

    public static UnitAttr get() {
        return INSTANCE;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof UnitAttr;
    }

    @Override
    public int hashCode() {
        return 1;
    }

    @Override
    public String toString() {
        return "unit";
    }
}
