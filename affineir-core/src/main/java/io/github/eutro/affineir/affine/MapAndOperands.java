package io.github.eutro.affineir.affine;

import io.github.eutro.affineir.affine.expr.AffineMap;
import io.github.eutro.affineir.ir.Value;

import java.util.List;
import java.util.Objects;

/**
 * An affine map together with the values applied to its inputs, dimensions first.
 */
public final class MapAndOperands {
    private final AffineMap map;
    private final List<Value> operands;

    public MapAndOperands(AffineMap map, List<Value> operands) {
        if (map.getNumInputs() != operands.size()) {
            throw new IllegalArgumentException("map " + map + " has " + map.getNumInputs()
                    + " inputs, but " + operands.size() + " operands were given");
        }
        this.map = map;
        this.operands = List.copyOf(operands);
    }

    public AffineMap getMap() {
        return map;
    }

    public List<Value> getOperands() {
        return operands;
    }

    public List<Value> getDimOperands() {
        return operands.subList(0, map.getNumDims());
    }

    public List<Value> getSymbolOperands() {
        return operands.subList(map.getNumDims(), operands.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MapAndOperands that = (MapAndOperands) o;
        return map.equals(that.map) && operands.equals(that.operands);
    }

    @Override
    public int hashCode() {
        return Objects.hash(map, operands);
    }

    @Override
    public String toString() {
        return map + " " + operands;
    }
}
