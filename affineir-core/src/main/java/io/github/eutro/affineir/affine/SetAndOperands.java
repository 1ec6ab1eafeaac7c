package io.github.eutro.affineir.affine;

import io.github.eutro.affineir.affine.expr.IntegerSet;
import io.github.eutro.affineir.ir.Value;

import java.util.List;

/**
 * An integer set together with the values applied to its inputs, dimensions first.
 */
public final class SetAndOperands {
    private final IntegerSet set;
    private final List<Value> operands;

    public SetAndOperands(IntegerSet set, List<Value> operands) {
        if (set.getNumInputs() != operands.size()) {
            throw new IllegalArgumentException("set " + set + " has " + set.getNumInputs()
                    + " inputs, but " + operands.size() + " operands were given");
        }
        this.set = set;
        this.operands = List.copyOf(operands);
    }

    public IntegerSet getSet() {
        return set;
    }

    public List<Value> getOperands() {
        return operands;
    }

    @Override
    public String toString() {
        return set + " " + operands;
    }
}
