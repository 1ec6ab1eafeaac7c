package io.github.eutro.affineir.affine;

import io.github.eutro.affineir.affine.expr.AffineMap;
import io.github.eutro.affineir.ir.Value;

import java.util.List;

/**
 * The lower or upper bound of an {@code affine.for}: a map and the contiguous range of the loop's operands
 * it is applied to. A bound with several results is their maximum, for a lower bound, or minimum,
 * for an upper bound.
 */
public final class AffineBound {
    private final AffineForOp forOp;
    private final int opStart;
    private final int opEnd;
    private final AffineMap map;

    AffineBound(AffineForOp forOp, int opStart, int opEnd, AffineMap map) {
        this.forOp = forOp;
        this.opStart = opStart;
        this.opEnd = opEnd;
        this.map = map;
    }

    public AffineForOp getAffineForOp() {
        return forOp;
    }

    public AffineMap getMap() {
        return map;
    }

    public int getNumOperands() {
        return opEnd - opStart;
    }

    public Value getOperand(int index) {
        if (index < 0 || index >= getNumOperands()) throw new IndexOutOfBoundsException(index);
        return forOp.getOperation().getOperand(opStart + index);
    }

    public List<Value> getOperands() {
        return forOp.getOperation().operandRange(opStart, opEnd);
    }

    /**
     * @return The bound as a map and its operands.
     */
    public MapAndOperands getAsMapAndOperands() {
        return new MapAndOperands(map, getOperands());
    }
}
