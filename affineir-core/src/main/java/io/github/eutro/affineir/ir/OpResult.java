package io.github.eutro.affineir.ir;

import io.github.eutro.affineir.types.Type;
import org.jetbrains.annotations.Nullable;

public final class OpResult extends Value {
    private final Operation owner;
    private final int resultNumber;

    OpResult(Operation owner, int resultNumber, Type type) {
        super(type);
        this.owner = owner;
        this.resultNumber = resultNumber;
    }

    public Operation getOwner() {
        return owner;
    }

    public int getResultNumber() {
        return resultNumber;
    }

    @Override
    public Operation getDefiningOp() {
        return owner;
    }

    @Override
    public @Nullable Block getParentBlock() {
        return owner.getBlock();
    }

    @Override
    public String toString() {
        return "result #" + resultNumber + " of '" + owner.getName() + "' : " + getType();
    }
}
