package io.github.eutro.affineir.ir;

import org.jetbrains.annotations.Nullable;

/**
 * A use of a {@link Value} as an operand of an {@link Operation}.
 */
public final class OpOperand extends IROperand<OpOperand, Value> {
    int operandNumber;

    OpOperand(Operation owner, @Nullable Value value, int operandNumber) {
        super(owner, value);
        this.operandNumber = operandNumber;
    }

    public int getOperandNumber() {
        return operandNumber;
    }
}
