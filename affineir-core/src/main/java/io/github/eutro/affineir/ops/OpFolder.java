package io.github.eutro.affineir.ops;

import io.github.eutro.affineir.attrs.Attribute;
import io.github.eutro.affineir.ir.Operation;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Folds an operation, given what is known about its operands, without changing the IR.
 */
@FunctionalInterface
public interface OpFolder {
    /**
     * @param op            The operation.
     * @param constOperands The constant value of each operand, null where unknown.
     * @param results       Receives one result per result of the operation, if folding succeeds.
     * @return Whether folding succeeded.
     */
    boolean fold(Operation op, List<@Nullable Attribute> constOperands, List<FoldResult> results);
}
