package io.github.eutro.affineir.rewrite;

import io.github.eutro.affineir.ir.OpBuilder;
import io.github.eutro.affineir.ir.Operation;
import io.github.eutro.affineir.ir.OperationState;
import io.github.eutro.affineir.ir.Value;

import java.util.List;

/**
 * The builder patterns make their changes through, so a driver can track what changed.
 */
public class PatternRewriter extends OpBuilder {
    /**
     * Replace the results of {@code op} with {@code values} and erase it.
     *
     * @param op     The operation.
     * @param values The replacements.
     */
    public void replaceOp(Operation op, List<? extends Value> values) {
        notifyRootReplaced(op);
        op.replaceAllUsesWith(values);
        eraseOp(op);
    }

    /**
     * Create an operation just before {@code op}, then replace {@code op} with its results.
     *
     * @param op    The operation to replace.
     * @param state The new operation.
     * @return The new operation.
     */
    public Operation replaceOpWithNewOp(Operation op, OperationState state) {
        setInsertionPoint(op);
        Operation newOp = create(state);
        replaceOp(op, newOp.getResults());
        return newOp;
    }

    public void eraseOp(Operation op) {
        notifyOperationRemoved(op);
        op.erase();
    }

    /**
     * Record that {@code op} was changed in place, such as by setting its operands or attributes.
     *
     * @param op The operation.
     */
    public void updatedRootInPlace(Operation op) {
    }

    protected void notifyRootReplaced(Operation op) {
    }

    protected void notifyOperationRemoved(Operation op) {
    }
}
