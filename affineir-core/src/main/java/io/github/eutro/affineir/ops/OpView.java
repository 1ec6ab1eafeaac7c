package io.github.eutro.affineir.ops;

import io.github.eutro.affineir.ir.Location;
import io.github.eutro.affineir.ir.Operation;
import io.github.eutro.affineir.ir.VerificationResult;

/**
 * A typed view of an {@link Operation} of a particular kind, giving named accessors to its parts.
 * <p>
 * Views are cheap wrappers; two views are equal if they view the same operation.
 */
public abstract class OpView {
    protected final Operation op;

    protected OpView(Operation op) {
        this.op = op;
    }

    public Operation getOperation() {
        return op;
    }

    public Location getLoc() {
        return op.getLoc();
    }

    public VerificationResult verify() {
        return op.verify();
    }

    protected VerificationResult emitOpError(String message) {
        return op.emitOpError(message);
    }

    /**
     * Check that an operation has the given kind, for the {@code cast} methods of views.
     *
     * @param op  The operation.
     * @param key The kind.
     * @return The operation.
     * @throws ClassCastException If it has another kind.
     */
    protected static Operation checkKind(Operation op, OpKey key) {
        if (op.getKey() != key) {
            throw new ClassCastException("expected '" + key.getName() + "', got '" + op.getName() + "'");
        }
        return op;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof OpView && ((OpView) o).op == op;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(op);
    }

    @Override
    public String toString() {
        return op.toString();
    }
}
