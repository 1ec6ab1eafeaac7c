package io.github.eutro.affineir.affine;

import io.github.eutro.affineir.ir.Location;
import io.github.eutro.affineir.ir.OpBuilder;
import io.github.eutro.affineir.ir.Operation;
import io.github.eutro.affineir.ir.OperationState;
import io.github.eutro.affineir.ir.VerificationResult;
import io.github.eutro.affineir.ops.OpView;

/**
 * Ends the body of an {@code affine.for} or {@code affine.if}, passing control to the end of the enclosing operation.
 * It has no custom form; the custom forms of its parents leave it out.
 */
public final class AffineTerminatorOp extends OpView {
    private AffineTerminatorOp(Operation op) {
        super(op);
    }

    public static AffineTerminatorOp cast(Operation op) {
        return new AffineTerminatorOp(checkKind(op, AffineOps.TERMINATOR));
    }

    public static OperationState build(Location location) {
        return new OperationState(location, AffineOps.TERMINATOR);
    }

    public static AffineTerminatorOp create(OpBuilder builder, Location location) {
        return new AffineTerminatorOp(builder.create(build(location)));
    }

    static VerificationResult verifyOp(Operation op) {
        if (op.getNumOperands() != 0) return op.emitOpError("requires zero operands");
        if (op.getNumResults() != 0) return op.emitOpError("requires zero results");
        return VerificationResult.success();
    }
}
