package io.github.eutro.affineir.affine;

import io.github.eutro.affineir.affine.expr.AffineMap;
import io.github.eutro.affineir.ir.Operation;
import io.github.eutro.affineir.ir.Value;
import io.github.eutro.affineir.rewrite.PatternRewriter;
import io.github.eutro.affineir.rewrite.RewritePattern;
import io.github.eutro.affineir.std.ConstantOp;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Replaces non-constant loop bounds whose operands are all constants with the constant they evaluate to:
 * the largest result of a lower bound, or the smallest result of an upper bound.
 */
final class AffineForLoopBoundFolder extends RewritePattern {
    private static final Logger LOGGER = Logger.getLogger(AffineForLoopBoundFolder.class.getName());

    AffineForLoopBoundFolder() {
        super(AffineOps.FOR, 1);
    }

    @Override
    public boolean matchAndRewrite(Operation op, PatternRewriter rewriter) {
        AffineForOp forOp = AffineForOp.cast(op);
        boolean folded = false;
        if (!forOp.hasConstantLowerBound()) folded |= foldBound(forOp, true);
        if (!forOp.hasConstantUpperBound()) folded |= foldBound(forOp, false);
        if (folded) rewriter.updatedRootInPlace(op);
        return folded;
    }

    private static boolean foldBound(AffineForOp forOp, boolean lower) {
        AffineBound bound = lower ? forOp.getLowerBound() : forOp.getUpperBound();
        List<Long> operandConstants = new ArrayList<>(bound.getNumOperands());
        for (Value operand : bound.getOperands()) {
            Long constant = ConstantOp.getConstantIndex(operand);
            if (constant == null) return false;
            operandConstants.add(constant);
        }
        AffineMap map = bound.getMap();
        Optional<long[]> results = map.constantFold(operandConstants);
        if (results.isEmpty()) return false;
        long[] values = results.get();
        long maxOrMin = values[0];
        for (int i = 1; i < values.length; i++) {
            maxOrMin = lower ? Math.max(maxOrMin, values[i]) : Math.min(maxOrMin, values[i]);
        }
        long value = maxOrMin;
        LOGGER.finer(() -> "folded " + (lower ? "lower" : "upper") + " bound " + map + " to " + value);
        if (lower) {
            forOp.setConstantLowerBound(value);
        } else {
            forOp.setConstantUpperBound(value);
        }
        return true;
    }
}
