package io.github.eutro.affineir.affine;

import io.github.eutro.affineir.ir.Operation;
import io.github.eutro.affineir.ir.Value;
import io.github.eutro.affineir.rewrite.PatternRewriter;
import io.github.eutro.affineir.rewrite.RewritePattern;

import java.util.List;
import java.util.logging.Logger;

/**
 * Composes an {@code affine.apply} with the {@code affine.apply} operations producing its operands,
 * replacing it with the canonical result if that differs.
 */
final class SimplifyAffineApply extends RewritePattern {
    private static final Logger LOGGER = Logger.getLogger(SimplifyAffineApply.class.getName());

    SimplifyAffineApply() {
        super(AffineOps.APPLY, 1);
    }

    @Override
    public boolean matchAndRewrite(Operation op, PatternRewriter rewriter) {
        AffineApplyOp apply = AffineApplyOp.cast(op);
        List<Value> operands = List.copyOf(apply.getMapOperands());
        MapAndOperands composed = AffineComposition.composeAffineMapAndOperands(apply.getAffineMap(), operands);
        if (composed.getMap().equals(apply.getAffineMap()) && composed.getOperands().equals(operands)) {
            return false;
        }
        LOGGER.finer(() -> "simplified " + apply.getAffineMap() + " to " + composed.getMap());
        rewriter.replaceOpWithNewOp(op, AffineApplyOp.build(op.getLoc(), composed.getMap(), composed.getOperands()));
        return true;
    }
}
