package io.github.eutro.affineir.passes.opts;

import io.github.eutro.affineir.affine.AffineApplyOp;
import io.github.eutro.affineir.affine.AffineComposition;
import io.github.eutro.affineir.affine.AffineLoadOp;
import io.github.eutro.affineir.affine.AffineStoreOp;
import io.github.eutro.affineir.affine.MapAndOperands;
import io.github.eutro.affineir.affine.expr.AffineMap;
import io.github.eutro.affineir.ir.OpBuilder;
import io.github.eutro.affineir.ir.Operation;
import io.github.eutro.affineir.ir.Value;
import io.github.eutro.affineir.passes.InPlaceIRPass;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Fully composes every {@code affine.apply}, and the access map of every {@code affine.load} and
 * {@code affine.store}, with the chains of {@code affine.apply} operations producing their operands.
 * <p>
 * The applies this leaves unused are not erased; run {@link EliminateDeadOps} after.
 */
public class ComposeAffineApplies implements InPlaceIRPass<Operation> {
    public static final ComposeAffineApplies INSTANCE = new ComposeAffineApplies();
    private static final Logger LOGGER = Logger.getLogger(ComposeAffineApplies.class.getName());

    private static MapAndOperands compose(AffineMap map, List<Value> operands) {
        MapAndOperands composed = AffineComposition.fullyComposeAffineMapAndOperands(map, operands);
        return AffineComposition.canonicalizeMapAndOperands(composed.getMap(), composed.getOperands());
    }

    private static boolean unchanged(MapAndOperands composed, AffineMap map, List<Value> operands) {
        return composed.getMap().equals(map) && composed.getOperands().equals(operands);
    }

    @Override
    public void runInPlace(Operation root) {
        List<Operation> ops = new ArrayList<>();
        root.walk(ops::add);
        int changed = 0;
        for (Operation op : ops) {
            AffineApplyOp apply = AffineApplyOp.dynCast(op);
            if (apply != null) {
                List<Value> operands = List.copyOf(apply.getMapOperands());
                MapAndOperands composed = compose(apply.getAffineMap(), operands);
                if (unchanged(composed, apply.getAffineMap(), operands)) continue;
                AffineApplyOp replacement = AffineApplyOp.create(OpBuilder.before(op), op.getLoc(),
                        composed.getMap(), composed.getOperands());
                op.replaceAllUsesWith(replacement.getOperation());
                op.erase();
                changed++;
                continue;
            }

            AffineLoadOp load = AffineLoadOp.dynCast(op);
            if (load != null) {
                List<Value> operands = List.copyOf(load.getMapOperands());
                MapAndOperands composed = compose(load.getAffineMap(), operands);
                if (unchanged(composed, load.getAffineMap(), operands)) continue;
                load.setAffineMap(composed.getMap(), composed.getOperands());
                changed++;
                continue;
            }

            AffineStoreOp store = AffineStoreOp.dynCast(op);
            if (store != null) {
                List<Value> operands = List.copyOf(store.getMapOperands());
                MapAndOperands composed = compose(store.getAffineMap(), operands);
                if (unchanged(composed, store.getAffineMap(), operands)) continue;
                store.setAffineMap(composed.getMap(), composed.getOperands());
                changed++;
            }
        }
        int count = changed;
        LOGGER.finer(() -> "composed " + count + " affine maps");
    }

    @Override
    public String toString() {
        return "compose-affine-applies";
    }
}
