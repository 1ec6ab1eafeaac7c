package io.github.eutro.affineir.passes.opts;

import io.github.eutro.affineir.ext.CommonExts;
import io.github.eutro.affineir.ir.Operation;
import io.github.eutro.affineir.ir.Value;
import io.github.eutro.affineir.passes.InPlaceIRPass;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Erases pure operations whose results are never used, and then any pure operations only they used.
 */
public class EliminateDeadOps implements InPlaceIRPass<Operation> {
    public static final EliminateDeadOps INSTANCE = new EliminateDeadOps();
    private static final Logger LOGGER = Logger.getLogger(EliminateDeadOps.class.getName());

    private static boolean isRemovable(Operation op) {
        return op.hasTrait(CommonExts.IS_PURE)
                && !op.isKnownTerminator()
                && op.getNumRegions() == 0;
    }

    @Override
    public void runInPlace(Operation root) {
        Map<Operation, Integer> usageCount = new HashMap<>();
        List<Operation> stack = new ArrayList<>();
        root.walk(op -> {
            if (op == root || !isRemovable(op)) return;
            int uses = 0;
            for (Value result : op.getResults()) {
                uses += result.getUsers().size();
            }
            usageCount.put(op, uses);
            if (uses == 0) stack.add(op);
        });

        // users are added before what they use
        Set<Operation> dead = new LinkedHashSet<>();
        while (!stack.isEmpty()) {
            Operation deadOp = stack.remove(stack.size() - 1);
            if (!dead.add(deadOp)) continue;
            for (Value operand : deadOp.getOperands()) {
                Operation def = operand.getDefiningOp();
                if (def == null) continue;
                usageCount.computeIfPresent(def, (o, n) -> {
                    if (n == 1) stack.add(o);
                    return n - 1;
                });
            }
        }

        for (Operation op : dead) {
            op.erase();
        }
        LOGGER.finer(() -> "erased " + dead.size() + " dead operations");
    }

    @Override
    public String toString() {
        return "dce";
    }
}
