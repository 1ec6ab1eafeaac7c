package io.github.eutro.affineir.rewrite;

import io.github.eutro.affineir.ext.CommonExts;
import io.github.eutro.affineir.ir.Operation;
import io.github.eutro.affineir.ir.Value;
import io.github.eutro.affineir.ops.OpKey;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Applies rewrite patterns and folding to every operation nested in a root operation,
 * revisiting the operations a change may have affected, until nothing changes.
 * <p>
 * Each run is capped at {@link #MAX_ITERATIONS} sweeps over the whole root, set by the
 * {@code AFFINEIR_MAX_REWRITE_ITERATIONS} environment variable.
 */
public class GreedyPatternRewriteDriver extends PatternRewriter {
    private static final Logger LOGGER = Logger.getLogger(GreedyPatternRewriteDriver.class.getName());

    public static final int MAX_ITERATIONS = readMaxIterations();

    private final Map<OpKey, List<RewritePattern>> patterns = new HashMap<>();
    private final OperationFolder folder = new OperationFolder();

    private final List<@Nullable Operation> worklist = new ArrayList<>();
    private final Map<Operation, Integer> worklistMap = new HashMap<>();

    public GreedyPatternRewriteDriver(Collection<? extends RewritePattern> patterns) {
        for (RewritePattern pattern : patterns) {
            this.patterns.computeIfAbsent(pattern.getRootKind(), k -> new ArrayList<>()).add(pattern);
        }
        for (List<RewritePattern> forKind : this.patterns.values()) {
            forKind.sort(Comparator.comparingInt(RewritePattern::getBenefit).reversed());
        }
    }

    private static int readMaxIterations() {
        String value = System.getenv("AFFINEIR_MAX_REWRITE_ITERATIONS");
        if (value == null) return 10;
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            parsed = 0;
        }
        if (parsed <= 0) {
            LOGGER.warning("ignoring invalid AFFINEIR_MAX_REWRITE_ITERATIONS=" + value);
            return 10;
        }
        return parsed;
    }

    /**
     * Rewrite everything nested in {@code root} until a fixed point is reached, or the iteration cap is hit.
     *
     * @param root The root operation, which is not itself rewritten.
     * @return Whether a fixed point was reached.
     */
    public boolean simplify(Operation root) {
        boolean changed;
        int iteration = 0;
        do {
            clearWorklist();
            root.walk(op -> {
                if (op != root) addToWorklist(op);
            });

            changed = false;
            while (!worklist.isEmpty()) {
                Operation op = popFromWorklist();
                if (op == null) continue;
                if (processOp(op)) changed = true;
            }
            iteration++;
            int it = iteration;
            boolean ch = changed;
            LOGGER.finer(() -> "rewrite iteration " + it + (ch ? " changed the IR" : " reached a fixed point"));
        } while (changed && iteration < MAX_ITERATIONS);

        if (changed) {
            int it = iteration;
            LOGGER.fine(() -> "pattern rewriting did not converge in " + it + " iterations");
        }
        return !changed;
    }

    private boolean processOp(Operation op) {
        if (isTriviallyDead(op)) {
            LOGGER.finer(() -> "erasing dead '" + op.getName() + "'");
            eraseOp(op);
            return true;
        }

        List<Value> originalOperands = new ArrayList<>(op.getOperands());
        if (folder.tryToFold(op, this::addToWorklist, this::addUsersToWorklist)) {
            LOGGER.finer(() -> "folded '" + op.getName() + "'");
            for (Value operand : originalOperands) {
                Operation def = operand.getDefiningOp();
                if (def != null && def.getBlock() != null) addToWorklist(def);
            }
            return true;
        }

        List<RewritePattern> forKind = patterns.get(op.getKey());
        if (forKind == null) return false;
        for (RewritePattern pattern : forKind) {
            setInsertionPoint(op);
            if (pattern.matchAndRewrite(op, this)) {
                LOGGER.finer(() -> "applied " + pattern);
                return true;
            }
        }
        return false;
    }

    private static boolean isTriviallyDead(Operation op) {
        return op.hasTrait(CommonExts.IS_PURE)
                && !op.isKnownTerminator()
                && op.getNumRegions() == 0
                && op.useEmpty();
    }

    private void addToWorklist(Operation op) {
        if (worklistMap.containsKey(op)) return;
        worklistMap.put(op, worklist.size());
        worklist.add(op);
    }

    private void addUsersToWorklist(Operation op) {
        for (Value result : op.getResults()) {
            for (Operation user : result.getUsers()) {
                addToWorklist(user);
            }
        }
    }

    private @Nullable Operation popFromWorklist() {
        Operation op = worklist.remove(worklist.size() - 1);
        if (op != null) worklistMap.remove(op);
        return op;
    }

    private void removeFromWorklist(Operation op) {
        Integer index = worklistMap.remove(op);
        if (index != null) worklist.set(index, null);
    }

    private void clearWorklist() {
        worklist.clear();
        worklistMap.clear();
    }

    @Override
    protected void notifyOperationInserted(Operation op) {
        addToWorklist(op);
    }

    @Override
    public void updatedRootInPlace(Operation op) {
        addUsersToWorklist(op);
    }

    @Override
    protected void notifyRootReplaced(Operation op) {
        addUsersToWorklist(op);
    }

    @Override
    protected void notifyOperationRemoved(Operation op) {
        for (Value operand : op.getOperands()) {
            Operation def = operand.getDefiningOp();
            if (def != null) addToWorklist(def);
        }
        op.walk(nested -> {
            folder.notifyRemoval(nested);
            removeFromWorklist(nested);
        });
    }
}
