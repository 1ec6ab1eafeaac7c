package io.github.eutro.affineir.passes.misc;

import io.github.eutro.affineir.ir.Block;
import io.github.eutro.affineir.ir.Operation;
import io.github.eutro.affineir.ops.OpKey;
import io.github.eutro.affineir.passes.IRPass;
import io.github.eutro.affineir.passes.InPlaceIRPass;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Lifts passes which operate on single operations into ones that operate on everything nested in an operation.
 */
public class ForPass {
    /**
     * Lift an operation pass to run on every operation of a kind nested in the root, nested operations first.
     *
     * @param kind The kind of operation, or null for every kind.
     * @param pass The operation pass.
     * @return The lifted pass.
     */
    public static Ops liftOps(@Nullable OpKey kind, IRPass<Operation, Operation> pass) {
        return new Ops(kind, pass);
    }

    /**
     * An operation pass lifted to run on the operations nested in a root.
     * <p>
     * If the pass is not in place, the operation it returns replaces the one it was given, taking its uses.
     */
    public static class Ops implements InPlaceIRPass<Operation> {
        private final @Nullable OpKey kind;
        private final IRPass<Operation, Operation> pass;

        private Ops(@Nullable OpKey kind, IRPass<Operation, Operation> pass) {
            this.kind = kind;
            this.pass = pass;
        }

        @Override
        public void runInPlace(Operation root) {
            List<Operation> targets = new ArrayList<>();
            root.walk(op -> {
                if (op != root && (kind == null || op.getKey() == kind)) targets.add(op);
            });

            int i = 0;
            try {
                for (Operation op : targets) {
                    // erased by the pass on an earlier operation
                    if (op.getBlock() == null) {
                        i++;
                        continue;
                    }
                    if (pass.isInPlace()) {
                        pass.run(op);
                    } else {
                        replace(op, pass.run(op));
                    }
                    i++;
                }
            } catch (RuntimeException | Error t) {
                t.addSuppressed(new RuntimeException("in operation " + i + " of " + targets.size()));
                throw t;
            }
        }

        private static void replace(Operation op, Operation replacement) {
            if (replacement == op) return;
            Block block = op.getBlock();
            if (block == null) throw new IllegalStateException("replaced operation is not in a block");
            if (replacement.getBlock() == null) {
                block.getOperations().add(block.getOperations().indexOf(op), replacement);
            }
            op.replaceAllUsesWith(replacement);
            op.erase();
        }

        @Override
        public String toString() {
            return "for-each(" + (kind == null ? "*" : kind.getName()) + ", " + pass + ")";
        }
    }
}
