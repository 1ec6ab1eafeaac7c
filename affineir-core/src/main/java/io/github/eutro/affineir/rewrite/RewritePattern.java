package io.github.eutro.affineir.rewrite;

import io.github.eutro.affineir.ir.Operation;
import io.github.eutro.affineir.ops.OpKey;

/**
 * A local rewrite rooted at operations of one kind.
 */
public abstract class RewritePattern {
    private final OpKey rootKind;
    private final int benefit;

    protected RewritePattern(OpKey rootKind, int benefit) {
        this.rootKind = rootKind;
        this.benefit = benefit;
    }

    public OpKey getRootKind() {
        return rootKind;
    }

    /**
     * @return How much applying this pattern is worth, compared to other patterns on the same operation.
     */
    public int getBenefit() {
        return benefit;
    }

    /**
     * Try to rewrite {@code op}. All changes must go through {@code rewriter}.
     *
     * @param op       The operation, which has the root kind.
     * @param rewriter The rewriter.
     * @return Whether the IR was changed.
     */
    public abstract boolean matchAndRewrite(Operation op, PatternRewriter rewriter);

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + rootKind + ")";
    }
}
