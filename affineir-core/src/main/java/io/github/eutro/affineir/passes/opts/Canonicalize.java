package io.github.eutro.affineir.passes.opts;

import io.github.eutro.affineir.ext.CommonExts;
import io.github.eutro.affineir.ir.Operation;
import io.github.eutro.affineir.ops.OpKey;
import io.github.eutro.affineir.passes.InPlaceIRPass;
import io.github.eutro.affineir.rewrite.GreedyPatternRewriteDriver;
import io.github.eutro.affineir.rewrite.RewritePattern;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Folds everything nested in an operation and applies the canonicalization patterns registered
 * for each kind of operation found in it.
 */
public class Canonicalize implements InPlaceIRPass<Operation> {
    public static final Canonicalize INSTANCE = new Canonicalize();
    private static final Logger LOGGER = Logger.getLogger(Canonicalize.class.getName());

    @Override
    public void runInPlace(Operation root) {
        Set<OpKey> kinds = new LinkedHashSet<>();
        root.walk(op -> kinds.add(op.getKey()));
        List<RewritePattern> patterns = new ArrayList<>();
        for (OpKey kind : kinds) {
            List<RewritePattern> forKind = kind.getNullable(CommonExts.CANONICALIZATION_PATTERNS);
            if (forKind != null) patterns.addAll(forKind);
        }
        boolean converged = new GreedyPatternRewriteDriver(patterns).simplify(root);
        if (!converged) {
            LOGGER.fine(() -> "canonicalization of '" + root.getName() + "' stopped before a fixed point");
        }
    }

    @Override
    public String toString() {
        return "canonicalize";
    }
}
