package io.github.eutro.affineir.affine;

import io.github.eutro.affineir.affine.expr.AffineDimExpr;
import io.github.eutro.affineir.affine.expr.AffineExpr;
import io.github.eutro.affineir.affine.expr.AffineExprSimplifier;
import io.github.eutro.affineir.affine.expr.AffineMap;
import io.github.eutro.affineir.affine.expr.AffineSymbolExpr;
import io.github.eutro.affineir.affine.expr.IntegerSet;
import io.github.eutro.affineir.ir.Location;
import io.github.eutro.affineir.ir.OpBuilder;
import io.github.eutro.affineir.ir.Operation;
import io.github.eutro.affineir.ir.Value;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Composition and canonicalization of affine maps and integer sets together with their operands.
 */
public final class AffineComposition {
    private AffineComposition() {
    }

    private static boolean isApplyResult(Value value) {
        Operation def = value.getDefiningOp();
        return def != null && def.getKey() == AffineOps.APPLY;
    }

    /**
     * Compose a map with the {@code affine.apply} operations directly producing its operands,
     * then canonicalize the result.
     *
     * @param map      The map.
     * @param operands The operands, dimensions first.
     * @return The composed map and its operands.
     */
    public static MapAndOperands composeAffineMapAndOperands(AffineMap map, List<Value> operands) {
        MapAndOperands normalized = AffineApplyNormalizer.normalize(map, operands);
        return canonicalizeMapAndOperands(normalized.getMap(), normalized.getOperands());
    }

    /**
     * Compose a map with every chain of {@code affine.apply} operations leading to its operands,
     * so that no operand of the result is produced by an {@code affine.apply}.
     *
     * @param map      The map.
     * @param operands The operands, dimensions first.
     * @return The composed map and its operands.
     */
    public static MapAndOperands fullyComposeAffineMapAndOperands(AffineMap map, List<Value> operands) {
        MapAndOperands current = new MapAndOperands(map, operands);
        while (current.getOperands().stream().anyMatch(AffineComposition::isApplyResult)) {
            current = composeAffineMapAndOperands(current.getMap(), current.getOperands());
        }
        return current;
    }

    /**
     * Create an {@code affine.apply} of a map composed with the {@code affine.apply} operations producing its operands.
     *
     * @param builder  Where to create it.
     * @param location The location.
     * @param map      The map, which must have a single result.
     * @param operands The operands, dimensions first.
     * @return The new operation.
     */
    public static AffineApplyOp makeComposedAffineApply(OpBuilder builder, Location location,
                                                        AffineMap map, List<Value> operands) {
        MapAndOperands composed = composeAffineMapAndOperands(map, operands);
        return AffineApplyOp.create(builder, location, composed.getMap(), composed.getOperands());
    }

    /**
     * Canonicalize a map and its operands: dimension operands that are valid symbols become symbols,
     * unused inputs are dropped, and inputs of the same kind applied to the same value are merged.
     * The resulting map is simplified.
     *
     * @param map      The map.
     * @param operands The operands, dimensions first.
     * @return The canonical map and operands.
     */
    public static MapAndOperands canonicalizeMapAndOperands(AffineMap map, List<Value> operands) {
        if (map.getNumInputs() != operands.size()) {
            throw new IllegalArgumentException("map inputs must match number of operands");
        }
        if (operands.isEmpty()) return new MapAndOperands(map.simplify(), operands);
        Canonicalizer canon = new Canonicalizer(map.getNumDims(), map.getNumSymbols(), operands);
        List<AffineExpr> results = canon.canonicalize(map.getResults());
        return new MapAndOperands(AffineMap.get(canon.numDims, canon.numSymbols, results), canon.operands);
    }

    /**
     * Canonicalize an integer set and its operands, in the same way as
     * {@link #canonicalizeMapAndOperands(AffineMap, List) maps}.
     *
     * @param set      The set.
     * @param operands The operands, dimensions first.
     * @return The canonical set and operands.
     */
    public static SetAndOperands canonicalizeSetAndOperands(IntegerSet set, List<Value> operands) {
        if (set.getNumInputs() != operands.size()) {
            throw new IllegalArgumentException("set inputs must match number of operands");
        }
        if (operands.isEmpty()) return new SetAndOperands(set.simplify(), operands);
        Canonicalizer canon = new Canonicalizer(set.getNumDims(), set.getNumSymbols(), operands);
        List<AffineExpr> constraints = canon.canonicalize(set.getConstraints());
        return new SetAndOperands(IntegerSet.get(canon.numDims, canon.numSymbols, constraints, set.getEqFlags()),
                canon.operands);
    }

    /**
     * The identifiers of a map or set as they are renumbered, with the pending substitution.
     */
    private static final class Canonicalizer {
        int numDims;
        int numSymbols;
        List<Value> operands;
        AffineExpr[] dimRemapping;
        AffineExpr[] symRemapping;

        Canonicalizer(int numDims, int numSymbols, List<Value> operands) {
            this.numDims = numDims;
            this.numSymbols = numSymbols;
            this.operands = operands;
        }

        List<AffineExpr> canonicalize(List<AffineExpr> exprs) {
            demotePromotedSymbols();
            exprs = rewrite(exprs);
            compact(exprs);
            exprs = rewrite(exprs);
            // merging inputs can cancel terms out, leaving more inputs unused
            compact(exprs);
            return rewrite(exprs);
        }

        /**
         * Apply the pending substitution, then simplify.
         */
        List<AffineExpr> rewrite(List<AffineExpr> exprs) {
            List<AffineExpr> dims = Arrays.asList(dimRemapping);
            List<AffineExpr> syms = Arrays.asList(symRemapping);
            List<AffineExpr> rewritten = new ArrayList<>(exprs.size());
            for (AffineExpr expr : exprs) {
                rewritten.add(AffineExprSimplifier.simplify(expr.replaceDimsAndSymbols(dims, syms)));
            }
            dimRemapping = null;
            symRemapping = null;
            return rewritten;
        }

        /**
         * Turn dimensions applied to valid symbols into symbols, after the existing ones.
         */
        void demotePromotedSymbols() {
            dimRemapping = new AffineExpr[numDims];
            symRemapping = new AffineExpr[numSymbols];
            for (int i = 0; i < numSymbols; i++) {
                symRemapping[i] = AffineExpr.symbol(i);
            }
            List<Value> dimOperands = new ArrayList<>();
            List<Value> demoted = new ArrayList<>();
            for (int i = 0; i < numDims; i++) {
                Value operand = operands.get(i);
                if (AffineValidity.isValidSymbol(operand)) {
                    dimRemapping[i] = AffineExpr.symbol(numSymbols + demoted.size());
                    demoted.add(operand);
                } else {
                    dimRemapping[i] = AffineExpr.dim(dimOperands.size());
                    dimOperands.add(operand);
                }
            }
            List<Value> newOperands = new ArrayList<>(dimOperands);
            newOperands.addAll(operands.subList(numDims, operands.size()));
            newOperands.addAll(demoted);
            operands = newOperands;
            numDims = dimOperands.size();
            numSymbols += demoted.size();
        }

        /**
         * Drop unused identifiers and merge identifiers of the same kind applied to the same value.
         *
         * @param exprs The expressions over the current identifiers.
         */
        void compact(List<AffineExpr> exprs) {
            boolean[] usedDims = new boolean[numDims];
            boolean[] usedSyms = new boolean[numSymbols];
            Consumer<AffineExpr> markUsed = expr -> {
                if (expr instanceof AffineDimExpr) {
                    usedDims[((AffineDimExpr) expr).getPosition()] = true;
                } else if (expr instanceof AffineSymbolExpr) {
                    usedSyms[((AffineSymbolExpr) expr).getPosition()] = true;
                }
            };
            for (AffineExpr expr : exprs) {
                expr.walk(markUsed);
            }

            List<Value> newOperands = new ArrayList<>();
            dimRemapping = new AffineExpr[numDims];
            Map<Value, AffineExpr> seenDims = new HashMap<>();
            for (int i = 0; i < numDims; i++) {
                if (!usedDims[i]) continue;
                Value operand = operands.get(i);
                AffineExpr seen = seenDims.get(operand);
                if (seen == null) {
                    seen = AffineExpr.dim(seenDims.size());
                    seenDims.put(operand, seen);
                    newOperands.add(operand);
                }
                dimRemapping[i] = seen;
            }
            symRemapping = new AffineExpr[numSymbols];
            Map<Value, AffineExpr> seenSymbols = new HashMap<>();
            for (int i = 0; i < numSymbols; i++) {
                if (!usedSyms[i]) continue;
                Value operand = operands.get(numDims + i);
                AffineExpr seen = seenSymbols.get(operand);
                if (seen == null) {
                    seen = AffineExpr.symbol(seenSymbols.size());
                    seenSymbols.put(operand, seen);
                    newOperands.add(operand);
                }
                symRemapping[i] = seen;
            }
            operands = newOperands;
            numDims = seenDims.size();
            numSymbols = seenSymbols.size();
        }
    }
}
