package io.github.eutro.affineir.affine;

import io.github.eutro.affineir.affine.expr.AffineExpr;
import io.github.eutro.affineir.affine.expr.AffineMap;
import io.github.eutro.affineir.ir.Operation;
import io.github.eutro.affineir.ir.Value;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composes an affine map with the {@code affine.apply} operations producing its operands, one level deep.
 * <p>
 * For example, normalizing {@code (d0) -> (d0 * 2)} applied to {@code %a = affine.apply (d0) -> (d0 + 1) (%i)}
 * gives {@code (d0) -> (d0 * 2 + 2)} applied to {@code %i}.
 * <p>
 * Dimension operands are unified by value: the same value used as two dimensions becomes a single dimension.
 * Symbols are never unified here, only concatenated, since composing maps concatenates their symbols.
 * Symbols defined by {@code affine.apply} are first promoted to dimensions so they can be composed.
 */
public final class AffineApplyNormalizer {
    private static final Logger LOGGER = Logger.getLogger(AffineApplyNormalizer.class.getName());

    /**
     * How many levels of producers a single normalization looks through.
     * Producers of producers are left for {@link AffineComposition#fullyComposeAffineMapAndOperands repeated}
     * normalization, so each step does not lengthen chains of {@code affine.apply}.
     */
    public static final int MAX_DEPTH = 1;

    private final Map<Value, Integer> dimValueToPosition = new HashMap<>();
    private final List<Value> reorderedDims = new ArrayList<>();
    private final List<Value> concatenatedSymbols = new ArrayList<>();

    private AffineApplyNormalizer() {
    }

    /**
     * Normalize a map and its operands, composing the {@code affine.apply} operations directly producing them.
     *
     * @param map      The map.
     * @param operands The operands, dimensions first.
     * @return The normalized map and operands, or the inputs unchanged if no operand came from an {@code affine.apply}.
     */
    public static MapAndOperands normalize(AffineMap map, List<Value> operands) {
        return normalize(map, operands, 0);
    }

    static MapAndOperands normalize(AffineMap map, List<Value> operands, int depth) {
        if (map.getNumInputs() != operands.size()) {
            throw new IllegalArgumentException("number of operands (" + operands.size()
                    + ") does not match the number of map inputs (" + map.getNumInputs() + ")");
        }
        return new AffineApplyNormalizer().run(map, operands, depth);
    }

    private static @Nullable AffineApplyOp getProducer(Value value) {
        Operation def = value.getDefiningOp();
        return def != null && def.getKey() == AffineOps.APPLY ? AffineApplyOp.cast(def) : null;
    }

    /**
     * Rewrite the symbols of a map that are produced by {@code affine.apply} as dimensions, placed after
     * the existing dimensions in symbol order. The remaining symbols are renumbered, keeping their order.
     *
     * @param map           The map.
     * @param symbolOperands The operands of the map's symbols.
     * @return The rewritten map, which expects the promoted operands after the original dimension operands.
     */
    static AffineMap promoteComposedSymbolsAsDims(AffineMap map, List<Value> symbolOperands) {
        int numDims = map.getNumDims();
        int numNewDims = 0;
        int numNewSymbols = 0;
        List<AffineExpr> symReplacements = new ArrayList<>(symbolOperands.size());
        for (Value symbol : symbolOperands) {
            symReplacements.add(getProducer(symbol) != null
                    ? AffineExpr.dim(numDims + numNewDims++)
                    : AffineExpr.symbol(numNewSymbols++));
        }
        if (numNewDims == 0) return map;
        return map.replaceDimsAndSymbols(List.of(), symReplacements, numDims + numNewDims, numNewSymbols);
    }

    private AffineExpr renumberOneDim(Value value) {
        Integer pos = dimValueToPosition.get(value);
        if (pos == null) {
            pos = reorderedDims.size();
            dimValueToPosition.put(value, pos);
            reorderedDims.add(value);
        }
        return AffineExpr.dim(pos);
    }

    /**
     * Move a nested normalization result into the dimensions and symbols of this one.
     *
     * @param other The nested result.
     * @return Its map, over the identifiers of this normalization.
     */
    private AffineMap renumber(MapAndOperands other) {
        List<AffineExpr> dimRemapping = new ArrayList<>();
        for (Value dim : other.getDimOperands()) {
            dimRemapping.add(renumberOneDim(dim));
        }
        List<AffineExpr> symRemapping = new ArrayList<>();
        for (Value sym : other.getSymbolOperands()) {
            symRemapping.add(AffineExpr.symbol(concatenatedSymbols.size()));
            concatenatedSymbols.add(sym);
        }
        return other.getMap().replaceDimsAndSymbols(dimRemapping, symRemapping,
                reorderedDims.size(), concatenatedSymbols.size());
    }

    private MapAndOperands run(AffineMap map, List<Value> operands, int depth) {
        int numDimsBeforeRewrite = map.getNumDims();
        AffineMap promoted = promoteComposedSymbolsAsDims(map, operands.subList(numDimsBeforeRewrite, operands.size()));
        if (LOGGER.isLoggable(Level.FINER) && promoted != map) {
            LOGGER.finer("promoted symbols of " + map + " to " + promoted);
        }

        boolean furtherCompose = depth < MAX_DEPTH;
        AffineExpr[] dimExprs = new AffineExpr[promoted.getNumDims()];
        AffineExpr[] symExprs = new AffineExpr[promoted.getNumSymbols()];
        int nextPromotedDim = numDimsBeforeRewrite;
        int nextSymbol = 0;
        boolean composed = false;
        for (int i = 0; i < operands.size(); i++) {
            Value operand = operands.get(i);
            AffineApplyOp producer = getProducer(operand);
            int dimPos;
            if (i < numDimsBeforeRewrite) {
                dimPos = i;
            } else if (producer != null) {
                dimPos = nextPromotedDim++;
            } else {
                symExprs[nextSymbol++] = AffineExpr.symbol(concatenatedSymbols.size());
                concatenatedSymbols.add(operand);
                continue;
            }
            if (furtherCompose && producer != null) {
                MapAndOperands nested = normalize(producer.getAffineMap(), producer.getMapOperands(), depth + 1);
                AffineMap renumbered = renumber(nested);
                LOGGER.finer(() -> "composed " + nested.getMap() + " into dimension " + dimPos
                        + " as " + renumbered);
                dimExprs[dimPos] = renumbered.getResult(0);
                composed = true;
            } else {
                dimExprs[dimPos] = renumberOneDim(operand);
            }
        }
        assert nextPromotedDim == promoted.getNumDims() && nextSymbol == promoted.getNumSymbols();

        if (!composed) return new MapAndOperands(map, operands);

        AffineMap result = promoted
                .replaceDimsAndSymbols(Arrays.asList(dimExprs), Arrays.asList(symExprs),
                        reorderedDims.size(), concatenatedSymbols.size())
                .simplify();
        List<Value> resultOperands = new ArrayList<>(reorderedDims);
        resultOperands.addAll(concatenatedSymbols);
        LOGGER.fine(() -> "normalized " + map + " to " + result);
        return new MapAndOperands(result, resultOperands);
    }
}
