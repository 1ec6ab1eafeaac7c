package io.github.eutro.affineir.affine.expr;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * An immutable function {@code (d0, ..., dn-1)[s0, ..., sm-1] -> (e0, ..., ek-1)}
 * from dimension and symbol identifiers to a list of affine expressions.
 */
public final class AffineMap {
    private final int numDims;
    private final int numSymbols;
    private final List<AffineExpr> results;

    private AffineMap(int numDims, int numSymbols, List<AffineExpr> results) {
        this.numDims = numDims;
        this.numSymbols = numSymbols;
        this.results = results;
    }

    /**
     * Create a map.
     *
     * @param numDims    The number of dimension inputs.
     * @param numSymbols The number of symbol inputs.
     * @param results    The result expressions.
     * @return The map.
     * @throws IllegalArgumentException If a result refers to an identifier out of range.
     */
    public static AffineMap get(int numDims, int numSymbols, List<AffineExpr> results) {
        if (numDims < 0 || numSymbols < 0) {
            throw new IllegalArgumentException("negative input count");
        }
        for (AffineExpr result : results) {
            checkInRange(result, numDims, numSymbols);
        }
        return new AffineMap(numDims, numSymbols, List.copyOf(results));
    }

    public static AffineMap get(int numDims, int numSymbols, AffineExpr... results) {
        return get(numDims, numSymbols, Arrays.asList(results));
    }

    static void checkInRange(AffineExpr expr, int numDims, int numSymbols) {
        expr.walk(e -> {
            if (e instanceof AffineDimExpr && ((AffineDimExpr) e).getPosition() >= numDims) {
                throw new IllegalArgumentException("d" + ((AffineDimExpr) e).getPosition()
                        + " out of range for " + numDims + " dimensions");
            }
            if (e instanceof AffineSymbolExpr && ((AffineSymbolExpr) e).getPosition() >= numSymbols) {
                throw new IllegalArgumentException("s" + ((AffineSymbolExpr) e).getPosition()
                        + " out of range for " + numSymbols + " symbols");
            }
        });
    }

    /**
     * @return The map {@code () -> ()}.
     */
    public static AffineMap getEmpty() {
        return new AffineMap(0, 0, List.of());
    }

    public static AffineMap constantMap(long value) {
        return new AffineMap(0, 0, List.of(AffineExpr.constant(value)));
    }

    public static AffineMap multiDimIdentityMap(int numDims) {
        List<AffineExpr> results = new ArrayList<>(numDims);
        for (int i = 0; i < numDims; i++) {
            results.add(AffineExpr.dim(i));
        }
        return new AffineMap(numDims, 0, Collections.unmodifiableList(results));
    }

    /**
     * @return The map {@code ()[s0] -> (s0)}.
     */
    public static AffineMap symbolIdentityMap() {
        return new AffineMap(0, 1, List.of(AffineExpr.symbol(0)));
    }

    public int getNumDims() {
        return numDims;
    }

    public int getNumSymbols() {
        return numSymbols;
    }

    public int getNumInputs() {
        return numDims + numSymbols;
    }

    public int getNumResults() {
        return results.size();
    }

    public List<AffineExpr> getResults() {
        return results;
    }

    public AffineExpr getResult(int index) {
        return results.get(index);
    }

    public boolean isEmpty() {
        return numDims == 0 && numSymbols == 0 && results.isEmpty();
    }

    public boolean isIdentity() {
        if (numDims != results.size()) return false;
        for (int i = 0; i < numDims; i++) {
            if (!results.get(i).equals(AffineExpr.dim(i))) return false;
        }
        return true;
    }

    public boolean isSymbolIdentity() {
        return numDims == 0 && numSymbols == 1 && results.size() == 1
                && results.get(0).equals(AffineExpr.symbol(0));
    }

    public boolean isSingleConstant() {
        return results.size() == 1 && results.get(0) instanceof AffineConstantExpr;
    }

    public long getSingleConstantResult() {
        if (!isSingleConstant()) throw new IllegalStateException("map is not a single constant: " + this);
        return ((AffineConstantExpr) results.get(0)).getValue();
    }

    public void walkExprs(Consumer<AffineExpr> visitor) {
        for (AffineExpr result : results) {
            result.walk(visitor);
        }
    }

    /**
     * Substitute the identifiers of every result, producing a map with the given input counts.
     *
     * @param dimReplacements The replacement for each dimension.
     * @param symReplacements The replacement for each symbol.
     * @param newNumDims      The dimension count of the new map.
     * @param newNumSymbols   The symbol count of the new map.
     * @return The new map.
     */
    public AffineMap replaceDimsAndSymbols(List<AffineExpr> dimReplacements, List<AffineExpr> symReplacements,
                                           int newNumDims, int newNumSymbols) {
        List<AffineExpr> newResults = new ArrayList<>(results.size());
        for (AffineExpr result : results) {
            newResults.add(result.replaceDimsAndSymbols(dimReplacements, symReplacements));
        }
        return get(newNumDims, newNumSymbols, newResults);
    }

    /**
     * Compose this map with {@code inner}, giving {@code this(inner(...))}.
     * <p>
     * The dimensions of the result are those of {@code inner}. Its symbols are the symbols of this map
     * followed by the symbols of {@code inner}.
     *
     * @param inner The map whose results feed the dimensions of this one.
     * @return The composed map.
     */
    public AffineMap compose(AffineMap inner) {
        if (numDims != inner.getNumResults()) {
            throw new IllegalArgumentException("cannot compose " + this + " with " + inner
                    + ": " + numDims + " dimensions, " + inner.getNumResults() + " results");
        }
        int newNumSymbols = numSymbols + inner.numSymbols;
        List<AffineExpr> innerDims = new ArrayList<>(inner.numDims);
        for (int i = 0; i < inner.numDims; i++) {
            innerDims.add(AffineExpr.dim(i));
        }
        List<AffineExpr> innerSyms = new ArrayList<>(inner.numSymbols);
        for (int i = 0; i < inner.numSymbols; i++) {
            innerSyms.add(AffineExpr.symbol(numSymbols + i));
        }
        AffineMap shifted = inner.replaceDimsAndSymbols(innerDims, innerSyms, inner.numDims, newNumSymbols);
        List<AffineExpr> newResults = new ArrayList<>(results.size());
        for (AffineExpr result : results) {
            newResults.add(result.compose(shifted));
        }
        return get(inner.numDims, newNumSymbols, newResults);
    }

    /**
     * Evaluate every result given the values of some inputs.
     *
     * @param operands The value of each input, dimensions first, null where unknown.
     * @return The results, or empty if any result could not be computed.
     */
    public Optional<long[]> constantFold(List<@Nullable Long> operands) {
        if (operands.size() != getNumInputs()) {
            throw new IllegalArgumentException("expected " + getNumInputs() + " operands, got " + operands.size());
        }
        List<Long> dims = operands.subList(0, numDims);
        List<Long> syms = operands.subList(numDims, operands.size());
        long[] folded = new long[results.size()];
        for (int i = 0; i < folded.length; i++) {
            Long value = results.get(i).constantFold(dims, syms);
            if (value == null) return Optional.empty();
            folded[i] = value;
        }
        return Optional.of(folded);
    }

    /**
     * @return This map with every result {@link AffineExprSimplifier#simplify(AffineExpr) simplified}.
     */
    public AffineMap simplify() {
        List<AffineExpr> newResults = new ArrayList<>(results.size());
        for (AffineExpr result : results) {
            newResults.add(AffineExprSimplifier.simplify(result));
        }
        return new AffineMap(numDims, numSymbols, Collections.unmodifiableList(newResults));
    }

    public AffineMap getSubMap(int... resultPositions) {
        List<AffineExpr> newResults = new ArrayList<>(resultPositions.length);
        for (int pos : resultPositions) {
            newResults.add(results.get(pos));
        }
        return new AffineMap(numDims, numSymbols, Collections.unmodifiableList(newResults));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AffineMap)) return false;
        AffineMap that = (AffineMap) o;
        return numDims == that.numDims && numSymbols == that.numSymbols && results.equals(that.results);
    }

    @Override
    public int hashCode() {
        return (numDims * 31 + numSymbols) * 31 + results.hashCode();
    }

    static void printInputs(StringBuilder sb, int numDims, int numSymbols) {
        sb.append('(');
        for (int i = 0; i < numDims; i++) {
            if (i != 0) sb.append(", ");
            sb.append('d').append(i);
        }
        sb.append(')');
        if (numSymbols != 0) {
            sb.append('[');
            for (int i = 0; i < numSymbols; i++) {
                if (i != 0) sb.append(", ");
                sb.append('s').append(i);
            }
            sb.append(']');
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        printInputs(sb, numDims, numSymbols);
        sb.append(" -> (");
        for (int i = 0; i < results.size(); i++) {
            if (i != 0) sb.append(", ");
            sb.append(results.get(i));
        }
        return sb.append(')').toString();
    }
}
