package io.github.eutro.affineir.affine.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * An immutable conjunction of affine constraints over dimensions and symbols,
 * each either {@code expr == 0} or {@code expr >= 0}.
 */
public final class IntegerSet {
    private final int numDims;
    private final int numSymbols;
    private final List<AffineExpr> constraints;
    private final List<Boolean> eqFlags;

    private IntegerSet(int numDims, int numSymbols, List<AffineExpr> constraints, List<Boolean> eqFlags) {
        this.numDims = numDims;
        this.numSymbols = numSymbols;
        this.constraints = constraints;
        this.eqFlags = eqFlags;
    }

    public static IntegerSet get(int numDims, int numSymbols, List<AffineExpr> constraints, List<Boolean> eqFlags) {
        if (constraints.size() != eqFlags.size()) {
            throw new IllegalArgumentException("expected one equality flag per constraint");
        }
        if (constraints.isEmpty()) {
            throw new IllegalArgumentException("an integer set needs at least one constraint");
        }
        for (AffineExpr constraint : constraints) {
            AffineMap.checkInRange(constraint, numDims, numSymbols);
        }
        return new IntegerSet(numDims, numSymbols, List.copyOf(constraints), List.copyOf(eqFlags));
    }

    /**
     * @return The canonical empty set {@code 1 == 0} with the given inputs.
     */
    public static IntegerSet getEmptySet(int numDims, int numSymbols) {
        return new IntegerSet(numDims, numSymbols, List.of(AffineExpr.constant(1)), List.of(true));
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

    public int getNumConstraints() {
        return constraints.size();
    }

    public List<AffineExpr> getConstraints() {
        return constraints;
    }

    public AffineExpr getConstraint(int index) {
        return constraints.get(index);
    }

    public List<Boolean> getEqFlags() {
        return eqFlags;
    }

    public boolean isEq(int index) {
        return eqFlags.get(index);
    }

    public int getNumEqualities() {
        int count = 0;
        for (boolean eq : eqFlags) {
            if (eq) count++;
        }
        return count;
    }

    public int getNumInequalities() {
        return constraints.size() - getNumEqualities();
    }

    /**
     * @return Whether some constraint is a constant that is trivially violated.
     */
    public boolean isEmptyIntegerSet() {
        for (int i = 0; i < constraints.size(); i++) {
            Long value = constraints.get(i).getConstantValue();
            if (value == null) continue;
            if (eqFlags.get(i) ? value != 0 : value < 0) return true;
        }
        return false;
    }

    public IntegerSet replaceDimsAndSymbols(List<AffineExpr> dimReplacements, List<AffineExpr> symReplacements,
                                            int newNumDims, int newNumSymbols) {
        List<AffineExpr> newConstraints = new ArrayList<>(constraints.size());
        for (AffineExpr constraint : constraints) {
            newConstraints.add(constraint.replaceDimsAndSymbols(dimReplacements, symReplacements));
        }
        return get(newNumDims, newNumSymbols, newConstraints, eqFlags);
    }

    public IntegerSet simplify() {
        List<AffineExpr> newConstraints = new ArrayList<>(constraints.size());
        for (AffineExpr constraint : constraints) {
            newConstraints.add(AffineExprSimplifier.simplify(constraint));
        }
        return new IntegerSet(numDims, numSymbols, List.copyOf(newConstraints), eqFlags);
    }

    /**
     * Decide membership given the values of some inputs.
     *
     * @param operands The value of each input, dimensions first, null where unknown.
     * @return Whether the point is in the set, or empty if that depends on an unknown input.
     */
    public Optional<Boolean> contains(List<Long> operands) {
        List<Long> dims = operands.subList(0, numDims);
        List<Long> syms = operands.subList(numDims, operands.size());
        for (int i = 0; i < constraints.size(); i++) {
            Long value = constraints.get(i).constantFold(dims, syms);
            if (value == null) return Optional.empty();
            if (eqFlags.get(i) ? value != 0 : value < 0) return Optional.of(false);
        }
        return Optional.of(true);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IntegerSet)) return false;
        IntegerSet that = (IntegerSet) o;
        return numDims == that.numDims && numSymbols == that.numSymbols
                && constraints.equals(that.constraints) && eqFlags.equals(that.eqFlags);
    }

    @Override
    public int hashCode() {
        return ((numDims * 31 + numSymbols) * 31 + constraints.hashCode()) * 31 + eqFlags.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        AffineMap.printInputs(sb, numDims, numSymbols);
        sb.append(" : (");
        for (int i = 0; i < constraints.size(); i++) {
            if (i != 0) sb.append(", ");
            sb.append(constraints.get(i));
            sb.append(eqFlags.get(i) ? " == 0" : " >= 0");
        }
        return sb.append(')').toString();
    }
}
