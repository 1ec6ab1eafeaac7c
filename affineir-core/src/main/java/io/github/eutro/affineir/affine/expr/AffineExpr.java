package io.github.eutro.affineir.affine.expr;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.function.Consumer;
import java.util.function.IntFunction;

/**
 * An immutable affine (or semi-affine) integer expression over dimension and symbol identifiers.
 * <p>
 * Expressions are compared structurally. The arithmetic methods perform local simplifications as they build,
 * so {@code d0.add(0)} is {@code d0} and constants always end up on the right hand side;
 * use {@link AffineExprSimplifier} for a canonical form.
 */
public abstract class AffineExpr {
    AffineExpr() {
    }

    public abstract AffineExprKind getKind();

    public static AffineDimExpr dim(int position) {
        return new AffineDimExpr(position);
    }

    public static AffineSymbolExpr symbol(int position) {
        return new AffineSymbolExpr(position);
    }

    public static AffineConstantExpr constant(long value) {
        return new AffineConstantExpr(value);
    }

    public AffineExpr add(AffineExpr other) {
        return AffineBinaryOpExpr.get(AffineExprKind.ADD, this, other);
    }

    public AffineExpr add(long other) {
        return add(constant(other));
    }

    public AffineExpr sub(AffineExpr other) {
        return add(other.neg());
    }

    public AffineExpr sub(long other) {
        return add(constant(-other));
    }

    public AffineExpr mul(AffineExpr other) {
        return AffineBinaryOpExpr.get(AffineExprKind.MUL, this, other);
    }

    public AffineExpr mul(long other) {
        return mul(constant(other));
    }

    public AffineExpr neg() {
        return mul(-1);
    }

    public AffineExpr floorDiv(AffineExpr other) {
        return AffineBinaryOpExpr.get(AffineExprKind.FLOOR_DIV, this, other);
    }

    public AffineExpr floorDiv(long other) {
        return floorDiv(constant(other));
    }

    public AffineExpr ceilDiv(AffineExpr other) {
        return AffineBinaryOpExpr.get(AffineExprKind.CEIL_DIV, this, other);
    }

    public AffineExpr ceilDiv(long other) {
        return ceilDiv(constant(other));
    }

    public AffineExpr mod(AffineExpr other) {
        return AffineBinaryOpExpr.get(AffineExprKind.MOD, this, other);
    }

    public AffineExpr mod(long other) {
        return mod(constant(other));
    }

    /**
     * @return Whether this expression refers to no dimension identifiers.
     */
    public abstract boolean isSymbolicOrConstant();

    /**
     * @return Whether this is a pure affine expression: multiplication only by constants,
     * division and modulo only by constants.
     */
    public abstract boolean isPureAffine();

    /**
     * @return The largest value this expression is always a multiple of.
     */
    public abstract long getLargestKnownDivisor();

    public boolean isMultipleOf(long factor) {
        if (factor == 0) return false;
        return getLargestKnownDivisor() % factor == 0;
    }

    public boolean isFunctionOfDim(int position) {
        boolean[] found = {false};
        walk(e -> {
            if (e instanceof AffineDimExpr && ((AffineDimExpr) e).getPosition() == position) found[0] = true;
        });
        return found[0];
    }

    public boolean isFunctionOfSymbol(int position) {
        boolean[] found = {false};
        walk(e -> {
            if (e instanceof AffineSymbolExpr && ((AffineSymbolExpr) e).getPosition() == position) found[0] = true;
        });
        return found[0];
    }

    /**
     * Visit every subexpression, operands before the expressions using them.
     *
     * @param visitor The visitor.
     */
    public abstract void walk(Consumer<AffineExpr> visitor);

    /**
     * Substitute dimension and symbol identifiers.
     * <p>
     * Identifiers with a position beyond the size of the respective list are kept as they are.
     *
     * @param dimReplacements The replacement for each dimension position.
     * @param symReplacements The replacement for each symbol position.
     * @return The substituted expression.
     */
    public abstract AffineExpr replaceDimsAndSymbols(List<AffineExpr> dimReplacements,
                                                     List<AffineExpr> symReplacements);

    /**
     * Substitute the dimensions of this expression with the results of {@code map}.
     *
     * @param map The map whose results replace the dimensions.
     * @return The composed expression.
     */
    public AffineExpr compose(AffineMap map) {
        return replaceDimsAndSymbols(map.getResults(), List.of());
    }

    /**
     * Evaluate this expression with some known identifier values.
     *
     * @param dimValues The value of each dimension, null if unknown.
     * @param symValues The value of each symbol, null if unknown.
     * @return The value, or null if it depends on an unknown identifier or divides by zero.
     */
    public abstract @Nullable Long constantFold(List<@Nullable Long> dimValues, List<@Nullable Long> symValues);

    @Contract(pure = true)
    public @Nullable Long getConstantValue() {
        return this instanceof AffineConstantExpr ? ((AffineConstantExpr) this).getValue() : null;
    }

    @Override
    public abstract boolean equals(Object o);

    @Override
    public abstract int hashCode();

    @Override
    public String toString() {
        return toString(AffineExpr::defaultDimName, AffineExpr::defaultSymbolName);
    }

    /**
     * Print this expression with custom identifier names.
     * <p>
     * Identifiers are named in the order they appear in the text, left to right.
     *
     * @param dimNames The name of each dimension position.
     * @param symNames The name of each symbol position.
     * @return The text.
     */
    public String toString(IntFunction<String> dimNames, IntFunction<String> symNames) {
        StringBuilder sb = new StringBuilder();
        print(sb, false, dimNames, symNames);
        return sb.toString();
    }

    static String defaultDimName(int position) {
        return "d" + position;
    }

    static String defaultSymbolName(int position) {
        return "s" + position;
    }

    /**
     * Print this expression.
     *
     * @param sb     The output.
     * @param strong Whether this is printed as the operand of a tightly binding operator,
     *               and so needs parentheses if it is a binary expression.
     */
    abstract void print(StringBuilder sb, boolean strong, IntFunction<String> dimNames, IntFunction<String> symNames);
}
