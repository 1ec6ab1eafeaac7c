package io.github.eutro.affineir.affine.expr;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.function.Consumer;
import java.util.function.IntFunction;

public final class AffineDimExpr extends AffineExpr {
    private final int position;

    AffineDimExpr(int position) {
        if (position < 0) throw new IllegalArgumentException("negative dimension position " + position);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }

    @Override
    public AffineExprKind getKind() {
        return AffineExprKind.DIM;
    }

    @Override
    public boolean isSymbolicOrConstant() {
        return false;
    }

    @Override
    public boolean isPureAffine() {
        return true;
    }

    @Override
    public long getLargestKnownDivisor() {
        return 1;
    }

    @Override
    public void walk(Consumer<AffineExpr> visitor) {
        visitor.accept(this);
    }

    @Override
    public AffineExpr replaceDimsAndSymbols(List<AffineExpr> dimReplacements, List<AffineExpr> symReplacements) {
        return position < dimReplacements.size() ? dimReplacements.get(position) : this;
    }

    @Override
    public @Nullable Long constantFold(List<@Nullable Long> dimValues, List<@Nullable Long> symValues) {
        return position < dimValues.size() ? dimValues.get(position) : null;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AffineDimExpr && ((AffineDimExpr) o).position == position;
    }

    @Override
    public int hashCode() {
        return position * 4 + 1;
    }

    @Override
    void print(StringBuilder sb, boolean strong, IntFunction<String> dimNames, IntFunction<String> symNames) {
        sb.append(dimNames.apply(position));
    }
}
