package io.github.eutro.affineir.affine.expr;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.function.Consumer;
import java.util.function.IntFunction;

public final class AffineConstantExpr extends AffineExpr {
    private final long value;

    AffineConstantExpr(long value) {
        this.value = value;
    }

    public long getValue() {
        return value;
    }

    @Override
    public AffineExprKind getKind() {
        return AffineExprKind.CONSTANT;
    }

    @Override
    public boolean isSymbolicOrConstant() {
        return true;
    }

    @Override
    public boolean isPureAffine() {
        return true;
    }

    @Override
    public long getLargestKnownDivisor() {
        return Math.abs(value);
    }

    @Override
    public void walk(Consumer<AffineExpr> visitor) {
        visitor.accept(this);
    }

    @Override
    public AffineExpr replaceDimsAndSymbols(List<AffineExpr> dimReplacements, List<AffineExpr> symReplacements) {
        return this;
    }

    @Override
    public @Nullable Long constantFold(List<@Nullable Long> dimValues, List<@Nullable Long> symValues) {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AffineConstantExpr && ((AffineConstantExpr) o).value == value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value) * 4 + 3;
    }

    @Override
    void print(StringBuilder sb, boolean strong, IntFunction<String> dimNames, IntFunction<String> symNames) {
        sb.append(value);
    }
}
