package io.github.eutro.affineir.affine.expr;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntFunction;

/**
 * A binary affine expression: {@code +}, {@code *}, {@code mod}, {@code floordiv} or {@code ceildiv}.
 * <p>
 * Subtraction is represented as addition of a product with {@code -1}.
 */
public final class AffineBinaryOpExpr extends AffineExpr {
    private final AffineExprKind kind;
    private final AffineExpr lhs;
    private final AffineExpr rhs;

    private AffineBinaryOpExpr(AffineExprKind kind, AffineExpr lhs, AffineExpr rhs) {
        this.kind = kind;
        this.lhs = lhs;
        this.rhs = rhs;
    }

    /**
     * Build a binary expression, simplifying it locally where possible.
     *
     * @param kind The operator.
     * @param lhs  The left operand.
     * @param rhs  The right operand.
     * @return The expression, which need not be a binary expression.
     */
    public static AffineExpr get(AffineExprKind kind, AffineExpr lhs, AffineExpr rhs) {
        AffineExpr simplified;
        switch (kind) {
            case ADD:
                simplified = simplifyAdd(lhs, rhs);
                break;
            case MUL:
                simplified = simplifyMul(lhs, rhs);
                break;
            case FLOOR_DIV:
                simplified = simplifyFloorDiv(lhs, rhs);
                break;
            case CEIL_DIV:
                simplified = simplifyCeilDiv(lhs, rhs);
                break;
            case MOD:
                simplified = simplifyMod(lhs, rhs);
                break;
            default:
                throw new IllegalArgumentException(kind + " is not a binary kind");
        }
        return simplified != null ? simplified : new AffineBinaryOpExpr(kind, lhs, rhs);
    }

    private static @Nullable AffineExpr simplifyAdd(AffineExpr lhs, AffineExpr rhs) {
        Long lhsConst = lhs.getConstantValue();
        Long rhsConst = rhs.getConstantValue();
        if (lhsConst != null && rhsConst != null) return constant(lhsConst + rhsConst);
        if (lhsConst != null) return simplifyOrBuild(AffineExprKind.ADD, rhs, lhs);
        if (rhsConst != null) {
            if (rhsConst == 0) return lhs;
            // (x + c1) + c2 -> x + (c1 + c2)
            if (lhs.getKind() == AffineExprKind.ADD) {
                AffineBinaryOpExpr lBin = (AffineBinaryOpExpr) lhs;
                Long inner = lBin.rhs.getConstantValue();
                if (inner != null) return lBin.lhs.add(inner + rhsConst);
            }
            return null;
        }
        // x + (y + c) -> (x + y) + c
        if (rhs.getKind() == AffineExprKind.ADD) {
            AffineBinaryOpExpr rBin = (AffineBinaryOpExpr) rhs;
            if (rBin.rhs instanceof AffineConstantExpr) return lhs.add(rBin.lhs).add(rBin.rhs);
        }
        return null;
    }

    private static @Nullable AffineExpr simplifyMul(AffineExpr lhs, AffineExpr rhs) {
        Long lhsConst = lhs.getConstantValue();
        Long rhsConst = rhs.getConstantValue();
        if (lhsConst != null && rhsConst != null) return constant(lhsConst * rhsConst);
        if (lhsConst != null || (lhs.isSymbolicOrConstant() && !rhs.isSymbolicOrConstant())) {
            return simplifyOrBuild(AffineExprKind.MUL, rhs, lhs);
        }
        if (rhsConst == null) return null;
        if (rhsConst == 1) return lhs;
        if (rhsConst == 0) return constant(0);
        // (x * c1) * c2 -> x * (c1 * c2)
        if (lhs.getKind() == AffineExprKind.MUL) {
            AffineBinaryOpExpr lBin = (AffineBinaryOpExpr) lhs;
            Long inner = lBin.rhs.getConstantValue();
            if (inner != null) return lBin.lhs.mul(inner * rhsConst);
        }
        return null;
    }

    private static @Nullable AffineExpr simplifyFloorDiv(AffineExpr lhs, AffineExpr rhs) {
        Long rhsConst = rhs.getConstantValue();
        if (rhsConst == null || rhsConst < 1) return null;
        Long lhsConst = lhs.getConstantValue();
        if (lhsConst != null) return constant(Math.floorDiv(lhsConst, rhsConst));
        if (rhsConst == 1) return lhs;
        // (x * c1) floordiv c2 -> x * (c1 / c2) when c2 divides c1
        if (lhs.getKind() == AffineExprKind.MUL) {
            AffineBinaryOpExpr lBin = (AffineBinaryOpExpr) lhs;
            Long inner = lBin.rhs.getConstantValue();
            if (inner != null && inner % rhsConst == 0) return lBin.lhs.mul(inner / rhsConst);
        }
        return null;
    }

    private static @Nullable AffineExpr simplifyCeilDiv(AffineExpr lhs, AffineExpr rhs) {
        Long rhsConst = rhs.getConstantValue();
        if (rhsConst == null || rhsConst < 1) return null;
        Long lhsConst = lhs.getConstantValue();
        if (lhsConst != null) return constant(ceilDiv(lhsConst, rhsConst));
        if (rhsConst == 1) return lhs;
        if (lhs.getKind() == AffineExprKind.MUL) {
            AffineBinaryOpExpr lBin = (AffineBinaryOpExpr) lhs;
            Long inner = lBin.rhs.getConstantValue();
            if (inner != null && inner % rhsConst == 0) return lBin.lhs.mul(inner / rhsConst);
        }
        return null;
    }

    private static @Nullable AffineExpr simplifyMod(AffineExpr lhs, AffineExpr rhs) {
        Long rhsConst = rhs.getConstantValue();
        if (rhsConst == null || rhsConst < 1) return null;
        Long lhsConst = lhs.getConstantValue();
        if (lhsConst != null) return constant(Math.floorMod(lhsConst, rhsConst));
        if (lhs.getLargestKnownDivisor() % rhsConst == 0) return constant(0);
        return null;
    }

    private static AffineExpr simplifyOrBuild(AffineExprKind kind, AffineExpr lhs, AffineExpr rhs) {
        return get(kind, lhs, rhs);
    }

    static long ceilDiv(long lhs, long rhs) {
        return -Math.floorDiv(-lhs, rhs);
    }

    public AffineExpr getLhs() {
        return lhs;
    }

    public AffineExpr getRhs() {
        return rhs;
    }

    @Override
    public AffineExprKind getKind() {
        return kind;
    }

    @Override
    public boolean isSymbolicOrConstant() {
        return lhs.isSymbolicOrConstant() && rhs.isSymbolicOrConstant();
    }

    @Override
    public boolean isPureAffine() {
        switch (kind) {
            case ADD:
                return lhs.isPureAffine() && rhs.isPureAffine();
            case MUL:
                return lhs.isPureAffine() && rhs.isPureAffine()
                        && (lhs instanceof AffineConstantExpr || rhs instanceof AffineConstantExpr);
            default:
                return lhs.isPureAffine() && rhs instanceof AffineConstantExpr;
        }
    }

    @Override
    public long getLargestKnownDivisor() {
        switch (kind) {
            case MUL:
                return lhs.getLargestKnownDivisor() * rhs.getLargestKnownDivisor();
            case ADD:
                return gcd(lhs.getLargestKnownDivisor(), rhs.getLargestKnownDivisor());
            case MOD:
                if (rhs instanceof AffineConstantExpr) {
                    return gcd(lhs.getLargestKnownDivisor(), rhs.getLargestKnownDivisor());
                }
                return 1;
            default:
                return 1;
        }
    }

    static long gcd(long a, long b) {
        a = Math.abs(a);
        b = Math.abs(b);
        while (b != 0) {
            long t = a % b;
            a = b;
            b = t;
        }
        return a;
    }

    @Override
    public void walk(Consumer<AffineExpr> visitor) {
        lhs.walk(visitor);
        rhs.walk(visitor);
        visitor.accept(this);
    }

    @Override
    public AffineExpr replaceDimsAndSymbols(List<AffineExpr> dimReplacements, List<AffineExpr> symReplacements) {
        AffineExpr newLhs = lhs.replaceDimsAndSymbols(dimReplacements, symReplacements);
        AffineExpr newRhs = rhs.replaceDimsAndSymbols(dimReplacements, symReplacements);
        if (newLhs.equals(lhs) && newRhs.equals(rhs)) return this;
        return get(kind, newLhs, newRhs);
    }

    @Override
    public @Nullable Long constantFold(List<@Nullable Long> dimValues, List<@Nullable Long> symValues) {
        Long l = lhs.constantFold(dimValues, symValues);
        if (l == null) return null;
        Long r = rhs.constantFold(dimValues, symValues);
        if (r == null) return null;
        switch (kind) {
            case ADD:
                return l + r;
            case MUL:
                return l * r;
            case FLOOR_DIV:
                return r == 0 ? null : Math.floorDiv(l, r);
            case CEIL_DIV:
                return r == 0 ? null : ceilDiv(l, r);
            case MOD:
                return r == 0 ? null : Math.floorMod(l, r);
            default:
                throw new IllegalStateException();
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AffineBinaryOpExpr)) return false;
        AffineBinaryOpExpr that = (AffineBinaryOpExpr) o;
        return kind == that.kind && lhs.equals(that.lhs) && rhs.equals(that.rhs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, lhs, rhs);
    }

    @Override
    void print(StringBuilder sb, boolean strong, IntFunction<String> dimNames, IntFunction<String> symNames) {
        if (kind != AffineExprKind.ADD) {
            if (strong) sb.append('(');
            Long rhsConst = rhs.getConstantValue();
            if (kind == AffineExprKind.MUL && rhsConst != null && rhsConst == -1) {
                sb.append('-');
                lhs.print(sb, true, dimNames, symNames);
            } else {
                lhs.print(sb, true, dimNames, symNames);
                sb.append(' ').append(kind.getSpelling()).append(' ');
                rhs.print(sb, true, dimNames, symNames);
            }
            if (strong) sb.append(')');
            return;
        }

        if (strong) sb.append('(');
        lhs.print(sb, false, dimNames, symNames);
        if (rhs.getKind() == AffineExprKind.MUL) {
            AffineBinaryOpExpr rBin = (AffineBinaryOpExpr) rhs;
            Long factor = rBin.rhs.getConstantValue();
            if (factor != null && factor < 0) {
                // x + y * -c prints as x - y * c
                sb.append(" - ");
                rBin.lhs.print(sb, true, dimNames, symNames);
                if (factor != -1) sb.append(" * ").append(-factor);
                if (strong) sb.append(')');
                return;
            }
        }
        Long rhsConst = rhs.getConstantValue();
        if (rhsConst != null && rhsConst < 0) {
            sb.append(" - ").append(-rhsConst);
        } else {
            sb.append(" + ");
            rhs.print(sb, false, dimNames, symNames);
        }
        if (strong) sb.append(')');
    }
}
