package io.github.eutro.affineir.affine.expr;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Brings affine expressions into a canonical sum-of-terms form.
 * <p>
 * An expression is flattened into a linear combination of dimensions, symbols and "local" terms
 * (products of non-constant expressions, and divisions or remainders that cannot be reduced),
 * plus a constant. It is then rebuilt with dimensions first, symbols next, local terms in order
 * of first appearance and the constant last. Terms whose coefficient is a multiple of a positive
 * constant divisor are moved out of {@code floordiv}, {@code ceildiv} and {@code mod}.
 * <p>
 * Simplification is idempotent.
 */
public final class AffineExprSimplifier {
    private AffineExprSimplifier() {
    }

    public static AffineExpr simplify(AffineExpr expr) {
        return flatten(expr).toExpr();
    }

    private static Linear flatten(AffineExpr expr) {
        switch (expr.getKind()) {
            case DIM: {
                Linear l = new Linear();
                l.dims.put(((AffineDimExpr) expr).getPosition(), 1L);
                return l;
            }
            case SYMBOL: {
                Linear l = new Linear();
                l.syms.put(((AffineSymbolExpr) expr).getPosition(), 1L);
                return l;
            }
            case CONSTANT: {
                Linear l = new Linear();
                l.constant = ((AffineConstantExpr) expr).getValue();
                return l;
            }
            default:
                break;
        }
        AffineBinaryOpExpr bin = (AffineBinaryOpExpr) expr;
        Linear lhs = flatten(bin.getLhs());
        Linear rhs = flatten(bin.getRhs());
        switch (bin.getKind()) {
            case ADD:
                lhs.addScaled(rhs, 1);
                return lhs;
            case MUL:
                if (rhs.isConstant()) {
                    lhs.scale(rhs.constant);
                    return lhs;
                }
                if (lhs.isConstant()) {
                    rhs.scale(lhs.constant);
                    return rhs;
                }
                return local(AffineExprKind.MUL, lhs.toExpr(), rhs.toExpr());
            default:
                return flattenDivOrMod(bin.getKind(), lhs, rhs);
        }
    }

    private static Linear flattenDivOrMod(AffineExprKind kind, Linear lhs, Linear rhs) {
        if (!rhs.isConstant() || rhs.constant < 1) {
            return local(kind, lhs.toExpr(), rhs.toExpr());
        }
        long divisor = rhs.constant;
        Linear quotient = new Linear();
        Linear remainder = new Linear();
        split(lhs.dims, quotient.dims, remainder.dims, divisor);
        split(lhs.syms, quotient.syms, remainder.syms, divisor);
        split(lhs.locals, quotient.locals, remainder.locals, divisor);
        if (lhs.constant % divisor == 0) {
            quotient.constant = lhs.constant / divisor;
        } else {
            remainder.constant = lhs.constant;
        }

        if (remainder.isConstant()) {
            long r = remainder.constant;
            long folded;
            switch (kind) {
                case FLOOR_DIV:
                    folded = Math.floorDiv(r, divisor);
                    break;
                case CEIL_DIV:
                    folded = AffineBinaryOpExpr.ceilDiv(r, divisor);
                    break;
                default:
                    Linear result = new Linear();
                    result.constant = Math.floorMod(r, divisor);
                    return result;
            }
            quotient.constant += folded;
            return quotient;
        }

        Linear rest = local(kind, remainder.toExpr(), AffineExpr.constant(divisor));
        if (kind == AffineExprKind.MOD) return rest;
        quotient.addScaled(rest, 1);
        return quotient;
    }

    private static <K> void split(Map<K, Long> from, Map<K, Long> quotient, Map<K, Long> remainder, long divisor) {
        for (Map.Entry<K, Long> entry : from.entrySet()) {
            long coefficient = entry.getValue();
            if (coefficient % divisor == 0) {
                quotient.put(entry.getKey(), coefficient / divisor);
            } else {
                remainder.put(entry.getKey(), coefficient);
            }
        }
    }

    private static Linear local(AffineExprKind kind, AffineExpr lhs, AffineExpr rhs) {
        AffineExpr term = AffineBinaryOpExpr.get(kind, lhs, rhs);
        if (term.getKind() == kind) {
            Linear l = new Linear();
            l.locals.put(term, 1L);
            return l;
        }
        // local simplification turned it into something that can be flattened further
        return flatten(term);
    }

    private static final class Linear {
        final TreeMap<Integer, Long> dims = new TreeMap<>();
        final TreeMap<Integer, Long> syms = new TreeMap<>();
        final LinkedHashMap<AffineExpr, Long> locals = new LinkedHashMap<>();
        long constant;

        boolean isConstant() {
            return dims.isEmpty() && syms.isEmpty() && locals.isEmpty();
        }

        void scale(long factor) {
            scale(dims, factor);
            scale(syms, factor);
            scale(locals, factor);
            constant *= factor;
        }

        private static <K> void scale(Map<K, Long> terms, long factor) {
            if (factor == 0) {
                terms.clear();
                return;
            }
            terms.replaceAll((k, v) -> v * factor);
        }

        void addScaled(Linear other, long factor) {
            merge(dims, other.dims, factor);
            merge(syms, other.syms, factor);
            merge(locals, other.locals, factor);
            constant += other.constant * factor;
        }

        private static <K> void merge(Map<K, Long> into, Map<K, Long> from, long factor) {
            for (Map.Entry<K, Long> entry : from.entrySet()) {
                into.merge(entry.getKey(), entry.getValue() * factor, Long::sum);
            }
            for (Iterator<Long> it = into.values().iterator(); it.hasNext(); ) {
                if (it.next() == 0) it.remove();
            }
        }

        AffineExpr toExpr() {
            AffineExpr result = null;
            for (Map.Entry<Integer, Long> entry : dims.entrySet()) {
                result = append(result, AffineExpr.dim(entry.getKey()), entry.getValue());
            }
            for (Map.Entry<Integer, Long> entry : syms.entrySet()) {
                result = append(result, AffineExpr.symbol(entry.getKey()), entry.getValue());
            }
            for (Map.Entry<AffineExpr, Long> entry : locals.entrySet()) {
                result = append(result, entry.getKey(), entry.getValue());
            }
            if (result == null) return AffineExpr.constant(constant);
            return constant == 0 ? result : result.add(constant);
        }

        private static AffineExpr append(AffineExpr sum, AffineExpr term, long coefficient) {
            if (coefficient == 0) return sum;
            AffineExpr scaled = coefficient == 1 ? term : term.mul(coefficient);
            return sum == null ? scaled : sum.add(scaled);
        }
    }
}
