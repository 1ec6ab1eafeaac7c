package io.github.eutro.affineir.affine.expr;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static io.github.eutro.affineir.affine.expr.AffineExpr.constant;
import static io.github.eutro.affineir.affine.expr.AffineExpr.dim;
import static io.github.eutro.affineir.affine.expr.AffineExpr.symbol;
import static org.junit.jupiter.api.Assertions.*;

public class AffineExprTest {
    @Test
    void testLocalSimplification() {
        assertEquals(constant(5), constant(2).add(3));
        assertEquals("d0 + 5", dim(0).add(2).add(3).toString());
        assertEquals("d0 + 2", constant(2).add(dim(0)).toString());
        assertEquals("d0 - 1", dim(0).sub(1).toString());
        assertEquals("d0 * 6", dim(0).mul(2).mul(3).toString());
        assertEquals("d0 * s0", symbol(0).mul(dim(0)).toString());
        assertEquals(constant(0), dim(0).mul(0));
        assertEquals(dim(0), dim(0).mul(1));
        assertEquals("d0 * 2", dim(0).mul(4).floorDiv(2).toString());
        assertEquals(constant(0), dim(0).mul(4).mod(2));
        assertEquals("d0 - s0", dim(0).sub(symbol(0)).toString());
        assertEquals("-d0", dim(0).neg().toString());
    }

    @Test
    void testConstantArithmetic() {
        assertEquals(constant(-4), constant(-7).floorDiv(2));
        assertEquals(constant(-3), constant(-7).ceilDiv(2));
        assertEquals(constant(1), constant(-7).mod(2));
        // non-positive divisors are left alone
        assertEquals(AffineExprKind.FLOOR_DIV, constant(7).floorDiv(0).getKind());
    }

    @Test
    void testPrecedenceInPrinting() {
        assertEquals("(d0 + 1) floordiv 2", dim(0).add(1).floorDiv(2).toString());
        assertEquals("d0 + d1 mod 4", dim(0).add(dim(1).mod(4)).toString());
        assertEquals("(d0 + s0) * (d1 + 1)", dim(0).add(symbol(0)).mul(dim(1).add(1)).toString());
    }

    @Test
    void testSimplifier() {
        assertEquals("d0 + d1 * 2", AffineExprSimplifier.simplify(dim(1).add(dim(0)).add(dim(1))).toString());
        assertEquals(dim(1), AffineExprSimplifier.simplify(dim(0).add(dim(1)).sub(dim(0))));
        assertEquals("d0 * 2 + d1 floordiv 2",
                AffineExprSimplifier.simplify(dim(0).mul(4).add(dim(1)).floorDiv(2)).toString());
        assertEquals("d0 + s0 + 3",
                AffineExprSimplifier.simplify(constant(1).add(symbol(0)).add(dim(0)).add(2)).toString());
        assertEquals(constant(1), AffineExprSimplifier.simplify(dim(0).mul(3).add(7).mod(3)));
    }

    @Test
    void testSimplifierIsIdempotent() {
        List<AffineExpr> exprs = List.of(
                dim(1).add(symbol(0)).add(dim(0).mul(3)).sub(dim(1)),
                dim(0).mul(6).add(dim(1)).add(5).floorDiv(3),
                dim(0).mul(dim(1)).add(dim(0).mul(dim(1))),
                symbol(1).ceilDiv(4).add(symbol(1).ceilDiv(4)).mod(8));
        for (AffineExpr expr : exprs) {
            AffineExpr once = AffineExprSimplifier.simplify(expr);
            assertEquals(once, AffineExprSimplifier.simplify(once), expr.toString());
        }
    }

    @Test
    void testConstantFold() {
        AffineExpr expr = dim(0).floorDiv(symbol(0));
        assertEquals(3L, expr.constantFold(List.of(7L), List.of(2L)));
        assertNull(expr.constantFold(List.of(7L), List.of(0L)));
        assertNull(expr.constantFold(Arrays.asList((Long) null), List.of(2L)));
    }

    @Test
    void testMapConstruction() {
        assertThrows(IllegalArgumentException.class, () -> AffineMap.get(1, 0, dim(1)));
        assertThrows(IllegalArgumentException.class, () -> AffineMap.get(0, 1, symbol(1)));
        assertEquals("(d0, d1) -> (d0, d1)", AffineMap.multiDimIdentityMap(2).toString());
        assertEquals("()[s0] -> (s0)", AffineMap.symbolIdentityMap().toString());
        assertEquals("() -> (42)", AffineMap.constantMap(42).toString());
        assertTrue(AffineMap.multiDimIdentityMap(3).isIdentity());
        assertTrue(AffineMap.constantMap(42).isSingleConstant());
        assertEquals(42, AffineMap.constantMap(42).getSingleConstantResult());
    }

    @Test
    void testMapCompose() {
        AffineMap outer = AffineMap.get(1, 1, dim(0).add(symbol(0)));
        AffineMap inner = AffineMap.get(1, 0, dim(0).mul(2));
        assertEquals("(d0)[s0] -> (d0 * 2 + s0)", outer.compose(inner).toString());

        AffineMap innerWithSymbol = AffineMap.get(1, 1, dim(0).add(symbol(0)));
        assertEquals("(d0)[s0, s1] -> (d0 + s1 + s0)", outer.compose(innerWithSymbol).toString());

        assertThrows(IllegalArgumentException.class, () -> outer.compose(AffineMap.multiDimIdentityMap(2)));
    }

    @Test
    void testMapConstantFold() {
        AffineMap map = AffineMap.get(2, 0, dim(0).add(dim(1)), dim(0).mod(3));
        Optional<long[]> folded = map.constantFold(List.of(5L, 4L));
        assertTrue(folded.isPresent());
        assertArrayEquals(new long[]{9, 2}, folded.get());
        assertFalse(map.constantFold(Arrays.asList(5L, null)).isPresent());
        assertThrows(IllegalArgumentException.class, () -> map.constantFold(List.of(1L)));
    }

    @Test
    void testSubMapAndSimplify() {
        AffineMap map = AffineMap.get(2, 0, dim(1).add(dim(0)), dim(0).sub(dim(0)));
        assertEquals("(d0, d1) -> (d1 + d0)", map.getSubMap(0).toString());
        assertEquals("(d0, d1) -> (d0 + d1, 0)", map.simplify().toString());
    }

    @Test
    void testIntegerSet() {
        IntegerSet set = IntegerSet.get(1, 1, List.of(dim(0).sub(symbol(0)), dim(0)), List.of(false, true));
        assertEquals("(d0)[s0] : (d0 - s0 >= 0, d0 == 0)", set.toString());
        assertEquals(1, set.getNumEqualities());
        assertEquals(1, set.getNumInequalities());
        assertEquals(Optional.of(true), set.contains(List.of(0L, 0L)));
        assertEquals(Optional.of(false), set.contains(List.of(3L, 3L)));
        assertEquals(Optional.of(false), set.contains(List.of(0L, 1L)));
        assertEquals(Optional.empty(), set.contains(Arrays.asList((Long) null, 0L)));
    }
}
