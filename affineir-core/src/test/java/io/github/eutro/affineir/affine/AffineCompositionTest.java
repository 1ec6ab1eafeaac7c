package io.github.eutro.affineir.affine;

import io.github.eutro.affineir.Utils;
import io.github.eutro.affineir.affine.expr.AffineMap;
import io.github.eutro.affineir.affine.expr.IntegerSet;
import io.github.eutro.affineir.ir.Block;
import io.github.eutro.affineir.ir.OpBuilder;
import io.github.eutro.affineir.ir.Value;
import io.github.eutro.affineir.std.ModuleOp;
import io.github.eutro.affineir.types.IndexType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.github.eutro.affineir.Utils.LOC;
import static io.github.eutro.affineir.affine.expr.AffineExpr.dim;
import static io.github.eutro.affineir.affine.expr.AffineExpr.symbol;
import static org.junit.jupiter.api.Assertions.*;

public class AffineCompositionTest {
    private Value x;
    private Value iv;
    private OpBuilder loopBuilder;

    @BeforeEach
    void setUp() {
        Utils.context();
        ModuleOp module = ModuleOp.create(LOC);
        OpBuilder builder = Utils.addFunction(module, "f", List.of(IndexType.get()));
        Block entry = Utils.entryBlock(builder);
        x = entry.getArgument(0);
        AffineForOp loop = AffineForOp.create(builder, LOC, 0, 10, 1);
        iv = loop.getInductionVar();
        loopBuilder = loop.getBodyBuilder();
    }

    private Value apply(AffineMap map, Value... operands) {
        return AffineApplyOp.create(loopBuilder, LOC, map, List.of(operands)).getResult();
    }

    @Test
    void testMergeDuplicateDims() {
        MapAndOperands canon = AffineComposition.canonicalizeMapAndOperands(
                AffineMap.get(2, 0, dim(0)), List.of(iv, iv));
        assertEquals("(d0) -> (d0)", canon.getMap().toString());
        assertEquals(List.of(iv), canon.getOperands());

        canon = AffineComposition.canonicalizeMapAndOperands(
                AffineMap.get(2, 0, dim(0).add(dim(1))), List.of(iv, iv));
        assertEquals("(d0) -> (d0 * 2)", canon.getMap().toString());
        assertEquals(List.of(iv), canon.getOperands());
    }

    @Test
    void testMergeDuplicateSymbols() {
        MapAndOperands canon = AffineComposition.canonicalizeMapAndOperands(
                AffineMap.get(0, 4, symbol(0).add(symbol(1)).add(symbol(2)).add(symbol(3))),
                List.of(x, x, x, x));
        assertEquals("()[s0] -> (s0 * 4)", canon.getMap().toString());
        assertEquals(List.of(x), canon.getOperands());
    }

    @Test
    void testDimsOfValidSymbolsBecomeSymbols() {
        MapAndOperands canon = AffineComposition.canonicalizeMapAndOperands(
                AffineMap.get(2, 0, dim(0).add(dim(1))), List.of(iv, x));
        assertEquals("(d0)[s0] -> (d0 + s0)", canon.getMap().toString());
        assertEquals(List.of(iv, x), canon.getOperands());

        canon = AffineComposition.canonicalizeMapAndOperands(
                AffineMap.get(4, 0, dim(0).add(dim(1)).add(dim(2)).add(dim(3))), List.of(x, x, x, x));
        assertEquals("()[s0] -> (s0 * 4)", canon.getMap().toString());
    }

    @Test
    void testUnusedInputsAreDropped() {
        MapAndOperands canon = AffineComposition.canonicalizeMapAndOperands(
                AffineMap.get(2, 1, dim(1)), List.of(x, iv, x));
        assertEquals("(d0) -> (d0)", canon.getMap().toString());
        assertEquals(List.of(iv), canon.getOperands());

        // terms that cancel out once merged leave their input unused
        canon = AffineComposition.canonicalizeMapAndOperands(
                AffineMap.get(2, 0, dim(0).sub(dim(1))), List.of(iv, iv));
        assertEquals("() -> (0)", canon.getMap().toString());
        assertTrue(canon.getOperands().isEmpty());
    }

    @Test
    void testCanonicalizationIsIdempotent() {
        MapAndOperands once = AffineComposition.canonicalizeMapAndOperands(
                AffineMap.get(3, 1, dim(2).add(symbol(0)).add(dim(0)).mul(2), dim(1)), List.of(iv, x, iv, x));
        MapAndOperands twice = AffineComposition.canonicalizeMapAndOperands(once.getMap(), once.getOperands());
        assertEquals(once, twice);
    }

    @Test
    void testOperandCountMismatch() {
        assertThrows(IllegalArgumentException.class,
                () -> AffineComposition.canonicalizeMapAndOperands(AffineMap.get(2, 0, dim(0)), List.of(iv)));
        assertThrows(IllegalArgumentException.class,
                () -> AffineComposition.composeAffineMapAndOperands(AffineMap.get(2, 0, dim(0)), List.of(iv)));
    }

    @Test
    void testComposeProducer() {
        Value minusOne = apply(AffineMap.get(1, 0, dim(0).sub(1)), iv);
        MapAndOperands composed = AffineComposition.fullyComposeAffineMapAndOperands(
                AffineMap.multiDimIdentityMap(1), List.of(minusOne));
        assertEquals("(d0) -> (d0 - 1)", composed.getMap().toString());
        assertEquals(List.of(iv), composed.getOperands());
    }

    @Test
    void testComposeProducerUsedTwice() {
        Value a = apply(AffineMap.get(1, 0, dim(0).sub(1)), iv);
        Value b = apply(AffineMap.get(2, 0, dim(0)), a, a);
        AffineApplyOp bOp = AffineApplyOp.cast(b.getDefiningOp());
        MapAndOperands composed = AffineComposition.fullyComposeAffineMapAndOperands(
                bOp.getAffineMap(), bOp.getMapOperands());
        assertEquals("(d0) -> (d0 - 1)", composed.getMap().toString());
        assertEquals(List.of(iv), composed.getOperands());
    }

    @Test
    void testComposeSharedSymbol() {
        AffineMap plusSymbol = AffineMap.get(1, 1, dim(0).add(symbol(0)));
        Value once = apply(plusSymbol, iv, x);
        MapAndOperands composed = AffineComposition.fullyComposeAffineMapAndOperands(
                plusSymbol, List.of(once, x));
        // both applies read the same symbol, which is counted twice
        assertEquals("(d0)[s0] -> (d0 + s0 * 2)", composed.getMap().toString());
        assertEquals(List.of(iv, x), composed.getOperands());
    }

    @Test
    void testFullyComposeChain() {
        Value a = apply(AffineMap.get(1, 0, dim(0).add(1)), iv);
        Value b = apply(AffineMap.get(1, 0, dim(0).mul(2)), a);
        Value c = apply(AffineMap.get(1, 1, dim(0).add(symbol(0))), b, x);
        MapAndOperands composed = AffineComposition.fullyComposeAffineMapAndOperands(
                AffineMap.multiDimIdentityMap(1), List.of(c));
        assertEquals("(d0)[s0] -> (d0 * 2 + s0 + 2)", composed.getMap().toString());
        assertEquals(List.of(iv, x), composed.getOperands());
        for (Value operand : composed.getOperands()) {
            assertNull(AffineApplyOp.dynCast(operand.getDefiningOp()));
        }
    }

    @Test
    void testComposeSymbolProducer() {
        Value doubled = apply(AffineMap.get(0, 1, symbol(0).mul(2)), x);
        MapAndOperands composed = AffineComposition.fullyComposeAffineMapAndOperands(
                AffineMap.get(1, 1, dim(0).add(symbol(0))), List.of(iv, doubled));
        assertEquals("(d0)[s0] -> (d0 + s0 * 2)", composed.getMap().toString());
        assertEquals(List.of(iv, x), composed.getOperands());
    }

    @Test
    void testComposedMapAgreesWithEvaluation() {
        AffineMap inner = AffineMap.get(1, 1, dim(0).mul(3).add(symbol(0)).floorDiv(2));
        Value produced = apply(inner, iv, x);
        AffineMap outer = AffineMap.get(1, 0, dim(0).mod(5).add(dim(0)));
        MapAndOperands composed = AffineComposition.fullyComposeAffineMapAndOperands(outer, List.of(produced));
        assertEquals(List.of(iv, x), composed.getOperands());
        for (long i = 0; i < 10; i++) {
            for (long s = -3; s < 3; s++) {
                long innerValue = inner.constantFold(List.of(i, s)).orElseThrow()[0];
                long expected = outer.constantFold(List.of(innerValue)).orElseThrow()[0];
                assertEquals(expected, composed.getMap().constantFold(List.of(i, s)).orElseThrow()[0]);
            }
        }
    }

    @Test
    void testMakeComposedAffineApply() {
        Value plusTwo = apply(AffineMap.get(1, 0, dim(0).add(2)), iv);
        AffineApplyOp composed = AffineComposition.makeComposedAffineApply(loopBuilder, LOC,
                AffineMap.get(1, 0, dim(0).mul(4)), List.of(plusTwo));
        assertEquals("(d0) -> (d0 * 4 + 8)", composed.getAffineMap().toString());
        assertEquals(List.of(iv), composed.getMapOperands());
        assertTrue(composed.getOperation().verify().isSuccess());
    }

    @Test
    void testCanonicalizeSet() {
        IntegerSet set = IntegerSet.get(2, 0, List.of(dim(0).sub(dim(1))), List.of(false));
        SetAndOperands canon = AffineComposition.canonicalizeSetAndOperands(set, List.of(iv, x));
        assertEquals("(d0)[s0] : (d0 - s0 >= 0)", canon.getSet().toString());
        assertEquals(List.of(iv, x), canon.getOperands());

        IntegerSet duplicated = IntegerSet.get(2, 0, List.of(dim(0).add(dim(1)).sub(10)), List.of(true));
        canon = AffineComposition.canonicalizeSetAndOperands(duplicated, List.of(iv, iv));
        assertEquals("(d0) : (d0 * 2 - 10 == 0)", canon.getSet().toString());
        assertEquals(List.of(iv), canon.getOperands());
    }
}
