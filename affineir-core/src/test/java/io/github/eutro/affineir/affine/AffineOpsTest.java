package io.github.eutro.affineir.affine;

import io.github.eutro.affineir.Utils;
import io.github.eutro.affineir.affine.expr.AffineMap;
import io.github.eutro.affineir.affine.expr.IntegerSet;
import io.github.eutro.affineir.attrs.Attribute;
import io.github.eutro.affineir.attrs.IntegerAttr;
import io.github.eutro.affineir.ir.Block;
import io.github.eutro.affineir.ir.OpBuilder;
import io.github.eutro.affineir.ir.Operation;
import io.github.eutro.affineir.ir.Value;
import io.github.eutro.affineir.ir.VerificationResult;
import io.github.eutro.affineir.ops.FoldResult;
import io.github.eutro.affineir.ops.OpView;
import io.github.eutro.affineir.std.ConstantOp;
import io.github.eutro.affineir.std.ModuleOp;
import io.github.eutro.affineir.types.FloatType;
import io.github.eutro.affineir.types.IndexType;
import io.github.eutro.affineir.types.IntegerType;
import io.github.eutro.affineir.types.MemRefType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static io.github.eutro.affineir.Utils.LOC;
import static io.github.eutro.affineir.affine.expr.AffineExpr.dim;
import static io.github.eutro.affineir.affine.expr.AffineExpr.symbol;
import static org.junit.jupiter.api.Assertions.*;

public class AffineOpsTest {
    private Value n;
    private Value a;
    private Value f;
    private Value fast;
    private Value tag;
    private Value iv;
    private OpBuilder body;

    @BeforeEach
    void setUp() {
        Utils.context();
        ModuleOp module = ModuleOp.create(LOC);
        OpBuilder builder = Utils.addFunction(module, "f", List.of(
                IndexType.get(),
                MemRefType.get(new long[]{16, 16}, FloatType.get(32)),
                FloatType.get(32),
                MemRefType.get(new long[]{16, 16}, FloatType.get(32), 2),
                MemRefType.get(new long[]{1}, IntegerType.get(32))));
        Block entry = Utils.entryBlock(builder);
        n = entry.getArgument(0);
        a = entry.getArgument(1);
        f = entry.getArgument(2);
        fast = entry.getArgument(3);
        tag = entry.getArgument(4);
        AffineForOp loop = AffineForOp.create(builder, LOC, 0, 16, 1);
        iv = loop.getInductionVar();
        body = loop.getBodyBuilder();
    }

    private static String verifyError(OpView view) {
        VerificationResult result = view.verify();
        assertTrue(result.isFailure(), () -> view + " verified");
        return result.getDiagnostic().getMessage();
    }

    @Test
    void testApplyFold() {
        AffineApplyOp dimApply = AffineApplyOp.create(body, LOC, AffineMap.get(1, 1, dim(0)), List.of(iv, n));
        List<FoldResult> results = new ArrayList<>();
        assertTrue(dimApply.getOperation().fold(Arrays.asList(null, null), results));
        assertSame(iv, results.get(0).getValue());

        AffineApplyOp symApply = AffineApplyOp.create(body, LOC, AffineMap.get(1, 1, symbol(0)), List.of(iv, n));
        results.clear();
        assertTrue(symApply.getOperation().fold(Arrays.asList(null, null), results));
        assertSame(n, results.get(0).getValue());

        AffineApplyOp sum = AffineApplyOp.create(body, LOC, AffineMap.get(1, 1, dim(0).add(symbol(0))), List.of(iv, n));
        results.clear();
        assertFalse(sum.getOperation().fold(Arrays.asList(IntegerAttr.index(3), null), results));
        List<Attribute> constants = List.of(IntegerAttr.index(3), IntegerAttr.index(4));
        assertTrue(sum.getOperation().fold(constants, results));
        assertEquals(IntegerAttr.index(7), results.get(0).getAttribute());
    }

    @Test
    void testApplyVerifier() {
        AffineApplyOp twoResults = AffineApplyOp.create(body, LOC,
                AffineMap.get(1, 0, dim(0), dim(0).add(1)), List.of(iv));
        assertEquals("'affine.apply' op mapping must produce one value", verifyError(twoResults));

        AffineApplyOp wrongCount = AffineApplyOp.create(body, LOC, AffineMap.get(1, 0, dim(0)), List.of(iv));
        wrongCount.getOperation().setOperands(List.of(iv, iv));
        assertEquals("'affine.apply' op operand count and affine map dimension and symbol count must match",
                verifyError(wrongCount));
    }

    @Test
    void testIf() {
        IntegerSet set = IntegerSet.get(1, 1, List.of(symbol(0).sub(dim(0)).sub(1)), List.of(false));
        AffineIfOp withElse = AffineIfOp.create(body, LOC, set, List.of(iv, n), true);
        assertTrue(withElse.hasElse());
        assertSame(AffineOps.TERMINATOR, withElse.getThenBlock().back().getKey());
        assertSame(AffineOps.TERMINATOR, withElse.getElseBlock().back().getKey());
        assertTrue(withElse.verify().isSuccess());

        AffineIfOp withoutElse = AffineIfOp.create(body, LOC, set, List.of(iv, n), false);
        assertFalse(withoutElse.hasElse());
        assertEquals(2, withoutElse.getOperation().getNumRegions());
        assertNull(withoutElse.getElseBlock());
        assertThrows(IllegalStateException.class, withoutElse::getElseBodyBuilder);
        assertTrue(withoutElse.verify().isSuccess());

        assertThrows(IllegalArgumentException.class, () -> AffineIfOp.build(LOC, set, List.of(iv), false));
    }

    @Test
    void testIfVerifier() {
        IntegerSet set = IntegerSet.get(1, 0, List.of(dim(0)), List.of(false));
        AffineIfOp symbolOperand = AffineIfOp.create(body, LOC,
                IntegerSet.get(0, 1, List.of(symbol(0)), List.of(false)), List.of(iv), false);
        assertEquals("'affine.if' op operand cannot be used as a symbol", verifyError(symbolOperand));

        AffineIfOp wrongCount = AffineIfOp.create(body, LOC, set, List.of(iv), false);
        wrongCount.getOperation().setOperands(List.of());
        assertEquals("'affine.if' op operand count and condition integer set dimension and symbol count must match",
                verifyError(wrongCount));

        AffineIfOp noCondition = AffineIfOp.create(body, LOC, set, List.of(iv), false);
        noCondition.getOperation().removeAttr(AffineIfOp.CONDITION_ATTR);
        assertEquals("'affine.if' op requires an integer set attribute named 'condition'", verifyError(noCondition));

        AffineIfOp blockArgs = AffineIfOp.create(body, LOC, set, List.of(iv), false);
        blockArgs.getThenBlock().addArgument(IndexType.get());
        assertEquals("'affine.if' op requires that child entry blocks have no arguments", verifyError(blockArgs));

        AffineIfOp twoBlocks = AffineIfOp.create(body, LOC, set, List.of(iv), false);
        twoBlocks.getThenRegion().addBlock();
        assertEquals("'affine.if' op expects only one block per 'then' or 'else' regions", verifyError(twoBlocks));
    }

    @Test
    void testLoadStore() {
        AffineLoadOp load = AffineLoadOp.create(body, LOC, a, List.of(iv, n));
        assertTrue(load.verify().isSuccess());
        assertEquals(FloatType.get(32), load.getResult().getType());
        assertEquals(AffineMap.multiDimIdentityMap(2), load.getAffineMap());

        AffineStoreOp store = AffineStoreOp.create(body, LOC, load.getResult(), a,
                AffineMap.get(1, 1, dim(0).add(1), symbol(0)), List.of(iv, n));
        assertTrue(store.verify().isSuccess());
        assertEquals(List.of(iv, n), store.getMapOperands());
        assertSame(load.getResult(), store.getValueToStore());
    }

    @Test
    void testLoadVerifier() {
        AffineLoadOp wrongRank = AffineLoadOp.create(body, LOC, a, AffineMap.get(1, 0, dim(0)), List.of(iv));
        assertEquals("'affine.load' op affine.load affine map num results must equal memref rank",
                verifyError(wrongRank));

        AffineLoadOp symbolIv = AffineLoadOp.create(body, LOC, a,
                AffineMap.get(1, 1, dim(0), symbol(0)), List.of(iv, iv));
        assertEquals("'affine.load' op operand cannot be used as a symbol", verifyError(symbolIv));

        AffineLoadOp notIndex = AffineLoadOp.create(body, LOC, a, List.of(iv, n));
        notIndex.getOperation().setOperands(List.of(a, iv, f));
        assertEquals("'affine.load' op index to load must have 'index' type", verifyError(notIndex));

        AffineLoadOp notMemRef = AffineLoadOp.create(body, LOC, a, List.of(iv, n));
        notMemRef.getOperation().setOperands(List.of(f, iv, n));
        assertEquals("'affine.load' op memref operand must be of memref type", verifyError(notMemRef));

        AffineLoadOp wrongResult = AffineLoadOp.create(body, LOC, a, List.of(iv, n));
        wrongResult.getOperation().setOperands(List.of(tag, iv, n));
        assertEquals("'affine.load' op result type must match element type of memref", verifyError(wrongResult));
    }

    @Test
    void testStoreVerifier() {
        AffineStoreOp wrongValue = AffineStoreOp.create(body, LOC, n, a, List.of(iv, n));
        assertEquals("'affine.store' op first operand must have same type memref element type",
                verifyError(wrongValue));

        AffineStoreOp wrongRank = AffineStoreOp.create(body, LOC, f, a, AffineMap.get(1, 0, dim(0)), List.of(iv));
        assertEquals("'affine.store' op affine.store affine map num results must equal memref rank",
                verifyError(wrongRank));
    }

    @Test
    void testDma() {
        Value zero = ConstantOp.createIndex(body, LOC, 0).getResult();
        Value count = ConstantOp.createIndex(body, LOC, 256).getResult();
        AffineDmaStartOp dma = AffineDmaStartOp.create(body, LOC,
                a, AffineMap.get(1, 0, dim(0), dim(0).add(1)), List.of(iv),
                fast, AffineMap.multiDimIdentityMap(2), List.of(iv, iv),
                tag, AffineMap.get(0, 1, symbol(0)), List.of(zero),
                count);
        assertTrue(dma.verify().isSuccess());
        assertEquals(List.of(iv), dma.getSrcIndices());
        assertEquals(List.of(iv, iv), dma.getDstIndices());
        assertEquals(List.of(zero), dma.getTagIndices());
        assertSame(count, dma.getNumElements());
        assertFalse(dma.isStrided());
        assertTrue(dma.isDestMemorySpaceFaster());
        assertEquals(AffineDmaStartOp.DST_MAP_ATTR, dma.getMapAttrNameForMemRef(dma.getDstMemRefOperandIndex()));

        AffineDmaWaitOp wait = AffineDmaWaitOp.create(body, LOC, tag, AffineMap.get(0, 1, symbol(0)),
                List.of(zero), count);
        assertTrue(wait.verify().isSuccess());
        assertSame(count, wait.getNumElements());
    }

    @Test
    void testDmaVerifier() {
        Value zero = ConstantOp.createIndex(body, LOC, 0).getResult();
        AffineDmaStartOp sameSpace = AffineDmaStartOp.create(body, LOC,
                a, AffineMap.multiDimIdentityMap(2), List.of(zero, zero),
                a, AffineMap.multiDimIdentityMap(2), List.of(zero, zero),
                tag, AffineMap.multiDimIdentityMap(1), List.of(zero),
                zero);
        assertEquals("'affine.dma_start' op DMA should be between different memory spaces", verifyError(sameSpace));

        AffineDmaStartOp notMemRef = AffineDmaStartOp.create(body, LOC,
                a, AffineMap.multiDimIdentityMap(2), List.of(zero, zero),
                fast, AffineMap.multiDimIdentityMap(2), List.of(zero, zero),
                n, AffineMap.getEmpty(), List.of(),
                zero);
        assertEquals("'affine.dma_start' op expected DMA tag to be of memref type", verifyError(notMemRef));

        AffineDmaStartOp extraOperand = AffineDmaStartOp.create(body, LOC,
                a, AffineMap.multiDimIdentityMap(2), List.of(zero, zero),
                fast, AffineMap.multiDimIdentityMap(2), List.of(zero, zero),
                tag, AffineMap.multiDimIdentityMap(1), List.of(zero),
                zero);
        Operation op = extraOperand.getOperation();
        List<Value> operands = new ArrayList<>(op.getOperands());
        operands.add(zero);
        op.setOperands(operands);
        assertEquals("'affine.dma_start' op incorrect number of operands", verifyError(extraOperand));

        AffineDmaWaitOp badWait = AffineDmaWaitOp.create(body, LOC, tag, AffineMap.multiDimIdentityMap(1),
                List.of(zero), zero);
        badWait.getOperation().setOperands(List.of(tag, zero));
        assertEquals("'affine.dma_wait' op incorrect number of operands", verifyError(badWait));
    }
}
