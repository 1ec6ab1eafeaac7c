package io.github.eutro.affineir.affine;

import io.github.eutro.affineir.Utils;
import io.github.eutro.affineir.affine.expr.AffineMap;
import io.github.eutro.affineir.ir.Block;
import io.github.eutro.affineir.ir.OpBuilder;
import io.github.eutro.affineir.ir.Value;
import io.github.eutro.affineir.ir.VerificationResult;
import io.github.eutro.affineir.std.ConstantOp;
import io.github.eutro.affineir.std.DimOp;
import io.github.eutro.affineir.std.ModuleOp;
import io.github.eutro.affineir.types.FloatType;
import io.github.eutro.affineir.types.IndexType;
import io.github.eutro.affineir.types.MemRefType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.github.eutro.affineir.Utils.LOC;
import static io.github.eutro.affineir.affine.expr.AffineExpr.dim;
import static io.github.eutro.affineir.affine.expr.AffineExpr.symbol;
import static org.junit.jupiter.api.Assertions.*;

public class AffineValidityTest {
    private Value n;
    private Value memref;
    private Value indices;
    private Value iv;
    private OpBuilder loopBuilder;

    @BeforeEach
    void setUp() {
        Utils.context();
        ModuleOp module = ModuleOp.create(LOC);
        OpBuilder builder = Utils.addFunction(module, "f", List.of(
                IndexType.get(),
                MemRefType.get(new long[]{MemRefType.DYNAMIC}, FloatType.get(32)),
                MemRefType.get(new long[]{8}, IndexType.get())));
        Block entry = Utils.entryBlock(builder);
        n = entry.getArgument(0);
        memref = entry.getArgument(1);
        indices = entry.getArgument(2);
        AffineForOp loop = AffineForOp.create(builder, LOC, 0, 8, 1);
        iv = loop.getInductionVar();
        loopBuilder = loop.getBodyBuilder();
    }

    @Test
    void testFunctionArguments() {
        assertTrue(AffineValidity.isTopLevelValue(n));
        assertTrue(AffineValidity.isValidSymbol(n));
        assertTrue(AffineValidity.isValidDim(n));
        // not of index type
        assertFalse(AffineValidity.isValidSymbol(memref));
        assertFalse(AffineValidity.isValidDim(memref));
    }

    @Test
    void testInductionVariable() {
        assertFalse(AffineValidity.isTopLevelValue(iv));
        assertTrue(AffineValidity.isValidDim(iv));
        assertFalse(AffineValidity.isValidSymbol(iv));
        assertTrue(AffineForOp.isForInductionVar(iv));
        assertFalse(AffineForOp.isForInductionVar(n));
    }

    @Test
    void testConstantsAndDims() {
        Value constant = ConstantOp.createIndex(loopBuilder, LOC, 3).getResult();
        assertFalse(AffineValidity.isTopLevelValue(constant));
        assertTrue(AffineValidity.isValidSymbol(constant));
        assertTrue(AffineValidity.isValidDim(constant));

        Value size = DimOp.create(loopBuilder, LOC, memref, 0).getResult();
        assertTrue(AffineValidity.isValidSymbol(size));
        assertTrue(AffineValidity.isValidDim(size));
    }

    @Test
    void testApplyResults() {
        Value ofSymbols = AffineApplyOp.create(loopBuilder, LOC,
                AffineMap.get(0, 1, symbol(0).mul(2)), List.of(n)).getResult();
        assertTrue(AffineValidity.isValidSymbol(ofSymbols));
        assertTrue(AffineValidity.isValidDim(ofSymbols));

        Value ofDims = AffineApplyOp.create(loopBuilder, LOC,
                AffineMap.get(1, 1, dim(0).add(symbol(0))), List.of(iv, n)).getResult();
        assertFalse(AffineValidity.isValidSymbol(ofDims));
        assertTrue(AffineValidity.isValidDim(ofDims));
    }

    @Test
    void testLoadedIndexIsNeither() {
        Value loaded = AffineLoadOp.create(loopBuilder, LOC, indices, List.of(iv)).getResult();
        assertFalse(AffineValidity.isValidDim(loaded));
        assertFalse(AffineValidity.isValidSymbol(loaded));

        AffineApplyOp apply = AffineApplyOp.create(loopBuilder, LOC, AffineMap.multiDimIdentityMap(1), List.of(loaded));
        VerificationResult result = apply.verify();
        assertTrue(result.isFailure());
        assertEquals("'affine.apply' op operand cannot be used as a dimension id",
                result.getDiagnostic().getMessage());
    }

    @Test
    void testVerifyIdentifiers() {
        AffineApplyOp apply = AffineApplyOp.create(loopBuilder, LOC,
                AffineMap.get(1, 1, dim(0).add(symbol(0))), List.of(iv, n));
        assertTrue(AffineValidity.verifyDimAndSymbolIdentifiers(
                apply.getOperation(), List.of(iv, n), 1).isSuccess());
        VerificationResult swapped = AffineValidity.verifyDimAndSymbolIdentifiers(
                apply.getOperation(), List.of(n, iv), 1);
        assertTrue(swapped.isFailure());
        assertEquals("'affine.apply' op operand cannot be used as a symbol", swapped.getDiagnostic().getMessage());
    }
}
