package io.github.eutro.affineir.affine;

import io.github.eutro.affineir.Utils;
import io.github.eutro.affineir.affine.expr.AffineMap;
import io.github.eutro.affineir.attrs.IntegerAttr;
import io.github.eutro.affineir.ir.Block;
import io.github.eutro.affineir.ir.OpBuilder;
import io.github.eutro.affineir.ir.Operation;
import io.github.eutro.affineir.ir.Value;
import io.github.eutro.affineir.ir.VerificationResult;
import io.github.eutro.affineir.ops.OpKey;
import io.github.eutro.affineir.passes.opts.Canonicalize;
import io.github.eutro.affineir.std.ConstantOp;
import io.github.eutro.affineir.std.ModuleOp;
import io.github.eutro.affineir.types.IndexType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.github.eutro.affineir.Utils.LOC;
import static io.github.eutro.affineir.affine.expr.AffineExpr.dim;
import static io.github.eutro.affineir.affine.expr.AffineExpr.symbol;
import static org.junit.jupiter.api.Assertions.*;

public class AffineForOpTest {
    private ModuleOp module;
    private OpBuilder builder;
    private Value n;

    @BeforeEach
    void setUp() {
        Utils.context();
        module = ModuleOp.create(LOC);
        builder = Utils.addFunction(module, "f", List.of(IndexType.get()));
        n = Utils.entryBlock(builder).getArgument(0);
    }

    private static String verifyError(AffineForOp loop) {
        VerificationResult result = loop.verify();
        assertTrue(result.isFailure());
        return result.getDiagnostic().getMessage();
    }

    @Test
    void testBuiltLoopShape() {
        AffineForOp loop = AffineForOp.create(builder, LOC, 0, 10, 2);
        assertEquals(1, loop.getRegion().getBlocks().size());
        Block body = loop.getBody();
        assertEquals(1, body.getNumArguments());
        assertTrue(loop.getInductionVar().getType().isIndex());
        assertSame(AffineOps.TERMINATOR, body.back().getKey());
        assertTrue(loop.hasConstantBounds());
        assertEquals(0, loop.getConstantLowerBound());
        assertEquals(10, loop.getConstantUpperBound());
        assertEquals(2, loop.getStep());
        assertTrue(loop.verify().isSuccess());
        assertSame(loop.getOperation(), AffineForOp.getForInductionVarOwner(loop.getInductionVar()).getOperation());
    }

    @Test
    void testBuildRejectsBadArguments() {
        assertThrows(IllegalArgumentException.class, () -> AffineForOp.build(LOC, 0, 10, 0));
        assertThrows(IllegalArgumentException.class, () -> AffineForOp.build(LOC,
                List.of(), AffineMap.symbolIdentityMap(), List.of(), AffineMap.constantMap(10), 1));
        AffineForOp loop = AffineForOp.create(builder, LOC, 0, 10, 1);
        assertThrows(IllegalArgumentException.class, () -> loop.setStep(-1));
    }

    @Test
    void testSymbolicBounds() {
        AffineForOp loop = AffineForOp.create(builder, LOC,
                List.of(n), AffineMap.symbolIdentityMap(),
                List.of(n, n), AffineMap.get(0, 2, symbol(0).add(10), symbol(1).mul(2)),
                1);
        assertTrue(loop.verify().isSuccess());
        assertEquals(List.of(n), loop.getLowerBoundOperands());
        assertEquals(List.of(n, n), loop.getUpperBoundOperands());
        assertFalse(loop.hasConstantUpperBound());
        assertFalse(loop.matchingBoundOperandList());

        loop.setConstantLowerBound(3);
        assertEquals(List.of(n, n), loop.getOperation().getOperands());
        assertTrue(loop.hasConstantLowerBound());
        assertTrue(loop.verify().isSuccess());
    }

    @Test
    void testNestedLoopBoundOnOuterInductionVar() {
        AffineForOp outer = AffineForOp.create(builder, LOC, 0, 10, 1);
        AffineForOp inner = AffineForOp.create(outer.getBodyBuilder(), LOC,
                List.of(outer.getInductionVar()), AffineMap.multiDimIdentityMap(1),
                List.of(), AffineMap.constantMap(10), 1);
        assertTrue(outer.verify().isSuccess());

        inner.setLowerBound(List.of(outer.getInductionVar()), AffineMap.symbolIdentityMap());
        assertEquals("'affine.for' op operand cannot be used as a symbol", verifyError(inner));
    }

    @Test
    void testVerifierMessages() {
        AffineForOp badStep = AffineForOp.create(builder, LOC, 0, 10, 1);
        badStep.getOperation().setAttr(AffineForOp.STEP_ATTR, IntegerAttr.index(0));
        assertEquals("'affine.for' op expected step to be representable as a positive signed integer",
                verifyError(badStep));

        AffineForOp noBound = AffineForOp.create(builder, LOC, 0, 10, 1);
        noBound.getOperation().removeAttr(AffineForOp.LOWER_BOUND_ATTR);
        assertEquals("'affine.for' op requires attributes 'lower_bound', 'upper_bound' and 'step'",
                verifyError(noBound));

        AffineForOp extraArg = AffineForOp.create(builder, LOC, 0, 10, 1);
        extraArg.getBody().addArgument(IndexType.get());
        assertEquals("'affine.for' op expected body to have a single index argument for the induction variable",
                verifyError(extraArg));

        AffineForOp noTerminator = AffineForOp.create(builder, LOC, 0, 10, 1);
        noTerminator.getBody().addOperation(Operation.create(LOC, OpKey.unregistered("test.op"),
                List.of(), List.of(), List.of(), 0));
        assertEquals("'affine.for' op expects regions to end with 'affine.terminator'",
                verifyError(noTerminator));

        AffineForOp twoBlocks = AffineForOp.create(builder, LOC, 0, 10, 1);
        twoBlocks.getRegion().addBlock();
        assertEquals("'affine.for' op expected body region to have a single block", verifyError(twoBlocks));

        AffineForOp extraOperand = AffineForOp.create(builder, LOC, 0, 10, 1);
        extraOperand.getOperation().setOperands(List.of(n));
        assertEquals("'affine.for' op operand count must match with affine map dimension and symbol count",
                verifyError(extraOperand));
    }

    @Test
    void testBoundsFoldToConstants() {
        Value four = ConstantOp.createIndex(builder, LOC, 4).getResult();
        AffineForOp loop = AffineForOp.create(builder, LOC,
                List.of(four, four), AffineMap.get(0, 2, symbol(0), symbol(1).mul(2)),
                List.of(four), AffineMap.get(1, 0, dim(0).add(10), dim(0).mul(5)),
                1);
        Canonicalize.INSTANCE.run(module.getOperation());

        assertTrue(loop.hasConstantBounds());
        assertEquals(8, loop.getConstantLowerBound());
        assertEquals(14, loop.getConstantUpperBound());
        assertEquals(0, loop.getOperation().getNumOperands());
        // the constant is no longer used
        assertTrue(module.getOperation().verify().isSuccess());
        int[] constants = {0};
        module.getOperation().walk(op -> {
            if (ConstantOp.dynCast(op) != null) constants[0]++;
        });
        assertEquals(0, constants[0]);
    }

    @Test
    void testBoundsWithUnknownOperandsAreKept() {
        Value four = ConstantOp.createIndex(builder, LOC, 4).getResult();
        AffineForOp loop = AffineForOp.create(builder, LOC,
                List.of(four, n), AffineMap.get(0, 2, symbol(0), symbol(1)),
                List.of(), AffineMap.constantMap(100),
                1);
        Canonicalize.INSTANCE.run(module.getOperation());
        assertFalse(loop.hasConstantLowerBound());
        assertEquals(2, loop.getLowerBoundMap().getNumResults());
    }
}
