package io.github.eutro.affineir.passes;

import io.github.eutro.affineir.Utils;
import io.github.eutro.affineir.affine.AffineForOp;
import io.github.eutro.affineir.affine.AffineLoadOp;
import io.github.eutro.affineir.affine.AffineOps;
import io.github.eutro.affineir.affine.AffineStoreOp;
import io.github.eutro.affineir.asm.AsmPrinter;
import io.github.eutro.affineir.asm.ParseException;
import io.github.eutro.affineir.attrs.IntegerAttr;
import io.github.eutro.affineir.ir.Operation;
import io.github.eutro.affineir.ir.VerificationException;
import io.github.eutro.affineir.ops.OpKey;
import io.github.eutro.affineir.passes.meta.VerifyPass;
import io.github.eutro.affineir.passes.misc.ChainedPass;
import io.github.eutro.affineir.passes.misc.ForPass;
import io.github.eutro.affineir.passes.opts.Canonicalize;
import io.github.eutro.affineir.passes.opts.ComposeAffineApplies;
import io.github.eutro.affineir.passes.opts.EliminateDeadOps;
import io.github.eutro.affineir.std.ConstantOp;
import io.github.eutro.affineir.std.ModuleOp;
import io.github.eutro.affineir.std.StdOps;
import io.github.eutro.affineir.types.IndexType;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class PassesTest {
    private static final String CHAINED_APPLIES = "func @f(%A: memref<16xf32>) {\n"
            + "  affine.for %i = 0 to 8 {\n"
            + "    %a = affine.apply affine_map<(d0) -> (d0 * 2)>(%i)\n"
            + "    %b = affine.apply affine_map<(d0) -> (d0 + 1)>(%a)\n"
            + "    %v = affine.load %A[%b] : memref<16xf32>\n"
            + "    affine.store %v, %A[%a] : memref<16xf32>\n"
            + "  }\n"
            + "  return\n"
            + "}\n";

    private static final String USE_BEFORE_DEF = "func @f() -> index {\n"
            + "  %a = affine.apply affine_map<(d0) -> (d0 + 1)>(%b)\n"
            + "  %b = constant 1 : index\n"
            + "  return %a : index\n"
            + "}\n";

    private static List<Operation> findAll(ModuleOp module, OpKey kind) {
        List<Operation> found = new ArrayList<>();
        module.getOperation().walk(op -> {
            if (op.getKey() == kind) found.add(op);
        });
        return found;
    }

    @Test
    void testCanonicalizeFoldsBounds() throws IOException, ParseException {
        ModuleOp module = Utils.parseResource("/asm/bounds.mlir");
        Canonicalize.INSTANCE.run(module.getOperation());
        assertTrue(module.getOperation().verify().isSuccess());

        AffineForOp loop = AffineForOp.cast(findAll(module, AffineOps.FOR).get(0));
        assertTrue(loop.hasConstantBounds());
        assertEquals(8, loop.getConstantLowerBound());
        assertEquals(14, loop.getConstantUpperBound());
        assertTrue(findAll(module, StdOps.CONSTANT).isEmpty());
        assertTrue(findAll(module, AffineOps.APPLY).isEmpty());
        assertEquals(1, findAll(module, StdOps.DIM).size());

        String printed = AsmPrinter.printToString(module.getOperation());
        assertTrue(printed.contains("affine.for %1 = 8 to 14 {"), printed);
    }

    @Test
    void testCanonicalizeIsIdempotent() throws ParseException {
        ModuleOp module = Utils.parse(CHAINED_APPLIES);
        Canonicalize.INSTANCE.run(module.getOperation());
        String once = AsmPrinter.printToString(module.getOperation());
        Canonicalize.INSTANCE.run(module.getOperation());
        assertEquals(once, AsmPrinter.printToString(module.getOperation()));
    }

    @Test
    void testComposeAffineApplies() throws ParseException {
        ModuleOp module = Utils.parse(CHAINED_APPLIES);
        ComposeAffineApplies.INSTANCE.run(module.getOperation());

        AffineForOp loop = AffineForOp.cast(findAll(module, AffineOps.FOR).get(0));
        AffineLoadOp load = AffineLoadOp.cast(findAll(module, AffineOps.LOAD).get(0));
        assertEquals("(d0) -> (d0 * 2 + 1)", load.getAffineMap().toString());
        assertEquals(List.of(loop.getInductionVar()), load.getMapOperands());
        AffineStoreOp store = AffineStoreOp.cast(findAll(module, AffineOps.STORE).get(0));
        assertEquals("(d0) -> (d0 * 2)", store.getAffineMap().toString());
        assertEquals(List.of(loop.getInductionVar()), store.getMapOperands());

        // the applies are left in place
        assertEquals(2, findAll(module, AffineOps.APPLY).size());
        EliminateDeadOps.INSTANCE.run(module.getOperation());
        assertTrue(findAll(module, AffineOps.APPLY).isEmpty());
        assertTrue(module.getOperation().verify().isSuccess());
    }

    @Test
    void testEliminateDeadOps() throws ParseException {
        ModuleOp module = Utils.parse("func @f(%n: index) -> index {\n"
                + "  %c = constant 3 : index\n"
                + "  %a = affine.apply affine_map<(d0) -> (d0 + 1)>(%c)\n"
                + "  %b = affine.apply affine_map<(d0) -> (d0 * 2)>(%a)\n"
                + "  %kept = affine.apply affine_map<()[s0] -> (s0 + 1)>()[%n]\n"
                + "  affine.for %i = 0 to 4 {\n"
                + "  }\n"
                + "  return %kept : index\n"
                + "}\n");
        EliminateDeadOps.INSTANCE.run(module.getOperation());
        assertTrue(findAll(module, StdOps.CONSTANT).isEmpty());
        assertEquals(1, findAll(module, AffineOps.APPLY).size());
        // operations with regions are kept
        assertEquals(1, findAll(module, AffineOps.FOR).size());
        assertEquals(1, findAll(module, StdOps.RETURN).size());
    }

    @Test
    void testAffineOptsPipeline() throws ParseException {
        ModuleOp module = Utils.parse(CHAINED_APPLIES);
        Operation result = Passes.VERIFIED_AFFINE_OPTS.run(module.getOperation());
        assertSame(module.getOperation(), result);
        assertTrue(findAll(module, AffineOps.APPLY).isEmpty());
        assertEquals("(d0) -> (d0 * 2 + 1)",
                AffineLoadOp.cast(findAll(module, AffineOps.LOAD).get(0)).getAffineMap().toString());
        assertTrue(Passes.VERIFIED_AFFINE_OPTS.isInPlace());
    }

    @Test
    void testVerifyPass() throws ParseException {
        ModuleOp good = Utils.parse(CHAINED_APPLIES);
        assertSame(good.getOperation(), VerifyPass.INSTANCE.run(good.getOperation()));

        ModuleOp bad = Utils.parse(USE_BEFORE_DEF);
        VerificationException e = assertThrows(VerificationException.class,
                () -> VerifyPass.INSTANCE.run(bad.getOperation()));
        assertNotNull(e.getDiagnostic());
    }

    @Test
    void testChainAnnotatesFailures() throws ParseException {
        ModuleOp bad = Utils.parse(USE_BEFORE_DEF);
        IRPass<Operation, Operation> chain = EliminateDeadOps.INSTANCE
                .then(ComposeAffineApplies.INSTANCE)
                .then(VerifyPass.INSTANCE);
        assertEquals(3, ((ChainedPass<?, ?, ?>) chain).getPasses().size());
        assertEquals("dce, compose-affine-applies, verify", chain.toString());

        VerificationException e = assertThrows(VerificationException.class, () -> chain.run(bad.getOperation()));
        assertTrue(Arrays.stream(e.getSuppressed())
                        .anyMatch(t -> "running pass 2 (verify) in chain".equals(t.getMessage())),
                () -> Arrays.toString(e.getSuppressed()));
    }

    @Test
    void testForPassReplaces() throws ParseException {
        ModuleOp module = Utils.parse(CHAINED_APPLIES);
        IRPass<Operation, Operation> toZero = op -> Operation.create(
                ConstantOp.build(op.getLoc(), IntegerAttr.index(0), IndexType.get()));
        ForPass.liftOps(AffineOps.APPLY, toZero).run(module.getOperation());

        assertTrue(findAll(module, AffineOps.APPLY).isEmpty());
        AffineLoadOp load = AffineLoadOp.cast(findAll(module, AffineOps.LOAD).get(0));
        assertEquals(0L, ConstantOp.getConstantIndex(load.getMapOperands().get(0)));
        assertEquals(2, findAll(module, StdOps.CONSTANT).size());
    }

    @Test
    void testForPassInPlace() throws ParseException {
        ModuleOp module = Utils.parse(CHAINED_APPLIES);
        AtomicInteger visited = new AtomicInteger();
        InPlaceIRPass<Operation> count = op -> visited.incrementAndGet();
        ForPass.liftOps(null, count).run(module.getOperation());
        // every operation but the module itself
        List<Operation> all = new ArrayList<>();
        module.getOperation().walk(all::add);
        assertEquals(all.size() - 1, visited.get());

        IRPass<Operation, Operation> failing = ForPass.liftOps(AffineOps.APPLY, (InPlaceIRPass<Operation>) op -> {
            throw new IllegalStateException("failed");
        });
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> failing.run(module.getOperation()));
        assertEquals("in operation 0 of 2", e.getSuppressed()[0].getMessage());
    }
}
