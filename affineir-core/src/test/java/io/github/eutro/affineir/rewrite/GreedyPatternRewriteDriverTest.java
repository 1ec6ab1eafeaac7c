package io.github.eutro.affineir.rewrite;

import io.github.eutro.affineir.Utils;
import io.github.eutro.affineir.affine.AffineApplyOp;
import io.github.eutro.affineir.affine.AffineOps;
import io.github.eutro.affineir.affine.expr.AffineMap;
import io.github.eutro.affineir.attrs.IntegerAttr;
import io.github.eutro.affineir.attrs.StringAttr;
import io.github.eutro.affineir.ext.CommonExts;
import io.github.eutro.affineir.ir.Block;
import io.github.eutro.affineir.ir.OpBuilder;
import io.github.eutro.affineir.ir.Operation;
import io.github.eutro.affineir.ir.OperationState;
import io.github.eutro.affineir.ir.Value;
import io.github.eutro.affineir.ops.OpKey;
import io.github.eutro.affineir.std.ConstantOp;
import io.github.eutro.affineir.std.ModuleOp;
import io.github.eutro.affineir.types.IndexType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.github.eutro.affineir.Utils.LOC;
import static io.github.eutro.affineir.affine.expr.AffineExpr.dim;
import static org.junit.jupiter.api.Assertions.*;

public class GreedyPatternRewriteDriverTest {
    private static final OpKey USER = OpKey.unregistered("test.user");
    private static final OpKey MARKER = OpKey.unregistered("test.marker");

    private ModuleOp module;
    private OpBuilder builder;
    private Block entry;

    @BeforeEach
    void setUp() {
        Utils.context();
        module = ModuleOp.create(LOC);
        builder = Utils.addFunction(module, "f", List.of(IndexType.get()));
        entry = Utils.entryBlock(builder);
    }

    private Operation use(Value value) {
        return builder.create(new OperationState(LOC, USER).addOperand(value));
    }

    private static final class Mark extends RewritePattern {
        private final String stage;

        Mark(String stage, int benefit) {
            super(MARKER, benefit);
            this.stage = stage;
        }

        @Override
        public boolean matchAndRewrite(Operation op, PatternRewriter rewriter) {
            if (op.getAttr("stage") != null) return false;
            op.setAttr("stage", StringAttr.get(stage));
            rewriter.updatedRootInPlace(op);
            return true;
        }
    }

    private static final class Toggle extends RewritePattern {
        Toggle() {
            super(MARKER, 1);
        }

        @Override
        public boolean matchAndRewrite(Operation op, PatternRewriter rewriter) {
            IntegerAttr count = op.getAttrOfType("count", IntegerAttr.class);
            op.setAttr("count", IntegerAttr.i64(count == null ? 1 : count.getValue() + 1));
            rewriter.updatedRootInPlace(op);
            return true;
        }
    }

    @Test
    void testFoldsChainsAndErasesDeadConstants() {
        ConstantOp two = ConstantOp.createIndex(builder, LOC, 2);
        AffineApplyOp times3 = AffineApplyOp.create(builder, LOC,
                AffineMap.get(1, 0, dim(0).mul(3)), List.of(two.getResult()));
        AffineApplyOp plus1 = AffineApplyOp.create(builder, LOC,
                AffineMap.get(1, 0, dim(0).add(1)), List.of(times3.getResult()));
        Operation user = use(plus1.getResult());

        assertTrue(new GreedyPatternRewriteDriver(List.of()).simplify(module.getOperation()));

        Operation seven = user.getOperand(0).getDefiningOp();
        assertNotNull(seven);
        assertEquals(7L, ConstantOp.cast(seven).getIndexValue());
        assertEquals(3, entry.getOperations().size());
        assertSame(seven, entry.front());
        assertSame(user, entry.getOperations().get(1));
    }

    @Test
    void testUnusedPureOpsAreErased() {
        Value arg = entry.getArgument(0);
        AffineApplyOp.create(builder, LOC, AffineMap.get(1, 0, dim(0).add(1)), List.of(arg));
        Operation kept = use(arg);

        assertTrue(new GreedyPatternRewriteDriver(List.of()).simplify(module.getOperation()));
        assertEquals(List.of(kept, entry.back()), entry.getOperations());
        assertTrue(entry.back().isKnownTerminator());
    }

    @Test
    void testHigherBenefitFirst() {
        Operation marker = builder.create(new OperationState(LOC, MARKER));
        assertTrue(new GreedyPatternRewriteDriver(List.of(new Mark("low", 1), new Mark("high", 5)))
                .simplify(module.getOperation()));
        assertEquals(StringAttr.get("high"), marker.getAttr("stage"));
    }

    @Test
    void testIterationCap() {
        Operation marker = builder.create(new OperationState(LOC, MARKER));
        assertFalse(new GreedyPatternRewriteDriver(List.of(new Toggle())).simplify(module.getOperation()));
        assertEquals(GreedyPatternRewriteDriver.MAX_ITERATIONS,
                marker.getAttrOfType("count", IntegerAttr.class).getValue());
    }

    @Test
    void testApplyCanonicalization() {
        Value arg = entry.getArgument(0);
        AffineApplyOp inner = AffineApplyOp.create(builder, LOC,
                AffineMap.get(1, 0, dim(0).mul(2)), List.of(arg));
        AffineApplyOp outer = AffineApplyOp.create(builder, LOC,
                AffineMap.get(1, 0, dim(0).add(3)), List.of(inner.getResult()));
        Operation user = use(outer.getResult());

        List<RewritePattern> patterns = AffineOps.APPLY.getNullable(CommonExts.CANONICALIZATION_PATTERNS);
        assertNotNull(patterns);
        assertTrue(new GreedyPatternRewriteDriver(patterns).simplify(module.getOperation()));

        AffineApplyOp composed = AffineApplyOp.dynCast(user.getOperand(0).getDefiningOp());
        assertNotNull(composed);
        // the function argument is a valid symbol
        assertEquals("()[s0] -> (s0 * 2 + 3)", composed.getAffineMap().toString());
        assertEquals(List.of(arg), composed.getMapOperands());
        // the inner apply became dead and was erased
        assertEquals(List.of(composed.getOperation(), user, entry.back()), entry.getOperations());
    }
}
