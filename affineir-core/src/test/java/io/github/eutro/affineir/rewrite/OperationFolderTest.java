package io.github.eutro.affineir.rewrite;

import io.github.eutro.affineir.Utils;
import io.github.eutro.affineir.affine.AffineApplyOp;
import io.github.eutro.affineir.affine.AffineForOp;
import io.github.eutro.affineir.affine.expr.AffineMap;
import io.github.eutro.affineir.ir.Block;
import io.github.eutro.affineir.ir.OpBuilder;
import io.github.eutro.affineir.ir.Operation;
import io.github.eutro.affineir.ir.OperationState;
import io.github.eutro.affineir.ir.Value;
import io.github.eutro.affineir.ops.OpKey;
import io.github.eutro.affineir.std.ConstantOp;
import io.github.eutro.affineir.std.ModuleOp;
import io.github.eutro.affineir.std.StdOps;
import io.github.eutro.affineir.types.IndexType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static io.github.eutro.affineir.Utils.LOC;
import static io.github.eutro.affineir.affine.expr.AffineExpr.dim;
import static org.junit.jupiter.api.Assertions.*;

public class OperationFolderTest {
    private static final OpKey USER = OpKey.unregistered("test.user");

    private OpBuilder builder;
    private Block entry;
    private OperationFolder folder;

    @BeforeEach
    void setUp() {
        Utils.context();
        ModuleOp module = ModuleOp.create(LOC);
        builder = Utils.addFunction(module, "f", List.of(IndexType.get()));
        entry = Utils.entryBlock(builder);
        folder = new OperationFolder();
    }

    private Operation use(OpBuilder at, Value value) {
        return at.create(new OperationState(LOC, USER).addOperand(value));
    }

    private static List<Operation> constantsIn(Block block) {
        List<Operation> constants = new ArrayList<>();
        for (Operation op : block.getOperations()) {
            if (op.getKey() == StdOps.CONSTANT) constants.add(op);
        }
        return constants;
    }

    @Test
    void testConstantsAreUniqued() {
        ConstantOp first = ConstantOp.createIndex(builder, LOC, 5);
        ConstantOp second = ConstantOp.createIndex(builder, LOC, 5);
        ConstantOp other = ConstantOp.createIndex(builder, LOC, 6);
        Operation user = use(builder, second.getResult());

        assertFalse(folder.tryToFold(first.getOperation(), null, null));
        assertTrue(folder.tryToFold(second.getOperation(), null, null));
        assertFalse(folder.tryToFold(other.getOperation(), null, null));

        assertNull(second.getOperation().getBlock());
        assertSame(first.getResult(), user.getOperand(0));
        assertEquals(2, constantsIn(entry).size());
    }

    @Test
    void testConstantsAreHoistedToTheScope() {
        AffineForOp loop = AffineForOp.create(builder, LOC, 0, 10, 1);
        OpBuilder inLoop = OpBuilder.atBlockBegin(loop.getBody());
        ConstantOp inner = ConstantOp.createIndex(inLoop, LOC, 3);
        use(inLoop, inner.getResult());

        assertFalse(folder.tryToFold(inner.getOperation(), null, null));
        assertSame(entry, inner.getOperation().getBlock());
        assertSame(inner.getOperation(), entry.front());
        assertTrue(constantsIn(loop.getBody()).isEmpty());

        // a later equal constant in the loop folds into the hoisted one
        ConstantOp again = ConstantOp.createIndex(inLoop, LOC, 3);
        Operation user = use(inLoop, again.getResult());
        assertTrue(folder.tryToFold(again.getOperation(), null, null));
        assertSame(inner.getResult(), user.getOperand(0));
    }

    @Test
    void testFoldMaterializesConstants() {
        ConstantOp three = ConstantOp.createIndex(builder, LOC, 3);
        AffineApplyOp apply = AffineApplyOp.create(builder, LOC,
                AffineMap.get(1, 0, dim(0).mul(2)), List.of(three.getResult()));
        Operation user = use(builder, apply.getResult());

        List<Operation> generated = new ArrayList<>();
        List<Operation> replaced = new ArrayList<>();
        assertTrue(folder.tryToFold(apply.getOperation(), generated::add, replaced::add));

        assertEquals(List.of(apply.getOperation()), replaced);
        assertEquals(1, generated.size());
        Operation six = generated.get(0);
        assertEquals(6L, ConstantOp.cast(six).getIndexValue());
        assertSame(six, entry.front());
        assertSame(six.getResult(0), user.getOperand(0));
        assertNull(apply.getOperation().getBlock());
    }

    @Test
    void testFoldToOperand() {
        Value arg = entry.getArgument(0);
        AffineApplyOp apply = AffineApplyOp.create(builder, LOC, AffineMap.get(1, 0, dim(0)), List.of(arg));
        Operation user = use(builder, apply.getResult());

        List<Operation> generated = new ArrayList<>();
        assertTrue(folder.tryToFold(apply.getOperation(), generated::add, null));
        assertTrue(generated.isEmpty());
        assertSame(arg, user.getOperand(0));
    }

    @Test
    void testNothingToFold() {
        Value arg = entry.getArgument(0);
        AffineApplyOp apply = AffineApplyOp.create(builder, LOC,
                AffineMap.get(1, 0, dim(0).add(1)), List.of(arg));
        assertFalse(folder.tryToFold(apply.getOperation(), null, null));
        assertSame(entry, apply.getOperation().getBlock());
    }

    @Test
    void testCreate() {
        ConstantOp four = ConstantOp.createIndex(builder, LOC, 4);
        assertFalse(folder.tryToFold(four.getOperation(), null, null));
        int before = entry.getOperations().size();

        List<Value> results = folder.create(builder,
                AffineApplyOp.build(LOC, AffineMap.get(1, 0, dim(0).add(-4)), List.of(four.getResult())));
        assertEquals(1, results.size());
        Operation def = results.get(0).getDefiningOp();
        assertNotNull(def);
        assertEquals(0L, ConstantOp.cast(def).getIndexValue());
        // only the zero constant was added
        assertEquals(before + 1, entry.getOperations().size());

        List<Value> unfolded = folder.create(builder,
                AffineApplyOp.build(LOC, AffineMap.get(1, 0, dim(0).add(1)), List.of(entry.getArgument(0))));
        assertNotNull(AffineApplyOp.dynCast(unfolded.get(0).getDefiningOp()));
    }

    @Test
    void testNotifyRemoval() {
        ConstantOp seven = ConstantOp.createIndex(builder, LOC, 7);
        assertFalse(folder.tryToFold(seven.getOperation(), null, null));
        folder.notifyRemoval(seven.getOperation());
        seven.getOperation().erase();

        ConstantOp replacement = ConstantOp.createIndex(builder, LOC, 7);
        // nothing is left to fold into
        assertFalse(folder.tryToFold(replacement.getOperation(), null, null));
        assertSame(entry, replacement.getOperation().getBlock());
    }
}
