package io.github.eutro.affineir.affine;

import io.github.eutro.affineir.Utils;
import io.github.eutro.affineir.affine.expr.AffineMap;
import io.github.eutro.affineir.ir.Block;
import io.github.eutro.affineir.ir.OpBuilder;
import io.github.eutro.affineir.ir.Operation;
import io.github.eutro.affineir.ir.Value;
import io.github.eutro.affineir.ops.OpKey;
import io.github.eutro.affineir.std.ConstantOp;
import io.github.eutro.affineir.std.ModuleOp;
import io.github.eutro.affineir.types.FloatType;
import io.github.eutro.affineir.types.IndexType;
import io.github.eutro.affineir.types.IntegerType;
import io.github.eutro.affineir.types.MemRefType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static io.github.eutro.affineir.Utils.LOC;
import static io.github.eutro.affineir.affine.expr.AffineExpr.dim;
import static org.junit.jupiter.api.Assertions.*;

public class AffineUtilsTest {
    private ModuleOp module;
    private OpBuilder builder;
    private Value flat;
    private Value tiled;
    private Value stacked;
    private Value iv;
    private OpBuilder body;

    @BeforeEach
    void setUp() {
        Utils.context();
        module = ModuleOp.create(LOC);
        builder = Utils.addFunction(module, "f", List.of(
                MemRefType.get(new long[]{16}, FloatType.get(32)),
                MemRefType.get(new long[]{4, 4}, FloatType.get(32)),
                MemRefType.get(new long[]{2, 16}, FloatType.get(32))));
        Block entry = Utils.entryBlock(builder);
        flat = entry.getArgument(0);
        tiled = entry.getArgument(1);
        stacked = entry.getArgument(2);
        AffineForOp loop = AffineForOp.create(builder, LOC, 0, 15, 1);
        iv = loop.getInductionVar();
        body = loop.getBodyBuilder();
    }

    private int countApplies() {
        int[] count = {0};
        module.getOperation().walk(op -> {
            if (op.getKey() == AffineOps.APPLY) count[0]++;
        });
        return count[0];
    }

    private Operation findOnly(OpKey kind) {
        List<Operation> found = new ArrayList<>();
        module.getOperation().walk(op -> {
            if (op.getKey() == kind) found.add(op);
        });
        assertEquals(1, found.size(), () -> "expected a single " + kind);
        return found.get(0);
    }

    @Test
    void testExtraIndices() {
        Value one = ConstantOp.createIndex(builder, LOC, 1).getResult();
        AffineLoadOp load = AffineLoadOp.create(body, LOC, flat, List.of(iv));
        AffineStoreOp.create(body, LOC, load.getResult(), flat, List.of(iv));

        assertTrue(AffineUtils.replaceAllMemRefUsesWith(flat, stacked, List.of(one), null, List.of()));
        assertTrue(flat.useEmpty());

        AffineLoadOp newLoad = AffineLoadOp.cast(findOnly(AffineOps.LOAD));
        assertNotSame(load.getOperation(), newLoad.getOperation());
        assertSame(stacked, newLoad.getMemRef());
        assertEquals("(d0)[s0] -> (s0, d0)", newLoad.getAffineMap().toString());
        assertEquals(List.of(iv, one), newLoad.getMapOperands());

        AffineStoreOp newStore = AffineStoreOp.cast(findOnly(AffineOps.STORE));
        assertSame(stacked, newStore.getMemRef());
        assertSame(newLoad.getResult(), newStore.getValueToStore());
        assertTrue(module.getOperation().verify().isSuccess());
    }

    @Test
    void testIndexRemap() {
        AffineLoadOp load = AffineLoadOp.create(body, LOC, flat,
                AffineMap.get(1, 0, dim(0).add(1)), List.of(iv));
        AffineStoreOp.create(body, LOC, load.getResult(), flat, List.of(iv));

        AffineMap tile = AffineMap.get(1, 0, dim(0).floorDiv(4), dim(0).mod(4));
        assertTrue(AffineUtils.replaceAllMemRefUsesWith(flat, tiled, List.of(), tile, List.of()));

        AffineLoadOp newLoad = AffineLoadOp.cast(findOnly(AffineOps.LOAD));
        assertSame(tiled, newLoad.getMemRef());
        assertEquals(List.of(iv), newLoad.getMapOperands());
        AffineMap map = newLoad.getAffineMap();
        for (long i = 0; i < 15; i++) {
            long[] subscripts = map.constantFold(List.of(i)).orElseThrow();
            assertArrayEquals(new long[]{(i + 1) / 4, (i + 1) % 4}, subscripts);
        }
        assertEquals(0, countApplies());
        assertTrue(module.getOperation().verify().isSuccess());
    }

    @Test
    void testNonAccessUserPreventsReplacement() {
        AffineLoadOp load = AffineLoadOp.create(body, LOC, flat, List.of(iv));
        Operation escape = Operation.create(LOC, OpKey.unregistered("test.escape"),
                List.of(flat), List.of(), List.of(), 0);
        body.insert(escape);

        assertFalse(AffineUtils.replaceAllMemRefUsesWith(flat, stacked,
                List.of(ConstantOp.createIndex(builder, LOC, 0).getResult()), null, List.of()));
        assertSame(flat, load.getMemRef());
        assertSame(flat, escape.getOperand(0));
        assertEquals(2, flat.getUsers().size());
    }

    @Test
    void testRankAndTypeChecks() {
        AffineLoadOp.create(body, LOC, flat, List.of(iv));
        assertThrows(IllegalArgumentException.class,
                () -> AffineUtils.replaceAllMemRefUsesWith(flat, stacked, List.of(), null, List.of()));

        Value ints = Utils.entryBlock(builder).addArgument(MemRefType.get(new long[]{16}, IntegerType.get(32)));
        assertThrows(IllegalArgumentException.class,
                () -> AffineUtils.replaceAllMemRefUsesWith(flat, ints, List.of(), null, List.of()));

        AffineMap withSymbol = AffineMap.get(1, 1, dim(0));
        assertThrows(IllegalArgumentException.class,
                () -> AffineUtils.replaceAllMemRefUsesWith(flat, flat, List.of(), withSymbol, List.of()));
    }

    @Test
    void testIsMemRefDereferencingOp() {
        AffineLoadOp load = AffineLoadOp.create(body, LOC, flat, List.of(iv));
        assertTrue(AffineUtils.isMemRefDereferencingOp(load.getOperation()));
        Value c = ConstantOp.createIndex(body, LOC, 0).getResult();
        assertFalse(AffineUtils.isMemRefDereferencingOp(c.getDefiningOp()));
        assertEquals(IndexType.get(), c.getType());
    }
}
