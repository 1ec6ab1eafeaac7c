package io.github.eutro.affineir.affine;

import io.github.eutro.affineir.attrs.Attribute;
import io.github.eutro.affineir.ir.Location;
import io.github.eutro.affineir.ir.OpBuilder;
import io.github.eutro.affineir.ir.Operation;
import io.github.eutro.affineir.ops.Dialect;
import io.github.eutro.affineir.std.StdDialect;
import io.github.eutro.affineir.types.Type;
import org.jetbrains.annotations.Nullable;

/**
 * The {@code affine} dialect: loops, conditionals and memory accesses indexed by affine maps.
 */
public final class AffineDialect extends Dialect {
    public static final AffineDialect INSTANCE = new AffineDialect();

    private AffineDialect() {
        super("affine");
        addOperations(
                AffineOps.APPLY,
                AffineOps.DMA_START,
                AffineOps.DMA_WAIT,
                AffineOps.FOR,
                AffineOps.IF,
                AffineOps.LOAD,
                AffineOps.STORE,
                AffineOps.TERMINATOR
        );
    }

    /**
     * Folded affine operations produce {@code std.constant}s.
     */
    @Override
    public @Nullable Operation materializeConstant(OpBuilder builder, Attribute value, Type type, Location location) {
        return StdDialect.INSTANCE.materializeConstant(builder, value, type, location);
    }
}
