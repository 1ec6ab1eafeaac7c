package io.github.eutro.affineir.std;

import io.github.eutro.affineir.attrs.Attribute;
import io.github.eutro.affineir.attrs.FloatAttr;
import io.github.eutro.affineir.attrs.IntegerAttr;
import io.github.eutro.affineir.ir.Location;
import io.github.eutro.affineir.ir.OpBuilder;
import io.github.eutro.affineir.ir.Operation;
import io.github.eutro.affineir.ops.Dialect;
import io.github.eutro.affineir.types.Type;
import org.jetbrains.annotations.Nullable;

/**
 * The {@code std} dialect: constants, memref extents and function returns.
 */
public final class StdDialect extends Dialect {
    public static final StdDialect INSTANCE = new StdDialect();

    private StdDialect() {
        super("std");
        addOperations(StdOps.CONSTANT, StdOps.DIM, StdOps.RETURN);
    }

    @Override
    public @Nullable Operation materializeConstant(OpBuilder builder, Attribute value, Type type, Location location) {
        if (value instanceof IntegerAttr && type.isIntOrIndex()) {
            value = IntegerAttr.get(((IntegerAttr) value).getValue(), type);
        } else if (!(value instanceof FloatAttr) || !((FloatAttr) value).getType().equals(type)) {
            return null;
        }
        return ConstantOp.create(builder, location, value, type).getOperation();
    }
}
