package io.github.eutro.affineir.std;

import io.github.eutro.affineir.ops.OpKey;

import static io.github.eutro.affineir.ext.CommonExts.*;

/**
 * Kinds of the operations in the {@code std} dialect.
 */
public final class StdOps {
    private StdOps() {
    }

    public static final OpKey CONSTANT = new OpKey("std.constant");
    public static final OpKey DIM = new OpKey("std.dim");
    public static final OpKey RETURN = new OpKey("std.return");

    static {
        markPure(CONSTANT);
        CONSTANT.attachExt(CONSTANT_LIKE, true);
        CONSTANT.attachExt(VERIFIER, ConstantOp::verifyOp);
        CONSTANT.attachExt(FOLDER, ConstantOp::foldOp);
        CONSTANT.attachExt(PRINTER, ConstantOp::printOp);
        CONSTANT.attachExt(PARSER, ConstantOp::parseOp);

        markPure(DIM);
        DIM.attachExt(VERIFIER, DimOp::verifyOp);
        DIM.attachExt(FOLDER, DimOp::foldOp);
        DIM.attachExt(PRINTER, DimOp::printOp);
        DIM.attachExt(PARSER, DimOp::parseOp);

        RETURN.attachExt(IS_TERMINATOR, true);
        RETURN.attachExt(VERIFIER, ReturnOp::verifyOp);
        RETURN.attachExt(PRINTER, ReturnOp::printOp);
        RETURN.attachExt(PARSER, ReturnOp::parseOp);
    }
}
