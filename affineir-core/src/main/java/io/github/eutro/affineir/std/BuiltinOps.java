package io.github.eutro.affineir.std;

import io.github.eutro.affineir.ir.Operation;
import io.github.eutro.affineir.ir.VerificationResult;
import io.github.eutro.affineir.ops.OpKey;

import static io.github.eutro.affineir.ext.CommonExts.*;

/**
 * Kinds of the operations without a dialect prefix: functions and modules.
 */
public final class BuiltinOps {
    private BuiltinOps() {
    }

    public static final OpKey FUNC = new OpKey("func");
    public static final OpKey MODULE = new OpKey("module");
    public static final OpKey MODULE_TERMINATOR = new OpKey("module_terminator");

    static {
        FUNC.attachExt(AFFINE_SCOPE, true);
        FUNC.attachExt(VERIFIER, FuncOp::verifyOp);
        FUNC.attachExt(PRINTER, FuncOp::printOp);
        FUNC.attachExt(PARSER, FuncOp::parseOp);

        MODULE.attachExt(IMPLICIT_TERMINATOR, MODULE_TERMINATOR);
        MODULE.attachExt(VERIFIER, ModuleOp::verifyOp);
        MODULE.attachExt(PRINTER, ModuleOp::printOp);
        MODULE.attachExt(PARSER, ModuleOp::parseOp);

        MODULE_TERMINATOR.attachExt(IS_TERMINATOR, true);
        MODULE_TERMINATOR.attachExt(VERIFIER, op -> {
            Operation parent = op.getParentOp();
            if (parent == null || parent.getKey() != MODULE) {
                return op.emitOpError("expects parent op 'module'");
            }
            return VerificationResult.success();
        });
    }
}
