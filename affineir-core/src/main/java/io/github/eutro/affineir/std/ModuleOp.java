package io.github.eutro.affineir.std;

import io.github.eutro.affineir.asm.AsmPrinter;
import io.github.eutro.affineir.asm.OpAsmParser;
import io.github.eutro.affineir.asm.ParseException;
import io.github.eutro.affineir.ir.Block;
import io.github.eutro.affineir.ir.Location;
import io.github.eutro.affineir.ir.Operation;
import io.github.eutro.affineir.ir.OperationState;
import io.github.eutro.affineir.ir.Region;
import io.github.eutro.affineir.ir.VerificationResult;
import io.github.eutro.affineir.ops.OpView;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * The top level container: one block of operations, ended by an implicit {@code module_terminator}.
 */
public final class ModuleOp extends OpView {
    private ModuleOp(Operation op) {
        super(op);
    }

    public static ModuleOp cast(Operation op) {
        return new ModuleOp(checkKind(op, BuiltinOps.MODULE));
    }

    public static ModuleOp create(Location location) {
        OperationState state = new OperationState(location, BuiltinOps.MODULE);
        state.addRegion().ensureTerminator(BuiltinOps.MODULE_TERMINATOR, location);
        return new ModuleOp(Operation.create(state));
    }

    public Block getBody() {
        return op.getRegion(0).front();
    }

    /**
     * Append an operation to the body, before the terminator.
     *
     * @param child The detached operation.
     */
    public void push(Operation child) {
        Block body = getBody();
        body.getOperations().add(body.getOperations().size() - 1, child);
    }

    public List<FuncOp> getFunctions() {
        List<FuncOp> funcs = new ArrayList<>();
        for (Operation child : getBody().getOperations()) {
            FuncOp func = FuncOp.dynCast(child);
            if (func != null) funcs.add(func);
        }
        return funcs;
    }

    public @Nullable FuncOp lookupFunction(String name) {
        for (FuncOp func : getFunctions()) {
            if (func.getName().equals(name)) return func;
        }
        return null;
    }

    static VerificationResult verifyOp(Operation op) {
        if (op.getNumRegions() != 1) return op.emitOpError("requires one region");
        Region body = op.getRegion(0);
        if (!body.hasOneBlock()) return op.emitOpError("expects region to have a single block");
        if (body.front().getNumArguments() != 0) return op.emitOpError("expects body to have no arguments");
        Operation last = body.front().isEmpty() ? null : body.front().back();
        if (last == null || last.getKey() != BuiltinOps.MODULE_TERMINATOR) {
            return op.emitOpError("expects regions to end with 'module_terminator'");
        }
        return VerificationResult.success();
    }

    static void printOp(Operation op, AsmPrinter p) {
        if (op.getNumRegions() != 1 || !op.getRegion(0).hasOneBlock()
                || op.getRegion(0).front().getNumArguments() != 0) {
            p.printGenericOp(op);
            return;
        }
        p.print("module");
        if (!op.getAttrs().isEmpty()) {
            p.print(" attributes");
            p.printOptionalAttrDict(op.getAttrs());
        }
        p.print(" ");
        p.printRegion(op.getRegion(0), false, false);
    }

    static void parseOp(OpAsmParser parser, OperationState state) throws ParseException {
        if (parser.parseOptionalKeyword("attributes")) {
            parser.parseOptionalAttrDict(state);
        }
        Region body = state.addRegion();
        parser.parseRegion(body, List.of(), List.of());
        body.ensureTerminator(BuiltinOps.MODULE_TERMINATOR, state.getLocation());
    }
}
