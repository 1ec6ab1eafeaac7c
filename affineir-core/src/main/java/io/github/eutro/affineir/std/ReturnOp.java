package io.github.eutro.affineir.std;

import io.github.eutro.affineir.asm.AsmPrinter;
import io.github.eutro.affineir.asm.OpAsmParser;
import io.github.eutro.affineir.asm.ParseException;
import io.github.eutro.affineir.ir.Location;
import io.github.eutro.affineir.ir.OpBuilder;
import io.github.eutro.affineir.ir.Operation;
import io.github.eutro.affineir.ir.OperationState;
import io.github.eutro.affineir.ir.Value;
import io.github.eutro.affineir.ir.VerificationResult;
import io.github.eutro.affineir.ops.OpView;
import io.github.eutro.affineir.types.FunctionType;
import io.github.eutro.affineir.types.Type;

import java.util.List;
import java.util.stream.Collectors;

/**
 * {@code return %a : index}: the terminator of a function body.
 */
public final class ReturnOp extends OpView {
    private ReturnOp(Operation op) {
        super(op);
    }

    public static ReturnOp cast(Operation op) {
        return new ReturnOp(checkKind(op, StdOps.RETURN));
    }

    public static OperationState build(Location location, List<Value> operands) {
        return new OperationState(location, StdOps.RETURN).addOperands(operands);
    }

    public static ReturnOp create(OpBuilder builder, Location location, List<Value> operands) {
        return new ReturnOp(builder.create(build(location, operands)));
    }

    static VerificationResult verifyOp(Operation op) {
        Operation parent = op.getParentOp();
        if (parent == null || parent.getKey() != BuiltinOps.FUNC) {
            return op.emitOpError("must be nested within a 'func' operation");
        }
        FunctionType type = FuncOp.cast(parent).getType();
        if (type == null) return VerificationResult.success();
        List<Type> results = type.getResults();
        if (op.getNumOperands() != results.size()) {
            return op.emitOpError("has " + op.getNumOperands() + " operands, but enclosing function returns "
                    + results.size());
        }
        for (int i = 0; i < results.size(); i++) {
            Type actual = op.getOperand(i).getType();
            if (!actual.equals(results.get(i))) {
                return op.emitOpError("type of return operand " + i + " (" + actual
                        + ") doesn't match function result type (" + results.get(i) + ")");
            }
        }
        return VerificationResult.success();
    }

    static void printOp(Operation op, AsmPrinter p) {
        p.print("return");
        if (op.getNumOperands() != 0) {
            p.print(" ");
            p.printOperands(op.getOperands());
        }
        p.printOptionalAttrDict(op.getAttrs());
        if (op.getNumOperands() != 0) {
            p.print(" : ");
            p.printTypes(op.getOperands().stream().map(Value::getType).collect(Collectors.toList()));
        }
    }

    static void parseOp(OpAsmParser parser, OperationState state) throws ParseException {
        List<OpAsmParser.UnresolvedOperand> operands = parser.parseOperandList();
        parser.parseOptionalAttrDict(state);
        if (!operands.isEmpty()) {
            Location typeLoc = parser.getCurrentLocation();
            List<Type> types = parser.parseColonTypeList();
            state.addOperands(parser.resolveOperands(operands, types, typeLoc));
        }
    }
}
