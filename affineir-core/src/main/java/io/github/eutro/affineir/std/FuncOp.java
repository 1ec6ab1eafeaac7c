package io.github.eutro.affineir.std;

import io.github.eutro.affineir.asm.AsmPrinter;
import io.github.eutro.affineir.asm.OpAsmParser;
import io.github.eutro.affineir.asm.ParseException;
import io.github.eutro.affineir.attrs.StringAttr;
import io.github.eutro.affineir.attrs.TypeAttr;
import io.github.eutro.affineir.ir.Block;
import io.github.eutro.affineir.ir.Location;
import io.github.eutro.affineir.ir.Operation;
import io.github.eutro.affineir.ir.OperationState;
import io.github.eutro.affineir.ir.Region;
import io.github.eutro.affineir.ir.VerificationResult;
import io.github.eutro.affineir.ops.OpView;
import io.github.eutro.affineir.types.FunctionType;
import io.github.eutro.affineir.types.Type;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A function: a named region whose entry block arguments are the parameters.
 * <pre>{@code
 * func @f(%arg0: index) -> index {
 *   return %arg0 : index
 * }
 * }</pre>
 * A function without a body is external, and is printed with only its parameter types.
 */
public final class FuncOp extends OpView {
    private FuncOp(Operation op) {
        super(op);
    }

    public static FuncOp cast(Operation op) {
        return new FuncOp(checkKind(op, BuiltinOps.FUNC));
    }

    public static @Nullable FuncOp dynCast(@Nullable Operation op) {
        return op != null && op.getKey() == BuiltinOps.FUNC ? new FuncOp(op) : null;
    }

    /**
     * Create a detached function with an empty body.
     *
     * @param location The location.
     * @param name     The symbol name.
     * @param type     The signature.
     * @return The function.
     */
    public static FuncOp create(Location location, String name, FunctionType type) {
        OperationState state = new OperationState(location, BuiltinOps.FUNC)
                .addAttribute("sym_name", StringAttr.get(name))
                .addAttribute("type", TypeAttr.get(type));
        state.addRegion();
        return new FuncOp(Operation.create(state));
    }

    public String getName() {
        StringAttr name = op.getAttrOfType("sym_name", StringAttr.class);
        return name == null ? "" : name.getValue();
    }

    public @Nullable FunctionType getType() {
        TypeAttr type = op.getAttrOfType("type", TypeAttr.class);
        return type != null && type.getValue() instanceof FunctionType ? (FunctionType) type.getValue() : null;
    }

    public Region getBody() {
        return op.getRegion(0);
    }

    public boolean isExternal() {
        return getBody().isEmpty();
    }

    /**
     * Add the entry block, with one argument per parameter.
     *
     * @return The block.
     */
    public Block addEntryBlock() {
        FunctionType type = getType();
        if (type == null) throw new IllegalStateException("function has no signature");
        if (!getBody().isEmpty()) throw new IllegalStateException("function already has a body");
        Block entry = getBody().addBlock();
        entry.addArguments(type.getInputs());
        return entry;
    }

    static VerificationResult verifyOp(Operation op) {
        if (op.getAttrOfType("sym_name", StringAttr.class) == null) {
            return op.emitOpError("requires a string attribute 'sym_name'");
        }
        FuncOp func = new FuncOp(op);
        FunctionType type = func.getType();
        if (type == null) return op.emitOpError("requires a type attribute 'type'");
        if (op.getNumRegions() != 1) return op.emitOpError("requires one region");
        if (func.isExternal()) return VerificationResult.success();
        Block entry = func.getBody().front();
        List<Type> inputs = type.getInputs();
        if (entry.getNumArguments() != inputs.size()) {
            return op.emitOpError("entry block must have " + inputs.size()
                    + " arguments to match function signature");
        }
        for (int i = 0; i < inputs.size(); i++) {
            Type argType = entry.getArgument(i).getType();
            if (!argType.equals(inputs.get(i))) {
                return op.emitOpError("type of entry block argument #" + i + "(" + argType
                        + ") must match the type of the corresponding argument in function signature("
                        + inputs.get(i) + ")");
            }
        }
        return VerificationResult.success();
    }

    static void printOp(Operation op, AsmPrinter p) {
        FuncOp func = new FuncOp(op);
        FunctionType type = func.getType();
        if (type == null || op.getAttrOfType("sym_name", StringAttr.class) == null || op.getNumRegions() != 1
                || (!func.isExternal() && func.getBody().front().getNumArguments() != type.getInputs().size())) {
            p.printGenericOp(op);
            return;
        }
        p.print("func @").print(func.getName()).print("(");
        List<Type> inputs = type.getInputs();
        for (int i = 0; i < inputs.size(); i++) {
            if (i != 0) p.print(", ");
            if (!func.isExternal()) {
                p.printOperand(func.getBody().front().getArgument(i));
                p.print(": ");
            }
            p.printType(inputs.get(i));
        }
        p.print(")");
        if (!type.getResults().isEmpty()) {
            p.print(" -> ").print(FunctionType.resultsToString(type.getResults()));
        }
        if (op.getAttrs().size() > 2) {
            p.print(" attributes");
            p.printOptionalAttrDict(op.getAttrs(), "sym_name", "type");
        }
        if (!func.isExternal()) {
            p.print(" ");
            p.printRegion(func.getBody(), false, true);
        }
    }

    static void parseOp(OpAsmParser parser, OperationState state) throws ParseException {
        String name = parser.parseSymbolName();
        parser.parsePunct("(");
        List<OpAsmParser.UnresolvedOperand> args = new ArrayList<>();
        List<Type> argTypes = new ArrayList<>();
        if (!parser.parseOptionalPunct(")")) {
            do {
                OpAsmParser.UnresolvedOperand arg = parser.parseOptionalOperand();
                if (arg != null) {
                    args.add(arg);
                    parser.parsePunct(":");
                }
                argTypes.add(parser.parseType());
            } while (parser.parseOptionalPunct(","));
            parser.parsePunct(")");
        }
        if (!args.isEmpty() && args.size() != argTypes.size()) {
            throw parser.error("expected SSA identifier for every argument");
        }
        List<Type> results = parser.parseOptionalPunct("->") ? parser.parseResultTypeList() : List.of();
        state.addAttribute("sym_name", StringAttr.get(name));
        state.addAttribute("type", TypeAttr.get(FunctionType.get(argTypes, results)));
        if (parser.parseOptionalKeyword("attributes")) {
            parser.parseOptionalAttrDict(state);
        }
        Location bodyLoc = parser.getCurrentLocation();
        Region body = state.addRegion();
        if (parser.parseOptionalRegion(body, args, argTypes) && args.size() != argTypes.size()) {
            throw new ParseException(bodyLoc, "expected named arguments for a function with a body");
        }
    }
}
