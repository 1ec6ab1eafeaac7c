package io.github.eutro.affineir.std;

import io.github.eutro.affineir.asm.AsmPrinter;
import io.github.eutro.affineir.asm.OpAsmParser;
import io.github.eutro.affineir.asm.ParseException;
import io.github.eutro.affineir.attrs.Attribute;
import io.github.eutro.affineir.attrs.IntegerAttr;
import io.github.eutro.affineir.ir.Location;
import io.github.eutro.affineir.ir.OpBuilder;
import io.github.eutro.affineir.ir.Operation;
import io.github.eutro.affineir.ir.OperationState;
import io.github.eutro.affineir.ir.Value;
import io.github.eutro.affineir.ir.VerificationResult;
import io.github.eutro.affineir.ops.FoldResult;
import io.github.eutro.affineir.ops.OpView;
import io.github.eutro.affineir.types.IndexType;
import io.github.eutro.affineir.types.MemRefType;
import io.github.eutro.affineir.types.Type;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * {@code %n = dim %m, 0 : memref<?xf32>}: the extent of a memref along one dimension.
 */
public final class DimOp extends OpView {
    private DimOp(Operation op) {
        super(op);
    }

    public static DimOp cast(Operation op) {
        return new DimOp(checkKind(op, StdOps.DIM));
    }

    public static @Nullable DimOp dynCast(@Nullable Operation op) {
        return op != null && op.getKey() == StdOps.DIM ? new DimOp(op) : null;
    }

    public static OperationState build(Location location, Value memref, int index) {
        return new OperationState(location, StdOps.DIM)
                .addOperand(memref)
                .addAttribute("index", IntegerAttr.index(index))
                .addType(IndexType.get());
    }

    public static DimOp create(OpBuilder builder, Location location, Value memref, int index) {
        return new DimOp(builder.create(build(location, memref, index)));
    }

    public Value getMemRef() {
        return op.getOperand(0);
    }

    public int getIndex() {
        return (int) op.getAttrOfType("index", IntegerAttr.class).getValue();
    }

    public Value getResult() {
        return op.getResult(0);
    }

    static VerificationResult verifyOp(Operation op) {
        if (op.getNumOperands() != 1) return op.emitOpError("requires a single operand");
        if (op.getNumResults() != 1 || !op.getResult(0).getType().isIndex()) {
            return op.emitOpError("requires a single result of type 'index'");
        }
        IntegerAttr index = op.getAttrOfType("index", IntegerAttr.class);
        if (index == null) return op.emitOpError("requires an integer attribute named 'index'");
        Type type = op.getOperand(0).getType();
        if (!(type instanceof MemRefType)) return op.emitOpError("requires an operand with memref type");
        if (index.getValue() < 0 || index.getValue() >= ((MemRefType) type).getRank()) {
            return op.emitOpError("index is out of range");
        }
        return VerificationResult.success();
    }

    static boolean foldOp(Operation op, List<@Nullable Attribute> constOperands, List<FoldResult> results) {
        if (verifyOp(op).isFailure()) return false;
        DimOp dim = new DimOp(op);
        MemRefType type = (MemRefType) dim.getMemRef().getType();
        if (type.isDynamicDim(dim.getIndex())) return false;
        results.add(FoldResult.of(IntegerAttr.index(type.getDimSize(dim.getIndex()))));
        return true;
    }

    static void printOp(Operation op, AsmPrinter p) {
        if (verifyOp(op).isFailure()) {
            p.printGenericOp(op);
            return;
        }
        p.print("dim ");
        p.printOperand(op.getOperand(0));
        p.print(", ").print(new DimOp(op).getIndex());
        p.printOptionalAttrDict(op.getAttrs(), "index");
        p.print(" : ").printType(op.getOperand(0).getType());
    }

    static void parseOp(OpAsmParser parser, OperationState state) throws ParseException {
        OpAsmParser.UnresolvedOperand memref = parser.parseOperand();
        parser.parsePunct(",");
        long index = parser.parseInteger();
        parser.parseOptionalAttrDict(state);
        Type type = parser.parseColonType();
        state.addOperand(parser.resolveOperand(memref, type))
                .addAttribute("index", IntegerAttr.index(index))
                .addType(IndexType.get());
    }
}
