package io.github.eutro.affineir.std;

import io.github.eutro.affineir.asm.AsmPrinter;
import io.github.eutro.affineir.asm.OpAsmParser;
import io.github.eutro.affineir.asm.ParseException;
import io.github.eutro.affineir.attrs.Attribute;
import io.github.eutro.affineir.attrs.FloatAttr;
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
import io.github.eutro.affineir.types.Type;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * {@code %c = constant 42 : index}: a constant integer or float.
 */
public final class ConstantOp extends OpView {
    private ConstantOp(Operation op) {
        super(op);
    }

    public static ConstantOp cast(Operation op) {
        return new ConstantOp(checkKind(op, StdOps.CONSTANT));
    }

    public static @Nullable ConstantOp dynCast(@Nullable Operation op) {
        return op != null && op.getKey() == StdOps.CONSTANT ? new ConstantOp(op) : null;
    }

    public static OperationState build(Location location, Attribute value, Type type) {
        return new OperationState(location, StdOps.CONSTANT)
                .addAttribute("value", value)
                .addType(type);
    }

    public static ConstantOp create(OpBuilder builder, Location location, Attribute value, Type type) {
        return new ConstantOp(builder.create(build(location, value, type)));
    }

    public static ConstantOp createIndex(OpBuilder builder, Location location, long value) {
        return create(builder, location, IntegerAttr.index(value), IndexType.get());
    }

    public Attribute getValue() {
        return op.getAttr("value");
    }

    public Value getResult() {
        return op.getResult(0);
    }

    /**
     * @return The value, if this is an index constant.
     */
    public @Nullable Long getIndexValue() {
        Attribute value = getValue();
        if (value instanceof IntegerAttr && ((IntegerAttr) value).getType().isIndex()) {
            return ((IntegerAttr) value).getValue();
        }
        return null;
    }

    /**
     * Get the constant index a value is defined to be, if it is defined by an index constant.
     *
     * @param value The value.
     * @return The constant, or null.
     */
    public static @Nullable Long getConstantIndex(Value value) {
        ConstantOp constant = dynCast(value.getDefiningOp());
        return constant == null ? null : constant.getIndexValue();
    }

    static VerificationResult verifyOp(Operation op) {
        if (op.getNumOperands() != 0) return op.emitOpError("requires zero operands");
        if (op.getNumResults() != 1) return op.emitOpError("requires a single result");
        Attribute value = op.getAttr("value");
        if (value == null) return op.emitOpError("requires a 'value' attribute");
        Type type = op.getResult(0).getType();
        Type attrType;
        if (value instanceof IntegerAttr) {
            attrType = ((IntegerAttr) value).getType();
        } else if (value instanceof FloatAttr) {
            attrType = ((FloatAttr) value).getType();
        } else {
            return op.emitOpError("requires an integer or float 'value' attribute");
        }
        if (!attrType.equals(type)) {
            return op.emitOpError("requires attribute's type (" + attrType + ") to match op's return type (" + type + ")");
        }
        return VerificationResult.success();
    }

    static boolean foldOp(Operation op, List<@Nullable Attribute> constOperands, List<FoldResult> results) {
        Attribute value = op.getAttr("value");
        if (value == null) return false;
        results.add(FoldResult.of(value));
        return true;
    }

    static void printOp(Operation op, AsmPrinter p) {
        if (verifyOp(op).isFailure()) {
            p.printGenericOp(op);
            return;
        }
        p.print("constant ");
        p.printAttribute(op.getAttr("value"));
        p.printOptionalAttrDict(op.getAttrs(), "value");
    }

    static void parseOp(OpAsmParser parser, OperationState state) throws ParseException {
        Attribute value = parser.parseAttribute();
        Type type;
        if (value instanceof IntegerAttr) {
            type = ((IntegerAttr) value).getType();
        } else if (value instanceof FloatAttr) {
            type = ((FloatAttr) value).getType();
        } else {
            throw parser.error("expected an integer or float constant");
        }
        state.addAttribute("value", value).addType(type);
        parser.parseOptionalAttrDict(state);
    }
}
