package io.github.eutro.affineir.affine;

import io.github.eutro.affineir.affine.expr.AffineMap;
import io.github.eutro.affineir.asm.AsmPrinter;
import io.github.eutro.affineir.asm.OpAsmParser;
import io.github.eutro.affineir.asm.ParseException;
import io.github.eutro.affineir.attrs.AffineMapAttr;
import io.github.eutro.affineir.ir.Location;
import io.github.eutro.affineir.ir.OpBuilder;
import io.github.eutro.affineir.ir.Operation;
import io.github.eutro.affineir.ir.OperationState;
import io.github.eutro.affineir.ir.Value;
import io.github.eutro.affineir.ir.VerificationResult;
import io.github.eutro.affineir.ops.OpView;
import io.github.eutro.affineir.types.IndexType;
import io.github.eutro.affineir.types.MemRefType;
import io.github.eutro.affineir.types.Type;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code affine.store %v, %m[%i, %j + 2] : memref<100x100xf32>}: the write counterpart of {@link AffineLoadOp}.
 */
public final class AffineStoreOp extends OpView {
    public static final String MAP_ATTR = AffineLoadOp.MAP_ATTR;

    private AffineStoreOp(Operation op) {
        super(op);
    }

    public static AffineStoreOp cast(Operation op) {
        return new AffineStoreOp(checkKind(op, AffineOps.STORE));
    }

    public static @Nullable AffineStoreOp dynCast(@Nullable Operation op) {
        return op != null && op.getKey() == AffineOps.STORE ? new AffineStoreOp(op) : null;
    }

    public static OperationState build(Location location, Value valueToStore, Value memref,
                                       AffineMap map, List<Value> mapOperands) {
        return new OperationState(location, AffineOps.STORE)
                .addOperand(valueToStore)
                .addOperand(memref)
                .addOperands(mapOperands)
                .addAttribute(MAP_ATTR, AffineMapAttr.get(map));
    }

    public static OperationState build(Location location, Value valueToStore, Value memref, List<Value> indices) {
        AffineMap identity = AffineMap.multiDimIdentityMap(((MemRefType) memref.getType()).getRank());
        return build(location, valueToStore, memref, identity, indices);
    }

    public static AffineStoreOp create(OpBuilder builder, Location location, Value valueToStore, Value memref,
                                       AffineMap map, List<Value> mapOperands) {
        return new AffineStoreOp(builder.create(build(location, valueToStore, memref, map, mapOperands)));
    }

    public static AffineStoreOp create(OpBuilder builder, Location location,
                                       Value valueToStore, Value memref, List<Value> indices) {
        return new AffineStoreOp(builder.create(build(location, valueToStore, memref, indices)));
    }

    public Value getValueToStore() {
        return op.getOperand(0);
    }

    public Value getMemRef() {
        return op.getOperand(1);
    }

    public MemRefType getMemRefType() {
        return (MemRefType) getMemRef().getType();
    }

    public List<Value> getMapOperands() {
        return op.operandRange(2, op.getNumOperands());
    }

    public AffineMap getAffineMap() {
        return AffineLoadOp.accessMap(op, getMemRefType());
    }

    public void setAffineMap(AffineMap map, List<Value> mapOperands) {
        List<Value> operands = new ArrayList<>();
        operands.add(getValueToStore());
        operands.add(getMemRef());
        operands.addAll(mapOperands);
        op.setOperands(operands);
        op.setAttr(MAP_ATTR, AffineMapAttr.get(map));
    }

    static VerificationResult verifyOp(Operation op) {
        if (op.getNumOperands() < 2 || !(op.getOperand(1).getType() instanceof MemRefType)) {
            return op.emitOpError("memref operand must be of memref type");
        }
        MemRefType memRefType = (MemRefType) op.getOperand(1).getType();
        if (!op.getOperand(0).getType().equals(memRefType.getElementType())) {
            return op.emitOpError("first operand must have same type memref element type");
        }
        if (op.getNumResults() != 0) return op.emitOpError("requires zero results");
        return AffineLoadOp.verifyAccess(op, memRefType, op.operandRange(2, op.getNumOperands()));
    }

    static void printOp(Operation op, AsmPrinter p) {
        if (op.getAttrOfType(MAP_ATTR, AffineMapAttr.class) == null || verifyOp(op).isFailure()) {
            p.printGenericOp(op);
            return;
        }
        AffineStoreOp store = new AffineStoreOp(op);
        String subscripts = p.formatAffineMapOfSSAIds(store.getAffineMap(), store.getMapOperands());
        if (subscripts == null) {
            p.printGenericOp(op);
            return;
        }
        p.print("affine.store ");
        p.printOperand(store.getValueToStore());
        p.print(", ");
        AffineLoadOp.printAccess(p, store.getMemRef(), subscripts);
        p.printOptionalAttrDict(op.getAttrs(), MAP_ATTR);
        p.print(" : ");
        p.printType(store.getMemRefType());
    }

    static void parseOp(OpAsmParser parser, OperationState state) throws ParseException {
        OpAsmParser.UnresolvedOperand valueToStore = parser.parseOperand();
        parser.parsePunct(",");
        OpAsmParser.UnresolvedOperand memref = parser.parseOperand();
        List<OpAsmParser.UnresolvedOperand> mapOperands = new ArrayList<>();
        AffineMap map = parser.parseAffineMapOfSSAIds(mapOperands);
        state.addAttribute(MAP_ATTR, AffineMapAttr.get(map));
        parser.parseOptionalAttrDict(state);
        Location typeLoc = parser.getCurrentLocation();
        Type type = parser.parseColonType();
        if (!(type instanceof MemRefType)) throw new ParseException(typeLoc, "expected memref type");
        state.addOperand(parser.resolveOperand(valueToStore, ((MemRefType) type).getElementType()));
        state.addOperand(parser.resolveOperand(memref, type));
        state.addOperands(parser.resolveOperands(mapOperands, IndexType.get()));
    }
}
