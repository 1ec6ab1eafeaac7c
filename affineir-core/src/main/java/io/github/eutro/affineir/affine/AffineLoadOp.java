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
 * {@code %v = affine.load %m[%i + 1, symbol(%n)] : memref<100x?xf32>}: reads the element of a memref
 * at the subscripts given by an affine map of the index operands.
 */
public final class AffineLoadOp extends OpView {
    public static final String MAP_ATTR = "map";

    private AffineLoadOp(Operation op) {
        super(op);
    }

    public static AffineLoadOp cast(Operation op) {
        return new AffineLoadOp(checkKind(op, AffineOps.LOAD));
    }

    public static @Nullable AffineLoadOp dynCast(@Nullable Operation op) {
        return op != null && op.getKey() == AffineOps.LOAD ? new AffineLoadOp(op) : null;
    }

    public static OperationState build(Location location, Value memref, AffineMap map, List<Value> mapOperands) {
        return new OperationState(location, AffineOps.LOAD)
                .addOperand(memref)
                .addOperands(mapOperands)
                .addAttribute(MAP_ATTR, AffineMapAttr.get(map))
                .addType(((MemRefType) memref.getType()).getElementType());
    }

    /**
     * Gather the parts of a load with the identity map, one index per dimension of the memref.
     */
    public static OperationState build(Location location, Value memref, List<Value> indices) {
        return build(location, memref, AffineMap.multiDimIdentityMap(((MemRefType) memref.getType()).getRank()),
                indices);
    }

    public static AffineLoadOp create(OpBuilder builder, Location location,
                                      Value memref, AffineMap map, List<Value> mapOperands) {
        return new AffineLoadOp(builder.create(build(location, memref, map, mapOperands)));
    }

    public static AffineLoadOp create(OpBuilder builder, Location location, Value memref, List<Value> indices) {
        return new AffineLoadOp(builder.create(build(location, memref, indices)));
    }

    public Value getMemRef() {
        return op.getOperand(0);
    }

    public MemRefType getMemRefType() {
        return (MemRefType) getMemRef().getType();
    }

    public List<Value> getMapOperands() {
        return op.operandRange(1, op.getNumOperands());
    }

    public AffineMap getAffineMap() {
        return accessMap(op, getMemRefType());
    }

    public void setAffineMap(AffineMap map, List<Value> mapOperands) {
        List<Value> operands = new ArrayList<>();
        operands.add(getMemRef());
        operands.addAll(mapOperands);
        op.setOperands(operands);
        op.setAttr(MAP_ATTR, AffineMapAttr.get(map));
    }

    public Value getResult() {
        return op.getResult(0);
    }

    static AffineMap accessMap(Operation op, MemRefType memRefType) {
        AffineMapAttr mapAttr = op.getAttrOfType(MAP_ATTR, AffineMapAttr.class);
        return mapAttr == null ? AffineMap.multiDimIdentityMap(memRefType.getRank()) : mapAttr.getValue();
    }

    /**
     * Check the subscripts of a load or a store.
     *
     * @param op          The operation.
     * @param memRefType  The type of the memref accessed.
     * @param mapOperands The operands of the access map.
     * @return The result.
     */
    static VerificationResult verifyAccess(Operation op, MemRefType memRefType, List<Value> mapOperands) {
        AffineMap map = accessMap(op, memRefType);
        if (map.getNumResults() != memRefType.getRank()) {
            return op.emitOpError(op.getName() + " affine map num results must equal memref rank");
        }
        for (Value index : mapOperands) {
            if (!index.getType().isIndex()) return op.emitOpError("index to load must have 'index' type");
        }
        if (mapOperands.size() != map.getNumInputs()) {
            return op.emitOpError("index operand count and affine map dimension and symbol count must match");
        }
        return AffineValidity.verifyDimAndSymbolIdentifiers(op, mapOperands, map.getNumDims());
    }

    static void printAccess(AsmPrinter p, Value memref, String subscripts) {
        p.printOperand(memref);
        p.print("[").print(subscripts).print("]");
    }

    static VerificationResult verifyOp(Operation op) {
        if (op.getNumOperands() < 1 || !(op.getOperand(0).getType() instanceof MemRefType)) {
            return op.emitOpError("memref operand must be of memref type");
        }
        MemRefType memRefType = (MemRefType) op.getOperand(0).getType();
        if (op.getNumResults() != 1 || !op.getResult(0).getType().equals(memRefType.getElementType())) {
            return op.emitOpError("result type must match element type of memref");
        }
        return verifyAccess(op, memRefType, op.operandRange(1, op.getNumOperands()));
    }

    static void printOp(Operation op, AsmPrinter p) {
        if (op.getAttrOfType(MAP_ATTR, AffineMapAttr.class) == null || verifyOp(op).isFailure()) {
            p.printGenericOp(op);
            return;
        }
        AffineLoadOp load = new AffineLoadOp(op);
        String subscripts = p.formatAffineMapOfSSAIds(load.getAffineMap(), load.getMapOperands());
        if (subscripts == null) {
            p.printGenericOp(op);
            return;
        }
        p.print("affine.load ");
        printAccess(p, load.getMemRef(), subscripts);
        p.printOptionalAttrDict(op.getAttrs(), MAP_ATTR);
        p.print(" : ");
        p.printType(load.getMemRefType());
    }

    static void parseOp(OpAsmParser parser, OperationState state) throws ParseException {
        OpAsmParser.UnresolvedOperand memref = parser.parseOperand();
        List<OpAsmParser.UnresolvedOperand> mapOperands = new ArrayList<>();
        AffineMap map = parser.parseAffineMapOfSSAIds(mapOperands);
        state.addAttribute(MAP_ATTR, AffineMapAttr.get(map));
        parser.parseOptionalAttrDict(state);
        Location typeLoc = parser.getCurrentLocation();
        Type type = parser.parseColonType();
        if (!(type instanceof MemRefType)) throw new ParseException(typeLoc, "expected memref type");
        state.addOperand(parser.resolveOperand(memref, type));
        state.addOperands(parser.resolveOperands(mapOperands, IndexType.get()));
        state.addType(((MemRefType) type).getElementType());
    }
}
