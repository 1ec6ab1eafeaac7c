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
 * {@code affine.dma_wait %tag[%idx], %num_elements : memref<1xi32, 2>}: blocks until the
 * {@link AffineDmaStartOp transfer} signalling through the tag element completes.
 */
public final class AffineDmaWaitOp extends OpView {
    public static final String TAG_MAP_ATTR = AffineDmaStartOp.TAG_MAP_ATTR;

    private AffineDmaWaitOp(Operation op) {
        super(op);
    }

    public static AffineDmaWaitOp cast(Operation op) {
        return new AffineDmaWaitOp(checkKind(op, AffineOps.DMA_WAIT));
    }

    public static @Nullable AffineDmaWaitOp dynCast(@Nullable Operation op) {
        return op != null && op.getKey() == AffineOps.DMA_WAIT ? new AffineDmaWaitOp(op) : null;
    }

    public static OperationState build(Location location, Value tagMemRef, AffineMap tagMap,
                                       List<Value> tagIndices, Value numElements) {
        return new OperationState(location, AffineOps.DMA_WAIT)
                .addOperand(tagMemRef)
                .addAttribute(TAG_MAP_ATTR, AffineMapAttr.get(tagMap))
                .addOperands(tagIndices)
                .addOperand(numElements);
    }

    public static AffineDmaWaitOp create(OpBuilder builder, Location location, Value tagMemRef, AffineMap tagMap,
                                         List<Value> tagIndices, Value numElements) {
        return new AffineDmaWaitOp(builder.create(build(location, tagMemRef, tagMap, tagIndices, numElements)));
    }

    public Value getTagMemRef() {
        return op.getOperand(0);
    }

    public MemRefType getTagMemRefType() {
        return (MemRefType) getTagMemRef().getType();
    }

    public AffineMap getTagMap() {
        return op.getAttrOfType(TAG_MAP_ATTR, AffineMapAttr.class).getValue();
    }

    public List<Value> getTagIndices() {
        return op.operandRange(1, 1 + getTagMap().getNumInputs());
    }

    public Value getNumElements() {
        return op.getOperand(1 + getTagMap().getNumInputs());
    }

    static VerificationResult verifyOp(Operation op) {
        if (op.getNumOperands() < 1 || !(op.getOperand(0).getType() instanceof MemRefType)) {
            return op.emitOpError("expected DMA tag to be of memref type");
        }
        AffineMapAttr tagMapAttr = op.getAttrOfType(TAG_MAP_ATTR, AffineMapAttr.class);
        if (tagMapAttr == null) return op.emitOpError("requires attribute '" + TAG_MAP_ATTR + "'");
        if (op.getNumOperands() != tagMapAttr.getValue().getNumInputs() + 2) {
            return op.emitOpError("incorrect number of operands");
        }
        if (!op.getOperand(op.getNumOperands() - 1).getType().isIndex()) {
            return op.emitOpError("expected numElements to be of index type");
        }
        return VerificationResult.success();
    }

    static void printOp(Operation op, AsmPrinter p) {
        if (verifyOp(op).isFailure()) {
            p.printGenericOp(op);
            return;
        }
        AffineDmaWaitOp wait = new AffineDmaWaitOp(op);
        String tag = p.formatAffineMapOfSSAIds(wait.getTagMap(), wait.getTagIndices());
        if (tag == null) {
            p.printGenericOp(op);
            return;
        }
        p.print("affine.dma_wait ");
        AffineLoadOp.printAccess(p, wait.getTagMemRef(), tag);
        p.print(", ");
        p.printOperand(wait.getNumElements());
        p.printOptionalAttrDict(op.getAttrs(), TAG_MAP_ATTR);
        p.print(" : ");
        p.printType(wait.getTagMemRefType());
    }

    static void parseOp(OpAsmParser parser, OperationState state) throws ParseException {
        OpAsmParser.UnresolvedOperand tagMemRef = parser.parseOperand();
        List<OpAsmParser.UnresolvedOperand> tagIndices = new ArrayList<>();
        AffineMap tagMap = parser.parseAffineMapOfSSAIds(tagIndices);
        parser.parsePunct(",");
        OpAsmParser.UnresolvedOperand numElements = parser.parseOperand();
        parser.parseOptionalAttrDict(state);
        Location typeLoc = parser.getCurrentLocation();
        Type type = parser.parseColonType();
        if (!(type instanceof MemRefType)) throw new ParseException(typeLoc, "expected tag to be of memref type");
        state.addOperand(parser.resolveOperand(tagMemRef, type));
        state.addOperands(parser.resolveOperands(tagIndices, IndexType.get()));
        state.addOperand(parser.resolveOperand(numElements, IndexType.get()));
        state.addAttribute(TAG_MAP_ATTR, AffineMapAttr.get(tagMap));
    }
}
