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
 * Starts a transfer of {@code %num_elements} elements between memrefs in different memory spaces,
 * signalling completion through an element of a tag memref.
 * <pre>{@code
 * affine.dma_start %src[%i, %j], %dst[%k, %l], %tag[%idx], %num_elements, %stride, %num_elt_per_stride
 *   : memref<40x128xf32>, memref<2x1024xf32, 1>, memref<1xi32, 2>
 * }</pre>
 * Operands are laid out as the source memref and its subscripts, the destination memref and its subscripts,
 * the tag memref and its subscripts, the element count, then optionally the stride and the elements per stride.
 */
public final class AffineDmaStartOp extends OpView {
    public static final String SRC_MAP_ATTR = "src_map";
    public static final String DST_MAP_ATTR = "dst_map";
    public static final String TAG_MAP_ATTR = "tag_map";

    private AffineDmaStartOp(Operation op) {
        super(op);
    }

    public static AffineDmaStartOp cast(Operation op) {
        return new AffineDmaStartOp(checkKind(op, AffineOps.DMA_START));
    }

    public static @Nullable AffineDmaStartOp dynCast(@Nullable Operation op) {
        return op != null && op.getKey() == AffineOps.DMA_START ? new AffineDmaStartOp(op) : null;
    }

    public static OperationState build(Location location,
                                       Value srcMemRef, AffineMap srcMap, List<Value> srcIndices,
                                       Value dstMemRef, AffineMap dstMap, List<Value> dstIndices,
                                       Value tagMemRef, AffineMap tagMap, List<Value> tagIndices,
                                       Value numElements,
                                       @Nullable Value stride, @Nullable Value elementsPerStride) {
        if ((stride == null) != (elementsPerStride == null)) {
            throw new IllegalArgumentException("stride and elements per stride must be given together");
        }
        OperationState state = new OperationState(location, AffineOps.DMA_START)
                .addOperand(srcMemRef)
                .addAttribute(SRC_MAP_ATTR, AffineMapAttr.get(srcMap))
                .addOperands(srcIndices)
                .addOperand(dstMemRef)
                .addAttribute(DST_MAP_ATTR, AffineMapAttr.get(dstMap))
                .addOperands(dstIndices)
                .addOperand(tagMemRef)
                .addAttribute(TAG_MAP_ATTR, AffineMapAttr.get(tagMap))
                .addOperands(tagIndices)
                .addOperand(numElements);
        if (stride != null) {
            state.addOperand(stride).addOperand(elementsPerStride);
        }
        return state;
    }

    public static AffineDmaStartOp create(OpBuilder builder, Location location,
                                          Value srcMemRef, AffineMap srcMap, List<Value> srcIndices,
                                          Value dstMemRef, AffineMap dstMap, List<Value> dstIndices,
                                          Value tagMemRef, AffineMap tagMap, List<Value> tagIndices,
                                          Value numElements) {
        return new AffineDmaStartOp(builder.create(build(location,
                srcMemRef, srcMap, srcIndices,
                dstMemRef, dstMap, dstIndices,
                tagMemRef, tagMap, tagIndices,
                numElements, null, null)));
    }

    public int getSrcMemRefOperandIndex() {
        return 0;
    }

    public Value getSrcMemRef() {
        return op.getOperand(getSrcMemRefOperandIndex());
    }

    public MemRefType getSrcMemRefType() {
        return (MemRefType) getSrcMemRef().getType();
    }

    public AffineMap getSrcMap() {
        return op.getAttrOfType(SRC_MAP_ATTR, AffineMapAttr.class).getValue();
    }

    public List<Value> getSrcIndices() {
        int start = getSrcMemRefOperandIndex() + 1;
        return op.operandRange(start, start + getSrcMap().getNumInputs());
    }

    public int getSrcMemorySpace() {
        return getSrcMemRefType().getMemorySpace();
    }

    public int getDstMemRefOperandIndex() {
        return getSrcMemRefOperandIndex() + 1 + getSrcMap().getNumInputs();
    }

    public Value getDstMemRef() {
        return op.getOperand(getDstMemRefOperandIndex());
    }

    public MemRefType getDstMemRefType() {
        return (MemRefType) getDstMemRef().getType();
    }

    public AffineMap getDstMap() {
        return op.getAttrOfType(DST_MAP_ATTR, AffineMapAttr.class).getValue();
    }

    public List<Value> getDstIndices() {
        int start = getDstMemRefOperandIndex() + 1;
        return op.operandRange(start, start + getDstMap().getNumInputs());
    }

    public int getDstMemorySpace() {
        return getDstMemRefType().getMemorySpace();
    }

    public int getTagMemRefOperandIndex() {
        return getDstMemRefOperandIndex() + 1 + getDstMap().getNumInputs();
    }

    public Value getTagMemRef() {
        return op.getOperand(getTagMemRefOperandIndex());
    }

    public MemRefType getTagMemRefType() {
        return (MemRefType) getTagMemRef().getType();
    }

    public AffineMap getTagMap() {
        return op.getAttrOfType(TAG_MAP_ATTR, AffineMapAttr.class).getValue();
    }

    public List<Value> getTagIndices() {
        int start = getTagMemRefOperandIndex() + 1;
        return op.operandRange(start, start + getTagMap().getNumInputs());
    }

    public Value getNumElements() {
        return op.getOperand(getTagMemRefOperandIndex() + 1 + getTagMap().getNumInputs());
    }

    public boolean isStrided() {
        return op.getNumOperands() != getTagMemRefOperandIndex() + 1 + getTagMap().getNumInputs() + 1;
    }

    public @Nullable Value getStride() {
        return isStrided() ? op.getOperand(op.getNumOperands() - 2) : null;
    }

    public @Nullable Value getNumElementsPerStride() {
        return isStrided() ? op.getOperand(op.getNumOperands() - 1) : null;
    }

    /**
     * @return Whether this transfer is from a slower memory space to a faster one,
     * lower numbered memory spaces being slower.
     */
    public boolean isSrcMemorySpaceFaster() {
        return getDstMemorySpace() < getSrcMemorySpace();
    }

    public boolean isDestMemorySpaceFaster() {
        return getSrcMemorySpace() < getDstMemorySpace();
    }

    /**
     * Get the name of the map attribute applied to one of the memrefs of this operation.
     *
     * @param operandIndex The operand index of the source, destination or tag memref.
     * @return The attribute name.
     */
    public String getMapAttrNameForMemRef(int operandIndex) {
        if (operandIndex == getSrcMemRefOperandIndex()) return SRC_MAP_ATTR;
        if (operandIndex == getDstMemRefOperandIndex()) return DST_MAP_ATTR;
        if (operandIndex == getTagMemRefOperandIndex()) return TAG_MAP_ATTR;
        throw new IllegalArgumentException("operand " + operandIndex + " is not a memref of " + op.getName());
    }

    private static boolean hasMapAttrs(Operation op) {
        return op.getAttrOfType(SRC_MAP_ATTR, AffineMapAttr.class) != null
                && op.getAttrOfType(DST_MAP_ATTR, AffineMapAttr.class) != null
                && op.getAttrOfType(TAG_MAP_ATTR, AffineMapAttr.class) != null;
    }

    private static boolean isMemRefAt(Operation op, int index) {
        return index < op.getNumOperands() && op.getOperand(index).getType() instanceof MemRefType;
    }

    static VerificationResult verifyOp(Operation op) {
        if (!hasMapAttrs(op)) {
            return op.emitOpError("requires attributes '" + SRC_MAP_ATTR + "', '" + DST_MAP_ATTR
                    + "' and '" + TAG_MAP_ATTR + "'");
        }
        AffineDmaStartOp dma = new AffineDmaStartOp(op);
        if (!isMemRefAt(op, dma.getSrcMemRefOperandIndex())) {
            return op.emitOpError("expected DMA source to be of memref type");
        }
        if (!isMemRefAt(op, dma.getDstMemRefOperandIndex())) {
            return op.emitOpError("expected DMA destination to be of memref type");
        }
        if (!isMemRefAt(op, dma.getTagMemRefOperandIndex())) {
            return op.emitOpError("expected DMA tag to be of memref type");
        }
        if (dma.getSrcMemorySpace() == dma.getDstMemorySpace()) {
            return op.emitOpError("DMA should be between different memory spaces");
        }
        int numInputsAllMaps = dma.getSrcMap().getNumInputs()
                + dma.getDstMap().getNumInputs()
                + dma.getTagMap().getNumInputs();
        if (op.getNumOperands() != numInputsAllMaps + 3 + 1
                && op.getNumOperands() != numInputsAllMaps + 3 + 1 + 2) {
            return op.emitOpError("incorrect number of operands");
        }
        return VerificationResult.success();
    }

    static void printOp(Operation op, AsmPrinter p) {
        if (verifyOp(op).isFailure()) {
            p.printGenericOp(op);
            return;
        }
        AffineDmaStartOp dma = new AffineDmaStartOp(op);
        String src = p.formatAffineMapOfSSAIds(dma.getSrcMap(), dma.getSrcIndices());
        String dst = p.formatAffineMapOfSSAIds(dma.getDstMap(), dma.getDstIndices());
        String tag = p.formatAffineMapOfSSAIds(dma.getTagMap(), dma.getTagIndices());
        if (src == null || dst == null || tag == null) {
            p.printGenericOp(op);
            return;
        }
        p.print("affine.dma_start ");
        AffineLoadOp.printAccess(p, dma.getSrcMemRef(), src);
        p.print(", ");
        AffineLoadOp.printAccess(p, dma.getDstMemRef(), dst);
        p.print(", ");
        AffineLoadOp.printAccess(p, dma.getTagMemRef(), tag);
        p.print(", ");
        p.printOperand(dma.getNumElements());
        if (dma.isStrided()) {
            p.print(", ");
            p.printOperand(dma.getStride());
            p.print(", ");
            p.printOperand(dma.getNumElementsPerStride());
        }
        p.printOptionalAttrDict(op.getAttrs(), SRC_MAP_ATTR, DST_MAP_ATTR, TAG_MAP_ATTR);
        p.print(" : ");
        p.printTypes(List.of(dma.getSrcMemRefType(), dma.getDstMemRefType(), dma.getTagMemRefType()));
    }

    static void parseOp(OpAsmParser parser, OperationState state) throws ParseException {
        Location loc = parser.getCurrentLocation();
        OpAsmParser.UnresolvedOperand srcMemRef = parser.parseOperand();
        List<OpAsmParser.UnresolvedOperand> srcIndices = new ArrayList<>();
        AffineMap srcMap = parser.parseAffineMapOfSSAIds(srcIndices);
        parser.parsePunct(",");
        OpAsmParser.UnresolvedOperand dstMemRef = parser.parseOperand();
        List<OpAsmParser.UnresolvedOperand> dstIndices = new ArrayList<>();
        AffineMap dstMap = parser.parseAffineMapOfSSAIds(dstIndices);
        parser.parsePunct(",");
        OpAsmParser.UnresolvedOperand tagMemRef = parser.parseOperand();
        List<OpAsmParser.UnresolvedOperand> tagIndices = new ArrayList<>();
        AffineMap tagMap = parser.parseAffineMapOfSSAIds(tagIndices);
        parser.parsePunct(",");
        OpAsmParser.UnresolvedOperand numElements = parser.parseOperand();

        List<OpAsmParser.UnresolvedOperand> strideInfo = new ArrayList<>();
        while (parser.parseOptionalPunct(",")) {
            strideInfo.add(parser.parseOperand());
        }
        if (!strideInfo.isEmpty() && strideInfo.size() != 2) {
            throw new ParseException(loc, "expected two stride related operands");
        }
        parser.parseOptionalAttrDict(state);
        List<Type> types = parser.parseColonTypeList();
        if (types.size() != 3) throw new ParseException(loc, "expected three types");

        Type indexType = IndexType.get();
        state.addOperand(parser.resolveOperand(srcMemRef, types.get(0)));
        state.addOperands(parser.resolveOperands(srcIndices, indexType));
        state.addOperand(parser.resolveOperand(dstMemRef, types.get(1)));
        state.addOperands(parser.resolveOperands(dstIndices, indexType));
        state.addOperand(parser.resolveOperand(tagMemRef, types.get(2)));
        state.addOperands(parser.resolveOperands(tagIndices, indexType));
        state.addOperand(parser.resolveOperand(numElements, indexType));
        state.addOperands(parser.resolveOperands(strideInfo, indexType));
        state.addAttribute(SRC_MAP_ATTR, AffineMapAttr.get(srcMap));
        state.addAttribute(DST_MAP_ATTR, AffineMapAttr.get(dstMap));
        state.addAttribute(TAG_MAP_ATTR, AffineMapAttr.get(tagMap));
    }
}
