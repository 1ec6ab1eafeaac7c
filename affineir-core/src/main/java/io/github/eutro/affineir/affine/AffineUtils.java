package io.github.eutro.affineir.affine;

import io.github.eutro.affineir.affine.expr.AffineMap;
import io.github.eutro.affineir.attrs.AffineMapAttr;
import io.github.eutro.affineir.attrs.NamedAttribute;
import io.github.eutro.affineir.ir.OpBuilder;
import io.github.eutro.affineir.ir.Operation;
import io.github.eutro.affineir.ir.OperationState;
import io.github.eutro.affineir.ir.Value;
import io.github.eutro.affineir.types.MemRefType;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Transformations of the memory accesses of the affine dialect.
 */
public final class AffineUtils {
    private static final Logger LOGGER = Logger.getLogger(AffineUtils.class.getName());

    private AffineUtils() {
    }

    public static boolean isMemRefDereferencingOp(Operation op) {
        return op.getKey() == AffineOps.LOAD
                || op.getKey() == AffineOps.STORE
                || op.getKey() == AffineOps.DMA_START
                || op.getKey() == AffineOps.DMA_WAIT;
    }

    private static String getMapAttrNameForMemRef(Operation op, int memRefOperandPos) {
        if (op.getKey() == AffineOps.DMA_START) {
            return AffineDmaStartOp.cast(op).getMapAttrNameForMemRef(memRefOperandPos);
        }
        if (op.getKey() == AffineOps.DMA_WAIT) return AffineDmaWaitOp.TAG_MAP_ATTR;
        return AffineLoadOp.MAP_ATTR;
    }

    private static AffineMap getMapForMemRef(Operation op, String attrName, MemRefType memRefType) {
        AffineMapAttr attr = op.getAttrOfType(attrName, AffineMapAttr.class);
        return attr == null ? AffineMap.multiDimIdentityMap(memRefType.getRank()) : attr.getValue();
    }

    /**
     * Replace every use of a memref with another memref, rewriting the subscripts of each access.
     * <p>
     * Each access to {@code oldMemRef} at subscripts {@code s} is replaced by an access to {@code newMemRef} at
     * {@code extraIndices ++ indexRemap(extraOperands ++ s)}, the new access map being fully composed.
     *
     * @param oldMemRef     The memref to replace.
     * @param newMemRef     Its replacement, with the same element type.
     * @param extraIndices  Leading subscripts of the new memref.
     * @param indexRemap    A purely dimensional map from the extra operands and the old subscripts to the
     *                      remaining new subscripts, or null to use the old subscripts as they are.
     * @param extraOperands Extra inputs of the remapping.
     * @return Whether the memref was replaced, which it is not if it is used by anything other than an access.
     */
    public static boolean replaceAllMemRefUsesWith(Value oldMemRef, Value newMemRef,
                                                   List<Value> extraIndices,
                                                   @Nullable AffineMap indexRemap,
                                                   List<Value> extraOperands) {
        MemRefType oldType = (MemRefType) oldMemRef.getType();
        MemRefType newType = (MemRefType) newMemRef.getType();
        int oldRank = oldType.getRank();
        int newRank = newType.getRank();
        if (indexRemap != null) {
            if (indexRemap.getNumSymbols() != 0) {
                throw new IllegalArgumentException("pure dimensional index remapping expected");
            }
            if (indexRemap.getNumInputs() != extraOperands.size() + oldRank) {
                throw new IllegalArgumentException("index remapping must take the extra operands and old subscripts");
            }
            if (indexRemap.getNumResults() + extraIndices.size() != newRank) {
                throw new IllegalArgumentException("index remapping does not produce the new memref's rank");
            }
        } else if (oldRank + extraIndices.size() != newRank) {
            throw new IllegalArgumentException("extra indices do not make up the new memref's rank");
        }
        if (!oldType.getElementType().equals(newType.getElementType())) {
            throw new IllegalArgumentException("memrefs must have the same element type");
        }

        for (Operation user : oldMemRef.getUsers()) {
            if (!isMemRefDereferencingOp(user)) {
                LOGGER.fine(() -> "not replacing memref used by '" + user.getName() + "'");
                return false;
            }
        }

        while (!oldMemRef.useEmpty()) {
            Operation user = oldMemRef.getUsers().get(0);
            replaceMemRefUse(user, oldMemRef, newMemRef, extraIndices, indexRemap, extraOperands);
        }
        return true;
    }

    private static void replaceMemRefUse(Operation op, Value oldMemRef, Value newMemRef,
                                         List<Value> extraIndices,
                                         @Nullable AffineMap indexRemap,
                                         List<Value> extraOperands) {
        MemRefType oldType = (MemRefType) oldMemRef.getType();
        int memRefOperandPos = op.getOperands().indexOf(oldMemRef);
        String mapAttrName = getMapAttrNameForMemRef(op, memRefOperandPos);
        AffineMap oldMap = getMapForMemRef(op, mapAttrName, oldType);
        int oldMapNumInputs = oldMap.getNumInputs();
        List<Value> oldMapOperands = List.copyOf(op.operandRange(memRefOperandPos + 1,
                memRefOperandPos + 1 + oldMapNumInputs));

        OpBuilder builder = OpBuilder.before(op);
        List<Operation> applies = new ArrayList<>();

        List<Value> oldSubscripts = new ArrayList<>();
        if (!oldMap.equals(AffineMap.multiDimIdentityMap(oldMap.getNumDims()))) {
            for (int i = 0; i < oldMap.getNumResults(); i++) {
                AffineApplyOp apply = AffineApplyOp.create(builder, op.getLoc(),
                        oldMap.getSubMap(i), oldMapOperands);
                applies.add(apply.getOperation());
                oldSubscripts.add(apply.getResult());
            }
        } else {
            oldSubscripts.addAll(oldMapOperands);
        }

        List<Value> remapOperands = new ArrayList<>(extraOperands);
        remapOperands.addAll(oldSubscripts);
        List<Value> remapOutputs = new ArrayList<>();
        if (indexRemap != null && !indexRemap.equals(AffineMap.multiDimIdentityMap(indexRemap.getNumDims()))) {
            for (int i = 0; i < indexRemap.getNumResults(); i++) {
                AffineApplyOp apply = AffineApplyOp.create(builder, op.getLoc(),
                        indexRemap.getSubMap(i), remapOperands);
                applies.add(apply.getOperation());
                remapOutputs.add(apply.getResult());
            }
        } else {
            remapOutputs.addAll(remapOperands);
        }

        List<Value> newMapOperands = new ArrayList<>(extraIndices);
        newMapOperands.addAll(remapOutputs);
        MapAndOperands newAccess = AffineComposition.fullyComposeAffineMapAndOperands(
                AffineMap.multiDimIdentityMap(newMapOperands.size()), newMapOperands);
        newAccess = AffineComposition.canonicalizeMapAndOperands(newAccess.getMap().simplify(),
                newAccess.getOperands());

        OperationState state = new OperationState(op.getLoc(), op.getKey());
        state.addOperands(op.operandRange(0, memRefOperandPos));
        state.addOperand(newMemRef);
        state.addOperands(newAccess.getOperands());
        state.addOperands(op.operandRange(memRefOperandPos + 1 + oldMapNumInputs, op.getNumOperands()));
        state.addTypes(op.getResultTypes());
        boolean hadMap = false;
        for (NamedAttribute attr : op.getAttrs()) {
            if (attr.getName().equals(mapAttrName)) {
                state.addAttribute(mapAttrName, AffineMapAttr.get(newAccess.getMap()));
                hadMap = true;
            } else {
                state.addAttribute(attr.getName(), attr.getValue());
            }
        }
        if (!hadMap) state.addAttribute(mapAttrName, AffineMapAttr.get(newAccess.getMap()));

        Operation replacement = builder.create(state);
        op.replaceAllUsesWith(replacement);
        op.erase();

        for (int i = applies.size() - 1; i >= 0; i--) {
            if (applies.get(i).useEmpty()) applies.get(i).erase();
        }
    }
}
