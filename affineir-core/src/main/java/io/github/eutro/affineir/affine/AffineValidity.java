package io.github.eutro.affineir.affine;

import io.github.eutro.affineir.ext.CommonExts;
import io.github.eutro.affineir.ir.BlockArgument;
import io.github.eutro.affineir.ir.Operation;
import io.github.eutro.affineir.ir.Region;
import io.github.eutro.affineir.ir.Value;
import io.github.eutro.affineir.ir.VerificationResult;
import io.github.eutro.affineir.std.DimOp;
import io.github.eutro.affineir.std.StdOps;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Rules for which values may be used as the dimensions and symbols of affine maps and integer sets.
 * <p>
 * A symbol is a value that does not change within the nearest {@link CommonExts#AFFINE_SCOPE affine scope},
 * such as a function argument or a constant. A dimension may also be a loop induction variable,
 * or anything computed from dimensions by {@code affine.apply}.
 */
public final class AffineValidity {
    private AffineValidity() {
    }

    private static boolean isScopeRegion(@Nullable Region region) {
        if (region == null) return false;
        Operation parent = region.getParentOp();
        return parent != null && parent.hasTrait(CommonExts.AFFINE_SCOPE);
    }

    /**
     * Whether a value is defined directly in the body of an affine scope, such as a function,
     * rather than in a loop or conditional nested in it.
     *
     * @param value The value.
     * @return Whether it is top-level.
     */
    public static boolean isTopLevelValue(Value value) {
        if (value instanceof BlockArgument) {
            return isScopeRegion(((BlockArgument) value).getOwner().getParent());
        }
        Operation def = value.getDefiningOp();
        return def != null && isScopeRegion(def.getContainingRegion());
    }

    /**
     * Whether a value can be used as a dimension identifier: it is a valid symbol, a block argument
     * such as a loop induction variable, or the result of an {@code affine.apply} of dimensions.
     *
     * @param value The value.
     * @return Whether it is a valid dimension.
     */
    public static boolean isValidDim(Value value) {
        if (!value.getType().isIndex()) return false;
        Operation def = value.getDefiningOp();
        if (def == null) return true;
        if (isScopeRegion(def.getContainingRegion()) || def.getKey() == StdOps.CONSTANT) return true;
        if (def.getKey() == AffineOps.APPLY) return AffineApplyOp.cast(def).isValidDim();
        if (def.getKey() == StdOps.DIM) return isTopLevelValue(DimOp.cast(def).getMemRef());
        return false;
    }

    /**
     * Whether a value can be used as a symbol identifier: it is a constant, defined at the top level,
     * the {@code dim} of a top-level memref, or the result of an {@code affine.apply} of symbols.
     *
     * @param value The value.
     * @return Whether it is a valid symbol.
     */
    public static boolean isValidSymbol(Value value) {
        if (!value.getType().isIndex()) return false;
        Operation def = value.getDefiningOp();
        if (def == null) return isTopLevelValue(value);
        if (isScopeRegion(def.getContainingRegion()) || def.getKey() == StdOps.CONSTANT) return true;
        if (def.getKey() == AffineOps.APPLY) return AffineApplyOp.cast(def).isValidSymbol();
        if (def.getKey() == StdOps.DIM) return isTopLevelValue(DimOp.cast(def).getMemRef());
        return false;
    }

    /**
     * Check that the operands of a map or set are valid identifiers of the kind they are used as.
     *
     * @param op       The operation, to report errors on.
     * @param operands The operands, dimensions first.
     * @param numDims  The number of dimension operands.
     * @return The first failure, or success.
     */
    public static VerificationResult verifyDimAndSymbolIdentifiers(Operation op, List<Value> operands, int numDims) {
        for (int i = 0; i < operands.size(); i++) {
            Value operand = operands.get(i);
            if (i < numDims) {
                if (!isValidDim(operand)) return op.emitOpError("operand cannot be used as a dimension id");
            } else if (!isValidSymbol(operand)) {
                return op.emitOpError("operand cannot be used as a symbol");
            }
        }
        return VerificationResult.success();
    }
}
