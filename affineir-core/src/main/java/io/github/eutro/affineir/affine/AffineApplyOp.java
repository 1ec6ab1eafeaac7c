package io.github.eutro.affineir.affine;

import io.github.eutro.affineir.affine.expr.AffineDimExpr;
import io.github.eutro.affineir.affine.expr.AffineExpr;
import io.github.eutro.affineir.affine.expr.AffineMap;
import io.github.eutro.affineir.affine.expr.AffineSymbolExpr;
import io.github.eutro.affineir.asm.AsmPrinter;
import io.github.eutro.affineir.asm.OpAsmParser;
import io.github.eutro.affineir.asm.ParseException;
import io.github.eutro.affineir.attrs.AffineMapAttr;
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
import io.github.eutro.affineir.types.Type;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * {@code %r = affine.apply affine_map<(d0)[s0] -> (d0 + s0)> (%i)[%n]}: applies a single-result affine map
 * to index operands.
 */
public final class AffineApplyOp extends OpView {
    public static final String MAP_ATTR = "map";

    private AffineApplyOp(Operation op) {
        super(op);
    }

    public static AffineApplyOp cast(Operation op) {
        return new AffineApplyOp(checkKind(op, AffineOps.APPLY));
    }

    public static @Nullable AffineApplyOp dynCast(@Nullable Operation op) {
        return op != null && op.getKey() == AffineOps.APPLY ? new AffineApplyOp(op) : null;
    }

    public static OperationState build(Location location, AffineMap map, List<Value> operands) {
        return new OperationState(location, AffineOps.APPLY)
                .addOperands(operands)
                .addTypes(Collections.nCopies(map.getNumResults(), IndexType.get()))
                .addAttribute(MAP_ATTR, AffineMapAttr.get(map));
    }

    public static AffineApplyOp create(OpBuilder builder, Location location, AffineMap map, List<Value> operands) {
        return new AffineApplyOp(builder.create(build(location, map, operands)));
    }

    public AffineMap getAffineMap() {
        return op.getAttrOfType(MAP_ATTR, AffineMapAttr.class).getValue();
    }

    public List<Value> getMapOperands() {
        return op.getOperands();
    }

    public Value getResult() {
        return op.getResult(0);
    }

    /**
     * @return Whether the result can be used as a dimension, which it can if all operands can.
     */
    public boolean isValidDim() {
        return getMapOperands().stream().allMatch(AffineValidity::isValidDim);
    }

    /**
     * @return Whether the result can be used as a symbol, which it can if all operands can.
     */
    public boolean isValidSymbol() {
        return getMapOperands().stream().allMatch(AffineValidity::isValidSymbol);
    }

    /**
     * Convert the known constant operands of an operation to index values.
     *
     * @param constOperands The constant operands, null where unknown.
     * @return The values, null where unknown or not an integer.
     */
    static List<@Nullable Long> toIndexValues(List<@Nullable Attribute> constOperands) {
        List<@Nullable Long> values = new ArrayList<>(constOperands.size());
        for (Attribute attr : constOperands) {
            values.add(attr instanceof IntegerAttr ? ((IntegerAttr) attr).getValue() : null);
        }
        return values;
    }

    static VerificationResult verifyOp(Operation op) {
        AffineMapAttr mapAttr = op.getAttrOfType(MAP_ATTR, AffineMapAttr.class);
        if (mapAttr == null) return op.emitOpError("requires an affine map");
        AffineMap map = mapAttr.getValue();
        if (op.getNumOperands() != map.getNumInputs()) {
            return op.emitOpError("operand count and affine map dimension and symbol count must match");
        }
        for (Value operand : op.getOperands()) {
            if (!operand.getType().isIndex()) return op.emitOpError("operands must be of type 'index'");
        }
        for (Value result : op.getResults()) {
            if (!result.getType().isIndex()) return op.emitOpError("result must be of type 'index'");
        }
        VerificationResult valid = AffineValidity.verifyDimAndSymbolIdentifiers(op, op.getOperands(),
                map.getNumDims());
        if (valid.isFailure()) return valid;
        if (map.getNumResults() != 1 || op.getNumResults() != 1) {
            return op.emitOpError("mapping must produce one value");
        }
        return VerificationResult.success();
    }

    static boolean foldOp(Operation op, List<@Nullable Attribute> constOperands, List<FoldResult> results) {
        if (verifyOp(op).isFailure()) return false;
        AffineMap map = new AffineApplyOp(op).getAffineMap();
        AffineExpr expr = map.getResult(0);
        if (expr instanceof AffineDimExpr) {
            results.add(FoldResult.of(op.getOperand(((AffineDimExpr) expr).getPosition())));
            return true;
        }
        if (expr instanceof AffineSymbolExpr) {
            results.add(FoldResult.of(op.getOperand(map.getNumDims() + ((AffineSymbolExpr) expr).getPosition())));
            return true;
        }
        Optional<long[]> folded = map.constantFold(toIndexValues(constOperands));
        if (folded.isEmpty()) return false;
        results.add(FoldResult.of(IntegerAttr.index(folded.get()[0])));
        return true;
    }

    static void printOp(Operation op, AsmPrinter p) {
        AffineMapAttr mapAttr = op.getAttrOfType(MAP_ATTR, AffineMapAttr.class);
        if (mapAttr == null
                || mapAttr.getValue().getNumInputs() != op.getNumOperands()
                || mapAttr.getValue().getNumResults() != op.getNumResults()
                || !op.getResultTypes().stream().allMatch(Type::isIndex)
                || !op.getOperands().stream().allMatch(v -> v.getType().isIndex())) {
            p.printGenericOp(op);
            return;
        }
        p.print("affine.apply ").printAttribute(mapAttr);
        p.print(" ");
        p.printDimAndSymbolList(op.getOperands(), mapAttr.getValue().getNumDims());
        p.printOptionalAttrDict(op.getAttrs(), MAP_ATTR);
    }

    static void parseOp(OpAsmParser parser, OperationState state) throws ParseException {
        Location mapLoc = parser.getCurrentLocation();
        Attribute attr = parser.parseAttribute();
        if (!(attr instanceof AffineMapAttr)) throw new ParseException(mapLoc, "expected affine map");
        AffineMap map = ((AffineMapAttr) attr).getValue();
        List<OpAsmParser.UnresolvedOperand> operands = new ArrayList<>();
        int numDims = parser.parseDimAndSymbolList(operands);
        if (map.getNumDims() != numDims || map.getNumInputs() != operands.size()) {
            throw new ParseException(mapLoc, "dimension or symbol index mismatch");
        }
        state.addAttribute(MAP_ATTR, attr);
        parser.parseOptionalAttrDict(state);
        state.addOperands(parser.resolveOperands(operands, IndexType.get()));
        state.addTypes(Collections.nCopies(map.getNumResults(), IndexType.get()));
    }
}
