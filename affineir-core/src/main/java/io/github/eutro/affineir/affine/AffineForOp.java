package io.github.eutro.affineir.affine;

import io.github.eutro.affineir.affine.expr.AffineConstantExpr;
import io.github.eutro.affineir.affine.expr.AffineExpr;
import io.github.eutro.affineir.affine.expr.AffineMap;
import io.github.eutro.affineir.affine.expr.AffineSymbolExpr;
import io.github.eutro.affineir.asm.AsmPrinter;
import io.github.eutro.affineir.asm.OpAsmParser;
import io.github.eutro.affineir.asm.ParseException;
import io.github.eutro.affineir.attrs.AffineMapAttr;
import io.github.eutro.affineir.attrs.Attribute;
import io.github.eutro.affineir.attrs.IntegerAttr;
import io.github.eutro.affineir.ir.Block;
import io.github.eutro.affineir.ir.BlockArgument;
import io.github.eutro.affineir.ir.Location;
import io.github.eutro.affineir.ir.OpBuilder;
import io.github.eutro.affineir.ir.Operation;
import io.github.eutro.affineir.ir.OperationState;
import io.github.eutro.affineir.ir.Region;
import io.github.eutro.affineir.ir.Value;
import io.github.eutro.affineir.ir.VerificationResult;
import io.github.eutro.affineir.ops.OpView;
import io.github.eutro.affineir.types.IndexType;
import io.github.eutro.affineir.types.Type;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A loop over an induction variable, from a lower bound up to but not including an upper bound, by a constant step.
 * <pre>{@code
 * affine.for %i = 0 to %n step 2 {
 *   ...
 * }
 * }</pre>
 * The operands are those of the lower bound map followed by those of the upper bound map.
 * The body is a single block whose only argument is the induction variable, ending in {@code affine.terminator}.
 */
public final class AffineForOp extends OpView {
    public static final String LOWER_BOUND_ATTR = "lower_bound";
    public static final String UPPER_BOUND_ATTR = "upper_bound";
    public static final String STEP_ATTR = "step";

    private AffineForOp(Operation op) {
        super(op);
    }

    public static AffineForOp cast(Operation op) {
        return new AffineForOp(checkKind(op, AffineOps.FOR));
    }

    public static @Nullable AffineForOp dynCast(@Nullable Operation op) {
        return op != null && op.getKey() == AffineOps.FOR ? new AffineForOp(op) : null;
    }

    /**
     * Gather the parts of a loop, with an empty body.
     *
     * @param location   The location.
     * @param lbOperands The operands of the lower bound.
     * @param lbMap      The lower bound.
     * @param ubOperands The operands of the upper bound.
     * @param ubMap      The upper bound.
     * @param step       The step, which must be positive.
     * @return The state.
     */
    public static OperationState build(Location location,
                                       List<Value> lbOperands, AffineMap lbMap,
                                       List<Value> ubOperands, AffineMap ubMap,
                                       long step) {
        if (lbOperands.size() != lbMap.getNumInputs()) {
            throw new IllegalArgumentException("lower bound operand count does not match the affine map");
        }
        if (ubOperands.size() != ubMap.getNumInputs()) {
            throw new IllegalArgumentException("upper bound operand count does not match the affine map");
        }
        if (step <= 0) throw new IllegalArgumentException("step has to be a positive integer constant");
        OperationState state = new OperationState(location, AffineOps.FOR)
                .addAttribute(STEP_ATTR, IntegerAttr.index(step))
                .addAttribute(LOWER_BOUND_ATTR, AffineMapAttr.get(lbMap))
                .addAttribute(UPPER_BOUND_ATTR, AffineMapAttr.get(ubMap))
                .addOperands(lbOperands)
                .addOperands(ubOperands);
        Region body = state.addRegion();
        body.addBlock().addArgument(IndexType.get());
        body.ensureTerminator(AffineOps.TERMINATOR, location);
        return state;
    }

    public static OperationState build(Location location, long lb, long ub, long step) {
        return build(location, List.of(), AffineMap.constantMap(lb), List.of(), AffineMap.constantMap(ub), step);
    }

    public static AffineForOp create(OpBuilder builder, Location location,
                                     List<Value> lbOperands, AffineMap lbMap,
                                     List<Value> ubOperands, AffineMap ubMap,
                                     long step) {
        return new AffineForOp(builder.create(build(location, lbOperands, lbMap, ubOperands, ubMap, step)));
    }

    public static AffineForOp create(OpBuilder builder, Location location, long lb, long ub, long step) {
        return new AffineForOp(builder.create(build(location, lb, ub, step)));
    }

    public Region getRegion() {
        return op.getRegion(0);
    }

    public Block getBody() {
        return getRegion().front();
    }

    public BlockArgument getInductionVar() {
        return getBody().getArgument(0);
    }

    /**
     * @return A builder inserting before the terminator of the body.
     */
    public OpBuilder getBodyBuilder() {
        return OpBuilder.before(getBody().back());
    }

    public AffineMap getLowerBoundMap() {
        return op.getAttrOfType(LOWER_BOUND_ATTR, AffineMapAttr.class).getValue();
    }

    public AffineMap getUpperBoundMap() {
        return op.getAttrOfType(UPPER_BOUND_ATTR, AffineMapAttr.class).getValue();
    }

    public AffineBound getLowerBound() {
        AffineMap lbMap = getLowerBoundMap();
        return new AffineBound(this, 0, lbMap.getNumInputs(), lbMap);
    }

    public AffineBound getUpperBound() {
        return new AffineBound(this, getLowerBoundMap().getNumInputs(), op.getNumOperands(), getUpperBoundMap());
    }

    public List<Value> getLowerBoundOperands() {
        return op.operandRange(0, getLowerBoundMap().getNumInputs());
    }

    public List<Value> getUpperBoundOperands() {
        return op.operandRange(getLowerBoundMap().getNumInputs(), op.getNumOperands());
    }

    /**
     * Replace the lower bound and its operands.
     *
     * @param lbOperands The new operands.
     * @param map        The new bound, with at least one result.
     */
    public void setLowerBound(List<Value> lbOperands, AffineMap map) {
        checkBound(lbOperands, map);
        List<Value> newOperands = new ArrayList<>(lbOperands);
        newOperands.addAll(getUpperBoundOperands());
        op.setOperands(newOperands);
        op.setAttr(LOWER_BOUND_ATTR, AffineMapAttr.get(map));
    }

    public void setUpperBound(List<Value> ubOperands, AffineMap map) {
        checkBound(ubOperands, map);
        List<Value> newOperands = new ArrayList<>(getLowerBoundOperands());
        newOperands.addAll(ubOperands);
        op.setOperands(newOperands);
        op.setAttr(UPPER_BOUND_ATTR, AffineMapAttr.get(map));
    }

    private static void checkBound(List<Value> operands, AffineMap map) {
        if (operands.size() != map.getNumInputs()) {
            throw new IllegalArgumentException("bound operand count does not match the affine map");
        }
        if (map.getNumResults() < 1) throw new IllegalArgumentException("bound map has no results");
    }

    /**
     * Replace the lower bound map, keeping the operands.
     *
     * @param map The new map, with the same inputs as the old one.
     */
    public void setLowerBoundMap(AffineMap map) {
        AffineMap lbMap = getLowerBoundMap();
        if (lbMap.getNumDims() != map.getNumDims() || lbMap.getNumSymbols() != map.getNumSymbols()) {
            throw new IllegalArgumentException("new lower bound map has different inputs");
        }
        checkBound(getLowerBoundOperands(), map);
        op.setAttr(LOWER_BOUND_ATTR, AffineMapAttr.get(map));
    }

    public void setUpperBoundMap(AffineMap map) {
        AffineMap ubMap = getUpperBoundMap();
        if (ubMap.getNumDims() != map.getNumDims() || ubMap.getNumSymbols() != map.getNumSymbols()) {
            throw new IllegalArgumentException("new upper bound map has different inputs");
        }
        checkBound(getUpperBoundOperands(), map);
        op.setAttr(UPPER_BOUND_ATTR, AffineMapAttr.get(map));
    }

    public boolean hasConstantLowerBound() {
        return getLowerBoundMap().isSingleConstant();
    }

    public boolean hasConstantUpperBound() {
        return getUpperBoundMap().isSingleConstant();
    }

    public boolean hasConstantBounds() {
        return hasConstantLowerBound() && hasConstantUpperBound();
    }

    public long getConstantLowerBound() {
        return getLowerBoundMap().getSingleConstantResult();
    }

    public long getConstantUpperBound() {
        return getUpperBoundMap().getSingleConstantResult();
    }

    public void setConstantLowerBound(long value) {
        setLowerBound(List.of(), AffineMap.constantMap(value));
    }

    public void setConstantUpperBound(long value) {
        setUpperBound(List.of(), AffineMap.constantMap(value));
    }

    public long getStep() {
        return op.getAttrOfType(STEP_ATTR, IntegerAttr.class).getValue();
    }

    public void setStep(long step) {
        if (step <= 0) throw new IllegalArgumentException("step has to be a positive integer constant");
        op.setAttr(STEP_ATTR, IntegerAttr.index(step));
    }

    /**
     * @return Whether the lower and upper bounds are applied to the same operands, in the same way.
     */
    public boolean matchingBoundOperandList() {
        AffineMap lbMap = getLowerBoundMap();
        AffineMap ubMap = getUpperBoundMap();
        if (lbMap.getNumDims() != ubMap.getNumDims() || lbMap.getNumSymbols() != ubMap.getNumSymbols()) {
            return false;
        }
        int numOperands = lbMap.getNumInputs();
        for (int i = 0; i < numOperands; i++) {
            if (op.getOperand(i) != op.getOperand(numOperands + i)) return false;
        }
        return true;
    }

    public static boolean isForInductionVar(Value value) {
        return getForInductionVarOwner(value) != null;
    }

    /**
     * @param value A value.
     * @return The loop the value is the induction variable of, or null if it is not one.
     */
    public static @Nullable AffineForOp getForInductionVarOwner(Value value) {
        if (!(value instanceof BlockArgument)) return null;
        Region region = ((BlockArgument) value).getOwner().getParent();
        return region == null ? null : dynCast(region.getParentOp());
    }

    public static List<Value> extractForInductionVars(List<AffineForOp> forOps) {
        List<Value> ivs = new ArrayList<>(forOps.size());
        for (AffineForOp forOp : forOps) {
            ivs.add(forOp.getInductionVar());
        }
        return ivs;
    }

    static VerificationResult checkHasAffineTerminator(Operation op, Block block) {
        if (block.isEmpty() || block.back().getKey() == AffineOps.TERMINATOR) return VerificationResult.success();
        return op.emitOpError("expects regions to end with '" + AffineOps.TERMINATOR.getName() + "'");
    }

    private static boolean hasBoundAttrs(Operation op) {
        return op.getAttrOfType(LOWER_BOUND_ATTR, AffineMapAttr.class) != null
                && op.getAttrOfType(UPPER_BOUND_ATTR, AffineMapAttr.class) != null
                && op.getAttrOfType(STEP_ATTR, IntegerAttr.class) != null;
    }

    static VerificationResult verifyOp(Operation op) {
        if (op.getNumRegions() != 1 || !op.getRegion(0).hasOneBlock()) {
            return op.emitOpError("expected body region to have a single block");
        }
        Block body = op.getRegion(0).front();
        if (body.getNumArguments() != 1 || !body.getArgument(0).getType().isIndex()) {
            return op.emitOpError("expected body to have a single index argument for the induction variable");
        }
        VerificationResult result = checkHasAffineTerminator(op, body);
        if (result.isFailure()) return result;
        if (!hasBoundAttrs(op)) {
            return op.emitOpError("requires attributes '" + LOWER_BOUND_ATTR + "', '" + UPPER_BOUND_ATTR
                    + "' and '" + STEP_ATTR + "'");
        }
        AffineForOp forOp = new AffineForOp(op);
        AffineMap lbMap = forOp.getLowerBoundMap();
        AffineMap ubMap = forOp.getUpperBoundMap();
        if (op.getNumOperands() != lbMap.getNumInputs() + ubMap.getNumInputs()) {
            return op.emitOpError("operand count must match with affine map dimension and symbol count");
        }
        result = AffineValidity.verifyDimAndSymbolIdentifiers(op, forOp.getLowerBoundOperands(), lbMap.getNumDims());
        if (result.isFailure()) return result;
        result = AffineValidity.verifyDimAndSymbolIdentifiers(op, forOp.getUpperBoundOperands(), ubMap.getNumDims());
        if (result.isFailure()) return result;
        if (forOp.getStep() <= 0) {
            return op.emitOpError("expected step to be representable as a positive signed integer");
        }
        return VerificationResult.success();
    }

    static void printOp(Operation op, AsmPrinter p) {
        if (op.getNumRegions() != 1 || !op.getRegion(0).hasOneBlock()
                || op.getRegion(0).front().getNumArguments() != 1
                || !hasBoundAttrs(op)) {
            p.printGenericOp(op);
            return;
        }
        AffineForOp forOp = new AffineForOp(op);
        if (op.getNumOperands() != forOp.getLowerBoundMap().getNumInputs() + forOp.getUpperBoundMap().getNumInputs()
                || forOp.getLowerBoundMap().getNumResults() == 0
                || forOp.getUpperBoundMap().getNumResults() == 0
                || forOp.getStep() <= 0) {
            p.printGenericOp(op);
            return;
        }
        p.print("affine.for ");
        p.printOperand(forOp.getInductionVar());
        p.print(" = ");
        printBound(p, forOp.getLowerBound(), "max");
        p.print(" to ");
        printBound(p, forOp.getUpperBound(), "min");
        if (forOp.getStep() != 1) p.print(" step ").print(forOp.getStep());
        p.print(" ");
        p.printRegion(forOp.getRegion(), false, false);
        p.printOptionalAttrDict(op.getAttrs(), LOWER_BOUND_ATTR, UPPER_BOUND_ATTR, STEP_ATTR);
    }

    private static void printBound(AsmPrinter p, AffineBound bound, String prefix) {
        AffineMap map = bound.getMap();
        if (map.getNumResults() == 1) {
            AffineExpr expr = map.getResult(0);
            if (map.getNumInputs() == 0 && expr instanceof AffineConstantExpr) {
                p.print(((AffineConstantExpr) expr).getValue());
                return;
            }
            if (map.getNumDims() == 0 && map.getNumSymbols() == 1 && expr instanceof AffineSymbolExpr) {
                p.printOperand(bound.getOperand(0));
                return;
            }
        } else {
            p.print(prefix).print(" ");
        }
        p.printAttribute(AffineMapAttr.get(map));
        p.printDimAndSymbolList(bound.getOperands(), map.getNumDims());
    }

    private static void parseBound(OpAsmParser parser, OperationState state, boolean isLower) throws ParseException {
        String attrName = isLower ? LOWER_BOUND_ATTR : UPPER_BOUND_ATTR;
        boolean hasMinMax = parser.parseOptionalKeyword(isLower ? "max" : "min");

        OpAsmParser.UnresolvedOperand symbol = parser.parseOptionalOperand();
        if (symbol != null) {
            state.addOperand(parser.resolveOperand(symbol, IndexType.get()));
            state.addAttribute(attrName, AffineMapAttr.get(AffineMap.symbolIdentityMap()));
            return;
        }

        Long constant = parser.parseOptionalInteger();
        if (constant != null) {
            state.addAttribute(attrName, AffineMapAttr.get(AffineMap.constantMap(constant)));
            return;
        }

        Location attrLoc = parser.getCurrentLocation();
        Attribute attr = parser.parseAttribute();
        if (!(attr instanceof AffineMapAttr)) {
            throw new ParseException(attrLoc, "expected valid affine map representation for loop bounds");
        }
        AffineMap map = ((AffineMapAttr) attr).getValue();
        List<OpAsmParser.UnresolvedOperand> operands = new ArrayList<>();
        int numDims = parser.parseDimAndSymbolList(operands);
        if (map.getNumDims() != numDims) {
            throw new ParseException(attrLoc, "dim operand count and affine map dim count must match");
        }
        if (map.getNumInputs() != operands.size()) {
            throw new ParseException(attrLoc, "symbol operand count and affine map symbol count must match");
        }
        if (map.getNumResults() > 1 && !hasMinMax) {
            throw new ParseException(attrLoc, isLower
                    ? "lower loop bound affine map with multiple results requires 'max' prefix"
                    : "upper loop bound affine map with multiple results requires 'min' prefix");
        }
        state.addOperands(parser.resolveOperands(operands, IndexType.get()));
        state.addAttribute(attrName, attr);
    }

    static void parseOp(OpAsmParser parser, OperationState state) throws ParseException {
        OpAsmParser.UnresolvedOperand iv = parser.parseOperand();
        parser.parsePunct("=");
        parseBound(parser, state, true);
        parser.parseKeyword("to");
        parseBound(parser, state, false);
        long step = 1;
        if (parser.parseOptionalKeyword("step")) {
            Location stepLoc = parser.getCurrentLocation();
            step = parser.parseInteger();
            if (step <= 0) {
                throw new ParseException(stepLoc, "expected step to be representable as a positive signed integer");
            }
        }
        state.addAttribute(STEP_ATTR, IntegerAttr.index(step));
        Region body = state.addRegion();
        List<Type> ivType = List.of(IndexType.get());
        parser.parseRegion(body, List.of(iv), ivType);
        body.ensureTerminator(AffineOps.TERMINATOR, state.getLocation());
        parser.parseOptionalAttrDict(state);
    }
}
