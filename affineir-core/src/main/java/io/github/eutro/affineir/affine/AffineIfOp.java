package io.github.eutro.affineir.affine;

import io.github.eutro.affineir.affine.expr.IntegerSet;
import io.github.eutro.affineir.asm.AsmPrinter;
import io.github.eutro.affineir.asm.OpAsmParser;
import io.github.eutro.affineir.asm.ParseException;
import io.github.eutro.affineir.attrs.Attribute;
import io.github.eutro.affineir.attrs.IntegerSetAttr;
import io.github.eutro.affineir.ir.Block;
import io.github.eutro.affineir.ir.Location;
import io.github.eutro.affineir.ir.OpBuilder;
import io.github.eutro.affineir.ir.Operation;
import io.github.eutro.affineir.ir.OperationState;
import io.github.eutro.affineir.ir.Region;
import io.github.eutro.affineir.ir.Value;
import io.github.eutro.affineir.ir.VerificationResult;
import io.github.eutro.affineir.ops.OpView;
import io.github.eutro.affineir.types.IndexType;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs its then region if the operands are in the integer set, and its else region otherwise.
 * <pre>{@code
 * affine.if affine_set<(d0)[s0] : (d0 - s0 >= 0)> (%i)[%n] {
 *   ...
 * } else {
 *   ...
 * }
 * }</pre>
 * Both regions always exist; the else region may be empty.
 */
public final class AffineIfOp extends OpView {
    public static final String CONDITION_ATTR = "condition";

    private AffineIfOp(Operation op) {
        super(op);
    }

    public static AffineIfOp cast(Operation op) {
        return new AffineIfOp(checkKind(op, AffineOps.IF));
    }

    public static @Nullable AffineIfOp dynCast(@Nullable Operation op) {
        return op != null && op.getKey() == AffineOps.IF ? new AffineIfOp(op) : null;
    }

    /**
     * Gather the parts of a conditional, with an empty then block and, if requested, an empty else block.
     *
     * @param location   The location.
     * @param condition  The set the operands are tested against.
     * @param operands   The operands, dimensions first.
     * @param withElse   Whether to create a block in the else region.
     * @return The state.
     */
    public static OperationState build(Location location, IntegerSet condition, List<Value> operands,
                                       boolean withElse) {
        if (condition.getNumInputs() != operands.size()) {
            throw new IllegalArgumentException("operand count does not match the integer set");
        }
        OperationState state = new OperationState(location, AffineOps.IF)
                .addAttribute(CONDITION_ATTR, IntegerSetAttr.get(condition))
                .addOperands(operands);
        Region thenRegion = state.addRegion();
        thenRegion.addBlock();
        thenRegion.ensureTerminator(AffineOps.TERMINATOR, location);
        Region elseRegion = state.addRegion();
        if (withElse) {
            elseRegion.addBlock();
            elseRegion.ensureTerminator(AffineOps.TERMINATOR, location);
        }
        return state;
    }

    public static AffineIfOp create(OpBuilder builder, Location location, IntegerSet condition,
                                    List<Value> operands, boolean withElse) {
        return new AffineIfOp(builder.create(build(location, condition, operands, withElse)));
    }

    public IntegerSet getIntegerSet() {
        return op.getAttrOfType(CONDITION_ATTR, IntegerSetAttr.class).getValue();
    }

    public void setIntegerSet(IntegerSet set) {
        op.setAttr(CONDITION_ATTR, IntegerSetAttr.get(set));
    }

    /**
     * Replace the condition and its operands together.
     *
     * @param set      The new set.
     * @param operands The new operands.
     */
    public void setConditional(IntegerSet set, List<Value> operands) {
        if (set.getNumInputs() != operands.size()) {
            throw new IllegalArgumentException("operand count does not match the integer set");
        }
        op.setOperands(new ArrayList<>(operands));
        setIntegerSet(set);
    }

    public List<Value> getConditionOperands() {
        return op.getOperands();
    }

    public Region getThenRegion() {
        return op.getRegion(0);
    }

    public Region getElseRegion() {
        return op.getRegion(1);
    }

    public boolean hasElse() {
        return !getElseRegion().isEmpty();
    }

    public Block getThenBlock() {
        return getThenRegion().front();
    }

    public @Nullable Block getElseBlock() {
        return hasElse() ? getElseRegion().front() : null;
    }

    public OpBuilder getThenBodyBuilder() {
        return OpBuilder.before(getThenBlock().back());
    }

    /**
     * @return A builder inserting before the terminator of the else block.
     * @throws IllegalStateException If there is no else block.
     */
    public OpBuilder getElseBodyBuilder() {
        Block elseBlock = getElseBlock();
        if (elseBlock == null) throw new IllegalStateException("affine.if has no else block");
        return OpBuilder.before(elseBlock.back());
    }

    static VerificationResult verifyOp(Operation op) {
        IntegerSetAttr conditionAttr = op.getAttrOfType(CONDITION_ATTR, IntegerSetAttr.class);
        if (conditionAttr == null) {
            return op.emitOpError("requires an integer set attribute named '" + CONDITION_ATTR + "'");
        }
        IntegerSet condition = conditionAttr.getValue();
        if (op.getNumOperands() != condition.getNumInputs()) {
            return op.emitOpError("operand count and condition integer set dimension and symbol count must match");
        }
        VerificationResult result = AffineValidity.verifyDimAndSymbolIdentifiers(op, op.getOperands(),
                condition.getNumDims());
        if (result.isFailure()) return result;

        for (Region region : op.getRegions()) {
            if (region.isEmpty()) continue;
            if (!region.hasOneBlock()) {
                return op.emitOpError("expects only one block per 'then' or 'else' regions");
            }
            result = AffineForOp.checkHasAffineTerminator(op, region.front());
            if (result.isFailure()) return result;
            if (region.front().getNumArguments() != 0) {
                return op.emitOpError("requires that child entry blocks have no arguments");
            }
        }
        return VerificationResult.success();
    }

    static void printOp(Operation op, AsmPrinter p) {
        IntegerSetAttr conditionAttr = op.getAttrOfType(CONDITION_ATTR, IntegerSetAttr.class);
        if (conditionAttr == null
                || op.getNumRegions() != 2
                || conditionAttr.getValue().getNumInputs() != op.getNumOperands()
                || op.getRegion(0).isEmpty()) {
            p.printGenericOp(op);
            return;
        }
        for (Region region : op.getRegions()) {
            for (Block block : region.getBlocks()) {
                if (block.getNumArguments() != 0) {
                    p.printGenericOp(op);
                    return;
                }
            }
        }
        p.print("affine.if ").printAttribute(conditionAttr);
        p.print(" ");
        p.printDimAndSymbolList(op.getOperands(), conditionAttr.getValue().getNumDims());
        p.print(" ");
        p.printRegion(op.getRegion(0), false, false);
        Region elseRegion = op.getRegion(1);
        if (!elseRegion.isEmpty()) {
            p.print(" else ");
            p.printRegion(elseRegion, false, false);
        }
        p.printOptionalAttrDict(op.getAttrs(), CONDITION_ATTR);
    }

    static void parseOp(OpAsmParser parser, OperationState state) throws ParseException {
        Location setLoc = parser.getCurrentLocation();
        Attribute attr = parser.parseAttribute();
        if (!(attr instanceof IntegerSetAttr)) throw new ParseException(setLoc, "expected integer set");
        IntegerSet set = ((IntegerSetAttr) attr).getValue();
        List<OpAsmParser.UnresolvedOperand> operands = new ArrayList<>();
        int numDims = parser.parseDimAndSymbolList(operands);
        if (set.getNumDims() != numDims) {
            throw new ParseException(setLoc, "dim operand count and integer set dim count must match");
        }
        if (set.getNumInputs() != operands.size()) {
            throw new ParseException(setLoc, "symbol operand count and integer set symbol count must match");
        }
        state.addAttribute(CONDITION_ATTR, attr);
        state.addOperands(parser.resolveOperands(operands, IndexType.get()));

        Region thenRegion = state.addRegion();
        Region elseRegion = state.addRegion();
        parser.parseRegion(thenRegion, List.of(), List.of());
        thenRegion.ensureTerminator(AffineOps.TERMINATOR, state.getLocation());
        if (parser.parseOptionalKeyword("else")) {
            parser.parseRegion(elseRegion, List.of(), List.of());
            elseRegion.ensureTerminator(AffineOps.TERMINATOR, state.getLocation());
        }
        parser.parseOptionalAttrDict(state);
    }
}
