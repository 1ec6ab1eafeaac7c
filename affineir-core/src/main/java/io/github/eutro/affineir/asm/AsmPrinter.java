package io.github.eutro.affineir.asm;

import io.github.eutro.affineir.affine.expr.AffineMap;
import io.github.eutro.affineir.attrs.Attribute;
import io.github.eutro.affineir.attrs.NamedAttribute;
import io.github.eutro.affineir.attrs.StringAttr;
import io.github.eutro.affineir.attrs.UnitAttr;
import io.github.eutro.affineir.ext.CommonExts;
import io.github.eutro.affineir.ir.Block;
import io.github.eutro.affineir.ir.BlockArgument;
import io.github.eutro.affineir.ir.Operation;
import io.github.eutro.affineir.ir.Region;
import io.github.eutro.affineir.ir.Value;
import io.github.eutro.affineir.ops.OpKey;
import io.github.eutro.affineir.ops.OpPrinter;
import io.github.eutro.affineir.types.FunctionType;
import io.github.eutro.affineir.types.Type;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Writes operations as text that {@link AsmParser} reads back.
 * <p>
 * Operations with a {@link CommonExts#PRINTER custom printer} are printed in their custom form,
 * unless the generic form is requested; all others are printed generically:
 * <pre>{@code
 * %0, %1 = "dialect.op"(%a, %b)[^bb1(%c : index)] ({ ... }) {attr = 1 : index} : (index, index) -> (f32, f32)
 * }</pre>
 * Results and block arguments are numbered {@code %0, %1, ...} in the order they are printed;
 * entry arguments of functions are named {@code %arg0, %arg1, ...}, and blocks {@code ^bb0, ^bb1, ...}
 * within each region.
 */
public final class AsmPrinter {
    private static final int INDENT = 2;

    private final StringBuilder out;
    private final boolean generic;
    private final Map<Value, String> valueNames = new HashMap<>();
    private final Map<Block, String> blockNames = new HashMap<>();
    private int nextValueId = 0;
    private int indent = 0;

    public AsmPrinter(StringBuilder out, boolean printGenericOpForm) {
        this.out = out;
        this.generic = printGenericOpForm;
    }

    public static String printToString(Operation op) {
        return printToString(op, false);
    }

    public static String printToString(Operation op, boolean printGenericOpForm) {
        StringBuilder sb = new StringBuilder();
        new AsmPrinter(sb, printGenericOpForm).printTopLevel(op);
        return sb.toString();
    }

    /**
     * Name every value and block in an operation, then print it.
     *
     * @param op The operation.
     */
    public void printTopLevel(Operation op) {
        numberValues(op);
        printOperation(op);
    }

    private void numberValues(Operation op) {
        for (Value result : op.getResults()) {
            valueNames.putIfAbsent(result, "%" + nextValueId++);
        }
        boolean namedArgs = op.hasTrait(CommonExts.AFFINE_SCOPE);
        for (Region region : op.getRegions()) {
            int nextBlockId = 0;
            for (Block block : region.getBlocks()) {
                blockNames.put(block, "^bb" + nextBlockId++);
                int argId = 0;
                for (BlockArgument arg : block.getArguments()) {
                    valueNames.put(arg, namedArgs && block.isEntryBlock() ? "%arg" + argId++ : "%" + nextValueId++);
                }
                for (Operation nested : block.getOperations()) {
                    numberValues(nested);
                }
            }
        }
    }

    public void printOperation(Operation op) {
        if (op.getNumResults() != 0) {
            printOperands(op.getResults());
            out.append(" = ");
        }
        OpPrinter printer = generic ? null : op.getNullable(CommonExts.PRINTER);
        if (printer != null) {
            printer.print(op, this);
        } else {
            printGenericOp(op);
        }
    }

    /**
     * Print an operation in the generic form, from its name on.
     *
     * @param op The operation.
     */
    public void printGenericOp(Operation op) {
        out.append(StringAttr.quote(op.getName())).append('(');
        printOperands(op.getNonSuccessorOperands());
        out.append(')');
        if (op.getNumSuccessors() != 0) {
            out.append('[');
            for (int i = 0; i < op.getNumSuccessors(); i++) {
                if (i != 0) out.append(", ");
                printSuccessorAndUseList(op, i);
            }
            out.append(']');
        }
        if (op.getNumRegions() != 0) {
            out.append(" (");
            for (int i = 0; i < op.getNumRegions(); i++) {
                if (i != 0) out.append(", ");
                printRegion(op.getRegion(i), true, true);
            }
            out.append(')');
        }
        printOptionalAttrDict(op.getAttrs());
        List<Type> operandTypes = op.getNonSuccessorOperands().stream()
                .map(Value::getType)
                .collect(Collectors.toList());
        out.append(" : ").append(FunctionType.get(operandTypes, op.getResultTypes()));
    }

    public AsmPrinter print(Object text) {
        out.append(text);
        return this;
    }

    public void printKeyword(String keyword) {
        out.append(keyword);
    }

    public String getValueName(Value value) {
        return valueNames.computeIfAbsent(value, v -> "%" + nextValueId++);
    }

    public void printOperand(Value value) {
        out.append(getValueName(value));
    }

    public void printOperands(Collection<? extends Value> values) {
        boolean first = true;
        for (Value value : values) {
            if (!first) out.append(", ");
            first = false;
            printOperand(value);
        }
    }

    public void printType(Type type) {
        out.append(type);
    }

    public void printTypes(Collection<? extends Type> types) {
        out.append(types.stream().map(Type::toString).collect(Collectors.joining(", ")));
    }

    public void printAttribute(Attribute attribute) {
        out.append(attribute);
    }

    /**
     * Print an attribute dictionary preceded by a space, if any attribute is not elided.
     *
     * @param attrs  The attributes.
     * @param elided The names of attributes that the custom form already shows.
     */
    public void printOptionalAttrDict(List<NamedAttribute> attrs, String... elided) {
        Set<String> elidedSet = Set.of(elided);
        List<NamedAttribute> shown = new ArrayList<>();
        for (NamedAttribute attr : attrs) {
            if (!elidedSet.contains(attr.getName())) shown.add(attr);
        }
        if (shown.isEmpty()) return;
        out.append(" {");
        for (int i = 0; i < shown.size(); i++) {
            if (i != 0) out.append(", ");
            NamedAttribute attr = shown.get(i);
            out.append(formatAttrName(attr.getName()));
            if (!(attr.getValue() instanceof UnitAttr)) {
                out.append(" = ").append(attr.getValue());
            }
        }
        out.append('}');
    }

    private static String formatAttrName(String name) {
        if (!name.isEmpty() && (Character.isLetter(name.charAt(0)) || name.charAt(0) == '_')
                && name.chars().allMatch(c -> Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '.')) {
            return name;
        }
        return StringAttr.quote(name);
    }

    /**
     * Print the operands of a map application as {@code (%d0, %d1)[%s0]}, leaving out empty symbol brackets.
     *
     * @param operands The operands.
     * @param numDims  How many of the operands are dimensions.
     */
    public void printDimAndSymbolList(List<Value> operands, int numDims) {
        out.append('(');
        printOperands(operands.subList(0, numDims));
        out.append(')');
        if (operands.size() > numDims) {
            out.append('[');
            printOperands(operands.subList(numDims, operands.size()));
            out.append(']');
        }
    }

    /**
     * Format a map with its operands substituted in, as in {@code %i + 1, symbol(%n)},
     * if reading it back gives the same map and operands.
     *
     * @param map      The map.
     * @param operands The dimension operands, then the symbol operands.
     * @return The text, without brackets, or null if it would not read back exactly.
     */
    public @Nullable String formatAffineMapOfSSAIds(AffineMap map, List<Value> operands) {
        if (map.getNumInputs() != operands.size()) return null;
        List<Value> dims = operands.subList(0, map.getNumDims());
        if (dims.stream().distinct().count() != dims.size()) return null;
        List<Value> syms = operands.subList(map.getNumDims(), operands.size());
        if (syms.stream().distinct().count() != syms.size()) return null;

        boolean[] ok = {true};
        int[] nextDim = {0};
        int[] nextSym = {0};
        boolean[] dimSeen = new boolean[map.getNumDims()];
        boolean[] symSeen = new boolean[map.getNumSymbols()];
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < map.getNumResults(); i++) {
            if (i != 0) sb.append(", ");
            sb.append(map.getResult(i).toString(pos -> {
                if (!dimSeen[pos]) {
                    dimSeen[pos] = true;
                    if (pos != nextDim[0]++) ok[0] = false;
                }
                return getValueName(dims.get(pos));
            }, pos -> {
                if (!symSeen[pos]) {
                    symSeen[pos] = true;
                    if (pos != nextSym[0]++) ok[0] = false;
                }
                return "symbol(" + getValueName(syms.get(pos)) + ")";
            }));
        }
        if (nextDim[0] != dims.size() || nextSym[0] != syms.size()) return null;
        return ok[0] ? sb.toString() : null;
    }

    /**
     * Print a successor and the operands passed to it, as in {@code ^bb1(%0 : index)}.
     *
     * @param op    The operation.
     * @param index The successor index.
     */
    public void printSuccessorAndUseList(Operation op, int index) {
        out.append(getBlockName(op.getSuccessor(index)));
        List<Value> operands = op.getSuccessorOperands(index);
        if (!operands.isEmpty()) {
            out.append('(');
            printOperands(operands);
            out.append(" : ");
            printTypes(operands.stream().map(Value::getType).collect(Collectors.toList()));
            out.append(')');
        }
    }

    private String getBlockName(Block block) {
        return blockNames.computeIfAbsent(block, b -> "^bb" + blockNames.size());
    }

    /**
     * Print a region in braces, one operation per line.
     *
     * @param region                The region.
     * @param printEntryBlockArgs   Whether to label the entry block with its arguments,
     *                              false if the custom form shows them elsewhere.
     * @param printBlockTerminators Whether to show the terminators the parent operation would create implicitly.
     */
    public void printRegion(Region region, boolean printEntryBlockArgs, boolean printBlockTerminators) {
        out.append("{\n");
        indent += INDENT;
        OpKey implicitTerminator = region.getParentOp() == null
                ? null
                : region.getParentOp().getNullable(CommonExts.IMPLICIT_TERMINATOR);
        List<Block> blocks = region.getBlocks();
        for (int b = 0; b < blocks.size(); b++) {
            Block block = blocks.get(b);
            boolean omitLabel = b == 0 && (!printEntryBlockArgs || block.getNumArguments() == 0);
            if (!omitLabel) printBlockLabel(block);
            List<Operation> ops = block.getOperations();
            for (int i = 0; i < ops.size(); i++) {
                Operation op = ops.get(i);
                if (!printBlockTerminators && !generic && i == ops.size() - 1
                        && isElidable(op, implicitTerminator)) {
                    continue;
                }
                indent();
                printOperation(op);
                out.append('\n');
            }
        }
        indent -= INDENT;
        indent();
        out.append('}');
    }

    private static boolean isElidable(Operation op, @Nullable OpKey implicitTerminator) {
        return op.getKey() == implicitTerminator
                && op.getNumOperands() == 0
                && op.getNumResults() == 0
                && op.getAttrs().isEmpty();
    }

    private void printBlockLabel(Block block) {
        indent -= INDENT;
        indent();
        indent += INDENT;
        out.append(getBlockName(block));
        if (block.getNumArguments() != 0) {
            out.append('(');
            List<BlockArgument> args = block.getArguments();
            for (int i = 0; i < args.size(); i++) {
                if (i != 0) out.append(", ");
                printOperand(args.get(i));
                out.append(": ").append(args.get(i).getType());
            }
            out.append(')');
        }
        out.append(":\n");
    }

    private void indent() {
        char[] spaces = new char[indent];
        Arrays.fill(spaces, ' ');
        out.append(spaces);
    }
}
