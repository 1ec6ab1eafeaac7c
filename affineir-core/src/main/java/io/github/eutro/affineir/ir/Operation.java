package io.github.eutro.affineir.ir;

import io.github.eutro.affineir.asm.AsmPrinter;
import io.github.eutro.affineir.attrs.Attribute;
import io.github.eutro.affineir.attrs.NamedAttribute;
import io.github.eutro.affineir.ext.CommonExts;
import io.github.eutro.affineir.ext.DelegatingExtHolder;
import io.github.eutro.affineir.ext.Ext;
import io.github.eutro.affineir.ext.ExtContainer;
import io.github.eutro.affineir.ops.FoldResult;
import io.github.eutro.affineir.ops.OpFolder;
import io.github.eutro.affineir.ops.OpKey;
import io.github.eutro.affineir.types.Type;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.UnmodifiableView;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * A node of the IR graph.
 * <p>
 * An operation has a {@link OpKey kind}, operands, results, attributes, regions and successors.
 * Successor operands are stored after the other operands, each successor owning a contiguous range.
 * <p>
 * Behaviour that depends on the kind, such as verification and folding, is looked up as an
 * {@link io.github.eutro.affineir.ext.Ext ext} on the operation, which falls back to its {@link OpKey}.
 */
public final class Operation extends DelegatingExtHolder {
    /**
     * Set the {@code AFFINEIR_TRACK_OP_CREATIONS} environment variable to record
     * where every operation was created, for debugging.
     */
    public static final boolean TRACK_OP_CREATIONS = System.getenv("AFFINEIR_TRACK_OP_CREATIONS") != null;

    private final @Nullable Throwable created = TRACK_OP_CREATIONS ? new Throwable("operation created") : null;

    private final OpKey key;
    private Location location;
    private OpOperand[] operands;
    private final OpResult[] results;
    private final BlockOperand[] successors;
    private final int[] successorOperandCounts;
    private final Region[] regions;
    private List<NamedAttribute> attributes;

    @Nullable Block block;
    int orderIndex = -1;

    private Operation(Location location, OpKey key, List<Type> resultTypes, List<NamedAttribute> attributes,
                      int numSuccessors, int numRegions) {
        this.location = location;
        this.key = key;
        this.attributes = List.copyOf(attributes);
        results = new OpResult[resultTypes.size()];
        for (int i = 0; i < results.length; i++) {
            results[i] = new OpResult(this, i, resultTypes.get(i));
        }
        successors = new BlockOperand[numSuccessors];
        successorOperandCounts = new int[numSuccessors];
        regions = new Region[numRegions];
        for (int i = 0; i < numRegions; i++) {
            regions[i] = new Region(this);
        }
    }

    /**
     * Create a new operation, not attached to any block.
     *
     * @param location          The location.
     * @param key               The operation kind.
     * @param operands          The operands, excluding successor operands.
     * @param resultTypes       The type of each result.
     * @param attributes        The attributes.
     * @param successors        The successor blocks.
     * @param successorOperands The operands passed to each successor.
     * @param numRegions        The number of (empty) regions.
     * @return The operation.
     */
    public static Operation create(Location location, OpKey key, List<Value> operands, List<Type> resultTypes,
                                   List<NamedAttribute> attributes, List<Block> successors,
                                   List<? extends List<Value>> successorOperands, int numRegions) {
        if (successors.size() != successorOperands.size()) {
            throw new IllegalArgumentException("expected one operand list per successor");
        }
        Operation op = new Operation(location, key, resultTypes, attributes, successors.size(), numRegions);
        int total = operands.size();
        for (List<Value> succOperands : successorOperands) {
            total += succOperands.size();
        }
        op.operands = new OpOperand[total];
        int i = 0;
        for (Value operand : operands) {
            op.operands[i] = new OpOperand(op, operand, i);
            i++;
        }
        for (int s = 0; s < successors.size(); s++) {
            op.successors[s] = new BlockOperand(op, successors.get(s), s);
            List<Value> succOperands = successorOperands.get(s);
            op.successorOperandCounts[s] = succOperands.size();
            for (Value operand : succOperands) {
                op.operands[i] = new OpOperand(op, operand, i);
                i++;
            }
        }
        assert i == total;
        return op;
    }

    public static Operation create(Location location, OpKey key, List<Value> operands, List<Type> resultTypes,
                                   List<NamedAttribute> attributes, int numRegions) {
        return create(location, key, operands, resultTypes, attributes, List.of(), List.of(), numRegions);
    }

    /**
     * Create an operation from a state, moving the bodies of the state's regions into it.
     *
     * @param state The state.
     * @return The operation.
     */
    public static Operation create(OperationState state) {
        Operation op = create(state.getLocation(), state.getKey(), state.getOperands(), state.getTypes(),
                state.getAttributes(), state.getSuccessors(), state.getSuccessorOperands(),
                state.getRegions().size());
        for (int i = 0; i < op.regions.length; i++) {
            op.regions[i].takeBody(state.getRegions().get(i));
        }
        return op;
    }

    @Override
    protected ExtContainer getDelegate() {
        return key;
    }

    public OpKey getKey() {
        return key;
    }

    public String getName() {
        return key.getName();
    }

    public String getDialectNamespace() {
        return key.getDialectNamespace();
    }

    public boolean hasTrait(Ext<Boolean> trait) {
        return hasFlag(trait);
    }

    public boolean isKnownTerminator() {
        return hasTrait(CommonExts.IS_TERMINATOR);
    }

    public boolean isKnownNonTerminator() {
        return key.isRegistered() && !isKnownTerminator();
    }

    public Location getLoc() {
        return location;
    }

    public void setLoc(Location location) {
        this.location = location;
    }

    /**
     * @return Where this operation was created, if {@link #TRACK_OP_CREATIONS} is set.
     */
    public @Nullable Throwable getCreationTrace() {
        return created;
    }

    // structure

    public @Nullable Block getBlock() {
        return block;
    }

    public @Nullable Region getContainingRegion() {
        return block == null ? null : block.getParent();
    }

    public @Nullable Operation getParentOp() {
        return block == null ? null : block.getParentOp();
    }

    /**
     * Whether this operation is {@code other} or contains it, at any depth.
     *
     * @param other The other operation.
     * @return Whether it is.
     */
    public boolean isAncestor(@Nullable Operation other) {
        while (other != null) {
            if (other == this) return true;
            other = other.getParentOp();
        }
        return false;
    }

    public boolean isProperAncestor(Operation other) {
        return other != this && isAncestor(other);
    }

    /**
     * Whether this operation comes before {@code other} in their common block.
     *
     * @param other The other operation, which must be in the same block.
     * @return Whether this comes first.
     */
    public boolean isBeforeInBlock(Operation other) {
        if (block == null || other.block != block) {
            throw new IllegalArgumentException("operations are not in the same block");
        }
        if (!block.isOpOrderValid()) block.recomputeOpOrder();
        return orderIndex < other.orderIndex;
    }

    /**
     * Detach this operation from its block, without destroying it.
     */
    public void remove() {
        if (block != null) block.getOperations().remove(this);
    }

    public void moveBefore(Operation other) {
        Block dest = other.block;
        if (dest == null) throw new IllegalArgumentException("operation to move before is not in a block");
        if (other == this) return;
        remove();
        dest.getOperations().add(dest.getOperations().indexOf(other), this);
    }

    public void moveAfter(Operation other) {
        Block dest = other.block;
        if (dest == null) throw new IllegalArgumentException("operation to move after is not in a block");
        if (other == this) return;
        remove();
        dest.getOperations().add(dest.getOperations().indexOf(other) + 1, this);
    }

    public void moveBefore(Block dest, int index) {
        remove();
        dest.getOperations().add(index, this);
    }

    /**
     * Detach this operation from its block and destroy it.
     * <p>
     * None of its results may be used anywhere.
     */
    public void erase() {
        remove();
        destroy();
    }

    /**
     * Destroy this detached operation: sever every reference made from it or from operations nested in it.
     * <p>
     * References are severed for the whole subtree first, since nested operations may use each other's results.
     */
    public void destroy() {
        assert block == null : "destroying an operation that is still in a block";
        for (OpResult result : results) {
            assert result.useEmpty() : "destroying '" + getName() + "' whose result is still used";
        }
        dropAllReferences();
        for (Region region : regions) {
            region.getBlocks().clear();
        }
    }

    /**
     * Sever every operand and successor reference of this operation and of all operations nested in it.
     */
    public void dropAllReferences() {
        for (OpOperand operand : operands) {
            operand.drop();
        }
        for (Region region : regions) {
            region.dropAllReferences();
        }
        for (BlockOperand successor : successors) {
            successor.drop();
        }
    }

    /**
     * Clear every use of a value defined by this operation or inside its regions.
     */
    public void dropAllDefinedValueUses() {
        for (OpResult result : results) {
            result.dropAllUses();
        }
        for (Region region : regions) {
            for (Block block : region.getBlocks()) {
                block.dropAllDefinedValueUses();
            }
        }
    }

    /**
     * Walk this operation and everything nested in it, nested operations first.
     *
     * @param visitor The visitor, which may erase the operation it is given.
     */
    public void walk(Consumer<Operation> visitor) {
        for (Region region : regions) {
            region.walk(visitor);
        }
        visitor.accept(this);
    }

    // operands

    public int getNumOperands() {
        return operands.length;
    }

    public Value getOperand(int index) {
        return operands[index].get();
    }

    public void setOperand(int index, Value value) {
        operands[index].set(value);
    }

    public OpOperand getOpOperand(int index) {
        return operands[index];
    }

    @UnmodifiableView
    public List<OpOperand> getOpOperands() {
        return Collections.unmodifiableList(Arrays.asList(operands));
    }

    @UnmodifiableView
    public List<Value> getOperands() {
        return operandRange(0, operands.length);
    }

    /**
     * A live view of some of the operands.
     *
     * @param start The first operand.
     * @param end   One past the last operand.
     * @return The view.
     */
    @UnmodifiableView
    public List<Value> operandRange(int start, int end) {
        if (start < 0 || end > operands.length || start > end) {
            throw new IndexOutOfBoundsException("operand range [" + start + ", " + end + ") of " + operands.length);
        }
        return new AbstractList<Value>() {
            @Override
            public Value get(int index) {
                if (index < 0 || index >= end - start) throw new IndexOutOfBoundsException(index);
                return operands[start + index].get();
            }

            @Override
            public int size() {
                return end - start;
            }
        };
    }

    /**
     * Replace every operand. Only valid for operations without successors.
     *
     * @param newOperands The new operands.
     */
    public void setOperands(List<Value> newOperands) {
        if (successors.length != 0) {
            throw new IllegalStateException("cannot reset the operands of an operation with successors");
        }
        for (OpOperand operand : operands) {
            operand.drop();
        }
        operands = new OpOperand[newOperands.size()];
        for (int i = 0; i < operands.length; i++) {
            operands[i] = new OpOperand(this, newOperands.get(i), i);
        }
    }

    /**
     * Point every operand of this operation that refers to {@code from} at {@code to}.
     *
     * @param from The value to replace.
     * @param to   The replacement.
     */
    public void replaceUsesOfWith(Value from, Value to) {
        if (from == to) return;
        for (OpOperand operand : operands) {
            if (operand.get() == from) operand.set(to);
        }
    }

    // results

    public int getNumResults() {
        return results.length;
    }

    public OpResult getResult(int index) {
        return results[index];
    }

    @UnmodifiableView
    public List<OpResult> getResults() {
        return Collections.unmodifiableList(Arrays.asList(results));
    }

    public List<Type> getResultTypes() {
        List<Type> types = new ArrayList<>(results.length);
        for (OpResult result : results) {
            types.add(result.getType());
        }
        return types;
    }

    public boolean useEmpty() {
        for (OpResult result : results) {
            if (!result.useEmpty()) return false;
        }
        return true;
    }

    public void replaceAllUsesWith(List<? extends Value> values) {
        if (values.size() != results.length) {
            throw new IllegalArgumentException("expected " + results.length + " replacement values, got " + values.size());
        }
        for (int i = 0; i < results.length; i++) {
            results[i].replaceAllUsesWith(values.get(i));
        }
    }

    public void replaceAllUsesWith(Operation other) {
        replaceAllUsesWith(other.getResults());
    }

    // successors

    public int getNumSuccessors() {
        return successors.length;
    }

    public Block getSuccessor(int index) {
        return successors[index].get();
    }

    public void setSuccessor(Block block, int index) {
        successors[index].set(block);
    }

    public List<Block> getSuccessors() {
        List<Block> blocks = new ArrayList<>(successors.length);
        for (BlockOperand successor : successors) {
            blocks.add(successor.get());
        }
        return blocks;
    }

    @UnmodifiableView
    public List<BlockOperand> getBlockOperands() {
        return Collections.unmodifiableList(Arrays.asList(successors));
    }

    public int getNumSuccessorOperands(int index) {
        return successorOperandCounts[index];
    }

    public int getNumNonSuccessorOperands() {
        int count = operands.length;
        for (int succCount : successorOperandCounts) {
            count -= succCount;
        }
        return count;
    }

    /**
     * @param index The successor.
     * @return The index of the first operand passed to that successor.
     */
    public int getSuccessorOperandIndex(int index) {
        int operandIndex = getNumNonSuccessorOperands();
        for (int i = 0; i < index; i++) {
            operandIndex += successorOperandCounts[i];
        }
        return operandIndex;
    }

    @UnmodifiableView
    public List<Value> getSuccessorOperands(int index) {
        int start = getSuccessorOperandIndex(index);
        return operandRange(start, start + successorOperandCounts[index]);
    }

    @UnmodifiableView
    public List<Value> getNonSuccessorOperands() {
        return operandRange(0, getNumNonSuccessorOperands());
    }

    /**
     * Find the successor an operand is passed to.
     *
     * @param operandIndex The index of the operand.
     * @return The successor index and the position of the operand among that successor's operands,
     * or null if the operand is not a successor operand.
     */
    public int @Nullable [] decomposeSuccessorOperandIndex(int operandIndex) {
        int start = getNumNonSuccessorOperands();
        if (operandIndex < start) return null;
        for (int s = 0; s < successorOperandCounts.length; s++) {
            if (operandIndex < start + successorOperandCounts[s]) {
                return new int[]{s, operandIndex - start};
            }
            start += successorOperandCounts[s];
        }
        return null;
    }

    // regions

    public int getNumRegions() {
        return regions.length;
    }

    public Region getRegion(int index) {
        return regions[index];
    }

    @UnmodifiableView
    public List<Region> getRegions() {
        return Collections.unmodifiableList(Arrays.asList(regions));
    }

    // attributes

    public List<NamedAttribute> getAttrs() {
        return attributes;
    }

    public @Nullable Attribute getAttr(String name) {
        for (NamedAttribute attr : attributes) {
            if (attr.getName().equals(name)) return attr.getValue();
        }
        return null;
    }

    public <A extends Attribute> @Nullable A getAttrOfType(String name, Class<A> type) {
        Attribute attr = getAttr(name);
        return type.isInstance(attr) ? type.cast(attr) : null;
    }

    /**
     * Set an attribute, replacing the attribute list as a whole.
     *
     * @param name  The name.
     * @param value The value.
     */
    public void setAttr(String name, Attribute value) {
        List<NamedAttribute> newAttrs = new ArrayList<>(attributes.size() + 1);
        boolean replaced = false;
        for (NamedAttribute attr : attributes) {
            if (attr.getName().equals(name)) {
                newAttrs.add(new NamedAttribute(name, value));
                replaced = true;
            } else {
                newAttrs.add(attr);
            }
        }
        if (!replaced) newAttrs.add(new NamedAttribute(name, value));
        attributes = Collections.unmodifiableList(newAttrs);
    }

    public boolean removeAttr(String name) {
        List<NamedAttribute> newAttrs = new ArrayList<>(attributes);
        boolean removed = newAttrs.removeIf(attr -> attr.getName().equals(name));
        if (removed) attributes = Collections.unmodifiableList(newAttrs);
        return removed;
    }

    public void setAttrs(List<NamedAttribute> newAttrs) {
        attributes = List.copyOf(newAttrs);
    }

    // cloning

    /**
     * Clone this operation without its regions' contents, remapping operands and successors through {@code mapper}
     * and adding its results to it. The clone has the same number of regions, all empty.
     *
     * @param mapper The mapping.
     * @return The detached clone.
     */
    public Operation cloneWithoutRegions(ValueMapping mapper) {
        int numNonSucc = getNumNonSuccessorOperands();
        List<Value> newOperands = new ArrayList<>(numNonSucc);
        for (int i = 0; i < numNonSucc; i++) {
            newOperands.add(mapper.lookupOrDefault(getOperand(i)));
        }
        List<Block> newSuccessors = new ArrayList<>(successors.length);
        List<List<Value>> newSuccOperands = new ArrayList<>(successors.length);
        for (int s = 0; s < successors.length; s++) {
            newSuccessors.add(mapper.lookupOrDefault(getSuccessor(s)));
            List<Value> succOperands = new ArrayList<>();
            for (Value operand : getSuccessorOperands(s)) {
                succOperands.add(mapper.lookupOrDefault(operand));
            }
            newSuccOperands.add(succOperands);
        }
        Operation newOp = create(location, key, newOperands, getResultTypes(), attributes,
                newSuccessors, newSuccOperands, regions.length);
        for (int i = 0; i < results.length; i++) {
            mapper.map(results[i], newOp.results[i]);
        }
        return newOp;
    }

    public Operation cloneWithoutRegions() {
        return cloneWithoutRegions(new ValueMapping());
    }

    /**
     * Clone this operation and everything nested in it.
     *
     * @param mapper The mapping, used for operands defined outside of this operation
     *               and extended with every value and block that is cloned.
     * @return The detached clone.
     */
    public Operation clone(ValueMapping mapper) {
        Operation newOp = cloneWithoutRegions(mapper);
        for (int i = 0; i < regions.length; i++) {
            regions[i].cloneInto(newOp.regions[i], mapper);
        }
        return newOp;
    }

    // folding and verification

    /**
     * Try to fold this operation.
     *
     * @param constOperands The constant value of each operand, null where unknown.
     * @param results       Filled with one result per result of this operation on success.
     * @return Whether the operation was folded.
     */
    public boolean fold(List<@Nullable Attribute> constOperands, List<FoldResult> results) {
        OpFolder folder = getNullable(CommonExts.FOLDER);
        return folder != null && folder.fold(this, constOperands, results);
    }

    /**
     * Verify this operation and everything nested in it.
     *
     * @return The first failure, or success.
     */
    public VerificationResult verify() {
        return Verifier.verify(this);
    }

    public VerificationResult emitError(String message) {
        return VerificationResult.failure(Diagnostic.error(location, message));
    }

    /**
     * @param message The message.
     * @return A failure whose message names this operation.
     */
    public VerificationResult emitOpError(String message) {
        return emitError("'" + getName() + "' op " + message);
    }

    @Override
    public String toString() {
        return AsmPrinter.printToString(this);
    }
}
