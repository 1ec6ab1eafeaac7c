package io.github.eutro.affineir.ir;

import io.github.eutro.affineir.ext.CommonExts;
import io.github.eutro.affineir.ext.TrackedList;
import io.github.eutro.affineir.types.Type;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.UnmodifiableView;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * A list of operations with typed arguments, owned by a {@link Region}.
 * <p>
 * Blocks can be branched to by terminators, which makes them {@link BlockOperand used}.
 */
public final class Block extends IRObjectWithUseList<BlockOperand, Block> {
    @Nullable Region parent;
    private final List<BlockArgument> arguments = new ArrayList<>();
    private final TrackedList<Operation> operations = new TrackedList<Operation>() {
        @Override
        protected void onAdded(Operation op) {
            if (op.block != null) {
                throw new IllegalStateException("operation '" + op.getName() + "' is already in a block");
            }
            op.block = Block.this;
            orderValid = false;
        }

        @Override
        protected void onRemoved(Operation op) {
            op.block = null;
            orderValid = false;
        }
    };
    private boolean orderValid = false;

    public @Nullable Region getParent() {
        return parent;
    }

    public @Nullable Operation getParentOp() {
        return parent == null ? null : parent.getParentOp();
    }

    public boolean isEntryBlock() {
        return parent != null && !parent.getBlocks().isEmpty() && parent.getBlocks().get(0) == this;
    }

    @UnmodifiableView
    public List<BlockArgument> getArguments() {
        return Collections.unmodifiableList(arguments);
    }

    public BlockArgument getArgument(int index) {
        return arguments.get(index);
    }

    public int getNumArguments() {
        return arguments.size();
    }

    public BlockArgument addArgument(Type type) {
        BlockArgument arg = new BlockArgument(this, arguments.size(), type);
        arguments.add(arg);
        return arg;
    }

    public List<BlockArgument> addArguments(List<Type> types) {
        List<BlockArgument> added = new ArrayList<>(types.size());
        for (Type type : types) {
            added.add(addArgument(type));
        }
        return added;
    }

    /**
     * Remove an argument, which must have no remaining uses.
     *
     * @param index The index of the argument.
     */
    public void eraseArgument(int index) {
        if (!arguments.get(index).useEmpty()) {
            throw new IllegalStateException("cannot erase block argument " + index + ", it still has uses");
        }
        arguments.remove(index);
        for (int i = index; i < arguments.size(); i++) {
            arguments.get(i).argNumber = i;
        }
    }

    /**
     * The operations of this block. Adding to or removing from this list updates their parent block.
     *
     * @return The operation list.
     */
    public List<Operation> getOperations() {
        return operations;
    }

    public void addOperation(Operation op) {
        operations.add(op);
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }

    public Operation front() {
        return operations.get(0);
    }

    public Operation back() {
        return operations.get(operations.size() - 1);
    }

    /**
     * @return The last operation, if it is a terminator.
     */
    public @Nullable Operation getTerminator() {
        if (operations.isEmpty()) return null;
        Operation last = back();
        return last.hasTrait(CommonExts.IS_TERMINATOR) ? last : null;
    }

    public List<Block> getSuccessors() {
        Operation terminator = getTerminator();
        return terminator == null ? List.of() : terminator.getSuccessors();
    }

    public List<Block> getPredecessors() {
        List<Block> preds = new ArrayList<>();
        for (BlockOperand use : getUses()) {
            Block pred = use.getOwner().getBlock();
            if (pred != null) preds.add(pred);
        }
        return preds;
    }

    public boolean isOpOrderValid() {
        return orderValid;
    }

    public void invalidateOpOrder() {
        orderValid = false;
    }

    /**
     * Renumber the operations of this block, so {@link Operation#isBeforeInBlock(Operation)} is a field comparison.
     */
    public void recomputeOpOrder() {
        int index = 0;
        for (Operation op : operations) {
            op.orderIndex = index++;
        }
        orderValid = true;
    }

    /**
     * Walk every operation in this block, nested operations before the operations containing them.
     *
     * @param visitor The visitor, which may erase the operation it is given.
     */
    public void walk(Consumer<Operation> visitor) {
        for (Operation op : new ArrayList<>(operations)) {
            op.walk(visitor);
        }
    }

    public void dropAllReferences() {
        for (Operation op : operations) {
            op.dropAllReferences();
        }
    }

    public void dropAllDefinedValueUses() {
        for (BlockArgument arg : arguments) {
            arg.dropAllUses();
        }
        for (Operation op : operations) {
            op.dropAllDefinedValueUses();
        }
    }

    /**
     * Remove this block from its region and destroy its operations.
     * Values defined in it must not be used outside of it.
     */
    public void erase() {
        assert useEmpty() : "erasing a block that is still branched to";
        if (parent != null) parent.getBlocks().remove(this);
        dropAllReferences();
        operations.clear();
    }

    @Override
    public String toString() {
        return "block with " + arguments.size() + " arguments and " + operations.size() + " operations";
    }
}
