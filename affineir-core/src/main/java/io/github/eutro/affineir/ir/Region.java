package io.github.eutro.affineir.ir;

import io.github.eutro.affineir.ext.ExtHolder;
import io.github.eutro.affineir.ext.TrackedList;
import io.github.eutro.affineir.ops.OpKey;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * A list of blocks owned by an {@link Operation}.
 */
public final class Region extends ExtHolder {
    @Nullable Operation parentOp;
    private final TrackedList<Block> blocks = new TrackedList<Block>() {
        @Override
        protected void onAdded(Block block) {
            if (block.parent != null) throw new IllegalStateException("block is already in a region");
            block.parent = Region.this;
        }

        @Override
        protected void onRemoved(Block block) {
            block.parent = null;
        }
    };

    /**
     * Create a region that is not yet owned by an operation, to be moved into one
     * by {@link Operation#create(OperationState)}.
     */
    public Region() {
    }

    Region(Operation parentOp) {
        this.parentOp = parentOp;
    }

    public @Nullable Operation getParentOp() {
        return parentOp;
    }

    /**
     * @return The region containing the operation owning this region, if any.
     */
    public @Nullable Region getParentRegion() {
        return parentOp == null ? null : parentOp.getContainingRegion();
    }

    public List<Block> getBlocks() {
        return blocks;
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }

    public boolean hasOneBlock() {
        return blocks.size() == 1;
    }

    public Block front() {
        return blocks.get(0);
    }

    public Block back() {
        return blocks.get(blocks.size() - 1);
    }

    public Block addBlock() {
        Block block = new Block();
        blocks.add(block);
        return block;
    }

    public void addBlock(Block block) {
        blocks.add(block);
    }

    /**
     * Whether this region is {@code other} or contains it, at any depth.
     *
     * @param other The other region.
     * @return Whether it is.
     */
    public boolean isAncestor(@Nullable Region other) {
        while (other != null) {
            if (other == this) return true;
            other = other.getParentRegion();
        }
        return false;
    }

    /**
     * Clone the blocks of this region, appending them to {@code dest}.
     * <p>
     * Operands are remapped only once every block has been cloned,
     * so uses that textually precede their definitions are resolved too.
     *
     * @param dest   The region to clone into.
     * @param mapper The value and block mapping, extended with every cloned value and block.
     */
    public void cloneInto(Region dest, ValueMapping mapper) {
        if (dest == this) throw new IllegalArgumentException("cannot clone a region into itself");
        if (blocks.isEmpty()) return;
        int firstNew = dest.blocks.size();
        for (Block block : blocks) {
            Block newBlock = new Block();
            mapper.map(block, newBlock);
            for (BlockArgument arg : block.getArguments()) {
                mapper.map(arg, newBlock.addArgument(arg.getType()));
            }
            dest.blocks.add(newBlock);
        }
        for (Block block : blocks) {
            Block newBlock = mapper.lookup(block);
            for (Operation op : block.getOperations()) {
                newBlock.addOperation(op.clone(mapper));
            }
        }
        Consumer<Operation> remap = op -> {
            for (OpOperand operand : op.getOpOperands()) {
                Value mapped = mapper.lookupOrNull(operand.get());
                if (mapped != null) operand.set(mapped);
            }
            for (BlockOperand successor : op.getBlockOperands()) {
                Block mapped = mapper.lookupOrNull(successor.get());
                if (mapped != null) successor.set(mapped);
            }
        };
        for (int i = firstNew; i < dest.blocks.size(); i++) {
            dest.blocks.get(i).walk(remap);
        }
    }

    /**
     * Replace the blocks of this region with those of {@code other}, leaving it empty.
     *
     * @param other The region to take the body of.
     */
    public void takeBody(Region other) {
        dropAllReferences();
        blocks.clear();
        List<Block> moved = new ArrayList<>(other.blocks);
        other.blocks.clear();
        blocks.addAll(moved);
    }

    /**
     * Make sure this region has a block ending in a terminator, creating the block
     * and an operand-less terminator of the given kind if needed.
     *
     * @param terminatorKey The terminator kind.
     * @param location      The location of a created terminator.
     */
    public void ensureTerminator(OpKey terminatorKey, Location location) {
        if (blocks.isEmpty()) addBlock();
        Block block = back();
        if (!block.isEmpty() && block.back().isKnownTerminator()) return;
        block.addOperation(Operation.create(location, terminatorKey, List.of(), List.of(), List.of(), 0));
    }

    /**
     * Walk every operation in this region, nested operations first.
     *
     * @param visitor The visitor.
     */
    public void walk(Consumer<Operation> visitor) {
        for (Block block : new ArrayList<>(blocks)) {
            block.walk(visitor);
        }
    }

    public void dropAllReferences() {
        for (Block block : blocks) {
            block.dropAllReferences();
        }
    }
}
