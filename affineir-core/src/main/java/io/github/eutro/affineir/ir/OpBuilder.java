package io.github.eutro.affineir.ir;

import io.github.eutro.affineir.types.Type;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Creates operations at an insertion point: the end of a block, or just before an operation.
 */
public class OpBuilder {
    private @Nullable Block block;
    private @Nullable Operation before;

    public OpBuilder() {
    }

    public static OpBuilder atBlockEnd(Block block) {
        OpBuilder builder = new OpBuilder();
        builder.setInsertionPointToEnd(block);
        return builder;
    }

    public static OpBuilder atBlockBegin(Block block) {
        OpBuilder builder = new OpBuilder();
        builder.setInsertionPointToStart(block);
        return builder;
    }

    public static OpBuilder before(Operation op) {
        OpBuilder builder = new OpBuilder();
        builder.setInsertionPoint(op);
        return builder;
    }

    public void setInsertionPointToEnd(Block block) {
        this.block = block;
        this.before = null;
    }

    public void setInsertionPointToStart(Block block) {
        this.block = block;
        this.before = block.isEmpty() ? null : block.front();
    }

    public void setInsertionPoint(Operation op) {
        Block opBlock = op.getBlock();
        if (opBlock == null) throw new IllegalArgumentException("operation is not in a block");
        this.block = opBlock;
        this.before = op;
    }

    public void setInsertionPointAfter(Operation op) {
        Block opBlock = op.getBlock();
        if (opBlock == null) throw new IllegalArgumentException("operation is not in a block");
        List<Operation> ops = opBlock.getOperations();
        int index = ops.indexOf(op);
        this.block = opBlock;
        this.before = index + 1 < ops.size() ? ops.get(index + 1) : null;
    }

    public void clearInsertionPoint() {
        block = null;
        before = null;
    }

    public @Nullable Block getInsertionBlock() {
        return block;
    }

    /**
     * Insert a detached operation at the insertion point, if there is one.
     *
     * @param op The operation.
     * @return The operation.
     */
    public Operation insert(Operation op) {
        if (block != null) {
            if (before == null) {
                block.addOperation(op);
            } else {
                block.getOperations().add(block.getOperations().indexOf(before), op);
            }
        }
        notifyOperationInserted(op);
        return op;
    }

    public Operation create(OperationState state) {
        return insert(Operation.create(state));
    }

    /**
     * Append a new block to a region and move the insertion point to its end.
     *
     * @param region   The region.
     * @param argTypes The types of the block's arguments.
     * @return The block.
     */
    public Block createBlock(Region region, List<Type> argTypes) {
        Block newBlock = region.addBlock();
        newBlock.addArguments(argTypes);
        setInsertionPointToEnd(newBlock);
        return newBlock;
    }

    protected void notifyOperationInserted(Operation op) {
    }
}
