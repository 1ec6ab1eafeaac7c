package io.github.eutro.affineir.ir;

import io.github.eutro.affineir.types.Type;
import org.jetbrains.annotations.Nullable;

/**
 * A typed SSA value, either the {@link OpResult result} of an operation
 * or a {@link BlockArgument block argument}.
 * <p>
 * Every value keeps the list of {@link OpOperand operands} that use it.
 */
public abstract class Value extends IRObjectWithUseList<OpOperand, Value> {
    private Type type;

    Value(Type type) {
        this.type = type;
    }

    public Type getType() {
        return type;
    }

    public void setType(Type type) {
        this.type = type;
    }

    /**
     * @return The operation producing this value, or null for block arguments.
     */
    public abstract @Nullable Operation getDefiningOp();

    /**
     * @return The block this value is defined in, or null if it is detached.
     */
    public abstract @Nullable Block getParentBlock();

    public @Nullable Region getParentRegion() {
        Block block = getParentBlock();
        return block == null ? null : block.getParent();
    }

    /**
     * Whether this value is used by an operation outside of {@code block}.
     *
     * @param block The block.
     * @return Whether it is.
     */
    public boolean isUsedOutsideOfBlock(Block block) {
        for (OpOperand use : getUses()) {
            if (use.getOwner().getBlock() != block) return true;
        }
        return false;
    }
}
