package io.github.eutro.affineir.ir;

import org.jetbrains.annotations.Nullable;

/**
 * A reference to a successor {@link Block} from a terminator.
 */
public final class BlockOperand extends IROperand<BlockOperand, Block> {
    private final int successorIndex;

    BlockOperand(Operation owner, @Nullable Block block, int successorIndex) {
        super(owner, block);
        this.successorIndex = successorIndex;
    }

    public int getSuccessorIndex() {
        return successorIndex;
    }
}
