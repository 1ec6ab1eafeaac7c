package io.github.eutro.affineir.ir;

import io.github.eutro.affineir.types.Type;
import org.jetbrains.annotations.Nullable;

public final class BlockArgument extends Value {
    private final Block owner;
    int argNumber;

    BlockArgument(Block owner, int argNumber, Type type) {
        super(type);
        this.owner = owner;
        this.argNumber = argNumber;
    }

    public Block getOwner() {
        return owner;
    }

    public int getArgNumber() {
        return argNumber;
    }

    @Override
    public @Nullable Operation getDefiningOp() {
        return null;
    }

    @Override
    public Block getParentBlock() {
        return owner;
    }

    @Override
    public String toString() {
        return "block argument #" + argNumber + " : " + getType();
    }
}
