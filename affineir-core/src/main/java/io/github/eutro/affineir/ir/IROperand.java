package io.github.eutro.affineir.ir;

import org.jetbrains.annotations.Nullable;

/**
 * An edge from an operation to something it refers to, linked into the use list of its target.
 *
 * @param <O> The type of this.
 * @param <V> The target type.
 */
public abstract class IROperand<O extends IROperand<O, V>, V extends IRObjectWithUseList<O, V>> {
    private final Operation owner;
    private @Nullable V value;
    @Nullable O nextUse;
    @Nullable O prevUse;

    protected IROperand(Operation owner, @Nullable V value) {
        this.owner = owner;
        set(value);
    }

    @SuppressWarnings("unchecked")
    private O self() {
        return (O) this;
    }

    public Operation getOwner() {
        return owner;
    }

    /**
     * @return The target, or null if this operand was dropped.
     */
    public @Nullable V get() {
        return value;
    }

    /**
     * Point this operand at {@code newValue}, unlinking it from its previous target.
     *
     * @param newValue The new target.
     */
    public void set(@Nullable V newValue) {
        if (value != null) removeFromCurrent();
        value = newValue;
        if (newValue != null) insertIntoCurrent(newValue);
    }

    /**
     * Unlink this operand from its target, leaving it null.
     */
    public void drop() {
        set(null);
    }

    private void insertIntoCurrent(V target) {
        O self = self();
        O head = target.firstUse;
        nextUse = head;
        prevUse = null;
        if (head != null) head.prevUse = self;
        target.firstUse = self;
    }

    private void removeFromCurrent() {
        assert value != null;
        if (prevUse == null) {
            value.firstUse = nextUse;
        } else {
            prevUse.nextUse = nextUse;
        }
        if (nextUse != null) nextUse.prevUse = prevUse;
        nextUse = null;
        prevUse = null;
    }
}
