package io.github.eutro.affineir.ir;

import io.github.eutro.affineir.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Something operands can refer to, keeping an intrusive list of those operands.
 *
 * @param <O> The operand type.
 * @param <V> The type of this.
 */
public abstract class IRObjectWithUseList<O extends IROperand<O, V>, V extends IRObjectWithUseList<O, V>>
        extends ExtHolder {
    @Nullable O firstUse;

    public boolean useEmpty() {
        return firstUse == null;
    }

    public boolean hasOneUse() {
        return firstUse != null && firstUse.nextUse == null;
    }

    public int getNumUses() {
        int count = 0;
        for (O use = firstUse; use != null; use = use.nextUse) {
            count++;
        }
        return count;
    }

    /**
     * Iterate over the uses of this. The use being visited may be relinked or dropped during iteration.
     *
     * @return The uses.
     */
    public Iterable<O> getUses() {
        return () -> new Iterator<O>() {
            @Nullable O next = firstUse;

            @Override
            public boolean hasNext() {
                return next != null;
            }

            @Override
            public O next() {
                O current = next;
                if (current == null) throw new NoSuchElementException();
                next = current.nextUse;
                return current;
            }
        };
    }

    public List<Operation> getUsers() {
        List<Operation> users = new ArrayList<>();
        for (O use = firstUse; use != null; use = use.nextUse) {
            users.add(use.getOwner());
        }
        return users;
    }

    /**
     * Make every operand referring to this refer to {@code newValue} instead.
     *
     * @param newValue The replacement.
     */
    public void replaceAllUsesWith(V newValue) {
        if (newValue == this) return;
        while (firstUse != null) {
            firstUse.set(newValue);
        }
    }

    /**
     * Clear every operand referring to this.
     */
    public void dropAllUses() {
        while (firstUse != null) {
            firstUse.drop();
        }
    }
}
