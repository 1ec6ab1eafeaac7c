package io.github.eutro.affineir.ir;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * A mapping of values and blocks to their replacements, used when cloning.
 */
public final class ValueMapping {
    private final Map<Value, Value> values = new HashMap<>();
    private final Map<Block, Block> blocks = new HashMap<>();

    public void map(Value from, Value to) {
        values.put(from, to);
    }

    public void map(Block from, Block to) {
        blocks.put(from, to);
    }

    public @Nullable Value lookupOrNull(@Nullable Value from) {
        return from == null ? null : values.get(from);
    }

    public @Nullable Block lookupOrNull(@Nullable Block from) {
        return from == null ? null : blocks.get(from);
    }

    @Contract("null -> null; !null -> !null")
    public Value lookupOrDefault(@Nullable Value from) {
        if (from == null) return null;
        return values.getOrDefault(from, from);
    }

    @Contract("null -> null; !null -> !null")
    public Block lookupOrDefault(@Nullable Block from) {
        if (from == null) return null;
        return blocks.getOrDefault(from, from);
    }

    public Value lookup(Value from) {
        Value to = values.get(from);
        if (to == null) throw new IllegalArgumentException("no mapping for " + from);
        return to;
    }

    public Block lookup(Block from) {
        Block to = blocks.get(from);
        if (to == null) throw new IllegalArgumentException("no mapping for " + from);
        return to;
    }

    public boolean contains(Value from) {
        return values.containsKey(from);
    }

    public boolean contains(Block from) {
        return blocks.containsKey(from);
    }

    public void erase(Value from) {
        values.remove(from);
    }

    public void clear() {
        values.clear();
        blocks.clear();
    }
}
