package io.github.eutro.affineir.ops;

import io.github.eutro.affineir.attrs.Attribute;
import io.github.eutro.affineir.ir.Value;
import org.jetbrains.annotations.Nullable;

/**
 * What one result of a folded operation turned into: an existing value or a constant.
 */
public final class FoldResult {
    private final @Nullable Value value;
    private final @Nullable Attribute attribute;

    private FoldResult(@Nullable Value value, @Nullable Attribute attribute) {
        this.value = value;
        this.attribute = attribute;
    }

    public static FoldResult of(Value value) {
        return new FoldResult(value, null);
    }

    public static FoldResult of(Attribute attribute) {
        return new FoldResult(null, attribute);
    }

    public boolean isValue() {
        return value != null;
    }

    public @Nullable Value getValue() {
        return value;
    }

    public @Nullable Attribute getAttribute() {
        return attribute;
    }

    @Override
    public String toString() {
        return value != null ? String.valueOf(value) : String.valueOf(attribute);
    }
}
