package io.github.eutro.affineir.ops;

import io.github.eutro.affineir.attrs.Attribute;
import io.github.eutro.affineir.ext.CommonExts;
import io.github.eutro.affineir.ir.Location;
import io.github.eutro.affineir.ir.OpBuilder;
import io.github.eutro.affineir.ir.Operation;
import io.github.eutro.affineir.types.Type;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A namespace of operation kinds.
 */
public abstract class Dialect {
    private final String namespace;
    private final Map<String, OpKey> operations = new LinkedHashMap<>();

    protected Dialect(String namespace) {
        this.namespace = namespace;
    }

    protected void addOperations(OpKey... keys) {
        for (OpKey key : keys) {
            if (!key.getDialectNamespace().equals(namespace)) {
                throw new IllegalArgumentException("'" + key.getName() + "' is not in namespace '" + namespace + "'");
            }
            operations.put(key.getName(), key);
            key.attachExt(CommonExts.DIALECT, this);
        }
    }

    public String getNamespace() {
        return namespace;
    }

    public Collection<OpKey> getOperations() {
        return Collections.unmodifiableCollection(operations.values());
    }

    public @Nullable OpKey lookup(String name) {
        return operations.get(name);
    }

    /**
     * Create an operation producing a constant, used to materialize the results of folding.
     *
     * @param builder  Where to create it.
     * @param value    The constant.
     * @param type     The type of the result.
     * @param location The location.
     * @return The operation, or null if this dialect cannot produce the constant.
     */
    public @Nullable Operation materializeConstant(OpBuilder builder, Attribute value, Type type, Location location) {
        return null;
    }

    @Override
    public String toString() {
        return namespace.isEmpty() ? "<builtin>" : namespace;
    }
}
