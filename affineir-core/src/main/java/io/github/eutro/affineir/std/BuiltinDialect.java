package io.github.eutro.affineir.std;

import io.github.eutro.affineir.ops.Dialect;

/**
 * The dialect with the empty namespace, holding {@code func} and {@code module}.
 */
public final class BuiltinDialect extends Dialect {
    public static final BuiltinDialect INSTANCE = new BuiltinDialect();

    private BuiltinDialect() {
        super("");
        addOperations(BuiltinOps.FUNC, BuiltinOps.MODULE, BuiltinOps.MODULE_TERMINATOR);
    }
}
