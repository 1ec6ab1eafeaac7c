package io.github.eutro.affineir.passes;

import io.github.eutro.affineir.passes.misc.ChainedPass;

/**
 * A transformation or analysis of some unit of IR, usually an {@link io.github.eutro.affineir.ir.Operation}
 * such as a module.
 *
 * @param <A> The input type.
 * @param <B> The output type.
 */
public interface IRPass<A, B> {
    B run(A a);

    /**
     * @return Whether this pass returns the IR it was given, having changed it in place.
     */
    default boolean isInPlace() {
        return false;
    }

    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
