package io.github.eutro.affineir.passes.meta;

import io.github.eutro.affineir.ir.Operation;
import io.github.eutro.affineir.ir.VerificationException;
import io.github.eutro.affineir.passes.InPlaceIRPass;

/**
 * Verifies an operation and everything nested in it.
 *
 * @throws VerificationException If it does not verify.
 */
public class VerifyPass implements InPlaceIRPass<Operation> {
    public static final VerifyPass INSTANCE = new VerifyPass();

    @Override
    public void runInPlace(Operation op) {
        op.verify().orElseThrow();
    }

    @Override
    public String toString() {
        return "verify";
    }
}
