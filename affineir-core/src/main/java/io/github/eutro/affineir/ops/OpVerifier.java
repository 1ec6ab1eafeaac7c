package io.github.eutro.affineir.ops;

import io.github.eutro.affineir.ir.Operation;
import io.github.eutro.affineir.ir.VerificationResult;

/**
 * Checks the invariants of one kind of operation.
 * Nested operations are verified separately.
 */
@FunctionalInterface
public interface OpVerifier {
    VerificationResult verify(Operation op);
}
