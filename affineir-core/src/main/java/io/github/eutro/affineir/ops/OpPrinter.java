package io.github.eutro.affineir.ops;

import io.github.eutro.affineir.asm.AsmPrinter;
import io.github.eutro.affineir.ir.Operation;

/**
 * Prints the custom textual form of an operation, after its results and {@code =}, starting with its name.
 */
@FunctionalInterface
public interface OpPrinter {
    void print(Operation op, AsmPrinter printer);
}
