package io.github.eutro.affineir.ops;

import io.github.eutro.affineir.asm.OpAsmParser;
import io.github.eutro.affineir.asm.ParseException;
import io.github.eutro.affineir.ir.OperationState;

/**
 * Parses the custom textual form of an operation, after its name, into an {@link OperationState}.
 */
@FunctionalInterface
public interface OpParser {
    void parse(OpAsmParser parser, OperationState state) throws ParseException;
}
