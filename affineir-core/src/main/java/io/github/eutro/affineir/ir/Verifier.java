package io.github.eutro.affineir.ir;

import io.github.eutro.affineir.ext.CommonExts;
import io.github.eutro.affineir.ops.OpVerifier;

import java.util.List;

/**
 * Checks the structural invariants shared by every operation, then the invariants of each operation kind,
 * then everything nested.
 */
final class Verifier {
    private Verifier() {
    }

    static VerificationResult verify(Operation op) {
        VerificationResult result = verifyOperation(op);
        if (result.isFailure()) return result;
        for (Region region : op.getRegions()) {
            for (Block block : region.getBlocks()) {
                result = verifyBlock(op, block);
                if (result.isFailure()) return result;
            }
        }
        return VerificationResult.success();
    }

    private static VerificationResult verifyOperation(Operation op) {
        for (int i = 0; i < op.getNumOperands(); i++) {
            Value operand = op.getOperand(i);
            if (operand == null) return op.emitOpError("operand #" + i + " does not have a definition");
            Operation def = operand.getDefiningOp();
            if (def != null && def.getBlock() != null && def.getBlock() == op.getBlock() && !def.isBeforeInBlock(op)) {
                return op.emitOpError("operand #" + i + " does not dominate this use");
            }
        }

        if (op.isKnownTerminator()) {
            Block block = op.getBlock();
            if (block != null && block.back() != op) {
                return op.emitOpError("must be the last operation in the parent block");
            }
        }

        for (int s = 0; s < op.getNumSuccessors(); s++) {
            Block successor = op.getSuccessor(s);
            if (successor == null) return op.emitOpError("successor #" + s + " is missing");
            if (successor.getParent() == null || successor.getParent() != op.getContainingRegion()) {
                return op.emitOpError("reference to block defined in another region");
            }
            List<Value> succOperands = op.getSuccessorOperands(s);
            if (succOperands.size() != successor.getNumArguments()) {
                return op.emitOpError("branch has " + succOperands.size() + " operands, but target block has "
                        + successor.getNumArguments());
            }
            for (int i = 0; i < succOperands.size(); i++) {
                if (!succOperands.get(i).getType().equals(successor.getArgument(i).getType())) {
                    return op.emitOpError("type mismatch in bb argument #" + i);
                }
            }
        }

        OpVerifier verifier = op.getNullable(CommonExts.VERIFIER);
        if (verifier != null) return verifier.verify(op);
        return VerificationResult.success();
    }

    private static VerificationResult verifyBlock(Operation parent, Block block) {
        if (parent.getKey().isRegistered()) {
            if (block.isEmpty()) {
                return parent.emitOpError("contains a block with no terminator");
            }
            if (block.back().isKnownNonTerminator()) {
                return block.back().emitOpError("is not a terminator but ends a block of '" + parent.getName() + "'");
            }
        }
        for (BlockArgument arg : block.getArguments()) {
            if (arg.getOwner() != block) return parent.emitOpError("block argument not owned by its block");
        }
        for (Operation op : block.getOperations()) {
            VerificationResult result = verify(op);
            if (result.isFailure()) return result;
        }
        return VerificationResult.success();
    }
}
