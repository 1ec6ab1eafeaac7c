package io.github.eutro.affineir.affine;

import io.github.eutro.affineir.ops.OpKey;

import java.util.List;

import static io.github.eutro.affineir.ext.CommonExts.*;

/**
 * Kinds of the operations in the {@code affine} dialect.
 */
public final class AffineOps {
    private AffineOps() {
    }

    public static final OpKey APPLY = new OpKey("affine.apply");
    public static final OpKey FOR = new OpKey("affine.for");
    public static final OpKey IF = new OpKey("affine.if");
    public static final OpKey LOAD = new OpKey("affine.load");
    public static final OpKey STORE = new OpKey("affine.store");
    public static final OpKey DMA_START = new OpKey("affine.dma_start");
    public static final OpKey DMA_WAIT = new OpKey("affine.dma_wait");
    public static final OpKey TERMINATOR = new OpKey("affine.terminator");

    static {
        markPure(APPLY);
        APPLY.attachExt(VERIFIER, AffineApplyOp::verifyOp);
        APPLY.attachExt(FOLDER, AffineApplyOp::foldOp);
        APPLY.attachExt(PRINTER, AffineApplyOp::printOp);
        APPLY.attachExt(PARSER, AffineApplyOp::parseOp);
        APPLY.attachExt(CANONICALIZATION_PATTERNS, List.of(new SimplifyAffineApply()));

        FOR.attachExt(IMPLICIT_TERMINATOR, TERMINATOR);
        FOR.attachExt(VERIFIER, AffineForOp::verifyOp);
        FOR.attachExt(PRINTER, AffineForOp::printOp);
        FOR.attachExt(PARSER, AffineForOp::parseOp);
        FOR.attachExt(CANONICALIZATION_PATTERNS, List.of(new AffineForLoopBoundFolder()));

        IF.attachExt(IMPLICIT_TERMINATOR, TERMINATOR);
        IF.attachExt(VERIFIER, AffineIfOp::verifyOp);
        IF.attachExt(PRINTER, AffineIfOp::printOp);
        IF.attachExt(PARSER, AffineIfOp::parseOp);

        LOAD.attachExt(VERIFIER, AffineLoadOp::verifyOp);
        LOAD.attachExt(PRINTER, AffineLoadOp::printOp);
        LOAD.attachExt(PARSER, AffineLoadOp::parseOp);

        STORE.attachExt(VERIFIER, AffineStoreOp::verifyOp);
        STORE.attachExt(PRINTER, AffineStoreOp::printOp);
        STORE.attachExt(PARSER, AffineStoreOp::parseOp);

        DMA_START.attachExt(VERIFIER, AffineDmaStartOp::verifyOp);
        DMA_START.attachExt(PRINTER, AffineDmaStartOp::printOp);
        DMA_START.attachExt(PARSER, AffineDmaStartOp::parseOp);

        DMA_WAIT.attachExt(VERIFIER, AffineDmaWaitOp::verifyOp);
        DMA_WAIT.attachExt(PRINTER, AffineDmaWaitOp::printOp);
        DMA_WAIT.attachExt(PARSER, AffineDmaWaitOp::parseOp);

        TERMINATOR.attachExt(IS_TERMINATOR, true);
        TERMINATOR.attachExt(VERIFIER, AffineTerminatorOp::verifyOp);
    }
}
