package io.github.eutro.affineir.passes;

import io.github.eutro.affineir.ir.Operation;
import io.github.eutro.affineir.passes.meta.VerifyPass;
import io.github.eutro.affineir.passes.opts.Canonicalize;
import io.github.eutro.affineir.passes.opts.ComposeAffineApplies;
import io.github.eutro.affineir.passes.opts.EliminateDeadOps;

public class Passes {
    public static final IRPass<Operation, Operation> AFFINE_OPTS =
            ComposeAffineApplies.INSTANCE
                    .then(Canonicalize.INSTANCE)
                    .then(EliminateDeadOps.INSTANCE);

    public static final IRPass<Operation, Operation> VERIFIED_AFFINE_OPTS =
            VerifyPass.INSTANCE
                    .then(AFFINE_OPTS)
                    .then(VerifyPass.INSTANCE);
}
