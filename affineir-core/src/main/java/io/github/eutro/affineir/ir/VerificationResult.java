package io.github.eutro.affineir.ir;

import org.jetbrains.annotations.Nullable;

/**
 * The outcome of verifying a piece of IR: success, or the diagnostic of the first violated invariant.
 */
public final class VerificationResult {
    private static final VerificationResult SUCCESS = new VerificationResult(null);

    private final @Nullable Diagnostic diagnostic;

    private VerificationResult(@Nullable Diagnostic diagnostic) {
        this.diagnostic = diagnostic;
    }

    public static VerificationResult success() {
        return SUCCESS;
    }

    public static VerificationResult failure(Diagnostic diagnostic) {
        return new VerificationResult(diagnostic);
    }

    public boolean isSuccess() {
        return diagnostic == null;
    }

    public boolean isFailure() {
        return diagnostic != null;
    }

    public Diagnostic getDiagnostic() {
        if (diagnostic == null) throw new IllegalStateException("verification succeeded");
        return diagnostic;
    }

    /**
     * Throw if this is a failure.
     *
     * @throws VerificationException If this is a failure.
     */
    public void orElseThrow() {
        if (diagnostic != null) throw new VerificationException(diagnostic);
    }

    @Override
    public String toString() {
        return diagnostic == null ? "success" : diagnostic.toString();
    }
}
