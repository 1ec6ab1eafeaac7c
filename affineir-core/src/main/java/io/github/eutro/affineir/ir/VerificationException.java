package io.github.eutro.affineir.ir;

/**
 * Thrown when IR that failed verification would be consumed.
 */
public class VerificationException extends RuntimeException {
    private final Diagnostic diagnostic;

    public VerificationException(Diagnostic diagnostic) {
        super(diagnostic.toString());
        this.diagnostic = diagnostic;
    }

    public Diagnostic getDiagnostic() {
        return diagnostic;
    }
}
