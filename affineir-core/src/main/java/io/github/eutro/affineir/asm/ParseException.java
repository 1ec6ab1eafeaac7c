package io.github.eutro.affineir.asm;

import io.github.eutro.affineir.ir.Diagnostic;
import io.github.eutro.affineir.ir.Location;

/**
 * A located failure to read IR text.
 */
public class ParseException extends Exception {
    private final Diagnostic diagnostic;

    public ParseException(Location location, String message) {
        this(Diagnostic.error(location, message));
    }

    public ParseException(Diagnostic diagnostic) {
        super(diagnostic.toString());
        this.diagnostic = diagnostic;
    }

    public Diagnostic getDiagnostic() {
        return diagnostic;
    }

    public Location getLocation() {
        return diagnostic.getLocation();
    }
}
