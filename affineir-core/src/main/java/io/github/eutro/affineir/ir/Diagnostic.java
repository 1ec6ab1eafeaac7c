package io.github.eutro.affineir.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A located message about the IR, with optional attached notes.
 */
public final class Diagnostic {
    public enum Severity {
        ERROR, WARNING, REMARK, NOTE;

        @Override
        public String toString() {
            return name().toLowerCase(java.util.Locale.ROOT);
        }
    }

    private final Severity severity;
    private final Location location;
    private final String message;
    private final List<Diagnostic> notes = new ArrayList<>();

    public Diagnostic(Severity severity, Location location, String message) {
        this.severity = severity;
        this.location = location;
        this.message = message;
    }

    public static Diagnostic error(Location location, String message) {
        return new Diagnostic(Severity.ERROR, location, message);
    }

    public Diagnostic attachNote(Location location, String message) {
        notes.add(new Diagnostic(Severity.NOTE, location, message));
        return this;
    }

    public Severity getSeverity() {
        return severity;
    }

    public Location getLocation() {
        return location;
    }

    public String getMessage() {
        return message;
    }

    public List<Diagnostic> getNotes() {
        return Collections.unmodifiableList(notes);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(location).append(": ").append(severity).append(": ").append(message);
        for (Diagnostic note : notes) {
            sb.append('\n').append(note);
        }
        return sb.toString();
    }
}
