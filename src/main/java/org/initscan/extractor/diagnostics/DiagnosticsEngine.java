package org.initscan.extractor.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects diagnostics for one extraction call.
 * <p>
 * Scanners that skip or patch malformed input report here instead of failing, so the
 * caller can decide afterwards whether the skipped data matters. An engine belongs to a
 * single call and is not meant to be shared between threads.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param message    The error message.
     * @param subject    The entry or field concerned.
     * @param lineNumber The line number of the error.
     */
    public void reportError(String message, String subject, int lineNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, message, subject, lineNumber));
    }

    /**
     * Reports a warning.
     *
     * @param message    The warning message.
     * @param subject    The entry or field concerned.
     * @param lineNumber The line number of the warning.
     */
    public void reportWarning(String message, String subject, int lineNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, message, subject, lineNumber));
    }

    /**
     * @return {@code true} if at least one error was reported.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * @return {@code true} if nothing was reported.
     */
    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
