package org.initscan.extractor.diagnostics;

/**
 * A single message recorded while extracting from a text buffer.
 *
 * @param type The severity of the diagnostic.
 * @param message The diagnostic message.
 * @param subject What the message is about, e.g. an entry key or a field name.
 * @param lineNumber The one-based line in the scanned text, or 0 if unknown.
 */
public record Diagnostic(
        Type type,
        String message,
        String subject,
        int lineNumber
) {
    /**
     * The severity of a diagnostic message.
     */
    public enum Type {
        /** Data was lost, e.g. a malformed entry was skipped. */
        ERROR,
        /** Data was kept but may be incomplete. */
        WARNING
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d: %s", type, subject, lineNumber, message);
    }
}
