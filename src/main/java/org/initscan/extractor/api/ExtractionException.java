package org.initscan.extractor.api;

/**
 * Thrown when an expression or a raw value text cannot be turned into a typed value.
 * <p>
 * Every instance carries an {@link ExtractionErrorCode}, the name of the component that
 * failed and the offending text fragment, so a caller can decide whether to skip the
 * single record or abort the whole run.
 */
public class ExtractionException extends Exception {

    private final ExtractionErrorCode errorCode;
    private final String source;
    private final String fragment;

    /**
     * Constructs a new extraction exception.
     * @param errorCode The kind of failure.
     * @param source The component that failed (e.g. "expression", "entry-list").
     * @param fragment The offending text fragment.
     * @param message The detail message.
     */
    public ExtractionException(ExtractionErrorCode errorCode, String source, String fragment, String message) {
        this(errorCode, source, fragment, message, null);
    }

    /**
     * Constructs a new extraction exception with a cause.
     * @param errorCode The kind of failure.
     * @param source The component that failed.
     * @param fragment The offending text fragment.
     * @param message The detail message.
     * @param cause The cause.
     */
    public ExtractionException(ExtractionErrorCode errorCode, String source, String fragment, String message, Throwable cause) {
        super(String.format("[%s] %s: %s (at '%s')", errorCode, source, message, fragment), cause);
        this.errorCode = errorCode;
        this.source = source;
        this.fragment = fragment;
    }

    public ExtractionErrorCode getErrorCode() {
        return errorCode;
    }

    public String getSource() {
        return source;
    }

    public String getFragment() {
        return fragment;
    }
}
