package io.xmldecl.core.error;

/**
 * Abstract base for all xml-decl exceptions. Never thrown directly; use the concrete subclasses.
 *
 * <p>Every exception carries the location (root-relative element path, e.g. {@code
 * author/birth-year}) at which processing failed, and the phase in which it occurred. The
 * location is empty for declaration errors that are detected before any document is touched.
 */
public abstract class XmlProcessingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        DECLARATION,
        DECODE,
        ENCODE
    }

    private final String detail;
    private final String location;
    private final Phase phase;

    protected XmlProcessingException(String detail, String location, Phase phase) {
        super(format(detail, location));
        this.detail = detail;
        this.location = location != null ? location : "";
        this.phase = phase;
    }

    protected XmlProcessingException(String detail, Throwable cause, String location, Phase phase) {
        super(format(detail, location), cause);
        this.detail = detail;
        this.location = location != null ? location : "";
        this.phase = phase;
    }

    /** Human-readable error description without the location suffix. */
    public String detail() {
        return detail;
    }

    /** The slash-joined location of the failure, or an empty string if none applies. */
    public String location() {
        return location;
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }

    private static String format(String detail, String location) {
        if (location == null || location.isEmpty()) {
            return detail;
        }
        return detail + " at " + location;
    }
}
