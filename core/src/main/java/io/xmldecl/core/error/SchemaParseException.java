package io.xmldecl.core.error;

/**
 * Thrown when a YAML processor schema is unreadable, violates the processor schema format, or
 * references an unknown class or hook. Carries the {@code source} that caused the error.
 */
public final class SchemaParseException extends XmlProcessingException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public SchemaParseException(String detail, String source) {
        super(detail, "", Phase.DECLARATION);
        this.source = source;
    }

    public SchemaParseException(String detail, Throwable cause, String source) {
        super(detail, cause, "", Phase.DECLARATION);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
