package io.xmldecl.core.error;

/** Thrown when markup cannot be parsed or written, or the underlying I/O fails. */
public final class DocumentParseException extends XmlProcessingException {

    private static final long serialVersionUID = 1L;

    public DocumentParseException(String detail, Throwable cause, Phase phase) {
        super(detail, cause, "", phase);
    }
}
