package io.xmldecl.core.error;

/**
 * Thrown when a required element, attribute or nested container is absent from the document
 * during decode, or a required field is absent from the value during encode.
 */
public final class MissingValueException extends XmlProcessingException {

    private static final long serialVersionUID = 1L;

    public MissingValueException(String detail, String location, Phase phase) {
        super(detail, location, phase);
    }
}
