package io.xmldecl.core.error;

/**
 * Thrown when a primitive value cannot be converted: text that does not parse as the declared
 * type during decode, or a value of the wrong Java type during encode.
 */
public final class InvalidPrimitiveValueException extends XmlProcessingException {

    private static final long serialVersionUID = 1L;

    private final transient Object rawValue;

    public InvalidPrimitiveValueException(String detail, Object rawValue, String location, Phase phase) {
        super(detail, location, phase);
        this.rawValue = rawValue;
    }

    public InvalidPrimitiveValueException(
            String detail, Object rawValue, Throwable cause, String location, Phase phase) {
        super(detail, cause, location, phase);
        this.rawValue = rawValue;
    }

    /** The offending raw text (decode) or value (encode). */
    public Object rawValue() {
        return rawValue;
    }
}
