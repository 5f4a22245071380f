package io.xmldecl.core.error;

/**
 * Thrown for structural misuse of processor declarations: an empty path, {@code omitEmpty}
 * on a required processor, a missing object binding, or a processor that cannot serve as the
 * document root. Detected eagerly, independent of any document.
 */
public final class InvalidRootProcessorException extends XmlProcessingException {

    private static final long serialVersionUID = 1L;

    public InvalidRootProcessorException(String detail) {
        super(detail, "", Phase.DECLARATION);
    }

    public InvalidRootProcessorException(String detail, Throwable cause) {
        super(detail, cause, "", Phase.DECLARATION);
    }
}
