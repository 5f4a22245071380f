package io.xmldecl.core.error;

/**
 * Raised from a user hook, either through {@code ProcessorState.raiseError} or by the engine
 * wrapping any other runtime exception that escapes a hook. The original exception, if any, is
 * kept as the cause.
 */
public final class HookFailureException extends XmlProcessingException {

    private static final long serialVersionUID = 1L;

    public HookFailureException(String detail, String location, Phase phase) {
        super(detail, location, phase);
    }

    public HookFailureException(String detail, Throwable cause, String location, Phase phase) {
        super(detail, cause, location, phase);
    }
}
