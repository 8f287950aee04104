package ai.policyatlas.exception;

/**
 * An attribute was present but its value could not be interpreted, e.g. {@code maxValue="lots"}. Absent attributes
 * never raise this.
 */
public final class MalformedDefinitionException extends RuntimeException {
    public MalformedDefinitionException(String message) {
        super(message);
    }

    public MalformedDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
