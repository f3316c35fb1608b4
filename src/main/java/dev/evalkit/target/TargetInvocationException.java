package dev.evalkit.target;

/** A target could not produce output. */
public class TargetInvocationException extends RuntimeException {

    public TargetInvocationException(String message) {
        super(message);
    }

    public TargetInvocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
