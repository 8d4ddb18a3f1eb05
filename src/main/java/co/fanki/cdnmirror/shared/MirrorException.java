package co.fanki.cdnmirror.shared;

/**
 * Base exception for mirror pipeline failures.
 *
 * <p>Carries an {@link ErrorCode} so callers can decide whether to skip
 * the affected package or abort the run.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class MirrorException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorCode errorCode;

    /**
     * Creates a new mirror exception with a message and error code.
     *
     * @param message the error message
     * @param theErrorCode the specific error code
     */
    public MirrorException(final String message, final ErrorCode theErrorCode) {
        super(message);
        this.errorCode = Preconditions.requireNonNull(theErrorCode,
                "Error code is required");
    }

    /**
     * Creates a new mirror exception with message, error code, and cause.
     *
     * @param message the error message
     * @param theErrorCode the specific error code
     * @param cause the underlying cause
     */
    public MirrorException(final String message, final ErrorCode theErrorCode,
            final Throwable cause) {
        super(message, cause);
        this.errorCode = Preconditions.requireNonNull(theErrorCode,
                "Error code is required");
    }

    /**
     * Returns the error code for this exception.
     *
     * @return the error code
     */
    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * Checks if this failure must abort the run.
     *
     * @return true if the error code is fatal
     */
    public boolean isFatal() {
        return errorCode.isFatal();
    }

}
