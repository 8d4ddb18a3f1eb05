package co.fanki.cdnmirror.fetch.domain;

import co.fanki.cdnmirror.shared.ErrorCode;
import co.fanki.cdnmirror.shared.MirrorException;

/**
 * A failed request against the CDN or the registry.
 *
 * <p>Only {@link Kind#TRANSIENT} failures are retried; once retries are
 * exhausted the failure is still transient but is reported to the caller,
 * which skips the affected unit.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class FetchException extends MirrorException {

    private static final long serialVersionUID = 1L;

    /** Failure classes of a remote request. */
    public enum Kind {

        /** Timeout, reset, refused connection, DNS failure or 5xx. */
        TRANSIENT(ErrorCode.FETCH_TRANSIENT),

        /** HTTP 404. */
        NOT_FOUND(ErrorCode.FETCH_NOT_FOUND),

        /** Any other 4xx. */
        REJECTED(ErrorCode.FETCH_REJECTED);

        private final ErrorCode errorCode;

        Kind(final ErrorCode theErrorCode) {
            this.errorCode = theErrorCode;
        }

        ErrorCode errorCode() {
            return errorCode;
        }
    }

    private final Kind kind;

    private final String url;

    /**
     * Creates a new fetch exception.
     *
     * @param theKind the failure class
     * @param theUrl the requested URL
     * @param message the error message
     * @param cause the underlying cause, may be null
     */
    public FetchException(final Kind theKind, final String theUrl,
            final String message, final Throwable cause) {
        super(message + " (" + theUrl + ")", theKind.errorCode(), cause);
        this.kind = theKind;
        this.url = theUrl;
    }

    /** @return the failure class */
    public Kind getKind() {
        return kind;
    }

    /** @return the requested URL */
    public String getUrl() {
        return url;
    }

    /**
     * Checks if the request may succeed when repeated.
     *
     * @return true for transient failures
     */
    public boolean isRetryable() {
        return kind == Kind.TRANSIENT;
    }

}
