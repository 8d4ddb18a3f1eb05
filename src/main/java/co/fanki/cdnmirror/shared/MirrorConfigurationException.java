package co.fanki.cdnmirror.shared;

/**
 * Raised at startup when required configuration input is missing or
 * malformed.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class MirrorConfigurationException extends MirrorException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new configuration exception.
     *
     * @param message the error message
     */
    public MirrorConfigurationException(final String message) {
        super(message, ErrorCode.CONFIGURATION);
    }

    /**
     * Creates a new configuration exception with its cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public MirrorConfigurationException(final String message,
            final Throwable cause) {
        super(message, ErrorCode.CONFIGURATION, cause);
    }

}
