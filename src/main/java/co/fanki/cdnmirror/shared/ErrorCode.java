package co.fanki.cdnmirror.shared;

/**
 * Classifies every failure the mirror pipeline reports.
 *
 * <p>The code decides how a failure propagates: transient and not-found
 * failures are skipped at package, version or permutation scope, while
 * structural and configuration failures abort the run.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum ErrorCode {

    /** Timeout, connection reset or refused, DNS failure or a 5xx status. */
    FETCH_TRANSIENT(false),

    /** The remote resource does not exist (404). */
    FETCH_NOT_FOUND(false),

    /** Any other non-success response from a remote service. */
    FETCH_REJECTED(false),

    /** The package registry could not produce metadata for a package. */
    REGISTRY_UNAVAILABLE(false),

    /** An import could not be mapped to any mirrored file. */
    UNRESOLVED_IMPORT(true),

    /** The mirror state contradicts itself. */
    STRUCTURAL_INCONSISTENCY(true),

    /** Missing or invalid configuration input. */
    CONFIGURATION(true),

    /** The lookup index could not be read or written. */
    INDEX_IO(true),

    /** Another run holds the lookup index. */
    INDEX_LOCKED(true);

    private final boolean fatal;

    ErrorCode(final boolean isFatal) {
        this.fatal = isFatal;
    }

    /**
     * Checks if a failure with this code must abort the whole run.
     *
     * @return true if fatal
     */
    public boolean isFatal() {
        return fatal;
    }

}
