package co.fanki.cdnmirror.shared;

import java.util.List;

/**
 * Raised when the mirror cannot map an import or a URL to a local file.
 *
 * <p>Always fatal. The message lists the specifier, the unit that
 * referenced it and every candidate URL that was considered, so the
 * broken mapping can be diagnosed from the log alone.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class MirrorInconsistencyException extends MirrorException {

    private static final long serialVersionUID = 1L;

    private final String specifier;

    private final String resolvingUnit;

    private final List<String> candidates;

    /**
     * Creates a new inconsistency exception.
     *
     * @param message the error message
     * @param theErrorCode either UNRESOLVED_IMPORT or STRUCTURAL_INCONSISTENCY
     * @param theSpecifier the import specifier or URL that failed to map
     * @param theResolvingUnit the unit (URL or filename) being processed
     * @param theCandidates the candidate URLs that were considered
     */
    public MirrorInconsistencyException(final String message,
            final ErrorCode theErrorCode,
            final String theSpecifier,
            final String theResolvingUnit,
            final List<String> theCandidates) {
        super(describe(message, theSpecifier, theResolvingUnit, theCandidates),
                theErrorCode);
        Preconditions.require(theErrorCode.isFatal(),
                "Inconsistencies are always fatal");
        this.specifier = theSpecifier;
        this.resolvingUnit = theResolvingUnit;
        this.candidates = List.copyOf(theCandidates);
    }

    private static String describe(final String message,
            final String specifier, final String unit,
            final List<String> candidates) {
        final StringBuilder text = new StringBuilder(message)
                .append(" [specifier=").append(specifier)
                .append(", unit=").append(unit)
                .append(", candidates=");
        if (candidates.isEmpty()) {
            text.append("none");
        } else {
            text.append(candidates);
        }
        return text.append(']').toString();
    }

    /** @return the specifier that could not be mapped */
    public String getSpecifier() {
        return specifier;
    }

    /** @return the unit that referenced the specifier */
    public String getResolvingUnit() {
        return resolvingUnit;
    }

    /** @return the candidate URLs that were considered */
    public List<String> getCandidates() {
        return candidates;
    }

}
