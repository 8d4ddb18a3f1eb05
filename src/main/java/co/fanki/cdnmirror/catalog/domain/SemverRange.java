package co.fanki.cdnmirror.catalog.domain;

import com.vdurmont.semver4j.Requirement;
import com.vdurmont.semver4j.Semver;
import com.vdurmont.semver4j.SemverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * npm-flavoured semantic version helpers backed by semver4j.
 *
 * <p>Published versions are parsed strictly. Constraints are parsed with
 * npm range rules ({@code ^}, {@code ~}, {@code ||}, hyphen and x-ranges).
 * An unparseable constraint matches nothing; it is logged and never
 * thrown, because one package with a malformed peer range must not stop
 * the analysis of the others.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SemverRange {

    private static final Logger LOG = LoggerFactory.getLogger(
            SemverRange.class);

    private SemverRange() {
    }

    /**
     * Checks if a constraint accepts any version.
     *
     * @param constraint the peer constraint, may be null
     * @return true for blank, {@code *} and {@code x} constraints
     */
    public static boolean isWildcard(final String constraint) {
        if (constraint == null) {
            return true;
        }
        final String trimmed = constraint.trim();
        return trimmed.isEmpty() || "*".equals(trimmed)
                || "x".equalsIgnoreCase(trimmed);
    }

    /**
     * Parses a published version strictly.
     *
     * @param version the version string
     * @return the parsed version, empty if it is not strict semver
     */
    public static Optional<Semver> parse(final String version) {
        if (version == null || version.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new Semver(version, Semver.SemverType.STRICT));
        } catch (final SemverException e) {
            return Optional.empty();
        }
    }

    /**
     * Checks if a version is a stable release (no pre-release suffix).
     *
     * @param version the parsed version
     * @return true if stable
     */
    public static boolean isStable(final Semver version) {
        return version.getSuffixTokens() == null
                || version.getSuffixTokens().length == 0;
    }

    /**
     * Checks if a version satisfies an npm range.
     *
     * @param version the concrete version
     * @param constraint the npm range
     * @return true if the version is inside the range
     */
    public static boolean satisfies(final String version,
            final String constraint) {
        if (isWildcard(constraint)) {
            return true;
        }
        final Optional<Semver> parsed = parse(version);
        if (parsed.isEmpty()) {
            return false;
        }
        try {
            return Requirement.buildNPM(constraint.trim())
                    .isSatisfiedBy(parsed.get());
        } catch (final SemverException e) {
            LOG.warn("Invalid version constraint '{}': {}", constraint,
                    e.getMessage());
            return false;
        }
    }

    /**
     * Keeps the versions that satisfy a constraint, preserving order.
     *
     * @param versions the candidate versions
     * @param constraint the npm range
     * @return the compatible versions
     */
    public static List<String> filter(final List<String> versions,
            final String constraint) {
        final List<String> compatible = new ArrayList<>();
        for (final String version : versions) {
            if (satisfies(version, constraint)) {
                compatible.add(version);
            }
        }
        return compatible;
    }

    /**
     * Compares two version strings, ordering unparseable ones first.
     *
     * @param left the first version
     * @param right the second version
     * @return negative, zero or positive as for {@link Comparable}
     */
    public static int compare(final String left, final String right) {
        final Optional<Semver> a = parse(left);
        final Optional<Semver> b = parse(right);
        if (a.isPresent() && b.isPresent()) {
            return a.get().compareTo(b.get());
        }
        if (a.isPresent()) {
            return 1;
        }
        if (b.isPresent()) {
            return -1;
        }
        return left.compareTo(right);
    }

}
