package co.fanki.cdnmirror.catalog.domain;

import co.fanki.cdnmirror.shared.Preconditions;
import co.fanki.cdnmirror.shared.ValueObject;

/**
 * A package-internal entry point mirrored as its own top-level unit.
 *
 * @param name the subpath below the parent package (e.g. {@code client})
 * @param fromVersion optional npm range gating the parent versions
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record SubpathConfig(String name, String fromVersion)
        implements ValueObject {

    /**
     * Validates the config.
     *
     * @param name the subpath name
     * @param fromVersion the optional range, may be null
     */
    public SubpathConfig {
        Preconditions.requireNonBlank(name, "Subpath name is required");
    }

    /**
     * Returns the package name of this subpath under its parent.
     *
     * @param parent the parent package name
     * @return e.g. {@code react-dom/client}
     */
    public String fullName(final String parent) {
        return parent + "/" + name;
    }

    /**
     * Checks if the subpath exists in a given parent version.
     *
     * @param version the parent version
     * @return true if there is no gate or the version satisfies it
     */
    public boolean appliesTo(final String version) {
        return fromVersion == null || SemverRange.satisfies(version,
                fromVersion);
    }

}
