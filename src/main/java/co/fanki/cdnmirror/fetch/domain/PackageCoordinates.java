package co.fanki.cdnmirror.fetch.domain;

import co.fanki.cdnmirror.shared.Preconditions;
import co.fanki.cdnmirror.shared.ValueObject;

/**
 * The package addressed by a CDN path.
 *
 * @param name the package name, possibly scoped
 * @param version the version or version constraint, as written
 * @param subpath the path after {@code name@version}, without leading
 *        slash or query; empty for the package entry point
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record PackageCoordinates(String name, String version, String subpath)
        implements ValueObject {

    /**
     * Validates the coordinates.
     *
     * @param name the package name
     * @param version the version
     * @param subpath the subpath
     */
    public PackageCoordinates {
        Preconditions.requireNonBlank(name, "Package name is required");
        Preconditions.requireNonBlank(version, "Version is required");
        subpath = subpath == null ? "" : subpath;
    }

    /** @return {@code name@version} */
    public String nameVersion() {
        return name + "@" + version;
    }

}
