package co.fanki.cdnmirror.catalog.domain;

import co.fanki.cdnmirror.shared.Preconditions;
import co.fanki.cdnmirror.shared.ValueObject;

/**
 * A managed package and the CDN URL template it is served from.
 *
 * @param name the npm package name, possibly scoped or a subpath
 * @param urlTemplate the CDN URL with a {@code {version}} placeholder
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record PackageSpec(String name, String urlTemplate)
        implements ValueObject {

    /** The placeholder replaced by a concrete version. */
    public static final String VERSION_PLACEHOLDER = "{version}";

    /**
     * Validates the spec.
     *
     * @param name the package name
     * @param urlTemplate the URL template
     */
    public PackageSpec {
        Preconditions.requireNonBlank(name, "Package name is required");
        Preconditions.requireNonBlank(urlTemplate,
                "URL template is required for " + name);
        Preconditions.require(urlTemplate.contains(VERSION_PLACEHOLDER),
                "URL template for " + name + " has no "
                        + VERSION_PLACEHOLDER + " placeholder");
    }

    /**
     * Builds the CDN URL of a concrete version.
     *
     * @param version the version
     * @return the URL
     */
    public String urlFor(final String version) {
        Preconditions.requireNonBlank(version, "Version is required");
        return urlTemplate.replace(VERSION_PLACEHOLDER, version);
    }

}
