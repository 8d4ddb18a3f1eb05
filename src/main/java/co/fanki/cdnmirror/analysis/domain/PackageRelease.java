package co.fanki.cdnmirror.analysis.domain;

import co.fanki.cdnmirror.shared.Preconditions;

import java.util.Map;

/**
 * One selected version of a managed package, ready for graph building.
 *
 * @param name the package name
 * @param version the selected version
 * @param url the CDN URL of that version
 * @param peerDependencies the declared peer constraints
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record PackageRelease(
        String name,
        String version,
        String url,
        Map<String, String> peerDependencies) {

    /**
     * Validates the release.
     *
     * @param name the package name
     * @param version the version
     * @param url the URL
     * @param peerDependencies the peer constraints
     */
    public PackageRelease {
        Preconditions.requireNonBlank(name, "Package name is required");
        Preconditions.requireNonBlank(version, "Version is required");
        Preconditions.requireNonBlank(url, "URL is required");
        peerDependencies = peerDependencies == null
                ? Map.of() : Map.copyOf(peerDependencies);
    }

}
