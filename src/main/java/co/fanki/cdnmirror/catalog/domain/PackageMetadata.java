package co.fanki.cdnmirror.catalog.domain;

import co.fanki.cdnmirror.shared.Preconditions;

import java.util.List;
import java.util.Map;

/**
 * What the registry publishes about one package.
 *
 * @param name the package name
 * @param versions every published version string, in registry order
 * @param peerDependencies peer constraints keyed by version
 * @param latestTag the {@code latest} dist-tag, may be null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record PackageMetadata(
        String name,
        List<String> versions,
        Map<String, Map<String, String>> peerDependencies,
        String latestTag) {

    /**
     * Validates and copies the metadata.
     *
     * @param name the package name
     * @param versions the published versions
     * @param peerDependencies the per-version peer constraints
     * @param latestTag the latest tag
     */
    public PackageMetadata {
        Preconditions.requireNonBlank(name, "Package name is required");
        versions = List.copyOf(Preconditions.requireNonNull(versions,
                "Versions are required"));
        peerDependencies = Map.copyOf(Preconditions.requireNonNull(
                peerDependencies, "Peer dependencies are required"));
    }

    /**
     * Returns the peer constraints declared by one version.
     *
     * @param version the version
     * @return peer name to npm range, empty if none
     */
    public Map<String, String> peerDependenciesOf(final String version) {
        return peerDependencies.getOrDefault(version, Map.of());
    }

}
