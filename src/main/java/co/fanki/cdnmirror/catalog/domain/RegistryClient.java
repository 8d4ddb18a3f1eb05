package co.fanki.cdnmirror.catalog.domain;

/**
 * Reads package metadata from a package registry.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface RegistryClient {

    /**
     * Fetches the published versions and their peer dependencies.
     *
     * @param packageName the package name, possibly scoped
     * @return the metadata
     * @throws co.fanki.cdnmirror.shared.MirrorException with
     *         {@code REGISTRY_UNAVAILABLE} when the registry cannot answer
     */
    PackageMetadata fetchMetadata(String packageName);

}
