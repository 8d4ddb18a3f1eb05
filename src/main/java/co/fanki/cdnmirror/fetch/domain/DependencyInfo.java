package co.fanki.cdnmirror.fetch.domain;

import co.fanki.cdnmirror.analysis.domain.PeerContext;
import co.fanki.cdnmirror.shared.Preconditions;

import java.util.List;

/**
 * A fetched module held in memory for the duration of a run.
 *
 * @param name the package the module belongs to
 * @param version the package version
 * @param url the URL the module is known by, including any peer-context
 *        query
 * @param content the module source
 * @param imports the resolved absolute URLs of its imports
 * @param leaf false if the module re-exports from the CDN
 * @param peerContext the peer context of a replicated copy, empty for a
 *        fetched base module
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record DependencyInfo(
        String name,
        String version,
        String url,
        String content,
        List<String> imports,
        boolean leaf,
        PeerContext peerContext) {

    /**
     * Validates the module.
     *
     * @param name the package name
     * @param version the version
     * @param url the URL
     * @param content the source
     * @param imports the resolved imports
     * @param leaf whether it is a leaf module
     * @param peerContext the peer context
     */
    public DependencyInfo {
        Preconditions.requireNonBlank(name, "Name is required");
        Preconditions.requireNonBlank(version, "Version is required");
        Preconditions.requireNonBlank(url, "URL is required");
        content = content == null ? "" : content;
        imports = List.copyOf(imports);
        peerContext = peerContext == null ? PeerContext.empty() : peerContext;
    }

    /**
     * Creates the peer-qualified copy of this base module.
     *
     * @param context the peer context
     * @return a module with the same content, known by the qualified URL
     */
    public DependencyInfo withPeerContext(final PeerContext context) {
        Preconditions.require(peerContext.isEmpty(),
                "Only base modules can be replicated: " + url);
        return new DependencyInfo(name, version,
                context.qualify(CdnUrls.stripQuery(url)), content, imports,
                leaf, context);
    }

}
