package co.fanki.cdnmirror.analysis.domain;

import co.fanki.cdnmirror.shared.Preconditions;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * One unit of mirroring work: a package version, optionally qualified by
 * a peer context.
 *
 * <p>Identity fields are fixed at analysis time. The depth is assigned by
 * the {@link DependencyGraphBuilder}; the {@code downloaded} and
 * {@code transformed} flags are flipped by the later stages and survive
 * incremental re-analysis.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class AnalyzedDependency {

    private final String name;

    private final String version;

    private final String baseUrl;

    private final PeerContext peerContext;

    private final Map<String, String> peerDependencies;

    private int depth;

    private boolean downloaded;

    private boolean transformed;

    /**
     * Creates a fresh entry.
     *
     * @param theName the package name
     * @param theVersion the version
     * @param theUrl the CDN URL; any query is dropped and replaced by the
     *        peer context
     * @param thePeerContext the peer context, empty for a base unit
     * @param thePeerDependencies the declared peer constraints
     */
    public AnalyzedDependency(final String theName, final String theVersion,
            final String theUrl, final PeerContext thePeerContext,
            final Map<String, String> thePeerDependencies) {
        this(theName, theVersion, theUrl, thePeerContext, thePeerDependencies,
                0, false, false);
    }

    /**
     * Creates an entry with its full persisted state.
     *
     * @param theName the package name
     * @param theVersion the version
     * @param theUrl the CDN URL
     * @param thePeerContext the peer context
     * @param thePeerDependencies the declared peer constraints
     * @param theDepth the depth
     * @param isDownloaded whether the download stage finished it
     * @param isTransformed whether the rewrite stage finished it
     */
    public AnalyzedDependency(final String theName, final String theVersion,
            final String theUrl, final PeerContext thePeerContext,
            final Map<String, String> thePeerDependencies, final int theDepth,
            final boolean isDownloaded, final boolean isTransformed) {
        this.name = Preconditions.requireNonBlank(theName,
                "Package name is required");
        this.version = Preconditions.requireNonBlank(theVersion,
                "Version is required");
        Preconditions.requireNonBlank(theUrl, "URL is required");
        final int query = theUrl.indexOf('?');
        this.baseUrl = query < 0 ? theUrl : theUrl.substring(0, query);
        this.peerContext = thePeerContext == null
                ? PeerContext.empty() : thePeerContext;
        this.peerDependencies = Collections.unmodifiableMap(
                thePeerDependencies == null
                        ? new TreeMap<>() : new TreeMap<>(thePeerDependencies));
        this.depth = theDepth;
        this.downloaded = isDownloaded;
        this.transformed = isTransformed;
    }

    /** @return the package name */
    public String getName() {
        return name;
    }

    /** @return the version */
    public String getVersion() {
        return version;
    }

    /** @return the URL including the peer-context query, if any */
    public String getUrl() {
        return peerContext.qualify(baseUrl);
    }

    /** @return the URL without any query */
    public String getBaseUrl() {
        return baseUrl;
    }

    /** @return the peer context, empty for a base unit */
    public PeerContext getPeerContext() {
        return peerContext;
    }

    /** @return the declared peer constraints */
    public Map<String, String> getPeerDependencies() {
        return peerDependencies;
    }

    /** @return the depth, 0 for base units */
    public int getDepth() {
        return depth;
    }

    /** @return true once the download stage finished this unit */
    public boolean isDownloaded() {
        return downloaded;
    }

    /** @return true once the rewrite stage finished this unit */
    public boolean isTransformed() {
        return transformed;
    }

    /** @return {@code name@version} */
    public String getNameVersion() {
        return name + "@" + version;
    }

    /**
     * Returns the key used to merge entries across runs.
     *
     * @return {@code name@version} followed by {@code ?query} when the
     *         entry has a peer context
     */
    public String canonicalKey() {
        return peerContext.qualify(getNameVersion());
    }

    /**
     * Assigns the depth.
     *
     * @param theDepth the depth, non-negative
     */
    public void assignDepth(final int theDepth) {
        Preconditions.require(theDepth >= 0, "Depth cannot be negative");
        this.depth = theDepth;
    }

    /** Marks the unit as downloaded. */
    public void markDownloaded() {
        this.downloaded = true;
    }

    /** Marks the unit as transformed. */
    public void markTransformed() {
        this.transformed = true;
    }

    /**
     * Copies the lifecycle flags of an entry this one supersedes.
     *
     * @param previous the superseded entry
     */
    public void inheritProgress(final AnalyzedDependency previous) {
        this.downloaded = this.downloaded || previous.downloaded;
        this.transformed = this.transformed || previous.transformed;
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof AnalyzedDependency that)) {
            return false;
        }
        return canonicalKey().equals(that.canonicalKey());
    }

    @Override
    public int hashCode() {
        return canonicalKey().hashCode();
    }

    @Override
    public String toString() {
        return canonicalKey() + " (depth " + depth + ")";
    }

}
