package co.fanki.cdnmirror.analysis.domain;

import co.fanki.cdnmirror.catalog.domain.CdnMapping;
import co.fanki.cdnmirror.catalog.domain.SemverRange;
import co.fanki.cdnmirror.shared.Preconditions;

import java.util.Map;
import java.util.TreeMap;

/**
 * Decides which peers of a package are external, that is, which peers
 * force the package to be mirrored once per peer version.
 *
 * <p>A peer is internal when its constraint is a wildcard, when it is
 * not a managed package, when it is the package itself, or when it is in
 * the package's own same-version group. A package that belongs to a
 * same-version group never needs a peer context: the group pins its
 * peers. A standalone subpath shares the rule of its parent
 * package.</p>
 *
 * <p>This is the one place that rule lives. Analysis, filenames, lookup
 * keys, dep-keys, base copy cleanup and the transformed flag all go
 * through it.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class PeerScope {

    private final CdnMapping mapping;

    /**
     * Creates the predicate over a catalog.
     *
     * @param theMapping the catalog
     */
    public PeerScope(final CdnMapping theMapping) {
        this.mapping = Preconditions.requireNonNull(theMapping,
                "Mapping is required");
    }

    /**
     * Checks if a peer is external to a package, ignoring its constraint.
     *
     * @param packageName the depending package
     * @param peerName the peer
     * @return true if managed, not the package itself and not grouped
     *         with it
     */
    public boolean isExternal(final String packageName,
            final String peerName) {
        final String owner = mapping.ownerOf(packageName);
        return mapping.isManaged(peerName)
                && !peerName.equals(packageName)
                && !peerName.equals(owner)
                && !mapping.groups().areGrouped(owner, peerName);
    }

    /**
     * Checks if a declared peer dependency is external.
     *
     * @param packageName the depending package
     * @param peerName the peer
     * @param constraint the declared npm range
     * @return true if the constraint is not a wildcard and the peer is
     *         external
     */
    public boolean isExternal(final String packageName, final String peerName,
            final String constraint) {
        return !SemverRange.isWildcard(constraint)
                && isExternal(packageName, peerName);
    }

    /**
     * Returns the external peer dependencies of a package.
     *
     * @param packageName the package
     * @param peerDependencies the declared peer constraints
     * @return the external ones, sorted by name; empty for group members
     */
    public Map<String, String> externalPeers(final String packageName,
            final Map<String, String> peerDependencies) {
        final Map<String, String> external = new TreeMap<>();
        if (mapping.groups().isGroupMember(mapping.ownerOf(packageName))) {
            return external;
        }
        peerDependencies.forEach((peer, constraint) -> {
            if (isExternal(packageName, peer, constraint)) {
                external.put(peer, constraint);
            }
        });
        return external;
    }

    /**
     * Checks if a package must be mirrored per peer context.
     *
     * @param packageName the package
     * @param peerDependencies the declared peer constraints
     * @return true if it has at least one external peer
     */
    public boolean requiresPeerContext(final String packageName,
            final Map<String, String> peerDependencies) {
        return !externalPeers(packageName, peerDependencies).isEmpty();
    }

    /**
     * Reduces a peer context to the peers that distinguish copies of a
     * given unit.
     *
     * @param unitName the unit the context qualifies
     * @param context the full context
     * @return the external part of the context
     */
    public PeerContext distinguishing(final String unitName,
            final PeerContext context) {
        return context.retain(peer -> isExternal(unitName, peer));
    }

}
