package co.fanki.cdnmirror.mirror.domain;

import co.fanki.cdnmirror.analysis.domain.PeerContext;
import co.fanki.cdnmirror.fetch.domain.CdnUrls;
import co.fanki.cdnmirror.fetch.domain.DependencyInfo;
import co.fanki.cdnmirror.fetch.domain.UnitStore;
import co.fanki.cdnmirror.shared.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Clones a fetched module tree into a peer context.
 *
 * <p>The copies have the same content as the base modules and are known
 * by the base URL qualified with the peer context. Modules of a pinned
 * peer are not cloned: the pinned version is mirrored on its own.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class PeerContextReplicator {

    private static final Logger LOG = LoggerFactory.getLogger(
            PeerContextReplicator.class);

    private final UnitStore store;

    private final CdnUrls cdnUrls;

    /**
     * Creates a new replicator.
     *
     * @param theStore the modules fetched in this run
     * @param theCdnUrls the CDN URL helper
     */
    public PeerContextReplicator(final UnitStore theStore,
            final CdnUrls theCdnUrls) {
        this.store = Preconditions.requireNonNull(theStore,
                "Unit store is required");
        this.cdnUrls = Preconditions.requireNonNull(theCdnUrls,
                "CDN URLs are required");
    }

    /**
     * Replicates a base module and every CDN module it reaches.
     *
     * @param root the fetched base module
     * @param context the peer context, non-empty
     * @param tracker collects managed entry points that are not cloned
     * @return the new copies, root first; empty if the root was already
     *         replicated in this context
     */
    public List<DependencyInfo> replicate(final DependencyInfo root,
            final PeerContext context, final ManagedSubpathTracker tracker) {
        Preconditions.requireNonNull(root, "Root module is required");
        Preconditions.require(!context.isEmpty(),
                "Replication needs a peer context");

        final List<DependencyInfo> copies = new ArrayList<>();
        final Deque<DependencyInfo> pending = new ArrayDeque<>();
        final Set<String> visited = new HashSet<>();
        pending.push(root);
        visited.add(root.url());

        while (!pending.isEmpty()) {
            final DependencyInfo base = pending.pop();
            final DependencyInfo copy = base.withPeerContext(context);
            if (!store.putIfAbsent(copy)) {
                continue;
            }
            copies.add(copy);

            for (final String imported : base.imports()) {
                if (!cdnUrls.isCdnUrl(imported) || visited.contains(imported)
                        || tracker.track(imported)) {
                    continue;
                }
                final Optional<DependencyInfo> nested = store.get(imported);
                if (nested.isEmpty()) {
                    LOG.debug("Not replicating {}: it was not fetched",
                            imported);
                    continue;
                }
                if (context.pins(nested.get().name())) {
                    continue;
                }
                visited.add(imported);
                pending.push(nested.get());
            }
        }
        LOG.debug("Replicated {} modules of {} into {}", copies.size(),
                root.url(), context);
        return copies;
    }

}
