package co.fanki.cdnmirror.analysis.domain;

import co.fanki.cdnmirror.catalog.domain.CdnMapping;
import co.fanki.cdnmirror.catalog.domain.SemverRange;
import co.fanki.cdnmirror.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Expands the peer constraints of a package into every concrete peer
 * context it has to be mirrored for.
 *
 * <p>Each external peer contributes one slot whose values are the
 * mirrored versions of that peer satisfying its constraint. Peers that
 * share a same-version group collapse into a single slot resolved
 * against the first of them (in group order); the chosen version is
 * then written for every grouped peer the package declares. The result
 * is the Cartesian product of all slots, group slots first, with the
 * first slot varying slowest.</p>
 *
 * <p>If any slot has no compatible version the package cannot be
 * resolved with the current catalog and gets no permutation at all.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class PermutationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(
            PermutationEngine.class);

    private final CdnMapping mapping;

    private final PeerScope peerScope;

    /**
     * Creates a new engine.
     *
     * @param theMapping the catalog
     * @param thePeerScope the external-peer predicate
     */
    public PermutationEngine(final CdnMapping theMapping,
            final PeerScope thePeerScope) {
        this.mapping = Preconditions.requireNonNull(theMapping,
                "Mapping is required");
        this.peerScope = Preconditions.requireNonNull(thePeerScope,
                "Peer scope is required");
    }

    /** One combinatorial dimension: the peers it pins and their options. */
    private record Slot(List<String> peers, List<String> versions) {}

    /**
     * Computes the peer contexts of a package.
     *
     * @param packageName the package
     * @param peerDependencies its declared peer constraints
     * @param availableVersions the mirrored versions of every managed
     *        package
     * @return the contexts in deterministic order; empty when the package
     *         needs no context or cannot be resolved
     */
    public List<PeerContext> permutations(final String packageName,
            final Map<String, String> peerDependencies,
            final Map<String, List<String>> availableVersions) {
        Preconditions.requireNonBlank(packageName, "Package name is required");
        Preconditions.requireNonNull(peerDependencies,
                "Peer dependencies are required");
        Preconditions.requireNonNull(availableVersions,
                "Available versions are required");

        final Map<String, String> external = peerScope.externalPeers(
                packageName, peerDependencies);
        if (external.isEmpty()) {
            return List.of();
        }

        final List<Slot> slots = slotsFor(external, availableVersions);
        for (final Slot slot : slots) {
            if (slot.versions().isEmpty()) {
                LOG.warn("{} cannot be resolved with the current catalog:"
                        + " no mirrored version of {} satisfies {}",
                        packageName, slot.peers(),
                        external.get(slot.peers().get(0)));
                return List.of();
            }
        }

        final List<PeerContext> contexts = new ArrayList<>();
        expand(slots, 0, new TreeMap<>(), contexts);
        LOG.debug("{} has {} peer permutations over {}", packageName,
                contexts.size(), external.keySet());
        return contexts;
    }

    /**
     * Counts the permutations without building them.
     *
     * @param packageName the package
     * @param peerDependencies its declared peer constraints
     * @param availableVersions the mirrored versions of every managed
     *        package
     * @return the product of the slot sizes, 0 if no context is needed
     */
    public long count(final String packageName,
            final Map<String, String> peerDependencies,
            final Map<String, List<String>> availableVersions) {
        final Map<String, String> external = peerScope.externalPeers(
                packageName, peerDependencies);
        if (external.isEmpty()) {
            return 0;
        }
        long product = 1;
        for (final Slot slot : slotsFor(external, availableVersions)) {
            product *= slot.versions().size();
        }
        return product;
    }

    private List<Slot> slotsFor(final Map<String, String> external,
            final Map<String, List<String>> availableVersions) {
        final List<Slot> groupSlots = new ArrayList<>();
        final List<Slot> independentSlots = new ArrayList<>();
        final Set<String> assigned = new LinkedHashSet<>();

        for (final List<String> group : mapping.groups().asList()) {
            final List<String> members = new ArrayList<>();
            for (final String member : group) {
                if (external.containsKey(member)) {
                    members.add(member);
                }
            }
            if (members.isEmpty()) {
                continue;
            }
            final String primary = members.get(0);
            groupSlots.add(new Slot(members, SemverRange.filter(
                    availableVersions.getOrDefault(primary, List.of()),
                    external.get(primary))));
            assigned.addAll(members);
        }

        for (final Map.Entry<String, String> peer : external.entrySet()) {
            if (assigned.contains(peer.getKey())) {
                continue;
            }
            independentSlots.add(new Slot(List.of(peer.getKey()),
                    SemverRange.filter(availableVersions.getOrDefault(
                            peer.getKey(), List.of()), peer.getValue())));
        }

        final List<Slot> slots = new ArrayList<>(groupSlots);
        slots.addAll(independentSlots);
        return slots;
    }

    private static void expand(final List<Slot> slots, final int index,
            final TreeMap<String, String> partial,
            final List<PeerContext> out) {
        if (index == slots.size()) {
            out.add(PeerContext.of(partial));
            return;
        }
        final Slot slot = slots.get(index);
        for (final String version : slot.versions()) {
            for (final String peer : slot.peers()) {
                partial.put(peer, version);
            }
            expand(slots, index + 1, partial, out);
        }
        for (final String peer : slot.peers()) {
            partial.remove(peer);
        }
    }

}
