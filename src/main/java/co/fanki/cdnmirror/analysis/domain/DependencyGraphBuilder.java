package co.fanki.cdnmirror.analysis.domain;

import co.fanki.cdnmirror.catalog.domain.SemverRange;
import co.fanki.cdnmirror.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns selected releases into the ordered list of mirroring units.
 *
 * <p>A release without external peers becomes one base unit. A release
 * with external peers becomes one unit per peer permutation and no base
 * unit, because a base copy would shadow the peer-qualified answer.</p>
 *
 * <p>Depth: a base unit has depth 0; a unit with a peer context has
 * depth {@code 1 + max(depth(peer@version))} over its context, where the
 * depth of a {@code name@version} is the highest depth of its units.
 * Sorting by depth then name therefore downloads every peer before the
 * units that pin it.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DependencyGraphBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(
            DependencyGraphBuilder.class);

    /** Download order: depth, name, version, then canonical key. */
    public static final Comparator<AnalyzedDependency> DOWNLOAD_ORDER =
            Comparator.comparingInt(AnalyzedDependency::getDepth)
                    .thenComparing(AnalyzedDependency::getName)
                    .thenComparing(AnalyzedDependency::getVersion,
                            SemverRange::compare)
                    .thenComparing(AnalyzedDependency::canonicalKey);

    private final PermutationEngine permutationEngine;

    private final PeerScope peerScope;

    /**
     * Creates a new builder.
     *
     * @param thePermutationEngine the permutation engine
     * @param thePeerScope the external-peer predicate
     */
    public DependencyGraphBuilder(final PermutationEngine thePermutationEngine,
            final PeerScope thePeerScope) {
        this.permutationEngine = Preconditions.requireNonNull(
                thePermutationEngine, "Permutation engine is required");
        this.peerScope = Preconditions.requireNonNull(thePeerScope,
                "Peer scope is required");
    }

    /**
     * Builds the units of a set of releases.
     *
     * @param releases the selected releases
     * @param availableVersions the mirrored versions of every package
     * @return the units, depths assigned, in download order
     */
    public List<AnalyzedDependency> build(final List<PackageRelease> releases,
            final Map<String, List<String>> availableVersions) {
        Preconditions.requireNonNull(releases, "Releases are required");
        final List<AnalyzedDependency> units = new ArrayList<>();

        for (final PackageRelease release : releases) {
            if (!peerScope.requiresPeerContext(release.name(),
                    release.peerDependencies())) {
                units.add(new AnalyzedDependency(release.name(),
                        release.version(), release.url(), PeerContext.empty(),
                        release.peerDependencies()));
                continue;
            }
            final List<PeerContext> contexts = permutationEngine.permutations(
                    release.name(), release.peerDependencies(),
                    availableVersions);
            if (contexts.isEmpty()) {
                LOG.warn("Skipping {}@{}: no peer permutation can be"
                        + " mirrored", release.name(), release.version());
            }
            for (final PeerContext context : contexts) {
                units.add(new AnalyzedDependency(release.name(),
                        release.version(), release.url(), context,
                        release.peerDependencies()));
            }
        }

        assignDepths(units);
        units.sort(DOWNLOAD_ORDER);
        return units;
    }

    /**
     * Merges freshly built units into the units of a previous run.
     *
     * <p>Entries are matched by canonical key. A fresh entry replaces a
     * previous one with the same key but keeps its lifecycle flags;
     * previous entries without a fresh counterpart are kept; a base entry
     * is dropped when the same {@code name@version} now has
     * peer-qualified entries.</p>
     *
     * @param previous the persisted units
     * @param fresh the units of this run
     * @return the merged units, depths reassigned, in download order
     */
    public List<AnalyzedDependency> merge(
            final List<AnalyzedDependency> previous,
            final List<AnalyzedDependency> fresh) {
        final Map<String, AnalyzedDependency> byKey = new LinkedHashMap<>();
        for (final AnalyzedDependency entry : previous) {
            byKey.put(entry.canonicalKey(), entry);
        }
        int superseded = 0;
        for (final AnalyzedDependency entry : fresh) {
            final AnalyzedDependency old = byKey.get(entry.canonicalKey());
            if (old != null) {
                entry.inheritProgress(old);
                superseded++;
            }
            byKey.put(entry.canonicalKey(), entry);
        }

        final Set<String> qualified = new HashSet<>();
        for (final AnalyzedDependency entry : byKey.values()) {
            if (!entry.getPeerContext().isEmpty()) {
                qualified.add(entry.getNameVersion());
            }
        }

        final List<AnalyzedDependency> merged = new ArrayList<>();
        int dropped = 0;
        for (final AnalyzedDependency entry : byKey.values()) {
            if (entry.getPeerContext().isEmpty()
                    && qualified.contains(entry.getNameVersion())) {
                dropped++;
                continue;
            }
            merged.add(entry);
        }

        LOG.info("Merged {} fresh units into {} previous ones: {} superseded,"
                + " {} base units filtered, {} total", fresh.size(),
                previous.size(), superseded, dropped, merged.size());

        assignDepths(merged);
        merged.sort(DOWNLOAD_ORDER);
        return merged;
    }

    /**
     * Assigns the depth of every unit.
     *
     * @param units the units
     */
    public void assignDepths(final List<AnalyzedDependency> units) {
        final Map<String, List<AnalyzedDependency>> byRelease =
                new HashMap<>();
        for (final AnalyzedDependency unit : units) {
            byRelease.computeIfAbsent(unit.getNameVersion(),
                    key -> new ArrayList<>()).add(unit);
        }
        final DepthCalculator calculator = new DepthCalculator(byRelease);
        for (final AnalyzedDependency unit : units) {
            unit.assignDepth(calculator.depthOf(unit));
        }
    }

    /** Memoized depth computation with a guard against peer cycles. */
    private static final class DepthCalculator {

        private final Map<String, List<AnalyzedDependency>> byRelease;

        private final Map<String, Integer> memo = new HashMap<>();

        private final Set<String> visiting = new HashSet<>();

        private DepthCalculator(
                final Map<String, List<AnalyzedDependency>> theByRelease) {
            this.byRelease = theByRelease;
        }

        private int depthOf(final AnalyzedDependency unit) {
            if (unit.getPeerContext().isEmpty()) {
                return 0;
            }
            int deepest = 0;
            for (final Map.Entry<String, String> peer
                    : unit.getPeerContext().versions().entrySet()) {
                deepest = Math.max(deepest,
                        releaseDepth(peer.getKey() + "@" + peer.getValue()));
            }
            return deepest + 1;
        }

        private int releaseDepth(final String nameVersion) {
            final Integer known = memo.get(nameVersion);
            if (known != null) {
                return known;
            }
            if (!visiting.add(nameVersion)) {
                LOG.warn("Peer cycle through {}, counting it as depth 0",
                        nameVersion);
                return 0;
            }
            int deepest = 0;
            for (final AnalyzedDependency unit
                    : byRelease.getOrDefault(nameVersion, List.of())) {
                deepest = Math.max(deepest, depthOf(unit));
            }
            visiting.remove(nameVersion);
            memo.put(nameVersion, deepest);
            return deepest;
        }
    }

}
