package co.fanki.cdnmirror.analysis.application;

import co.fanki.cdnmirror.analysis.domain.AnalyzedDependency;
import co.fanki.cdnmirror.analysis.domain.DependencyGraphBuilder;
import co.fanki.cdnmirror.analysis.domain.PackageRelease;
import co.fanki.cdnmirror.analysis.domain.PeerScope;
import co.fanki.cdnmirror.analysis.domain.PermutationEngine;
import co.fanki.cdnmirror.catalog.domain.CdnMapping;
import co.fanki.cdnmirror.catalog.domain.CdnMappingRepository;
import co.fanki.cdnmirror.catalog.domain.PackageMetadata;
import co.fanki.cdnmirror.catalog.domain.PackageSpec;
import co.fanki.cdnmirror.catalog.domain.RegistryClient;
import co.fanki.cdnmirror.catalog.domain.SubpathConfig;
import co.fanki.cdnmirror.catalog.domain.VersionSelector;
import co.fanki.cdnmirror.index.domain.IndexLock;
import co.fanki.cdnmirror.index.domain.LookupIndex;
import co.fanki.cdnmirror.index.domain.LookupIndexRepository;
import co.fanki.cdnmirror.shared.MirrorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Decides what the mirror must contain.
 *
 * <p>Flow:</p>
 * <ol>
 *   <li>Fetch the registry metadata of every managed package</li>
 *   <li>Select the representative versions the CDN serves</li>
 *   <li>Derive the versions of the standalone subpaths from their
 *       parents</li>
 *   <li>Expand every release into its peer permutations</li>
 *   <li>Merge the units into the previous index and save it</li>
 * </ol>
 *
 * <p>A package whose metadata cannot be fetched is skipped; the versions
 * recorded for it by a previous run are still used to resolve the peers
 * of other packages.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class DependencyAnalysisService {

    private static final Logger LOG = LoggerFactory.getLogger(
            DependencyAnalysisService.class);

    private final LookupIndexRepository indexRepository;
    private final CdnMappingRepository mappingRepository;
    private final RegistryClient registryClient;
    private final VersionSelector versionSelector;

    /**
     * Creates a new DependencyAnalysisService.
     *
     * @param theIndexRepository the lookup index repository
     * @param theMappingRepository the CDN mapping repository
     * @param theRegistryClient the package registry
     * @param theVersionSelector the version selector
     */
    public DependencyAnalysisService(
            final LookupIndexRepository theIndexRepository,
            final CdnMappingRepository theMappingRepository,
            final RegistryClient theRegistryClient,
            final VersionSelector theVersionSelector) {
        this.indexRepository = theIndexRepository;
        this.mappingRepository = theMappingRepository;
        this.registryClient = theRegistryClient;
        this.versionSelector = theVersionSelector;
    }

    /**
     * Runs the analysis stage.
     *
     * @return what the stage did
     */
    public Summary analyze() {
        try (IndexLock lock = indexRepository.acquireLock()) {
            final CdnMapping mapping = mappingRepository.load();
            final LookupIndex index = indexRepository.loadOrEmpty();
            final PeerScope scope = new PeerScope(mapping);
            final PermutationEngine engine = new PermutationEngine(mapping,
                    scope);
            final DependencyGraphBuilder builder = new DependencyGraphBuilder(
                    engine, scope);

            final Map<String, List<String>> selected = new LinkedHashMap<>();
            final Map<String, PackageMetadata> metadataByName =
                    new LinkedHashMap<>();
            final List<PackageRelease> releases = new ArrayList<>();
            int skipped = 0;

            for (final String name : mapping.packageNames()) {
                if (mapping.isStandaloneSubpath(name)) {
                    continue;
                }
                final PackageSpec spec = mapping.spec(name).orElseThrow();
                final PackageMetadata metadata;
                try {
                    metadata = registryClient.fetchMetadata(name);
                } catch (final MirrorException e) {
                    LOG.warn("Skipping {}: {}", name, e.getMessage());
                    skipped++;
                    continue;
                }
                final List<String> versions = versionSelector.select(spec,
                        metadata);
                selected.put(name, versions);
                metadataByName.put(name, metadata);
                for (final String version : versions) {
                    releases.add(new PackageRelease(name, version,
                            spec.urlFor(version),
                            metadata.peerDependenciesOf(version)));
                }
            }

            addStandaloneSubpaths(mapping, selected, metadataByName,
                    releases);

            final Map<String, List<String>> available = new LinkedHashMap<>(
                    index.availableVersions());
            available.putAll(selected);
            logPermutations(engine, releases, available);

            final List<AnalyzedDependency> fresh = builder.build(releases,
                    available);
            final List<AnalyzedDependency> merged = builder.merge(
                    index.packages(), fresh);

            index.replacePackages(merged);
            selected.forEach(index::putAvailableVersions);
            index.setStandaloneSubpaths(mapping.standaloneSubpaths());
            indexRepository.save(index);

            logDepths(merged);
            final Summary summary = new Summary(selected.size(), skipped,
                    fresh.size(), merged.size());
            LOG.info("Analysis finished: {} packages analyzed, {} skipped,"
                    + " {} fresh units, {} units in index",
                    summary.packages(), summary.skipped(),
                    summary.freshUnits(), summary.totalUnits());
            return summary;
        }
    }

    private void addStandaloneSubpaths(final CdnMapping mapping,
            final Map<String, List<String>> selected,
            final Map<String, PackageMetadata> metadataByName,
            final List<PackageRelease> releases) {
        for (final Map.Entry<String, List<SubpathConfig>> entry
                : mapping.standaloneSubpaths().entrySet()) {
            final String parent = entry.getKey();
            final List<String> parentVersions = selected.get(parent);
            if (parentVersions == null) {
                LOG.warn("Skipping standalone subpaths of {}: the package"
                        + " was not analyzed", parent);
                continue;
            }
            for (final SubpathConfig config : entry.getValue()) {
                final String name = config.fullName(parent);
                final Optional<PackageSpec> spec = mapping.spec(name);
                if (spec.isEmpty()) {
                    LOG.warn("Skipping standalone subpath {}: no URL"
                            + " template in packages", name);
                    continue;
                }
                final List<String> versions = new ArrayList<>();
                for (final String version : parentVersions) {
                    if (config.appliesTo(version)) {
                        versions.add(version);
                    }
                }
                if (versions.isEmpty()) {
                    LOG.info("Skipping standalone subpath {}: no version of"
                            + " {} matches {}", name, parent,
                            config.fromVersion());
                    continue;
                }
                selected.put(name, versions);
                final PackageMetadata metadata = metadataByName.get(parent);
                for (final String version : versions) {
                    releases.add(new PackageRelease(name, version,
                            spec.get().urlFor(version),
                            metadata.peerDependenciesOf(version)));
                }
            }
        }
    }

    private static void logPermutations(final PermutationEngine engine,
            final List<PackageRelease> releases,
            final Map<String, List<String>> available) {
        for (final PackageRelease release : releases) {
            LOG.info("{}@{}: {} peer dependencies, {} permutations",
                    release.name(), release.version(),
                    release.peerDependencies().size(),
                    engine.count(release.name(), release.peerDependencies(),
                            available));
        }
    }

    private static void logDepths(final List<AnalyzedDependency> units) {
        final Map<Integer, Integer> byDepth = new TreeMap<>();
        for (final AnalyzedDependency unit : units) {
            byDepth.merge(unit.getDepth(), 1, Integer::sum);
        }
        LOG.info("Depth distribution: {}", byDepth);
    }

    /**
     * What an analysis run did.
     *
     * @param packages the packages with selected versions, standalone
     *        subpaths included
     * @param skipped the packages skipped for registry failures
     * @param freshUnits the units built by this run
     * @param totalUnits the units in the index after merging
     */
    public record Summary(int packages, int skipped, int freshUnits,
            int totalUnits) {
    }

}
