package co.fanki.cdnmirror.mirror.application;

import co.fanki.cdnmirror.analysis.domain.AnalyzedDependency;
import co.fanki.cdnmirror.analysis.domain.PeerContext;
import co.fanki.cdnmirror.analysis.domain.PeerScope;
import co.fanki.cdnmirror.catalog.domain.CdnMapping;
import co.fanki.cdnmirror.catalog.domain.CdnMappingRepository;
import co.fanki.cdnmirror.fetch.domain.CdnUrls;
import co.fanki.cdnmirror.fetch.domain.ContentFetcher;
import co.fanki.cdnmirror.fetch.domain.ContentSource;
import co.fanki.cdnmirror.fetch.domain.DependencyInfo;
import co.fanki.cdnmirror.fetch.domain.FetchException;
import co.fanki.cdnmirror.fetch.domain.FetchResult;
import co.fanki.cdnmirror.fetch.domain.ImportScanner;
import co.fanki.cdnmirror.fetch.domain.InMemoryUnitStore;
import co.fanki.cdnmirror.index.domain.IndexLock;
import co.fanki.cdnmirror.index.domain.LookupIndex;
import co.fanki.cdnmirror.index.domain.LookupIndexRepository;
import co.fanki.cdnmirror.index.domain.MirrorFilename;
import co.fanki.cdnmirror.mirror.domain.ManagedSubpathTracker;
import co.fanki.cdnmirror.mirror.domain.MirrorStore;
import co.fanki.cdnmirror.mirror.domain.PeerContextReplicator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Downloads every analyzed unit that is not on disk yet.
 *
 * <p>Flow:</p>
 * <ol>
 *   <li>Fetch the module tree of each pending unit, in depth order</li>
 *   <li>Save the fetched modules into the mirror directory</li>
 *   <li>Clone the tree into the unit's peer context, if it has one</li>
 *   <li>Fetch the entry-point subpaths of managed packages met while
 *       cloning, for every context-free version</li>
 *   <li>Remove the base copies of units that need a peer context</li>
 * </ol>
 *
 * <p>A unit whose root cannot be fetched is skipped and stays pending
 * for the next run.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class MirrorDownloadService {

    private static final Logger LOG = LoggerFactory.getLogger(
            MirrorDownloadService.class);

    private final LookupIndexRepository indexRepository;
    private final CdnMappingRepository mappingRepository;
    private final ContentSource contentSource;
    private final ImportScanner scanner;
    private final CdnUrls cdnUrls;
    private final MirrorStore mirrorStore;
    private final int concurrency;

    /**
     * Creates a new MirrorDownloadService.
     *
     * @param theIndexRepository the lookup index repository
     * @param theMappingRepository the CDN mapping repository
     * @param theContentSource the CDN
     * @param theScanner the import scanner
     * @param theCdnUrls the CDN URL helper
     * @param theMirrorStore the mirror directory
     * @param theConcurrency the maximum number of parallel downloads
     */
    public MirrorDownloadService(
            final LookupIndexRepository theIndexRepository,
            final CdnMappingRepository theMappingRepository,
            final ContentSource theContentSource,
            final ImportScanner theScanner,
            final CdnUrls theCdnUrls,
            final MirrorStore theMirrorStore,
            @Value("${mirror.fetch.concurrency:8}") final int theConcurrency) {
        this.indexRepository = theIndexRepository;
        this.mappingRepository = theMappingRepository;
        this.contentSource = theContentSource;
        this.scanner = theScanner;
        this.cdnUrls = theCdnUrls;
        this.mirrorStore = theMirrorStore;
        this.concurrency = theConcurrency;
    }

    /**
     * Runs the download stage.
     *
     * @return what the stage did
     */
    public Summary download() {
        try (IndexLock lock = indexRepository.acquireLock()) {
            final CdnMapping mapping = mappingRepository.load();
            final PeerScope scope = new PeerScope(mapping);
            final LookupIndex index = indexRepository.load();

            final InMemoryUnitStore store = new InMemoryUnitStore();
            final ContentFetcher fetcher = new ContentFetcher(contentSource,
                    scanner, cdnUrls, store, concurrency);
            final PeerContextReplicator replicator =
                    new PeerContextReplicator(store, cdnUrls);
            final ManagedSubpathTracker tracker = new ManagedSubpathTracker(
                    cdnUrls, mapping::isManaged);

            final Counters counters = new Counters();
            try {
                for (final AnalyzedDependency unit : index.packages()) {
                    if (unit.isDownloaded()) {
                        continue;
                    }
                    downloadUnit(unit, fetcher, replicator, tracker, index,
                            scope, counters);
                }
                downloadManagedSubpaths(tracker, fetcher, index, scope,
                        counters);
            } finally {
                fetcher.close();
            }
            final int removed = removeBaseCopies(index, scope);

            indexRepository.save(index);

            final Summary summary = new Summary(counters.units,
                    counters.skipped, counters.fetched, counters.saved,
                    removed);
            LOG.info("Download finished: {} units, {} skipped, {} modules"
                    + " fetched, {} files saved, {} base copies removed",
                    summary.units(), summary.skipped(), summary.fetched(),
                    summary.saved(), summary.removed());
            return summary;
        }
    }

    private void downloadUnit(final AnalyzedDependency unit,
            final ContentFetcher fetcher,
            final PeerContextReplicator replicator,
            final ManagedSubpathTracker tracker, final LookupIndex index,
            final PeerScope scope, final Counters counters) {
        final FetchResult result;
        try {
            result = fetcher.fetch(unit.getBaseUrl());
        } catch (final FetchException e) {
            LOG.warn("Skipping {}: {}", unit.canonicalKey(), e.getMessage());
            counters.skipped++;
            return;
        }
        counters.fetched += result.fetched().size();
        counters.saved += saveAll(result.fetched(), index, scope);

        final PeerContext context = unit.getPeerContext();
        if (!context.isEmpty()) {
            counters.saved += saveAll(replicator.replicate(result.root(),
                    context, tracker), index, scope);
        }
        unit.markDownloaded();
        counters.units++;
        LOG.info("Downloaded {} ({} new modules, {} failed)",
                unit.canonicalKey(), result.fetched().size(),
                result.failedUrls().size());
    }

    private void downloadManagedSubpaths(final ManagedSubpathTracker tracker,
            final ContentFetcher fetcher, final LookupIndex index,
            final PeerScope scope, final Counters counters) {
        for (final Map.Entry<String, Set<String>> entry
                : tracker.subpaths().entrySet()) {
            final Set<String> versions = new TreeSet<>();
            for (final AnalyzedDependency unit : index.packages()) {
                if (unit.getName().equals(entry.getKey())
                        && unit.getPeerContext().isEmpty()) {
                    versions.add(unit.getVersion());
                }
            }
            for (final String version : versions) {
                for (final String subpath : entry.getValue()) {
                    final String url = cdnUrls.origin() + "/"
                            + entry.getKey() + "@" + version + "/" + subpath;
                    try {
                        final FetchResult result = fetcher.fetch(url);
                        counters.fetched += result.fetched().size();
                        counters.saved += saveAll(result.fetched(), index,
                                scope);
                    } catch (final FetchException e) {
                        LOG.warn("Skipping managed subpath {}: {}", url,
                                e.getMessage());
                    }
                }
            }
        }
    }

    /**
     * Deletes the context-free files of every package version that is
     * mirrored per peer context.
     */
    private int removeBaseCopies(final LookupIndex index,
            final PeerScope scope) {
        final Set<String> contextual = new HashSet<>();
        for (final AnalyzedDependency unit : index.packages()) {
            if (!scope.distinguishing(unit.getName(), unit.getPeerContext())
                    .isEmpty()) {
                contextual.add(unit.getNameVersion());
            }
        }
        if (contextual.isEmpty()) {
            return 0;
        }

        int removed = 0;
        final Map<String, String> urls = new LinkedHashMap<>(
                index.urlToFile());
        for (final Map.Entry<String, String> entry : urls.entrySet()) {
            final Optional<MirrorFilename> parsed =
                    MirrorFilename.parse(entry.getValue());
            if (parsed.isEmpty() || !parsed.get().peers().isEmpty()) {
                continue;
            }
            final String nameVersion = parsed.get().name() + "@"
                    + parsed.get().version();
            if (contextual.contains(nameVersion)) {
                mirrorStore.delete(entry.getValue());
                index.removeUrl(entry.getKey());
                removed++;
                LOG.debug("Removed base copy {}", entry.getKey());
            }
        }
        return removed;
    }

    private int saveAll(final List<DependencyInfo> modules,
            final LookupIndex index, final PeerScope scope) {
        int saved = 0;
        for (final DependencyInfo module : modules) {
            if (mirrorStore.save(module, index, scope).isPresent()) {
                saved++;
            }
        }
        return saved;
    }

    /** Mutable tallies of one run. */
    private static final class Counters {
        private int units;
        private int skipped;
        private int fetched;
        private int saved;
    }

    /**
     * What a download run did.
     *
     * @param units the units downloaded
     * @param skipped the units whose root could not be fetched
     * @param fetched the modules fetched from the CDN
     * @param saved the files written
     * @param removed the base copies deleted
     */
    public record Summary(int units, int skipped, int fetched, int saved,
            int removed) {
    }

}
