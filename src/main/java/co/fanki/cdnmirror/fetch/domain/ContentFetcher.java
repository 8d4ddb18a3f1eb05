package co.fanki.cdnmirror.fetch.domain;

import co.fanki.cdnmirror.analysis.domain.PeerContext;
import co.fanki.cdnmirror.shared.ErrorCode;
import co.fanki.cdnmirror.shared.MirrorException;
import co.fanki.cdnmirror.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Downloads a module and, transitively, every CDN module it imports.
 *
 * <p>Fetches are memoized by exact URL for the lifetime of the fetcher,
 * which is one run. Independent URLs are downloaded in parallel on a
 * fixed pool of {@code concurrency} threads; the calling thread acts as
 * coordinator and is the only one touching the worklist, so results are
 * stored and new URLs scheduled without further locking.</p>
 *
 * <p>A failure of the requested module propagates. A failure of a nested
 * module only drops that branch and is logged.</p>
 *
 * <p>Not thread-safe: one coordinator at a time. Call {@link #close()}
 * when the run ends.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ContentFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(
            ContentFetcher.class);

    private final ContentSource contentSource;

    private final ImportScanner scanner;

    private final CdnUrls cdnUrls;

    private final UnitStore store;

    private final ExecutorService executor;

    private final Set<String> failed = new HashSet<>();

    /** Outcome of one download task. */
    private record Attempt(String url, DependencyInfo unit,
            FetchException failure) {}

    /**
     * Creates a new fetcher.
     *
     * @param theContentSource the CDN
     * @param theScanner the import scanner
     * @param theCdnUrls the CDN URL helper
     * @param theStore the memo of known modules
     * @param concurrency the maximum number of parallel downloads
     */
    public ContentFetcher(final ContentSource theContentSource,
            final ImportScanner theScanner, final CdnUrls theCdnUrls,
            final UnitStore theStore, final int concurrency) {
        this.contentSource = Preconditions.requireNonNull(theContentSource,
                "Content source is required");
        this.scanner = Preconditions.requireNonNull(theScanner,
                "Scanner is required");
        this.cdnUrls = Preconditions.requireNonNull(theCdnUrls,
                "CDN URLs are required");
        this.store = Preconditions.requireNonNull(theStore,
                "Unit store is required");
        Preconditions.requirePositive(concurrency,
                "Concurrency must be positive");
        final AtomicInteger threads = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(concurrency, task -> {
            final Thread thread = new Thread(task,
                    "cdn-fetch-" + threads.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Fetches a module tree.
     *
     * @param url the URL of the root module
     * @return the root and every module downloaded for it
     * @throws FetchException if the root itself cannot be fetched
     */
    public FetchResult fetch(final String url) {
        Preconditions.requireNonBlank(url, "URL is required");
        final Optional<DependencyInfo> cached = store.get(url);
        if (cached.isPresent()) {
            return new FetchResult(cached.get(), List.of(), List.of());
        }
        failed.remove(url);

        final CompletionService<Attempt> completion =
                new ExecutorCompletionService<>(executor);
        final Set<String> scheduled = new HashSet<>();
        final List<DependencyInfo> fetched = new ArrayList<>();
        final List<String> failedUrls = new ArrayList<>();
        DependencyInfo root = null;

        completion.submit(() -> download(url));
        scheduled.add(url);
        int pending = 1;

        while (pending > 0) {
            final Attempt attempt = next(completion);
            pending--;

            if (attempt.failure() != null) {
                if (attempt.url().equals(url)) {
                    throw attempt.failure();
                }
                failed.add(attempt.url());
                failedUrls.add(attempt.url());
                LOG.warn("Failed to download nested module {}: {}",
                        attempt.url(), attempt.failure().getMessage());
                continue;
            }

            final DependencyInfo unit = attempt.unit();
            if (store.putIfAbsent(unit)) {
                fetched.add(unit);
            }
            if (attempt.url().equals(url)) {
                root = unit;
            }

            for (final String imported : unit.imports()) {
                if (!cdnUrls.isCdnUrl(imported)
                        || scheduled.contains(imported)
                        || failed.contains(imported)
                        || store.get(imported).isPresent()) {
                    continue;
                }
                scheduled.add(imported);
                completion.submit(() -> download(imported));
                pending++;
            }
        }

        LOG.debug("Fetched {} modules for {} ({} failed)", fetched.size(),
                url, failedUrls.size());
        return new FetchResult(root, fetched, failedUrls);
    }

    /**
     * Scans already-downloaded content into a module.
     *
     * @param url the URL the content was served from
     * @param content the content
     * @return the module with resolved imports
     */
    public DependencyInfo toUnit(final String url, final String content) {
        final ScannedModule module = scanner.scan(content);
        final List<String> imports = new ArrayList<>();
        for (final String specifier : module.specifiers()) {
            cdnUrls.resolve(specifier, url).ifPresent(imports::add);
        }
        boolean leaf = true;
        for (final String source : module.reExportSources()) {
            if ((source.startsWith("/") && !source.startsWith("//"))
                    || source.startsWith(cdnUrls.origin() + "/")) {
                leaf = false;
                break;
            }
        }
        final PackageCoordinates coordinates = cdnUrls.identify(url);
        return new DependencyInfo(coordinates.name(), coordinates.version(),
                url, content, imports, leaf, PeerContext.empty());
    }

    /** Shuts the download pool down. */
    public void close() {
        executor.shutdownNow();
    }

    private Attempt download(final String url) {
        try {
            return new Attempt(url, toUnit(url, contentSource.get(url)), null);
        } catch (final FetchException e) {
            return new Attempt(url, null, e);
        }
    }

    private static Attempt next(final CompletionService<Attempt> completion) {
        try {
            final Future<Attempt> done = completion.take();
            return done.get();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MirrorException("Interrupted while fetching modules",
                    ErrorCode.FETCH_TRANSIENT, e);
        } catch (final ExecutionException e) {
            if (e.getCause() instanceof MirrorException failure) {
                throw failure;
            }
            throw new MirrorException("Module download crashed",
                    ErrorCode.STRUCTURAL_INCONSISTENCY, e.getCause());
        }
    }

}
