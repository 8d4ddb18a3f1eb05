package co.fanki.cdnmirror.rewrite.domain;

import co.fanki.cdnmirror.analysis.domain.AnalyzedDependency;
import co.fanki.cdnmirror.analysis.domain.PeerContext;
import co.fanki.cdnmirror.analysis.domain.PeerScope;
import co.fanki.cdnmirror.catalog.domain.CdnMapping;
import co.fanki.cdnmirror.fetch.domain.CdnUrls;
import co.fanki.cdnmirror.fetch.domain.ImportScanner;
import co.fanki.cdnmirror.fetch.domain.ImportSpecifier;
import co.fanki.cdnmirror.index.domain.LookupIndex;
import co.fanki.cdnmirror.index.domain.MirrorFilename;
import co.fanki.cdnmirror.index.domain.PathNode;
import co.fanki.cdnmirror.mirror.domain.MirrorStore;
import co.fanki.cdnmirror.shared.ErrorCode;
import co.fanki.cdnmirror.shared.MirrorInconsistencyException;
import co.fanki.cdnmirror.shared.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Points every import of the mirrored files at the local mirror.
 *
 * <p>Each import is replaced by the import prefix followed by the
 * filename of the module it resolves to:</p>
 * <ul>
 *   <li>CDN URLs are looked up in the URL to file map, in the importer's
 *       peer context first.</li>
 *   <li>Root-relative paths are looked up the same way, then by
 *       containment in a mirrored URL, then by the best-scoring URL of
 *       the same package.</li>
 *   <li>Relative paths are looked up in the importer's relative-import
 *       tree.</li>
 * </ul>
 *
 * <p>Imports of other hosts and bare imports are left alone. An import
 * that should resolve but does not fails the run.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ImportRewriter {

    private static final Logger LOG = LoggerFactory.getLogger(
            ImportRewriter.class);

    private static final Comparator<ImportSpecifier> LAST_FIRST =
            Comparator.comparingInt(ImportSpecifier::start).reversed();

    private final ImportScanner scanner;

    private final CdnUrls cdnUrls;

    private final AbsoluteImportMatcher matcher;

    private final String importPrefix;

    /**
     * Creates a new rewriter.
     *
     * @param theScanner the import scanner
     * @param theCdnUrls the CDN URL helper
     * @param theMatcher the best-match scorer for root-relative imports
     * @param theImportPrefix the path mirrored files are served from,
     *        e.g. {@code /dependencies/}
     */
    public ImportRewriter(final ImportScanner theScanner,
            final CdnUrls theCdnUrls, final AbsoluteImportMatcher theMatcher,
            final String theImportPrefix) {
        this.scanner = Preconditions.requireNonNull(theScanner,
                "Scanner is required");
        this.cdnUrls = Preconditions.requireNonNull(theCdnUrls,
                "CDN URLs are required");
        this.matcher = Preconditions.requireNonNull(theMatcher,
                "Matcher is required");
        this.importPrefix = Preconditions.requireNonBlank(theImportPrefix,
                "Import prefix is required");
    }

    /**
     * Rewrites the imports of every mirrored file not yet transformed and
     * flags the units it went through.
     *
     * @param index the lookup index
     * @param store the mirror directory
     * @param mapping the catalog
     * @return what the run did
     * @throws MirrorInconsistencyException if an import cannot be resolved
     */
    public Summary rewrite(final LookupIndex index, final MirrorStore store,
            final CdnMapping mapping) {
        final PeerScope scope = new PeerScope(mapping);
        final MirrorLookup lookup = new MirrorLookup(index, scope, cdnUrls);
        final Set<AnalyzedDependency> inspected = new HashSet<>();
        final Set<String> inspectedFiles = new HashSet<>();

        int files = 0;
        int skipped = 0;
        int withImports = 0;
        int replacements = 0;

        for (final String filename : store.listModuleFiles()) {
            files++;
            final Optional<MirrorFilename> parsed =
                    MirrorFilename.parse(filename);
            if (parsed.isEmpty()) {
                LOG.debug("Skipping {}: not a mirrored module name",
                        filename);
                skipped++;
                continue;
            }
            final Optional<AnalyzedDependency> owner = index.findPackage(
                    parsed.get().name(), parsed.get().version(),
                    parsed.get().peers(), scope);
            if (owner.isPresent() && owner.get().isTransformed()) {
                skipped++;
                continue;
            }
            final Optional<String> url = index.urlForFile(filename);
            if (url.isEmpty()) {
                LOG.warn("Skipping {}: no URL maps to it", filename);
                skipped++;
                continue;
            }

            final String content = store.read(filename);
            final List<ImportSpecifier> imports = new ArrayList<>(
                    scanner.scan(content).imports());
            if (!imports.isEmpty()) {
                withImports++;
            }
            final int replaced = rewriteFile(filename, url.get(),
                    parsed.get(), content, imports, index, store, lookup);
            replacements += replaced;
            owner.ifPresent(inspected::add);
            inspectedFiles.add(filename);
        }

        int transformed = 0;
        for (final AnalyzedDependency unit : index.packages()) {
            if (unit.isTransformed()) {
                continue;
            }
            if (inspected.contains(unit) || ownsInspectedFile(unit, index,
                    scope, inspectedFiles)) {
                unit.markTransformed();
                transformed++;
            }
        }

        final Summary summary = new Summary(files, skipped,
                files - skipped, withImports, replacements, transformed);
        LOG.info("Rewrote imports: {} files, {} skipped, {} processed,"
                + " {} with imports, {} replacements, {} units transformed",
                summary.files(), summary.skipped(), summary.processed(),
                summary.withImports(), summary.replacements(),
                summary.transformed());
        return summary;
    }

    private int rewriteFile(final String filename, final String url,
            final MirrorFilename parsed, final String content,
            final List<ImportSpecifier> imports, final LookupIndex index,
            final MirrorStore store, final MirrorLookup lookup) {
        final Map<String, Optional<String>> resolved = new HashMap<>();
        final StringBuilder text = new StringBuilder(content);
        imports.sort(LAST_FIRST);
        int replaced = 0;

        for (final ImportSpecifier specifier : imports) {
            final String value = specifier.value();
            if (value.startsWith(importPrefix)) {
                continue;
            }
            final Optional<String> target = resolved.computeIfAbsent(value,
                    v -> resolve(v, url, parsed, index, lookup));
            if (target.isEmpty()) {
                continue;
            }
            final String replacement = importPrefix + target.get();
            text.replace(specifier.start(), specifier.end(), replacement);
            replaced++;
            LOG.debug("{}: {} -> {}", filename, value, replacement);
        }

        if (replaced > 0) {
            store.write(filename, text.toString());
        }
        return replaced;
    }

    /**
     * Resolves one import to a mirrored filename.
     *
     * @return the filename, empty for imports that are left alone
     */
    private Optional<String> resolve(final String value, final String url,
            final MirrorFilename parsed, final LookupIndex index,
            final MirrorLookup lookup) {
        final PeerContext context = parsed.peers();

        if (value.startsWith("//") || value.startsWith("http://")
                || value.startsWith("https://")) {
            final String absolute = cdnUrls.resolve(value, url).orElseThrow();
            if (!cdnUrls.isCdnUrl(absolute)) {
                return Optional.empty();
            }
            return Optional.of(fileOf(lookup.find(absolute, context),
                    value, url, lookup.candidates(absolute, context),
                    index));
        }

        if (value.startsWith("/")) {
            final String absolute = cdnUrls.resolve(value, url).orElseThrow();
            Optional<String> key = lookup.find(absolute, context);
            if (key.isEmpty()) {
                key = findContaining(CdnUrls.stripQuery(absolute), context,
                        index);
            }
            if (key.isEmpty()) {
                key = matcher.bestMatch(value, index.urlToFile().keySet(),
                        context);
            }
            return Optional.of(fileOf(key, value, url,
                    lookup.candidates(absolute, context), index));
        }

        if (value.startsWith("./") || value.startsWith("../")) {
            final String absolute = cdnUrls.resolve(value, url).orElseThrow();
            final Optional<String> path = cdnUrls.packagePath(absolute);
            final Optional<String> leaf = path.flatMap(p ->
                    index.relativeImports(parsed.depKey())
                            .flatMap(tree -> tree.get(
                                    PathNode.segments(p))));
            return Optional.of(fileOf(leaf, value, url,
                    List.of(parsed.depKey() + ":" + path.orElse("")),
                    index));
        }

        return Optional.empty();
    }

    private static Optional<String> findContaining(final String path,
            final PeerContext context, final LookupIndex index) {
        String first = null;
        for (final String key : index.urlToFile().keySet()) {
            if (!key.contains(path)) {
                continue;
            }
            if (CdnUrls.queryOf(key).equals(context.toQuery())) {
                return Optional.of(key);
            }
            if (first == null) {
                first = key;
            }
        }
        return Optional.ofNullable(first);
    }

    private static String fileOf(final Optional<String> key,
            final String specifier, final String importer,
            final List<String> candidates, final LookupIndex index) {
        final Optional<String> file = key.flatMap(index::fileFor);
        if (file.isPresent()) {
            return file.get();
        }
        LOG.error("Import {} of {} matches no mirrored file, tried {}",
                specifier, importer, candidates);
        throw new MirrorInconsistencyException(
                "Import matches no mirrored file",
                ErrorCode.UNRESOLVED_IMPORT, specifier, importer, candidates);
    }

    private static boolean ownsInspectedFile(final AnalyzedDependency unit,
            final LookupIndex index, final PeerScope scope,
            final Set<String> inspectedFiles) {
        final String key = MirrorStore.indexKey(unit.getUrl(),
                scope.distinguishing(unit.getName(), unit.getPeerContext()));
        return index.fileFor(key).map(inspectedFiles::contains).orElse(false);
    }

    /**
     * What a rewrite run did.
     *
     * @param files the module files found
     * @param skipped the files left untouched
     * @param processed the files scanned
     * @param withImports the scanned files that have imports
     * @param replacements the imports replaced
     * @param transformed the units flagged as transformed
     */
    public record Summary(int files, int skipped, int processed,
            int withImports, int replacements, int transformed) {
    }

}
