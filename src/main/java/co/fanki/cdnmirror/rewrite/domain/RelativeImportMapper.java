package co.fanki.cdnmirror.rewrite.domain;

import co.fanki.cdnmirror.analysis.domain.PeerContext;
import co.fanki.cdnmirror.analysis.domain.PeerScope;
import co.fanki.cdnmirror.catalog.domain.CdnMapping;
import co.fanki.cdnmirror.fetch.domain.CdnUrls;
import co.fanki.cdnmirror.fetch.domain.ImportScanner;
import co.fanki.cdnmirror.fetch.domain.ImportSpecifier;
import co.fanki.cdnmirror.fetch.domain.PackageCoordinates;
import co.fanki.cdnmirror.index.domain.DepKey;
import co.fanki.cdnmirror.index.domain.LookupIndex;
import co.fanki.cdnmirror.index.domain.PathNode;
import co.fanki.cdnmirror.mirror.domain.MirrorStore;
import co.fanki.cdnmirror.shared.ErrorCode;
import co.fanki.cdnmirror.shared.MirrorInconsistencyException;
import co.fanki.cdnmirror.shared.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Records, per unit, where each of its relative imports points.
 *
 * <p>Every mirrored file is scanned again; each {@code ./} or {@code ../}
 * import is resolved against the file's URL and matched to a mirrored
 * URL, preferring the copy in the same peer context. The match is stored
 * in the unit's relative-import tree at the target's package path.</p>
 *
 * <p>An import that matches no mirrored URL means the mirror is broken
 * and fails the run.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class RelativeImportMapper {

    private static final Logger LOG = LoggerFactory.getLogger(
            RelativeImportMapper.class);

    private final ImportScanner scanner;

    private final CdnUrls cdnUrls;

    /**
     * Creates a new mapper.
     *
     * @param theScanner the import scanner
     * @param theCdnUrls the CDN URL helper
     */
    public RelativeImportMapper(final ImportScanner theScanner,
            final CdnUrls theCdnUrls) {
        this.scanner = Preconditions.requireNonNull(theScanner,
                "Scanner is required");
        this.cdnUrls = Preconditions.requireNonNull(theCdnUrls,
                "CDN URLs are required");
    }

    /**
     * Builds the relative-import trees of every mirrored file and merges
     * them into the index.
     *
     * @param index the lookup index
     * @param store the mirror directory
     * @param mapping the catalog
     * @return the number of relative imports recorded
     * @throws MirrorInconsistencyException if an import cannot be mapped
     */
    public int map(final LookupIndex index, final MirrorStore store,
            final CdnMapping mapping) {
        final PeerScope scope = new PeerScope(mapping);
        final MirrorLookup lookup = new MirrorLookup(index, scope, cdnUrls);
        final Map<DepKey, PathNode.Branch> trees = new LinkedHashMap<>();
        int mapped = 0;

        for (final Map.Entry<String, String> entry
                : new LinkedHashMap<>(index.urlToFile()).entrySet()) {
            final String url = entry.getKey();
            if (!cdnUrls.isCdnUrl(url) || !store.exists(entry.getValue())) {
                continue;
            }
            final List<ImportSpecifier> relative = new ArrayList<>();
            for (final ImportSpecifier specifier
                    : scanner.scan(store.read(entry.getValue())).imports()) {
                if (specifier.isRelative()) {
                    relative.add(specifier);
                }
            }
            if (relative.isEmpty()) {
                continue;
            }

            final PackageCoordinates unit = cdnUrls.identify(url);
            final PeerContext context = PeerContext.fromQuery(
                    CdnUrls.queryOf(url)).retain(mapping::isManaged);
            final DepKey depKey = DepKey.of(unit.name(), unit.version(),
                    scope.distinguishing(unit.name(), context));
            final PathNode.Branch tree = trees.computeIfAbsent(depKey,
                    key -> new PathNode.Branch());

            for (final ImportSpecifier specifier : relative) {
                final String target = resolve(specifier.value(), url,
                        context, lookup);
                tree.set(PathNode.segments(packagePath(specifier.value(),
                        url, target)), target);
                mapped++;
                LOG.debug("{}: {} -> {}", depKey, specifier.value(), target);
            }
        }

        trees.forEach(index::mergeRelativeImports);
        LOG.info("Mapped {} relative imports for {} dep-keys", mapped,
                trees.size());
        return mapped;
    }

    private String resolve(final String specifier, final String importer,
            final PeerContext context, final MirrorLookup lookup) {
        final String absolute = cdnUrls.resolve(specifier, importer)
                .orElseThrow();
        final Optional<String> match = lookup.find(absolute, context)
                .or(() -> lookup.findSameBase(absolute));
        if (match.isPresent()) {
            return match.get();
        }
        final List<String> candidates = lookup.candidates(absolute, context);
        LOG.error("Relative import {} of {} matches no mirrored URL,"
                + " tried {}", specifier, importer, candidates);
        throw new MirrorInconsistencyException(
                "Relative import matches no mirrored URL",
                ErrorCode.UNRESOLVED_IMPORT, specifier, importer, candidates);
    }

    private String packagePath(final String specifier, final String importer,
            final String target) {
        final Optional<String> path = cdnUrls.packagePath(target);
        if (path.isEmpty() || path.get().isEmpty()) {
            LOG.error("No package path in {} for {} of {}", target,
                    specifier, importer);
            throw new MirrorInconsistencyException(
                    "Matched URL has no package path",
                    ErrorCode.STRUCTURAL_INCONSISTENCY, specifier, importer,
                    List.of(target));
        }
        return path.get();
    }

}
