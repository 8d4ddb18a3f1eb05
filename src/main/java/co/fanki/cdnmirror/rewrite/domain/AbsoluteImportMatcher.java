package co.fanki.cdnmirror.rewrite.domain;

import co.fanki.cdnmirror.analysis.domain.PeerContext;
import co.fanki.cdnmirror.catalog.domain.SemverRange;
import co.fanki.cdnmirror.fetch.domain.CdnUrls;
import co.fanki.cdnmirror.fetch.domain.PackageCoordinates;
import co.fanki.cdnmirror.shared.Preconditions;

import java.util.Collection;
import java.util.Comparator;
import java.util.Optional;

/**
 * Picks the mirrored URL that best matches a root-relative import such
 * as {@code /react@^19.1.1/jsx-runtime?target=es2022}.
 *
 * <p>A URL of the same package scores 1; an identical subpath adds 100,
 * a subpath that contains the imported one adds 50. Ties go to the URL
 * whose version satisfies the import's range, then to the URL carrying
 * the importer's peer context, then to the higher version, then to the
 * lower URL.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class AbsoluteImportMatcher {

    static final int PACKAGE_MATCH = 1;

    static final int EXACT_SUBPATH = 100;

    static final int SUBPATH_CONTAINED = 50;

    private static final Comparator<Candidate> BEST_FIRST = Comparator
            .comparingInt(Candidate::score).reversed()
            .thenComparing(Candidate::satisfies, Comparator.reverseOrder())
            .thenComparing(Candidate::contextMatch, Comparator.reverseOrder())
            .thenComparing((a, b) -> SemverRange.compare(b.version(),
                    a.version()))
            .thenComparing(Candidate::url);

    private final CdnUrls cdnUrls;

    /**
     * Creates a new matcher.
     *
     * @param theCdnUrls the CDN URL helper
     */
    public AbsoluteImportMatcher(final CdnUrls theCdnUrls) {
        this.cdnUrls = Preconditions.requireNonNull(theCdnUrls,
                "CDN URLs are required");
    }

    /**
     * Finds the best mirrored URL for an import.
     *
     * @param specifier the root-relative import
     * @param mirrored the mirrored URLs
     * @param context the peer context of the importing unit
     * @return the best URL, empty if no mirrored URL is of the package
     */
    public Optional<String> bestMatch(final String specifier,
            final Collection<String> mirrored, final PeerContext context) {
        final Optional<PackageCoordinates> imported =
                cdnUrls.coordinates(specifier);
        if (imported.isEmpty()) {
            return Optional.empty();
        }
        return mirrored.stream()
                .filter(cdnUrls::isCdnUrl)
                .map(url -> score(imported.get(), url, context))
                .flatMap(Optional::stream)
                .min(BEST_FIRST)
                .map(Candidate::url);
    }

    /**
     * Scores one mirrored URL.
     *
     * @param imported the coordinates of the import
     * @param url the mirrored URL
     * @return the score, 0 if the URL is of another package
     */
    int score(final PackageCoordinates imported, final String url) {
        final Optional<PackageCoordinates> target = cdnUrls.coordinates(url);
        if (target.isEmpty() || !target.get().name().equals(imported.name())) {
            return 0;
        }
        int score = PACKAGE_MATCH;
        final String wanted = imported.subpath();
        final String actual = target.get().subpath();
        if (!wanted.isEmpty()) {
            if (actual.equals(wanted)) {
                score += EXACT_SUBPATH;
            } else if (actual.contains(wanted)) {
                score += SUBPATH_CONTAINED;
            }
        }
        return score;
    }

    private Optional<Candidate> score(final PackageCoordinates imported,
            final String url, final PeerContext context) {
        final int score = score(imported, url);
        if (score == 0) {
            return Optional.empty();
        }
        final String version = cdnUrls.coordinates(url).orElseThrow()
                .version();
        final boolean satisfies = !SemverRange.parse(version).isEmpty()
                && !CdnUrls.UNVERSIONED.equals(imported.version())
                && SemverRange.satisfies(version, imported.version());
        final boolean contextMatch = CdnUrls.queryOf(url)
                .equals(context.toQuery());
        return Optional.of(new Candidate(url, score, satisfies, contextMatch,
                version));
    }

    private record Candidate(String url, int score, boolean satisfies,
            boolean contextMatch, String version) {
    }

}
