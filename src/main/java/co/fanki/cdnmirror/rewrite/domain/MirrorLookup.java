package co.fanki.cdnmirror.rewrite.domain;

import co.fanki.cdnmirror.analysis.domain.PeerContext;
import co.fanki.cdnmirror.analysis.domain.PeerScope;
import co.fanki.cdnmirror.fetch.domain.CdnUrls;
import co.fanki.cdnmirror.index.domain.LookupIndex;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds the mirrored URL an absolute import refers to, from the point of
 * view of a unit with a given peer context.
 *
 * <p>Order: the URL qualified with the peers that distinguish the
 * target, then the exact URL, then the URL without its query.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
final class MirrorLookup {

    private final LookupIndex index;

    private final PeerScope scope;

    private final CdnUrls cdnUrls;

    MirrorLookup(final LookupIndex theIndex, final PeerScope theScope,
            final CdnUrls theCdnUrls) {
        this.index = theIndex;
        this.scope = theScope;
        this.cdnUrls = theCdnUrls;
    }

    /**
     * Resolves a URL to a mirrored key.
     *
     * @param url the absolute URL
     * @param context the peer context of the importing unit
     * @return the key in the URL to file map, empty if not mirrored
     */
    Optional<String> find(final String url, final PeerContext context) {
        for (final String candidate : candidates(url, context)) {
            if (index.fileFor(candidate).isPresent()) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Lists the keys {@link #find} tries, in order.
     *
     * @param url the absolute URL
     * @param context the peer context of the importing unit
     * @return the candidate keys
     */
    List<String> candidates(final String url, final PeerContext context) {
        final List<String> candidates = new ArrayList<>();
        final String base = CdnUrls.stripQuery(url);
        if (!context.isEmpty()) {
            final PeerContext distinguishing = scope.distinguishing(
                    cdnUrls.identify(url).name(), context);
            if (!distinguishing.isEmpty()) {
                candidates.add(distinguishing.qualify(base));
            }
        }
        if (!candidates.contains(url)) {
            candidates.add(url);
        }
        if (!candidates.contains(base)) {
            candidates.add(base);
        }
        return candidates;
    }

    /**
     * Finds any mirrored variant of a URL.
     *
     * @param url the absolute URL
     * @return the first key, in lexicographic order, whose base URL is the
     *         URL's base
     */
    Optional<String> findSameBase(final String url) {
        final String base = CdnUrls.stripQuery(url);
        for (final Map.Entry<String, String> entry
                : index.urlToFile().entrySet()) {
            if (CdnUrls.stripQuery(entry.getKey()).equals(base)) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

}
