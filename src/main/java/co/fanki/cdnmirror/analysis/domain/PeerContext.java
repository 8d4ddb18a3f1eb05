package co.fanki.cdnmirror.analysis.domain;

import co.fanki.cdnmirror.shared.Preconditions;
import co.fanki.cdnmirror.shared.ValueObject;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.StringJoiner;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * A concrete choice of peer versions qualifying a mirrored copy.
 *
 * <p>Entries are always kept sorted by peer name, so the query string,
 * the canonical key and the filename suffix of equal contexts are
 * byte-identical. An empty context means "shared base copy".</p>
 *
 * @param versions peer name to concrete version, sorted by name
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record PeerContext(SortedMap<String, String> versions)
        implements ValueObject {

    private static final PeerContext EMPTY = new PeerContext(new TreeMap<>());

    /**
     * Copies and freezes the entries.
     *
     * @param versions the peer versions
     */
    public PeerContext {
        Preconditions.requireNonNull(versions, "Peer versions are required");
        final TreeMap<String, String> copy = new TreeMap<>();
        for (final Map.Entry<String, String> entry : versions.entrySet()) {
            Preconditions.requireNonBlank(entry.getKey(),
                    "Peer name is required");
            Preconditions.requireNonBlank(entry.getValue(),
                    "Peer version is required for " + entry.getKey());
            copy.put(entry.getKey(), entry.getValue());
        }
        versions = Collections.unmodifiableSortedMap(copy);
    }

    /** @return the empty context */
    public static PeerContext empty() {
        return EMPTY;
    }

    /**
     * Creates a context from any map.
     *
     * @param versions peer name to version
     * @return the context
     */
    public static PeerContext of(final Map<String, String> versions) {
        if (versions == null || versions.isEmpty()) {
            return EMPTY;
        }
        return new PeerContext(new TreeMap<>(versions));
    }

    /**
     * Parses a {@code name=version&...} query string.
     *
     * <p>Parameters without a value are ignored.</p>
     *
     * @param query the query, without the leading question mark; may be null
     * @return the context
     */
    public static PeerContext fromQuery(final String query) {
        if (query == null || query.isBlank()) {
            return EMPTY;
        }
        final TreeMap<String, String> versions = new TreeMap<>();
        for (final String pair : query.split("&")) {
            final int eq = pair.indexOf('=');
            if (eq <= 0 || eq == pair.length() - 1) {
                continue;
            }
            versions.put(pair.substring(0, eq), pair.substring(eq + 1));
        }
        return of(versions);
    }

    /** @return true if no peer is pinned */
    public boolean isEmpty() {
        return versions.isEmpty();
    }

    /**
     * Checks if a peer is pinned by this context.
     *
     * @param peerName the peer name
     * @return true if pinned
     */
    public boolean pins(final String peerName) {
        return versions.containsKey(peerName);
    }

    /**
     * Returns the version pinned for a peer.
     *
     * @param peerName the peer name
     * @return the version, null if not pinned
     */
    public String versionOf(final String peerName) {
        return versions.get(peerName);
    }

    /**
     * Keeps only the peers accepted by a predicate.
     *
     * @param keep the predicate over peer names
     * @return the filtered context
     */
    public PeerContext retain(final Predicate<String> keep) {
        final TreeMap<String, String> kept = new TreeMap<>();
        versions.forEach((name, version) -> {
            if (keep.test(name)) {
                kept.put(name, version);
            }
        });
        return of(kept);
    }

    /** @return the sorted {@code name=version&...} query, empty if none */
    public String toQuery() {
        final StringJoiner joiner = new StringJoiner("&");
        versions.forEach((name, version) -> joiner.add(name + "=" + version));
        return joiner.toString();
    }

    /**
     * Appends this context as a query to a URL without query.
     *
     * @param baseUrl the URL
     * @return the URL itself when empty, else {@code baseUrl?query}
     */
    public String qualify(final String baseUrl) {
        return isEmpty() ? baseUrl : baseUrl + "?" + toQuery();
    }

    @Override
    public String toString() {
        return versions.toString();
    }

}
