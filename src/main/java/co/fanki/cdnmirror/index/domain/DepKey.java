package co.fanki.cdnmirror.index.domain;

import co.fanki.cdnmirror.analysis.domain.PeerContext;
import co.fanki.cdnmirror.shared.Preconditions;
import co.fanki.cdnmirror.shared.ValueObject;

/**
 * Identifies a unit for relative-import lookups.
 *
 * <p>{@code name@version}, followed by {@code _peer-version} for every
 * distinguishing peer in name order, e.g.
 * {@code framer-motion@12.23.23_react-19.2.0}.</p>
 *
 * @param value the key text
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record DepKey(String value) implements ValueObject {

    /**
     * Validates the key.
     *
     * @param value the key text
     */
    public DepKey {
        Preconditions.requireNonBlank(value, "Dep-key is required");
    }

    /**
     * Builds the key of a unit.
     *
     * @param name the package name
     * @param version the version
     * @param distinguishingPeers the peers that distinguish the unit's
     *        copies, already filtered
     * @return the key
     */
    public static DepKey of(final String name, final String version,
            final PeerContext distinguishingPeers) {
        final StringBuilder key = new StringBuilder(name).append('@')
                .append(version);
        distinguishingPeers.versions().forEach((peer, peerVersion) ->
                key.append('_').append(peer).append('-').append(peerVersion));
        return new DepKey(key.toString());
    }

    @Override
    public String toString() {
        return value;
    }

}
