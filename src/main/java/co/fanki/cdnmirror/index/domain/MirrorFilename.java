package co.fanki.cdnmirror.index.domain;

import co.fanki.cdnmirror.analysis.domain.PeerContext;
import co.fanki.cdnmirror.shared.Preconditions;
import co.fanki.cdnmirror.shared.ValueObject;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The local filename of a mirrored module, and its inverse.
 *
 * <p>Grammar:</p>
 * <pre>
 * filename = unit "@" version *( "_" peer "-" peerVersion ) "_" hash ".js"
 * </pre>
 * <p>Inside names {@code /} is written as {@code +}, and inside names and
 * versions {@code _} is written as {@code ,}. Neither {@code +} nor
 * {@code ,} can occur in an npm name or a version's core, so every
 * filename decodes back to the exact name, version and peers. The hash is
 * the first eight hex digits of the MD5 of the module URL.</p>
 *
 * @param name the package name
 * @param version the locked version
 * @param peers the distinguishing peer context
 * @param hash the eight-digit URL hash
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record MirrorFilename(String name, String version, PeerContext peers,
        String hash) implements ValueObject {

    /** Extension of every mirrored module file. */
    public static final String EXTENSION = ".js";

    private static final Pattern HASH = Pattern.compile("[0-9a-f]{8}");

    private static final Pattern PEER = Pattern.compile(
            "^(.+?)-(\\d+\\.\\d+\\.\\d+\\S*|latest)$");

    /**
     * Validates the parts.
     *
     * @param name the package name
     * @param version the version
     * @param peers the peers
     * @param hash the hash
     */
    public MirrorFilename {
        Preconditions.requireNonBlank(name, "Name is required");
        Preconditions.requireNonBlank(version, "Version is required");
        Preconditions.requireNonNull(peers, "Peers are required");
        Preconditions.require(hash != null && HASH.matcher(hash).matches(),
                "Hash must be eight lowercase hex digits: " + hash);
    }

    /**
     * Names the file of a module.
     *
     * @param name the package name
     * @param version the version
     * @param peers the distinguishing peers
     * @param url the module URL, hashed into the name
     * @return the filename
     */
    public static MirrorFilename forUnit(final String name,
            final String version, final PeerContext peers, final String url) {
        return new MirrorFilename(name, version, peers, hashOf(url));
    }

    /**
     * Hashes a URL.
     *
     * @param url the URL
     * @return the first eight hex digits of its MD5
     */
    public static String hashOf(final String url) {
        try {
            final byte[] digest = MessageDigest.getInstance("MD5")
                    .digest(url.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, 8);
        } catch (final NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 is not available", e);
        }
    }

    /**
     * Parses a filename.
     *
     * @param filename the filename
     * @return the parts, empty if the name does not follow the grammar
     */
    public static Optional<MirrorFilename> parse(final String filename) {
        if (filename == null || !filename.endsWith(EXTENSION)) {
            return Optional.empty();
        }
        final String[] tokens = filename.substring(0,
                filename.length() - EXTENSION.length()).split("_", -1);
        if (tokens.length < 2) {
            return Optional.empty();
        }
        final String hash = tokens[tokens.length - 1];
        if (!HASH.matcher(hash).matches()) {
            return Optional.empty();
        }
        final String unit = tokens[0];
        final int at = unit.lastIndexOf('@');
        if (at <= 0 || at == unit.length() - 1) {
            return Optional.empty();
        }

        final TreeMap<String, String> peers = new TreeMap<>();
        for (int i = 1; i < tokens.length - 1; i++) {
            final Matcher matcher = PEER.matcher(tokens[i]);
            if (!matcher.matches()) {
                return Optional.empty();
            }
            peers.put(decodeName(matcher.group(1)),
                    decodeVersion(matcher.group(2)));
        }
        return Optional.of(new MirrorFilename(
                decodeName(unit.substring(0, at)),
                decodeVersion(unit.substring(at + 1)), PeerContext.of(peers),
                hash));
    }

    /** @return the filename text */
    public String value() {
        final StringBuilder text = new StringBuilder(encodeName(name))
                .append('@').append(encodeVersion(version));
        peers.versions().forEach((peer, peerVersion) -> text.append('_')
                .append(encodeName(peer)).append('-')
                .append(encodeVersion(peerVersion)));
        return text.append('_').append(hash).append(EXTENSION).toString();
    }

    /** @return the dep-key of the unit stored in this file */
    public DepKey depKey() {
        return DepKey.of(name, version, peers);
    }

    @Override
    public String toString() {
        return value();
    }

    private static String encodeName(final String text) {
        return text.replace('/', '+').replace('_', ',');
    }

    private static String decodeName(final String text) {
        return text.replace('+', '/').replace(',', '_');
    }

    private static String encodeVersion(final String text) {
        return text.replace('_', ',');
    }

    private static String decodeVersion(final String text) {
        return text.replace(',', '_');
    }

}
