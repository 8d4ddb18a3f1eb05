package co.fanki.cdnmirror.fetch.domain;

import co.fanki.cdnmirror.shared.Preconditions;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * URL arithmetic for one CDN origin.
 *
 * <p>Works on plain strings: CDN paths carry characters such as the caret
 * of a version range that {@link java.net.URI} rejects, and the exact
 * text of a URL is what keys the lookup index.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class CdnUrls {

    /** Version used for CDN paths that do not name one. */
    public static final String UNVERSIONED = "latest";

    private static final Pattern RANGE_PREFIX = Pattern.compile(
            "^(/(?:@[^/@?]+/)?[^/@?]+@)[\\^~]");

    private static final Pattern BUILD_TARGET = Pattern.compile(
            "es\\d{4}|esnext|denonext");

    private final String origin;

    /**
     * Creates the helper for a CDN.
     *
     * @param theBaseUrl the CDN origin, e.g. {@code https://esm.sh}
     */
    public CdnUrls(final String theBaseUrl) {
        Preconditions.requireNonBlank(theBaseUrl, "CDN base URL is required");
        this.origin = theBaseUrl.endsWith("/")
                ? theBaseUrl.substring(0, theBaseUrl.length() - 1)
                : theBaseUrl;
        Preconditions.require(origin.startsWith("http://")
                || origin.startsWith("https://"),
                "CDN base URL must be http(s): " + theBaseUrl);
    }

    /** @return the origin without trailing slash */
    public String origin() {
        return origin;
    }

    /**
     * Checks if a URL is served by this CDN.
     *
     * @param url the absolute URL
     * @return true if it starts with the origin
     */
    public boolean isCdnUrl(final String url) {
        return url != null && url.startsWith(origin + "/");
    }

    /**
     * Resolves a specifier found in a module to an absolute URL.
     *
     * <ul>
     *   <li>{@code http(s)://} specifiers are returned as they are.</li>
     *   <li>Root-relative specifiers are prefixed with the origin; a
     *       leading {@code ^} or {@code ~} on the package version is
     *       dropped.</li>
     *   <li>{@code ./} and {@code ../} specifiers are resolved against
     *       the importer by path segments: the importer's last segment
     *       and query are dropped first.</li>
     *   <li>Bare specifiers do not resolve.</li>
     * </ul>
     *
     * @param specifier the specifier
     * @param importerUrl the URL of the importing module
     * @return the absolute URL, empty for bare specifiers
     */
    public Optional<String> resolve(final String specifier,
            final String importerUrl) {
        Preconditions.requireNonNull(specifier, "Specifier is required");
        if (specifier.startsWith("https://") || specifier.startsWith("http://")) {
            return Optional.of(specifier);
        }
        if (specifier.startsWith("//")) {
            return Optional.of("https:" + specifier);
        }
        if (specifier.startsWith("/")) {
            return Optional.of(origin + normalizeRange(specifier));
        }
        if (specifier.startsWith("./") || specifier.startsWith("../")) {
            return Optional.of(resolveRelative(specifier, importerUrl));
        }
        return Optional.empty();
    }

    /**
     * Drops a {@code ^} or {@code ~} right after the package name of a
     * root-relative path.
     *
     * @param path the root-relative path
     * @return the normalized path
     */
    public static String normalizeRange(final String path) {
        return RANGE_PREFIX.matcher(path).replaceFirst("$1");
    }

    private static String resolveRelative(final String specifier,
            final String importerUrl) {
        Preconditions.requireNonBlank(importerUrl,
                "Importer URL is required for relative specifiers");
        final String importer = stripQuery(importerUrl);
        final int pathStart = importer.indexOf('/', importer.indexOf("//") + 2);
        final String host = pathStart < 0 ? importer
                : importer.substring(0, pathStart);
        final String path = pathStart < 0 ? "/" : importer.substring(pathStart);

        final List<String> segments = new ArrayList<>(Arrays.asList(
                path.substring(1).split("/", -1)));
        segments.remove(segments.size() - 1);

        final String query;
        final int q = specifier.indexOf('?');
        final String relative = q < 0 ? specifier : specifier.substring(0, q);
        query = q < 0 ? "" : specifier.substring(q);

        for (final String segment : relative.split("/", -1)) {
            if (".".equals(segment)) {
                continue;
            }
            if ("..".equals(segment)) {
                if (!segments.isEmpty()) {
                    segments.remove(segments.size() - 1);
                }
                continue;
            }
            segments.add(segment);
        }
        return host + "/" + String.join("/", segments) + query;
    }

    /**
     * Parses the package coordinates of a URL.
     *
     * <p>The first path segment of the form {@code name@version} (or the
     * pair {@code @scope/name@version}) names the package; any prefix
     * segments before it are ignored.</p>
     *
     * @param url the absolute URL or root-relative path
     * @return the coordinates, empty if the path names no package version
     */
    public Optional<PackageCoordinates> coordinates(final String url) {
        final List<String> segments = pathSegments(url);
        for (int i = 0; i < segments.size(); i++) {
            final String segment = segments.get(i);
            if (segment.startsWith("@")) {
                if (i + 1 < segments.size()) {
                    final String next = segments.get(i + 1);
                    final int at = next.indexOf('@');
                    if (at > 0 && at < next.length() - 1) {
                        return Optional.of(new PackageCoordinates(
                                segment + "/" + next.substring(0, at),
                                next.substring(at + 1),
                                join(segments, i + 2)));
                    }
                }
                continue;
            }
            final int at = segment.indexOf('@');
            if (at > 0 && at < segment.length() - 1) {
                return Optional.of(new PackageCoordinates(
                        segment.substring(0, at), segment.substring(at + 1),
                        join(segments, i + 1)));
            }
        }
        return Optional.empty();
    }

    /**
     * Identifies the unit a fetched URL belongs to.
     *
     * <p>Falls back to the first path segment (two for a scope) as the
     * name and {@value #UNVERSIONED} as the version when the path names
     * no version.</p>
     *
     * @param url the absolute URL
     * @return the coordinates
     */
    public PackageCoordinates identify(final String url) {
        final Optional<PackageCoordinates> coordinates = coordinates(url);
        if (coordinates.isPresent()) {
            return coordinates.get();
        }
        final List<String> segments = pathSegments(url);
        Preconditions.require(!segments.isEmpty(),
                "URL names no package: " + url);
        if (segments.get(0).startsWith("@") && segments.size() > 1) {
            return new PackageCoordinates(segments.get(0) + "/"
                    + segments.get(1), UNVERSIONED, join(segments, 2));
        }
        return new PackageCoordinates(segments.get(0), UNVERSIONED,
                join(segments, 1));
    }

    /**
     * Returns the path of a URL inside its package.
     *
     * <p>A leading build target directory such as {@code es2022} is
     * dropped, so different build targets of the same file map to the
     * same package path.</p>
     *
     * @param url the absolute URL
     * @return the package path, empty if the URL names no package version
     */
    public Optional<String> packagePath(final String url) {
        return coordinates(url).map(coordinates -> {
            final String subpath = coordinates.subpath();
            final int slash = subpath.indexOf('/');
            if (slash > 0 && BUILD_TARGET.matcher(
                    subpath.substring(0, slash)).matches()) {
                return subpath.substring(slash + 1);
            }
            return subpath;
        });
    }

    /**
     * Removes the query and fragment of a URL.
     *
     * @param url the URL
     * @return the URL up to the first {@code ?} or {@code #}
     */
    public static String stripQuery(final String url) {
        int end = url.length();
        final int q = url.indexOf('?');
        if (q >= 0) {
            end = q;
        }
        final int hash = url.indexOf('#');
        if (hash >= 0 && hash < end) {
            end = hash;
        }
        return url.substring(0, end);
    }

    /**
     * Returns the query of a URL.
     *
     * @param url the URL
     * @return the text after {@code ?}, empty if none
     */
    public static String queryOf(final String url) {
        final int q = url.indexOf('?');
        if (q < 0) {
            return "";
        }
        final int hash = url.indexOf('#', q);
        return hash < 0 ? url.substring(q + 1) : url.substring(q + 1, hash);
    }

    private List<String> pathSegments(final String url) {
        String path = stripQuery(url);
        if (path.startsWith(origin)) {
            path = path.substring(origin.length());
        } else if (path.startsWith("http://") || path.startsWith("https://")) {
            final int slash = path.indexOf('/', path.indexOf("//") + 2);
            path = slash < 0 ? "" : path.substring(slash);
        }
        final List<String> segments = new ArrayList<>();
        for (final String segment : path.split("/")) {
            if (!segment.isEmpty()) {
                segments.add(segment);
            }
        }
        return segments;
    }

    private static String join(final List<String> segments, final int from) {
        if (from >= segments.size()) {
            return "";
        }
        return String.join("/", segments.subList(from, segments.size()));
    }

}
