package co.fanki.cdnmirror.catalog.domain;

import co.fanki.cdnmirror.fetch.domain.ContentSource;
import co.fanki.cdnmirror.fetch.domain.FetchException;
import co.fanki.cdnmirror.shared.Preconditions;
import com.vdurmont.semver4j.Semver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Picks the bounded set of versions of a package that gets mirrored.
 *
 * <p>Invalid and pre-release versions are discarded. Of the remaining
 * versions, the most recent {@code majorLines} major lines are kept; in
 * each of those the most recent {@code minorLines} minor lines; and in
 * each minor line only the highest patch. Each pick is then probed on
 * the CDN and dropped when the CDN cannot serve it.</p>
 *
 * <p>When a package has no stable version at all, its {@code latest}
 * dist-tag is used instead, or the literal tag {@code latest}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class VersionSelector {

    private static final Logger LOG = LoggerFactory.getLogger(
            VersionSelector.class);

    /** The tag used when a package publishes no stable version. */
    public static final String LATEST_TAG = "latest";

    private final ContentSource contentSource;

    private final int majorLines;

    private final int minorLines;

    /**
     * Creates a new selector.
     *
     * @param theContentSource the CDN used for existence probes
     * @param theMajorLines how many major lines to keep
     * @param theMinorLines how many minor lines to keep per major
     */
    public VersionSelector(final ContentSource theContentSource,
            final int theMajorLines, final int theMinorLines) {
        this.contentSource = Preconditions.requireNonNull(theContentSource,
                "Content source is required");
        this.majorLines = Preconditions.requirePositive(theMajorLines,
                "Major lines must be positive");
        this.minorLines = Preconditions.requirePositive(theMinorLines,
                "Minor lines must be positive");
    }

    /**
     * Selects the servable representative versions of a package.
     *
     * @param spec the package spec, used to build probe URLs
     * @param metadata the registry metadata
     * @return the versions, newest first; empty if none is servable
     */
    public List<String> select(final PackageSpec spec,
            final PackageMetadata metadata) {
        final List<String> candidates = representativeVersions(metadata);
        final List<String> servable = new ArrayList<>();
        for (final String version : candidates) {
            final String url = spec.urlFor(version);
            try {
                if (contentSource.exists(url)) {
                    servable.add(version);
                } else {
                    LOG.info("Dropping {}@{}: not served by the CDN ({})",
                            spec.name(), version, url);
                }
            } catch (final FetchException e) {
                LOG.warn("Dropping {}@{}: CDN probe failed: {}",
                        spec.name(), version, e.getMessage());
            }
        }
        LOG.info("Selected {} of {} candidate versions of {}: {}",
                servable.size(), candidates.size(), spec.name(), servable);
        return servable;
    }

    /**
     * Computes the representative versions without probing the CDN.
     *
     * @param metadata the registry metadata
     * @return the versions, newest first
     */
    public List<String> representativeVersions(
            final PackageMetadata metadata) {
        final Set<Semver> stable = new LinkedHashSet<>();
        for (final String version : metadata.versions()) {
            final Optional<Semver> parsed = SemverRange.parse(version);
            if (parsed.isPresent() && SemverRange.isStable(parsed.get())) {
                stable.add(parsed.get());
            }
        }

        if (stable.isEmpty()) {
            final String fallback = metadata.latestTag() == null
                    ? LATEST_TAG : metadata.latestTag();
            LOG.warn("No stable versions of {}, falling back to {}",
                    metadata.name(), fallback);
            return List.of(fallback);
        }

        final List<Semver> sorted = new ArrayList<>(stable);
        sorted.sort(Comparator.reverseOrder());

        final Map<Integer, Map<Integer, Semver>> lines = new LinkedHashMap<>();
        for (final Semver version : sorted) {
            final Map<Integer, Semver> minors = lines.get(version.getMajor());
            if (minors == null) {
                if (lines.size() == majorLines) {
                    continue;
                }
                final Map<Integer, Semver> fresh = new LinkedHashMap<>();
                fresh.put(version.getMinor(), version);
                lines.put(version.getMajor(), fresh);
            } else if (!minors.containsKey(version.getMinor())
                    && minors.size() < minorLines) {
                minors.put(version.getMinor(), version);
            }
        }

        final List<String> selected = new ArrayList<>();
        for (final Map<Integer, Semver> minors : lines.values()) {
            for (final Semver version : minors.values()) {
                selected.add(version.getValue());
            }
        }
        return selected;
    }

}
