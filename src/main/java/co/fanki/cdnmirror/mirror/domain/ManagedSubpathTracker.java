package co.fanki.cdnmirror.mirror.domain;

import co.fanki.cdnmirror.fetch.domain.CdnUrls;
import co.fanki.cdnmirror.fetch.domain.PackageCoordinates;
import co.fanki.cdnmirror.shared.Preconditions;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Collects the entry-point subpaths of managed packages met while
 * replicating, such as {@code react@19.0.0/jsx-runtime}.
 *
 * <p>Such imports are not cloned into a peer context; they are fetched
 * later for every context-free version of the package.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ManagedSubpathTracker {

    private final CdnUrls cdnUrls;

    private final Predicate<String> managed;

    private final Map<String, Set<String>> subpaths = new TreeMap<>();

    /**
     * Creates a new tracker.
     *
     * @param theCdnUrls the CDN URL helper
     * @param theManaged tells whether a package name is managed
     */
    public ManagedSubpathTracker(final CdnUrls theCdnUrls,
            final Predicate<String> theManaged) {
        this.cdnUrls = Preconditions.requireNonNull(theCdnUrls,
                "CDN URLs are required");
        this.managed = Preconditions.requireNonNull(theManaged,
                "Managed predicate is required");
    }

    /**
     * Records a URL if it is an entry-point subpath of a managed package.
     *
     * @param url the import URL
     * @return true if recorded
     */
    public boolean track(final String url) {
        final Optional<PackageCoordinates> coordinates =
                cdnUrls.coordinates(url);
        if (coordinates.isEmpty() || !managed.test(coordinates.get().name())) {
            return false;
        }
        final String subpath = coordinates.get().subpath();
        if (subpath.isEmpty() || isBuildArtifact(subpath)) {
            return false;
        }
        subpaths.computeIfAbsent(coordinates.get().name(),
                name -> new TreeSet<>()).add(subpath);
        return true;
    }

    /** @return the recorded subpaths per package, sorted */
    public Map<String, Set<String>> subpaths() {
        return Collections.unmodifiableMap(subpaths);
    }

    private static boolean isBuildArtifact(final String subpath) {
        return subpath.endsWith(".js") || subpath.endsWith(".mjs")
                || subpath.endsWith(".cjs");
    }

}
