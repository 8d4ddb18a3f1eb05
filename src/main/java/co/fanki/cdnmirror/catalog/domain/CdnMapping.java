package co.fanki.cdnmirror.catalog.domain;

import co.fanki.cdnmirror.shared.Preconditions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The static catalog of a mirror run: the managed packages with their
 * URL templates, the same-version groups and the standalone subpaths.
 *
 * <p>Immutable for the duration of a run.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class CdnMapping {

    private final Map<String, PackageSpec> packages;

    private final SameVersionGroups groups;

    private final Map<String, List<SubpathConfig>> standaloneSubpaths;

    /**
     * Creates the catalog.
     *
     * @param thePackages the package specs, in configuration order
     * @param theGroups the same-version groups
     * @param theStandaloneSubpaths subpath declarations keyed by parent
     */
    public CdnMapping(final List<PackageSpec> thePackages,
            final SameVersionGroups theGroups,
            final Map<String, List<SubpathConfig>> theStandaloneSubpaths) {
        Preconditions.requireNonNull(thePackages, "Packages are required");
        this.groups = Preconditions.requireNonNull(theGroups,
                "Same-version groups are required");
        final Map<String, PackageSpec> byName = new LinkedHashMap<>();
        for (final PackageSpec spec : thePackages) {
            byName.put(spec.name(), spec);
        }
        this.packages = Collections.unmodifiableMap(byName);
        final Map<String, List<SubpathConfig>> subpaths =
                new LinkedHashMap<>();
        if (theStandaloneSubpaths != null) {
            theStandaloneSubpaths.forEach((parent, configs) ->
                    subpaths.put(parent, List.copyOf(configs)));
        }
        this.standaloneSubpaths = Collections.unmodifiableMap(subpaths);
    }

    /**
     * Checks if a package is managed by this mirror.
     *
     * @param name the package name
     * @return true if it has a URL template
     */
    public boolean isManaged(final String name) {
        return packages.containsKey(name);
    }

    /** @return the managed package names, in configuration order */
    public Set<String> packageNames() {
        return packages.keySet();
    }

    /**
     * Looks up the spec of a package.
     *
     * @param name the package name
     * @return the spec, empty if unmanaged
     */
    public Optional<PackageSpec> spec(final String name) {
        return Optional.ofNullable(packages.get(name));
    }

    /** @return the same-version groups */
    public SameVersionGroups groups() {
        return groups;
    }

    /** @return the standalone subpath declarations keyed by parent */
    public Map<String, List<SubpathConfig>> standaloneSubpaths() {
        return standaloneSubpaths;
    }

    /**
     * Returns the standalone subpaths declared under a parent package.
     *
     * @param parent the parent package name
     * @return the declarations, empty if none
     */
    public List<SubpathConfig> subpathsOf(final String parent) {
        return standaloneSubpaths.getOrDefault(parent, List.of());
    }

    /**
     * Checks if a package entry is a standalone subpath, analyzed together
     * with its parent rather than on its own.
     *
     * @param name the package name
     * @return true if a parent declares it as a standalone subpath
     */
    public boolean isStandaloneSubpath(final String name) {
        return parentOf(name).isPresent();
    }

    /**
     * Returns the parent of a standalone subpath.
     *
     * @param name the package name
     * @return the parent package, empty if the name is not a declared
     *         standalone subpath
     */
    public Optional<String> parentOf(final String name) {
        for (final Map.Entry<String, List<SubpathConfig>> entry
                : standaloneSubpaths.entrySet()) {
            final String prefix = entry.getKey() + "/";
            if (!name.startsWith(prefix)) {
                continue;
            }
            final String subpath = name.substring(prefix.length());
            for (final SubpathConfig config : entry.getValue()) {
                if (config.name().equals(subpath)) {
                    return Optional.of(entry.getKey());
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the package whose peers a unit shares: the parent for a
     * standalone subpath, the unit itself otherwise.
     *
     * @param name the package name
     * @return the owning package name
     */
    public String ownerOf(final String name) {
        return parentOf(name).orElse(name);
    }

}
