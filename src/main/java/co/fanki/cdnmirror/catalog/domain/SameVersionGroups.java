package co.fanki.cdnmirror.catalog.domain;

import co.fanki.cdnmirror.shared.Preconditions;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The sets of packages that must always be mirrored at identical
 * versions relative to each other.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SameVersionGroups {

    private final List<List<String>> groups;

    /**
     * Creates the groups.
     *
     * @param theGroups the groups, in configuration order
     */
    public SameVersionGroups(final List<List<String>> theGroups) {
        Preconditions.requireNonNull(theGroups, "Groups are required");
        final List<List<String>> copy = new ArrayList<>();
        for (final List<String> group : theGroups) {
            Preconditions.require(!group.isEmpty(),
                    "Same-version groups cannot be empty");
            copy.add(List.copyOf(group));
        }
        this.groups = List.copyOf(copy);
    }

    /** @return an instance without groups */
    public static SameVersionGroups none() {
        return new SameVersionGroups(List.of());
    }

    /**
     * Finds the group a package belongs to.
     *
     * @param name the package name
     * @return the group, empty if the package is ungrouped
     */
    public Optional<List<String>> groupOf(final String name) {
        for (final List<String> group : groups) {
            if (group.contains(name)) {
                return Optional.of(group);
            }
        }
        return Optional.empty();
    }

    /**
     * Checks if a package belongs to any group.
     *
     * @param name the package name
     * @return true if grouped
     */
    public boolean isGroupMember(final String name) {
        return groupOf(name).isPresent();
    }

    /**
     * Checks if two distinct packages share a group.
     *
     * @param first a package name
     * @param second another package name
     * @return true if both are members of the same group
     */
    public boolean areGrouped(final String first, final String second) {
        return groupOf(first).map(group -> group.contains(second))
                .orElse(false);
    }

    /** @return the groups in configuration order */
    public List<List<String>> asList() {
        return groups;
    }

}
