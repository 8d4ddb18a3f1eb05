package co.fanki.cdnmirror.index.domain;

import co.fanki.cdnmirror.shared.Preconditions;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * A node of a relative-import tree: either a directory of path segments
 * or a leaf holding the absolute URL a package path resolves to.
 *
 * <p>When one path is both a file and a directory (for example
 * {@code client} and {@code client/index}), the file leaf is kept under
 * the empty segment of the directory branch.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public sealed interface PathNode permits PathNode.Branch, PathNode.Leaf {

    /** Segment that holds the leaf of a path that is also a directory. */
    String SELF = "";

    /**
     * A resolved target.
     *
     * @param url the absolute URL, including any peer-context query
     */
    record Leaf(String url) implements PathNode {

        /**
         * Validates the leaf.
         *
         * @param url the URL
         */
        public Leaf {
            Preconditions.requireNonBlank(url, "Leaf URL is required");
        }

        @Override
        public int leafCount() {
            return 1;
        }
    }

    /**
     * A directory of segments.
     *
     * @param children child nodes keyed by segment, sorted
     */
    record Branch(TreeMap<String, PathNode> children) implements PathNode {

        /** Creates an empty branch. */
        public Branch() {
            this(new TreeMap<>());
        }

        /**
         * Validates the branch.
         *
         * @param children the children
         */
        public Branch {
            Preconditions.requireNonNull(children, "Children are required");
        }

        /**
         * Records that a package path resolves to a URL.
         *
         * @param segments the package path segments, non-empty
         * @param url the target URL
         */
        public void set(final List<String> segments, final String url) {
            Preconditions.require(!segments.isEmpty(),
                    "A package path needs at least one segment");
            final String head = segments.get(0);
            final PathNode existing = children.get(head);

            if (segments.size() == 1) {
                if (existing instanceof Branch branch) {
                    branch.children().put(SELF, new Leaf(url));
                } else {
                    children.put(head, new Leaf(url));
                }
                return;
            }

            final Branch next;
            if (existing instanceof Branch branch) {
                next = branch;
            } else {
                next = new Branch();
                if (existing instanceof Leaf leaf) {
                    next.children().put(SELF, leaf);
                }
                children.put(head, next);
            }
            next.set(segments.subList(1, segments.size()), url);
        }

        /**
         * Resolves a package path.
         *
         * <p>A path that ends on a branch resolves to the branch's own
         * leaf, or else to its first leaf child.</p>
         *
         * @param segments the package path segments
         * @return the URL, empty if the path is unknown
         */
        public Optional<String> get(final List<String> segments) {
            if (segments.isEmpty()) {
                final PathNode self = children.get(SELF);
                if (self instanceof Leaf leaf) {
                    return Optional.of(leaf.url());
                }
                for (final PathNode child : children.values()) {
                    if (child instanceof Leaf leaf) {
                        return Optional.of(leaf.url());
                    }
                }
                return Optional.empty();
            }
            final PathNode child = children.get(segments.get(0));
            if (child instanceof Leaf leaf) {
                return segments.size() == 1
                        ? Optional.of(leaf.url()) : Optional.empty();
            }
            if (child instanceof Branch branch) {
                return branch.get(segments.subList(1, segments.size()));
            }
            return Optional.empty();
        }

        /**
         * Copies every leaf of another tree into this one.
         *
         * @param other the other tree
         */
        public void mergeFrom(final Branch other) {
            for (final Map.Entry<String, PathNode> entry
                    : other.children().entrySet()) {
                final PathNode mine = children.get(entry.getKey());
                final PathNode theirs = entry.getValue();
                if (theirs instanceof Leaf leaf) {
                    if (mine instanceof Branch branch) {
                        branch.children().put(SELF, leaf);
                    } else {
                        children.put(entry.getKey(), leaf);
                    }
                } else if (theirs instanceof Branch incoming) {
                    if (mine instanceof Branch branch) {
                        branch.mergeFrom(incoming);
                    } else {
                        final Branch fresh = new Branch();
                        if (mine instanceof Leaf leaf) {
                            fresh.children().put(SELF, leaf);
                        }
                        fresh.mergeFrom(incoming);
                        children.put(entry.getKey(), fresh);
                    }
                }
            }
        }

        @Override
        public int leafCount() {
            int count = 0;
            for (final PathNode child : children.values()) {
                count += child.leafCount();
            }
            return count;
        }
    }

    /**
     * Splits a package path into segments, ignoring empty ones.
     *
     * @param packagePath the path, e.g. {@code es2022/client.mjs}
     * @return the segments
     */
    static List<String> segments(final String packagePath) {
        return Arrays.stream(packagePath.split("/"))
                .filter(segment -> !segment.isEmpty())
                .toList();
    }

    /** @return the number of leaves under this node */
    int leafCount();

}
