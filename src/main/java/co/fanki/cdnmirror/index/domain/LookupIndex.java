package co.fanki.cdnmirror.index.domain;

import co.fanki.cdnmirror.analysis.domain.AnalyzedDependency;
import co.fanki.cdnmirror.analysis.domain.PeerContext;
import co.fanki.cdnmirror.analysis.domain.PeerScope;
import co.fanki.cdnmirror.catalog.domain.CdnMappingRepository;
import co.fanki.cdnmirror.catalog.domain.SubpathConfig;
import co.fanki.cdnmirror.shared.ErrorCode;
import co.fanki.cdnmirror.shared.MirrorException;
import co.fanki.cdnmirror.shared.Preconditions;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * The persisted state of the mirror, shared by every stage.
 *
 * <p>Holds the analyzed units, the map from CDN URL to local filename,
 * the relative-import trees keyed by dep-key, the available versions per
 * package and the standalone subpath declarations. The index is the only
 * owner of URL to filename assignments.</p>
 *
 * <p>Instances are not thread-safe; a stage loads the index, mutates it
 * from a single thread and saves it.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class LookupIndex {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<AnalyzedDependency> packages;

    private final TreeMap<String, String> urlToFile;

    private final TreeMap<String, PathNode.Branch> relativeImports;

    private final Map<String, List<String>> availableVersions;

    private final Map<String, List<SubpathConfig>> standaloneSubpaths;

    private LookupIndex(final List<AnalyzedDependency> thePackages,
            final TreeMap<String, String> theUrlToFile,
            final TreeMap<String, PathNode.Branch> theRelativeImports,
            final Map<String, List<String>> theAvailableVersions,
            final Map<String, List<SubpathConfig>> theStandaloneSubpaths) {
        this.packages = thePackages;
        this.urlToFile = theUrlToFile;
        this.relativeImports = theRelativeImports;
        this.availableVersions = theAvailableVersions;
        this.standaloneSubpaths = theStandaloneSubpaths;
    }

    /**
     * Creates an index with no content.
     *
     * @return the empty index
     */
    public static LookupIndex empty() {
        return new LookupIndex(new ArrayList<>(), new TreeMap<>(),
                new TreeMap<>(), new LinkedHashMap<>(), new LinkedHashMap<>());
    }

    // -- packages ---

    /** @return the analyzed units in download order, unmodifiable */
    public List<AnalyzedDependency> packages() {
        return Collections.unmodifiableList(packages);
    }

    /**
     * Replaces the analyzed units.
     *
     * @param thePackages the units, already merged and sorted
     */
    public void replacePackages(final List<AnalyzedDependency> thePackages) {
        Preconditions.requireNonNull(thePackages, "Packages are required");
        packages.clear();
        packages.addAll(thePackages);
    }

    /**
     * Finds the unit a mirrored file belongs to.
     *
     * <p>Two contexts are the same unit when they agree on the peers that
     * distinguish copies of the package.</p>
     *
     * @param name the package name
     * @param version the version
     * @param distinguishingPeers the peers encoded in the filename
     * @param scope decides which peers are distinguishing
     * @return the unit, empty if the index has none
     */
    public Optional<AnalyzedDependency> findPackage(final String name,
            final String version, final PeerContext distinguishingPeers,
            final PeerScope scope) {
        for (final AnalyzedDependency unit : packages) {
            if (unit.getName().equals(name)
                    && unit.getVersion().equals(version)
                    && scope.distinguishing(name, unit.getPeerContext())
                            .equals(distinguishingPeers)) {
                return Optional.of(unit);
            }
        }
        return Optional.empty();
    }

    // -- urlToFile ---

    /**
     * Looks up the local file of a URL.
     *
     * @param url the exact URL, including any query
     * @return the filename, empty if the URL is not mirrored
     */
    public Optional<String> fileFor(final String url) {
        return Optional.ofNullable(urlToFile.get(url));
    }

    /**
     * Assigns a file to a URL unless the URL already has one.
     *
     * @param url the URL
     * @param filename the filename
     * @return true if the assignment was added
     */
    public boolean putFileIfAbsent(final String url, final String filename) {
        Preconditions.requireNonBlank(url, "URL is required");
        Preconditions.requireNonBlank(filename, "Filename is required");
        return urlToFile.putIfAbsent(url, filename) == null;
    }

    /**
     * Forgets a URL.
     *
     * @param url the URL
     */
    public void removeUrl(final String url) {
        urlToFile.remove(url);
    }

    /**
     * Finds the URL a file was saved for.
     *
     * @param filename the filename
     * @return the first URL in lexicographic order mapped to the file
     */
    public Optional<String> urlForFile(final String filename) {
        for (final Map.Entry<String, String> entry : urlToFile.entrySet()) {
            if (entry.getValue().equals(filename)) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    /** @return the URL to filename map in URL order, unmodifiable */
    public Map<String, String> urlToFile() {
        return Collections.unmodifiableMap(urlToFile);
    }

    // -- relativeImports ---

    /**
     * Returns the relative-import tree of a unit.
     *
     * @param depKey the unit's dep-key
     * @return the tree, empty if none was recorded
     */
    public Optional<PathNode.Branch> relativeImports(final DepKey depKey) {
        return Optional.ofNullable(relativeImports.get(depKey.value()));
    }

    /**
     * Adds the leaves of a tree to the tree of a unit.
     *
     * @param depKey the unit's dep-key
     * @param tree the new leaves
     */
    public void mergeRelativeImports(final DepKey depKey,
            final PathNode.Branch tree) {
        relativeImports.computeIfAbsent(depKey.value(),
                key -> new PathNode.Branch()).mergeFrom(tree);
    }

    /** @return the number of dep-keys with a relative-import tree */
    public int relativeImportKeyCount() {
        return relativeImports.size();
    }

    // -- availableVersions ---

    /** @return the versions selected per package, unmodifiable */
    public Map<String, List<String>> availableVersions() {
        return Collections.unmodifiableMap(availableVersions);
    }

    /**
     * Records the versions selected for a package.
     *
     * @param name the package name
     * @param versions the versions
     */
    public void putAvailableVersions(final String name,
            final List<String> versions) {
        availableVersions.put(name, List.copyOf(versions));
    }

    // -- standaloneSubpaths ---

    /** @return the standalone subpath declarations, unmodifiable */
    public Map<String, List<SubpathConfig>> standaloneSubpaths() {
        return Collections.unmodifiableMap(standaloneSubpaths);
    }

    /**
     * Replaces the standalone subpath declarations.
     *
     * @param subpaths the declarations per parent package
     */
    public void setStandaloneSubpaths(
            final Map<String, List<SubpathConfig>> subpaths) {
        standaloneSubpaths.clear();
        subpaths.forEach((parent, configs) ->
                standaloneSubpaths.put(parent, List.copyOf(configs)));
    }

    // -- codec ---

    /**
     * Builds the JSON tree of the index.
     *
     * @return the JSON object
     */
    public ObjectNode toJsonTree() {
        final ObjectNode root = MAPPER.createObjectNode();

        final ArrayNode packagesArray = MAPPER.createArrayNode();
        for (final AnalyzedDependency unit : packages) {
            packagesArray.add(toJson(unit));
        }
        root.set("packages", packagesArray);

        final ObjectNode urlsObj = MAPPER.createObjectNode();
        urlToFile.forEach(urlsObj::put);
        root.set("urlToFile", urlsObj);

        final ObjectNode relativeObj = MAPPER.createObjectNode();
        relativeImports.forEach((key, tree) ->
                relativeObj.set(key, toJson(tree)));
        root.set("relativeImports", relativeObj);

        final ObjectNode versionsObj = MAPPER.createObjectNode();
        availableVersions.forEach((name, versions) -> {
            final ArrayNode versionsArray = versionsObj.putArray(name);
            versions.forEach(versionsArray::add);
        });
        root.set("availableVersions", versionsObj);

        if (!standaloneSubpaths.isEmpty()) {
            final ObjectNode subpathsObj = MAPPER.createObjectNode();
            standaloneSubpaths.forEach((parent, configs) -> {
                final ArrayNode configsArray = subpathsObj.putArray(parent);
                for (final SubpathConfig config : configs) {
                    final ObjectNode configObj = configsArray.addObject();
                    configObj.put("name", config.name());
                    if (config.fromVersion() != null) {
                        configObj.put("fromVersion", config.fromVersion());
                    }
                }
            });
            root.set("standaloneSubpaths", subpathsObj);
        }
        return root;
    }

    /**
     * Serializes the index as pretty-printed JSON.
     *
     * @return the JSON text
     */
    public String toJson() {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(toJsonTree());
        } catch (final JsonProcessingException e) {
            throw new MirrorException("Failed to serialize lookup index",
                    ErrorCode.INDEX_IO, e);
        }
    }

    /**
     * Parses a serialized index.
     *
     * @param json the JSON text
     * @return the index
     * @throws MirrorException if the text is not a valid index
     */
    public static LookupIndex fromJson(final String json) {
        Preconditions.requireNonBlank(json, "JSON is required");
        final JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (final JsonProcessingException e) {
            throw new MirrorException("Lookup index is not valid JSON",
                    ErrorCode.INDEX_IO, e);
        }
        if (root == null || !root.isObject()) {
            throw new MirrorException("Lookup index must be a JSON object",
                    ErrorCode.INDEX_IO);
        }

        final List<AnalyzedDependency> packages = new ArrayList<>();
        for (final JsonNode item : root.path("packages")) {
            packages.add(unitFromJson(item));
        }

        final TreeMap<String, String> urls = new TreeMap<>();
        final Iterator<Map.Entry<String, JsonNode>> urlFields =
                root.path("urlToFile").fields();
        while (urlFields.hasNext()) {
            final Map.Entry<String, JsonNode> entry = urlFields.next();
            urls.put(entry.getKey(), entry.getValue().asText());
        }

        final TreeMap<String, PathNode.Branch> relative = new TreeMap<>();
        final Iterator<Map.Entry<String, JsonNode>> relativeFields =
                root.path("relativeImports").fields();
        while (relativeFields.hasNext()) {
            final Map.Entry<String, JsonNode> entry = relativeFields.next();
            if (treeFromJson(entry.getValue()) instanceof PathNode.Branch b) {
                relative.put(entry.getKey(), b);
            }
        }

        final Map<String, List<String>> versions = new LinkedHashMap<>();
        final Iterator<Map.Entry<String, JsonNode>> versionFields =
                root.path("availableVersions").fields();
        while (versionFields.hasNext()) {
            final Map.Entry<String, JsonNode> entry = versionFields.next();
            final List<String> list = new ArrayList<>();
            entry.getValue().forEach(v -> list.add(v.asText()));
            versions.put(entry.getKey(), list);
        }

        final Map<String, List<SubpathConfig>> subpaths =
                new LinkedHashMap<>();
        final Iterator<Map.Entry<String, JsonNode>> subpathFields =
                root.path("standaloneSubpaths").fields();
        while (subpathFields.hasNext()) {
            final Map.Entry<String, JsonNode> entry = subpathFields.next();
            subpaths.put(entry.getKey(),
                    CdnMappingRepository.parseSubpaths(entry.getValue()));
        }

        return new LookupIndex(packages, urls, relative, versions, subpaths);
    }

    private static ObjectNode toJson(final AnalyzedDependency unit) {
        final ObjectNode unitObj = MAPPER.createObjectNode();
        unitObj.put("name", unit.getName());
        unitObj.put("version", unit.getVersion());
        unitObj.put("url", unit.getUrl());
        if (!unit.getPeerContext().isEmpty()) {
            final ObjectNode contextObj = unitObj.putObject("peerContext");
            unit.getPeerContext().versions().forEach(contextObj::put);
        }
        if (!unit.getPeerDependencies().isEmpty()) {
            final ObjectNode peersObj = unitObj.putObject("peerDependencies");
            unit.getPeerDependencies().forEach(peersObj::put);
        }
        unitObj.put("depth", unit.getDepth());
        unitObj.put("downloaded", unit.isDownloaded());
        unitObj.put("transformed", unit.isTransformed());
        return unitObj;
    }

    private static AnalyzedDependency unitFromJson(final JsonNode node) {
        return new AnalyzedDependency(
                node.path("name").asText(),
                node.path("version").asText(),
                node.path("url").asText(),
                PeerContext.of(stringMap(node.get("peerContext"))),
                stringMap(node.get("peerDependencies")),
                node.path("depth").asInt(0),
                node.path("downloaded").asBoolean(false),
                node.path("transformed").asBoolean(false));
    }

    private static Map<String, String> stringMap(final JsonNode node) {
        final Map<String, String> map = new TreeMap<>();
        if (node == null || !node.isObject()) {
            return map;
        }
        final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> entry = fields.next();
            map.put(entry.getKey(), entry.getValue().asText());
        }
        return map;
    }

    private static JsonNode toJson(final PathNode node) {
        if (node instanceof PathNode.Leaf leaf) {
            return MAPPER.getNodeFactory().textNode(leaf.url());
        }
        final ObjectNode branchObj = MAPPER.createObjectNode();
        ((PathNode.Branch) node).children().forEach((segment, child) ->
                branchObj.set(segment, toJson(child)));
        return branchObj;
    }

    private static PathNode treeFromJson(final JsonNode node) {
        if (node.isTextual()) {
            return new PathNode.Leaf(node.asText());
        }
        final PathNode.Branch branch = new PathNode.Branch();
        final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> entry = fields.next();
            branch.children().put(entry.getKey(),
                    treeFromJson(entry.getValue()));
        }
        return branch;
    }

}
