package co.fanki.cdnmirror.catalog.domain;

import co.fanki.cdnmirror.shared.MirrorConfigurationException;
import co.fanki.cdnmirror.shared.Preconditions;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the CDN mapping configuration file.
 *
 * <p>Expected shape:</p>
 * <pre>
 * {
 *   "packages": { "react": "https://esm.sh/react@{version}" },
 *   "sameVersionRequired": [["react", "react-dom"]],
 *   "standaloneSubpaths": { "react-dom": ["client", {"name": "server",
 *       "fromVersion": "&gt;=18"}] }
 * }
 * </pre>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class CdnMappingRepository {

    private static final Logger LOG = LoggerFactory.getLogger(
            CdnMappingRepository.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path mappingFile;

    /**
     * Creates a repository over a mapping file.
     *
     * @param theMappingFile the JSON file path
     */
    public CdnMappingRepository(final Path theMappingFile) {
        this.mappingFile = Preconditions.requireNonNull(theMappingFile,
                "Mapping file is required");
    }

    /**
     * Loads and validates the mapping.
     *
     * @return the catalog
     * @throws MirrorConfigurationException if the file is missing or invalid
     */
    public CdnMapping load() {
        if (!Files.isRegularFile(mappingFile)) {
            throw new MirrorConfigurationException(
                    "CDN mapping file not found: " + mappingFile);
        }
        final JsonNode root;
        try {
            root = MAPPER.readTree(mappingFile.toFile());
        } catch (final IOException e) {
            throw new MirrorConfigurationException(
                    "Cannot read CDN mapping file " + mappingFile, e);
        }
        final CdnMapping mapping = parse(root);
        LOG.info("Loaded {} managed packages and {} same-version groups"
                + " from {}", mapping.packageNames().size(),
                mapping.groups().asList().size(), mappingFile);
        return mapping;
    }

    /**
     * Builds the catalog from a parsed JSON document.
     *
     * @param root the document root
     * @return the catalog
     */
    static CdnMapping parse(final JsonNode root) {
        final JsonNode packagesNode = root == null ? null : root.get("packages");
        if (packagesNode == null || !packagesNode.isObject()) {
            throw new MirrorConfigurationException(
                    "CDN mapping has no 'packages' object");
        }

        final List<PackageSpec> packages = new ArrayList<>();
        final var fields = packagesNode.fields();
        while (fields.hasNext()) {
            final var entry = fields.next();
            final JsonNode template = entry.getValue();
            if (template == null || !template.isTextual()) {
                throw new MirrorConfigurationException(
                        "Package " + entry.getKey() + " has no URL template");
            }
            try {
                packages.add(new PackageSpec(entry.getKey(),
                        template.asText()));
            } catch (final IllegalArgumentException e) {
                throw new MirrorConfigurationException(e.getMessage(), e);
            }
        }

        final List<List<String>> groups = new ArrayList<>();
        final JsonNode groupsNode = root.get("sameVersionRequired");
        if (groupsNode != null && groupsNode.isArray()) {
            for (final JsonNode groupNode : groupsNode) {
                final List<String> group = new ArrayList<>();
                for (final JsonNode member : groupNode) {
                    group.add(member.asText());
                }
                if (!group.isEmpty()) {
                    groups.add(group);
                }
            }
        }

        final Map<String, List<SubpathConfig>> subpaths =
                new LinkedHashMap<>();
        final JsonNode subpathsNode = root.get("standaloneSubpaths");
        if (subpathsNode != null && subpathsNode.isObject()) {
            final var parents = subpathsNode.fields();
            while (parents.hasNext()) {
                final var parent = parents.next();
                subpaths.put(parent.getKey(),
                        parseSubpaths(parent.getValue()));
            }
        }

        return new CdnMapping(packages, new SameVersionGroups(groups),
                subpaths);
    }

    /**
     * Parses a list of subpath declarations, each either a plain string or
     * an object with {@code name} and optional {@code fromVersion}.
     *
     * @param node the JSON array
     * @return the declarations
     */
    public static List<SubpathConfig> parseSubpaths(final JsonNode node) {
        final List<SubpathConfig> configs = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return configs;
        }
        for (final JsonNode item : node) {
            if (item.isTextual()) {
                configs.add(new SubpathConfig(item.asText(), null));
            } else if (item.isObject() && item.hasNonNull("name")) {
                final JsonNode from = item.get("fromVersion");
                configs.add(new SubpathConfig(item.get("name").asText(),
                        from == null || from.isNull() ? null : from.asText()));
            } else {
                throw new MirrorConfigurationException(
                        "Invalid standalone subpath declaration: " + item);
            }
        }
        return configs;
    }

}
