package co.fanki.cdnmirror.mirror.application;

import co.fanki.cdnmirror.index.domain.LookupIndex;
import co.fanki.cdnmirror.index.domain.LookupIndexRepository;
import co.fanki.cdnmirror.shared.ErrorCode;
import co.fanki.cdnmirror.shared.MirrorException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Publishes the versions and units of the mirror for the application
 * that consumes it.
 *
 * <p>The exports file holds {@code availableVersions},
 * {@code standaloneSubpaths} and {@code packages}, each package without
 * its depth and peer constraints.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class ExportService {

    private static final Logger LOG = LoggerFactory.getLogger(
            ExportService.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final LookupIndexRepository indexRepository;
    private final Path exportsFile;

    /**
     * Creates a new ExportService.
     *
     * @param theIndexRepository the lookup index repository
     * @param theExportsFile the file to write
     */
    public ExportService(final LookupIndexRepository theIndexRepository,
            @Value("${mirror.exports-file:./cdn-exports.json}")
            final String theExportsFile) {
        this.indexRepository = theIndexRepository;
        this.exportsFile = Path.of(theExportsFile).toAbsolutePath();
    }

    /**
     * Runs the export stage.
     *
     * @return the number of packages exported
     */
    public int export() {
        final LookupIndex index = indexRepository.load();
        final ObjectNode tree = index.toJsonTree();

        final ObjectNode root = MAPPER.createObjectNode();
        root.set("availableVersions", tree.get("availableVersions"));
        root.set("standaloneSubpaths", tree.has("standaloneSubpaths")
                ? tree.get("standaloneSubpaths")
                : MAPPER.createObjectNode());

        final ArrayNode packages = root.putArray("packages");
        for (final JsonNode unit : tree.get("packages")) {
            final ObjectNode exported = ((ObjectNode) unit).deepCopy();
            exported.remove("depth");
            exported.remove("peerDependencies");
            packages.add(exported);
        }

        try {
            final Path parent = exportsFile.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(exportsFile, MAPPER
                    .writerWithDefaultPrettyPrinter()
                    .writeValueAsString(root), StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new MirrorException("Failed to write exports file "
                    + exportsFile, ErrorCode.INDEX_IO, e);
        }
        LOG.info("Exported {} packages to {}", packages.size(), exportsFile);
        return packages.size();
    }

}
