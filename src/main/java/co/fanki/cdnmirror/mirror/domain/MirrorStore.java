package co.fanki.cdnmirror.mirror.domain;

import co.fanki.cdnmirror.analysis.domain.PeerContext;
import co.fanki.cdnmirror.analysis.domain.PeerScope;
import co.fanki.cdnmirror.fetch.domain.CdnUrls;
import co.fanki.cdnmirror.fetch.domain.DependencyInfo;
import co.fanki.cdnmirror.index.domain.LookupIndex;
import co.fanki.cdnmirror.index.domain.MirrorFilename;
import co.fanki.cdnmirror.shared.ErrorCode;
import co.fanki.cdnmirror.shared.MirrorException;
import co.fanki.cdnmirror.shared.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * The local mirror directory: one file per mirrored module.
 *
 * <p>A module is registered in the index under its URL with the query
 * reduced to the peers that distinguish it, so copies that only differ
 * in irrelevant peers share one file.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class MirrorStore {

    private static final Logger LOG = LoggerFactory.getLogger(
            MirrorStore.class);

    private final Path outputDir;

    /**
     * Creates a new store.
     *
     * @param theOutputDir the mirror directory
     */
    public MirrorStore(final Path theOutputDir) {
        this.outputDir = Preconditions.requireNonNull(theOutputDir,
                "Output directory is required").toAbsolutePath();
    }

    /**
     * Saves a module unless its index key already has a file.
     *
     * @param info the module
     * @param index the index that owns the URL to file map
     * @param scope decides which peers distinguish the module
     * @return the filename written, empty if the key was already mirrored
     */
    public Optional<String> save(final DependencyInfo info,
            final LookupIndex index, final PeerScope scope) {
        final PeerContext peers = scope.distinguishing(info.name(),
                info.peerContext());
        final String key = indexKey(info.url(), peers);
        if (index.fileFor(key).isPresent()) {
            return Optional.empty();
        }
        final String filename = MirrorFilename.forUnit(info.name(),
                info.version(), peers, info.url()).value();
        write(filename, info.content());
        index.putFileIfAbsent(key, filename);
        LOG.debug("Saved {} as {}", key, filename);
        return Optional.of(filename);
    }

    /**
     * Builds the index key of a module URL.
     *
     * @param url the module URL, with any peer-context query
     * @param distinguishingPeers the peers kept in the key
     * @return the URL without query, qualified by the given peers
     */
    public static String indexKey(final String url,
            final PeerContext distinguishingPeers) {
        return distinguishingPeers.qualify(CdnUrls.stripQuery(url));
    }

    /**
     * Reads a mirrored file.
     *
     * @param filename the filename
     * @return the content
     */
    public String read(final String filename) {
        try {
            return Files.readString(resolve(filename), StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new MirrorException("Failed to read mirrored file "
                    + filename, ErrorCode.INDEX_IO, e);
        }
    }

    /**
     * Writes a mirrored file, replacing any previous content.
     *
     * @param filename the filename
     * @param content the content
     */
    public void write(final String filename, final String content) {
        try {
            Files.createDirectories(outputDir);
            Files.writeString(resolve(filename), content,
                    StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new MirrorException("Failed to write mirrored file "
                    + filename, ErrorCode.INDEX_IO, e);
        }
    }

    /**
     * Checks if a mirrored file exists.
     *
     * @param filename the filename
     * @return true if it is on disk
     */
    public boolean exists(final String filename) {
        return Files.isRegularFile(resolve(filename));
    }

    /**
     * Deletes a mirrored file.
     *
     * @param filename the filename
     * @return true if a file was deleted
     */
    public boolean delete(final String filename) {
        try {
            return Files.deleteIfExists(resolve(filename));
        } catch (final IOException e) {
            throw new MirrorException("Failed to delete mirrored file "
                    + filename, ErrorCode.INDEX_IO, e);
        }
    }

    /**
     * Lists the mirrored module files.
     *
     * @return the filenames ending in {@value MirrorFilename#EXTENSION},
     *         sorted
     */
    public List<String> listModuleFiles() {
        if (!Files.isDirectory(outputDir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(outputDir)) {
            return files.filter(Files::isRegularFile)
                    .map(file -> file.getFileName().toString())
                    .filter(name -> name.endsWith(MirrorFilename.EXTENSION))
                    .sorted()
                    .toList();
        } catch (final IOException e) {
            throw new MirrorException("Failed to list " + outputDir,
                    ErrorCode.INDEX_IO, e);
        }
    }

    /** @return the mirror directory */
    public Path getOutputDir() {
        return outputDir;
    }

    private Path resolve(final String filename) {
        Preconditions.requireNonBlank(filename, "Filename is required");
        Preconditions.require(!filename.contains("/")
                && !filename.contains("\\") && !filename.equals("..")
                && !filename.equals("."),
                "Invalid mirror filename: " + filename);
        return outputDir.resolve(filename);
    }

}
