package co.fanki.cdnmirror.index.domain;

import co.fanki.cdnmirror.shared.ErrorCode;
import co.fanki.cdnmirror.shared.MirrorConfigurationException;
import co.fanki.cdnmirror.shared.MirrorException;
import co.fanki.cdnmirror.shared.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Reads and writes the lookup index file.
 *
 * <p>Saving writes a sibling temporary file and moves it over the index,
 * so a failed run leaves the previous index intact.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class LookupIndexRepository {

    private static final Logger LOG = LoggerFactory.getLogger(
            LookupIndexRepository.class);

    private final Path indexFile;

    /**
     * Creates a new repository.
     *
     * @param theIndexFile the index file
     */
    public LookupIndexRepository(final Path theIndexFile) {
        this.indexFile = Preconditions.requireNonNull(theIndexFile,
                "Index file is required").toAbsolutePath();
    }

    /**
     * Loads the index of a previous analysis.
     *
     * @return the index
     * @throws MirrorConfigurationException if there is no index file
     */
    public LookupIndex load() {
        if (!Files.isRegularFile(indexFile)) {
            throw new MirrorConfigurationException(
                    "Lookup index not found, run the analyze stage first: "
                            + indexFile);
        }
        return read();
    }

    /**
     * Loads the index, or starts a new one.
     *
     * @return the stored index, or an empty one if there is no file
     */
    public LookupIndex loadOrEmpty() {
        if (!Files.isRegularFile(indexFile)) {
            LOG.info("No lookup index at {}, starting a new one", indexFile);
            return LookupIndex.empty();
        }
        return read();
    }

    /**
     * Replaces the index file.
     *
     * @param index the index
     */
    public void save(final LookupIndex index) {
        Preconditions.requireNonNull(index, "Index is required");
        final Path temp = indexFile.resolveSibling(
                indexFile.getFileName() + ".tmp");
        try {
            Files.createDirectories(indexFile.getParent());
            Files.writeString(temp, index.toJson(), StandardCharsets.UTF_8);
            Files.move(temp, indexFile, StandardCopyOption.ATOMIC_MOVE,
                    StandardCopyOption.REPLACE_EXISTING);
        } catch (final IOException e) {
            throw new MirrorException("Failed to write lookup index "
                    + indexFile, ErrorCode.INDEX_IO, e);
        }
        LOG.debug("Saved lookup index to {}", indexFile);
    }

    /**
     * Takes the single-writer lock on the index.
     *
     * @return the lock, to be closed when the stage ends
     * @throws MirrorException with {@link ErrorCode#INDEX_LOCKED} if
     *         another run holds it
     */
    public IndexLock acquireLock() {
        final Path lockFile = indexFile.resolveSibling(
                indexFile.getFileName() + ".lock");
        FileChannel channel = null;
        try {
            Files.createDirectories(indexFile.getParent());
            channel = FileChannel.open(lockFile, StandardOpenOption.CREATE,
                    StandardOpenOption.WRITE);
            final FileLock lock = channel.tryLock();
            if (lock == null) {
                channel.close();
                throw locked(lockFile, null);
            }
            return new IndexLock(channel, lock);
        } catch (final OverlappingFileLockException e) {
            closeQuietly(channel);
            throw locked(lockFile, e);
        } catch (final IOException e) {
            closeQuietly(channel);
            throw new MirrorException("Failed to lock " + lockFile,
                    ErrorCode.INDEX_IO, e);
        }
    }

    /** @return the index file */
    public Path getIndexFile() {
        return indexFile;
    }

    private LookupIndex read() {
        try {
            return LookupIndex.fromJson(Files.readString(indexFile,
                    StandardCharsets.UTF_8));
        } catch (final IOException e) {
            throw new MirrorException("Failed to read lookup index "
                    + indexFile, ErrorCode.INDEX_IO, e);
        }
    }

    private static MirrorException locked(final Path lockFile,
            final Exception cause) {
        return new MirrorException("Lookup index is in use by another run: "
                + lockFile, ErrorCode.INDEX_LOCKED, cause);
    }

    private static void closeQuietly(final FileChannel channel) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (final IOException e) {
            LOG.warn("Failed to close lock channel: {}", e.getMessage());
        }
    }

}
