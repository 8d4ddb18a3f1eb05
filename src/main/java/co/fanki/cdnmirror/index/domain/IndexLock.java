package co.fanki.cdnmirror.index.domain;

import co.fanki.cdnmirror.shared.ErrorCode;
import co.fanki.cdnmirror.shared.MirrorException;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;

/**
 * Exclusive ownership of the lookup index for the duration of a stage.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class IndexLock implements AutoCloseable {

    private final FileChannel channel;

    private final FileLock lock;

    IndexLock(final FileChannel theChannel, final FileLock theLock) {
        this.channel = theChannel;
        this.lock = theLock;
    }

    /** @return true while the lock is held */
    public boolean isValid() {
        return lock.isValid();
    }

    /** Releases the lock. */
    @Override
    public void close() {
        try {
            if (lock.isValid()) {
                lock.release();
            }
            channel.close();
        } catch (final IOException e) {
            throw new MirrorException("Failed to release index lock",
                    ErrorCode.INDEX_IO, e);
        }
    }

}
