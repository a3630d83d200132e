package eu.fbk.slopat.runtime;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.lang.management.ManagementFactory;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

import com.google.common.base.Preconditions;
import com.google.common.collect.Sets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An exclusive, process-level lock on a storage location.
 * <p>
 * The lock is an OS file lock on file {@value #FILE_NAME} inside the locked directory, so it
 * excludes both other processes and other handles in the same JVM. It is released by
 * {@link #close()} or, if the process dies, by the OS. The lock file itself is left in place and
 * records the name of the last process holding the lock.
 * </p>
 * <p>
 * Locks held by this JVM are also tracked in memory and checked before the lock file is opened,
 * as on some platforms closing any channel on the file drops the OS locks of the whole process.
 * </p>
 */
public final class StoreLock implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(StoreLock.class);

    public static final String FILE_NAME = "write.lock";

    private static final Set<String> HELD = Sets.newConcurrentHashSet();

    private final File file;

    private final RandomAccessFile raf;

    private final FileLock lock;

    private final AtomicBoolean closed;

    private StoreLock(final File file, final RandomAccessFile raf, final FileLock lock) {
        this.file = file;
        this.raf = raf;
        this.lock = lock;
        this.closed = new AtomicBoolean(false);
    }

    /**
     * Acquires the lock on the directory specified, without waiting.
     *
     * @param directory
     *            the storage location, which must exist
     * @return the acquired lock
     * @throws StoreLockedException
     *             if the lock is held by someone else
     * @throws IOException
     *             if the lock file cannot be created or locked
     */
    public static StoreLock acquire(final File directory) throws IOException {

        Preconditions.checkNotNull(directory);

        final File file = new File(directory, FILE_NAME).getCanonicalFile();
        if (!HELD.add(file.getPath())) {
            throw new StoreLockedException(directory);
        }

        RandomAccessFile raf = null;
        boolean acquired = false;
        try {
            raf = new RandomAccessFile(file, "rw");
            final FileChannel channel = raf.getChannel();
            FileLock lock;
            try {
                lock = channel.tryLock();
            } catch (final OverlappingFileLockException ex) {
                lock = null; // held by this JVM
            }
            if (lock == null) {
                throw new StoreLockedException(directory);
            }
            final byte[] owner = ManagementFactory.getRuntimeMXBean().getName()
                    .getBytes(StandardCharsets.UTF_8);
            raf.setLength(0);
            raf.write(owner);
            LOGGER.debug("Lock acquired on {}", file);
            acquired = true;
            return new StoreLock(file, raf, lock);

        } finally {
            if (!acquired) {
                HELD.remove(file.getPath());
                if (raf != null) {
                    raf.close(); // also releases the lock, if obtained
                }
            }
        }
    }

    public File getFile() {
        return this.file;
    }

    public boolean isHeld() {
        return !this.closed.get() && this.lock.isValid();
    }

    @Override
    public void close() throws IOException {
        if (!this.closed.compareAndSet(false, true)) {
            return;
        }
        try {
            if (this.lock.isValid()) {
                this.lock.release();
            }
            LOGGER.debug("Lock released on {}", this.file);
        } finally {
            try {
                this.raf.close();
            } finally {
                HELD.remove(this.file.getPath());
            }
        }
    }

    @Override
    public String toString() {
        return "StoreLock(" + this.file + (isHeld() ? ")" : ", released)");
    }

}
