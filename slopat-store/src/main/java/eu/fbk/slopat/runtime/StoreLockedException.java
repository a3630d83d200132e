package eu.fbk.slopat.runtime;

import java.io.File;
import java.io.IOException;

/**
 * Signals that a storage location is already held by another read-write handle, either in this
 * process or in another one.
 */
public class StoreLockedException extends IOException {

    private static final long serialVersionUID = 1L;

    private final File location;

    public StoreLockedException(final File location) {
        super("Store at " + location + " is locked by another read-write handle");
        this.location = location;
    }

    /**
     * Returns the storage location that could not be locked.
     */
    public File getLocation() {
        return this.location;
    }

}
