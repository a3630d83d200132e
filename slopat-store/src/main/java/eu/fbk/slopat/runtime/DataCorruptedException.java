package eu.fbk.slopat.runtime;

import java.io.IOException;

import javax.annotation.Nullable;

/**
 * Signals that persisted store data is missing or damaged.
 * <p>
 * Thrown when a snapshot cannot be read back, or when a transaction can be neither committed nor
 * rolled back, leaving the in-memory graph in an unknown state. Other {@code IOException}s do not
 * imply damaged data and the failed operation may be retried.
 * </p>
 */
public class DataCorruptedException extends IOException {

    private static final long serialVersionUID = 1L;

    public DataCorruptedException(@Nullable final String message) {
        this(message, null);
    }

    public DataCorruptedException(@Nullable final String message,
            @Nullable final Throwable cause) {
        super(message, cause);
    }

}
