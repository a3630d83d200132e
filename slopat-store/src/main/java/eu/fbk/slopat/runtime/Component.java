package eu.fbk.slopat.runtime;

import java.io.Closeable;
import java.io.IOException;

/**
 * A store-side component with an explicit lifecycle.
 * <p>
 * A {@code Component} is first created and configured, without allocating any resource or
 * touching persistent data. Method {@link #init()} then makes it operational, possibly loading
 * data and starting background activities; it is called once, before any other method. Method
 * {@link #close()} disposes the component and may be called at any time, even before
 * initialization or while other methods are running in other threads; calling it more than once
 * has no effect.
 * </p>
 * <p>
 * Methods may throw {@link IOException}s, and in particular {@link DataCorruptedException}s when
 * persisted data is found missing or damaged.
 * </p>
 */
public interface Component extends Closeable {

    /**
     * Initializes the component, making it operational.
     *
     * @throws IOException
     *             if initialization fails
     * @throws IllegalStateException
     *             if the component has already been initialized or closed
     */
    void init() throws IOException, IllegalStateException;

    /**
     * Closes the component, releasing its resources and aborting pending operations. Persisted
     * data is left as is.
     */
    @Override
    void close();

}
