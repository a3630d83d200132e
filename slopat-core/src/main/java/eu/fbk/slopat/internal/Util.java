package eu.fbk.slopat.internal;

import java.io.IOException;
import java.lang.Thread.UncaughtExceptionHandler;
import java.net.URL;
import java.util.concurrent.Executors;

import javax.annotation.Nullable;

import com.google.common.base.Charsets;
import com.google.common.io.Resources;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import info.aduna.iteration.CloseableIteration;

public final class Util {

    private static final Logger LOGGER = LoggerFactory.getLogger(Util.class);

    private static final UncaughtExceptionHandler LOGGING_HANDLER = new UncaughtExceptionHandler() {

        @Override
        public void uncaughtException(final Thread thread, final Throwable ex) {
            LOGGER.error("Uncaught exception in " + thread.getName(), ex);
        }

    };

    /**
     * Reads a UTF-8 text resource located relative to a class. A missing resource denotes a
     * broken build, hence an {@code Error} is thrown.
     *
     * @param referenceClass
     *            the class the resource name is relative to
     * @param resourceName
     *            the resource name
     * @return the resource text
     */
    public static String getResource(final Class<?> referenceClass, final String resourceName) {
        final URL url = referenceClass.getResource(resourceName);
        if (url == null) {
            throw new Error("Resource " + resourceName + " not found next to "
                    + referenceClass.getName());
        }
        try {
            return Resources.toString(url, Charsets.UTF_8);
        } catch (final IOException ex) {
            throw new Error("Could not read resource " + url, ex);
        }
    }

    /**
     * Closes a {@code Closeable} or a Sesame {@code CloseableIteration}, logging failures. Other
     * objects and null are ignored.
     *
     * @param object
     *            the object to close, possibly null
     */
    public static void closeQuietly(@Nullable final Object object) {
        try {
            if (object instanceof AutoCloseable) {
                ((AutoCloseable) object).close();
            } else if (object instanceof CloseableIteration<?, ?>) {
                ((CloseableIteration<?, ?>) object).close();
            }
        } catch (final Throwable ex) {
            LOGGER.error("Could not close " + object, ex);
        }
    }

    /**
     * Creates a fixed pool of daemon threads, named after the format specified and logging the
     * exceptions escaping their tasks.
     *
     * @param size
     *            the number of threads
     * @param nameFormat
     *            the thread name format, with a {@code %d} placeholder for the thread number
     * @return the created executor
     */
    public static ListeningExecutorService newExecutor(final int size, final String nameFormat) {
        return MoreExecutors.listeningDecorator(Executors.newFixedThreadPool(size,
                new ThreadFactoryBuilder().setDaemon(true).setNameFormat(nameFormat)
                        .setUncaughtExceptionHandler(LOGGING_HANDLER).build()));
    }

    private Util() {
    }

}
