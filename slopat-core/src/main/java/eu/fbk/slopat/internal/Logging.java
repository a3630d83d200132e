package eu.fbk.slopat.internal;

import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.collect.Maps;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.pattern.ClassicConverter;
import ch.qos.logback.classic.spi.ILoggingEvent;

/**
 * Logging support: MDC handling and Logback extensions.
 * <p>
 * The MDC key {@link #MDC_CONTEXT} carries the identifier of the document being processed, so
 * that log lines emitted while processing it, possibly by several worker threads at once, can be
 * told apart. Logback configurations can render it via {@link ContextConverter}:
 * </p>
 *
 * <pre>
 * &lt;conversionRule conversionWord="context"
 *     converterClass="eu.fbk.slopat.internal.Logging$ContextConverter" /&gt;
 * </pre>
 */
public final class Logging {

    private static final Logger LOGGER = LoggerFactory.getLogger(Logging.class);

    public static final String MDC_CONTEXT = "context";

    private Logging() {
    }

    @Nullable
    public static Map<String, String> getMDC() {
        try {
            return MDC.getCopyOfContextMap();
        } catch (final Throwable ex) {
            LOGGER.warn("Could not retrieve MDC map", ex);
            return null;
        }
    }

    public static void setMDC(@Nullable final Map<String, String> mdc) {
        try {
            MDC.setContextMap(mdc == null ? Maps.<String, String>newHashMap() : mdc);
        } catch (final Throwable ex) {
            LOGGER.warn("Could not update MDC map", ex);
        }
    }

    /**
     * Sets the MDC context value, returning the previous MDC map so that it can be restored with
     * {@link #setMDC(Map)}.
     *
     * @param context
     *            the new context value, null to remove it
     * @return the previous MDC map, possibly null
     */
    @Nullable
    public static Map<String, String> setContext(@Nullable final String context) {
        final Map<String, String> old = getMDC();
        if (context == null) {
            MDC.remove(MDC_CONTEXT);
        } else {
            MDC.put(MDC_CONTEXT, context);
        }
        return old;
    }

    public static final class ContextConverter extends ClassicConverter {

        @Override
        public String convert(final ILoggingEvent event) {
            final String context = event.getMDCPropertyMap().get(MDC_CONTEXT);
            final String logger = event.getLevel().toInt() >= Level.WARN_INT ? event
                    .getLoggerName() : null;
            if (context == null) {
                return logger == null ? "" : "[" + logger + "] ";
            } else {
                return logger == null ? "[" + context + "] " : "[" + context + "][" + logger
                        + "] ";
            }
        }

    }

}
