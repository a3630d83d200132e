package eu.fbk.slopat.store;

import java.io.File;
import java.util.Properties;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * The configuration of a {@link GraphStore} handle.
 * <p>
 * Instances are immutable and created either via {@link #builder(File)} or out of a properties
 * table via {@link #fromProperties(Properties)}, using the keys {@value #PROPERTY_LOCATION}
 * (mandatory), {@value #PROPERTY_MODE} ({@code read-write} or {@code read-only}),
 * {@value #PROPERTY_TIMEOUT} (default query timeout in milliseconds) and
 * {@value #PROPERTY_TRANSACTIONS} (maximum number of concurrent transactions).
 * </p>
 */
public final class StoreConfig {

    public static final String PROPERTY_LOCATION = "slopat.store.location";

    public static final String PROPERTY_MODE = "slopat.store.mode";

    public static final String PROPERTY_TIMEOUT = "slopat.store.timeout";

    public static final String PROPERTY_TRANSACTIONS = "slopat.store.transactions";

    public static final long DEFAULT_QUERY_TIMEOUT = 30000L;

    public static final int DEFAULT_MAX_CONCURRENT_TRANSACTIONS = 8;

    /** The access mode of a store handle. */
    public enum Mode {

        /** Exclusive, locking access allowing writes. */
        READ_WRITE,

        /** Shared access to the last published snapshot; writes are rejected. */
        READ_ONLY;

        static Mode parse(final String string) {
            final String normalized = string.trim().toUpperCase().replace('-', '_');
            for (final Mode mode : values()) {
                if (mode.name().equals(normalized)) {
                    return mode;
                }
            }
            throw new IllegalArgumentException("Invalid store mode '" + string + "'");
        }

    }

    private final File location;

    private final Mode mode;

    private final long queryTimeout;

    private final int maxConcurrentTransactions;

    private StoreConfig(final Builder builder) {
        this.location = builder.location;
        this.mode = builder.mode;
        this.queryTimeout = builder.queryTimeout;
        this.maxConcurrentTransactions = builder.maxConcurrentTransactions;
    }

    public static Builder builder(final File location) {
        return new Builder(location);
    }

    /**
     * Creates a configuration out of the properties specified.
     *
     * @param properties
     *            the properties
     * @return the created configuration
     * @throws IllegalArgumentException
     *             if the location is missing or some value is invalid
     */
    public static StoreConfig fromProperties(final Properties properties) {
        final String location = properties.getProperty(PROPERTY_LOCATION);
        Preconditions.checkArgument(location != null && !location.trim().isEmpty(),
                "Missing property %s", PROPERTY_LOCATION);
        final Builder builder = builder(new File(location.trim()));
        final String mode = properties.getProperty(PROPERTY_MODE);
        if (mode != null) {
            builder.mode(Mode.parse(mode));
        }
        final String timeout = properties.getProperty(PROPERTY_TIMEOUT);
        if (timeout != null) {
            builder.queryTimeout(parseNumber(PROPERTY_TIMEOUT, timeout));
        }
        final String transactions = properties.getProperty(PROPERTY_TRANSACTIONS);
        if (transactions != null) {
            builder.maxConcurrentTransactions((int) parseNumber(PROPERTY_TRANSACTIONS,
                    transactions));
        }
        return builder.build();
    }

    private static long parseNumber(final String property, final String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (final NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid value '" + value + "' for property "
                    + property, ex);
        }
    }

    public File getLocation() {
        return this.location;
    }

    public Mode getMode() {
        return this.mode;
    }

    public boolean isReadOnly() {
        return this.mode == Mode.READ_ONLY;
    }

    /**
     * Returns the timeout in milliseconds applied to queries issued without an explicit one.
     */
    public long getQueryTimeout() {
        return this.queryTimeout;
    }

    public int getMaxConcurrentTransactions() {
        return this.maxConcurrentTransactions;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("location", this.location)
                .add("mode", this.mode).add("queryTimeout", this.queryTimeout)
                .add("maxConcurrentTransactions", this.maxConcurrentTransactions).toString();
    }

    public static final class Builder {

        final File location;

        Mode mode = Mode.READ_WRITE;

        long queryTimeout = DEFAULT_QUERY_TIMEOUT;

        int maxConcurrentTransactions = DEFAULT_MAX_CONCURRENT_TRANSACTIONS;

        Builder(final File location) {
            this.location = Preconditions.checkNotNull(location);
        }

        public Builder mode(final Mode mode) {
            this.mode = Preconditions.checkNotNull(mode);
            return this;
        }

        public Builder readOnly() {
            return mode(Mode.READ_ONLY);
        }

        public Builder queryTimeout(final long queryTimeout) {
            Preconditions.checkArgument(queryTimeout > 0, "Non-positive query timeout");
            this.queryTimeout = queryTimeout;
            return this;
        }

        public Builder maxConcurrentTransactions(final int maxConcurrentTransactions) {
            Preconditions.checkArgument(maxConcurrentTransactions > 0,
                    "Non-positive transaction limit");
            this.maxConcurrentTransactions = maxConcurrentTransactions;
            return this;
        }

        public StoreConfig build() {
            return new StoreConfig(this);
        }

    }

}
