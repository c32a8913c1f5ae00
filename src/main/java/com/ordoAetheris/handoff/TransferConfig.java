package com.ordoAetheris.handoff;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Locale;
import java.util.Properties;

/**
 * Settings for one {@link TransferManager} run. Validated on construction, never coerced.
 *
 * <p>{@link #load()} reads {@code handoff.properties} from the classpath and lets system
 * properties override any key:
 * <pre>
 * handoff.capacity=10
 * handoff.producers=2
 * handoff.consumers=2
 * handoff.shutdown-mode=BROADCAST
 * handoff.join-timeout-ms=30000
 * handoff.pacing-ms=0
 * </pre>
 * <pre>
 * java -Dhandoff.capacity=1 ...
 * </pre>
 */
public final class TransferConfig {

    public static final String RESOURCE = "handoff.properties";

    public static final String CAPACITY = "handoff.capacity";
    public static final String PRODUCERS = "handoff.producers";
    public static final String CONSUMERS = "handoff.consumers";
    public static final String SHUTDOWN_MODE = "handoff.shutdown-mode";
    public static final String JOIN_TIMEOUT_MS = "handoff.join-timeout-ms";
    public static final String PACING_MS = "handoff.pacing-ms";

    private final int capacity;
    private final int producers;
    private final int consumers;
    private final ShutdownMode shutdownMode;
    private final Duration joinTimeout;
    private final Duration pacing;

    private TransferConfig(Builder b) {
        if (b.capacity <= 0) throw new IllegalArgumentException("capacity must be > 0, got " + b.capacity);
        if (b.producers <= 0) throw new IllegalArgumentException("producers must be > 0, got " + b.producers);
        if (b.consumers <= 0) throw new IllegalArgumentException("consumers must be > 0, got " + b.consumers);
        if (b.shutdownMode == null) throw new IllegalArgumentException("shutdownMode must not be null");
        if (b.shutdownMode == ShutdownMode.SYMMETRIC && b.producers != b.consumers) {
            throw new IllegalArgumentException("SYMMETRIC shutdown needs producers == consumers, got "
                    + b.producers + " producers and " + b.consumers + " consumers");
        }
        if (b.joinTimeout == null || b.joinTimeout.isZero() || b.joinTimeout.isNegative()) {
            throw new IllegalArgumentException("joinTimeout must be > 0, got " + b.joinTimeout);
        }
        if (b.pacing == null || b.pacing.isNegative()) {
            throw new IllegalArgumentException("pacing must be >= 0, got " + b.pacing);
        }
        this.capacity = b.capacity;
        this.producers = b.producers;
        this.consumers = b.consumers;
        this.shutdownMode = b.shutdownMode;
        this.joinTimeout = b.joinTimeout;
        this.pacing = b.pacing;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static TransferConfig defaults() {
        return builder().build();
    }

    /** Classpath {@value #RESOURCE} overlaid with system properties. */
    public static TransferConfig load() {
        Properties merged = new Properties();
        try (InputStream in = TransferConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) merged.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read " + RESOURCE, e);
        }
        merged.putAll(System.getProperties());
        return fromProperties(merged);
    }

    /** Missing keys keep their defaults; malformed values throw {@link IllegalArgumentException}. */
    public static TransferConfig fromProperties(Properties props) {
        Builder b = builder();
        String v;
        if ((v = props.getProperty(CAPACITY)) != null) b.capacity(parseInt(CAPACITY, v));
        if ((v = props.getProperty(PRODUCERS)) != null) b.producers(parseInt(PRODUCERS, v));
        if ((v = props.getProperty(CONSUMERS)) != null) b.consumers(parseInt(CONSUMERS, v));
        if ((v = props.getProperty(SHUTDOWN_MODE)) != null) b.shutdownMode(parseMode(v));
        if ((v = props.getProperty(JOIN_TIMEOUT_MS)) != null) b.joinTimeout(Duration.ofMillis(parseLong(JOIN_TIMEOUT_MS, v)));
        if ((v = props.getProperty(PACING_MS)) != null) b.pacing(Duration.ofMillis(parseLong(PACING_MS, v)));
        return b.build();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not an integer: '" + value + "'", e);
        }
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not an integer: '" + value + "'", e);
        }
    }

    private static ShutdownMode parseMode(String value) {
        try {
            return ShutdownMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(SHUTDOWN_MODE + " must be SYMMETRIC or BROADCAST, got '" + value + "'", e);
        }
    }

    public int capacity() {
        return capacity;
    }

    public int producers() {
        return producers;
    }

    public int consumers() {
        return consumers;
    }

    public ShutdownMode shutdownMode() {
        return shutdownMode;
    }

    public Duration joinTimeout() {
        return joinTimeout;
    }

    public Duration pacing() {
        return pacing;
    }

    @Override
    public String toString() {
        return String.format("TransferConfig{capacity=%d, producers=%d, consumers=%d, shutdownMode=%s, joinTimeout=%dms, pacing=%dms}",
                capacity, producers, consumers, shutdownMode, joinTimeout.toMillis(), pacing.toMillis());
    }

    public static final class Builder {

        private int capacity = 10;
        private int producers = 1;
        private int consumers = 1;
        private ShutdownMode shutdownMode = ShutdownMode.BROADCAST;
        private Duration joinTimeout = Duration.ofSeconds(30);
        private Duration pacing = Duration.ZERO;

        private Builder() {
        }

        public Builder capacity(int capacity) {
            this.capacity = capacity;
            return this;
        }

        public Builder producers(int producers) {
            this.producers = producers;
            return this;
        }

        public Builder consumers(int consumers) {
            this.consumers = consumers;
            return this;
        }

        public Builder shutdownMode(ShutdownMode shutdownMode) {
            this.shutdownMode = shutdownMode;
            return this;
        }

        public Builder joinTimeout(Duration joinTimeout) {
            this.joinTimeout = joinTimeout;
            return this;
        }

        public Builder pacing(Duration pacing) {
            this.pacing = pacing;
            return this;
        }

        public TransferConfig build() {
            return new TransferConfig(this);
        }
    }
}
