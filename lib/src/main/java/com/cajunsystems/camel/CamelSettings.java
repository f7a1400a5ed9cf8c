package com.cajunsystems.camel;

import java.time.Duration;

/**
 * Configuration for a {@link CamelExtension}.
 */
public class CamelSettings {
    public static final Duration DEFAULT_REPLY_TIMEOUT = Duration.ofMinutes(1);
    public static final Duration DEFAULT_ACTIVATION_TIMEOUT = Duration.ofSeconds(10);
    public static final String DEFAULT_CONTEXT_NAME = "cajun-camel";
    private static final int DEFAULT_SHUTDOWN_TIMEOUT_SECONDS = 5;

    private Duration replyTimeout = DEFAULT_REPLY_TIMEOUT;
    private Duration activationTimeout = DEFAULT_ACTIVATION_TIMEOUT;
    private String contextName = DEFAULT_CONTEXT_NAME;
    private boolean jmxEnabled = false;
    private boolean streamCaching = false;
    private int shutdownTimeoutSeconds = DEFAULT_SHUTDOWN_TIMEOUT_SECONDS;

    /**
     * Creates settings with default values.
     */
    public CamelSettings() {
        // Use defaults
    }

    /**
     * Default reply timeout of consumers that do not set their own.
     */
    public Duration getReplyTimeout() {
        return replyTimeout;
    }

    public CamelSettings setReplyTimeout(Duration replyTimeout) {
        this.replyTimeout = requirePositive(replyTimeout, "replyTimeout");
        return this;
    }

    /**
     * Timeout used by the activation and deactivation waits that take no explicit timeout.
     */
    public Duration getActivationTimeout() {
        return activationTimeout;
    }

    public CamelSettings setActivationTimeout(Duration activationTimeout) {
        this.activationTimeout = requirePositive(activationTimeout, "activationTimeout");
        return this;
    }

    public String getContextName() {
        return contextName;
    }

    public CamelSettings setContextName(String contextName) {
        this.contextName = contextName;
        return this;
    }

    public boolean isJmxEnabled() {
        return jmxEnabled;
    }

    public CamelSettings setJmxEnabled(boolean jmxEnabled) {
        this.jmxEnabled = jmxEnabled;
        return this;
    }

    public boolean isStreamCaching() {
        return streamCaching;
    }

    public CamelSettings setStreamCaching(boolean streamCaching) {
        this.streamCaching = streamCaching;
        return this;
    }

    /**
     * Seconds to wait for pending route changes when the extension is closed.
     */
    public int getShutdownTimeoutSeconds() {
        return shutdownTimeoutSeconds;
    }

    public CamelSettings setShutdownTimeoutSeconds(int shutdownTimeoutSeconds) {
        this.shutdownTimeoutSeconds = shutdownTimeoutSeconds;
        return this;
    }

    static Duration requirePositive(Duration duration, String name) {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(name + " must be positive: " + duration);
        }
        return duration;
    }

    @Override
    public String toString() {
        return "CamelSettings{replyTimeout=" + replyTimeout
                + ", activationTimeout=" + activationTimeout
                + ", contextName='" + contextName + '\''
                + ", jmxEnabled=" + jmxEnabled
                + ", streamCaching=" + streamCaching + '}';
    }
}
