package io.tiller.core;

import io.tiller.core.router.CircuitBreaker;
import io.tiller.core.router.ConsentMode;
import io.tiller.core.slot.ClarifierSettings;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;

/// Configuration options for the Tiller orchestration environment.
///
/// ### Default Values
/// - `threadPoolSize`: `10` (size of each of two pools, one for parallel plan steps
///   and one for source fetches)
/// - `suspendTtl`: 1 hour
/// - `historyWindow`: `5` user messages
/// - `skipIntents`: `intro`, `unclear`
/// - `circuitThreshold`: `3` consecutive failures
/// - `circuitResetTimeout`: 300 seconds
/// - `maxAutoTier`: `2`, `maxTier`: `4`
/// - `consentMode`: {@link ConsentMode#EITHER}
/// - `capabilityTimeout`: 30 seconds
/// - `epilogueCapability`: none
///
/// @implNote **Not thread-safe**. This is a mutable configuration object
/// intended to be configured before passing to {@link TillerFactory}.
/// Do not modify after environment creation.
///
/// @see TillerFactory.Builder#config(TillerConfig)
public class TillerConfig {
    private int threadPoolSize = 10;
    private Duration suspendTtl = Duration.ofHours(1);
    private int historyWindow = ClarifierSettings.DEFAULT_HISTORY_WINDOW;
    private Set<String> skipIntents = new LinkedHashSet<>(Set.of("intro", "unclear"));
    private int circuitThreshold = CircuitBreaker.DEFAULT_THRESHOLD;
    private Duration circuitResetTimeout = CircuitBreaker.DEFAULT_RESET_TIMEOUT;
    private int maxAutoTier = 2;
    private int maxTier = 4;
    private ConsentMode consentMode = ConsentMode.EITHER;
    private Duration capabilityTimeout = Duration.ofSeconds(30);
    private String epilogueCapability;

    public TillerConfig() {}

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    /// Sets the size of each worker pool. Parallel plan steps and source fetches run
    /// on separate pools of this size.
    ///
    /// ### Contracts
    /// - **Precondition**: `threadPoolSize` should be positive
    ///
    /// @param threadPoolSize number of platform threads, must be positive
    public void setThreadPoolSize(int threadPoolSize) {
        this.threadPoolSize = threadPoolSize;
    }

    /// Returns how long a suspended clarification stays resumable.
    ///
    /// @return suspend TTL, never null
    public Duration getSuspendTtl() {
        return suspendTtl;
    }

    public void setSuspendTtl(Duration suspendTtl) {
        this.suspendTtl = suspendTtl;
    }

    public int getHistoryWindow() {
        return historyWindow;
    }

    public void setHistoryWindow(int historyWindow) {
        this.historyWindow = historyWindow;
    }

    public Set<String> getSkipIntents() {
        return skipIntents;
    }

    public void setSkipIntents(Set<String> skipIntents) {
        this.skipIntents = skipIntents;
    }

    public int getCircuitThreshold() {
        return circuitThreshold;
    }

    public void setCircuitThreshold(int circuitThreshold) {
        this.circuitThreshold = circuitThreshold;
    }

    public Duration getCircuitResetTimeout() {
        return circuitResetTimeout;
    }

    public void setCircuitResetTimeout(Duration circuitResetTimeout) {
        this.circuitResetTimeout = circuitResetTimeout;
    }

    /// Returns the highest tier the router enters without consent.
    ///
    /// @return max auto tier, >= 1
    public int getMaxAutoTier() {
        return maxAutoTier;
    }

    public void setMaxAutoTier(int maxAutoTier) {
        this.maxAutoTier = maxAutoTier;
    }

    public int getMaxTier() {
        return maxTier;
    }

    public void setMaxTier(int maxTier) {
        this.maxTier = maxTier;
    }

    public ConsentMode getConsentMode() {
        return consentMode;
    }

    public void setConsentMode(ConsentMode consentMode) {
        this.consentMode = consentMode;
    }

    public Duration getCapabilityTimeout() {
        return capabilityTimeout;
    }

    public void setCapabilityTimeout(Duration capabilityTimeout) {
        this.capabilityTimeout = capabilityTimeout;
    }

    /// Returns the capability forced to the end of planned sequences.
    ///
    /// @return epilogue capability name, may be null
    public String getEpilogueCapability() {
        return epilogueCapability;
    }

    public void setEpilogueCapability(String epilogueCapability) {
        this.epilogueCapability = epilogueCapability;
    }

    public ClarifierSettings clarifierSettings() {
        return new ClarifierSettings(historyWindow, skipIntents);
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link TillerConfig}.
    ///
    /// @implNote The builder mutates a single config instance and returns
    /// it on {@link #build()}.
    public static class Builder {
        private final TillerConfig config = new TillerConfig();

        public Builder threadPoolSize(int threadPoolSize) {
            config.threadPoolSize = threadPoolSize;
            return this;
        }

        public Builder suspendTtl(Duration suspendTtl) {
            config.suspendTtl = suspendTtl;
            return this;
        }

        public Builder historyWindow(int historyWindow) {
            config.historyWindow = historyWindow;
            return this;
        }

        public Builder skipIntents(Set<String> skipIntents) {
            config.skipIntents = new LinkedHashSet<>(skipIntents);
            return this;
        }

        public Builder circuitThreshold(int circuitThreshold) {
            config.circuitThreshold = circuitThreshold;
            return this;
        }

        public Builder circuitResetTimeout(Duration circuitResetTimeout) {
            config.circuitResetTimeout = circuitResetTimeout;
            return this;
        }

        /// Sets the tier bounds of the router.
        ///
        /// @param maxAutoTier highest tier entered without consent, >= 1
        /// @param maxTier highest tier entered at all, >= `maxAutoTier`
        /// @return this builder for chaining, never null
        public Builder tiers(int maxAutoTier, int maxTier) {
            config.maxAutoTier = maxAutoTier;
            config.maxTier = maxTier;
            return this;
        }

        public Builder consentMode(ConsentMode consentMode) {
            config.consentMode = consentMode;
            return this;
        }

        public Builder capabilityTimeout(Duration capabilityTimeout) {
            config.capabilityTimeout = capabilityTimeout;
            return this;
        }

        public Builder epilogueCapability(String epilogueCapability) {
            config.epilogueCapability = epilogueCapability;
            return this;
        }

        public TillerConfig build() {
            return config;
        }
    }
}
