package io.fetch4j.config;

import io.fetch4j.core.RetryPolicy;

import java.time.Duration;

/**
 * Runtime configuration for scheduler and worker behavior.
 */
public class FetchProperties {
    private int maxConcurrency = 2;
    private Duration processEvery = Duration.ofSeconds(5);
    private int maxRetries = RetryPolicy.DEFAULT_MAX_RETRIES;
    private Duration retryBaseDelay = RetryPolicy.DEFAULT_BASE_DELAY;
    private String timezone = "UTC";
    private Duration taskRetention = Duration.ofHours(24);
    private Duration shutdownTimeout = Duration.ofSeconds(30);
    private boolean ensureIndexesOnStartup = false;

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public Duration getProcessEvery() {
        return processEvery;
    }

    public void setProcessEvery(Duration processEvery) {
        this.processEvery = processEvery;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Duration getRetryBaseDelay() {
        return retryBaseDelay;
    }

    public void setRetryBaseDelay(Duration retryBaseDelay) {
        this.retryBaseDelay = retryBaseDelay;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public Duration getTaskRetention() {
        return taskRetention;
    }

    public void setTaskRetention(Duration taskRetention) {
        this.taskRetention = taskRetention;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public RetryPolicy retryPolicy() {
        return RetryPolicy.of(maxRetries, retryBaseDelay);
    }
}
