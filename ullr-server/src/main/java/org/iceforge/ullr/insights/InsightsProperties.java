package org.iceforge.ullr.insights;

import org.iceforge.ullr.logs.LogModels;
import org.iceforge.ullr.query.PollingPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Polling, retry and sampling settings for Logs Insights queries.
 */
@ConfigurationProperties(prefix = "ullr.insights")
public class InsightsProperties {

    /** Wait before the second status check; later waits grow by {@link #pollMultiplier}. */
    private Duration pollInitialDelay = Duration.ofMillis(500);

    private Duration pollMaxDelay = Duration.ofSeconds(5);

    private double pollMultiplier = 2.0;

    /** Local ceiling for one query, submit to last poll. The remote query is not cancelled. */
    private Duration timeout = Duration.ofSeconds(60);

    /** Retries per status check on throttling or network faults. */
    private int maxTransientRetries = 5;

    private Duration retryBaseDelay = Duration.ofMillis(250);

    private Duration retryMaxDelay = Duration.ofSeconds(4);

    /** Window searched when a request gives no start time. */
    private Duration defaultLookback = Duration.ofHours(24);

    /** Rows pulled by the field discovery query. */
    private int sampleLimit = 20;

    private String messageField = LogModels.MESSAGE_FIELD;

    /** Check every log group exists before starting a query. */
    private boolean verifySources = true;

    public PollingPolicy toPollingPolicy() {
        return new PollingPolicy(pollInitialDelay, pollMaxDelay, pollMultiplier, timeout,
                maxTransientRetries, retryBaseDelay, retryMaxDelay);
    }

    public String samplingQuery() {
        return "fields " + LogModels.TIMESTAMP_FIELD + ", " + messageField + " | limit " + sampleLimit;
    }

    public Duration getPollInitialDelay() {
        return pollInitialDelay;
    }

    public void setPollInitialDelay(Duration pollInitialDelay) {
        this.pollInitialDelay = pollInitialDelay;
    }

    public Duration getPollMaxDelay() {
        return pollMaxDelay;
    }

    public void setPollMaxDelay(Duration pollMaxDelay) {
        this.pollMaxDelay = pollMaxDelay;
    }

    public double getPollMultiplier() {
        return pollMultiplier;
    }

    public void setPollMultiplier(double pollMultiplier) {
        this.pollMultiplier = pollMultiplier;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public int getMaxTransientRetries() {
        return maxTransientRetries;
    }

    public void setMaxTransientRetries(int maxTransientRetries) {
        this.maxTransientRetries = maxTransientRetries;
    }

    public Duration getRetryBaseDelay() {
        return retryBaseDelay;
    }

    public void setRetryBaseDelay(Duration retryBaseDelay) {
        this.retryBaseDelay = retryBaseDelay;
    }

    public Duration getRetryMaxDelay() {
        return retryMaxDelay;
    }

    public void setRetryMaxDelay(Duration retryMaxDelay) {
        this.retryMaxDelay = retryMaxDelay;
    }

    public Duration getDefaultLookback() {
        return defaultLookback;
    }

    public void setDefaultLookback(Duration defaultLookback) {
        this.defaultLookback = defaultLookback;
    }

    public int getSampleLimit() {
        return sampleLimit;
    }

    public void setSampleLimit(int sampleLimit) {
        this.sampleLimit = sampleLimit;
    }

    public String getMessageField() {
        return messageField;
    }

    public void setMessageField(String messageField) {
        this.messageField = messageField;
    }

    public boolean isVerifySources() {
        return verifySources;
    }

    public void setVerifySources(boolean verifySources) {
        this.verifySources = verifySources;
    }
}
