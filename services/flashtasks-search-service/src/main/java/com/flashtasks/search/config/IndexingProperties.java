package com.flashtasks.search.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "indexing")
public class IndexingProperties {
    private String webhookSecret;
    private boolean refreshAfterWrite = true;
    /**
     * When disabled, concurrent child merges into the same organization are last-writer-wins.
     */
    private boolean optimisticConcurrency = false;
    private int maxConflictRetries = 3;

    public String getWebhookSecret() {
        return webhookSecret;
    }

    public void setWebhookSecret(String webhookSecret) {
        this.webhookSecret = webhookSecret;
    }

    public boolean isRefreshAfterWrite() {
        return refreshAfterWrite;
    }

    public void setRefreshAfterWrite(boolean refreshAfterWrite) {
        this.refreshAfterWrite = refreshAfterWrite;
    }

    public boolean isOptimisticConcurrency() {
        return optimisticConcurrency;
    }

    public void setOptimisticConcurrency(boolean optimisticConcurrency) {
        this.optimisticConcurrency = optimisticConcurrency;
    }

    public int getMaxConflictRetries() {
        return maxConflictRetries;
    }

    public void setMaxConflictRetries(int maxConflictRetries) {
        this.maxConflictRetries = maxConflictRetries;
    }
}
