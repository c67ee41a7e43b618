package com.flashtasks.search.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search")
public class SearchProperties {
    private int defaultLimit = 10;
    private int maxLimit = 50;
    private int minQueryLength = 2;
    private long mappingRefreshIntervalMs = 0L;

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public void setDefaultLimit(int defaultLimit) {
        this.defaultLimit = defaultLimit;
    }

    public int getMaxLimit() {
        return maxLimit;
    }

    public void setMaxLimit(int maxLimit) {
        this.maxLimit = maxLimit;
    }

    public int getMinQueryLength() {
        return minQueryLength;
    }

    public void setMinQueryLength(int minQueryLength) {
        this.minQueryLength = minQueryLength;
    }

    public long getMappingRefreshIntervalMs() {
        return mappingRefreshIntervalMs;
    }

    public void setMappingRefreshIntervalMs(long mappingRefreshIntervalMs) {
        this.mappingRefreshIntervalMs = mappingRefreshIntervalMs;
    }
}
