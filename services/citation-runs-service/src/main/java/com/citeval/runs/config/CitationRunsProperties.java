package com.citeval.runs.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "citation-runs")
public class CitationRunsProperties {

    private int defaultRecentLimit = 20;
    private int maxRecentLimit = 200;

    public int getDefaultRecentLimit() {
        return defaultRecentLimit;
    }

    public void setDefaultRecentLimit(int defaultRecentLimit) {
        this.defaultRecentLimit = defaultRecentLimit;
    }

    public int getMaxRecentLimit() {
        return maxRecentLimit;
    }

    public void setMaxRecentLimit(int maxRecentLimit) {
        this.maxRecentLimit = maxRecentLimit;
    }
}
