package io.github.drompincen.bugflow.runtime.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings for activity feed reads, bound from {@code bugflow.activity.*}.
 */
@ConfigurationProperties(prefix = "bugflow.activity")
public class ActivityProperties {

    /** Upper bound accepted for {@code limit} on recent-activity reads. */
    private int maxRecentLimit = 1000;

    /** How long a display-name lookup may take before its placeholder is used. */
    private Duration enrichmentTimeout = Duration.ofSeconds(5);

    /** How many per-bug sequence cursors stay cached; older ones are reloaded from the store. */
    private int cursorCacheSize = 10_000;

    public int getMaxRecentLimit() { return maxRecentLimit; }
    public void setMaxRecentLimit(int maxRecentLimit) { this.maxRecentLimit = maxRecentLimit; }

    public int getCursorCacheSize() { return cursorCacheSize; }
    public void setCursorCacheSize(int cursorCacheSize) { this.cursorCacheSize = cursorCacheSize; }

    public Duration getEnrichmentTimeout() { return enrichmentTimeout; }
    public void setEnrichmentTimeout(Duration enrichmentTimeout) { this.enrichmentTimeout = enrichmentTimeout; }
}
