package de.bsommerfeld.selfupdate.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Scratch storage housekeeping. Downloaded artifacts live in the cache tier
 * and are purged once they exceed this age.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class StorageConfig {

    @JsonProperty("stale-after-hours")
    private long staleAfterHours = 24;

    public long getStaleAfterHours() {
        return staleAfterHours;
    }

    public void setStaleAfterHours(long staleAfterHours) {
        this.staleAfterHours = staleAfterHours;
    }

    public Duration staleAfter() {
        return Duration.ofHours(staleAfterHours);
    }
}
