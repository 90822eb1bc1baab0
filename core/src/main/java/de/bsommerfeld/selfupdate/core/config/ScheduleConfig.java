package de.bsommerfeld.selfupdate.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ScheduleConfig {

    @JsonProperty("enabled")
    private boolean enabled = true;

    @JsonProperty("interval-minutes")
    private long intervalMinutes = 60;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getIntervalMinutes() {
        return intervalMinutes;
    }

    public void setIntervalMinutes(long intervalMinutes) {
        this.intervalMinutes = intervalMinutes;
    }
}
