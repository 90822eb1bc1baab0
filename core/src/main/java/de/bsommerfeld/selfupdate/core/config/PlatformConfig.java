package de.bsommerfeld.selfupdate.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Capability switches consulted once at startup.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PlatformConfig {

    @JsonProperty("installable")
    private Installability installable = Installability.AUTO;

    /**
     * When disabled, artifacts are buffered in memory and written in one go
     * instead of being streamed to disk.
     */
    @JsonProperty("streaming-download")
    private boolean streamingDownload = true;

    public Installability getInstallable() {
        return installable;
    }

    public void setInstallable(Installability installable) {
        this.installable = installable;
    }

    public boolean isStreamingDownload() {
        return streamingDownload;
    }

    public void setStreamingDownload(boolean streamingDownload) {
        this.streamingDownload = streamingDownload;
    }
}
