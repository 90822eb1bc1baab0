package de.bsommerfeld.selfupdate.broadcast;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * In-app notification pushed through the host's real-time channel.
 *
 * @param versionCode lowest build code the message is meant for; builds
 *                    older than this never see it
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BroadcastMessage(
        @JsonProperty("title") String title,
        @JsonProperty("message") String message,
        @JsonProperty("version_code") long versionCode) {
}
