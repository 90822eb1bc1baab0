package de.bsommerfeld.selfupdate.manifest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.net.URI;

/**
 * Parsed release manifest.
 *
 * <p>
 * Expected JSON shape:
 * <pre>{@code
 * {
 *   "version": "1.2.0",
 *   "versionCode": 12,
 *   "downloadUrl": "https://example.com/app-1.2.0.msi",
 *   "changelog": "...",
 *   "mandatory": false,
 *   "releaseDate": "2026-01-15",
 *   "minVersion": "1.0.0"
 * }
 * }</pre>
 *
 * {@code versionCode} and {@code downloadUrl} are required, everything else
 * is informational. The version fields are trusted as published.
 *
 * @param mandatory  whether the host should block usage until the update is installed
 * @param minVersion oldest version still allowed to run, may be {@code null}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UpdateInfo(
        @JsonProperty("version") String version,
        @JsonProperty(value = "versionCode", required = true) long versionCode,
        @JsonProperty(value = "downloadUrl", required = true) String downloadUrl,
        @JsonProperty("changelog") String changelog,
        @JsonProperty("mandatory") boolean mandatory,
        @JsonProperty("releaseDate") String releaseDate,
        @JsonProperty("minVersion") String minVersion) {

    public UpdateInfo {
        if (downloadUrl == null || !URI.create(downloadUrl).isAbsolute()) {
            throw new IllegalArgumentException("downloadUrl must be an absolute URL, got: " + downloadUrl);
        }
    }
}
