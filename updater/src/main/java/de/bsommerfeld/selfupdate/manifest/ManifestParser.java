package de.bsommerfeld.selfupdate.manifest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Maps a manifest body onto {@link UpdateInfo}.
 */
public final class ManifestParser {

    /**
     * Jackson's {@link ObjectMapper} is thread-safe for reading, so one
     * instance serves every check.
     */
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ManifestParser() {
    }

    /**
     * @throws ManifestParseException if the body is empty, not JSON, lacks a
     *                                required field or carries a relative
     *                                download URL
     */
    public static UpdateInfo parse(String json) {
        if (json == null || json.isBlank()) {
            throw new ManifestParseException("Manifest body is empty");
        }
        try {
            UpdateInfo info = MAPPER.readValue(json, UpdateInfo.class);
            if (info == null) {
                throw new ManifestParseException("Manifest body is null");
            }
            return info;
        } catch (JsonProcessingException e) {
            throw new ManifestParseException("Malformed manifest: " + e.getOriginalMessage(), e);
        }
    }
}
