package de.bsommerfeld.selfupdate.manifest;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ManifestParserTest {

    @Test
    void parse_shouldMapAllFields() {
        String json = """
                {
                  "version": "1.2.0",
                  "versionCode": 12,
                  "downloadUrl": "https://example.com/app-1.2.0.msi",
                  "changelog": "Faster startup",
                  "mandatory": true,
                  "releaseDate": "2026-01-15",
                  "minVersion": "1.0.0"
                }
                """;

        UpdateInfo info = ManifestParser.parse(json);

        assertEquals("1.2.0", info.version());
        assertEquals(12, info.versionCode());
        assertEquals("https://example.com/app-1.2.0.msi", info.downloadUrl());
        assertEquals("Faster startup", info.changelog());
        assertTrue(info.mandatory());
        assertEquals("2026-01-15", info.releaseDate());
        assertEquals("1.0.0", info.minVersion());
    }

    @Test
    void parse_shouldDefaultOptionalFields() {
        UpdateInfo info = ManifestParser.parse("{\"versionCode\": 3, \"downloadUrl\": \"https://example.com/a.deb\"}");

        assertNull(info.version());
        assertNull(info.changelog());
        assertFalse(info.mandatory());
    }

    @Test
    void parse_shouldIgnoreUnknownFields() {
        UpdateInfo info = ManifestParser.parse(
                "{\"versionCode\": 3, \"downloadUrl\": \"https://example.com/a.deb\", \"sha256\": \"abc\"}");

        assertEquals(3, info.versionCode());
    }

    @Test
    void parse_shouldRejectMissingVersionCode() {
        assertThrows(ManifestParseException.class,
                () -> ManifestParser.parse("{\"downloadUrl\": \"https://example.com/a.deb\"}"));
    }

    @Test
    void parse_shouldRejectMissingDownloadUrl() {
        assertThrows(ManifestParseException.class, () -> ManifestParser.parse("{\"versionCode\": 3}"));
    }

    @Test
    void parse_shouldRejectRelativeDownloadUrl() {
        assertThrows(ManifestParseException.class,
                () -> ManifestParser.parse("{\"versionCode\": 3, \"downloadUrl\": \"downloads/a.deb\"}"));
    }

    @Test
    void parse_shouldRejectMalformedJson() {
        assertThrows(ManifestParseException.class, () -> ManifestParser.parse("<html>Not Found</html>"));
    }

    @Test
    void parse_shouldRejectEmptyBody() {
        assertThrows(ManifestParseException.class, () -> ManifestParser.parse(""));
        assertThrows(ManifestParseException.class, () -> ManifestParser.parse(null));
    }
}
