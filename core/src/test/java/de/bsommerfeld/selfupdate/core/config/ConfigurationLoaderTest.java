package de.bsommerfeld.selfupdate.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_shouldCreateDefaultFileWhenMissing() throws IOException {
        Path configPath = tempDir.resolve("nested/updater.toml");

        UpdaterConfig config = ConfigurationLoader.load(configPath);

        assertTrue(Files.exists(configPath));
        assertEquals(60, config.getSchedule().getIntervalMinutes());
    }

    @Test
    void load_shouldReadBackGeneratedDefaults() throws IOException {
        Path configPath = tempDir.resolve("updater.toml");
        ConfigurationLoader.load(configPath);

        UpdaterConfig reloaded = ConfigurationLoader.load(configPath);

        assertEquals(new ManifestConfig().getUrl(), reloaded.getManifest().getUrl());
        assertEquals(Installability.AUTO, reloaded.getPlatform().getInstallable());
        assertTrue(reloaded.getPlatform().isStreamingDownload());
    }

    @Test
    void load_shouldApplyOverridesAndKeepMissingDefaults() throws IOException {
        Path configPath = tempDir.resolve("updater.toml");
        Files.writeString(configPath, """
                [manifest]
                url = "https://updates.example.com/version.json"

                [platform]
                installable = "never"
                streaming-download = false

                [schedule]
                interval-minutes = 15
                """);

        UpdaterConfig config = ConfigurationLoader.load(configPath);

        assertEquals("https://updates.example.com/version.json", config.getManifest().getUrl());
        assertEquals(Installability.NEVER, config.getPlatform().getInstallable());
        assertFalse(config.getPlatform().isStreamingDownload());
        assertEquals(15, config.getSchedule().getIntervalMinutes());
        assertTrue(config.getSchedule().isEnabled());
        assertEquals(60, config.getNetwork().getRequestTimeoutSeconds());
    }

    @Test
    void load_shouldIgnoreUnknownKeys() throws IOException {
        Path configPath = tempDir.resolve("updater.toml");
        Files.writeString(configPath, """
                legacy-flag = true

                [schedule]
                enabled = false
                jitter = 3
                """);

        UpdaterConfig config = ConfigurationLoader.load(configPath);
        assertFalse(config.getSchedule().isEnabled());
    }

    @Test
    void load_shouldFailOnMalformedToml() throws IOException {
        Path configPath = tempDir.resolve("updater.toml");
        Files.writeString(configPath, "[schedule\ninterval-minutes = ");

        assertThrows(IOException.class, () -> ConfigurationLoader.load(configPath));
    }
}
