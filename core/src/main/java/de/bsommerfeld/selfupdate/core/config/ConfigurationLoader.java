package de.bsommerfeld.selfupdate.core.config;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link UpdaterConfig} from a TOML file.
 *
 * <p>
 * A missing file is created with the default values so users have a
 * template to edit. Keys absent from an existing file keep their defaults,
 * unknown keys are ignored. Enum values are matched case-insensitively
 * ({@code installable = "never"} works).
 */
public final class ConfigurationLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLoader.class);

    private static final TomlMapper MAPPER = TomlMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .build();

    private ConfigurationLoader() {
    }

    /**
     * @throws IOException if the file cannot be read, written or parsed
     */
    public static UpdaterConfig load(Path configPath) throws IOException {
        if (!Files.exists(configPath)) {
            UpdaterConfig defaults = new UpdaterConfig();
            if (configPath.getParent() != null) {
                Files.createDirectories(configPath.getParent());
            }
            MAPPER.writeValue(configPath.toFile(), defaults);
            LOG.info("Created default updater configuration at {}", configPath.toAbsolutePath());
            return defaults;
        }

        LOG.debug("Reading updater configuration from {}", configPath.toAbsolutePath());
        return MAPPER.readValue(configPath.toFile(), UpdaterConfig.class);
    }
}
