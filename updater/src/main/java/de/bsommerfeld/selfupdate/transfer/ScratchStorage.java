package de.bsommerfeld.selfupdate.transfer;

import com.google.common.io.BaseEncoding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Cache-tier directory that stages downloaded artifacts until the installer
 * picks them up.
 *
 * <p>
 * File names are synthesized here and never taken from user input or the
 * manifest. Every attempt gets a fresh name built from a microsecond
 * timestamp plus a process-wide sequence, so a failed or superseded attempt
 * can't collide with a later one, even when two downloads start in the
 * same microsecond.
 */
public class ScratchStorage {

    private static final Logger LOG = LoggerFactory.getLogger(ScratchStorage.class);

    static final String ARTIFACT_PREFIX = "update_v";

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final Path directory;

    public ScratchStorage(Path directory) {
        this.directory = directory;
    }

    public Path directory() {
        return directory;
    }

    /**
     * Creates a name that no earlier attempt of this process has used.
     *
     * @param extension file extension including the dot, e.g. {@code ".msi"}
     */
    public String newArtifactName(String extension) {
        long micros = ChronoUnit.MICROS.between(Instant.EPOCH, Instant.now());
        return ARTIFACT_PREFIX + micros + "-" + SEQUENCE.incrementAndGet() + extension;
    }

    /**
     * Target path for a streaming write. The file does not need to exist yet.
     */
    public Path pathOf(String artifactName) {
        return directory.resolve(artifactName);
    }

    /**
     * Resolves the location of a stored artifact.
     *
     * @throws NoSuchFileException if nothing was written under that name
     */
    public URI getUri(String artifactName) throws IOException {
        Path path = pathOf(artifactName);
        if (!Files.isRegularFile(path)) {
            throw new NoSuchFileException(path.toString(), null, "artifact not found in scratch storage");
        }
        return path.toUri();
    }

    /**
     * Decodes a Base64 payload and writes it under a new name.
     *
     * @throws java.nio.file.FileAlreadyExistsException if the name was used before
     * @throws IOException                               if the payload is not valid
     *                                                   Base64 or the write fails
     */
    public URI writeEncoded(String artifactName, String base64Payload) throws IOException {
        byte[] data;
        try {
            data = BaseEncoding.base64().decode(base64Payload);
        } catch (IllegalArgumentException e) {
            throw new IOException("Payload is not valid Base64: " + artifactName, e);
        }

        Files.createDirectories(directory);
        Path target = pathOf(artifactName);
        Files.write(target, data, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        return target.toUri();
    }

    /**
     * Deletes artifacts and leftover {@code .tmp} files older than
     * {@code maxAge}. Failures on individual files are logged and skipped.
     *
     * @return number of deleted files
     */
    public int purgeStale(Duration maxAge) {
        if (!Files.isDirectory(directory)) {
            return 0;
        }

        Instant cutoff = Instant.now().minus(maxAge);
        List<Path> candidates;
        try (Stream<Path> files = Files.list(directory)) {
            candidates = files
                    .filter(p -> p.getFileName().toString().startsWith(ARTIFACT_PREFIX))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            LOG.warn("Could not list scratch directory {}", directory, e);
            return 0;
        }

        int deleted = 0;
        for (Path file : candidates) {
            try {
                if (Files.getLastModifiedTime(file).toInstant().isBefore(cutoff) && Files.deleteIfExists(file)) {
                    deleted++;
                }
            } catch (IOException e) {
                LOG.warn("Could not delete stale artifact {}", file, e);
            }
        }
        if (deleted > 0) {
            LOG.info("Purged {} stale artifacts from {}", deleted, directory);
        }
        return deleted;
    }
}
