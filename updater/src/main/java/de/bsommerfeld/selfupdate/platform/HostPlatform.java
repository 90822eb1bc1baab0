package de.bsommerfeld.selfupdate.platform;

/**
 * Capabilities of the host the application runs on. Resolved once at
 * startup and consulted before any network or filesystem action of the
 * update pipeline.
 */
public interface HostPlatform {

    /** Short identifier for log output. */
    String name();

    /**
     * Whether the host can hand artifacts to an installer at all. When
     * {@code false} update checks are skipped and downloads are refused.
     */
    boolean canInstallUpdates();

    /**
     * Whether artifacts can be streamed straight to disk. Hosts without this
     * capability fall back to buffering the whole artifact in memory.
     */
    boolean supportsStreamingDownload();
}
