package de.bsommerfeld.selfupdate.http;

/**
 * Callback for tracking raw download progress.
 */
@FunctionalInterface
public interface DownloadProgressListener {

    /** Listener that discards every update. */
    DownloadProgressListener NONE = (bytesRead, totalBytes) -> {
    };

    /**
     * Called periodically during a download.
     *
     * @param bytesRead  bytes transferred so far
     * @param totalBytes total expected size, or -1 if unknown
     */
    void onProgress(long bytesRead, long totalBytes);
}
