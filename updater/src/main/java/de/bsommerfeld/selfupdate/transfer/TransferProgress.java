package de.bsommerfeld.selfupdate.transfer;

/**
 * Snapshot of a running transfer.
 *
 * @param bytesTransferred bytes received so far
 * @param totalBytes       expected size, or a value {@code <= 0} if the server
 *                         did not announce one
 */
public record TransferProgress(long bytesTransferred, long totalBytes) {

    public boolean isDeterminate() {
        return totalBytes > 0;
    }

    /**
     * Completion in percent, clamped to {@code 0..100}.
     *
     * @throws IllegalStateException if the total size is unknown
     */
    public double percent() {
        if (!isDeterminate()) {
            throw new IllegalStateException("Total size unknown");
        }
        double percent = (double) bytesTransferred / totalBytes * 100.0;
        return Math.max(0.0, Math.min(100.0, percent));
    }
}
