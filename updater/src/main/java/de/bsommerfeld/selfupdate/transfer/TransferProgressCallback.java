package de.bsommerfeld.selfupdate.transfer;

/**
 * Receives download completion in percent. Invoked only while the total size
 * is known, on the thread performing the transfer.
 */
@FunctionalInterface
public interface TransferProgressCallback {

    /**
     * @param percent completion between {@code 0} and {@code 100}
     */
    void onProgress(double percent);
}
