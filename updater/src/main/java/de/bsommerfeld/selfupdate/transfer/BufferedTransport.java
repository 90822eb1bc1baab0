package de.bsommerfeld.selfupdate.transfer;

import de.bsommerfeld.selfupdate.http.DownloadProgressListener;

import java.io.IOException;
import java.net.URI;

/**
 * Transport that returns the whole response body in memory. Failure types
 * follow {@link de.bsommerfeld.selfupdate.http.Downloader}.
 */
@FunctionalInterface
public interface BufferedTransport {

    byte[] fetch(URI url, DownloadProgressListener listener) throws IOException;
}
