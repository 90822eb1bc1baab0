package de.bsommerfeld.selfupdate.http;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;

/**
 * HTTP download utility built on {@link HttpClient}.
 *
 * <p>
 * Supports three modes: streaming to file (with atomic rename),
 * in-memory byte download, and convenience string download. All modes
 * report progress via {@link DownloadProgressListener} when applicable.
 *
 * <h3>Redirect handling</h3>
 * The client follows redirects automatically. Release hosts commonly
 * redirect artifact URLs to a CDN.
 *
 * <h3>Failure types</h3>
 * Callers distinguish failures by exception type: {@link HttpStatusException}
 * for non-2xx answers, {@link java.net.http.HttpTimeoutException} when no
 * response arrives within the request timeout or the body stalls for that
 * long, and plain {@link IOException} for everything on the network level.
 */
public class Downloader {

    private static final int BUFFER_SIZE = 8192;

    /** Content-Length is only a hint; larger bodies grow the buffer as they arrive. */
    static final int MAX_PREALLOCATION = 8 * 1024 * 1024;

    private final HttpClient http;
    private final Duration requestTimeout;

    public Downloader(Duration connectTimeout, Duration requestTimeout) {
        this(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(connectTimeout)
                .build(), requestTimeout);
    }

    public Downloader(HttpClient http, Duration requestTimeout) {
        this.http = http;
        this.requestTimeout = requestTimeout;
    }

    /**
     * Downloads a URL to the given target file.
     *
     * <p>
     * The download streams into a {@code .tmp} sibling first, then
     * atomically renames it to the target path. A broken transfer therefore
     * never leaves a truncated file under the target name.
     */
    public void toFile(URI url, Path target, DownloadProgressListener listener) throws IOException {
        HttpResponse<InputStream> response = send(url);
        validateStatus(response, url);

        long totalBytes = contentLength(response);
        Files.createDirectories(target.getParent());

        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        try (InputStream in = body(response, url)) {
            transferWithProgress(in, temp, totalBytes, listener);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    /**
     * Downloads a URL entirely into memory and returns the raw bytes.
     *
     * <p>
     * Pre-allocates the buffer to Content-Length when known, capped at
     * {@link #MAX_PREALLOCATION}, to avoid repeated array resizing.
     */
    public byte[] toBytes(URI url, DownloadProgressListener listener) throws IOException {
        HttpResponse<InputStream> response = send(url);
        validateStatus(response, url);

        long totalBytes = contentLength(response);
        try (InputStream in = body(response, url)) {
            return readWithProgress(in, totalBytes, listener);
        }
    }

    /**
     * Downloads a URL as a UTF-8 string. Progress is not reported since
     * this is used for small payloads (release manifests).
     */
    public String toString(URI url) throws IOException {
        return new String(toBytes(url, DownloadProgressListener.NONE), StandardCharsets.UTF_8);
    }

    private HttpResponse<InputStream> send(URI url) throws IOException {
        HttpRequest request = HttpRequest.newBuilder(url)
                .timeout(requestTimeout)
                .GET()
                .build();
        try {
            return http.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Download interrupted: " + url, e);
        }
    }

    private InputStream body(HttpResponse<InputStream> response, URI url) {
        return new IdleTimeoutInputStream(response.body(), requestTimeout, url);
    }

    private static long contentLength(HttpResponse<?> response) {
        return response.headers()
                .firstValueAsLong("Content-Length")
                .orElse(-1);
    }

    /**
     * Streams bytes from the input to the target file while reporting
     * progress. Uses an 8 KB buffer, large enough for throughput and
     * small enough for responsive progress updates.
     */
    private static void transferWithProgress(InputStream in, Path target, long totalBytes,
            DownloadProgressListener listener) throws IOException {
        try (OutputStream out = Files.newOutputStream(target)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            long transferred = 0;
            int read;
            while ((read = in.read(buffer)) != -1) {
                out.write(buffer, 0, read);
                transferred += read;
                listener.onProgress(transferred, totalBytes);
            }
        }
    }

    /**
     * Reads the entire input stream into a byte array while reporting
     * progress.
     */
    private static byte[] readWithProgress(InputStream in, long totalBytes,
            DownloadProgressListener listener) throws IOException {
        int initial = totalBytes > 0 ? (int) Math.min(totalBytes, MAX_PREALLOCATION) : BUFFER_SIZE;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(initial);
        byte[] chunk = new byte[BUFFER_SIZE];
        long transferred = 0;
        int read;
        while ((read = in.read(chunk)) != -1) {
            buffer.write(chunk, 0, read);
            transferred += read;
            listener.onProgress(transferred, totalBytes);
        }
        return buffer.toByteArray();
    }

    /** Validates that the HTTP status code is in the 2xx success range. */
    private static void validateStatus(HttpResponse<InputStream> response, URI url) throws IOException {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            response.body().close();
            throw new HttpStatusException(status, url.toString());
        }
    }
}
