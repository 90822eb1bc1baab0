package de.bsommerfeld.selfupdate.transfer;

import de.bsommerfeld.selfupdate.http.Downloader;
import de.bsommerfeld.selfupdate.http.HttpStatusException;
import de.bsommerfeld.selfupdate.testing.LocalHttpServer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class BufferedTransferStrategyTest {

    private static final URI URL = URI.create("https://updates.example.com/app.deb");
    private static final int CHUNK = 64 * 1024;

    @TempDir
    Path tempDir;

    private ScratchStorage storage;

    @BeforeEach
    void setUp() {
        storage = new ScratchStorage(tempDir);
    }

    /** Serves the payload in fixed chunks, announcing {@code total} on every update. */
    private static BufferedTransport chunked(byte[] payload, long total) {
        return (url, listener) -> {
            for (long read = CHUNK; read < payload.length; read += CHUNK) {
                listener.onProgress(read, total);
            }
            listener.onProgress(payload.length, total);
            return payload;
        };
    }

    private static BufferedTransport failing(IOException failure) {
        return (url, listener) -> {
            throw failure;
        };
    }

    @Test
    void transfer_shouldReportMonotonicPercentForLargePayload() throws Exception {
        byte[] payload = new byte[10 * 1024 * 1024];
        for (int i = 0; i < payload.length; i += 4096) {
            payload[i] = (byte) i;
        }
        List<Double> received = new ArrayList<>();
        BufferedTransferStrategy strategy = new BufferedTransferStrategy(chunked(payload, payload.length), storage);

        URI location = strategy.transfer(URL, "update_v1-1.deb", received::add);

        assertFalse(received.isEmpty());
        for (int i = 1; i < received.size(); i++) {
            assertTrue(received.get(i) >= received.get(i - 1));
        }
        assertTrue(received.get(0) >= 0.0);
        assertEquals(100.0, received.get(received.size() - 1), 1e-9);
        assertArrayEquals(payload, Files.readAllBytes(Path.of(location)));
    }

    @Test
    void transfer_shouldSkipProgressWithoutTotal() throws Exception {
        List<Double> received = new ArrayList<>();
        BufferedTransferStrategy strategy = new BufferedTransferStrategy(chunked(new byte[CHUNK * 3], 0), storage);

        strategy.transfer(URL, "update_v1-2.deb", received::add);

        assertTrue(received.isEmpty());
    }

    @Test
    void transfer_shouldDistinguishFailureKinds() {
        TransferException status = assertThrows(TransferException.class,
                () -> new BufferedTransferStrategy(failing(new HttpStatusException(404, URL.toString())), storage)
                        .transfer(URL, "update_v1-3.deb", null));
        TransferException network = assertThrows(TransferException.class,
                () -> new BufferedTransferStrategy(failing(new IOException("unreachable")), storage)
                        .transfer(URL, "update_v1-4.deb", null));
        TransferException timeout = assertThrows(TransferException.class,
                () -> new BufferedTransferStrategy(failing(new HttpTimeoutException("request timed out")), storage)
                        .transfer(URL, "update_v1-5.deb", null));

        assertEquals(TransferException.Reason.HTTP_STATUS, status.reason());
        assertEquals(TransferException.Reason.NETWORK, network.reason());
        assertEquals(TransferException.Reason.TIMEOUT, timeout.reason());
        assertTrue(status.getMessage().contains("404"));

        Set<String> messages = new HashSet<>(List.of(status.getMessage(), network.getMessage(), timeout.getMessage()));
        assertEquals(3, messages.size());
    }

    @Test
    void transfer_shouldReportConversionFailureWhenEncodingRunsOutOfMemory() {
        BufferedTransferStrategy strategy = new BufferedTransferStrategy(chunked(new byte[16], 16), storage,
                payload -> {
                    throw new OutOfMemoryError("Java heap space");
                });

        TransferException e = assertThrows(TransferException.class,
                () -> strategy.transfer(URL, "update_v1-6.deb", null));

        assertEquals(TransferException.Reason.CONVERSION, e.reason());
        assertFalse(Files.exists(storage.pathOf("update_v1-6.deb")));
    }

    @Test
    void transfer_shouldReportConversionFailureWhenBufferingRunsOutOfMemory() {
        BufferedTransport exhausted = (url, listener) -> {
            throw new OutOfMemoryError("Java heap space");
        };
        BufferedTransferStrategy strategy = new BufferedTransferStrategy(exhausted, storage);

        TransferException e = assertThrows(TransferException.class,
                () -> strategy.transfer(URL, "update_v1-8.deb", null));

        assertEquals(TransferException.Reason.CONVERSION, e.reason());
    }

    @Test
    void transfer_shouldCompleteWhenCallbackThrows() throws Exception {
        byte[] payload = new byte[CHUNK * 3];
        AtomicInteger calls = new AtomicInteger();
        BufferedTransferStrategy strategy = new BufferedTransferStrategy(chunked(payload, payload.length), storage);

        URI location = strategy.transfer(URL, "update_v1-9.deb", percent -> {
            calls.incrementAndGet();
            throw new IllegalStateException("progress bar disposed");
        });

        assertEquals(3, calls.get());
        assertArrayEquals(payload, Files.readAllBytes(Path.of(location)));
    }

    @Test
    void transfer_shouldReportTimeoutWhenServerStallsMidBody() throws IOException {
        try (LocalHttpServer server = LocalHttpServer.start()) {
            server.serveStalled("/app.deb", new byte[2_000], 50_000);
            Downloader downloader = new Downloader(Duration.ofSeconds(5), Duration.ofMillis(300));
            BufferedTransferStrategy strategy = new BufferedTransferStrategy(downloader::toBytes, storage);

            TransferException e = assertTimeoutPreemptively(Duration.ofSeconds(10),
                    () -> assertThrows(TransferException.class,
                            () -> strategy.transfer(server.uri("/app.deb"), "update_v1-10.deb", null)));

            assertEquals(TransferException.Reason.TIMEOUT, e.reason());
            assertFalse(Files.exists(storage.pathOf("update_v1-10.deb")));
        }
    }

    @Test
    void transfer_shouldReportStorageFailureOnNameCollision() throws Exception {
        BufferedTransferStrategy strategy = new BufferedTransferStrategy(chunked(new byte[16], 16), storage);
        strategy.transfer(URL, "update_v1-7.deb", null);

        TransferException e = assertThrows(TransferException.class,
                () -> strategy.transfer(URL, "update_v1-7.deb", null));

        assertEquals(TransferException.Reason.STORAGE, e.reason());
    }
}
