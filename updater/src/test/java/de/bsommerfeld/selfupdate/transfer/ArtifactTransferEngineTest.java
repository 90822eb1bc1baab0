package de.bsommerfeld.selfupdate.transfer;

import de.bsommerfeld.selfupdate.platform.HostPlatform;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ArtifactTransferEngineTest {

    @TempDir
    Path tempDir;

    @Mock
    private HostPlatform platform;

    @Mock
    private TransferStrategy strategy;

    private ScratchStorage storage;
    private ArtifactTransferEngine engine;

    @BeforeEach
    void setUp() {
        storage = new ScratchStorage(tempDir);
        engine = new ArtifactTransferEngine(platform, strategy, storage);
        when(platform.canInstallUpdates()).thenReturn(true);
        when(platform.name()).thenReturn("linux");
    }

    // -- gate and validation --

    @Test
    void download_shouldRefuseOnNonInstallablePlatform() {
        when(platform.canInstallUpdates()).thenReturn(false);

        TransferException e = assertThrows(TransferException.class,
                () -> engine.download("https://updates.example.com/app.deb", null));

        assertEquals(TransferException.Reason.UNSUPPORTED_PLATFORM, e.reason());
        verifyNoInteractions(strategy);
    }

    @ParameterizedTest
    @ValueSource(strings = { "", "   ", "not a url", "downloads/app.deb", "file:///tmp/app.deb" })
    void download_shouldRejectInvalidUrl(String url) {
        TransferException e = assertThrows(TransferException.class, () -> engine.download(url, null));

        assertEquals(TransferException.Reason.INVALID_URL, e.reason());
        verifyNoInteractions(strategy);
    }

    @Test
    void download_shouldRejectMissingUrl() {
        TransferException e = assertThrows(TransferException.class, () -> engine.download(null, null));

        assertEquals(TransferException.Reason.INVALID_URL, e.reason());
    }

    // -- delegation --

    @Test
    void download_shouldDelegateWithFreshArtifactName() throws Exception {
        URI expected = tempDir.resolve("result.msi").toUri();
        TransferProgressCallback callback = percent -> {
        };
        when(strategy.transfer(any(), anyString(), any())).thenReturn(expected);

        URI location = engine.download("https://updates.example.com/releases/App-1.1.MSI", callback);

        ArgumentCaptor<String> name = ArgumentCaptor.forClass(String.class);
        verify(strategy).transfer(eq(URI.create("https://updates.example.com/releases/App-1.1.MSI")),
                name.capture(), eq(callback));
        assertTrue(name.getValue().startsWith(ScratchStorage.ARTIFACT_PREFIX));
        assertTrue(name.getValue().endsWith(".msi"));
        assertEquals(expected, location);
    }

    @Test
    void download_shouldPropagateStrategyFailure() throws Exception {
        TransferException failure = TransferException.timeout(new java.net.http.HttpTimeoutException("slow"));
        when(strategy.transfer(any(), anyString(), any())).thenThrow(failure);

        assertSame(failure, assertThrows(TransferException.class,
                () -> engine.download("https://updates.example.com/app.deb", null)));
    }

    @Test
    void download_shouldUseDistinctNamesForConcurrentAttempts() throws Exception {
        Set<String> names = ConcurrentHashMap.newKeySet();
        when(strategy.transfer(any(), anyString(), any())).thenAnswer(invocation -> {
            String name = invocation.getArgument(1);
            names.add(name);
            return storage.pathOf(name).toUri();
        });

        int attempts = 8;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(attempts);
        try {
            List<Future<URI>> futures = new ArrayList<>();
            for (int i = 0; i < attempts; i++) {
                Callable<URI> attempt = () -> {
                    start.await();
                    return engine.download("https://updates.example.com/app.deb", null);
                };
                futures.add(pool.submit(attempt));
            }
            start.countDown();
            Set<URI> locations = ConcurrentHashMap.newKeySet();
            for (Future<URI> future : futures) {
                locations.add(future.get());
            }
            assertEquals(attempts, locations.size());
        } finally {
            pool.shutdownNow();
        }
        assertEquals(attempts, names.size());
    }

    // -- extensionOf --

    @Test
    void extensionOf_shouldKeepInstallerExtension() {
        assertEquals(".msi", ArtifactTransferEngine.extensionOf(URI.create("https://x.example/a/Setup.MSI")));
        assertEquals(".deb", ArtifactTransferEngine.extensionOf(URI.create("https://x.example/app_1.0.deb?token=1")));
        assertEquals(".gz", ArtifactTransferEngine.extensionOf(URI.create("https://x.example/app.tar.gz")));
    }

    @Test
    void extensionOf_shouldFallBackForUnusableNames() {
        assertEquals(ArtifactTransferEngine.DEFAULT_EXTENSION,
                ArtifactTransferEngine.extensionOf(URI.create("https://x.example/download")));
        assertEquals(ArtifactTransferEngine.DEFAULT_EXTENSION,
                ArtifactTransferEngine.extensionOf(URI.create("https://x.example/.hidden")));
        assertEquals(ArtifactTransferEngine.DEFAULT_EXTENSION,
                ArtifactTransferEngine.extensionOf(URI.create("https://x.example/file.")));
        assertEquals(ArtifactTransferEngine.DEFAULT_EXTENSION,
                ArtifactTransferEngine.extensionOf(URI.create("https://x.example/file.exe%20bad")));
    }
}
