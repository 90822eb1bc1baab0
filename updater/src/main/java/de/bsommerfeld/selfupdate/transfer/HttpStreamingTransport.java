package de.bsommerfeld.selfupdate.transfer;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.selfupdate.core.event.ApplicationEventBus;
import de.bsommerfeld.selfupdate.event.UpdateEvents.TransferProgressEvent;
import de.bsommerfeld.selfupdate.http.Downloader;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;

/**
 * {@link StreamingTransport} over HTTP that announces every chunk on the
 * application event bus.
 */
@Singleton
public class HttpStreamingTransport implements StreamingTransport {

    private final Downloader downloader;
    private final ApplicationEventBus eventBus;

    @Inject
    public HttpStreamingTransport(Downloader downloader, ApplicationEventBus eventBus) {
        this.downloader = downloader;
        this.eventBus = eventBus;
    }

    @Override
    public void downloadFile(URI url, Path target) throws IOException {
        String artifactName = target.getFileName().toString();
        downloader.toFile(url, target, (read, total) ->
                eventBus.post(new TransferProgressEvent(artifactName, new TransferProgress(read, total))));
    }
}
