package de.bsommerfeld.selfupdate.transfer;

import com.google.common.eventbus.Subscribe;
import de.bsommerfeld.selfupdate.core.event.ApplicationEventBus;
import de.bsommerfeld.selfupdate.event.UpdateEvents.TransferProgressEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Event bus registration that forwards the progress of exactly one transfer
 * attempt to a {@link TransferProgressCallback}.
 *
 * <p>
 * Meant for try-with-resources: the subscription is registered on
 * {@link #open} and unregistered on {@link #close}, whichever way the
 * transfer ends. Closing twice is a no-op, so the bus sees exactly one
 * unregister per registration.
 *
 * <p>
 * A callback that throws is logged and ignored; the transfer carries on.
 */
public final class ProgressSubscription implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ProgressSubscription.class);

    private final ApplicationEventBus eventBus;
    private final String artifactName;
    private final TransferProgressCallback callback;
    private final AtomicBoolean active = new AtomicBoolean(true);

    private ProgressSubscription(ApplicationEventBus eventBus, String artifactName,
            TransferProgressCallback callback) {
        this.eventBus = eventBus;
        this.artifactName = artifactName;
        this.callback = callback;
    }

    public static ProgressSubscription open(ApplicationEventBus eventBus, String artifactName,
            TransferProgressCallback callback) {
        ProgressSubscription subscription = new ProgressSubscription(eventBus, artifactName, callback);
        eventBus.register(subscription);
        return subscription;
    }

    @Subscribe
    public void onProgress(TransferProgressEvent event) {
        if (!active.get() || !artifactName.equals(event.artifactName())) {
            return;
        }
        TransferProgress progress = event.progress();
        if (!progress.isDeterminate()) {
            return;
        }
        try {
            callback.onProgress(progress.percent());
        } catch (RuntimeException e) {
            LOG.warn("Progress callback for {} failed", artifactName, e);
        }
    }

    public boolean isActive() {
        return active.get();
    }

    @Override
    public void close() {
        if (active.compareAndSet(true, false)) {
            eventBus.unregister(this);
        }
    }
}
