package de.bsommerfeld.selfupdate.broadcast;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.selfupdate.core.event.ApplicationEventBus;
import de.bsommerfeld.selfupdate.event.UpdateEvents.BroadcastEvent;
import de.bsommerfeld.selfupdate.version.UpdateEvaluator;
import de.bsommerfeld.selfupdate.version.VersionDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Filters broadcasts by version before they reach the UI.
 *
 * <p>
 * Uses the same comparison as the update check: a broadcast whose version
 * code is newer than the running build is withheld, everything else is
 * published as a {@link BroadcastEvent}.
 */
@Singleton
public class BroadcastGate {

    private static final Logger LOG = LoggerFactory.getLogger(BroadcastGate.class);

    private final ApplicationEventBus eventBus;
    private final VersionDescriptor currentVersion;

    @Inject
    public BroadcastGate(ApplicationEventBus eventBus, VersionDescriptor currentVersion) {
        this.eventBus = eventBus;
        this.currentVersion = currentVersion;
    }

    public boolean isVisible(BroadcastMessage message) {
        return !UpdateEvaluator.isNewer(message.versionCode(), currentVersion.code());
    }

    /**
     * Publishes the broadcast if it passes the version gate.
     *
     * @return whether the broadcast was published
     */
    public boolean offer(BroadcastMessage message) {
        if (!isVisible(message)) {
            LOG.debug("Suppressed broadcast for code {} (running {})", message.versionCode(), currentVersion.code());
            return false;
        }
        eventBus.post(new BroadcastEvent(message));
        return true;
    }
}
