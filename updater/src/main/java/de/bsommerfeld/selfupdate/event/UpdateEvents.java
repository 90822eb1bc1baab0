package de.bsommerfeld.selfupdate.event;

import de.bsommerfeld.selfupdate.broadcast.BroadcastMessage;
import de.bsommerfeld.selfupdate.core.event.HighFrequencyEvent;
import de.bsommerfeld.selfupdate.manifest.UpdateInfo;
import de.bsommerfeld.selfupdate.transfer.TransferProgress;

/**
 * Events the update pipeline publishes on the
 * {@link de.bsommerfeld.selfupdate.core.event.ApplicationEventBus}.
 */
public final class UpdateEvents {

    private UpdateEvents() {
    }

    /**
     * Fired by scheduled checks when a newer release was found. The UI decides
     * how to present it; {@link UpdateInfo#mandatory()} asks for a blocking prompt.
     */
    public record UpdateAvailableEvent(UpdateInfo update) {
    }

    /**
     * Raw progress of one streaming transfer, keyed by the scratch file name
     * of the attempt. Emitted once per buffer chunk.
     */
    public record TransferProgressEvent(String artifactName, TransferProgress progress)
            implements HighFrequencyEvent {
    }

    /** A broadcast that passed the version gate and should be displayed. */
    public record BroadcastEvent(BroadcastMessage message) {
    }
}
