package de.bsommerfeld.selfupdate.core.event;

/**
 * Marker for events posted many times per second, such as per-chunk transfer
 * progress. {@link ApplicationEventBus} logs them at TRACE instead of DEBUG.
 */
public interface HighFrequencyEvent {
}
