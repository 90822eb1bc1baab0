package de.bsommerfeld.selfupdate.core.config;

/**
 * Overrides the detected installer capability of the host.
 */
public enum Installability {

    /** Derive from the operating system. */
    AUTO,

    /** Treat the host as installable regardless of detection. */
    ALWAYS,

    /** Disable update checks and downloads entirely, e.g. for portable or managed installs. */
    NEVER
}
