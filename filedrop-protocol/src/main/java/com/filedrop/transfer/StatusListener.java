package com.filedrop.transfer;

/**
 * Receives human-readable status and progress lines from a transfer session.
 * Presentation layers (console, GUI) plug in here; the protocol code never prints.
 */
@FunctionalInterface
public interface StatusListener {

    /** Discards every status line */
    StatusListener NONE = message -> {
    };

    void onStatus(String message);
}
