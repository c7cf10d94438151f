package com.filedrop.server.state;

import java.util.Set;

/**
 * States of one receiving session.
 *
 * AWAIT_INFO -> READY -> RECEIVING -> COMPLETE | FAILED
 */
public enum ReceiverState {

    /** Waiting for the FILE_INFO frame (initial state) */
    AWAIT_INFO("Waiting for file info"),

    /** Metadata accepted, destination resolved */
    READY("Ready to receive"),

    /** Receiving FILE_DATA frames */
    RECEIVING("Receiving data"),

    /** File kept, success acknowledged */
    COMPLETE("Transfer complete"),

    /** Partial file removed, error reported */
    FAILED("Transfer failed");

    private final String description;
    private Set<ReceiverState> validTransitions;

    static {
        AWAIT_INFO.validTransitions = Set.of(READY, FAILED);
        READY.validTransitions = Set.of(RECEIVING, FAILED);
        RECEIVING.validTransitions = Set.of(COMPLETE, FAILED);
        COMPLETE.validTransitions = Set.of();
        FAILED.validTransitions = Set.of();
    }

    ReceiverState(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public Set<ReceiverState> getValidTransitions() {
        return validTransitions;
    }

    /**
     * Check if transitioning to the given state is allowed.
     */
    public boolean canTransitionTo(ReceiverState nextState) {
        return validTransitions.contains(nextState);
    }

    /**
     * COMPLETE and FAILED end the session.
     */
    public boolean isTerminal() {
        return validTransitions.isEmpty();
    }

    @Override
    public String toString() {
        return name() + " - " + description;
    }
}
