package com.filedrop.server.model;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

import com.filedrop.server.state.ReceiverState;

import lombok.AccessLevel;
import lombok.Data;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

/**
 * State of one receiving connection.
 */
@Slf4j
@Data
public class ReceiveSession {

    /** Unique session identifier */
    private final String sessionId;

    /** Remote address of the sender */
    private final String remoteAddress;

    /** Current state of the receiver state machine */
    private ReceiverState state = ReceiverState.AWAIT_INFO;

    /** Filename as announced by the sender */
    private String originalFilename;

    /** Sanitized filename */
    private String filename;

    /** Size announced in FILE_INFO */
    private long declaredSize;

    /** Bytes appended to the destination so far */
    private long bytesReceived;

    /** Resolved destination path (null until READY) */
    private Path destination;

    /** Sender ended the transfer with FILE_END */
    private boolean endMarkerReceived;

    private Instant startTime;
    private Instant endTime;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private OutputStream output;

    public ReceiveSession(String sessionId, String remoteAddress) {
        this.sessionId = sessionId;
        this.remoteAddress = remoteAddress;
        this.startTime = Instant.now();
    }

    /**
     * Transition to a new state, logging a warning if the transition is not declared valid.
     */
    public void transitionTo(ReceiverState newState) {
        ReceiverState oldState = this.state;

        if (oldState != null && !oldState.canTransitionTo(newState)) {
            log.warn("[{}] Invalid state transition: {} -> {} (not in valid transitions: {})",
                    sessionId, oldState, newState, oldState.getValidTransitions());
        }

        this.state = newState;
        log.debug("[{}] State transition: {} -> {}", sessionId, oldState, newState);
        if (newState.isTerminal()) {
            endTime = Instant.now();
        }
    }

    /**
     * Create (or truncate) the destination file for writing.
     */
    public void openOutput() throws IOException {
        if (destination == null) {
            throw new IllegalStateException("Destination not resolved");
        }
        output = new BufferedOutputStream(Files.newOutputStream(destination));
    }

    /**
     * Append one chunk to the destination and count it.
     */
    public void append(byte[] data) throws IOException {
        if (output == null) {
            throw new IllegalStateException("Output not open");
        }
        output.write(data);
        bytesReceived += data.length;
    }

    public boolean isOutputOpen() {
        return output != null;
    }

    /**
     * Flush and close the destination. Safe to call more than once.
     */
    public void closeOutput() throws IOException {
        if (output != null) {
            try {
                output.close();
            } finally {
                output = null;
            }
        }
    }

    /**
     * Close and remove whatever was written to the destination.
     *
     * @return true if a file was deleted
     */
    public boolean deletePartialFile() {
        try {
            closeOutput();
        } catch (IOException e) {
            log.warn("[{}] Error closing partial file: {}", sessionId, e.getMessage());
        }
        if (destination == null) {
            return false;
        }
        try {
            boolean deleted = Files.deleteIfExists(destination);
            if (deleted) {
                log.info("[{}] Deleted partial file {}", sessionId, destination);
            }
            return deleted;
        } catch (IOException e) {
            log.error("[{}] Could not delete partial file {}: {}", sessionId, destination, e.getMessage());
            return false;
        }
    }

    /**
     * Counter equals the declared size.
     */
    public boolean isSizeMatched() {
        return bytesReceived == declaredSize;
    }

    public String progressText() {
        double percent = declaredSize > 0 ? bytesReceived * 100.0 / declaredSize : 100.0;
        return String.format(Locale.ROOT, "Received %d/%d bytes (%.1f%%)", bytesReceived, declaredSize, percent);
    }

    public Duration getElapsed() {
        return Duration.between(startTime, endTime != null ? endTime : Instant.now());
    }
}
