package com.filedrop.server.handler;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.UUID;

import com.filedrop.frame.FileInfo;
import com.filedrop.frame.Frame;
import com.filedrop.frame.FrameFormatException;
import com.filedrop.frame.FrameType;
import com.filedrop.server.model.ReceiveSession;
import com.filedrop.server.naming.DestinationResolver;
import com.filedrop.server.naming.FilenameSanitizer;
import com.filedrop.server.observability.TransferMetrics;
import com.filedrop.server.state.ReceiverState;
import com.filedrop.transfer.StatusListener;
import com.filedrop.transfer.TransferFailure;
import com.filedrop.transfer.TransferResult;
import com.filedrop.transport.TransportChannel;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Receives a single file over one accepted connection.
 *
 * The channel is closed when the session ends, whatever the outcome.
 */
@Slf4j
public class FileReceiveHandler implements Runnable {

    static final String EXPECTED_FILE_INFO = "Expected file info message";
    static final String READY = "Ready to receive file";
    static final String INCOMPLETE = "File transfer incomplete";

    private final TransportChannel channel;
    private final Path receiveDirectory;
    private final StatusListener statusListener;
    private final TransferMetrics metrics;

    @Getter
    private final ReceiveSession session;

    @Getter
    private volatile TransferResult result;

    public FileReceiveHandler(TransportChannel channel, Path receiveDirectory,
            StatusListener statusListener, TransferMetrics metrics) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.receiveDirectory = Objects.requireNonNull(receiveDirectory, "receiveDirectory");
        this.statusListener = statusListener != null ? statusListener : StatusListener.NONE;
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.session = new ReceiveSession(UUID.randomUUID().toString().substring(0, 8), channel.getRemoteAddress());
    }

    @Override
    public void run() {
        handle();
    }

    /**
     * Run the session to completion.
     *
     * @return the outcome; never null
     */
    public TransferResult handle() {
        String sessionId = session.getSessionId();
        log.info("[{}] New connection from {}", sessionId, session.getRemoteAddress());
        metrics.connectionOpened();

        try {
            result = receive();
        } catch (RuntimeException e) {
            log.error("[{}] Unexpected error: {}", sessionId, e.getMessage(), e);
            session.deletePartialFile();
            result = fail(TransferFailure.APPLICATION_ERROR, "Server error: " + e.getMessage());
            sendErrorQuietly(result.message());
        } finally {
            closeChannel();
            metrics.connectionClosed();
        }

        if (result.success()) {
            metrics.transferCompleted(result.bytes(), session.getElapsed());
        } else {
            metrics.transferFailed(result.failure());
        }
        log.info("[{}] Connection closed: {}", sessionId, result.describe());
        return result;
    }

    private TransferResult receive() {
        String sessionId = session.getSessionId();

        FileInfo info;
        try {
            Frame first = channel.receiveFrame();
            if (first.type() != FrameType.FILE_INFO) {
                log.warn("[{}] First frame was {}", sessionId, first.type());
                return reject(TransferFailure.PROTOCOL_VIOLATION, EXPECTED_FILE_INFO);
            }
            info = FileInfo.fromJson(first.payload());
        } catch (FrameFormatException e) {
            log.warn("[{}] Invalid file info: {}", sessionId, e.getMessage());
            return reject(TransferFailure.PROTOCOL_VIOLATION, e.getMessage());
        } catch (IOException e) {
            log.info("[{}] Connection ended before file info: {}", sessionId, e.getMessage());
            return fail(TransferFailure.TRANSPORT_FAILURE, e.getMessage());
        }

        session.setOriginalFilename(info.filename());
        session.setFilename(FilenameSanitizer.sanitize(info.filename()));
        session.setDeclaredSize(info.filesize());
        if (!session.getFilename().equals(info.filename())) {
            log.debug("[{}] Filename '{}' sanitized to '{}'", sessionId, info.filename(), session.getFilename());
        }

        try {
            Files.createDirectories(receiveDirectory);
            session.setDestination(DestinationResolver.resolve(receiveDirectory, session.getFilename()));
            session.openOutput();
        } catch (IOException e) {
            log.error("[{}] Cannot create destination for {}: {}", sessionId, session.getFilename(), e.getMessage());
            session.deletePartialFile();
            return reject(TransferFailure.APPLICATION_ERROR, "Server error: " + e.getMessage());
        }

        session.transitionTo(ReceiverState.READY);
        metrics.transferStarted();
        status("Receiving file: " + session.getFilename() + " (" + session.getDeclaredSize() + " bytes)");

        try {
            channel.sendFrame(Frame.ack(READY));
            session.transitionTo(ReceiverState.RECEIVING);

            String violation = receiveData();
            if (violation != null) {
                log.warn("[{}] Protocol error: {}", sessionId, violation);
                channel.sendFrame(Frame.error(violation));
                return incomplete(TransferFailure.PROTOCOL_VIOLATION, violation);
            }

            closeOutput();
            if (session.isEndMarkerReceived() || session.isSizeMatched()) {
                return complete();
            }
            return incomplete(TransferFailure.PROTOCOL_VIOLATION,
                    "Received " + session.getBytesReceived() + " of " + session.getDeclaredSize() + " bytes");
        } catch (LocalWriteException e) {
            log.error("[{}] Write to {} failed: {}", sessionId, session.getDestination(), e.getMessage());
            session.deletePartialFile();
            return reject(TransferFailure.APPLICATION_ERROR, "Server error: " + e.getMessage());
        } catch (IOException e) {
            log.warn("[{}] Connection lost after {} of {} bytes: {}",
                    sessionId, session.getBytesReceived(), session.getDeclaredSize(), e.getMessage());
            session.deletePartialFile();
            sendErrorQuietly(INCOMPLETE);
            return fail(TransferFailure.TRANSPORT_FAILURE, e.getMessage());
        }
    }

    /**
     * Data phase. Ends when the counter reaches the declared size or on FILE_END.
     *
     * @return a protocol diagnostic, or null if the phase ended normally
     */
    private String receiveData() throws IOException {
        while (session.getBytesReceived() < session.getDeclaredSize()) {
            Frame frame;
            try {
                frame = channel.receiveFrame();
            } catch (FrameFormatException e) {
                return e.getMessage();
            }

            switch (frame.type()) {
                case FILE_DATA -> {
                    write(frame.payload());
                    metrics.bytesReceived(frame.length());
                    String progress = session.progressText();
                    channel.sendFrame(Frame.ack(progress));
                    status(progress);
                }
                case FILE_END -> {
                    log.debug("[{}] End marker after {} bytes", session.getSessionId(), session.getBytesReceived());
                    session.setEndMarkerReceived(true);
                    return null;
                }
                default -> {
                    return "Unexpected message type: " + frame.type().getTag();
                }
            }
        }
        return null;
    }

    private TransferResult complete() {
        session.transitionTo(ReceiverState.COMPLETE);
        String message = "File '" + session.getFilename() + "' received successfully";
        log.info("[{}] File received: {} ({} bytes)", session.getSessionId(),
                session.getDestination(), session.getBytesReceived());
        status("File received successfully: " + session.getDestination());
        try {
            channel.sendFrame(Frame.ack(message));
        } catch (IOException e) {
            // the file is complete on disk, only the confirmation is lost
            log.warn("[{}] Could not confirm receipt: {}", session.getSessionId(), e.getMessage());
        }
        return TransferResult.success(session.getFilename(), session.getBytesReceived(), message);
    }

    /**
     * Remove the partial file and tell the sender the transfer is incomplete.
     */
    private TransferResult incomplete(TransferFailure failure, String reason) throws IOException {
        log.info("[{}] File transfer incomplete: {}/{} bytes", session.getSessionId(),
                session.getBytesReceived(), session.getDeclaredSize());
        session.deletePartialFile();
        TransferResult failed = fail(failure, reason);
        channel.sendFrame(Frame.error(INCOMPLETE));
        return failed;
    }

    /**
     * Fail the session and report the reason to the sender.
     */
    private TransferResult reject(TransferFailure failure, String message) {
        TransferResult failed = fail(failure, message);
        sendErrorQuietly(message);
        return failed;
    }

    private TransferResult fail(TransferFailure failure, String message) {
        if (!session.getState().isTerminal()) {
            session.transitionTo(ReceiverState.FAILED);
        }
        status("Transfer failed: " + message);
        return TransferResult.failure(failure, session.getFilename(), session.getBytesReceived(), message);
    }

    private void write(byte[] data) throws LocalWriteException {
        try {
            session.append(data);
        } catch (IOException e) {
            throw new LocalWriteException(e);
        }
    }

    private void closeOutput() throws LocalWriteException {
        try {
            session.closeOutput();
        } catch (IOException e) {
            throw new LocalWriteException(e);
        }
    }

    private void sendErrorQuietly(String message) {
        try {
            channel.sendFrame(Frame.error(message));
        } catch (IOException e) {
            log.debug("[{}] Could not report error to sender: {}", session.getSessionId(), e.getMessage());
        }
    }

    private void closeChannel() {
        try {
            channel.close();
        } catch (IOException e) {
            log.warn("[{}] Error closing connection: {}", session.getSessionId(), e.getMessage());
        }
    }

    private void status(String message) {
        statusListener.onStatus(message);
    }

    /**
     * Failure writing the destination file, as opposed to a failure of the connection.
     */
    private static class LocalWriteException extends IOException {

        private static final long serialVersionUID = 1L;

        LocalWriteException(IOException cause) {
            super(cause.getMessage(), cause);
        }
    }
}
