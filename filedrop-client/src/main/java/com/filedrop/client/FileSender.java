package com.filedrop.client;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import com.filedrop.frame.FileInfo;
import com.filedrop.frame.Frame;
import com.filedrop.frame.FrameFormatException;
import com.filedrop.transfer.StatusListener;
import com.filedrop.transfer.TransferFailure;
import com.filedrop.transfer.TransferResult;
import com.filedrop.transport.TcpTransportChannel;
import com.filedrop.transport.TransportChannel;
import com.filedrop.transport.TransportChannelFactory;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Pushes local files to a FileDrop receiver, one connection per file.
 *
 * Flow control is stop-and-wait: every FILE_DATA frame is acknowledged by the
 * receiver before the next one is sent.
 */
@Slf4j
public class FileSender {

    public static final int DEFAULT_CHUNK_SIZE = 4096;

    private final TransportChannelFactory channelFactory;
    private final StatusListener statusListener;

    @Getter
    private final int chunkSize;

    public FileSender(String host, int port) {
        this(TransportChannelFactory.tcp(host, port, TcpTransportChannel.DEFAULT_CONNECT_TIMEOUT),
                DEFAULT_CHUNK_SIZE, StatusListener.NONE);
    }

    public FileSender(TransportChannelFactory channelFactory, int chunkSize, StatusListener statusListener) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
        this.channelFactory = Objects.requireNonNull(channelFactory, "channelFactory");
        this.chunkSize = chunkSize;
        this.statusListener = statusListener != null ? statusListener : StatusListener.NONE;
    }

    /**
     * Send one file over a new connection.
     *
     * @param path a regular file
     * @return the outcome; never null, never thrown
     */
    public TransferResult sendFile(Path path) {
        Objects.requireNonNull(path, "path");
        String filename = path.getFileName() != null ? path.getFileName().toString() : path.toString();

        if (!Files.exists(path)) {
            return sourceUnavailable(filename, "File not found: " + path);
        }
        if (!Files.isRegularFile(path)) {
            return sourceUnavailable(filename, "Path is not a file: " + path);
        }

        long filesize;
        try {
            filesize = Files.size(path);
        } catch (IOException e) {
            return sourceUnavailable(filename, "Cannot read file size: " + e.getMessage());
        }

        Outbound outbound = new Outbound(path, new FileInfo(filename, filesize));
        TransportChannel channel = channelFactory.createChannel();
        report("Connecting to " + channel.getRemoteAddress() + "...");

        try {
            channel.connect();
            report("Connected! Sending file: " + filename + " (" + filesize + " bytes)");
            TransferResult result = executeTransfer(channel, outbound);
            if (result.success()) {
                log.info("Sent {} ({} bytes) to {}: {}", filename, outbound.bytesSent, channel.getRemoteAddress(),
                        result.message());
            } else {
                log.warn("Transfer of {} rejected after {} bytes: {}", filename, outbound.bytesSent,
                        result.describe());
            }
            return result;
        } catch (SourceReadException e) {
            log.error("Reading {} failed after {} bytes: {}", path, outbound.bytesSent, e.getMessage());
            return report(TransferResult.failure(TransferFailure.SOURCE_UNAVAILABLE, filename, outbound.bytesSent,
                    "Cannot read file: " + e.getMessage()));
        } catch (FrameFormatException e) {
            log.error("Protocol error sending {}: {}", filename, e.getMessage());
            return report(TransferResult.failure(TransferFailure.PROTOCOL_VIOLATION, filename, outbound.bytesSent,
                    e.getMessage()));
        } catch (IOException e) {
            log.error("Connection error sending {}: {}", filename, e.getMessage());
            return report(TransferResult.failure(TransferFailure.TRANSPORT_FAILURE, filename, outbound.bytesSent,
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
        } finally {
            closeQuietly(channel);
            report("Connection closed.");
        }
    }

    /**
     * Send each file over its own connection. A failed file is reported and the
     * remaining files are still sent.
     *
     * @param paths files to send
     * @return one outcome per path, in the same order
     */
    public List<TransferResult> sendMultipleFiles(List<Path> paths) {
        List<TransferResult> results = new ArrayList<>(paths.size());
        for (Path path : paths) {
            TransferResult result = sendFile(path);
            if (result.success()) {
                report("Successfully sent: " + path);
            } else {
                log.warn("Failed to send {}: {}", path, result.describe());
                report("Failed to send " + path + ": " + result.describe());
            }
            results.add(result);
        }
        return results;
    }

    private TransferResult executeTransfer(TransportChannel channel, Outbound outbound) throws IOException {
        String filename = outbound.info.filename();

        channel.sendFrame(Frame.fileInfo(outbound.info));
        TransferResult rejected = checkAcknowledged(channel.receiveFrame(), outbound);
        if (rejected != null) {
            return rejected;
        }

        byte[] buffer = new byte[chunkSize];
        try (InputStream in = openSource(outbound.path)) {
            int read;
            while ((read = readChunk(in, buffer)) > 0) {
                channel.sendFrame(Frame.data(Arrays.copyOf(buffer, read)));
                outbound.bytesSent += read;

                rejected = checkAcknowledged(channel.receiveFrame(), outbound);
                if (rejected != null) {
                    return rejected;
                }
            }
        }

        channel.sendFrame(Frame.end());
        Frame reply = channel.receiveFrame();
        return switch (reply.type()) {
            case ACK -> report(TransferResult.success(filename, outbound.bytesSent, reply.text()));
            case ERROR -> report(TransferResult.failure(TransferFailure.APPLICATION_ERROR, filename,
                    outbound.bytesSent, reply.text()));
            case FILE_INFO, FILE_DATA, FILE_END -> report(unexpected(reply, outbound));
        };
    }

    /**
     * @return null if the reply is an ACK, otherwise the failure to return
     */
    private TransferResult checkAcknowledged(Frame reply, Outbound outbound) {
        return switch (reply.type()) {
            case ACK -> {
                report(reply.text());
                yield null;
            }
            case ERROR -> report(TransferResult.failure(TransferFailure.APPLICATION_ERROR,
                    outbound.info.filename(), outbound.bytesSent, reply.text()));
            case FILE_INFO, FILE_DATA, FILE_END -> report(unexpected(reply, outbound));
        };
    }

    private TransferResult unexpected(Frame reply, Outbound outbound) {
        return TransferResult.failure(TransferFailure.PROTOCOL_VIOLATION, outbound.info.filename(),
                outbound.bytesSent, "Expected ACK, got: " + reply.type().getTag());
    }

    private InputStream openSource(Path path) throws SourceReadException {
        try {
            return Files.newInputStream(path);
        } catch (IOException e) {
            throw new SourceReadException(e);
        }
    }

    private int readChunk(InputStream in, byte[] buffer) throws SourceReadException {
        try {
            return in.readNBytes(buffer, 0, buffer.length);
        } catch (IOException e) {
            throw new SourceReadException(e);
        }
    }

    private TransferResult sourceUnavailable(String filename, String message) {
        log.warn("Cannot send {}: {}", filename, message);
        return report(TransferResult.failure(TransferFailure.SOURCE_UNAVAILABLE, filename, 0, message));
    }

    private TransferResult report(TransferResult result) {
        report(result.describe());
        return result;
    }

    private void report(String message) {
        statusListener.onStatus(message);
    }

    private void closeQuietly(TransportChannel channel) {
        try {
            channel.close();
        } catch (IOException e) {
            log.warn("Error closing connection to {}: {}", channel.getRemoteAddress(), e.getMessage());
        }
    }

    /** Per-transfer state, owned by the calling thread */
    private static final class Outbound {
        private final Path path;
        private final FileInfo info;
        private long bytesSent;

        private Outbound(Path path, FileInfo info) {
            this.path = path;
            this.info = info;
        }
    }

    /** Local read failure, kept apart from socket I/O errors */
    private static final class SourceReadException extends IOException {
        private SourceReadException(IOException cause) {
            super(cause.getMessage(), cause);
        }
    }
}
