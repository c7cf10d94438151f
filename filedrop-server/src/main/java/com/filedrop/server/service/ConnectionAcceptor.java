package com.filedrop.server.service;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import com.filedrop.server.handler.FileReceiveHandler;
import com.filedrop.server.observability.TransferMetrics;
import com.filedrop.transfer.StatusListener;
import com.filedrop.transport.TcpTransportChannel;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Listening socket and accept loop.
 *
 * Each accepted connection is handed to a {@link FileReceiveHandler} on a thread
 * of its own. Handler threads are not tracked, bounded or joined; {@link #stop()}
 * only ends the accept loop.
 */
@Slf4j
public class ConnectionAcceptor {

    public static final int DEFAULT_POLL_INTERVAL = 1000;

    @Getter
    private final String host;
    private final int port;
    @Getter
    private final Path receiveDirectory;
    private final int pollInterval;
    private final long maxPayloadLength;
    private final StatusListener statusListener;
    private final TransferMetrics metrics;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger connectionCounter = new AtomicInteger();
    private ServerSocket serverSocket;
    private Thread acceptThread;

    public ConnectionAcceptor(String host, int port, Path receiveDirectory, int pollInterval,
            long maxPayloadLength, StatusListener statusListener, TransferMetrics metrics) {
        if (pollInterval <= 0) {
            throw new IllegalArgumentException("pollInterval must be positive: " + pollInterval);
        }
        this.host = host;
        this.port = port;
        this.receiveDirectory = receiveDirectory;
        this.pollInterval = pollInterval;
        this.maxPayloadLength = maxPayloadLength;
        this.statusListener = statusListener != null ? statusListener : StatusListener.NONE;
        this.metrics = metrics;
    }

    /**
     * Create the receive directory, bind and start the accept loop.
     *
     * @throws IOException if the directory cannot be created or the address cannot be bound
     */
    public synchronized void start() throws IOException {
        if (running.get()) {
            throw new IllegalStateException("Acceptor already running on port " + getLocalPort());
        }

        Files.createDirectories(receiveDirectory);

        ServerSocket socket = new ServerSocket();
        try {
            socket.setReuseAddress(true);
            socket.bind(new InetSocketAddress(host, port));
            socket.setSoTimeout(pollInterval);
        } catch (IOException e) {
            socket.close();
            throw e;
        }
        serverSocket = socket;
        running.set(true);

        acceptThread = new Thread(() -> acceptLoop(socket), "filedrop-acceptor-" + socket.getLocalPort());
        acceptThread.start();
        metrics.acceptorStarted();

        log.info("FileDrop server listening on {}:{}, receiving into {}",
                host, socket.getLocalPort(), receiveDirectory.toAbsolutePath());
        statusListener.onStatus("Server listening on " + host + ":" + socket.getLocalPort());
    }

    /**
     * Clear the liveness flag. The loop notices within one poll interval and closes
     * the listening socket; sessions in progress keep running.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Stopping FileDrop server on port {}", getLocalPort());
        }
    }

    /**
     * Wait for the accept loop to exit after {@link #stop()}.
     *
     * @return true if the loop has exited
     */
    public boolean awaitTermination(long timeoutMs) throws InterruptedException {
        Thread thread = acceptThread;
        if (thread == null) {
            return true;
        }
        thread.join(timeoutMs);
        return !thread.isAlive();
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Port actually bound, or -1 when not listening.
     */
    public int getLocalPort() {
        ServerSocket socket = serverSocket;
        return socket != null && !socket.isClosed() ? socket.getLocalPort() : -1;
    }

    private void acceptLoop(ServerSocket listener) {
        try {
            while (running.get() && !listener.isClosed()) {
                Socket client;
                try {
                    client = listener.accept();
                } catch (SocketTimeoutException e) {
                    continue;
                } catch (IOException e) {
                    if (running.get()) {
                        log.error("Error accepting connection: {}", e.getMessage(), e);
                    }
                    continue;
                }
                dispatch(client);
            }
        } finally {
            closeServerSocket(listener);
            metrics.acceptorStopped();
            log.info("FileDrop server stopped");
            statusListener.onStatus("Server stopped");
        }
    }

    private void dispatch(Socket client) {
        log.debug("Accepted connection from {}", client.getRemoteSocketAddress());
        try {
            TcpTransportChannel channel = TcpTransportChannel.accepted(client);
            channel.setMaxPayloadLength(maxPayloadLength);

            FileReceiveHandler handler = new FileReceiveHandler(channel, receiveDirectory, statusListener, metrics);
            Thread thread = new Thread(handler, "filedrop-session-" + connectionCounter.incrementAndGet());
            thread.setDaemon(true);
            thread.start();
        } catch (IOException e) {
            log.warn("Could not set up connection from {}: {}", client.getRemoteSocketAddress(), e.getMessage());
            try {
                client.close();
            } catch (IOException closeError) {
                log.debug("Error closing rejected socket: {}", closeError.getMessage());
            }
        }
    }

    private void closeServerSocket(ServerSocket listener) {
        try {
            listener.close();
        } catch (IOException e) {
            log.warn("Error closing server socket: {}", e.getMessage());
        }
    }
}
