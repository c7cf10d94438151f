package com.filedrop.transport;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;

import com.filedrop.frame.Frame;
import com.filedrop.frame.FrameCodec;

import lombok.extern.slf4j.Slf4j;

/**
 * Abstract base class for socket-based transport channels.
 * Subclasses decide how the socket is obtained.
 */
@Slf4j
public abstract class AbstractSocketTransportChannel implements TransportChannel {

    /** No receive timeout: a stalled peer blocks the owning thread */
    protected static final int DEFAULT_TIMEOUT = 0;

    protected final String host;
    protected final int port;
    protected Socket socket;
    protected InputStream inputStream;
    protected OutputStream outputStream;
    protected int receiveTimeout = DEFAULT_TIMEOUT;
    protected long maxPayloadLength = FrameCodec.DEFAULT_MAX_PAYLOAD_LENGTH;

    protected AbstractSocketTransportChannel(String host, int port) {
        this.host = host;
        this.port = port;
    }

    /**
     * Create and connect the socket.
     */
    protected abstract Socket createSocket() throws IOException;

    @Override
    public void connect() throws IOException {
        if (isConnected()) {
            log.debug("Already connected to {}:{}", host, port);
            return;
        }

        log.debug("Connecting to {}:{}", host, port);
        attach(createSocket());
        log.info("Connected to {}:{}", host, port);
    }

    /**
     * Configure a connected socket and open its streams.
     */
    protected void attach(Socket connected) throws IOException {
        this.socket = connected;
        socket.setSoTimeout(receiveTimeout);
        socket.setTcpNoDelay(true);

        inputStream = new BufferedInputStream(socket.getInputStream());
        outputStream = new BufferedOutputStream(socket.getOutputStream());
    }

    @Override
    public void sendFrame(Frame frame) throws IOException {
        if (!isConnected()) {
            throw new IOException("Not connected");
        }

        FrameCodec.writeFrame(outputStream, frame);
        log.trace("Sent {} to {}", frame, getRemoteAddress());
    }

    @Override
    public Frame receiveFrame() throws IOException {
        if (!isConnected()) {
            throw new IOException("Not connected");
        }

        try {
            Frame frame = FrameCodec.decode(inputStream, maxPayloadLength);
            log.trace("Received {} from {}", frame, getRemoteAddress());
            return frame;
        } catch (SocketTimeoutException e) {
            log.debug("Receive timeout on {}", getRemoteAddress());
            throw e;
        }
    }

    @Override
    public boolean isConnected() {
        return socket != null && socket.isConnected() && !socket.isClosed();
    }

    @Override
    public void close() throws IOException {
        if (socket == null) {
            return;
        }
        log.debug("Closing connection to {}", getRemoteAddress());

        try {
            if (outputStream != null && !socket.isClosed()) {
                outputStream.flush();
            }
        } finally {
            try {
                socket.close();
            } finally {
                socket = null;
                inputStream = null;
                outputStream = null;
            }
        }
    }

    @Override
    public String getRemoteAddress() {
        return socket != null ? socket.getRemoteSocketAddress().toString() : host + ":" + port;
    }

    @Override
    public String getLocalAddress() {
        return socket != null ? socket.getLocalSocketAddress().toString() : "not connected";
    }

    @Override
    public void setReceiveTimeout(int timeoutMs) {
        this.receiveTimeout = timeoutMs;
        if (socket != null) {
            try {
                socket.setSoTimeout(timeoutMs);
            } catch (IOException e) {
                log.warn("Failed to set socket timeout", e);
            }
        }
    }

    /**
     * Set the largest payload length accepted from the peer.
     */
    public void setMaxPayloadLength(long maxPayloadLength) {
        this.maxPayloadLength = maxPayloadLength;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }
}
