package com.filedrop.transport;

import java.io.Closeable;
import java.io.IOException;

import com.filedrop.frame.Frame;

/**
 * Byte-stream transport abstraction for the FileDrop protocol.
 * One channel carries exactly one transfer session.
 */
public interface TransportChannel extends Closeable {

    /**
     * Connect to the remote endpoint. No-op for channels wrapping an accepted socket.
     *
     * @throws IOException if connection fails
     */
    void connect() throws IOException;

    /**
     * Send one frame.
     *
     * @param frame the frame to send
     * @throws IOException if sending fails
     */
    void sendFrame(Frame frame) throws IOException;

    /**
     * Receive one frame, blocking until it is complete.
     *
     * @return the received frame
     * @throws com.filedrop.frame.IncompleteFrameException if the peer closes mid-frame
     * @throws com.filedrop.frame.FrameFormatException     if the frame is malformed
     * @throws IOException                                 if receiving fails
     */
    Frame receiveFrame() throws IOException;

    /**
     * Check if transport is connected.
     *
     * @return true if connected, false otherwise
     */
    boolean isConnected();

    /**
     * Close the transport connection.
     *
     * @throws IOException if closing fails
     */
    @Override
    void close() throws IOException;

    /**
     * Get remote address.
     *
     * @return the remote address
     */
    String getRemoteAddress();

    /**
     * Get local address.
     *
     * @return the local address
     */
    String getLocalAddress();

    /**
     * Set timeout for receive operations, 0 for none.
     *
     * @param timeoutMs timeout in milliseconds
     */
    void setReceiveTimeout(int timeoutMs);
}
