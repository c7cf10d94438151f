package com.filedrop.frame;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.util.Arrays;

import lombok.extern.slf4j.Slf4j;

/**
 * Low-level frame I/O for reading and writing frames over streams.
 * Used by both the sender (FileSender) and the receiver (FileReceiveHandler).
 *
 * Wire layout, big-endian: tag(4 ASCII bytes) length(uint32) payload(length bytes).
 */
@Slf4j
public final class FrameCodec {

    /** Tag plus 32-bit length */
    public static final int HEADER_SIZE = 8;

    /** Largest payload accepted by {@link #decode(InputStream)} */
    public static final long DEFAULT_MAX_PAYLOAD_LENGTH = 16L * 1024 * 1024;

    private FrameCodec() {
    }

    /**
     * Encode a frame with an arbitrary 4-byte tag.
     *
     * @param tag     exactly 4 bytes
     * @param payload frame payload (null means empty)
     * @return header followed by payload
     * @throws IllegalArgumentException if the tag is not exactly 4 bytes
     */
    public static byte[] encode(byte[] tag, byte[] payload) {
        if (tag == null || tag.length != FrameType.TAG_LENGTH) {
            throw new IllegalArgumentException("Message type must be exactly 4 bytes");
        }
        byte[] data = payload != null ? payload : new byte[0];
        ByteBuffer buffer = ByteBuffer.allocate(HEADER_SIZE + data.length);
        buffer.put(tag);
        buffer.putInt(data.length);
        buffer.put(data);
        return buffer.array();
    }

    /**
     * Encode a typed frame.
     */
    public static byte[] encode(Frame frame) {
        return encode(frame.type().getTagBytes(), frame.payload());
    }

    /**
     * Read a single frame, accepting payloads up to {@link #DEFAULT_MAX_PAYLOAD_LENGTH}.
     *
     * @param in stream to read from
     * @return the decoded frame
     * @throws IncompleteFrameException if the stream ends mid-frame
     * @throws FrameFormatException     if the tag is unknown or the length is unacceptable
     * @throws IOException              if the read fails
     */
    public static Frame decode(InputStream in) throws IOException {
        return decode(in, DEFAULT_MAX_PAYLOAD_LENGTH);
    }

    /**
     * Read a single frame.
     *
     * @param in               stream to read from
     * @param maxPayloadLength largest acceptable declared length
     * @return the decoded frame
     * @throws IncompleteFrameException if the stream ends mid-frame
     * @throws FrameFormatException     if the tag is unknown or the length is unacceptable
     * @throws IOException              if the read fails
     */
    public static Frame decode(InputStream in, long maxPayloadLength) throws IOException {
        byte[] header = readExact(in, HEADER_SIZE);
        if (header.length != HEADER_SIZE) {
            throw new IncompleteFrameException("header", HEADER_SIZE, header.length);
        }

        byte[] tag = Arrays.copyOf(header, FrameType.TAG_LENGTH);
        long length = ByteBuffer.wrap(header, FrameType.TAG_LENGTH, 4).getInt() & 0xFFFFFFFFL;

        // Reject before allocating anything for a corrupt header
        if (length > maxPayloadLength || length > Integer.MAX_VALUE - HEADER_SIZE) {
            throw new FrameFormatException("Invalid frame length: " + length);
        }

        byte[] payload = readExact(in, (int) length);
        if (payload.length != length) {
            throw new IncompleteFrameException("data", (int) length, payload.length);
        }

        FrameType type = FrameType.fromTag(tag);
        if (type == null) {
            throw new FrameFormatException("Unexpected message type: " + describeTag(tag));
        }

        log.trace("Decoded {} with {} payload bytes", type, length);
        return new Frame(type, payload);
    }

    /**
     * Accumulate reads until exactly {@code size} bytes are collected or the stream ends.
     *
     * @param in   stream to read from
     * @param size number of bytes wanted
     * @return the bytes read, shorter than {@code size} if the stream ended first
     * @throws IOException if a read fails
     */
    public static byte[] readExact(InputStream in, int size) throws IOException {
        byte[] data = new byte[size];
        int total = 0;
        while (total < size) {
            int read = in.read(data, total, size - total);
            if (read < 0) {
                break;
            }
            total += read;
        }
        return total == size ? data : Arrays.copyOf(data, total);
    }

    /**
     * Write a frame and flush the stream.
     *
     * @param out   stream to write to
     * @param frame frame to send
     * @throws IOException if the write fails
     */
    public static void writeFrame(OutputStream out, Frame frame) throws IOException {
        out.write(encode(frame));
        out.flush();
    }

    /**
     * Render a tag for diagnostics: printable ASCII as is, otherwise hex.
     */
    public static String describeTag(byte[] tag) {
        StringBuilder sb = new StringBuilder(tag.length * 2);
        boolean printable = true;
        for (byte b : tag) {
            if (b < 0x20 || b > 0x7E) {
                printable = false;
                break;
            }
        }
        if (printable) {
            for (byte b : tag) {
                sb.append((char) b);
            }
            return sb.toString();
        }
        sb.append("0x");
        for (byte b : tag) {
            sb.append(String.format("%02X", b & 0xFF));
        }
        return sb.toString();
    }
}
