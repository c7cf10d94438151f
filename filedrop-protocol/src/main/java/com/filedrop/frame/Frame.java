package com.filedrop.frame;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * One typed, length-prefixed protocol unit.
 */
public record Frame(FrameType type, byte[] payload) {

    private static final byte[] EMPTY = new byte[0];

    public Frame {
        Objects.requireNonNull(type, "type");
        payload = payload != null ? payload : EMPTY;
    }

    public static Frame fileInfo(FileInfo info) {
        return new Frame(FrameType.FILE_INFO, info.toJson());
    }

    public static Frame data(byte[] chunk) {
        return new Frame(FrameType.FILE_DATA, chunk);
    }

    public static Frame end() {
        return new Frame(FrameType.FILE_END, EMPTY);
    }

    public static Frame ack(String message) {
        return new Frame(FrameType.ACK, message.getBytes(StandardCharsets.UTF_8));
    }

    public static Frame error(String message) {
        return new Frame(FrameType.ERROR, message.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Payload decoded as UTF-8 (ACK and ERROR frames).
     */
    public String text() {
        return new String(payload, StandardCharsets.UTF_8);
    }

    public int length() {
        return payload.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Frame other)) {
            return false;
        }
        return type == other.type && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "Frame[" + type.getTag() + ", " + payload.length + " bytes]";
    }
}
