package com.filedrop.frame;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Frame kinds of the FileDrop wire protocol.
 * Each kind is identified on the wire by a 4-byte ASCII tag.
 */
public enum FrameType {

    /** File metadata, UTF-8 JSON {"filename": ..., "filesize": ...} */
    FILE_INFO("INFO"),

    /** Opaque chunk of file content */
    FILE_DATA("DATA"),

    /** Explicit end of file content, empty payload */
    FILE_END("FEND"),

    /** Acknowledgement carrying a UTF-8 status text */
    ACK("ACK_"),

    /** Error carrying a UTF-8 diagnostic text */
    ERROR("ERR_");

    public static final int TAG_LENGTH = 4;

    private final String tag;
    private final byte[] tagBytes;

    FrameType(String tag) {
        this.tag = tag;
        this.tagBytes = tag.getBytes(StandardCharsets.US_ASCII);
    }

    public String getTag() {
        return tag;
    }

    /**
     * Get a copy of the wire tag.
     */
    public byte[] getTagBytes() {
        return tagBytes.clone();
    }

    /**
     * Look up a frame type by its wire tag.
     *
     * @param tag 4 tag bytes
     * @return the frame type, or null if the tag is not defined
     */
    public static FrameType fromTag(byte[] tag) {
        if (tag == null || tag.length != TAG_LENGTH) {
            return null;
        }
        for (FrameType type : values()) {
            if (Arrays.equals(type.tagBytes, tag)) {
                return type;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return name() + "(" + tag + ")";
    }
}
