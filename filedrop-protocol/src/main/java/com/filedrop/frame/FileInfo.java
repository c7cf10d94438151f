package com.filedrop.frame;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * File metadata carried by a FILE_INFO frame.
 *
 * @param filename name as given by the sender (not yet sanitized)
 * @param filesize declared size in bytes, never negative
 */
public record FileInfo(String filename, long filesize) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String FILENAME_FIELD = "filename";
    public static final String FILESIZE_FIELD = "filesize";

    public FileInfo {
        if (filename == null) {
            throw new IllegalArgumentException("filename must not be null");
        }
        if (filesize < 0) {
            throw new IllegalArgumentException("filesize must not be negative: " + filesize);
        }
    }

    /**
     * Serialize as UTF-8 JSON.
     */
    public byte[] toJson() {
        ObjectNode node = MAPPER.createObjectNode();
        node.put(FILENAME_FIELD, filename);
        node.put(FILESIZE_FIELD, filesize);
        try {
            return MAPPER.writeValueAsBytes(node);
        } catch (JsonProcessingException e) {
            // An ObjectNode of a string and a long always serializes
            throw new IllegalStateException("Cannot serialize file info", e);
        }
    }

    /**
     * Parse a FILE_INFO payload.
     *
     * @param payload UTF-8 JSON bytes
     * @return the file metadata
     * @throws FrameFormatException if the payload is not valid UTF-8 JSON with a string
     *                              filename and a non-negative integer filesize
     */
    public static FileInfo fromJson(byte[] payload) throws FrameFormatException {
        JsonNode root;
        try {
            root = MAPPER.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new FrameFormatException("Failed to parse file info: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new FrameFormatException("Failed to parse file info: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new FrameFormatException("Failed to parse file info: expected a JSON object");
        }

        JsonNode name = root.get(FILENAME_FIELD);
        if (name == null || !name.isTextual()) {
            throw new FrameFormatException("Failed to parse file info: missing or invalid '" + FILENAME_FIELD + "'");
        }

        JsonNode size = root.get(FILESIZE_FIELD);
        if (size == null || !size.isIntegralNumber() || !size.canConvertToLong()) {
            throw new FrameFormatException("Failed to parse file info: missing or invalid '" + FILESIZE_FIELD + "'");
        }
        if (size.asLong() < 0) {
            throw new FrameFormatException("Failed to parse file info: negative filesize " + size.asLong());
        }

        return new FileInfo(name.asText(), size.asLong());
    }
}
