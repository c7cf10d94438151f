package com.filedrop.transfer;

/**
 * Why a transfer session ended without success.
 */
public enum TransferFailure {

    /** I/O error or the peer disconnected mid-frame */
    TRANSPORT_FAILURE("Connection error"),

    /** Unexpected frame type, malformed header or undecodable metadata */
    PROTOCOL_VIOLATION("Protocol error"),

    /** An explicit ERROR frame was sent or received */
    APPLICATION_ERROR("Server error"),

    /** The local file to send is missing or not a regular file */
    SOURCE_UNAVAILABLE("File error");

    private final String label;

    TransferFailure(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
