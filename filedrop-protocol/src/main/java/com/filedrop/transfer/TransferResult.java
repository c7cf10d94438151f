package com.filedrop.transfer;

/**
 * Outcome of one transfer session, on either side of the connection.
 *
 * @param success  true if the session completed successfully
 * @param failure  failure kind, null on success
 * @param message  final human-readable message (remote text where there is one)
 * @param filename name of the file as seen by the side producing the result
 * @param bytes    payload bytes sent or received
 */
public record TransferResult(boolean success, TransferFailure failure, String message, String filename, long bytes) {

    public static TransferResult success(String filename, long bytes, String message) {
        return new TransferResult(true, null, message, filename, bytes);
    }

    public static TransferResult failure(TransferFailure failure, String filename, long bytes, String message) {
        if (failure == null) {
            throw new IllegalArgumentException("failure kind is required");
        }
        return new TransferResult(false, failure, message, filename, bytes);
    }

    public boolean isFailure() {
        return !success;
    }

    /**
     * Message prefixed with the failure label, e.g. "Server error: File transfer incomplete".
     */
    public String describe() {
        return success ? message : failure.getLabel() + ": " + message;
    }
}
