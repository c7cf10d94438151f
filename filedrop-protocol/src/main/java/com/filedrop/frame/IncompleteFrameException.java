package com.filedrop.frame;

import java.io.EOFException;

/**
 * The stream ended before a full frame header or payload could be read.
 */
public class IncompleteFrameException extends EOFException {

    private final int expected;
    private final int received;

    public IncompleteFrameException(String what, int expected, int received) {
        super("Failed to receive complete " + what + ": got " + received + " of " + expected + " bytes");
        this.expected = expected;
        this.received = received;
    }

    public int getExpected() {
        return expected;
    }

    public int getReceived() {
        return received;
    }
}
