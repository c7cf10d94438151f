package com.filedrop.frame;

import java.io.IOException;

/**
 * A frame was read completely but does not conform to the protocol:
 * unknown tag, unacceptable length or undecodable metadata.
 */
public class FrameFormatException extends IOException {

    public FrameFormatException(String message) {
        super(message);
    }

    public FrameFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
