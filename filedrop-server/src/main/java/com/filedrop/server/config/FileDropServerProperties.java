package com.filedrop.server.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.filedrop.frame.FrameCodec;

import lombok.Data;

/**
 * Configuration of the receiving server.
 */
@Data
@ConfigurationProperties(prefix = "filedrop.server")
public class FileDropServerProperties {

    /** Address to bind */
    private String host = "localhost";

    /** TCP port, 0 for an ephemeral port */
    private int port = 8888;

    /** Directory where received files are stored, created if missing */
    private String receiveDirectory = "received_files";

    /** How long one accept call blocks before the liveness flag is re-checked (ms) */
    private int acceptPollInterval = 1000;

    /** Largest frame payload accepted from a sender */
    private long maxPayloadLength = FrameCodec.DEFAULT_MAX_PAYLOAD_LENGTH;

    /** Start listening when the application starts */
    private boolean autoStart = true;
}
