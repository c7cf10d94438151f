package com.filedrop.server.service;

import java.io.IOException;
import java.nio.file.Path;

import org.springframework.stereotype.Service;

import com.filedrop.server.config.FileDropServerProperties;
import com.filedrop.server.observability.TransferMetrics;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns the {@link ConnectionAcceptor} for the lifetime of the application.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FileDropServerManager {

    private final FileDropServerProperties properties;
    private final TransferMetrics metrics;

    private ConnectionAcceptor acceptor;

    @PostConstruct
    public void init() {
        if (properties.isAutoStart()) {
            log.info("Auto-starting FileDrop server");
            start();
        } else {
            log.info("Auto-start disabled, server not started");
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down FileDrop server...");
        stop();
    }

    /**
     * Bind and start accepting connections.
     *
     * @throws IllegalStateException if already running or the address cannot be bound
     */
    public synchronized void start() {
        if (acceptor != null && acceptor.isRunning()) {
            throw new IllegalStateException("Server already running on port " + acceptor.getLocalPort());
        }

        ConnectionAcceptor created = new ConnectionAcceptor(
                properties.getHost(),
                properties.getPort(),
                Path.of(properties.getReceiveDirectory()),
                properties.getAcceptPollInterval(),
                properties.getMaxPayloadLength(),
                message -> log.debug("{}", message),
                metrics);
        try {
            created.start();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to start server on "
                    + properties.getHost() + ":" + properties.getPort() + ": " + e.getMessage(), e);
        }
        acceptor = created;
    }

    /**
     * Stop accepting connections. Sessions already in progress run to completion.
     */
    public synchronized void stop() {
        if (acceptor == null || !acceptor.isRunning()) {
            return;
        }
        acceptor.stop();
        try {
            if (!acceptor.awaitTermination(2L * properties.getAcceptPollInterval())) {
                log.warn("Accept loop still running after stop request");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return acceptor != null && acceptor.isRunning();
    }

    /**
     * Bound port, or -1 when not running.
     */
    public int getLocalPort() {
        return acceptor != null ? acceptor.getLocalPort() : -1;
    }
}
