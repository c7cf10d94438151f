package com.filedrop.server.service;

import static org.assertj.core.api.Assertions.*;

import java.nio.file.Path;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.filedrop.server.config.FileDropServerProperties;
import com.filedrop.server.observability.TransferMetrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

@DisplayName("FileDropServerManager Tests")
class FileDropServerManagerTest {

    @TempDir
    Path tempDir;

    private FileDropServerProperties properties;
    private FileDropServerManager manager;

    @BeforeEach
    void setUp() {
        properties = new FileDropServerProperties();
        properties.setHost("127.0.0.1");
        properties.setPort(0);
        properties.setAcceptPollInterval(100);
        properties.setReceiveDirectory(tempDir.resolve("received").toString());
        manager = new FileDropServerManager(properties, new TransferMetrics(new SimpleMeterRegistry()));
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
    }

    @Test
    @DisplayName("init should start the server when auto-start is enabled")
    void initShouldAutoStart() {
        manager.init();

        assertThat(manager.isRunning()).isTrue();
        assertThat(manager.getLocalPort()).isPositive();
        assertThat(tempDir.resolve("received")).isDirectory();
    }

    @Test
    @DisplayName("init should leave the server stopped when auto-start is disabled")
    void initShouldHonourAutoStartFlag() {
        properties.setAutoStart(false);

        manager.init();

        assertThat(manager.isRunning()).isFalse();
        assertThat(manager.getLocalPort()).isEqualTo(-1);
    }

    @Test
    @DisplayName("start should refuse to run twice")
    void startShouldRefuseTwice() {
        manager.start();

        assertThatThrownBy(manager::start)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already running");
    }

    @Test
    @DisplayName("stop should end the accept loop and allow a restart")
    void stopShouldAllowRestart() {
        manager.start();
        manager.stop();

        assertThat(manager.isRunning()).isFalse();

        manager.start();
        assertThat(manager.isRunning()).isTrue();
    }

    @Test
    @DisplayName("stop should be a no-op when never started")
    void stopWithoutStart() {
        assertThatCode(manager::stop).doesNotThrowAnyException();
    }
}
