package com.filedrop.server.observability;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.filedrop.transfer.TransferFailure;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

@DisplayName("TransferMetrics Tests")
class TransferMetricsTest {

    private SimpleMeterRegistry registry;
    private TransferMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new TransferMetrics(registry);
    }

    @Test
    @DisplayName("connectionOpened should increment active and total connections")
    void connectionOpenedShouldIncrementCounters() {
        assertEquals(0, metrics.getActiveConnections());

        metrics.connectionOpened();
        metrics.connectionOpened();

        assertEquals(2, metrics.getActiveConnections());
        assertEquals(2.0, registry.get("filedrop.connections.total").counter().count());
        assertEquals(2.0, registry.get("filedrop.connections.active").gauge().value());
    }

    @Test
    @DisplayName("connectionClosed should decrement active connections only")
    void connectionClosedShouldDecrementActive() {
        metrics.connectionOpened();
        metrics.connectionOpened();
        metrics.connectionClosed();

        assertEquals(1, metrics.getActiveConnections());
        assertEquals(2.0, registry.get("filedrop.connections.total").counter().count());
    }

    @Test
    @DisplayName("transferCompleted should count the transfer and record size and duration")
    void transferCompletedShouldRecordMetrics() {
        metrics.transferStarted();
        metrics.transferCompleted(1024L, Duration.ofMillis(500));

        assertEquals(1.0, registry.get("filedrop.transfers.started").counter().count());
        assertEquals(1.0, registry.get("filedrop.transfers.completed").counter().count());
        assertEquals(1024.0, registry.get("filedrop.transfers.size").summary().totalAmount());
        assertEquals(1, registry.get("filedrop.transfers.duration").timer().count());
    }

    @Test
    @DisplayName("transferFailed should be tagged with the failure kind")
    void transferFailedShouldBeTagged() {
        metrics.transferFailed(TransferFailure.PROTOCOL_VIOLATION);
        metrics.transferFailed(TransferFailure.PROTOCOL_VIOLATION);
        metrics.transferFailed(TransferFailure.TRANSPORT_FAILURE);

        assertEquals(2.0, registry.get("filedrop.transfers.failed").tag("reason", "PROTOCOL_VIOLATION")
                .counter().count());
        assertEquals(1.0, registry.get("filedrop.transfers.failed").tag("reason", "TRANSPORT_FAILURE")
                .counter().count());
    }

    @Test
    @DisplayName("transferFailed should handle a null kind")
    void transferFailedShouldHandleNull() {
        assertDoesNotThrow(() -> metrics.transferFailed(null));
        assertEquals(1.0, registry.get("filedrop.transfers.failed").tag("reason", "UNKNOWN").counter().count());
    }

    @Test
    @DisplayName("bytesReceived should accumulate")
    void bytesReceivedShouldAccumulate() {
        metrics.bytesReceived(100);
        metrics.bytesReceived(28);

        assertEquals(128.0, registry.get("filedrop.bytes.received").counter().count());
    }

    @Test
    @DisplayName("acceptor gauge should follow start and stop")
    void acceptorGaugeShouldFollowLifecycle() {
        metrics.acceptorStarted();
        assertEquals(1, metrics.getRunningAcceptors());

        metrics.acceptorStopped();
        assertEquals(0, metrics.getRunningAcceptors());
    }
}
