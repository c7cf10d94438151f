package com.filedrop.server.observability;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import org.springframework.stereotype.Component;

import com.filedrop.transfer.TransferFailure;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * Micrometer meters for connections and transfers.
 */
@Component
public class TransferMetrics {

    private final MeterRegistry registry;

    private final AtomicInteger activeConnections = new AtomicInteger();
    private final AtomicInteger runningAcceptors = new AtomicInteger();

    private final Counter connectionsTotal;
    private final Counter transfersStarted;
    private final Counter transfersCompleted;
    private final Counter bytesReceived;
    private final Timer transferDuration;
    private final DistributionSummary fileSize;

    public TransferMetrics(MeterRegistry registry) {
        this.registry = registry;

        Gauge.builder("filedrop.connections.active", activeConnections, AtomicInteger::get)
                .description("Connections currently being handled")
                .register(registry);
        Gauge.builder("filedrop.acceptors.running", runningAcceptors, AtomicInteger::get)
                .description("Listening acceptors")
                .register(registry);

        connectionsTotal = Counter.builder("filedrop.connections.total")
                .description("Accepted connections")
                .register(registry);
        transfersStarted = Counter.builder("filedrop.transfers.started")
                .description("Transfers whose file info was accepted")
                .register(registry);
        transfersCompleted = Counter.builder("filedrop.transfers.completed")
                .description("Files received and kept")
                .register(registry);
        bytesReceived = Counter.builder("filedrop.bytes.received")
                .description("Payload bytes written to received files")
                .baseUnit("bytes")
                .register(registry);
        transferDuration = Timer.builder("filedrop.transfers.duration")
                .description("Duration of completed transfers")
                .register(registry);
        fileSize = DistributionSummary.builder("filedrop.transfers.size")
                .description("Size of kept files")
                .baseUnit("bytes")
                .register(registry);
    }

    public void connectionOpened() {
        activeConnections.incrementAndGet();
        connectionsTotal.increment();
    }

    public void connectionClosed() {
        activeConnections.decrementAndGet();
    }

    public void acceptorStarted() {
        runningAcceptors.incrementAndGet();
    }

    public void acceptorStopped() {
        runningAcceptors.decrementAndGet();
    }

    public void transferStarted() {
        transfersStarted.increment();
    }

    public void bytesReceived(long bytes) {
        bytesReceived.increment(bytes);
    }

    public void transferCompleted(long bytes, Duration duration) {
        transfersCompleted.increment();
        fileSize.record(bytes);
        transferDuration.record(duration);
    }

    public void transferFailed(TransferFailure failure) {
        Counter.builder("filedrop.transfers.failed")
                .description("Transfers that ended without a kept file")
                .tag("reason", failure != null ? failure.name() : "UNKNOWN")
                .register(registry)
                .increment();
    }

    public int getActiveConnections() {
        return activeConnections.get();
    }

    public int getRunningAcceptors() {
        return runningAcceptors.get();
    }
}
