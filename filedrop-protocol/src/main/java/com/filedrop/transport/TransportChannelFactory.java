package com.filedrop.transport;

/**
 * Creates unconnected channels towards a fixed endpoint, one per transfer.
 */
@FunctionalInterface
public interface TransportChannelFactory {

    TransportChannel createChannel();

    static TransportChannelFactory tcp(String host, int port, int connectTimeout) {
        return () -> new TcpTransportChannel(host, port, connectTimeout);
    }
}
