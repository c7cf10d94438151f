package com.filedrop.transport;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;

/**
 * Plain TCP transport channel.
 * Either dials a remote host or wraps a socket handed out by a server's accept loop.
 */
public class TcpTransportChannel extends AbstractSocketTransportChannel {

    public static final int DEFAULT_CONNECT_TIMEOUT = 10000;

    private final int connectTimeout;

    public TcpTransportChannel(String host, int port) {
        this(host, port, DEFAULT_CONNECT_TIMEOUT);
    }

    public TcpTransportChannel(String host, int port, int connectTimeout) {
        super(host, port);
        this.connectTimeout = connectTimeout;
    }

    /**
     * Wrap an already accepted socket.
     */
    public static TcpTransportChannel accepted(Socket socket) throws IOException {
        TcpTransportChannel channel = new TcpTransportChannel(
                socket.getInetAddress().getHostAddress(), socket.getPort(), 0);
        channel.attach(socket);
        return channel;
    }

    @Override
    protected Socket createSocket() throws IOException {
        Socket s = new Socket();
        try {
            s.connect(new InetSocketAddress(host, port), connectTimeout);
        } catch (IOException e) {
            s.close();
            throw e;
        }
        return s;
    }

    public int getConnectTimeout() {
        return connectTimeout;
    }
}
