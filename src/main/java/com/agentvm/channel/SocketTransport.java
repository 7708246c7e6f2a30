package com.agentvm.channel;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;

/**
 * {@link Transport} over a TCP socket, typically the host end of a forwarded guest agent port.
 */
public class SocketTransport extends StreamTransport {

    private final Socket socket;

    public SocketTransport(Socket socket) throws IOException {
        super(socket.getInputStream(), socket.getOutputStream(),
                String.valueOf(socket.getRemoteSocketAddress()));
        this.socket = socket;
    }

    /**
     * Opens a connection to the guest agent.
     *
     * @throws TransportException when the endpoint cannot be reached in time
     */
    public static SocketTransport connect(String host, int port, Duration connectTimeout) {
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Port must be between 1 and 65535, got: " + port);
        }
        var socket = new Socket();
        try {
            socket.setTcpNoDelay(true);
            socket.connect(new InetSocketAddress(host, port), (int) connectTimeout.toMillis());
            return new SocketTransport(socket);
        } catch (IOException e) {
            try {
                socket.close();
            } catch (IOException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw new TransportException("Failed to connect to " + host + ":" + port, e);
        }
    }

    @Override
    public boolean isOpen() {
        return super.isOpen() && !socket.isClosed();
    }

    @Override
    public void close() throws IOException {
        try {
            super.close();
        } finally {
            socket.close();
        }
    }
}
