package com.agentvm.channel;

import java.io.IOException;

/**
 * Byte-stream duplex connection to one guest: the substrate under a {@link ControlChannel}.
 * Implementations: {@link StreamTransport} (any stream pair), {@link SocketTransport} (TCP).
 */
public interface Transport extends AutoCloseable {

    /**
     * Reads up to {@code length} bytes, blocking until at least one is available.
     *
     * @return number of bytes read, or -1 at end of stream
     */
    int read(byte[] buffer, int offset, int length) throws IOException;

    /**
     * Writes every byte of {@code data} and flushes.
     */
    void write(byte[] data) throws IOException;

    boolean isOpen();

    /**
     * Closes both directions. Idempotent.
     */
    @Override
    void close() throws IOException;

    /**
     * Human-readable endpoint description for logs.
     */
    default String describe() {
        return getClass().getSimpleName();
    }
}
