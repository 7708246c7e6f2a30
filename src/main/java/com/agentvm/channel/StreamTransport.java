package com.agentvm.channel;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link Transport} over a plain input/output stream pair.
 */
public class StreamTransport implements Transport {

    private final InputStream in;
    private final OutputStream out;
    private final String description;
    private final AtomicBoolean open = new AtomicBoolean(true);

    public StreamTransport(InputStream in, OutputStream out) {
        this(in, out, "stream");
    }

    public StreamTransport(InputStream in, OutputStream out, String description) {
        this.in = in;
        this.out = out;
        this.description = description;
    }

    @Override
    public int read(byte[] buffer, int offset, int length) throws IOException {
        if (!open.get()) {
            throw new IOException("Transport " + description + " is closed");
        }
        return in.read(buffer, offset, length);
    }

    @Override
    public void write(byte[] data) throws IOException {
        if (!open.get()) {
            throw new IOException("Transport " + description + " is closed");
        }
        out.write(data);
        out.flush();
    }

    @Override
    public boolean isOpen() {
        return open.get();
    }

    @Override
    public void close() throws IOException {
        if (!open.compareAndSet(true, false)) {
            return;
        }
        IOException failure = null;
        try {
            in.close();
        } catch (IOException e) {
            failure = e;
        }
        try {
            out.close();
        } catch (IOException e) {
            if (failure == null) {
                failure = e;
            } else {
                failure.addSuppressed(e);
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public String describe() {
        return description;
    }
}
