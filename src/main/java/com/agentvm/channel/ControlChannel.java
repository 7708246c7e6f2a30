package com.agentvm.channel;

import com.agentvm.core.logging.MdcContext;
import com.agentvm.core.metrics.PoolMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Framed, checksummed message channel between the host and one guest.
 *
 * <p>Sending and receiving are independent. Writes are serialized by a lock and every frame
 * goes out in a single transport write. Reads are done by a dedicated reader thread that decodes
 * frames into an inbox; {@link #receiveMessage(Duration)} waits on that inbox with a deadline, so
 * a caller awaiting a RESULT also detects an unresponsive guest. A frame that arrives after a
 * receive timed out is delivered to the next receive.
 *
 * <p>Failure handling:
 * <ul>
 *   <li>checksum mismatch or unknown type: {@link ProtocolException}, channel stays usable</li>
 *   <li>declared length over the limit: {@link OversizedFrameException}, then the channel is closed</li>
 *   <li>connection closed or broken: {@link TransportException}, fatal to this instance</li>
 * </ul>
 */
public class ControlChannel implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ControlChannel.class);

    private static final int INBOX_CAPACITY = 256;

    private final String name;
    private final Transport transport;
    private final int maxPayloadBytes;
    private final Duration defaultReceiveTimeout;
    private final PoolMetrics metrics;

    private final ReentrantLock writeLock = new ReentrantLock();
    private final BlockingQueue<Inbound> inbox = new LinkedBlockingQueue<>(INBOX_CAPACITY);
    private final ExecutorService reader;

    private volatile boolean closed;
    private volatile TransportException broken;

    private ControlChannel(String name, Transport transport, int maxPayloadBytes,
                           Duration defaultReceiveTimeout, PoolMetrics metrics) {
        if (maxPayloadBytes < 0 || maxPayloadBytes > FrameCodec.MAX_PAYLOAD_BYTES) {
            throw new IllegalArgumentException("maxPayloadBytes must be between 0 and "
                    + FrameCodec.MAX_PAYLOAD_BYTES + ", got: " + maxPayloadBytes);
        }
        this.name = name;
        this.transport = transport;
        this.maxPayloadBytes = maxPayloadBytes;
        this.defaultReceiveTimeout = defaultReceiveTimeout;
        this.metrics = metrics;
        this.reader = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "control-channel-" + name);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Opens a channel over an established transport and starts its reader.
     */
    public static ControlChannel open(String name, Transport transport, ChannelProperties properties,
                                      PoolMetrics metrics) {
        var channel = new ControlChannel(name, transport, properties.getMaxPayloadBytes(),
                Duration.ofSeconds(properties.getReceiveTimeoutSeconds()), metrics);
        channel.reader.execute(channel::readLoop);
        log.info("Control channel {} opened on {}", name, transport.describe());
        return channel;
    }

    /**
     * Connects to the guest agent listening on {@code host} at the configured port.
     *
     * @throws TransportException when the guest cannot be reached within the connect timeout
     */
    public static ControlChannel connect(String name, String host, ChannelProperties properties,
                                         PoolMetrics metrics) {
        var transport = SocketTransport.connect(host, properties.getPort(),
                Duration.ofMillis(properties.getConnectTimeoutMillis()));
        return open(name, transport, properties, metrics);
    }

    /**
     * Encodes the frame and writes it in one call.
     *
     * @throws ProtocolException  when the payload exceeds the channel maximum
     * @throws TransportException when the channel is closed or the write fails; the channel is then broken
     */
    public void sendMessage(MessageType type, byte[] payload) {
        int length = payload == null ? 0 : payload.length;
        if (length > maxPayloadBytes) {
            throw new ProtocolException("Payload of " + length + " bytes exceeds maximum " + maxPayloadBytes);
        }
        var message = new ControlMessage(type, payload);
        byte[] frame = FrameCodec.encode(message);

        writeLock.lock();
        try {
            ensureUsable();
            transport.write(frame);
        } catch (IOException e) {
            var failure = new TransportException("Failed to send " + type + " on " + name, e);
            markBroken(failure);
            throw failure;
        } finally {
            writeLock.unlock();
        }

        if (metrics != null) {
            metrics.recordFrame("sent", type.name());
        }
        log.debug("Sent {} ({} bytes) on {}", type, length, name);
    }

    public void sendMessage(ControlMessage message) {
        sendMessage(message.type(), message.payload());
    }

    /**
     * Waits for the next message using the configured default timeout.
     */
    public ControlMessage receiveMessage() {
        return receiveMessage(defaultReceiveTimeout);
    }

    /**
     * Waits for the next verified message.
     *
     * @param timeout how long to wait for a complete frame
     * @throws ReceiveTimeoutException when nothing arrives in time
     * @throws ProtocolException       when the next frame failed verification
     * @throws TransportException      when the connection is closed or broken
     */
    public ControlMessage receiveMessage(Duration timeout) {
        if (broken != null && inbox.isEmpty()) {
            throw new TransportException("Channel " + name + " is broken", broken);
        }
        if (closed && inbox.isEmpty()) {
            throw new TransportException("Channel " + name + " is closed");
        }

        Inbound next;
        try {
            next = inbox.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChannelException("Interrupted while receiving on " + name, e);
        }

        if (next == null) {
            if (broken != null) {
                throw new TransportException("Channel " + name + " is broken", broken);
            }
            throw new ReceiveTimeoutException(name, timeout);
        }
        if (next.failure() instanceof TransportException transportFailure) {
            throw new TransportException(transportFailure.getMessage(), transportFailure);
        }
        if (next.failure() instanceof ProtocolException protocolFailure) {
            throw protocolFailure;
        }
        return next.message();
    }

    public boolean isOpen() {
        return !closed && broken == null;
    }

    public String name() {
        return name;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        // fail receivers already waiting instead of letting them run out their timeout
        markBroken(new TransportException("Channel " + name + " is closed"));
        try {
            transport.close();
        } catch (IOException e) {
            log.warn("Error closing transport for channel {}: {}", name, e.getMessage());
        }
        reader.shutdownNow();
        log.info("Control channel {} closed", name);
    }

    private void readLoop() {
        MdcContext.setChannel(name);
        try {
            while (!closed) {
                try {
                    var message = FrameCodec.readFrame(transport, maxPayloadBytes);
                    if (metrics != null) {
                        metrics.recordFrame("received", message.type().name());
                    }
                    log.debug("Received {} ({} bytes) on {}", message.type(), message.length(), name);
                    inbox.put(Inbound.of(message));
                } catch (OversizedFrameException e) {
                    log.error("Rejecting frame on {}: {}; closing desynchronized channel", name, e.getMessage());
                    recordProtocolError("oversized");
                    inbox.put(Inbound.failed(e));
                    markBroken(new TransportException("Channel " + name + " desynchronized", e));
                    closeTransportQuietly();
                    return;
                } catch (ProtocolException e) {
                    log.warn("Rejecting frame on {}: {}", name, e.getMessage());
                    recordProtocolError("invalid");
                    inbox.put(Inbound.failed(e));
                } catch (TransportException e) {
                    if (!closed) {
                        log.info("Channel {} lost its connection: {}", name, e.getMessage());
                        markBroken(e);
                    }
                    return;
                } catch (IOException e) {
                    if (!closed) {
                        log.warn("Read failed on {}: {}", name, e.getMessage());
                        markBroken(new TransportException("Read failed on " + name, e));
                    }
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            MdcContext.clear();
        }
    }

    private void ensureUsable() {
        if (broken != null) {
            throw new TransportException("Channel " + name + " is broken", broken);
        }
        if (closed || !transport.isOpen()) {
            throw new TransportException("Channel " + name + " is closed");
        }
    }

    private void markBroken(TransportException cause) {
        if (broken != null) {
            return;
        }
        broken = cause;
        // wakes a receiver that is already waiting
        if (!inbox.offer(Inbound.failed(cause))) {
            log.warn("Inbox of {} is full; receivers will see the broken state on their next call", name);
        }
    }

    private void closeTransportQuietly() {
        try {
            transport.close();
        } catch (IOException e) {
            log.debug("Ignoring close failure on {}: {}", name, e.getMessage());
        }
    }

    private void recordProtocolError(String reason) {
        if (metrics != null) {
            metrics.recordProtocolError(reason);
        }
    }

    private record Inbound(ControlMessage message, ChannelException failure) {
        static Inbound of(ControlMessage message) {
            return new Inbound(message, null);
        }

        static Inbound failed(ChannelException failure) {
            return new Inbound(null, failure);
        }
    }
}
