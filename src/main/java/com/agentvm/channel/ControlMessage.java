package com.agentvm.channel;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.zip.CRC32;

/**
 * One unit of the host-guest control protocol.
 *
 * <p>The payload is copied on the way in and out, so a message is immutable.
 * Length and checksum are derived from the payload.
 *
 * @param type    message type
 * @param payload opaque payload bytes, at most {@link FrameCodec#MAX_PAYLOAD_BYTES}
 */
public record ControlMessage(MessageType type, byte[] payload) {

    public ControlMessage {
        if (type == null) {
            throw new IllegalArgumentException("Message type must not be null");
        }
        payload = payload == null ? new byte[0] : payload.clone();
        if (payload.length > FrameCodec.MAX_PAYLOAD_BYTES) {
            throw new IllegalArgumentException("Payload of " + payload.length
                    + " bytes exceeds maximum " + FrameCodec.MAX_PAYLOAD_BYTES);
        }
    }

    public static ControlMessage of(MessageType type, String text) {
        return new ControlMessage(type, text.getBytes(StandardCharsets.UTF_8));
    }

    public static ControlMessage empty(MessageType type) {
        return new ControlMessage(type, new byte[0]);
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    public int length() {
        return payload.length;
    }

    /**
     * @return CRC32 of the payload as an unsigned 32-bit value
     */
    public long checksum() {
        return checksumOf(payload, 0, payload.length);
    }

    public String payloadAsString() {
        return new String(payload, StandardCharsets.UTF_8);
    }

    static long checksumOf(byte[] data, int offset, int length) {
        var crc = new CRC32();
        crc.update(data, offset, length);
        return crc.getValue();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ControlMessage other)) return false;
        return type == other.type && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "ControlMessage[type=" + type + ", length=" + payload.length + "]";
    }
}
