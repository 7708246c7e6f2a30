package com.agentvm.channel;

import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * Encodes and decodes control frames.
 *
 * <p>Frame layout, all fields big-endian:
 * <pre>
 *   +--------+-----------+--------------+-------------------+
 *   | type:1 | length:2  | crc32:4      | payload:length    |
 *   +--------+-----------+--------------+-------------------+
 * </pre>
 * The checksum is CRC32 over the payload only. A frame is handed to the caller only after
 * the checksum over the received payload matches the transmitted one.
 */
public final class FrameCodec {

    public static final int HEADER_BYTES = 7;

    /** Upper bound imposed by the unsigned 16-bit length field. */
    public static final int MAX_PAYLOAD_BYTES = 0xFFFF;

    private FrameCodec() {}

    /**
     * @return header and payload in one buffer, ready for a single write
     */
    public static byte[] encode(ControlMessage message) {
        byte[] payload = message.payload();
        var buffer = ByteBuffer.allocate(HEADER_BYTES + payload.length);
        buffer.put((byte) message.type().code());
        buffer.putShort((short) payload.length);
        buffer.putInt((int) message.checksum());
        buffer.put(payload);
        return buffer.array();
    }

    /**
     * Decodes one complete frame held in memory.
     *
     * @throws ProtocolException for a truncated frame, trailing bytes, a bad checksum or an unknown type
     */
    public static ControlMessage decode(byte[] frame) {
        if (frame.length < HEADER_BYTES) {
            throw new ProtocolException("Frame too short: " + frame.length + " bytes, need at least " + HEADER_BYTES);
        }
        var header = Header.parse(frame);
        int expected = HEADER_BYTES + header.length();
        if (frame.length != expected) {
            throw new ProtocolException("Invalid frame: expected " + expected + " bytes, got " + frame.length);
        }
        return header.toMessage(frame, HEADER_BYTES);
    }

    /**
     * Reads exactly one frame from the transport.
     *
     * @param transport  source of bytes
     * @param maxPayload largest payload accepted; longer declarations fail before any payload is read
     * @throws OversizedFrameException when the declared length exceeds {@code maxPayload}
     * @throws ProtocolException       on checksum mismatch or unknown type (stream stays aligned)
     * @throws TransportException      when the stream ends before a full frame was read
     * @throws IOException             when the transport read fails
     */
    public static ControlMessage readFrame(Transport transport, int maxPayload) throws IOException {
        byte[] headerBytes = new byte[HEADER_BYTES];
        int first = readFully(transport, headerBytes, 0, HEADER_BYTES);
        if (first == 0) {
            throw new TransportException("Connection closed by " + transport.describe());
        }
        if (first < HEADER_BYTES) {
            throw new TransportException("Connection closed mid-header after " + first + " bytes");
        }

        var header = Header.parse(headerBytes);
        if (header.length() > maxPayload) {
            throw new OversizedFrameException(header.length(), maxPayload);
        }

        byte[] payload = new byte[header.length()];
        int read = readFully(transport, payload, 0, payload.length);
        if (read < payload.length) {
            throw new TransportException("Connection closed mid-payload: got " + read
                    + " of " + payload.length + " bytes");
        }
        return header.toMessage(payload, 0);
    }

    /**
     * @return bytes actually read; less than {@code length} only at end of stream
     */
    private static int readFully(Transport transport, byte[] buffer, int offset, int length) throws IOException {
        int total = 0;
        while (total < length) {
            int n = transport.read(buffer, offset + total, length - total);
            if (n < 0) {
                break;
            }
            total += n;
        }
        return total;
    }

    private record Header(int typeCode, int length, long checksum) {

        static Header parse(byte[] bytes) {
            var buffer = ByteBuffer.wrap(bytes, 0, HEADER_BYTES);
            int type = Byte.toUnsignedInt(buffer.get());
            int length = Short.toUnsignedInt(buffer.getShort());
            long checksum = Integer.toUnsignedLong(buffer.getInt());
            return new Header(type, length, checksum);
        }

        ControlMessage toMessage(byte[] source, int payloadOffset) {
            long actual = ControlMessage.checksumOf(source, payloadOffset, length);
            if (actual != checksum) {
                throw new ProtocolException(String.format(
                        "Checksum mismatch: expected %08x, got %08x", checksum, actual));
            }
            byte[] payload = new byte[length];
            System.arraycopy(source, payloadOffset, payload, 0, length);
            return new ControlMessage(MessageType.fromCode(typeCode), payload);
        }
    }
}
