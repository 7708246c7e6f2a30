package com.agentvm.channel;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.zip.CRC32;

import static org.junit.jupiter.api.Assertions.*;

class FrameCodecTest {

    private static Transport transportOver(byte[] bytes) {
        return new StreamTransport(new ByteArrayInputStream(bytes), new ByteArrayOutputStream());
    }

    private static byte[] concat(byte[]... parts) {
        var out = new ByteArrayOutputStream();
        for (byte[] part : parts) {
            out.writeBytes(part);
        }
        return out.toByteArray();
    }

    @Nested
    @DisplayName("Encoding")
    class Encoding {

        @Test
        @DisplayName("header is type, big-endian length and CRC32, followed by the payload")
        void headerLayout() {
            byte[] payload = "print('hi')".getBytes(StandardCharsets.UTF_8);
            byte[] frame = FrameCodec.encode(new ControlMessage(MessageType.EXECUTE, payload));

            var crc = new CRC32();
            crc.update(payload);
            var buffer = ByteBuffer.wrap(frame);

            assertEquals(FrameCodec.HEADER_BYTES + payload.length, frame.length);
            assertEquals(1, buffer.get());
            assertEquals(payload.length, Short.toUnsignedInt(buffer.getShort()));
            assertEquals(crc.getValue(), Integer.toUnsignedLong(buffer.getInt()));
            assertArrayEquals(payload, Arrays.copyOfRange(frame, FrameCodec.HEADER_BYTES, frame.length));
        }

        @Test
        @DisplayName("empty payload encodes to a bare header")
        void emptyPayload() {
            byte[] frame = FrameCodec.encode(ControlMessage.empty(MessageType.HEARTBEAT));
            assertEquals(FrameCodec.HEADER_BYTES, frame.length);
            assertEquals(ControlMessage.empty(MessageType.HEARTBEAT), FrameCodec.decode(frame));
        }

        @Test
        @DisplayName("decode returns what was encoded")
        void roundTrip() {
            var message = ControlMessage.of(MessageType.RESULT, "{\"exit_code\":0,\"stdout\":\"ok\"}");
            var decoded = FrameCodec.decode(FrameCodec.encode(message));
            assertEquals(message, decoded);
            assertEquals(message.checksum(), decoded.checksum());
        }

        @Test
        @DisplayName("a full 65535-byte payload survives the stream path")
        void maximumPayload() throws IOException {
            byte[] payload = new byte[FrameCodec.MAX_PAYLOAD_BYTES];
            Arrays.fill(payload, (byte) 'x');
            var message = new ControlMessage(MessageType.EXECUTE, payload);

            var read = FrameCodec.readFrame(transportOver(FrameCodec.encode(message)), FrameCodec.MAX_PAYLOAD_BYTES);
            assertEquals(message, read);
        }
    }

    @Nested
    @DisplayName("Verification")
    class Verification {

        @Test
        @DisplayName("changing any single payload byte fails the checksum")
        void everyPayloadByteIsCovered() {
            byte[] frame = FrameCodec.encode(ControlMessage.of(MessageType.EXECUTE, "import os; print(os.getcwd())"));
            for (int i = FrameCodec.HEADER_BYTES; i < frame.length; i++) {
                byte[] corrupted = frame.clone();
                corrupted[i] ^= 0x01;
                int index = i;
                assertThrows(ProtocolException.class, () -> FrameCodec.decode(corrupted),
                        "corruption at byte " + index + " was not detected");
            }
        }

        @Test
        @DisplayName("a damaged checksum field is detected")
        void damagedChecksum() {
            byte[] frame = FrameCodec.encode(ControlMessage.of(MessageType.STATUS, "ok"));
            frame[3] ^= (byte) 0xFF;
            var ex = assertThrows(ProtocolException.class, () -> FrameCodec.decode(frame));
            assertTrue(ex.getMessage().contains("Checksum mismatch"));
        }

        @Test
        @DisplayName("unknown type code is a protocol error")
        void unknownType() {
            byte[] frame = FrameCodec.encode(ControlMessage.of(MessageType.STATUS, "ok"));
            frame[0] = 42;
            var ex = assertThrows(ProtocolException.class, () -> FrameCodec.decode(frame));
            assertTrue(ex.getMessage().contains("42"));
        }

        @Test
        @DisplayName("frames shorter than the header or with a wrong length are rejected")
        void malformedFrames() {
            assertThrows(ProtocolException.class, () -> FrameCodec.decode(new byte[3]));
            byte[] frame = FrameCodec.encode(ControlMessage.of(MessageType.RESULT, "abc"));
            assertThrows(ProtocolException.class, () -> FrameCodec.decode(Arrays.copyOf(frame, frame.length - 1)));
        }
    }

    @Nested
    @DisplayName("Reading from a transport")
    class Reading {

        @Test
        @DisplayName("a corrupted frame consumes exactly its own bytes")
        void streamStaysAligned() throws IOException {
            byte[] first = FrameCodec.encode(ControlMessage.of(MessageType.HEARTBEAT, "1"));
            byte[] second = FrameCodec.encode(ControlMessage.of(MessageType.STATUS, "busy"));
            second[second.length - 1] ^= 0x10;
            byte[] third = FrameCodec.encode(ControlMessage.of(MessageType.RESULT, "done"));
            var transport = transportOver(concat(first, second, third));

            assertEquals(MessageType.HEARTBEAT, FrameCodec.readFrame(transport, 1024).type());
            assertThrows(ProtocolException.class, () -> FrameCodec.readFrame(transport, 1024));
            assertEquals("done", FrameCodec.readFrame(transport, 1024).payloadAsString());
        }

        @Test
        @DisplayName("declared length above the limit is rejected before the payload is read")
        void oversizedLength() {
            byte[] frame = FrameCodec.encode(new ControlMessage(MessageType.EXECUTE, new byte[1000]));
            var in = new ByteArrayInputStream(frame);
            var transport = new StreamTransport(in, new ByteArrayOutputStream());

            var ex = assertThrows(OversizedFrameException.class, () -> FrameCodec.readFrame(transport, 100));
            assertEquals(1000, ex.getDeclaredLength());
            assertEquals(100, ex.getMaxLength());
            assertEquals(1000, in.available(), "payload must not be consumed");
        }

        @Test
        @DisplayName("end of stream before, inside and after the header is a transport error")
        void truncatedStreams() {
            byte[] frame = FrameCodec.encode(ControlMessage.of(MessageType.RESULT, "payload"));

            assertThrows(TransportException.class, () -> FrameCodec.readFrame(transportOver(new byte[0]), 1024));
            assertThrows(TransportException.class,
                    () -> FrameCodec.readFrame(transportOver(Arrays.copyOf(frame, 4)), 1024));
            var ex = assertThrows(TransportException.class,
                    () -> FrameCodec.readFrame(transportOver(Arrays.copyOf(frame, frame.length - 2)), 1024));
            assertTrue(ex.getMessage().contains("mid-payload"));
        }
    }

    @Nested
    @DisplayName("ControlMessage")
    class Messages {

        @Test
        @DisplayName("payload is copied on the way in and out")
        void payloadCopied() {
            byte[] payload = {1, 2, 3};
            var message = new ControlMessage(MessageType.RESULT, payload);
            payload[0] = 9;
            message.payload()[1] = 9;
            assertArrayEquals(new byte[]{1, 2, 3}, message.payload());
            assertEquals(3, message.length());
        }

        @Test
        @DisplayName("payload larger than 65535 bytes cannot be built")
        void tooLarge() {
            assertThrows(IllegalArgumentException.class,
                    () -> new ControlMessage(MessageType.EXECUTE, new byte[FrameCodec.MAX_PAYLOAD_BYTES + 1]));
        }

        @Test
        @DisplayName("type codes match the wire table")
        void typeCodes() {
            assertEquals(1, MessageType.EXECUTE.code());
            assertEquals(6, MessageType.HEARTBEAT.code());
            assertEquals(MessageType.STOP, MessageType.fromCode(5));
            assertThrows(ProtocolException.class, () -> MessageType.fromCode(0));
        }
    }
}
