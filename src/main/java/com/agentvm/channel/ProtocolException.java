package com.agentvm.channel;

/**
 * A frame was rejected: checksum mismatch, unknown type or a declared length over the limit.
 */
public class ProtocolException extends ChannelException {
    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
