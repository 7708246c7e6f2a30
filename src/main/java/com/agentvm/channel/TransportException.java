package com.agentvm.channel;

/**
 * The underlying connection is closed or broken. Fatal to the channel instance:
 * callers must discard it and reconnect.
 */
public class TransportException extends ChannelException {
    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
