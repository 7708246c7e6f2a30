package com.agentvm.channel;

import java.time.Duration;

/**
 * No complete message arrived within the receive timeout. The channel stays usable.
 */
public class ReceiveTimeoutException extends ChannelException {

    private final Duration timeout;

    public ReceiveTimeoutException(String channelName, Duration timeout) {
        super("No message received on " + channelName + " within " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
