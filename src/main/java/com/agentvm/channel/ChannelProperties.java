package com.agentvm.channel;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "agentvm.channel")
public class ChannelProperties {

    private int maxPayloadBytes = FrameCodec.MAX_PAYLOAD_BYTES;
    private int receiveTimeoutSeconds = 30;
    private int connectTimeoutMillis = 5000;
    private int port = 9000;

    public int getMaxPayloadBytes() { return maxPayloadBytes; }
    public void setMaxPayloadBytes(int maxPayloadBytes) { this.maxPayloadBytes = maxPayloadBytes; }
    public int getReceiveTimeoutSeconds() { return receiveTimeoutSeconds; }
    public void setReceiveTimeoutSeconds(int receiveTimeoutSeconds) { this.receiveTimeoutSeconds = receiveTimeoutSeconds; }
    public int getConnectTimeoutMillis() { return connectTimeoutMillis; }
    public void setConnectTimeoutMillis(int connectTimeoutMillis) { this.connectTimeoutMillis = connectTimeoutMillis; }
    public int getPort() { return port; }
    public void setPort(int port) { this.port = port; }
}
