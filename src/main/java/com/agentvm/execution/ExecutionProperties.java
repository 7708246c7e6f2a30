package com.agentvm.execution;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "agentvm.execution")
public class ExecutionProperties {

    private long defaultTimeoutSeconds = 300;
    private long maxTimeoutSeconds = 3600;

    public Duration getDefaultTimeout() { return Duration.ofSeconds(defaultTimeoutSeconds); }
    public Duration getMaxTimeout() { return Duration.ofSeconds(maxTimeoutSeconds); }

    public long getDefaultTimeoutSeconds() { return defaultTimeoutSeconds; }
    public void setDefaultTimeoutSeconds(long defaultTimeoutSeconds) { this.defaultTimeoutSeconds = defaultTimeoutSeconds; }
    public long getMaxTimeoutSeconds() { return maxTimeoutSeconds; }
    public void setMaxTimeoutSeconds(long maxTimeoutSeconds) { this.maxTimeoutSeconds = maxTimeoutSeconds; }
}
