package com.agentvm.execution;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one agent run inside a guest.
 *
 * @param success  true when the agent exited with code 0
 * @param exitCode process exit code reported by the guest
 * @param stdout   captured standard output
 * @param stderr   captured standard error
 * @param duration host-measured time from EXECUTE sent to RESULT received
 * @param output   structured output the agent produced, empty when none
 */
public record ExecutionResult(
    boolean success,
    int exitCode,
    String stdout,
    String stderr,
    Duration duration,
    Map<String, Object> output
) {
    public ExecutionResult {
        stdout = stdout != null ? stdout : "";
        stderr = stderr != null ? stderr : "";
        output = output != null ? Collections.unmodifiableMap(new LinkedHashMap<>(output)) : Map.of();
    }
}
