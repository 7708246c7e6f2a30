package com.agentvm.execution;

import com.agentvm.channel.ChannelException;
import com.agentvm.channel.ControlChannel;
import com.agentvm.channel.ControlMessage;
import com.agentvm.channel.MessageType;
import com.agentvm.channel.ProtocolException;
import com.agentvm.channel.ReceiveTimeoutException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * Runs agent code in a guest over its {@link ControlChannel}.
 *
 * <p>One EXECUTE is sent with the UTF-8 source; the guest answers with a single RESULT whose
 * payload is JSON:
 * <pre>
 * {"exit_code": 0, "stdout": "...", "stderr": "...", "output": {...}}
 * </pre>
 * HEARTBEAT and STATUS frames that arrive in between are skipped. A frame that fails
 * verification fails the run, since it may have been the RESULT. A run that misses its
 * deadline is sent a STOP before the failure is reported.
 */
public class AgentExecutor {

    private static final Logger log = LoggerFactory.getLogger(AgentExecutor.class);

    private static final TypeReference<Map<String, Object>> OUTPUT_TYPE = new TypeReference<>() {};

    private final Duration defaultTimeout;
    private final Duration maxTimeout;
    private final ObjectMapper objectMapper;

    public AgentExecutor(Duration defaultTimeout, Duration maxTimeout) {
        if (!isPositive(defaultTimeout) || !isPositive(maxTimeout)) {
            throw new ExecutionException("Timeout must be positive");
        }
        if (defaultTimeout.compareTo(maxTimeout) > 0) {
            throw new ExecutionException("Default timeout cannot exceed max timeout");
        }
        this.defaultTimeout = defaultTimeout;
        this.maxTimeout = maxTimeout;
        this.objectMapper = new ObjectMapper();
    }

    public ExecutionResult execute(ControlChannel channel, String code) {
        return execute(channel, code, defaultTimeout);
    }

    /**
     * Sends the code and waits for its result.
     *
     * @param timeout total time allowed for the run, at most the configured maximum
     * @throws IllegalArgumentException when the code is blank
     * @throws ExecutionException       when the timeout is invalid, the guest reports an error,
     *                                  a frame fails verification, the deadline passes, or the
     *                                  channel fails
     */
    public ExecutionResult execute(ControlChannel channel, String code, Duration timeout) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Agent code cannot be empty");
        }
        if (timeout == null) {
            timeout = defaultTimeout;
        }
        if (!isPositive(timeout)) {
            throw new ExecutionException("Timeout must be positive");
        }
        if (timeout.compareTo(maxTimeout) > 0) {
            throw new ExecutionException("Timeout " + timeout.toSeconds() + "s exceeds maximum "
                    + maxTimeout.toSeconds() + "s");
        }

        log.info("Executing {} chars of agent code on {} (timeout {}s)",
                code.length(), channel.name(), timeout.toSeconds());
        long startNanos = System.nanoTime();
        long deadlineNanos = startNanos + timeout.toNanos();

        try {
            channel.sendMessage(MessageType.EXECUTE, code.getBytes(StandardCharsets.UTF_8));
        } catch (ChannelException e) {
            throw new ExecutionException("Failed to send code to " + channel.name() + ": " + e.getMessage(), e);
        }

        while (true) {
            long remainingNanos = deadlineNanos - System.nanoTime();
            if (remainingNanos <= 0) {
                throw timedOut(channel, timeout, null);
            }

            ControlMessage message;
            try {
                message = channel.receiveMessage(Duration.ofNanos(remainingNanos));
            } catch (ReceiveTimeoutException e) {
                throw timedOut(channel, timeout, e);
            } catch (ProtocolException e) {
                log.error("Invalid frame from {} while awaiting result: {}", channel.name(), e.getMessage());
                throw new ExecutionException("Invalid frame from " + channel.name() + " while awaiting result", e);
            } catch (ChannelException e) {
                throw new ExecutionException("Channel " + channel.name() + " failed during execution", e);
            }

            switch (message.type()) {
                case RESULT -> {
                    Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
                    ExecutionResult result = parseResult(message, duration);
                    log.info("Execution on {} finished: exit code {} in {}ms",
                            channel.name(), result.exitCode(), duration.toMillis());
                    return result;
                }
                case ERROR -> {
                    String reason = message.payloadAsString();
                    log.error("Guest on {} reported an execution error: {}", channel.name(), reason);
                    throw new ExecutionException("Guest reported error: " + reason);
                }
                case HEARTBEAT, STATUS -> log.debug("Skipping {} from {} while awaiting result",
                        message.type(), channel.name());
                default -> log.warn("Ignoring unexpected {} from {} while awaiting result",
                        message.type(), channel.name());
            }
        }
    }

    /**
     * Sends STATUS and waits for the guest's STATUS reply.
     *
     * @return round-trip time
     * @throws ExecutionException when no reply arrives in time or the channel fails
     */
    public Duration ping(ControlChannel channel, Duration timeout) {
        long startNanos = System.nanoTime();
        long deadlineNanos = startNanos + timeout.toNanos();
        try {
            channel.sendMessage(ControlMessage.empty(MessageType.STATUS));
            while (true) {
                long remainingNanos = deadlineNanos - System.nanoTime();
                if (remainingNanos <= 0) {
                    throw new ReceiveTimeoutException(channel.name(), timeout);
                }
                ControlMessage reply = channel.receiveMessage(Duration.ofNanos(remainingNanos));
                if (reply.type() == MessageType.STATUS) {
                    Duration rtt = Duration.ofNanos(System.nanoTime() - startNanos);
                    log.debug("Guest on {} answered STATUS in {}ms", channel.name(), rtt.toMillis());
                    return rtt;
                }
                log.debug("Skipping {} from {} while awaiting STATUS", reply.type(), channel.name());
            }
        } catch (ChannelException e) {
            throw new ExecutionException("Guest on " + channel.name() + " did not answer STATUS", e);
        }
    }

    private ExecutionResult parseResult(ControlMessage message, Duration duration) {
        try {
            JsonNode root = objectMapper.readTree(message.payloadAsString());
            JsonNode exitCode = root == null ? null : root.get("exit_code");
            if (exitCode == null || !exitCode.canConvertToInt()) {
                throw new ExecutionException("RESULT is missing an integer exit_code");
            }
            Map<String, Object> output = null;
            JsonNode outputNode = root.get("output");
            if (outputNode != null && outputNode.isObject()) {
                output = objectMapper.convertValue(outputNode, OUTPUT_TYPE);
            }
            int code = exitCode.asInt();
            return new ExecutionResult(code == 0, code, textOrEmpty(root, "stdout"),
                    textOrEmpty(root, "stderr"), duration, output);
        } catch (JsonProcessingException e) {
            throw new ExecutionException("Malformed RESULT payload: " + e.getOriginalMessage(), e);
        }
    }

    private ExecutionException timedOut(ControlChannel channel, Duration timeout, ReceiveTimeoutException cause) {
        log.error("Execution on {} timed out after {}s; sending STOP", channel.name(), timeout.toSeconds());
        try {
            channel.sendMessage(ControlMessage.empty(MessageType.STOP));
        } catch (ChannelException e) {
            log.warn("Could not send STOP to {}: {}", channel.name(), e.getMessage());
        }
        return new ExecutionException("Execution timed out after " + timeout.toSeconds() + " seconds", cause);
    }

    private static String textOrEmpty(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node == null || node.isNull() ? "" : node.asText();
    }

    private static boolean isPositive(Duration d) {
        return d != null && !d.isNegative() && !d.isZero();
    }
}
