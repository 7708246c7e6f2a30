package com.agentvm.channel;

/**
 * Control message types and their one-byte wire codes.
 *
 * <ul>
 *   <li>EXECUTE: host to guest, payload is the command or code to run</li>
 *   <li>RESULT: guest to host, payload is the structured outcome (JSON)</li>
 *   <li>STATUS: either direction, liveness/state query and reply</li>
 *   <li>ERROR: guest to host, payload describes a failure such as an execution timeout</li>
 *   <li>STOP: host to guest, request graceful termination of the current work</li>
 *   <li>HEARTBEAT: either direction, keep-alive with an optional empty payload</li>
 * </ul>
 */
public enum MessageType {
    EXECUTE(1),
    RESULT(2),
    STATUS(3),
    ERROR(4),
    STOP(5),
    HEARTBEAT(6);

    private final int code;

    MessageType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * @throws ProtocolException for a code no type maps to
     */
    public static MessageType fromCode(int code) {
        for (MessageType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new ProtocolException("Unknown message type code: " + code);
    }
}
