package com.agentvm.machine;

/**
 * Network isolation applied to a new machine.
 * NAT_FILTERED is the default because CLI agents need package managers, APIs and git.
 */
public enum NetworkMode {
    NAT_FILTERED,
    ISOLATED,
    BRIDGE
}
