package com.agentvm.machine;

/**
 * CPU, memory and disk allocation for a machine.
 *
 * @param vcpu      virtual CPU count
 * @param memoryMib memory in MiB
 * @param diskGib   disk size in GiB
 */
public record ResourceProfile(int vcpu, int memoryMib, int diskGib) {

    public static final ResourceProfile STANDARD = new ResourceProfile(2, 2048, 20);

    public ResourceProfile {
        if (vcpu < 1) {
            throw new IllegalArgumentException("vcpu must be at least 1, got: " + vcpu);
        }
        if (memoryMib < 128) {
            throw new IllegalArgumentException("memoryMib must be at least 128, got: " + memoryMib);
        }
        if (diskGib < 1) {
            throw new IllegalArgumentException("diskGib must be at least 1, got: " + diskGib);
        }
    }
}
