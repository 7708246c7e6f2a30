package com.agentvm.machine;

/**
 * Everything the backend needs to define a new machine.
 *
 * @param name        unique machine name
 * @param resources   resource allocation
 * @param networkMode network isolation mode
 */
public record MachineTemplate(String name, ResourceProfile resources, NetworkMode networkMode) {

    public MachineTemplate {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Machine name must not be blank");
        }
        if (resources == null) {
            resources = ResourceProfile.STANDARD;
        }
        if (networkMode == null) {
            networkMode = NetworkMode.NAT_FILTERED;
        }
    }

    public static MachineTemplate standard(String name) {
        return new MachineTemplate(name, ResourceProfile.STANDARD, NetworkMode.NAT_FILTERED);
    }
}
