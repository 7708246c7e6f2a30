package com.agentvm.machine;

/**
 * Abstraction over the hypervisor driver.
 * The pool only needs to define new machines; lifecycle calls go through the returned handle.
 */
public interface VirtualizationBackend {

    /**
     * Defines a new machine from the template. The machine is not started.
     *
     * @param template name, resources and network mode of the machine
     * @return handle to the new machine
     * @throws MachineException when the backend cannot define the machine
     */
    MachineHandle createMachine(MachineTemplate template);
}
