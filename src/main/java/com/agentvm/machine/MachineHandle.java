package com.agentvm.machine;

/**
 * Opaque reference to one virtual machine owned by an external virtualization backend.
 * Implementations: supplied by the embedding application (libvirt, firecracker, ...).
 *
 * <p>The pool never forces a state change except through {@link #start()},
 * {@link #stop(boolean)} and {@link #destroy()}; it only observes {@link #getState()}.
 */
public interface MachineHandle {

    /**
     * Backend name of the machine.
     */
    String name();

    /**
     * Identity that stays stable for the lifetime of the machine.
     */
    String uuid();

    /**
     * Boots the machine. Must be a no-op when it is already running.
     * @throws MachineException when the backend rejects the request
     */
    void start();

    /**
     * Stops the machine.
     * @param graceful {@code true} to request an ACPI-style shutdown, {@code false} to power off
     * @throws MachineException when the backend rejects the request
     */
    void stop(boolean graceful);

    /**
     * Releases every backend resource held by the machine (definition, disks, snapshots).
     * @throws MachineException when the backend cleanup fails
     */
    void destroy();

    /**
     * @return the state currently reported by the backend
     * @throws MachineException when the state cannot be read
     */
    MachineState getState();
}
