package com.agentvm.pool;

import com.agentvm.machine.NetworkMode;
import com.agentvm.machine.ResourceProfile;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "agentvm")
public class PoolProperties {

    private Pool pool = new Pool();
    private Machine machine = new Machine();

    // -- Pool accessors (delegate to nested) --
    public String getId() { return pool.id; }
    public int getMinSize() { return pool.minSize; }
    public int getMaxSize() { return pool.maxSize; }
    public Duration getTtl() { return Duration.ofSeconds(pool.ttlSeconds); }
    public Duration getMaintenanceInterval() { return Duration.ofMillis(pool.maintenanceIntervalMillis); }
    public Duration getBootTimeout() { return Duration.ofSeconds(pool.bootTimeoutSeconds); }
    public Duration getResetTimeout() { return Duration.ofSeconds(pool.resetTimeoutSeconds); }
    public Duration getDestroyTimeout() { return Duration.ofSeconds(pool.destroyTimeoutSeconds); }
    public Duration getStatePollCeiling() { return Duration.ofMillis(pool.statePollCeilingMillis); }
    public boolean isOnDemandCreation() { return pool.onDemandCreation; }
    public String getNamePrefix() { return pool.namePrefix; }

    // -- Machine accessors (delegate to nested) --

    /**
     * Resources requested for every pooled machine.
     */
    public ResourceProfile getResourceProfile() {
        return new ResourceProfile(machine.vcpu, machine.memoryMib, machine.diskGib);
    }
    public NetworkMode getNetworkMode() { return machine.networkMode; }

    public Pool getPool() { return pool; }
    public void setPool(Pool pool) { this.pool = pool; }
    public Machine getMachine() { return machine; }
    public void setMachine(Machine machine) { this.machine = machine; }

    public static class Pool {
        private String id = "default";
        private int minSize = 5;
        private int maxSize = 20;
        private long ttlSeconds = 3600;
        private long maintenanceIntervalMillis = 10_000;
        private long bootTimeoutSeconds = 30;
        private long resetTimeoutSeconds = 30;
        private long destroyTimeoutSeconds = 10;
        private long statePollCeilingMillis = 500;
        private boolean onDemandCreation = false;
        private String namePrefix = "pool-vm";

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }
        public int getMinSize() { return minSize; }
        public void setMinSize(int minSize) { this.minSize = minSize; }
        public int getMaxSize() { return maxSize; }
        public void setMaxSize(int maxSize) { this.maxSize = maxSize; }
        public long getTtlSeconds() { return ttlSeconds; }
        public void setTtlSeconds(long ttlSeconds) { this.ttlSeconds = ttlSeconds; }
        public long getMaintenanceIntervalMillis() { return maintenanceIntervalMillis; }
        public void setMaintenanceIntervalMillis(long maintenanceIntervalMillis) { this.maintenanceIntervalMillis = maintenanceIntervalMillis; }
        public long getBootTimeoutSeconds() { return bootTimeoutSeconds; }
        public void setBootTimeoutSeconds(long bootTimeoutSeconds) { this.bootTimeoutSeconds = bootTimeoutSeconds; }
        public long getResetTimeoutSeconds() { return resetTimeoutSeconds; }
        public void setResetTimeoutSeconds(long resetTimeoutSeconds) { this.resetTimeoutSeconds = resetTimeoutSeconds; }
        public long getDestroyTimeoutSeconds() { return destroyTimeoutSeconds; }
        public void setDestroyTimeoutSeconds(long destroyTimeoutSeconds) { this.destroyTimeoutSeconds = destroyTimeoutSeconds; }
        public long getStatePollCeilingMillis() { return statePollCeilingMillis; }
        public void setStatePollCeilingMillis(long statePollCeilingMillis) { this.statePollCeilingMillis = statePollCeilingMillis; }
        public boolean isOnDemandCreation() { return onDemandCreation; }
        public void setOnDemandCreation(boolean onDemandCreation) { this.onDemandCreation = onDemandCreation; }
        public String getNamePrefix() { return namePrefix; }
        public void setNamePrefix(String namePrefix) { this.namePrefix = namePrefix; }
    }

    public static class Machine {
        private int vcpu = 2;
        private int memoryMib = 2048;
        private int diskGib = 20;
        private NetworkMode networkMode = NetworkMode.NAT_FILTERED;

        public int getVcpu() { return vcpu; }
        public void setVcpu(int vcpu) { this.vcpu = vcpu; }
        public int getMemoryMib() { return memoryMib; }
        public void setMemoryMib(int memoryMib) { this.memoryMib = memoryMib; }
        public int getDiskGib() { return diskGib; }
        public void setDiskGib(int diskGib) { this.diskGib = diskGib; }
        public NetworkMode getNetworkMode() { return networkMode; }
        public void setNetworkMode(NetworkMode networkMode) { this.networkMode = networkMode; }
    }
}
