package com.agentvm.dispatch.cli;

import com.agentvm.pool.VmPool;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: agentvm status
 * <p>
 * Shows the pool's state, occupancy and acquisition statistics.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show VM pool status")
@Component
public class StatusCommand implements Runnable {

    @Option(names = {"--maintain", "-m"}, description = "Run one maintenance cycle (evict and refill) before reporting")
    private boolean maintain;

    private final VmPool vmPool;

    public StatusCommand(@Autowired(required = false) VmPool vmPool) {
        this.vmPool = vmPool;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        if (vmPool == null) {
            ConsoleOutput.error("VM pool not enabled (set agentvm.pool.enabled=true)");
            return;
        }

        if (maintain) {
            ConsoleOutput.info("Running maintenance cycle for pool " + vmPool.getPoolId());
            vmPool.runMaintenance();
        }

        System.out.println();
        ConsoleOutput.poolStats(vmPool.stats());
    }
}
