package com.agentvm.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for AgentVM.
 * Routes to subcommands: status, health.
 */
@Command(
        name = "agentvm",
        mixinStandardHelpOptions = true,
        version = "AgentVM 0.1.0",
        description = "Pre-warmed VM pool for sandboxed agent execution",
        subcommands = {
                StatusCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AgentVmCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
