package com.chimera.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Chimera.
 */
@Command(
        name = "chimera",
        mixinStandardHelpOptions = true,
        version = "Chimera 0.1.0",
        description = "Adversary emulation operation engine",
        subcommands = {
                ServeCommand.class,
                StartCommand.class,
                StatusCommand.class,
                AgentsCommand.class,
                CancelCommand.class,
                HistoryCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ChimeraCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
