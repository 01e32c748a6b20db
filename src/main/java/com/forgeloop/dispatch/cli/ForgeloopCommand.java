package com.forgeloop.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Forgeloop.
 * Routes to subcommands: build, idea, health, serve.
 */
@Command(
        name = "forgeloop",
        mixinStandardHelpOptions = true,
        version = "Forgeloop 0.1.0",
        description = "Build-test-debug orchestrator for generated projects",
        subcommands = {
                BuildCommand.class,
                IdeaCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ForgeloopCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
