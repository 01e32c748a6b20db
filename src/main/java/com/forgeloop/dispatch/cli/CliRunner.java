package com.forgeloop.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

import java.util.Arrays;

/**
 * Runs the {@code forgeloop} command line once the context is up and hands picocli's exit
 * status to {@code SpringApplication.exit}. Subcommands are created through the Spring-aware
 * factory so they receive the project controller and health service.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final ForgeloopCommand forgeloopCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(ForgeloopCommand forgeloopCommand, IFactory factory) {
        this.forgeloopCommand = forgeloopCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        // serve: the web server owns the process, nothing to execute here
        if (Arrays.asList(args).contains("serve")) {
            return;
        }
        exitCode = new CommandLine(forgeloopCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
