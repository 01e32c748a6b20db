package com.forgeloop.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.forgeloop.core.build.BuildOutcome;
import com.forgeloop.core.events.EventBus;
import com.forgeloop.core.model.AppPlan;
import com.forgeloop.core.project.ProjectPhaseController;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * CLI command: forgeloop build &lt;plan.json&gt;
 * <p>
 * Loads a plan from a JSON file and runs a full build in-process, printing lifecycle
 * events as they are dispatched.
 */
@Command(name = "build", mixinStandardHelpOptions = true,
        description = "Build every file of a plan, testing and self-healing as it goes")
@Component
public class BuildCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Plan JSON file")
    private Path planFile;

    @Option(names = {"--max-debug-attempts"},
            description = "Debug attempts per file before the build halts (default: configured value)")
    private Integer maxDebugAttempts;

    @Option(names = {"--quiet", "-q"}, description = "Only print the final outcome")
    private boolean quiet;

    private final ProjectPhaseController project;
    private final EventBus eventBus;
    private final ObjectMapper objectMapper;

    public BuildCommand(ProjectPhaseController project, EventBus eventBus, ObjectMapper objectMapper) {
        this.project = project;
        this.eventBus = eventBus;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        AppPlan plan;
        try {
            plan = objectMapper.readValue(Files.readString(planFile), AppPlan.class);
        } catch (IOException e) {
            ConsoleOutput.error("Could not read plan " + planFile + ": " + e.getMessage());
            return 2;
        }

        EventBus.Subscription subscription = quiet ? () -> { } : eventBus.subscribeLocal(ConsoleOutput::event);
        try {
            project.loadPlan(plan);
            ConsoleOutput.info("Building " + plan.projectName() + " (" + project.artifacts().size() + " artifacts)");
            BuildOutcome outcome = project.buildProject(maxDebugAttempts);
            eventBus.awaitIdle(Duration.ofSeconds(5));
            ConsoleOutput.outcome(outcome);
            return outcome.isSuccess() ? 0 : 1;
        } catch (IllegalArgumentException | IllegalStateException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        } finally {
            subscription.unsubscribe();
        }
    }
}
