package com.forgeloop.dispatch.cli;

import com.forgeloop.core.build.BuildOutcome;
import com.forgeloop.core.events.EventBus;
import com.forgeloop.core.project.ProjectPhaseController;
import com.forgeloop.core.project.ProjectSnapshot;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: forgeloop idea "&lt;prompt&gt;"
 * <p>
 * Runs ideation, planning and the full build end to end. Without {@code --feature}
 * options every suggested feature is kept.
 */
@Command(name = "idea", mixinStandardHelpOptions = true,
        description = "Turn an idea into a planned and built project")
@Component
public class IdeaCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Project idea")
    private String prompt;

    @Option(names = {"--feature", "-f"}, description = "Feature to include (repeatable)")
    private List<String> features;

    @Option(names = {"--plan-only"}, description = "Stop after planning")
    private boolean planOnly;

    private final ProjectPhaseController project;
    private final EventBus eventBus;

    public IdeaCommand(ProjectPhaseController project, EventBus eventBus) {
        this.project = project;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        EventBus.Subscription subscription = eventBus.subscribeLocal(ConsoleOutput::event);
        try {
            ConsoleOutput.info("Analysing idea...");
            ProjectSnapshot snapshot = project.submitIdea(prompt);
            if (snapshot.ideation() == null) {
                ConsoleOutput.error("Ideation failed: " + snapshot.error());
                return 1;
            }

            List<String> chosen = features != null && !features.isEmpty()
                    ? features
                    : snapshot.ideation().featureSuggestions();
            ConsoleOutput.info("Planning with features: " + String.join(", ", chosen));
            snapshot = project.finalizeIdea(chosen);
            if (snapshot.plan() == null) {
                ConsoleOutput.error("Planning failed: " + snapshot.error());
                return 1;
            }
            ConsoleOutput.success("Plan ready: " + snapshot.plan().projectName());
            if (planOnly) {
                return 0;
            }

            BuildOutcome outcome = project.buildProject();
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
