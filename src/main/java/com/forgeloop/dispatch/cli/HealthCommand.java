package com.forgeloop.dispatch.cli;

import com.forgeloop.core.health.HealthCheckService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: forgeloop health
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check system health")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        boolean anyDown = false;
        for (var check : healthCheckService.checkAll()) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DEGRADED -> ConsoleOutput.info(label);
                case DOWN -> {
                    ConsoleOutput.error(label);
                    anyDown = true;
                }
            }
        }

        System.out.println("──────────────────────────────────");
        if (anyDown) {
            ConsoleOutput.error("Overall: one or more components down");
            return 1;
        }
        ConsoleOutput.success("Overall: operational");
        return 0;
    }
}
