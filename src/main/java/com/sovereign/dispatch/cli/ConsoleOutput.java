package com.sovereign.dispatch.cli;

import com.sovereign.core.engine.PhaseReport;
import com.sovereign.core.engine.RunSummary;
import com.sovereign.core.events.SovereignEvent;
import com.sovereign.core.gateway.Decision;
import com.sovereign.core.gateway.GatewayProperties;
import com.sovereign.core.logging.SensitiveData;
import com.sovereign.core.planner.PlanReport;
import com.sovereign.core.planner.Subtask;
import com.sovereign.core.planner.SubtaskResult;
import com.sovereign.core.planner.SubtaskStatus;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Sovereign CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SOVEREIGN v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SOVEREIGN]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    /**
     * One line per event, for live progress of a run.
     */
    public static void event(SovereignEvent event) {
        String prefix = switch (event.type()) {
            case "scope.enter", "scope.exit" -> "@|bold,fg(yellow) [SCOPE]|@";
            case "task.start", "task.complete" -> "@|fg(blue) [TASK]|@";
            case "task.cancelled" -> "@|fg(yellow) [CANCELLED]|@";
            case "task.error" -> "@|fg(red),bold [ERROR]|@";
            case "action.validated" -> "@|fg(green) [VALIDATED]|@";
            case "action.warning" -> "@|fg(yellow) [CAUTION]|@";
            case "action.rejected", "agent.rejected" -> "@|fg(red),bold [REJECTED]|@";
            case "deploy.started", "deploy.finished" -> "@|fg(cyan),bold [DEPLOY]|@";
            case "agent.plan", "agent.validated", "agent.execute", "agent.complete", "task.done" -> "@|fg(magenta) [AGENT]|@";
            default -> "@|fg(white) [" + event.type() + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                prefix + " " + event.type() + " @|faint [" + event.spanId() + "]|@ " + event.payload()));
    }

    public static void runSummary(RunSummary summary) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Deployment " + summary.traceId() + "|@"));
        for (PhaseReport phase : summary.phases()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  " + statusLabel(phase.status().name()) + " " + phase.phase()
                            + " (" + formatDuration(phase.durationMs()) + ")"));
        }
        System.out.println("  Events: " + summary.eventCount());
        switch (summary.status()) {
            case COMPLETED -> success("Deployment completed");
            case CANCELLED -> warn("Deployment cancelled: " + summary.cause());
            case FAILED -> error("Deployment failed: " + summary.cause());
        }
    }

    public static void planReport(PlanReport report) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Plan " + report.traceId() + "|@ - " + report.goal()));
        System.out.println("  Decomposed into " + report.subtasks().size() + " subtasks:");
        for (Subtask subtask : report.subtasks()) {
            System.out.println("    - " + subtask.name() + " [" + subtask.mode().displayName()
                    + ", complexity " + subtask.complexity() + "]");
        }
        for (SubtaskResult result : report.results()) {
            String label = result.status() == SubtaskStatus.COMPLETE ? "@|fg(green) DONE|@" : "@|fg(red) REJECTED|@";
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  " + label + " " + result.task() + " - " + result.output()));
        }
        System.out.println("  Events: " + report.eventCount());
        switch (report.status()) {
            case COMPLETED -> success("Goal complete: " + report.goal());
            case CANCELLED -> warn("Plan cancelled: " + report.cause());
            case FAILED -> error("Plan failed: " + report.cause());
        }
    }

    public static void decision(String action, Decision decision) {
        if (decision.isAllowed()) {
            success("ALLOWED: " + SensitiveData.mask(action));
        } else {
            error("REJECTED (" + decision.category() + "): " + decision.reason());
        }
        for (String warning : decision.warnings()) {
            warn(warning);
        }
    }

    public static void invariants(GatewayProperties gateway) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Gateway invariants|@"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Self-preservation: @|fg(green),bold enforced|@ (veto on "
                        + gateway.getSelfPreservationPatterns().size() + " patterns)"));
        gateway.getSelfPreservationPatterns().forEach(pattern -> System.out.println("    - " + pattern));
        System.out.println("  Torsion target: 0.0 (warn on " + gateway.getManipulationPatterns().size() + " markers)");
        gateway.getManipulationPatterns().forEach(pattern -> System.out.println("    - " + pattern));
        System.out.println("  Complexity threshold: " + gateway.getComplexityThreshold()
                + " chars (exempt: " + String.join(", ", gateway.getComplexityExemptions()) + ")");
        success("Gateway active");
    }

    private static String statusLabel(String status) {
        return switch (status) {
            case "COMPLETED" -> "@|fg(green) COMPLETED|@";
            case "CANCELLED" -> "@|fg(yellow) CANCELLED|@";
            default -> "@|fg(red) " + status + "|@";
        };
    }

    private static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
