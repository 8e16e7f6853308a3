package com.testament.dispatch.cli;

import com.testament.core.model.Result;
import com.testament.core.model.Status;
import com.testament.core.model.TestMethodResult;
import com.testament.core.model.TestModuleResult;
import com.testament.core.model.TestSuiteResult;
import picocli.CommandLine;

import java.time.Duration;

/**
 * ANSI-colored terminal output utilities for the Testament CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) TESTAMENT v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [TESTAMENT]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void moduleStart(String moduleName) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(blue) [MODULE]|@ " + moduleName));
    }

    public static void fixture(String moduleName, String kind, Result result) {
        if (result.passed()) {
            return;
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + status(result.getStatus()) + " " + kind + " " + moduleName + recordSuffix(result)));
    }

    public static void testResult(TestMethodResult result, boolean tuple) {
        String indent = tuple ? "      " : "  ";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                indent + status(result.getStatus()) + " " + escape(result.getName()) +
                " (" + formatDuration(result.getDuration()) + ")" + recordSuffix(result)));
    }

    public static void moduleResult(TestModuleResult result) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(blue) [MODULE " + result.getStatus() + "]|@ " + result.getName() + " " +
                counts(result.getPassedCount(), result.getFailedCount(), result.getSkippedCount()) +
                " in " + formatDuration(result.getDuration())));
    }

    public static void failedImport(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(red),bold [IMPORT FAILED]|@ " + escape(message)));
    }

    public static void summary(TestSuiteResult result) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Suite " + result.getName() + "|@ " + status(result.getStatus())));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Tests: " + result.getTotalCount() + " run, " +
                counts(result.getPassedCount(), result.getFailedCount(), result.getSkippedCount())));
        System.out.println("  Modules: " + result.getModuleResults().size());
        if (!result.getFailedImports().isEmpty()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(red) Failed imports: " + result.getFailedImports().size() + "|@"));
            result.getFailedImports().forEach(ConsoleOutput::failedImport);
        }
        System.out.println("  Duration: " + formatDuration(result.getDuration()));
    }

    static String status(Status status) {
        if (status == null) {
            return "@|fg(white) RUNNING|@";
        }
        return switch (status) {
            case PASSED -> "@|fg(green) PASS|@";
            case FAILED -> "@|fg(red) FAIL|@";
            case SKIPPED -> "@|fg(yellow) SKIP|@";
        };
    }

    private static String counts(int passed, int failed, int skipped) {
        return "@|fg(green) " + passed + " passed|@" +
                (failed > 0 ? ", @|fg(red) " + failed + " failed|@" : "") +
                (skipped > 0 ? ", @|fg(yellow) " + skipped + " skipped|@" : "");
    }

    private static String recordSuffix(Result result) {
        String record = result.getRecord();
        if (record == null || record.isBlank() || result.passed()) {
            return "";
        }
        String firstLine = record.lines().findFirst().orElse("");
        return " - @|faint " + escape(firstLine) + "|@";
    }

    private static String escape(String text) {
        return text.replace("@|", "@ |");
    }

    static String formatDuration(Duration duration) {
        if (duration == null) return "-";
        long ms = duration.toMillis();
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
