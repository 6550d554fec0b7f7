package com.syntex.natiq.cli;

import com.syntex.natiq.converter.ConversionReport;
import com.syntex.natiq.error.ConversionException;

/**
 * User facing progress lines shared by the commands.
 */
public final class Console {

    private Console() {
    }

    public static void progress(String message) {
        System.out.println("⏳ " + message);
    }

    public static void success(String message) {
        System.out.println(Color.GREEN.wrap("✅ " + message));
    }

    public static void warn(String message) {
        System.err.println(Color.YELLOW.wrap("⚠ " + message));
    }

    public static void failure(String message) {
        System.err.println(Color.RED.wrap("❌ " + message));
    }

    /** Prints file, stage and condition of a failed conversion. */
    public static void failure(ConversionException e) {
        failure(e.getMessage());
    }

    /** One line per outcome, then the summary. Returns the command exit code. */
    public static int report(ConversionReport report) {
        for (ConversionReport.Outcome outcome : report.getOutcomes()) {
            if (outcome.ok()) {
                success(outcome.name() + " -> " + outcome.output());
            } else {
                failure(outcome.error());
            }
        }
        if (report.hasFailures()) {
            warn(report.summary());
            return 1;
        }
        success(report.summary());
        return 0;
    }
}
