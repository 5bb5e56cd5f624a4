/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.utils;

import java.io.PrintStream;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Supplier;

/**
 * Minimal static logger. Lines go to stderr so that command output on stdout
 * (e.g. JSON summaries) stays machine readable.
 */
public final class LoggerUtil {
    private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");
    private static volatile boolean silent = false;
    private static volatile boolean debugEnabled = false;
    private static volatile PrintStream out = System.err;

    /**
     * Recent lines, oldest first. Kept even when silent so tests can inspect them.
     */
    private static final Deque<String> history = new ArrayDeque<>();
    private static int historyCapacity = 200;

    public static void log(String level, String msg) {
        String line = "[" + TS.format(LocalDateTime.now()) + "][" + level + "] " + msg;
        remember(line);
        if (!silent) {
            out.println(line);
        }
    }

    public static void info(String msg) { log("INFO", msg); }
    public static void warn(String msg) { log("WARN", msg); }
    public static void error(String msg) { log("ERROR", msg); }
    public static void debug(String msg) { if (debugEnabled) log("DEBUG", msg); }
    public static void debug(Supplier<String> msgSupplier) {
        if (debugEnabled) {
            log("DEBUG", msgSupplier.get());
        }
    }
    public static boolean isDebugEnabled() { return debugEnabled; }
    public static void setDebugEnabled(boolean enabled) { debugEnabled = enabled; }

    public static void setSilent(boolean silent) { LoggerUtil.silent = silent; }

    /**
     * Redirect output, e.g. to capture it in tests. {@code null} restores stderr.
     */
    public static void setOutput(PrintStream stream) {
        out = stream == null ? System.err : stream;
    }

    /**
     * Retrieves the last N log lines in chronological order (oldest to newest).
     *
     * @param count maximum number of lines to retrieve; negative counts as zero
     * @return list of log lines (may be fewer than requested if history is shorter)
     */
    public static List<String> getRecentLogs(int count) {
        synchronized (history) {
            List<String> all = new ArrayList<>(history);
            int wanted = Math.max(0, count);
            return all.subList(Math.max(0, all.size() - wanted), all.size());
        }
    }

    /**
     * Configures the capacity of the log history and clears it.
     *
     * @param capacity new capacity (must be at least 1)
     */
    public static void setLogHistoryCapacity(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be at least 1");
        }
        synchronized (history) {
            historyCapacity = capacity;
            history.clear();
        }
    }

    public static void clearLogHistory() {
        synchronized (history) {
            history.clear();
        }
    }

    private static void remember(String line) {
        synchronized (history) {
            if (history.size() >= historyCapacity) {
                history.removeFirst();
            }
            history.addLast(line);
        }
    }

    private LoggerUtil() {}
}
