package com.chaineditor;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Application log: console plus an append-only log file.
 *
 * {@link #get()} never returns null. Before {@link #initialize(Path, boolean)} runs it hands
 * out a console-only instance, which is what tests and embedded sessions use.
 */
public final class AppLogger {

    public enum Level {
        DEBUG, INFO, WARN, ERROR
    }

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final AppLogger CONSOLE_ONLY = new AppLogger(null, Level.INFO);

    private static volatile AppLogger instance;

    private final PrintStream logFile;
    private final Level threshold;

    private AppLogger(PrintStream logFile, Level threshold) {
        this.logFile = logFile;
        this.threshold = threshold;
    }

    /**
     * Open the log file. With {@code verbose} set, DEBUG lines are written as well.
     */
    public static synchronized void initialize(Path logPath, boolean verbose) throws IOException {
        if (instance != null) {
            return;
        }
        PrintStream out = new PrintStream(new FileOutputStream(logPath.toFile(), true), true, StandardCharsets.UTF_8);
        out.println();
        out.println("---- chain editor session " + LocalDateTime.now().format(TIME_FORMAT) + " ----");
        instance = new AppLogger(out, verbose ? Level.DEBUG : Level.INFO);
    }

    public static AppLogger get() {
        AppLogger current = instance;
        return current != null ? current : CONSOLE_ONLY;
    }

    public boolean isEnabled(Level level) {
        return level.compareTo(threshold) >= 0;
    }

    public void debug(String message) {
        log(Level.DEBUG, message, null);
    }

    public void info(String message) {
        log(Level.INFO, message, null);
    }

    public void warn(String message) {
        log(Level.WARN, message, null);
    }

    public void error(String message) {
        log(Level.ERROR, message, null);
    }

    public void error(String message, Throwable t) {
        log(Level.ERROR, message, t);
    }

    /**
     * Unformatted line for banners. Goes to stdout and the log file.
     */
    public synchronized void console(String message) {
        System.out.println(message);
        if (logFile != null) {
            logFile.println(message);
        }
    }

    public synchronized void close() {
        if (logFile != null) {
            logFile.close();
        }
    }

    private synchronized void log(Level level, String message, Throwable t) {
        if (!isEnabled(level)) {
            return;
        }
        String line = "[" + LocalDateTime.now().format(TIME_FORMAT) + "] [" + level + "] " + message;
        PrintStream console = level == Level.ERROR ? System.err : System.out;
        console.println(line);
        if (t != null) {
            t.printStackTrace(console);
        }
        if (logFile != null) {
            logFile.println(line);
            if (t != null) {
                t.printStackTrace(logFile);
            }
        }
    }
}
