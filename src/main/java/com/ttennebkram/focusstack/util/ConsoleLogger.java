package com.ttennebkram.focusstack.util;

import java.io.PrintStream;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;

/**
 * Console logger writing timestamped lines.
 * Verbose and info messages go to the output stream, errors to the error stream.
 */
public class ConsoleLogger implements PipelineLogger {

    private static final DateTimeFormatter LOG_TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss.SSS");

    private final PrintStream out;
    private final PrintStream err;
    private volatile boolean verboseEnabled;

    public ConsoleLogger(boolean verboseEnabled) {
        this(System.out, System.err, verboseEnabled);
    }

    public ConsoleLogger(PrintStream out, PrintStream err, boolean verboseEnabled) {
        this.out = out;
        this.err = err;
        this.verboseEnabled = verboseEnabled;
    }

    public void setVerboseEnabled(boolean verboseEnabled) {
        this.verboseEnabled = verboseEnabled;
    }

    public boolean isVerboseEnabled() {
        return verboseEnabled;
    }

    @Override
    public void verbose(String format, Object... args) {
        if (verboseEnabled) {
            print(out, "VERBOSE", format, args);
        }
    }

    @Override
    public void info(String format, Object... args) {
        print(out, "INFO", format, args);
    }

    @Override
    public void error(String format, Object... args) {
        print(err, "ERROR", format, args);
    }

    private void print(PrintStream stream, String level, String format, Object... args) {
        String message = args.length == 0 ? format : String.format(format, args);
        // Messages carry their own trailing newline in some call sites
        if (message.endsWith("\n")) {
            message = message.substring(0, message.length() - 1);
        }
        String line = "[" + timestamp() + "] [" + level + "] " + message;
        synchronized (stream) {
            stream.println(line);
        }
    }

    private static String timestamp() {
        return LocalTime.now().format(LOG_TIME_FORMAT);
    }
}
