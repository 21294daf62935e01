package com.studentcrud.shell;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Operator-facing console: timestamped notices out, raw lines in.
 */
public class ShellConsole {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final BufferedReader in;
    private final PrintStream out;
    private final Clock clock;

    public ShellConsole(BufferedReader in, PrintStream out, Clock clock) {
        this.in = in;
        this.out = out;
        this.clock = clock;
    }

    /**
     * Console on the process's standard input and output, stamped with the local time.
     */
    public static ShellConsole system() {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, Charset.defaultCharset()));
        return new ShellConsole(in, System.out, Clock.systemDefaultZone());
    }

    /**
     * One-line description of a failure: its message, or its class name when it has none.
     */
    public static String describe(Throwable failure) {
        String message = failure.getMessage();
        return (message == null || message.isBlank()) ? failure.getClass().getSimpleName() : message;
    }

    /**
     * Print a line prefixed with {@code [yyyy-MM-dd HH:mm:ss]}.
     */
    public void log(String message) {
        out.println("[" + LocalDateTime.now(clock).format(TIMESTAMP) + "] " + message);
    }

    /**
     * Print the label without a line break and read the operator's answer.
     *
     * @return the line with surrounding whitespace removed, or null once input is exhausted
     */
    public String prompt(String label) {
        out.print(label);
        out.flush();
        try {
            String line = in.readLine();
            return line == null ? null : line.trim();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read from console", e);
        }
    }
}
