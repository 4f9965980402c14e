package com.stockledger.shell;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Line-oriented console used by the menu. Wraps an input and output stream so
 * the shell can be driven by a script in tests.
 */
public class ShellConsole {

    private final BufferedReader in;
    private final PrintStream out;
    private final boolean interactive;

    public ShellConsole(InputStream in, PrintStream out, boolean interactive) {
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
        this.interactive = interactive;
    }

    public static ShellConsole overSystemStreams() {
        return new ShellConsole(System.in, System.out, System.console() != null);
    }

    /**
     * Prints {@code label} and reads one line.
     *
     * @return the line without its terminator, or {@code null} once input is exhausted
     */
    public String prompt(String label) {
        out.print(label);
        out.flush();
        try {
            return in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read console input", e);
        }
    }

    public void println(String line) {
        out.println(line);
    }

    public void println() {
        out.println();
    }

    public void clear() {
        if (interactive) {
            out.print("\033[H\033[2J");
            out.flush();
        }
    }
}
