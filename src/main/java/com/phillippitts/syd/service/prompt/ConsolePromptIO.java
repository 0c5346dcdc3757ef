package com.phillippitts.syd.service.prompt;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * {@link PromptIO} over standard input and output.
 */
public class ConsolePromptIO implements PromptIO {

    private final BufferedReader in;
    private final PrintStream out;

    public ConsolePromptIO() {
        this(System.in, System.out);
    }

    public ConsolePromptIO(InputStream in, PrintStream out) {
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
    }

    @Override
    public String readLine(String prompt) {
        out.print(prompt);
        out.flush();
        try {
            return in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read from console", e);
        }
    }

    @Override
    public void println(String message) {
        out.println(message);
    }
}
