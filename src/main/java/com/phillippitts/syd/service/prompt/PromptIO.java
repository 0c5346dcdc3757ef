package com.phillippitts.syd.service.prompt;

/**
 * Line-oriented terminal access for interactive prompts.
 */
public interface PromptIO {

    /**
     * Shows {@code prompt} and reads one line.
     *
     * @return the line without its terminator, or null at end of input
     */
    String readLine(String prompt);

    void println(String message);
}
