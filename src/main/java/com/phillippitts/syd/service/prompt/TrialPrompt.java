package com.phillippitts.syd.service.prompt;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.Optional;

/**
 * Asks which numax search trial to keep.
 *
 * <p>An integer in {@code [1, nTrials]} selects that trial. {@code 0} switches to asking for a
 * numax value directly, after which any number is accepted. Invalid answers print an error and
 * ask again. Blocking and single-threaded: only for attended serial runs, never from a worker.
 */
public class TrialPrompt {

    private static final Logger LOG = LogManager.getLogger(TrialPrompt.class);

    public static final int DEFAULT_MAX_ATTEMPTS = 100;
    static final String CUSTOM_QUESTION = "What is your value for numax? ";

    private final PromptIO io;

    public TrialPrompt(PromptIO io) {
        this.io = Objects.requireNonNull(io, "io");
    }

    public Optional<TrialSelection> askInt(String question, int nTrials) {
        return askInt(question, nTrials, DEFAULT_MAX_ATTEMPTS);
    }

    /**
     * @return the selection, or empty once {@code maxAttempts - 1} lines were read without a valid
     *         answer or input ended
     */
    public Optional<TrialSelection> askInt(String question, int nTrials, int maxAttempts) {
        boolean custom = false;
        String current = question;
        for (int attempt = 1; attempt < maxAttempts; attempt++) {
            String answer = io.readLine(current);
            if (answer == null) {
                LOG.debug("Input ended before a trial was selected");
                return Optional.empty();
            }
            String text = answer.trim();
            if (custom) {
                try {
                    return Optional.of(TrialSelection.custom(Double.parseDouble(text)));
                } catch (NumberFormatException e) {
                    io.println("ERROR: please try again");
                }
                continue;
            }
            double value;
            try {
                value = Double.parseDouble(text);
            } catch (NumberFormatException e) {
                io.println("ERROR: not a valid response");
                continue;
            }
            if (value != Math.rint(value) || Double.isInfinite(value)) {
                io.println("ERROR: the selection must match one of the integer values");
                continue;
            }
            int selection = (int) value;
            if (selection == 0) {
                custom = true;
                current = CUSTOM_QUESTION;
            } else if (selection >= 1 && selection <= nTrials) {
                return Optional.of(TrialSelection.trial(selection));
            } else {
                io.println("ERROR: please select an integer between 1 and " + nTrials
                        + " (or 0 to provide your own value for numax)");
            }
        }
        LOG.warn("No valid trial selected after {} attempts", maxAttempts - 1);
        return Optional.empty();
    }
}
