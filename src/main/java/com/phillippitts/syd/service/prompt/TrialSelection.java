package com.phillippitts.syd.service.prompt;

import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Answer to the trial prompt: either one of the numbered trials or a numax typed in by hand.
 */
public record TrialSelection(OptionalInt trial, OptionalDouble customNumax) {

    public static TrialSelection trial(int trial) {
        return new TrialSelection(OptionalInt.of(trial), OptionalDouble.empty());
    }

    public static TrialSelection custom(double numax) {
        return new TrialSelection(OptionalInt.empty(), OptionalDouble.of(numax));
    }

    public boolean isCustom() {
        return customNumax.isPresent();
    }
}
