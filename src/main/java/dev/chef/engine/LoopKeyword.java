package dev.chef.engine;

import java.util.Locale;

/**
 * Derives the word that closes a loop from the verb that opens it:
 * "Sift the flour." is closed by "... until sifted.".
 */
public final class LoopKeyword {

    private LoopKeyword() {}

    /** Past form of {@code verb}: append "d" after a final "e", otherwise "ed". */
    public static String closingFormOf(String verb) {
        String lower = verb.toLowerCase(Locale.ROOT);
        return lower.endsWith("e") ? lower + "d" : lower + "ed";
    }
}
