package com.parallel.wordflux;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns a raw line of text into normalized word tokens.
 */
public final class Normalizer {

    /**
     * Anything that is not a letter (accented letters included), a digit, an underscore or whitespace.
     */
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{M}\\p{Nd}_\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private Normalizer() {
    }

    public static List<String> normalizeLine(String line) {
        if (line == null || line.isEmpty()) {
            return List.of();
        }
        String cleaned = NON_WORD.matcher(line.toLowerCase(Locale.ROOT)).replaceAll(" ");
        List<String> tokens = new ArrayList<>();
        for (String token : WHITESPACE.split(cleaned)) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
