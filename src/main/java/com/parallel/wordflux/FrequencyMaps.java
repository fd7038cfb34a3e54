package com.parallel.wordflux;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Merge and ranking helpers for token frequency maps.
 */
public final class FrequencyMaps {

    public static final int DEFAULT_TOP_N = 10;

    /**
     * Count descending, then token ascending so that equal counts always come out in the same order.
     */
    public static final Comparator<WordCount> RANKING = Comparator
            .comparingLong(WordCount::count).reversed()
            .thenComparing(WordCount::word);

    private FrequencyMaps() {
    }

    /**
     * Returns a new map holding the pairwise sum of both inputs. Neither input is modified.
     */
    public static Map<String, Long> merge(Map<String, Long> left, Map<String, Long> right) {
        Map<String, Long> merged = new HashMap<>(left);
        mergeInto(merged, right);
        return merged;
    }

    /**
     * Adds every count of {@code source} to {@code target}, treating absent tokens as zero.
     */
    public static void mergeInto(Map<String, Long> target, Map<String, Long> source) {
        for (Map.Entry<String, Long> entry : source.entrySet()) {
            target.merge(entry.getKey(), entry.getValue(), Long::sum);
        }
    }

    public static long total(Map<String, Long> frequencies) {
        long sum = 0;
        for (long count : frequencies.values()) {
            sum += count;
        }
        return sum;
    }

    public static List<WordCount> topWords(Map<String, Long> frequencies) {
        return topWords(frequencies, DEFAULT_TOP_N);
    }

    public static List<WordCount> topWords(Map<String, Long> frequencies, int n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must not be negative: " + n);
        }
        if (n == 0 || frequencies.isEmpty()) {
            return List.of();
        }
        List<WordCount> entries = new ArrayList<>(frequencies.size());
        frequencies.forEach((word, count) -> entries.add(new WordCount(word, count)));
        entries.sort(RANKING);
        return List.copyOf(entries.subList(0, Math.min(n, entries.size())));
    }
}
