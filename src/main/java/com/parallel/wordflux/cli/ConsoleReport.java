package com.parallel.wordflux.cli;

import com.parallel.wordflux.AggregateResult;
import com.parallel.wordflux.FileCountResult;
import com.parallel.wordflux.FileFailure;
import com.parallel.wordflux.FrequencyMaps;
import com.parallel.wordflux.LogFormat;
import com.parallel.wordflux.WordCount;

import java.util.List;
import java.util.Locale;

/**
 * Plain text rendering of results for the terminal.
 */
public final class ConsoleReport {

    private static final int BAR_WIDTH = 20;

    private ConsoleReport() {
    }

    public static String formatFile(FileCountResult result, int topN) {
        StringBuilder out = new StringBuilder("\n");
        out.append(LogFormat.rule('=')).append('\n');
        out.append("File: ").append(result.path().getFileName()).append('\n');
        out.append(LogFormat.rule('-')).append('\n');
        out.append("   Lines processed: ").append(LogFormat.number(result.linesProcessed())).append('\n');
        out.append("   Total words:     ").append(LogFormat.number(result.totalWords())).append('\n');
        out.append("   Unique words:    ").append(LogFormat.number(result.uniqueWords())).append('\n');
        out.append(LogFormat.rule('-')).append('\n');
        out.append("Top ").append(topN).append(" words:\n");
        out.append(LogFormat.rule('-')).append('\n');
        appendRanking(out, FrequencyMaps.topWords(result.frequencies(), topN), 10);
        out.append(LogFormat.rule('=')).append('\n');
        return out.toString();
    }

    public static String formatSummary(AggregateResult result, int topN) {
        StringBuilder out = new StringBuilder("\n");
        out.append(LogFormat.rule('=')).append('\n');
        out.append("Summary\n");
        out.append(LogFormat.rule('-')).append('\n');
        out.append("   Total time:        ").append(LogFormat.seconds(result.durationSeconds())).append("s\n");
        out.append("   Successful files:  ").append(result.successful().size()).append('\n');
        out.append("   Failed files:      ").append(result.failed().size()).append('\n');
        out.append("   Lines processed:   ").append(LogFormat.number(result.totalLinesProcessed())).append('\n');
        out.append("   Total words:       ").append(LogFormat.number(result.totalWords())).append('\n');
        out.append("   Unique (combined): ").append(LogFormat.number(result.totalUniqueWords())).append('\n');

        if (result.hasFailures()) {
            out.append("\nFiles with errors:\n");
            for (FileFailure failure : result.failed()) {
                out.append("   - ").append(failure.path()).append(": ").append(failure.message()).append('\n');
            }
        }
        if (!result.combinedFrequencies().isEmpty() && topN > 0) {
            out.append("\nTop ").append(topN).append(" words (combined):\n");
            out.append(LogFormat.rule('-')).append('\n');
            appendRanking(out, result.topWords(topN), 12);
        }
        out.append(LogFormat.rule('=')).append('\n');
        return out.toString();
    }

    private static void appendRanking(StringBuilder out, List<WordCount> ranking, int countWidth) {
        if (ranking.isEmpty()) {
            return;
        }
        long max = ranking.get(0).count();
        for (int i = 0; i < ranking.size(); i++) {
            WordCount wc = ranking.get(i);
            int bar = (int) Math.min(BAR_WIDTH, wc.count() * BAR_WIDTH / max);
            out.append(String.format(Locale.ROOT, "   %2d. %-20s %" + countWidth + "s  %s\n",
                    i + 1, wc.word(), LogFormat.number(wc.count()), "#".repeat(bar)));
        }
    }
}
