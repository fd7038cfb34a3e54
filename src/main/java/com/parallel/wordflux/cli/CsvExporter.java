package com.parallel.wordflux.cli;

import com.parallel.wordflux.AggregateResult;
import com.parallel.wordflux.FileCountResult;
import com.parallel.wordflux.FileFailure;
import com.parallel.wordflux.WordCount;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class CsvExporter {

    private CsvExporter() {
    }

    public static void writeTopWords(Path path, List<WordCount> ranking) throws IOException {
        createParent(path);
        List<String> lines = new ArrayList<>();
        lines.add("rank,word,count");
        for (int i = 0; i < ranking.size(); i++) {
            WordCount wc = ranking.get(i);
            lines.add(String.join(",", String.valueOf(i + 1), wc.word(), String.valueOf(wc.count())));
        }
        Files.write(path, lines);
    }

    public static void writeFileSummary(Path path, AggregateResult result) throws IOException {
        createParent(path);
        List<String> lines = new ArrayList<>();
        lines.add("file,status,lines,words,unique,duration_s,error");
        for (FileCountResult r : result.successful()) {
            lines.add(String.join(",",
                    sanitize(r.path().toString()),
                    "ok",
                    String.valueOf(r.linesProcessed()),
                    String.valueOf(r.totalWords()),
                    String.valueOf(r.uniqueWords()),
                    String.format(Locale.ROOT, "%.3f", r.durationSeconds()),
                    ""));
        }
        for (FileFailure f : result.failed()) {
            lines.add(String.join(",",
                    sanitize(f.path().toString()),
                    f.kind().name(),
                    "", "", "", "",
                    sanitize(f.message())));
        }
        Files.write(path, lines);
    }

    private static void createParent(Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
    }

    private static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        return value.replace(",", " ");
    }
}
