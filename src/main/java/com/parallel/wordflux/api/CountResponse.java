package com.parallel.wordflux.api;

import com.parallel.wordflux.WordCount;

import java.util.List;

/**
 * JSON body of a successful count request.
 */
public record CountResponse(boolean success, Summary summary, Results results, List<WordCount> topWords) {

    public record Summary(
            int totalFiles,
            int successful,
            int failed,
            String totalDuration,
            long totalWords,
            int uniqueWords,
            long linesProcessed) {
    }

    public record Results(List<FileEntry> successful, List<FailedEntry> failed) {
    }

    public record FileEntry(String file, long words, int unique, String duration) {
    }

    public record FailedEntry(String file, String error) {
    }
}
