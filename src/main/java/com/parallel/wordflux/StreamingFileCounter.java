package com.parallel.wordflux;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Counts words line by line so that only the current line is held in memory, whatever the file size.
 * Invalid UTF-8 sequences are decoded as replacement characters, which the normalizer drops.
 */
public class StreamingFileCounter implements FileCounter {

    @Override
    public FileCountResult count(Path path, ScanOptions options) throws FileCountException {
        Objects.requireNonNull(path, "path");
        ScanOptions opts = options != null ? options : ScanOptions.defaults();

        if (!Files.exists(path)) {
            throw new FileCountException(ErrorKind.NOT_FOUND, path, "File does not exist: " + path);
        }
        if (Files.isDirectory(path)) {
            throw new FileCountException(ErrorKind.IS_DIRECTORY, path, "Path is a directory, not a file: " + path);
        }

        long start = System.nanoTime();
        Map<String, Long> frequencies = new HashMap<>();
        long totalWords = 0;
        long linesProcessed = 0;

        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(path), StandardCharsets.UTF_8), 64 * 1024)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new FileCountException(ErrorKind.IO_ERROR, path, "Scan interrupted: " + path);
                }
                linesProcessed++;

                List<String> tokens = Normalizer.normalizeLine(line);
                for (String token : tokens) {
                    frequencies.merge(token, 1L, Long::sum);
                }
                totalWords += tokens.size();

                if (opts.listener() != null && linesProcessed % opts.progressInterval() == 0) {
                    opts.listener().onProgress(linesProcessed, frequencies.size(), totalWords);
                }
            }
        } catch (IOException e) {
            throw new FileCountException(ErrorKind.IO_ERROR, path,
                    "Read failed for " + path + ": " + e.getMessage(), e);
        }

        double seconds = (System.nanoTime() - start) / 1_000_000_000.0;
        return new FileCountResult(path, totalWords, frequencies.size(), linesProcessed, frequencies, seconds);
    }
}
