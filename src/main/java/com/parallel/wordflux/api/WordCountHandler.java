package com.parallel.wordflux.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import com.parallel.wordflux.AggregateResult;
import com.parallel.wordflux.BatchScheduler;
import com.parallel.wordflux.FileCountResult;
import com.parallel.wordflux.FileFailure;
import com.parallel.wordflux.FrequencyMaps;
import com.parallel.wordflux.LogFormat;
import com.parallel.wordflux.SchedulerConfig;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Maps a JSON request body to a list of files, counts them and renders the outcome as JSON.
 *
 * <p>Accepted body: {@code {"files": [...], "texts": [...], "text": "...", "content": "...", "topN": 10}}.
 * Paths in {@code files} are resolved against the base directory and skipped when they point outside it.
 * Every entry of {@code texts} is written to a temporary file that is removed once the response is built.
 * {@code text} and {@code content} are only used when nothing else was supplied.</p>
 */
public class WordCountHandler {

    static final Map<String, String> CORS_HEADERS = corsHeaders();

    private final ObjectMapper mapper = new ObjectMapper();
    private final Path baseDir;
    private final Path tempDir;
    private final SchedulerConfig config;
    private final Consumer<String> logger;

    public WordCountHandler(Path baseDir, Path tempDir, SchedulerConfig config, Consumer<String> logger) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir").toAbsolutePath().normalize();
        this.tempDir = Objects.requireNonNull(tempDir, "tempDir");
        this.config = Objects.requireNonNull(config, "config");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    /**
     * Base directory from {@code LAMBDA_TASK_ROOT} when set, otherwise the working directory.
     */
    public static WordCountHandler fromEnvironment(Consumer<String> logger) {
        String root = System.getenv("LAMBDA_TASK_ROOT");
        Path baseDir = root != null && !root.isBlank() ? Paths.get(root) : Paths.get("").toAbsolutePath();
        Path tempDir = Paths.get(System.getProperty("java.io.tmpdir"));
        return new WordCountHandler(baseDir, tempDir, SchedulerConfig.defaults(), logger);
    }

    public ApiResponse handle(String body) {
        List<Path> createdFiles = new ArrayList<>();
        try {
            JsonNode request = parse(body);
            List<Path> files = collectFiles(request, createdFiles);

            if (files.isEmpty()) {
                return json(400, badRequest());
            }

            logger.accept(LogFormat.stamp("Processing " + files.size() + " files in parallel..."));
            AggregateResult result = new BatchScheduler(config, logger).run(files);
            int topN = Math.max(0, request.path("topN").asInt(FrequencyMaps.DEFAULT_TOP_N));
            return json(200, toResponse(result, files.size(), topN));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return internalError(e);
        } catch (Exception e) {
            return internalError(e);
        } finally {
            for (Path file : createdFiles) {
                try {
                    Files.deleteIfExists(file);
                } catch (IOException e) {
                    logger.accept(LogFormat.stamp("Could not delete temporary file " + file + ": " + e.getMessage()));
                }
            }
        }
    }

    /**
     * CORS preflight answer.
     */
    public ApiResponse options() {
        Map<String, String> headers = new LinkedHashMap<>(CORS_HEADERS);
        headers.remove("Content-Type");
        headers.put("Access-Control-Max-Age", "86400");
        return new ApiResponse(200, headers, "");
    }

    private JsonNode parse(String body) throws JsonProcessingException {
        if (body == null || body.isBlank()) {
            return mapper.createObjectNode();
        }
        JsonNode node = mapper.readTree(body);
        return node != null && node.isObject() ? node : mapper.createObjectNode();
    }

    private List<Path> collectFiles(JsonNode request, List<Path> createdFiles) throws IOException {
        List<Path> files = new ArrayList<>();

        JsonNode paths = request.path("files");
        if (paths.isArray()) {
            for (JsonNode entry : paths) {
                if (!entry.isTextual()) {
                    continue;
                }
                Path resolved = baseDir.resolve(entry.asText()).normalize();
                if (resolved.startsWith(baseDir) && Files.isRegularFile(resolved)) {
                    files.add(resolved);
                } else {
                    logger.accept(LogFormat.stamp("File not found: " + entry.asText()));
                }
            }
        }

        JsonNode texts = request.path("texts");
        if (texts.isArray()) {
            for (JsonNode entry : texts) {
                if (entry.isTextual() && !entry.asText().isEmpty()) {
                    files.add(writeTemp(entry.asText(), createdFiles));
                }
            }
        }

        if (files.isEmpty()) {
            String single = firstText(request, "text", "content");
            if (single != null) {
                files.add(writeTemp(single, createdFiles));
            }
        }
        return files;
    }

    private static String firstText(JsonNode request, String... fields) {
        for (String field : fields) {
            JsonNode node = request.path(field);
            if (node.isTextual() && !node.asText().isEmpty()) {
                return node.asText();
            }
        }
        return null;
    }

    private Path writeTemp(String text, List<Path> createdFiles) throws IOException {
        Path file = Files.createTempFile(tempDir, "text-", ".txt");
        createdFiles.add(file);
        Files.writeString(file, text, StandardCharsets.UTF_8);
        return file;
    }

    private CountResponse toResponse(AggregateResult result, int totalFiles, int topN) {
        List<CountResponse.FileEntry> successful = new ArrayList<>();
        for (FileCountResult r : result.successful()) {
            successful.add(new CountResponse.FileEntry(fileName(r.path()), r.totalWords(), r.uniqueWords(),
                    LogFormat.seconds(r.durationSeconds())));
        }
        List<CountResponse.FailedEntry> failed = new ArrayList<>();
        for (FileFailure f : result.failed()) {
            failed.add(new CountResponse.FailedEntry(fileName(f.path()), f.message()));
        }
        CountResponse.Summary summary = new CountResponse.Summary(
                totalFiles,
                result.successful().size(),
                result.failed().size(),
                LogFormat.seconds(result.durationSeconds()),
                result.totalWords(),
                result.totalUniqueWords(),
                result.totalLinesProcessed());
        return new CountResponse(true, summary, new CountResponse.Results(successful, failed), result.topWords(topN));
    }

    private static String fileName(Path path) {
        return path.getFileName() != null ? path.getFileName().toString() : path.toString();
    }

    private ObjectNode badRequest() {
        ObjectNode body = mapper.createObjectNode();
        body.put("error", "Bad Request");
        body.put("message", "No valid files or text content were provided.");
        ObjectNode example = body.putObject("example");
        example.putArray("files").add("data/file1.txt");
        example.putArray("texts").add("Text 1...").add("Text 2...");
        return body;
    }

    private ApiResponse internalError(Exception e) {
        logger.accept(LogFormat.stamp("Handler error: " + e));
        ObjectNode body = mapper.createObjectNode();
        body.put("error", "Internal Server Error");
        body.put("message", String.valueOf(e.getMessage()));
        try {
            return new ApiResponse(500, CORS_HEADERS, mapper.writeValueAsString(body));
        } catch (JsonProcessingException ex) {
            return new ApiResponse(500, CORS_HEADERS, "{\"error\":\"Internal Server Error\"}");
        }
    }

    private ApiResponse json(int status, Object body) throws JsonProcessingException {
        return new ApiResponse(status, CORS_HEADERS, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(body));
    }

    private static Map<String, String> corsHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Type", "application/json");
        headers.put("Access-Control-Allow-Origin", "*");
        headers.put("Access-Control-Allow-Headers", "Content-Type");
        headers.put("Access-Control-Allow-Methods", "POST, OPTIONS");
        return Collections.unmodifiableMap(headers);
    }
}
