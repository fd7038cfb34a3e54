package com.parallel.wordflux.cli;

import com.parallel.wordflux.AggregateResult;
import com.parallel.wordflux.BatchScheduler;
import com.parallel.wordflux.FileCountResult;
import com.parallel.wordflux.FrequencyMaps;
import com.parallel.wordflux.LogFormat;
import com.parallel.wordflux.ScheduleMode;
import com.parallel.wordflux.SchedulerConfig;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line entry point: counts words in the given files, one after the other or in parallel.
 */
public class WordFluxCli {

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FILE_ERRORS = 2;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Config config;
        try {
            config = Config.fromArgs(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            printUsage(out);
            return EXIT_USAGE;
        }
        if (config.help() || config.inputs().isEmpty()) {
            printUsage(out);
            return config.help() ? EXIT_OK : EXIT_USAGE;
        }

        try {
            List<Path> files = FileExpander.expand(config.inputs(), err::println);
            if (files.isEmpty()) {
                err.println("Error: no files found to process.");
                return EXIT_USAGE;
            }

            SchedulerConfig schedulerConfig = config.toSchedulerConfig();
            BatchScheduler scheduler = new BatchScheduler(schedulerConfig, out::println);
            AggregateResult result = scheduler.run(files);

            if (!config.parallel() || result.totalFiles() == 1) {
                for (FileCountResult fileResult : result.successful()) {
                    out.print(ConsoleReport.formatFile(fileResult, FrequencyMaps.DEFAULT_TOP_N));
                }
            }
            out.print(ConsoleReport.formatSummary(result, config.topN()));

            if (config.csvOutput() != null) {
                CsvExporter.writeTopWords(config.csvOutput(), result.topWords(config.topN()));
                out.println(LogFormat.stamp("CSV written to: " + config.csvOutput().toAbsolutePath()));
            }
            if (config.filesCsvOutput() != null) {
                CsvExporter.writeFileSummary(config.filesCsvOutput(), result);
                out.println(LogFormat.stamp("File summary written to: " + config.filesCsvOutput().toAbsolutePath()));
            }
            if (config.chartOutput() != null) {
                ChartGenerator.exportTopWordsChart(result.topWords(config.topN()), config.chartOutput());
                out.println(LogFormat.stamp("Chart written to: " + config.chartOutput().toAbsolutePath()));
            }
            return result.hasFailures() ? EXIT_FILE_ERRORS : EXIT_OK;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Fatal error: interrupted");
            return EXIT_USAGE;
        } catch (Exception e) {
            err.println("Fatal error: " + e.getMessage());
            return EXIT_USAGE;
        }
    }

    private static void printUsage(PrintStream out) {
        out.println("""
                WordFlux - word frequencies for large text files

                Usage:
                  java -jar target/wordflux-1.0.0-jar-with-dependencies.jar [options] <file|dir>...

                Options:
                  --help, -h           Show this message
                  --parallel, -p       Count files concurrently (default: one file at a time)
                  --workers=<n>        Maximum concurrent workers (default: available processors)
                  --rolling            Refill worker slots as soon as they free up instead of fixed batches
                  --timeout=<seconds>  Give up on a file whose worker runs longer than this
                  --top=<n>            Number of words in the ranking (default: 10)
                  --csv=<file>         Write the combined ranking as CSV
                  --files-csv=<file>   Write a per-file summary as CSV
                  --chart=<file>       Write the combined ranking as a PNG bar chart
                  --quiet, -q          Only print results and errors

                Directories contribute the .txt files they contain. Text is read as UTF-8,
                lowercased and stripped of punctuation before counting.
                """);
    }

    record Config(
            List<String> inputs,
            boolean parallel,
            Integer workers,
            boolean rolling,
            Duration timeout,
            int topN,
            Path csvOutput,
            Path filesCsvOutput,
            Path chartOutput,
            boolean quiet,
            boolean help) {

        static Config fromArgs(String[] args) {
            List<String> inputs = new ArrayList<>();
            boolean parallel = false;
            Integer workers = null;
            boolean rolling = false;
            Duration timeout = null;
            int topN = FrequencyMaps.DEFAULT_TOP_N;
            Path csv = null;
            Path filesCsv = null;
            Path chart = null;
            boolean quiet = false;
            boolean help = false;

            for (String arg : args) {
                if (!arg.startsWith("-")) {
                    inputs.add(arg);
                    continue;
                }
                String name = arg;
                String value = null;
                int eq = arg.indexOf('=');
                if (eq > 0) {
                    name = arg.substring(0, eq);
                    value = arg.substring(eq + 1);
                }
                switch (name) {
                    case "--help", "-h" -> help = true;
                    case "--parallel", "-p" -> parallel = true;
                    case "--quiet", "-q" -> quiet = true;
                    case "--rolling" -> rolling = true;
                    case "--workers" -> workers = parseInt(name, value);
                    case "--timeout" -> timeout = Duration.ofSeconds(parseInt(name, value));
                    case "--top" -> topN = parseInt(name, value);
                    case "--csv" -> csv = Paths.get(required(name, value));
                    case "--files-csv" -> filesCsv = Paths.get(required(name, value));
                    case "--chart" -> chart = Paths.get(required(name, value));
                    default -> throw new IllegalArgumentException("Unknown option: " + arg);
                }
            }
            if (topN < 0) {
                throw new IllegalArgumentException("--top must not be negative");
            }
            return new Config(List.copyOf(inputs), parallel, workers, rolling, timeout, topN,
                    csv, filesCsv, chart, quiet, help);
        }

        SchedulerConfig toSchedulerConfig() {
            return SchedulerConfig.defaults()
                    .withMaxWorkers(parallel ? workers : Integer.valueOf(1))
                    .withVerbose(!quiet)
                    .withWorkerTimeout(timeout)
                    .withMode(rolling ? ScheduleMode.ROLLING : ScheduleMode.BATCHED);
        }

        private static String required(String name, String value) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException("Expected a value: " + name + "=<value>");
            }
            return value;
        }

        private static int parseInt(String name, String value) {
            try {
                return Integer.parseInt(required(name, value).trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Not a number for " + name + ": " + value, e);
            }
        }
    }
}
