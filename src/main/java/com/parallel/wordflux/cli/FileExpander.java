package com.parallel.wordflux.cli;

import com.parallel.wordflux.LogFormat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Resolves command line arguments into the list of files to count.
 * Regular files are taken as they are, directories contribute their {@code .txt} children
 * and missing paths are reported and skipped.
 */
public final class FileExpander {

    private FileExpander() {
    }

    public static List<Path> expand(List<String> patterns, Consumer<String> warnings) throws IOException {
        Set<Path> files = new LinkedHashSet<>();
        for (String pattern : patterns) {
            Path path = Paths.get(pattern);
            if (Files.isRegularFile(path)) {
                files.add(path.toAbsolutePath().normalize());
            } else if (Files.isDirectory(path)) {
                try (Stream<Path> children = Files.list(path)) {
                    children.filter(Files::isRegularFile)
                            .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".txt"))
                            .map(p -> p.toAbsolutePath().normalize())
                            .sorted()
                            .forEach(files::add);
                }
            } else {
                warnings.accept(LogFormat.stamp("Warning: '" + pattern + "' not found"));
            }
        }
        return new ArrayList<>(files);
    }
}
