/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.colorizer.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import io.colorizer.brackets.BracketScanner;
import io.colorizer.brackets.ScanOptions;
import io.colorizer.brackets.ScanResult;
import io.colorizer.common.Resource;
import io.colorizer.config.ColorizerConfig;
import io.colorizer.config.RgbColor;
import io.colorizer.output.AnsiRenderer;
import io.colorizer.output.Console;
import io.colorizer.output.JsonRenderer;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Command-line interface that prints source files with their brackets colored
 * by nesting depth.
 * <p>
 * Usage examples:
 * <pre>
 * # Print a file with colored brackets
 * java -jar colorizer-cli.jar src/main.c
 *
 * # Emit the ranges as JSON, four levels, no angle brackets
 * java -jar colorizer-cli.jar -f json -l 4 --no-angle src/Main.java
 *
 * # Scan many files on four threads
 * java -jar colorizer-cli.jar -T 4 src/*.cpp
 * </pre>
 */
@Command(
        name = "colorize",
        mixinStandardHelpOptions = true,
        version = "colorize 1.0.0",
        description = "Print source files with brackets colored by nesting level"
)
public class Main implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public enum Format {
        ANSI, JSON
    }

    @Parameters(
            description = "Source files to colorize",
            arity = "0..*"
    )
    List<String> files;

    @Option(
            names = {"-c", "--config"},
            description = "Configuration file (default: colorizer.json in the working directory, if present)"
    )
    String configPath;

    @Option(
            names = {"-l", "--levels"},
            description = "Number of color levels"
    )
    Integer levels;

    @Option(
            names = {"-f", "--format"},
            description = "Output format: ${COMPLETION-CANDIDATES} (default: ansi)",
            defaultValue = "ansi"
    )
    Format format = Format.ANSI;

    @Option(
            names = {"--language"},
            description = "Language id for all files, overrides detection from the file extension"
    )
    String language;

    @Option(
            names = {"--heuristic"},
            description = "Angle bracket heuristic: strict or loose"
    )
    String heuristic;

    @Option(names = {"--no-round"}, description = "Do not color ( )")
    boolean noRound;

    @Option(names = {"--no-curly"}, description = "Do not color { }")
    boolean noCurly;

    @Option(names = {"--no-square"}, description = "Do not color [ ]")
    boolean noSquare;

    @Option(names = {"--no-angle"}, description = "Do not color < >")
    boolean noAngle;

    @Option(
            names = {"--raw"},
            description = "Scan raw text, skipping the built-in tokenizer"
    )
    boolean raw;

    @Option(
            names = {"--no-preprocessor"},
            description = "Do not detect inactive #if regions"
    )
    boolean noPreprocessor;

    @Option(
            names = {"-T", "--threads"},
            description = "Number of files scanned in parallel (default: 1)",
            defaultValue = "1"
    )
    int threads = 1;

    @Option(
            names = {"--no-color"},
            description = "Disable colored output"
    )
    boolean noColor;

    @Option(
            names = {"--debug"},
            description = "Enable debug logging"
    )
    boolean debug;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        if (noColor) {
            Console.setColorsEnabled(false);
        }
        if (debug) {
            setDebugLogging();
        }
        if (files == null || files.isEmpty()) {
            Console.println(Console.yellow("No files specified."));
            Console.println("Usage: colorize [options] <files...>");
            Console.println("Run 'colorize --help' for more information.");
            return 0;
        }
        ColorizerConfig config;
        ScanOptions options;
        try {
            config = resolveConfig();
            options = config.toScanOptions();
        } catch (Exception e) {
            Console.println(Console.fail("Error: " + e.getMessage()));
            logger.debug("configuration failed", e);
            return 1;
        }
        List<RgbColor> palette = config.getPalette();
        logger.debug("options: {}, files: {}, threads: {}", options, files.size(), threads);

        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, Math.min(threads, files.size())));
        boolean failed = false;
        try {
            List<Future<String>> futures = new ArrayList<>(files.size());
            for (String file : files) {
                futures.add(executor.submit(() -> render(file, options, palette)));
            }
            // print in argument order, whichever thread finished first
            for (int i = 0; i < futures.size(); i++) {
                String file = files.get(i);
                try {
                    String output = futures.get(i).get();
                    if (format == Format.ANSI && files.size() > 1) {
                        Console.println(Console.label("==> " + file + " <=="));
                    }
                    Console.print(output);
                    if (format == Format.JSON) {
                        Console.println();
                    }
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    Console.println(Console.fail("Error: " + file + ": " + cause.getMessage()));
                    logger.debug("failed: {}", file, cause);
                    failed = true;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            Console.println(Console.fail("Interrupted"));
            return 1;
        } finally {
            executor.shutdownNow();
        }
        return failed ? 1 : 0;
    }

    private String render(String file, ScanOptions options, List<RgbColor> palette) {
        Path path = Path.of(file);
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("not a file");
        }
        Resource resource = Resource.from(path);
        ScanResult result = BracketScanner.scan(resource, language, options, !raw);
        if (logger.isDebugEnabled()) {
            logger.debug("{}: language {}, {} range(s), {} inactive region(s), tokenized: {}",
                    file, result.languageId(), result.ranges().size(), result.inactive().size(), result.tokenized());
        }
        if (format == Format.JSON) {
            return new JsonRenderer(palette).render(file, result);
        }
        return new AnsiRenderer(palette).render(resource.getText(), result);
    }

    /**
     * Config file first, then command-line options on top.
     */
    ColorizerConfig resolveConfig() {
        ColorizerConfig config;
        if (configPath != null) {
            config = ColorizerConfig.load(configPath);
        } else if (Files.isRegularFile(Path.of(ColorizerConfig.DEFAULT_CONFIG_FILE))) {
            config = ColorizerConfig.load(ColorizerConfig.DEFAULT_CONFIG_FILE);
        } else {
            config = new ColorizerConfig();
        }
        if (levels != null) {
            config.setLevelCount(levels);
        }
        if (heuristic != null) {
            config.setHeuristic(heuristic);
        }
        if (noRound) {
            config.setRound(false);
        }
        if (noCurly) {
            config.setCurly(false);
        }
        if (noSquare) {
            config.setSquare(false);
        }
        if (noAngle) {
            config.setAngle(false);
        }
        if (noPreprocessor) {
            config.setPreprocessor(false);
        }
        return config;
    }

    private static void setDebugLogging() {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (factory instanceof LoggerContext context) {
            context.getLogger("io.colorizer").setLevel(Level.DEBUG);
        } else {
            logger.warn("--debug ignored, not using logback: {}", factory.getClass().getName());
        }
    }

    // ========== Getters for programmatic access ==========

    public List<String> getFiles() {
        return files;
    }

    public Format getFormat() {
        return format;
    }

    public int getThreads() {
        return threads;
    }

    /**
     * Parse command-line arguments without executing.
     */
    public static Main parse(String... args) {
        Main main = new Main();
        new CommandLine(main).setCaseInsensitiveEnumValuesAllowed(true).parseArgs(args);
        return main;
    }

}
