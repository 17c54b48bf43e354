package com.hbsparser.scanner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hbsparser.TemplateSyntaxException;
import com.hbsparser.jackson.OcarinaJackson;
import com.hbsparser.tokens.TemplateTokens;
import com.hbsparser.tokens.TokenOccurrence;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * Extracts invocation tokens from every template under a set of directories and writes
 * a JSON report of tokens per file plus the files that failed to parse.
 *
 * Usage:
 *   java -cp ... com.hbsparser.scanner.TemplateScanner [options] <source-dirs...>
 *
 * Options:
 *   --threads=N           Number of worker threads (default: available processors)
 *   --extensions=ext,...  File extensions to process (default: hbs)
 *   --output=PATH         Report file (default: ./template-tokens.json)
 *   --verbose             Log every file
 */
public class TemplateScanner {
    private static final Logger logger = LogManager.getLogger(TemplateScanner.class);

    private static final ObjectMapper mapper = OcarinaJackson.createObjectMapper();

    private final Config config;

    private final AtomicLong scannedFiles = new AtomicLong(0);
    private final AtomicLong failedFiles = new AtomicLong(0);
    private final AtomicLong totalTokens = new AtomicLong(0);

    private final ConcurrentMap<Path, List<TokenOccurrence>> results = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<FailureRecord> failures = new ConcurrentLinkedQueue<>();

    public static void main(String[] args) {
        Config config = Config.parse(args);
        if (config == null) {
            printUsage();
            System.exit(1);
        }

        try {
            System.exit(new TemplateScanner(config).run());
        } catch (Exception e) {
            logger.error("Fatal error", e);
            System.exit(1);
        }
    }

    public TemplateScanner(Config config) {
        this.config = config;
    }

    /**
     * Scans, writes the report, and returns the process exit code: 1 if any template
     * failed to parse, 0 otherwise.
     */
    public int run() throws IOException, InterruptedException {
        long startTime = System.currentTimeMillis();
        ScanReport report = scan();
        writeReport(report);

        long elapsedMs = System.currentTimeMillis() - startTime;
        logger.info("Scanned {} templates ({} failed, {} tokens) in {} ms, report at {}",
            scannedFiles.get(), failedFiles.get(), totalTokens.get(), elapsedMs, config.output);
        return report.failures().isEmpty() ? 0 : 1;
    }

    /**
     * Parses every matching file on a fixed pool of {@code --threads} workers.
     */
    public ScanReport scan() throws IOException, InterruptedException {
        List<Path> files = discoverFiles();
        logger.info("Found {} templates to scan", files.size());

        ExecutorService executor = Executors.newFixedThreadPool(config.threads);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (Path file : files) {
                futures.add(executor.submit(() -> processFile(file)));
            }
            for (Future<?> future : futures) {
                try {
                    future.get();
                } catch (ExecutionException e) {
                    throw new IllegalStateException("Template scan task failed", e.getCause());
                }
            }
        } finally {
            executor.shutdown();
            executor.awaitTermination(10, TimeUnit.SECONDS);
        }

        Map<Path, List<TokenOccurrence>> sorted = new TreeMap<>(results);
        List<FailureRecord> sortedFailures = failures.stream()
            .sorted(Comparator.comparing(FailureRecord::file))
            .toList();
        return new ScanReport(sorted, sortedFailures);
    }

    private List<Path> discoverFiles() throws IOException {
        List<Path> files = new ArrayList<>();
        for (Path sourceDir : config.sourceDirs) {
            if (!Files.exists(sourceDir)) {
                logger.warn("Source directory does not exist: {}", sourceDir);
                continue;
            }
            try (Stream<Path> paths = Files.walk(sourceDir)) {
                paths.filter(Files::isRegularFile)
                     .filter(this::hasValidExtension)
                     .filter(p -> !p.toString().contains("node_modules"))
                     .forEach(files::add);
            }
        }
        return files;
    }

    private boolean hasValidExtension(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return config.extensions.stream().anyMatch(ext -> name.endsWith("." + ext));
    }

    private void processFile(Path file) {
        String source;
        try {
            source = Files.readString(file);
        } catch (IOException e) {
            failedFiles.incrementAndGet();
            failures.add(new FailureRecord(file, "IO error: " + e.getMessage(), 0, 0));
            logger.warn("Could not read {}: {}", file, e.getMessage());
            return;
        }

        try {
            List<TokenOccurrence> tokens = TemplateTokens.extractTokenOccurrences(source);
            results.put(file, tokens);
            totalTokens.addAndGet(tokens.size());
            if (config.verbose) {
                logger.info("[OK] {} ({} tokens)", file, tokens.size());
            }
        } catch (TemplateSyntaxException e) {
            failedFiles.incrementAndGet();
            failures.add(new FailureRecord(file, e.getMessage(), e.getLine(), e.getColumn()));
            logger.warn("[FAIL] {}: {}", file, e.getMessage());
        }
        scannedFiles.incrementAndGet();
    }

    private void writeReport(ScanReport report) throws IOException {
        List<Map<String, Object>> files = new ArrayList<>();
        for (Map.Entry<Path, List<TokenOccurrence>> entry : report.tokens().entrySet()) {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("file", entry.getKey().toString());
            map.put("tokens", entry.getValue());
            files.add(map);
        }

        List<Map<String, Object>> failureList = new ArrayList<>();
        for (FailureRecord failure : report.failures()) {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("file", failure.file().toString());
            map.put("message", failure.message());
            map.put("line", failure.line());
            map.put("column", failure.column());
            failureList.add(map);
        }

        Map<String, Object> root = new LinkedHashMap<>();
        root.put("files", files);
        root.put("failures", failureList);

        Path parent = config.output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(config.output, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(root));
    }

    private static void printUsage() {
        System.out.println("Usage: TemplateScanner [options] <source-dirs...>");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --threads=N           Number of worker threads (default: CPU count)");
        System.out.println("  --extensions=ext,...  File extensions to process (default: hbs)");
        System.out.println("  --output=PATH         Report file (default: ./template-tokens.json)");
        System.out.println("  --verbose             Log every file");
        System.out.println("  --help                Show this help");
    }

    // ========== Inner classes ==========

    public record FailureRecord(Path file, String message, int line, int column) {}

    /**
     * Tokens per successfully parsed file, sorted by path, and the files that failed.
     */
    public record ScanReport(Map<Path, List<TokenOccurrence>> tokens, List<FailureRecord> failures) {}

    public static class Config {
        int threads = Runtime.getRuntime().availableProcessors();
        Path output = Path.of("template-tokens.json");
        List<String> extensions = List.of("hbs");
        List<Path> sourceDirs = new ArrayList<>();
        boolean verbose = false;

        public static Config parse(String[] args) {
            Config config = new Config();

            for (String arg : args) {
                if (arg.equals("--help") || arg.equals("-h")) {
                    return null;
                } else if (arg.startsWith("--threads=")) {
                    try {
                        config.threads = Integer.parseInt(arg.substring(10));
                    } catch (NumberFormatException e) {
                        System.err.println("Invalid thread count: " + arg.substring(10));
                        return null;
                    }
                    if (config.threads < 1) {
                        System.err.println("Thread count must be at least 1");
                        return null;
                    }
                } else if (arg.startsWith("--output=")) {
                    config.output = Path.of(arg.substring(9));
                } else if (arg.startsWith("--extensions=")) {
                    config.extensions = Arrays.asList(arg.substring(13).split(","));
                } else if (arg.equals("--verbose") || arg.equals("-v")) {
                    config.verbose = true;
                } else if (!arg.startsWith("-")) {
                    config.sourceDirs.add(Path.of(arg));
                } else {
                    System.err.println("Unknown option: " + arg);
                    return null;
                }
            }

            if (config.sourceDirs.isEmpty()) {
                System.err.println("Error: No source directories specified");
                return null;
            }

            return config;
        }
    }
}
