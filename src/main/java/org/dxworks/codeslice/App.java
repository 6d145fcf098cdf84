package org.dxworks.codeslice;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dxworks.codeslice.analyzer.AnalysisException;
import org.dxworks.codeslice.analyzer.FunctionAnalyzer;
import org.dxworks.codeslice.analyzer.FunctionDefinition;
import org.dxworks.codeslice.analyzer.ParsedSource;
import org.dxworks.codeslice.model.FunctionGraphs;
import org.dxworks.codeslice.model.FunctionReport;
import org.dxworks.codeslice.model.Graph;
import org.dxworks.codeslice.model.GraphKind;
import org.dxworks.codeslice.model.GraphStatistics;
import org.dxworks.codeslice.model.ParameterAnalysis;
import org.dxworks.codeslice.model.SliceResult;
import org.dxworks.codeslice.model.SliceType;
import org.dxworks.codeslice.report.GraphDotWriter;
import org.dxworks.codeslice.report.SliceSnippetRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

public class App {

    private static final Logger logger = LoggerFactory.getLogger(App.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ObjectMapper PRETTY = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) throws Exception {
        int code = run(args);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    static int run(String[] args) throws IOException {
        if (args.length < 1) {
            return usage();
        }
        CodesliceConfig config = CodesliceConfig.load();
        String[] rest = Arrays.copyOfRange(args, 1, args.length);
        switch (args[0]) {
            case "analyze":
                return analyzeCommand(rest, config);
            case "slice":
                return sliceCommand(rest, config);
            case "params":
                return paramsCommand(rest, config);
            case "graph":
                return graphCommand(rest);
            default:
                return usage();
        }
    }

    private static int usage() {
        System.err.println("Usage: java -jar codeslice.jar <command> <args>");
        System.err.println("  analyze <input> <output.jsonl>                              Analyze every function under <input>");
        System.err.println("  slice <file> <function> <variable> <line> [backward|forward|both]");
        System.err.println("  params <file> <function>                                     Parameter interaction report");
        System.err.println("  graph <file> <function> <cfg|cdg|ddg|pdg> [json|dot]         Export one graph");
        System.err.println("Supported languages: C (.c, .h), C++ (.cpp, .cc, .cxx, .hpp, .hh)");
        return EXIT_USAGE;
    }

    private static int analyzeCommand(String[] args, CodesliceConfig config) throws IOException {
        if (args.length < 2) {
            return usage();
        }
        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            return EXIT_FAILED;
        }
        Path jsonlOutput = Paths.get(args[1]);
        if (jsonlOutput.toAbsolutePath().getParent() != null) {
            Files.createDirectories(jsonlOutput.toAbsolutePath().getParent());
        }

        System.out.println("Starting slice analysis...");
        System.out.println("Input: " + input.toAbsolutePath());
        BatchSummary summary = analyzeAll(input, jsonlOutput, config);

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Analysis complete!");
        System.out.println("Successfully analyzed: " + summary.filesAnalyzed.get() + " files, "
                + summary.functionsAnalyzed.get() + " functions");
        if (summary.filesWithErrors.get() > 0 || summary.functionsWithErrors.get() > 0) {
            System.out.println("Errors: " + summary.filesWithErrors.get() + " files, "
                    + summary.functionsWithErrors.get() + " functions");
        }
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));
        return EXIT_OK;
    }

    /**
     * Writes one {@code run} record, then {@code function} and {@code error} records per file, then
     * one {@code done} record. A function that fails to analyze yields an error record and the rest
     * of its file is still analyzed.
     */
    static BatchSummary analyzeAll(Path input, Path jsonlOutput, CodesliceConfig config) throws IOException {
        List<Path> files = collectSourceFiles(input, config);
        System.out.println("Found " + files.size() + " source files");

        Instant startTime = Instant.now();
        BatchSummary summary = new BatchSummary();
        AtomicInteger progressCounter = new AtomicInteger(0);

        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new LinkedHashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", files.size());
            writer.write(MAPPER.writeValueAsString(runInfo));
            writer.newLine();

            files.parallelStream().forEach(file -> {
                Language language = LanguageDetector.detectLanguage(file).orElseThrow();
                int current = progressCounter.incrementAndGet();
                synchronized (System.out) {
                    System.out.println("[" + current + "/" + files.size() + "] Analyzing "
                            + language.getName() + ": " + file.getFileName());
                }

                List<Object> records = new ArrayList<>();
                boolean fileFailed;
                try {
                    fileFailed = analyzeFile(file, language, config, records, summary);
                } catch (Exception e) {
                    records.add(errorRecord(file, language, null, e));
                    fileFailed = true;
                    synchronized (System.err) {
                        System.err.println("  Error analyzing " + file.getFileName() + ": " + e.getMessage());
                    }
                }
                if (fileFailed) {
                    summary.filesWithErrors.incrementAndGet();
                } else {
                    summary.filesAnalyzed.incrementAndGet();
                }

                try {
                    synchronized (writer) {
                        for (Object record : records) {
                            writer.write(MAPPER.writeValueAsString(record));
                            writer.newLine();
                        }
                        writer.flush();
                    }
                } catch (IOException ioException) {
                    System.err.println("Failed to write results for " + file + ": " + ioException.getMessage());
                }
            });

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new LinkedHashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_analyzed", summary.filesAnalyzed.get());
            doneInfo.put("files_with_errors", summary.filesWithErrors.get());
            doneInfo.put("functions_analyzed", summary.functionsAnalyzed.get());
            doneInfo.put("functions_with_errors", summary.functionsWithErrors.get());
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writer.write(MAPPER.writeValueAsString(doneInfo));
            writer.newLine();
        }
        return summary;
    }

    /**
     * @return true when at least one function of the file failed
     */
    private static boolean analyzeFile(Path file, Language language, CodesliceConfig config,
                                       List<Object> records, BatchSummary summary) throws IOException {
        String sourceCode = Files.readString(file, StandardCharsets.UTF_8);
        FunctionAnalyzer analyzer = new FunctionAnalyzer();
        ParsedSource source = analyzer.parse(sourceCode, language);

        boolean failed = false;
        for (FunctionDefinition function : analyzer.functions(source)) {
            try {
                records.add(report(file, language, analyzer.analyze(source, function), sourceCode, config));
                summary.functionsAnalyzed.incrementAndGet();
            } catch (AnalysisException e) {
                logger.warn("Skipping {} in {}: {}", function.getInfo().name, file, e.getMessage());
                records.add(errorRecord(file, language, function.getInfo().name, e));
                summary.functionsWithErrors.incrementAndGet();
                failed = true;
            }
        }
        return failed;
    }

    static FunctionReport report(Path file, Language language, FunctionGraphs graphs, String sourceCode,
                                 CodesliceConfig config) {
        FunctionReport report = new FunctionReport();
        report.file = file.toString();
        report.language = language.getName();
        report.function = graphs.getFunction();
        report.statistics = GraphStatistics.of(graphs.getPdg());
        report.parameters = new FunctionAnalyzer().parameters(graphs);
        if (config.isIncludeSnippets()) {
            SliceSnippetRenderer.attach(report.parameters, sourceCode);
        }
        if (config.isIncludeGraphs()) {
            for (GraphKind kind : GraphKind.values()) {
                report.addGraph(graphs.graph(kind));
            }
        }
        return report;
    }

    private static Map<String, Object> errorRecord(Path file, Language language, String function, Exception e) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("kind", "error");
        error.put("file", file.toString());
        error.put("language", language.getName());
        if (function != null) {
            error.put("function", function);
        }
        error.put("error", e.getMessage());
        return error;
    }

    private static int sliceCommand(String[] args, CodesliceConfig config) throws IOException {
        if (args.length < 4) {
            return usage();
        }
        Optional<SliceType> type = SliceType.fromName(args.length > 4 ? args[4] : "backward");
        int line;
        try {
            line = Integer.parseInt(args[3]);
        } catch (NumberFormatException e) {
            System.err.println("Error: line must be a number: " + args[3]);
            return EXIT_USAGE;
        }
        if (type.isEmpty()) {
            return usage();
        }
        Path file = Paths.get(args[0]);
        Optional<Language> language = detect(file);
        if (language.isEmpty()) {
            return EXIT_USAGE;
        }

        String sourceCode = Files.readString(file, StandardCharsets.UTF_8);
        try {
            FunctionAnalyzer analyzer = new FunctionAnalyzer();
            FunctionGraphs graphs = analyzer.analyze(sourceCode, args[1], language.get());
            SliceResult slice = analyzer.slice(graphs, args[2], line, type.get());
            System.out.println(PRETTY.writeValueAsString(slice));
            if (config.isIncludeSnippets()) {
                System.out.println();
                System.out.print(SliceSnippetRenderer.render(sourceCode, slice));
            }
            return EXIT_OK;
        } catch (AnalysisException e) {
            System.err.println("Error: " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    private static int paramsCommand(String[] args, CodesliceConfig config) throws IOException {
        if (args.length < 2) {
            return usage();
        }
        Path file = Paths.get(args[0]);
        Optional<Language> language = detect(file);
        if (language.isEmpty()) {
            return EXIT_USAGE;
        }

        String sourceCode = Files.readString(file, StandardCharsets.UTF_8);
        try {
            FunctionAnalyzer analyzer = new FunctionAnalyzer();
            ParameterAnalysis analysis = analyzer.parameters(analyzer.analyze(sourceCode, args[1], language.get()));
            if (config.isIncludeSnippets()) {
                SliceSnippetRenderer.attach(analysis, sourceCode);
            }
            System.out.println(PRETTY.writeValueAsString(analysis));
            return EXIT_OK;
        } catch (AnalysisException e) {
            System.err.println("Error: " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    private static int graphCommand(String[] args) throws IOException {
        if (args.length < 3) {
            return usage();
        }
        Optional<GraphKind> kind = GraphKind.fromName(args[2]);
        String format = args.length > 3 ? args[3].toLowerCase() : "json";
        if (kind.isEmpty() || !(format.equals("json") || format.equals("dot"))) {
            return usage();
        }
        Path file = Paths.get(args[0]);
        Optional<Language> language = detect(file);
        if (language.isEmpty()) {
            return EXIT_USAGE;
        }

        String sourceCode = Files.readString(file, StandardCharsets.UTF_8);
        try {
            FunctionGraphs graphs = new FunctionAnalyzer().analyze(sourceCode, args[1], language.get());
            Graph graph = graphs.graph(kind.get());
            if (format.equals("dot")) {
                System.out.print(GraphDotWriter.toDot(graph, graphs.getFunction().name + " " + kind.get().name()));
            } else {
                System.out.println(PRETTY.writeValueAsString(graph));
            }
            return EXIT_OK;
        } catch (AnalysisException e) {
            System.err.println("Error: " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    private static Optional<Language> detect(Path file) {
        if (!Files.isRegularFile(file)) {
            System.err.println("Error: Input file does not exist: " + file);
            return Optional.empty();
        }
        Optional<Language> language = LanguageDetector.detectLanguage(file);
        if (language.isEmpty()) {
            System.err.println("Error: Unsupported file type: " + file.getFileName());
        }
        return language;
    }

    static List<Path> collectSourceFiles(Path input, CodesliceConfig config) throws IOException {
        return collectSourceFiles(input, config, SourceFileFilter.load(Paths.get(".ignore"), config.getExcludes()));
    }

    static List<Path> collectSourceFiles(Path input, CodesliceConfig config, SourceFileFilter filter) throws IOException {
        List<Path> files = new ArrayList<>();

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(p -> filter.accepts(input, p))
                      .filter(p -> withinMaxLines(p, config.getMaxFileLines()))
                      .filter(p -> LanguageDetector.detectLanguage(p).isPresent())
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input)) {
            if (filter.accepts(input.toAbsolutePath().getParent(), input)
                    && withinMaxLines(input, config.getMaxFileLines())
                    && LanguageDetector.detectLanguage(input).isPresent()) {
                files.add(input);
            }
        }

        return Collections.unmodifiableList(files);
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (Stream<String> lines = Files.lines(path, StandardCharsets.UTF_8)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            return count <= maxFileLines;
        } catch (IOException | UncheckedIOException e) {
            logger.debug("Could not count lines of {}: {}", path, e.getMessage());
            return true;
        }
    }

    static final class BatchSummary {
        final AtomicInteger filesAnalyzed = new AtomicInteger();
        final AtomicInteger filesWithErrors = new AtomicInteger();
        final AtomicInteger functionsAnalyzed = new AtomicInteger();
        final AtomicInteger functionsWithErrors = new AtomicInteger();
    }
}
