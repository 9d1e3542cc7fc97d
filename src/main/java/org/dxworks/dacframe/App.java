package org.dxworks.dacframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.dacframe.analyzer.sql.SchemaModelLoader;
import org.dxworks.dacframe.model.Analysis;
import org.dxworks.dacframe.analyzer.sql.body.BodyContext;
import org.dxworks.dacframe.analyzer.sql.body.BodyReferenceResolver;
import org.dxworks.dacframe.analyzer.sql.body.ColumnRegistry;
import org.dxworks.dacframe.analyzer.sql.body.RoutineBodyAnalyzer;
import org.dxworks.dacframe.model.sql.BodyAnalysis;
import org.dxworks.dacframe.model.sql.BodyDependency;
import org.dxworks.dacframe.model.sql.RoutineDefinition;
import org.dxworks.dacframe.model.sql.SchemaModel;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar dacframe.jar <input-folder> <output-file>");
            System.err.println("  <input-folder>: Path to a database project directory or a single .sql file");
            System.err.println("  <output-file>:  Path to output JSONL file");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        Path jsonlOutput = Paths.get(args[1]);
        // Create parent directories if they don't exist
        if (jsonlOutput.getParent() != null) {
            Files.createDirectories(jsonlOutput.getParent());
        }

        System.out.println("Starting body dependency analysis...");
        System.out.println("Input: " + input.toAbsolutePath());

        DacframeConfig config = DacframeConfig.load();
        List<Path> files = collectSourceFiles(input, config.getMaxFileLines());
        System.out.println("Found " + files.size() + " SQL files");

        Instant startTime = Instant.now();
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);

        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new HashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", files.size());
            writer.write(MAPPER.writeValueAsString(runInfo));
            writer.newLine();

            SchemaModel model = new SchemaModel();
            SchemaModelLoader loader = new SchemaModelLoader();
            for (Path file : files) {
                try {
                    loader.loadFile(file.toString(), Files.readString(file, StandardCharsets.UTF_8), model);
                } catch (IOException e) {
                    writeError(writer, file.toString(), e);
                    errorCount.incrementAndGet();
                }
            }
            for (String diagnostic : model.diagnostics) {
                System.err.println("  " + diagnostic);
            }

            // the registry is complete before any body is resolved
            ColumnRegistry registry = ColumnRegistry.build(model, config.getDefaultSchema());
            RoutineBodyAnalyzer analyzer = new BodyReferenceResolver(registry, config);
            System.out.println("Registry: " + registry.tableCount() + " tables, "
                    + model.routines.size() + " bodies to resolve");

            List<RoutineDefinition> routines = model.routines;
            routines.parallelStream().forEach(routine -> {
                int current = progressCounter.incrementAndGet();

                synchronized (System.out) {
                    System.out.println("[" + current + "/" + routines.size() + "] Resolving "
                            + routine.kind + ": " + qualifiedName(routine));
                }

                try {
                    writeAnalysis(writer, analyzeRoutine(routine, analyzer));

                    successCount.incrementAndGet();
                } catch (Exception e) {
                    try {
                        writeError(writer, routine.filePath, e);
                    } catch (IOException ioException) {
                        System.err.println("Failed to write error for " + qualifiedName(routine) + ": " + ioException.getMessage());
                    }

                    errorCount.incrementAndGet();
                    synchronized (System.err) {
                        System.err.println("  Error resolving " + qualifiedName(routine) + ": " + e.getMessage());
                    }
                }
            });

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new HashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("objects_analyzed", successCount.get());
            doneInfo.put("objects_with_errors", errorCount.get());
            doneInfo.put("duration_seconds",
                        java.time.Duration.between(startTime, endTime).getSeconds());
            writer.write(MAPPER.writeValueAsString(doneInfo));
            writer.newLine();
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Analysis complete!");
        System.out.println("Successfully analyzed: " + successCount.get() + " objects");
        if (errorCount.get() > 0) {
            System.out.println("Errors: " + errorCount.get());
        }
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    // Write result immediately (synchronized to avoid concurrent writes)
    private static void writeAnalysis(BufferedWriter writer, Analysis analysis) throws IOException {
        String line = MAPPER.writeValueAsString(analysis);
        synchronized (writer) {
            writer.write(line);
            writer.newLine();
            writer.flush();
        }
    }

    private static void writeError(BufferedWriter writer, String file, Exception e) throws IOException {
        Map<String, String> error = new HashMap<>();
        error.put("kind", "error");
        error.put("file", file);
        error.put("language", "sql");
        error.put("error", e.getMessage());
        synchronized (writer) {
            writer.write(MAPPER.writeValueAsString(error));
            writer.newLine();
            writer.flush();
        }
    }

    private static String qualifiedName(RoutineDefinition routine) {
        return routine.schema == null ? routine.name : routine.schema + "." + routine.name;
    }

    private static List<Path> collectSourceFiles(Path input, int maxFileLines) throws IOException {
        List<Path> files = new ArrayList<>();

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(App::isSqlFile)
                      .filter(p -> withinMaxLines(p, maxFileLines))
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input)) {
            if (isSqlFile(input) && withinMaxLines(input, maxFileLines)) {
                files.add(input);
            }
        }

        return files;
    }

    private static boolean isSqlFile(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".sql");
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (Stream<String> lines = Files.lines(path)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            return count <= maxFileLines;
        } catch (Exception e) {
            return true;
        }
    }

    /**
     * Loads every {@code .sql} file under {@code input}, builds the registry and resolves every
     * body. Results come back in load order.
     */
    public static List<BodyAnalysis> analyzeProject(Path input, DacframeConfig config) throws IOException {
        Map<String, String> sources = new LinkedHashMap<>();
        for (Path file : collectSourceFiles(input, config.getMaxFileLines())) {
            String relative = Files.isDirectory(input)
                    ? input.relativize(file).toString().replace('\\', '/')
                    : file.getFileName().toString();
            sources.put(relative, Files.readString(file, StandardCharsets.UTF_8));
        }
        SchemaModel model = new SchemaModelLoader().load(sources);
        RoutineBodyAnalyzer analyzer = new BodyReferenceResolver(
                ColumnRegistry.build(model, config.getDefaultSchema()), config);
        return model.routines.stream()
                .map(routine -> analyzeRoutine(routine, analyzer))
                .collect(Collectors.toList());
    }

    public static BodyAnalysis analyzeRoutine(RoutineDefinition routine, RoutineBodyAnalyzer analyzer) {
        RoutineBodyAnalyzer.Result result = analyzer.analyze(BodyContext.from(routine));
        BodyAnalysis analysis = new BodyAnalysis();
        analysis.filePath = routine.filePath;
        analysis.schema = routine.schema;
        analysis.name = routine.name;
        analysis.objectKind = routine.kind;
        analysis.dependencies.addAll(result.dependencies);
        for (BodyDependency dependency : result.dependencies) {
            analysis.references.add(dependency.toReference());
        }
        analysis.diagnostics.addAll(result.diagnostics);
        return analysis;
    }
}
