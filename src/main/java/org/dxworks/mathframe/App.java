package org.dxworks.mathframe;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.mathframe.model.FileRendering;
import org.dxworks.mathframe.model.FormulaRendering;
import org.dxworks.mathframe.renderer.MathRenderException;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar mathframe.jar <input-path> <output-file>");
            System.err.println("  <input-path>:  File or directory containing MathML");
            System.err.println("  <output-file>: Path to output JSONL file");
            System.err.println("Supported inputs: .html .htm .xhtml .xml .mml .txt .md");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        Path jsonlOutput = Paths.get(args[1]);
        if (jsonlOutput.getParent() != null) {
            Files.createDirectories(jsonlOutput.getParent());
        }

        System.out.println("Starting MathML rendering...");
        System.out.println("Input: " + input.toAbsolutePath());

        MathframeConfig config = MathframeConfig.load();
        List<Path> files = collectInputFiles(input, config.getMaxFileLines());
        System.out.println("Found " + files.size() + " input files");

        Instant startTime = Instant.now();
        RunTotals totals;

        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new HashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", files.size());
            writer.write(MAPPER.writeValueAsString(runInfo));
            writer.newLine();

            totals = writeRenderings(files, file -> renderFile(file, config), writer);

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new HashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_rendered", totals.filesRendered.get());
            doneInfo.put("files_with_errors", totals.fileErrors.get());
            doneInfo.put("formulas_rendered", totals.formulasRendered());
            doneInfo.put("formulas_with_errors", totals.formulaErrors.get());
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writer.write(MAPPER.writeValueAsString(doneInfo));
            writer.newLine();
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Rendering complete!");
        System.out.println("Files rendered: " + totals.filesRendered.get());
        if (totals.fileErrors.get() > 0) {
            System.out.println("Files with errors: " + totals.fileErrors.get());
        }
        System.out.println("Formulas rendered: " + totals.formulasRendered());
        if (totals.formulaErrors.get() > 0) {
            System.out.println("Formulas with errors: " + totals.formulaErrors.get());
        }
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    /**
     * Renders the files in parallel and writes one JSONL record per file. A file that fails
     * for any reason gets an error record instead and the remaining files are still rendered.
     */
    static RunTotals writeRenderings(List<Path> files, FileRenderer renderer, BufferedWriter writer) {
        RunTotals totals = new RunTotals();
        AtomicInteger progressCounter = new AtomicInteger(0);

        files.parallelStream().forEach(file -> {
            int current = progressCounter.incrementAndGet();

            synchronized (System.out) {
                System.out.println("[" + current + "/" + files.size() + "] Rendering " + file.getFileName());
            }

            try {
                FileRendering rendering = renderer.render(file);

                synchronized (writer) {
                    writer.write(MAPPER.writeValueAsString(rendering));
                    writer.newLine();
                    writer.flush();
                }

                totals.filesRendered.incrementAndGet();
                for (FormulaRendering formula : rendering.formulas) {
                    totals.formulas.incrementAndGet();
                    if (formula.error != null) {
                        totals.formulaErrors.incrementAndGet();
                    }
                }
            } catch (Exception e) {
                Map<String, String> error = new HashMap<>();
                error.put("kind", "error");
                error.put("file", file.toString());
                error.put("error", e.getMessage());

                try {
                    synchronized (writer) {
                        writer.write(MAPPER.writeValueAsString(error));
                        writer.newLine();
                        writer.flush();
                    }
                } catch (IOException ioException) {
                    System.err.println("Failed to write error for " + file + ": " + ioException.getMessage());
                }

                totals.fileErrors.incrementAndGet();
                synchronized (System.err) {
                    System.err.println("  Error rendering " + file.getFileName() + ": " + e.getMessage());
                }
            }
        });
        return totals;
    }

    private static List<Path> collectInputFiles(Path input, int maxFileLines) throws IOException {
        List<Path> files = new ArrayList<>();

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(InputDetector::isSupported)
                      .filter(p -> withinMaxLines(p, maxFileLines))
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input)) {
            if (InputDetector.isSupported(input) && withinMaxLines(input, maxFileLines)) {
                files.add(input);
            }
        }

        return files;
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (Stream<String> lines = Files.lines(path)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            return count <= maxFileLines;
        } catch (Exception e) {
            // unreadable here means it fails again when rendered and gets an error record
            return true;
        }
    }

    /**
     * Renders every math fragment of a file. A fragment that fails is recorded with its error
     * and does not stop the remaining fragments.
     */
    public static FileRendering renderFile(Path filePath, MathframeConfig config) throws IOException {
        String text = Files.readString(filePath, StandardCharsets.UTF_8);

        // Remove BOM if present
        if (text.startsWith("\uFEFF")) {
            text = text.substring(1);
        }

        MathMLConverter converter = MathMLConverter.from(config);
        FileRendering rendering = new FileRendering();
        rendering.filePath = filePath.toString();

        List<String> fragments = MathFragments.findAll(text);
        for (int i = 0; i < fragments.size(); i++) {
            try {
                rendering.formulas.add(FormulaRendering.of(i, converter.parse(fragments.get(i))));
            } catch (MathRenderException e) {
                rendering.formulas.add(FormulaRendering.failed(i, e.getMessage()));
            }
        }
        return rendering;
    }

    @FunctionalInterface
    interface FileRenderer {
        FileRendering render(Path file) throws IOException;
    }

    static final class RunTotals {
        final AtomicInteger filesRendered = new AtomicInteger(0);
        final AtomicInteger fileErrors = new AtomicInteger(0);
        final AtomicInteger formulas = new AtomicInteger(0);
        final AtomicInteger formulaErrors = new AtomicInteger(0);

        int formulasRendered() {
            return formulas.get() - formulaErrors.get();
        }
    }
}
