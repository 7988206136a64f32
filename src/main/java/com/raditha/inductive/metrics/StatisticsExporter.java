package com.raditha.inductive.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.raditha.inductive.model.MiningStep;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exports mining statistics to CSV and JSON for tracking runs over time.
 */
public class StatisticsExporter {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    /**
     * Flat view of a report, safe to serialise.
     */
    public record ReportDTO(
            LocalDateTime timestamp,
            String variant,
            String model,
            int alphabetSize,
            int treeSize,
            int maxDepth,
            long elapsedMillis,
            Map<String, Integer> steps) {
    }

    public ReportDTO toDto(MiningReport report) {
        Map<String, Integer> steps = new LinkedHashMap<>();
        for (MiningStep step : MiningStep.values()) {
            steps.put(step.name().toLowerCase(), report.count(step));
        }
        return new ReportDTO(
                report.timestamp(),
                report.variant().name(),
                report.tree().toString(),
                report.alphabetSize(),
                report.tree().size(),
                report.maxDepth(),
                report.elapsed().toMillis(),
                steps);
    }

    /**
     * CSV with a summary block and one row per step.
     */
    public String toCsv(MiningReport report) {
        StringBuilder csv = new StringBuilder();

        csv.append("# Run Summary\n");
        csv.append("timestamp,variant,alphabet_size,tree_size,max_depth,elapsed_ms,model\n");
        csv.append(String.format("%s,%s,%d,%d,%d,%d,\"%s\"\n",
                report.timestamp().format(TIMESTAMP_FORMAT),
                report.variant(),
                report.alphabetSize(),
                report.tree().size(),
                report.maxDepth(),
                report.elapsed().toMillis(),
                report.tree().toString().replace("\"", "\"\"")));

        csv.append("\n");

        csv.append("# Steps\n");
        csv.append("step,kind,count\n");
        for (MiningStep step : MiningStep.values()) {
            csv.append(String.format("%s,%s,%d\n",
                    step.name().toLowerCase(),
                    step.kind().name().toLowerCase(),
                    report.count(step)));
        }
        return csv.toString();
    }

    public String toJson(MiningReport report) throws IOException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toDto(report));
    }

    public void exportToCsv(MiningReport report, Path outputPath) throws IOException {
        Files.writeString(outputPath, toCsv(report));
    }

    public void exportToJson(MiningReport report, Path outputPath) throws IOException {
        Files.writeString(outputPath, toJson(report));
    }
}
