package com.recbench.evaluation.export;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.recbench.evaluation.model.AggregateResult;
import com.recbench.evaluation.model.CombinationResult;
import com.recbench.evaluation.model.EvaluationDetail;
import com.recbench.evaluation.model.ServiceResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes the per-sample details of an {@link AggregateResult} to CSV and reads them back.
 */
@Component
public class EvaluationExporter {
    private static final Logger log = LoggerFactory.getLogger(EvaluationExporter.class);
    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    static final String ITEM_SEPARATOR = "; ";
    static final String SCENARIO_SEPARATOR = " | ";

    private final CsvMapper csvMapper = new CsvMapper();
    private final CsvSchema schema = csvMapper.schemaFor(ExportRecord.class).withHeader();
    private final String defaultDirectory;

    public EvaluationExporter(@Value("${evaluation.export.directory:}") String defaultDirectory) {
        this.defaultDirectory = defaultDirectory == null ? "" : defaultDirectory.trim();
    }

    /**
     * Picks the target file for a task: an explicit {@code .csv} path is used as-is, an explicit
     * directory or the configured default directory gets a timestamped file name.
     *
     * @return null when neither a path nor a default directory is available
     */
    public Path resolveTarget(String requestedPath, String taskId) {
        String location = requestedPath == null || requestedPath.isBlank() ? defaultDirectory : requestedPath.trim();
        if (location.isEmpty()) {
            return null;
        }
        Path path = Paths.get(location);
        if (location.toLowerCase(Locale.ROOT).endsWith(".csv")) {
            return path;
        }
        String prefix = taskId == null ? "run" : taskId.substring(0, Math.min(8, taskId.length()));
        return path.resolve("evaluation_all_" + LocalDateTime.now().format(FILE_TIMESTAMP) + "_" + prefix + ".csv");
    }

    public Path write(AggregateResult aggregate, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        List<ExportRecord> records = toRecords(aggregate);
        try (OutputStream out = Files.newOutputStream(target)) {
            csvMapper.writer(schema).writeValues(out).writeAll(records).close();
        }
        log.info("event=export_written path={} rows={}", target, records.size());
        return target;
    }

    public List<ExportRecord> read(Path source) throws IOException {
        ObjectReader reader = csvMapper.readerFor(ExportRecord.class).with(schema);
        try (Reader in = Files.newBufferedReader(source, StandardCharsets.UTF_8);
             MappingIterator<ExportRecord> rows = reader.readValues(in)) {
            return rows.readAll();
        }
    }

    /**
     * Recomputes hit/total per service and combination label from exported rows.
     */
    public static Map<String, Map<String, HitTally>> reaggregate(List<ExportRecord> records) {
        Map<String, Map<String, HitTally>> tallies = new LinkedHashMap<>();
        for (ExportRecord record : records) {
            Map<String, HitTally> perLabel = tallies.computeIfAbsent(record.getServiceId(), ignored -> new LinkedHashMap<>());
            HitTally current = perLabel.getOrDefault(record.getCombinationLabel(), new HitTally(0, 0));
            perLabel.put(record.getCombinationLabel(), current.add(record.getHit() == 1));
        }
        return tallies;
    }

    static List<ExportRecord> toRecords(AggregateResult aggregate) {
        List<ExportRecord> records = new ArrayList<>();
        for (ServiceResult service : aggregate.getPerService().values()) {
            for (CombinationResult combination : service.getCombinationResults().values()) {
                for (EvaluationDetail detail : combination.getDetails()) {
                    ExportRecord record = new ExportRecord();
                    record.setServiceId(service.getServiceId());
                    record.setCombinationLabel(combination.getLabel());
                    record.setTopScenarios(combination.getCombination().getTopScenarios());
                    record.setTopRecommendationsPerScenario(
                            combination.getCombination().getTopRecommendationsPerScenario());
                    record.setClinicalScenario(detail.getClinicalScenario());
                    record.setStandardAnswer(detail.getStandardAnswer());
                    record.setRecommendations(flatten(detail.getRecommendations()));
                    record.setHit(detail.isHit() ? 1 : 0);
                    record.setProcessingTimeMs(detail.getProcessingTimeMs());
                    records.add(record);
                }
            }
        }
        return records;
    }

    static String flatten(List<List<String>> recommendations) {
        List<String> scenarios = new ArrayList<>(recommendations.size());
        for (List<String> list : recommendations) {
            scenarios.add(String.join(ITEM_SEPARATOR, list));
        }
        return String.join(SCENARIO_SEPARATOR, scenarios);
    }
}
