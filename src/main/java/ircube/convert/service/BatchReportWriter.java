package ircube.convert.service;

import com.google.gson.GsonBuilder;
import ircube.convert.model.BatchReport;
import ircube.convert.model.ConversionResult;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a {@link BatchReport} as pretty-printed JSON ({@code conversion_report.json}).
 */
public class BatchReportWriter {

    public static final String REPORT_FILE_NAME = "conversion_report.json";

    /**
     * @param report the report to write
     * @param outputPath destination JSON file
     * @throws IOException if the file cannot be written
     */
    public void write(BatchReport report, Path outputPath) throws IOException {
        try (Writer w = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8)) {
            new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create().toJson(toMap(report), w);
        }
    }

    Map<String, Object> toMap(BatchReport report) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("directory", report.getDirectory() == null ? null : report.getDirectory().toString());
        root.put("generated", LocalDateTime.now().toString());
        root.put("converted", report.getSuccessCount());
        root.put("failed", report.getFailureCount());

        List<Map<String, Object>> files = new ArrayList<>();
        for (ConversionResult result : report.getResults()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("source", result.source().toString());
            if (result.isSuccess()) {
                entry.put("status", "converted");
                entry.put("output", result.output().toString());
            } else {
                entry.put("status", "failed");
                entry.put("error", result.failureMessage());
            }
            files.add(entry);
        }
        root.put("files", files);
        return root;
    }
}
