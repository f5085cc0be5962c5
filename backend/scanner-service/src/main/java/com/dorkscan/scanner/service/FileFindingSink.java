package com.dorkscan.scanner.service;

import com.dorkscan.scanner.config.ScanProperties;
import com.dorkscan.scanner.model.Finding;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes findings to {@code results.jsonl} and {@code results.csv} in the output directory.
 * Every append opens, writes, flushes and closes both files, so an interrupted run leaves
 * complete records behind.
 */
@Component
public class FileFindingSink implements FindingSink {

    private static final Logger log = LoggerFactory.getLogger(FileFindingSink.class);

    public static final String JSONL_FILE = "results.jsonl";
    public static final String CSV_FILE = "results.csv";

    private final Path outputDir;
    private final ObjectMapper objectMapper;
    private final CsvMapper csvMapper = new CsvMapper();
    private final CsvSchema csvSchema = CsvSchema.builder()
            .addColumns(Finding.CSV_COLUMNS, CsvSchema.ColumnType.STRING)
            .build()
            .withoutHeader();
    private final Object lock = new Object();

    @Autowired
    public FileFindingSink(ScanProperties scan, ObjectMapper objectMapper) {
        this(scan.outputPath(), objectMapper);
    }

    public FileFindingSink(Path outputDir, ObjectMapper objectMapper) {
        this.outputDir = outputDir;
        this.objectMapper = objectMapper;
    }

    @Override
    public Path jsonlPath() {
        return outputDir.resolve(JSONL_FILE);
    }

    @Override
    public Path csvPath() {
        return outputDir.resolve(CSV_FILE);
    }

    @Override
    public void initialize() {
        synchronized (lock) {
            try {
                Files.createDirectories(outputDir);
            } catch (IOException e) {
                log.warn("Could not create output directory {}: {}", outputDir, e.toString());
                return;
            }
            if (Files.notExists(jsonlPath())) {
                try {
                    Files.createFile(jsonlPath());
                    log.info("Created {}", jsonlPath());
                } catch (IOException e) {
                    log.warn("Could not create {}: {}", jsonlPath(), e.toString());
                }
            }
            if (Files.notExists(csvPath())) {
                try {
                    writeCsvLine(csvPath(), header(), StandardOpenOption.CREATE_NEW);
                    log.info("Created {} with header", csvPath());
                } catch (IOException e) {
                    log.warn("Could not create {}: {}", csvPath(), e.toString());
                }
            }
        }
    }

    @Override
    public void append(Finding finding) {
        synchronized (lock) {
            try (Writer w = Files.newBufferedWriter(jsonlPath(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                w.write(objectMapper.writeValueAsString(finding));
                w.write('\n');
                w.flush();
                log.debug("jsonl entry added: {}", finding.url());
            } catch (IOException e) {
                log.warn("Error writing {} to {}: {}", finding.url(), jsonlPath(), e.toString());
            }

            try {
                if (Files.notExists(csvPath())) {
                    writeCsvLine(csvPath(), header(), StandardOpenOption.CREATE_NEW);
                }
                writeCsvLine(csvPath(), finding.csvRow(), StandardOpenOption.APPEND);
                log.debug("csv entry added: {}", finding.url());
            } catch (IOException e) {
                log.warn("Error writing {} to {}: {}", finding.url(), csvPath(), e.toString());
            }
        }
    }

    private static Map<String, String> header() {
        Map<String, String> header = new LinkedHashMap<>();
        for (String column : Finding.CSV_COLUMNS) {
            header.put(column, column);
        }
        return header;
    }

    private void writeCsvLine(Path path, Map<String, String> row, StandardOpenOption mode) throws IOException {
        String line = csvMapper.writer(csvSchema).writeValueAsString(row);
        try (Writer w = Files.newBufferedWriter(path, StandardCharsets.UTF_8, StandardOpenOption.WRITE, mode)) {
            w.write(line);
            w.flush();
        }
    }
}
