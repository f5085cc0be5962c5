package com.dorkscan.scanner.service;

import com.dorkscan.scanner.model.DorkQuery;
import com.dorkscan.scanner.model.Finding;
import com.dorkscan.scanner.model.PageSnapshot;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FileFindingSinkTest {

    private static final String HEADER = "timestamp,category,dork,query,url,status,title,sensitive_hint,error";

    @TempDir
    Path tempDir;

    private final ObjectMapper om = new ObjectMapper();

    @Test
    void initializeCreatesDirectoryAndFiles() throws Exception {
        FileFindingSink sink = new FileFindingSink(tempDir.resolve("out"), om);

        sink.initialize();

        assertThat(sink.jsonlPath()).exists().isEmptyFile();
        assertThat(Files.readAllLines(sink.csvPath(), StandardCharsets.UTF_8)).containsExactly(HEADER);
    }

    @Test
    void initializeTwiceDoesNotDuplicateHeader() throws Exception {
        FileFindingSink sink = new FileFindingSink(tempDir, om);
        sink.initialize();
        sink.append(Finding.of(query(), "http://example.com/a.pdf", 1_000L));

        sink.initialize();
        new FileFindingSink(tempDir, om).initialize();

        List<String> lines = Files.readAllLines(sink.csvPath(), StandardCharsets.UTF_8);
        assertThat(lines).hasSize(2);
        assertThat(lines.get(0)).isEqualTo(HEADER);
        assertThat(Files.readAllLines(sink.jsonlPath())).hasSize(1);
    }

    @Test
    void appendWritesOneJsonLineAndOneCsvRow() throws Exception {
        FileFindingSink sink = new FileFindingSink(tempDir, om);
        sink.initialize();
        Finding finding = Finding.of(query(), "http://example.com/a.pdf", 1_700_000_000_500L)
                .withSnapshot(PageSnapshot.ok("http://example.com/a.pdf", 200, "Report, final", "password=x"), true);

        sink.append(finding);
        sink.append(Finding.of(query(), "http://example.com/b.pdf", 1_700_000_001_000L));

        List<String> json = Files.readAllLines(sink.jsonlPath(), StandardCharsets.UTF_8);
        assertThat(json).hasSize(2);
        JsonNode first = om.readTree(json.get(0));
        assertThat(first.get("url").asText()).isEqualTo("http://example.com/a.pdf");
        assertThat(first.get("status").asInt()).isEqualTo(200);
        assertThat(first.get("sensitive_hint").asBoolean()).isTrue();

        List<List<String>> rows = readCsv(sink.csvPath());
        assertThat(rows).hasSize(3);
        assertThat(String.join(",", rows.get(0))).isEqualTo(HEADER);
        assertThat(rows.get(1)).containsExactly("1700000000.500", "files", "filetype:pdf",
                "site:example.com filetype:pdf", "http://example.com/a.pdf", "200", "Report, final", "True", "");
        assertThat(rows.get(2)).containsExactly("1700000001.000", "files", "filetype:pdf",
                "site:example.com filetype:pdf", "http://example.com/b.pdf", "", "", "False", "");
    }

    @Test
    void recreatesCsvWithHeaderIfItDisappears() throws Exception {
        FileFindingSink sink = new FileFindingSink(tempDir, om);
        sink.initialize();
        Files.delete(sink.csvPath());

        sink.append(Finding.of(query(), "http://example.com/a.pdf", 1_000L));

        List<String> csv = Files.readAllLines(sink.csvPath(), StandardCharsets.UTF_8);
        assertThat(csv).hasSize(2);
        assertThat(csv.get(0)).isEqualTo(HEADER);
    }

    @Test
    void writeFailureDoesNotThrow() throws Exception {
        Path blocker = tempDir.resolve("not-a-dir");
        Files.writeString(blocker, "x");
        FileFindingSink sink = new FileFindingSink(blocker, om);

        sink.initialize();
        sink.append(Finding.of(query(), "http://example.com/a.pdf", 1_000L));

        assertThat(Files.readString(blocker)).isEqualTo("x");
    }

    private static List<List<String>> readCsv(Path path) throws Exception {
        CsvMapper mapper = new CsvMapper();
        try (MappingIterator<List<String>> it = mapper.readerForListOf(String.class)
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .readValues(path.toFile())) {
            return it.readAll();
        }
    }

    private static DorkQuery query() {
        return DorkQuery.build("files", "filetype:pdf", "example.com");
    }
}
