package com.dorkscan.scanner.runner;

import com.dorkscan.scanner.config.ScanProperties;
import com.dorkscan.scanner.model.DorkCatalog;
import com.dorkscan.scanner.model.ScanSummary;
import com.dorkscan.scanner.service.ConfigurationException;
import com.dorkscan.scanner.service.DorkCatalogLoader;
import com.dorkscan.scanner.service.FindingSink;
import com.dorkscan.scanner.service.ScanOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Loads the catalog and runs a single scan at startup. Disabled with
 * {@code scan.runner.enabled=false}.
 */
@Component
@ConditionalOnProperty(prefix = "scan.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ScanRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(ScanRunner.class);

    private final DorkCatalogLoader catalogLoader;
    private final ScanOrchestrator orchestrator;
    private final FindingSink sink;
    private final ScanProperties props;

    public ScanRunner(DorkCatalogLoader catalogLoader, ScanOrchestrator orchestrator, FindingSink sink, ScanProperties props) {
        this.catalogLoader = catalogLoader;
        this.orchestrator = orchestrator;
        this.sink = sink;
        this.props = props;
    }

    @Override
    public void run(ApplicationArguments args) {
        DorkCatalog catalog;
        try {
            catalog = catalogLoader.load(Path.of(props.dorksFile()));
        } catch (ConfigurationException e) {
            log.error("Dorks not loaded, exiting: {}", e.getMessage());
            throw e;
        }

        try {
            ScanSummary summary = orchestrator.run(catalog);
            if (summary != null) {
                log.info("Scan {} in {} s: {} queries ({} without results), {} findings, {} with sensitive hints, {} categories skipped",
                        summary.cancelled() ? "interrupted" : "finished",
                        summary.elapsed().toSeconds(),
                        summary.queriesRun(), summary.emptyQueries(),
                        summary.findings().size(), summary.sensitiveFindings(),
                        summary.skippedCategories());
            }
        } finally {
            log.info("Done. Results saved to: {}", props.outputDir());
            log.info("  - jsonl: {}", sink.jsonlPath());
            log.info("  - csv:   {}", sink.csvPath());
        }
    }
}
