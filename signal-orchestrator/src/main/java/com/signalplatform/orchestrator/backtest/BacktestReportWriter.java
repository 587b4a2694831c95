package com.signalplatform.orchestrator.backtest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalplatform.common.model.BacktestResult;
import com.signalplatform.orchestrator.config.SignalPlatformProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Writes each backtest result as pretty-printed JSON to
 * {@code <reportDirectory>/<instrument>-<firstTimestampMillis>.json}. A blank report
 * directory disables writing.
 */
@Component
public class BacktestReportWriter {

    private static final Logger log = LoggerFactory.getLogger(BacktestReportWriter.class);

    private final ObjectMapper objectMapper;
    private final String reportDirectory;

    public BacktestReportWriter(ObjectMapper objectMapper, SignalPlatformProperties properties) {
        this.objectMapper    = objectMapper;
        this.reportDirectory = properties.backtest().reportDirectory();
    }

    public Optional<Path> write(BacktestResult result) throws IOException {
        if (reportDirectory.isBlank()) {
            return Optional.empty();
        }
        long start = result.events().isEmpty() ? 0L : result.events().get(0).timestamp().toEpochMilli();
        Path dir = Path.of(reportDirectory);
        Files.createDirectories(dir);
        Path file = dir.resolve(result.instrument() + "-" + start + ".json");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), result);
        log.info("[BacktestReport] Written. instrument={} path={} events={}",
                 result.instrument(), file, result.events().size());
        return Optional.of(file);
    }
}
