package com.signalplatform.orchestrator.backtest;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalplatform.common.exception.SignalPlatformException;
import com.signalplatform.common.model.MarketSnapshot;
import com.signalplatform.orchestrator.config.SignalPlatformProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * File-backed historical data: one JSON array of snapshots per instrument, stored as
 * {@code <dataDirectory>/<instrument>.json}.
 */
@Component
public class HistoricalSnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(HistoricalSnapshotStore.class);

    private static final Pattern INSTRUMENT = Pattern.compile("[A-Za-z0-9._-]+");
    private static final String SUFFIX = ".json";
    private static final TypeReference<List<MarketSnapshot>> SNAPSHOTS = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final Path directory;

    public HistoricalSnapshotStore(ObjectMapper objectMapper, SignalPlatformProperties properties) {
        this.objectMapper = objectMapper;
        this.directory    = Path.of(properties.backtest().dataDirectory());
    }

    /**
     * @throws IllegalArgumentException if the instrument name is not a plain file name
     * @throws NoSuchElementException   if no data file exists for the instrument
     */
    public List<MarketSnapshot> load(String instrument) {
        Path file = fileFor(instrument);
        if (!Files.isRegularFile(file)) {
            throw new NoSuchElementException("no historical data for " + instrument);
        }
        try {
            List<MarketSnapshot> snapshots = objectMapper.readValue(file.toFile(), SNAPSHOTS);
            log.debug("[SnapshotStore] Loaded. instrument={} snapshots={}", instrument, snapshots.size());
            return snapshots;
        } catch (IOException e) {
            throw new SignalPlatformException("unreadable historical data file " + file, e);
        }
    }

    public void save(String instrument, List<MarketSnapshot> snapshots) throws IOException {
        Path file = fileFor(instrument);
        Files.createDirectories(directory);
        objectMapper.writeValue(file.toFile(), snapshots);
    }

    /** Instruments with a data file, sorted. */
    public List<String> instruments() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files.map(p -> p.getFileName().toString())
                .filter(name -> name.endsWith(SUFFIX))
                .map(name -> name.substring(0, name.length() - SUFFIX.length()))
                .filter(name -> INSTRUMENT.matcher(name).matches())
                .sorted()
                .toList();
        } catch (IOException e) {
            throw new SignalPlatformException("cannot list historical data in " + directory, e);
        }
    }

    private Path fileFor(String instrument) {
        if (instrument == null || !INSTRUMENT.matcher(instrument).matches()) {
            throw new IllegalArgumentException("invalid instrument name: " + instrument);
        }
        return directory.resolve(instrument + SUFFIX);
    }
}
