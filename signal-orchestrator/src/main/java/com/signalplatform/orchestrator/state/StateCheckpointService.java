package com.signalplatform.orchestrator.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalplatform.common.exception.SignalPlatformException;
import com.signalplatform.orchestrator.config.SignalPlatformProperties;
import com.signalplatform.orchestrator.pipeline.DecisionState;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * Loads the live reliability tables and risk budgets from a JSON checkpoint at startup
 * and writes them back periodically and on shutdown. Inactive unless
 * {@code signal.checkpoint.enabled} is set.
 */
@Service
public class StateCheckpointService {

    private static final Logger log = LoggerFactory.getLogger(StateCheckpointService.class);

    private final InstrumentStateArena arena;
    private final ObjectMapper objectMapper;
    private final SignalPlatformProperties.Checkpoint settings;

    public StateCheckpointService(InstrumentStateArena arena, ObjectMapper objectMapper,
                                  SignalPlatformProperties properties) {
        this.arena        = arena;
        this.objectMapper = objectMapper;
        this.settings     = properties.checkpoint();
    }

    @PostConstruct
    public void restore() {
        if (!settings.enabled()) return;
        Path path = Path.of(settings.path());
        if (!Files.exists(path)) {
            log.info("[Checkpoint] No checkpoint found, starting fresh. path={}", path);
            return;
        }
        StateCheckpoint checkpoint;
        try {
            checkpoint = objectMapper.readValue(path.toFile(), StateCheckpoint.class);
        } catch (IOException e) {
            throw new SignalPlatformException("unreadable state checkpoint at " + path, e);
        }
        apply(checkpoint);
        log.info("[Checkpoint] Restored. path={} savedAt={} instruments={}",
                 path, checkpoint.savedAt(), checkpoint.instruments().keySet());
    }

    @Scheduled(fixedDelayString = "${signal.checkpoint.interval:PT60S}",
               initialDelayString = "${signal.checkpoint.interval:PT60S}")
    public void scheduledSave() {
        if (!settings.enabled()) return;
        try {
            save();
        } catch (IOException e) {
            log.error("[Checkpoint] Periodic save failed, will retry next interval. path={} error={}",
                      settings.path(), e.getMessage(), e);
        }
    }

    @PreDestroy
    public void saveOnShutdown() throws IOException {
        if (!settings.enabled()) return;
        save();
    }

    /** Writes the current state to a temp file and moves it over the checkpoint. */
    public void save() throws IOException {
        StateCheckpoint checkpoint = capture();
        Path path = Path.of(settings.path()).toAbsolutePath();
        Files.createDirectories(path.getParent());
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), checkpoint);
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        log.debug("[Checkpoint] Saved. path={} instruments={}", path, checkpoint.instruments().size());
    }

    StateCheckpoint capture() {
        Map<String, StateCheckpoint.Entry> entries = new TreeMap<>();
        for (String instrument : arena.instruments()) {
            DecisionState state = arena.stateFor(instrument).decisionState();
            synchronized (state.riskBudget()) {
                entries.put(instrument, new StateCheckpoint.Entry(
                    state.reliabilities().snapshot(), state.riskBudget().snapshot()));
            }
        }
        return new StateCheckpoint(Instant.now(), entries);
    }

    void apply(StateCheckpoint checkpoint) {
        checkpoint.instruments().forEach((instrument, entry) -> {
            DecisionState state = arena.stateFor(instrument).decisionState();
            synchronized (state.riskBudget()) {
                if (entry.reliabilities() != null) state.reliabilities().restore(entry.reliabilities());
                if (entry.risk() != null)          state.riskBudget().restore(entry.risk());
            }
        });
    }
}
