package com.signalplatform.orchestrator.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.signalplatform.analysis.predictor.Predictor;
import com.signalplatform.common.model.MarketSnapshot;
import com.signalplatform.common.model.Regime;
import com.signalplatform.common.model.RegimeState;
import com.signalplatform.common.risk.RiskBudget;
import com.signalplatform.orchestrator.catalog.PredictorCatalog;
import com.signalplatform.orchestrator.pipeline.DecisionState;
import com.signalplatform.orchestrator.state.InstrumentState;
import com.signalplatform.orchestrator.state.InstrumentStateArena;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

@RestController
@RequestMapping("/api/v1/admin")
public class AdminController {

    public record ReloadResponse(
        @JsonProperty("version")    String version,
        @JsonProperty("predictors") List<String> predictors
    ) {}

    public record InstrumentStateView(
        @JsonProperty("instrument")      String instrument,
        @JsonProperty("regime")          RegimeState regime,
        @JsonProperty("candidateRegime") Regime candidateRegime,
        @JsonProperty("candidateStreak") int candidateStreak,
        @JsonProperty("reliabilities")   Map<String, Map<Regime, Double>> reliabilities,
        @JsonProperty("risk")            RiskBudget.Snapshot risk,
        @JsonProperty("historySize")     int historySize,
        @JsonProperty("lastTimestamp")   Instant lastTimestamp
    ) {}

    private final PredictorCatalog catalog;
    private final InstrumentStateArena arena;

    public AdminController(PredictorCatalog catalog, InstrumentStateArena arena) {
        this.catalog = catalog;
        this.arena   = arena;
    }

    /** Re-reads the model registry; on failure the previous predictor set stays active. */
    @PostMapping("/reload")
    public Mono<ResponseEntity<ReloadResponse>> reload() {
        return Mono.fromCallable(catalog::reload)
            .subscribeOn(Schedulers.boundedElastic())
            .map(set -> ResponseEntity.ok(new ReloadResponse(
                set.version(), set.predictors().stream().map(Predictor::id).toList())));
    }

    @GetMapping("/state/{instrument}")
    public ResponseEntity<InstrumentStateView> state(@PathVariable String instrument) {
        InstrumentState state = arena.find(instrument);
        if (state == null) {
            throw new NoSuchElementException("no live state for " + instrument);
        }
        DecisionState ds = state.decisionState();
        MarketSnapshot last = state.lastSnapshot();
        synchronized (ds.riskBudget()) {
            return ResponseEntity.ok(new InstrumentStateView(
                instrument,
                ds.regimeDetector().current(),
                ds.regimeDetector().candidate(),
                ds.regimeDetector().candidateStreak(),
                ds.reliabilities().snapshot(),
                ds.riskBudget().snapshot(),
                state.history().size(),
                last == null ? null : last.timestamp()));
        }
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
