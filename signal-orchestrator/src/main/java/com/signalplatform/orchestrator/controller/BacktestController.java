package com.signalplatform.orchestrator.controller;

import com.signalplatform.common.model.BacktestResult;
import com.signalplatform.common.model.MarketSnapshot;
import com.signalplatform.orchestrator.backtest.BacktestReplayer;
import com.signalplatform.orchestrator.backtest.BacktestReportWriter;
import com.signalplatform.orchestrator.backtest.HistoricalSnapshotStore;
import com.signalplatform.orchestrator.config.SignalPlatformProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@RestController
@RequestMapping("/api/v1/backtest")
public class BacktestController {

    private static final Logger log = LoggerFactory.getLogger(BacktestController.class);

    private final BacktestReplayer replayer;
    private final HistoricalSnapshotStore store;
    private final BacktestReportWriter reportWriter;
    private final SignalPlatformProperties.Backtest defaults;

    public BacktestController(BacktestReplayer replayer, HistoricalSnapshotStore store,
                              BacktestReportWriter reportWriter, SignalPlatformProperties properties) {
        this.replayer     = replayer;
        this.store        = store;
        this.reportWriter = reportWriter;
        this.defaults     = properties.backtest();
    }

    /** Replays several instruments in parallel. */
    @PostMapping
    public Mono<ResponseEntity<Map<String, BacktestResult>>> backtestAll(
            @RequestBody(required = false) BacktestRequest body) {
        BacktestRequest request = body == null ? BacktestRequest.empty() : body;
        return Mono.fromCallable(() -> resolveData(request))
            .subscribeOn(Schedulers.boundedElastic())
            .flatMap(data -> replayer.replayAll(data, seed(request), verify(request)))
            .flatMap(results -> Flux.fromIterable(results.values())
                .concatMap(this::writeReport)
                .then(Mono.just(results)))
            .map(ResponseEntity::ok);
    }

    /** Replays one instrument from inline snapshots or, without them, from the store. */
    @PostMapping("/{instrument}")
    public Mono<ResponseEntity<BacktestResult>> backtest(@PathVariable String instrument,
                                                         @RequestBody(required = false) BacktestRequest body) {
        BacktestRequest request = body == null ? BacktestRequest.empty() : body;
        return Mono.fromCallable(() -> {
                List<MarketSnapshot> snapshots = request.data() != null && request.data().containsKey(instrument)
                    ? request.data().get(instrument)
                    : store.load(instrument);
                return verify(request)
                    ? replayer.replayVerified(instrument, snapshots, seed(request))
                    : replayer.replay(instrument, snapshots, seed(request));
            })
            .subscribeOn(Schedulers.boundedElastic())
            .flatMap(this::writeReport)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    private Map<String, List<MarketSnapshot>> resolveData(BacktestRequest request) {
        if (request.data() != null && !request.data().isEmpty()) {
            return new TreeMap<>(request.data());
        }
        List<String> instruments = request.instruments() != null && !request.instruments().isEmpty()
            ? request.instruments()
            : store.instruments();
        Map<String, List<MarketSnapshot>> data = new TreeMap<>();
        for (String instrument : instruments) {
            data.put(instrument, store.load(instrument));
        }
        log.info("[BacktestController] Loaded stored data. instruments={}", data.keySet());
        return data;
    }

    private Mono<BacktestResult> writeReport(BacktestResult result) {
        return Mono.fromCallable(() -> {
                try {
                    reportWriter.write(result);
                } catch (IOException e) {
                    log.warn("[BacktestController] Report not written. instrument={} error={}",
                             result.instrument(), e.getMessage());
                }
                return result;
            })
            .subscribeOn(Schedulers.boundedElastic());
    }

    private boolean seed(BacktestRequest request) {
        return request.seedFromLive() != null ? request.seedFromLive() : defaults.seedFromLive();
    }

    private boolean verify(BacktestRequest request) {
        return request.verifyDeterminism() != null ? request.verifyDeterminism() : defaults.verifyDeterminism();
    }
}
