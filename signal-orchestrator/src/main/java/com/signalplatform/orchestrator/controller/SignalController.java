package com.signalplatform.orchestrator.controller;

import com.signalplatform.common.model.MarketSnapshot;
import com.signalplatform.common.model.TradeSignal;
import com.signalplatform.orchestrator.live.LiveDecisionService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/signals")
public class SignalController {

    private final LiveDecisionService liveDecisionService;

    public SignalController(LiveDecisionService liveDecisionService) {
        this.liveDecisionService = liveDecisionService;
    }

    @PostMapping("/decide")
    public Mono<ResponseEntity<TradeSignal>> decide(@Valid @RequestBody DecideRequest request) {
        List<MarketSnapshot> snapshots = request.snapshots();
        if (request.timestamp() != null) {
            // snapshots after the decision timestamp would be look-ahead
            snapshots = snapshots.stream().filter(s -> !s.timestamp().isAfter(request.timestamp())).toList();
            boolean hasTick = snapshots.stream().anyMatch(s -> s.timestamp().equals(request.timestamp()));
            if (!hasTick) {
                return Mono.error(new IllegalArgumentException(
                    "no snapshot at decision timestamp " + request.timestamp()));
            }
        }
        return liveDecisionService.submit(request.instrument(), snapshots).map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
