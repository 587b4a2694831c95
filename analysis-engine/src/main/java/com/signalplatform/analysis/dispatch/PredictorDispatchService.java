package com.signalplatform.analysis.dispatch;

import com.signalplatform.analysis.predictor.Predictor;
import com.signalplatform.analysis.predictor.PredictorDescriptor;
import com.signalplatform.common.exception.ModelTimeoutException;
import com.signalplatform.common.model.FeatureVector;
import com.signalplatform.common.model.PredictorResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Fans a feature vector out to every predictor and collects one {@link PredictorResult}
 * per predictor, in registry order.
 *
 * <p>The returned {@code Mono} completes once every predictor has answered, failed or
 * timed out; it never errors. Failures become failed results carrying the reason.
 */
public class PredictorDispatchService {

    private static final Logger log = LoggerFactory.getLogger(PredictorDispatchService.class);

    public Mono<List<PredictorResult>> dispatchAll(List<Predictor> predictors, FeatureVector features,
                                                   DispatchMode mode) {
        log.debug("[Dispatch] Dispatching {} predictors. instrument={} mode={}",
                  predictors.size(), features.instrument(), mode);
        Flux<Predictor> source = Flux.fromIterable(predictors);
        Flux<PredictorResult> results = mode == DispatchMode.CONCURRENT
            ? source.flatMapSequential(p -> call(p, features, mode))
            : source.concatMap(p -> call(p, features, mode));
        return results.collectList();
    }

    private Mono<PredictorResult> call(Predictor predictor, FeatureVector features, DispatchMode mode) {
        PredictorDescriptor d = predictor.descriptor();
        long started = System.nanoTime();

        Mono<PredictorResult> call = Mono.defer(() -> predictor.predict(features))
            .map(prediction -> PredictorResult.success(d.id(), d.baseWeight(), d.validRegimes(), prediction));
        if (mode == DispatchMode.CONCURRENT) {
            call = call.subscribeOn(Schedulers.boundedElastic())
                .timeout(d.timeout())
                .onErrorMap(TimeoutException.class, e -> new ModelTimeoutException(d.id(), d.timeout()));
        }

        return call
            .switchIfEmpty(Mono.fromSupplier(() ->
                PredictorResult.failed(d.id(), d.baseWeight(), d.validRegimes(), "no prediction emitted", false)))
            .doOnNext(r -> {
                if (r.responded()) {
                    log.debug("[Dispatch] Predictor complete. predictor={} direction={} confidence={} latencyMs={}",
                              d.id(), r.prediction().direction(), r.prediction().confidence(),
                              (System.nanoTime() - started) / 1_000_000);
                }
            })
            .onErrorResume(e -> {
                boolean timedOut = e instanceof ModelTimeoutException;
                log.warn("[Dispatch] Predictor failed. predictor={} instrument={} timedOut={} reason={}",
                         d.id(), features.instrument(), timedOut, e.getMessage());
                return Mono.just(PredictorResult.failed(d.id(), d.baseWeight(), d.validRegimes(),
                                                        e.getMessage(), timedOut));
            });
    }
}
