package com.signalplatform.orchestrator.catalog;

import com.signalplatform.analysis.predictor.Predictor;
import com.signalplatform.analysis.registry.ModelCatalog;
import com.signalplatform.analysis.registry.ModelRegistry;
import com.signalplatform.common.exception.SignalPlatformException;
import com.signalplatform.common.feature.FeatureBuilder;
import com.signalplatform.orchestrator.config.SignalPlatformProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the active predictor set. Loaded once at construction, so an incompatible
 * registry aborts startup; afterwards replaced only by {@link #reload()}, atomically.
 * A cycle reads the set once and keeps that list for its whole run.
 */
@Component
public class PredictorCatalog {

    private static final Logger log = LoggerFactory.getLogger(PredictorCatalog.class);

    /** Validated registry contents. */
    public record ActiveSet(String version, List<Predictor> predictors) {
        public ActiveSet {
            predictors = List.copyOf(predictors);
        }
    }

    private final ModelRegistry registry;
    private final ResourceLoader resourceLoader;
    private final FeatureBuilder featureBuilder;
    private final String location;
    private final AtomicReference<ActiveSet> active = new AtomicReference<>();

    public PredictorCatalog(ModelRegistry registry, ResourceLoader resourceLoader,
                            FeatureBuilder featureBuilder, SignalPlatformProperties properties) {
        this.registry       = registry;
        this.resourceLoader = resourceLoader;
        this.featureBuilder = featureBuilder;
        this.location       = properties.registry().location();
        this.active.set(loadFromLocation());
    }

    public List<Predictor> predictors() {
        return active.get().predictors();
    }

    /** Predictors whose output depends on the inputs alone; the set a replay may use. */
    public List<Predictor> deterministicPredictors() {
        return active.get().predictors().stream().filter(Predictor::deterministic).toList();
    }

    public String version() {
        return active.get().version();
    }

    /**
     * Re-reads the registry and swaps the set. On any validation failure the previous set
     * stays active and the exception propagates.
     */
    public ActiveSet reload() {
        ActiveSet loaded = loadFromLocation();
        ActiveSet previous = active.getAndSet(loaded);
        log.info("[PredictorCatalog] Reloaded. previousVersion={} version={} predictors={}",
                 previous.version(), loaded.version(), loaded.predictors().size());
        return loaded;
    }

    private ActiveSet loadFromLocation() {
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            ModelCatalog catalog = registry.read(in);
            List<Predictor> predictors = registry.build(catalog, featureBuilder.schemaId(),
                                                        FeatureBuilder.FEATURE_COUNT);
            log.info("[PredictorCatalog] Registry loaded. location={} version={} predictors={}",
                     location, catalog.version(), predictors.size());
            return new ActiveSet(catalog.version(), predictors);
        } catch (IOException e) {
            throw new SignalPlatformException("cannot read model registry at " + location, e);
        }
    }
}
