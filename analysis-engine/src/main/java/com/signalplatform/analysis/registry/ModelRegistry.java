package com.signalplatform.analysis.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalplatform.analysis.predictor.Predictor;
import com.signalplatform.analysis.predictor.PredictorDescriptor;
import com.signalplatform.analysis.predictor.PredictorFactory;
import com.signalplatform.common.exception.PredictorException;
import com.signalplatform.common.exception.SchemaMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Loads the model catalog and turns it into an ordered, validated predictor list.
 *
 * <p>Validation is all-or-nothing: a single incompatible entry rejects the whole catalog.
 * <ul>
 *   <li>schema id differs from the active feature schema → {@link SchemaMismatchException}</li>
 *   <li>model cannot score the active feature width       → {@link SchemaMismatchException}</li>
 *   <li>blank/duplicate id, negative base weight, non-positive timeout, bad params
 *       → {@link PredictorException}</li>
 * </ul>
 * Nothing is coerced.
 */
public class ModelRegistry {

    private static final Logger log = LoggerFactory.getLogger(ModelRegistry.class);

    private final ObjectMapper objectMapper;
    private final PredictorFactory factory;

    public ModelRegistry(ObjectMapper objectMapper, PredictorFactory factory) {
        this.objectMapper = objectMapper;
        this.factory      = factory;
    }

    public ModelCatalog read(InputStream in) throws IOException {
        return objectMapper.readValue(in, ModelCatalog.class);
    }

    /**
     * @param catalog        parsed catalog
     * @param activeSchemaId schema id the feature builder produces
     * @param featureCount   width of vectors the feature builder produces
     * @return predictors in catalog order
     */
    public List<Predictor> build(ModelCatalog catalog, String activeSchemaId, int featureCount) {
        Set<String> seen = new HashSet<>();
        List<Predictor> predictors = new ArrayList<>(catalog.predictors().size());
        for (PredictorDescriptor d : catalog.predictors()) {
            String id = d.id();
            if (id == null || id.isBlank()) {
                throw new PredictorException(String.valueOf(id), "registry entry without id");
            }
            if (!seen.add(id)) {
                throw new PredictorException(id, "duplicate predictor id in registry");
            }
            if (!activeSchemaId.equals(d.schemaId())) {
                throw new SchemaMismatchException(id, activeSchemaId, d.schemaId());
            }
            if (d.baseWeight() < 0.0 || Double.isNaN(d.baseWeight())) {
                throw new PredictorException(id, "baseWeight must be >= 0, got " + d.baseWeight());
            }
            if (d.timeoutMs() <= 0) {
                throw new PredictorException(id, "timeoutMs must be > 0, got " + d.timeoutMs());
            }
            Predictor predictor = factory.create(d);
            if (!predictor.acceptsWidth(featureCount)) {
                throw new SchemaMismatchException(id, activeSchemaId + "[" + featureCount + " features]",
                    d.schemaId() + "[model width " + predictor.inputWidth() + "]");
            }
            predictors.add(predictor);
        }
        log.info("[ModelRegistry] Catalog validated. version={} predictors={}",
                 catalog.version(), predictors.stream().map(Predictor::id).toList());
        return List.copyOf(predictors);
    }

    public List<Predictor> load(InputStream in, String activeSchemaId, int featureCount) throws IOException {
        return build(read(in), activeSchemaId, featureCount);
    }
}
