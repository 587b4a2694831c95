package com.signalplatform.common.exception;

/**
 * A feature vector (or registry entry) does not match the schema a predictor expects.
 * This is a configuration error and is raised at startup validation or catalog reload.
 */
public class SchemaMismatchException extends SignalPlatformException {

    private final String predictorId;
    private final String expectedSchema;
    private final String actualSchema;

    public SchemaMismatchException(String predictorId, String expectedSchema, String actualSchema) {
        super("Schema mismatch for predictor=" + predictorId
              + ": expected=" + expectedSchema + " actual=" + actualSchema);
        this.predictorId    = predictorId;
        this.expectedSchema = expectedSchema;
        this.actualSchema   = actualSchema;
    }

    public String getPredictorId() {
        return predictorId;
    }

    public String getExpectedSchema() {
        return expectedSchema;
    }

    public String getActualSchema() {
        return actualSchema;
    }
}
