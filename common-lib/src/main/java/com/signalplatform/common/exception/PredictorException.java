package com.signalplatform.common.exception;

public class PredictorException extends SignalPlatformException {
    private final String predictorId;

    public PredictorException(String predictorId, String message) {
        super("[" + predictorId + "] " + message);
        this.predictorId = predictorId;
    }

    public PredictorException(String predictorId, String message, Throwable cause) {
        super("[" + predictorId + "] " + message, cause);
        this.predictorId = predictorId;
    }

    public String getPredictorId() {
        return predictorId;
    }
}
