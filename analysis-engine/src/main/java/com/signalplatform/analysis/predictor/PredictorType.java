package com.signalplatform.analysis.predictor;

/**
 * Model families a registry entry may declare.
 */
public enum PredictorType {
    STATISTICAL,
    TREE_ENSEMBLE,
    NEURAL_NETWORK,
    EXTERNAL_ADVISORY
}
