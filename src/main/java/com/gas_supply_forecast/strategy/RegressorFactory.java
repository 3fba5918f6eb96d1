package com.gas_supply_forecast.strategy;

import weka.classifiers.Classifier;

/**
 * Creates a fresh, untrained regressor. Every call returns a new instance configured the
 * same way, so two fits on the same data give the same model.
 */
@FunctionalInterface
public interface RegressorFactory {

    Classifier create();
}
