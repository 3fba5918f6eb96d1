package com.gas_supply_forecast.strategy;

import com.gas_supply_forecast.enumeration.AlgorithmEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import weka.classifiers.Classifier;
import weka.classifiers.functions.LinearRegression;
import weka.classifiers.lazy.IBk;
import weka.classifiers.meta.AdditiveRegression;
import weka.classifiers.trees.REPTree;
import weka.classifiers.trees.RandomForest;
import weka.core.SelectedTag;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Fixed catalog of regressor factories, one per {@link AlgorithmEnum}. Tree based regressors
 * use a fixed seed so refits on identical data are reproducible.
 */
@Component
@Slf4j
public class RegressorRegistry {

    public static final int SEED = 42;
    public static final int FOREST_TREES = 100;
    public static final int KNN_NEIGHBOURS = 5;
    public static final int BOOSTING_ITERATIONS = 100;
    public static final double BOOSTING_SHRINKAGE = 0.1;
    public static final int BOOSTING_TREE_DEPTH = 3;

    private final Map<AlgorithmEnum, RegressorFactory> factories;

    public RegressorRegistry() {
        Map<AlgorithmEnum, RegressorFactory> map = new EnumMap<>(AlgorithmEnum.class);
        map.put(AlgorithmEnum.LINEAR, RegressorRegistry::linear);
        map.put(AlgorithmEnum.POLYNOMIAL, PolynomialRegression::new);
        map.put(AlgorithmEnum.RANDOM_FOREST, RegressorRegistry::randomForest);
        map.put(AlgorithmEnum.KNN, () -> new IBk(KNN_NEIGHBOURS));
        map.put(AlgorithmEnum.DECISION_TREE, RegressorRegistry::decisionTree);
        map.put(AlgorithmEnum.GRADIENT_BOOSTING, RegressorRegistry::gradientBoosting);
        this.factories = Collections.unmodifiableMap(map);
    }

    public Set<AlgorithmEnum> algorithms() {
        return factories.keySet();
    }

    public RegressorFactory factory(AlgorithmEnum algorithm) {
        RegressorFactory factory = factories.get(algorithm);
        if (factory == null) {
            throw new IllegalArgumentException("No regressor registered for " + algorithm);
        }
        return factory;
    }

    public Classifier create(AlgorithmEnum algorithm) {
        Classifier classifier = factory(algorithm).create();
        log.debug("Created {} for {}", classifier.getClass().getSimpleName(), algorithm);
        return classifier;
    }

    static LinearRegression linear() {
        LinearRegression regression = new LinearRegression();
        regression.setAttributeSelectionMethod(
                new SelectedTag(LinearRegression.SELECTION_NONE, LinearRegression.TAGS_SELECTION));
        regression.setEliminateColinearAttributes(false);
        return regression;
    }

    static RandomForest randomForest() {
        RandomForest forest = new RandomForest();
        forest.setNumIterations(FOREST_TREES);
        forest.setSeed(SEED);
        forest.setNumExecutionSlots(1);
        return forest;
    }

    static REPTree decisionTree() {
        REPTree tree = new REPTree();
        tree.setNoPruning(true);
        tree.setMinNum(1);
        tree.setMinVarianceProp(0);
        tree.setSeed(SEED);
        return tree;
    }

    static AdditiveRegression gradientBoosting() {
        REPTree base = new REPTree();
        base.setMaxDepth(BOOSTING_TREE_DEPTH);
        base.setNoPruning(true);
        base.setSeed(SEED);

        AdditiveRegression boosting = new AdditiveRegression();
        boosting.setClassifier(base);
        boosting.setNumIterations(BOOSTING_ITERATIONS);
        boosting.setShrinkage(BOOSTING_SHRINKAGE);
        return boosting;
    }
}
