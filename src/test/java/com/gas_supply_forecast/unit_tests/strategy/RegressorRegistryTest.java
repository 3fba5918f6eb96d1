package com.gas_supply_forecast.unit_tests.strategy;

import com.gas_supply_forecast.enumeration.AlgorithmEnum;
import com.gas_supply_forecast.strategy.PolynomialRegression;
import com.gas_supply_forecast.strategy.RegressorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import weka.classifiers.Classifier;
import weka.classifiers.functions.LinearRegression;
import weka.classifiers.lazy.IBk;
import weka.classifiers.meta.AdditiveRegression;
import weka.classifiers.trees.REPTree;
import weka.classifiers.trees.RandomForest;
import weka.core.Attribute;
import weka.core.DenseInstance;
import weka.core.Instance;
import weka.core.Instances;

import java.util.ArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class RegressorRegistryTest {

    private RegressorRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new RegressorRegistry();
    }

    @Test
    void catalogCoversEveryAlgorithm() {
        assertThat(registry.algorithms()).containsExactly(AlgorithmEnum.values());
    }

    @ParameterizedTest
    @EnumSource(AlgorithmEnum.class)
    void factoryReturnsFreshInstances(AlgorithmEnum algorithm) {
        Classifier first = registry.create(algorithm);
        Classifier second = registry.create(algorithm);

        assertThat(first).isNotSameAs(second);
        assertThat(first.getClass()).isEqualTo(second.getClass());
    }

    @Test
    void regressorsAreConfiguredAsDocumented() {
        assertThat(registry.create(AlgorithmEnum.LINEAR)).isInstanceOf(LinearRegression.class);
        assertThat(registry.create(AlgorithmEnum.POLYNOMIAL)).isInstanceOfSatisfying(PolynomialRegression.class,
                p -> assertThat(p.getDegree()).isEqualTo(3));
        assertThat(registry.create(AlgorithmEnum.RANDOM_FOREST)).isInstanceOfSatisfying(RandomForest.class, rf -> {
            assertThat(rf.getNumIterations()).isEqualTo(100);
            assertThat(rf.getSeed()).isEqualTo(42);
        });
        assertThat(registry.create(AlgorithmEnum.KNN)).isInstanceOfSatisfying(IBk.class,
                knn -> assertThat(knn.getKNN()).isEqualTo(5));
        assertThat(registry.create(AlgorithmEnum.DECISION_TREE)).isInstanceOfSatisfying(REPTree.class, tree -> {
            assertThat(tree.getNoPruning()).isTrue();
            assertThat(tree.getMinNum()).isEqualTo(1.0);
            assertThat(tree.getMinVarianceProp()).isZero();
            assertThat(tree.getSeed()).isEqualTo(42);
        });
        assertThat(registry.create(AlgorithmEnum.GRADIENT_BOOSTING)).isInstanceOfSatisfying(AdditiveRegression.class, gb -> {
            assertThat(gb.getNumIterations()).isEqualTo(100);
            assertThat(gb.getShrinkage()).isEqualTo(0.1);
            assertThat(gb.getClassifier()).isInstanceOf(REPTree.class);
        });
    }

    @ParameterizedTest
    @EnumSource(AlgorithmEnum.class)
    void refittingOnSameDataGivesIdenticalPredictions(AlgorithmEnum algorithm) throws Exception {
        Instances data = noisyCurve();

        Classifier first = registry.create(algorithm);
        first.buildClassifier(data);
        Classifier second = registry.create(algorithm);
        second.buildClassifier(data);

        Instance query = query(data, 7.5);
        assertThat(first.classifyInstance(query)).isEqualTo(second.classifyInstance(query));
    }

    @Test
    void decisionTreeGrowsUntilEveryTrainingRowIsReproduced() throws Exception {
        Instances data = noisyCurve();
        Classifier tree = registry.create(AlgorithmEnum.DECISION_TREE);
        tree.buildClassifier(data);

        for (int i = 0; i < data.numInstances(); i++) {
            Instance row = data.instance(i);
            assertThat(tree.classifyInstance(query(data, row.value(0)))).isEqualTo(row.classValue());
        }
    }

    private Instances noisyCurve() {
        ArrayList<Attribute> attributes = new ArrayList<>();
        attributes.add(new Attribute("avg_temp"));
        attributes.add(new Attribute("supply_m3"));
        Instances data = new Instances("curve", attributes, 60);
        data.setClassIndex(1);
        for (int i = 0; i < 60; i++) {
            double x = -5 + i * 0.5;
            double noise = ((i * 37) % 11 - 5) * 10.0;
            data.add(new DenseInstance(1.0, new double[]{x, 5000 - 120 * x + noise}));
        }
        return data;
    }

    private Instance query(Instances header, double x) {
        Instance instance = new DenseInstance(1.0, new double[]{x, 0});
        instance.setDataset(header);
        instance.setClassMissing();
        return instance;
    }
}
