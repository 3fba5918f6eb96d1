package com.gas_supply_forecast.strategy;

import weka.classifiers.AbstractClassifier;
import weka.classifiers.functions.LinearRegression;
import weka.core.Attribute;
import weka.core.Capabilities;
import weka.core.DenseInstance;
import weka.core.Instance;
import weka.core.Instances;
import weka.core.SelectedTag;

import java.util.ArrayList;

/**
 * Least-squares fit of a cubic polynomial in a single numeric feature: the feature is
 * expanded to {@code x, x², x³} and a linear regression is fitted on the expansion.
 */
public class PolynomialRegression extends AbstractClassifier {

    private static final long serialVersionUID = 1L;

    private final int degree;
    private LinearRegression linearRegression;
    private Instances expandedHeader;
    private int featureIndex;

    public PolynomialRegression() {
        this(3);
    }

    public PolynomialRegression(int degree) {
        if (degree < 1) {
            throw new IllegalArgumentException("Polynomial degree must be at least 1");
        }
        this.degree = degree;
    }

    public int getDegree() {
        return degree;
    }

    @Override
    public Capabilities getCapabilities() {
        Capabilities result = super.getCapabilities();
        result.disableAll();
        result.enable(Capabilities.Capability.NUMERIC_ATTRIBUTES);
        result.enable(Capabilities.Capability.NUMERIC_CLASS);
        result.enable(Capabilities.Capability.MISSING_CLASS_VALUES);
        return result;
    }

    @Override
    public void buildClassifier(Instances data) throws Exception {
        getCapabilities().testWithFail(data);
        if (data.numAttributes() != 2) {
            throw new IllegalArgumentException("Polynomial regression expects exactly one feature, got "
                    + (data.numAttributes() - 1));
        }
        featureIndex = data.classIndex() == 0 ? 1 : 0;

        ArrayList<Attribute> attributes = new ArrayList<>();
        String featureName = data.attribute(featureIndex).name();
        for (int power = 1; power <= degree; power++) {
            attributes.add(new Attribute(power == 1 ? featureName : featureName + "^" + power));
        }
        attributes.add(new Attribute(data.classAttribute().name()));
        expandedHeader = new Instances(data.relationName() + "_poly" + degree, attributes, 0);
        expandedHeader.setClassIndex(degree);

        Instances expanded = new Instances(expandedHeader, data.numInstances());
        for (Instance instance : data) {
            if (instance.classIsMissing()) {
                continue;
            }
            expanded.add(expand(instance.value(featureIndex), instance.classValue()));
        }

        linearRegression = new LinearRegression();
        linearRegression.setAttributeSelectionMethod(
                new SelectedTag(LinearRegression.SELECTION_NONE, LinearRegression.TAGS_SELECTION));
        linearRegression.setEliminateColinearAttributes(false);
        linearRegression.buildClassifier(expanded);
    }

    @Override
    public double classifyInstance(Instance instance) throws Exception {
        if (linearRegression == null) {
            throw new IllegalStateException("Polynomial regression has not been trained");
        }
        Instance expanded = expand(instance.value(featureIndex), 0);
        expanded.setDataset(expandedHeader);
        expanded.setClassMissing();
        return linearRegression.classifyInstance(expanded);
    }

    private Instance expand(double x, double classValue) {
        double[] values = new double[degree + 1];
        double term = 1.0;
        for (int power = 1; power <= degree; power++) {
            term *= x;
            values[power - 1] = term;
        }
        values[degree] = classValue;
        return new DenseInstance(1.0, values);
    }

    @Override
    public String toString() {
        if (linearRegression == null) {
            return "PolynomialRegression: no model built yet.";
        }
        return "PolynomialRegression (degree " + degree + ")\n" + linearRegression;
    }
}
