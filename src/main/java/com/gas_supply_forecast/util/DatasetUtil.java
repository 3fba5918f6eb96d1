package com.gas_supply_forecast.util;

import com.gas_supply_forecast.dto.record.EnrichedRecord;
import com.gas_supply_forecast.enumeration.PredictionTaskEnum;
import com.gas_supply_forecast.enumeration.TargetUnitEnum;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import weka.core.Attribute;
import weka.core.DenseInstance;
import weka.core.Instance;
import weka.core.Instances;

import java.util.ArrayList;
import java.util.List;

/**
 * Conversions between daily records and the Weka tables the regressors are fitted on.
 */
public class DatasetUtil {
    private static final Logger logger = LoggerFactory.getLogger(DatasetUtil.class);

    private DatasetUtil() {
    }

    /**
     * Empty numeric schema: the task's feature columns followed by the unit's target column,
     * with the class index on the target.
     */
    public static Instances buildHeader(PredictionTaskEnum task, TargetUnitEnum unit) {
        ArrayList<Attribute> attributes = new ArrayList<>();
        for (String feature : task.getFeatureColumns()) {
            attributes.add(new Attribute(feature));
        }
        attributes.add(new Attribute(unit.getColumn()));

        Instances header = new Instances(task.name() + "_" + unit.name(), attributes, 0);
        header.setClassIndex(header.numAttributes() - 1);
        return header;
    }

    /**
     * Builds the training table for one target unit. Every record must already carry the
     * task's required columns.
     */
    public static Instances toInstances(List<EnrichedRecord> records, PredictionTaskEnum task, TargetUnitEnum unit) {
        Instances data = new Instances(buildHeader(task, unit), records.size());
        List<String> features = task.getFeatureColumns();

        for (EnrichedRecord record : records) {
            double[] values = new double[features.size() + 1];
            for (int i = 0; i < features.size(); i++) {
                values[i] = record.value(features.get(i));
            }
            values[features.size()] = record.value(unit.getColumn());
            data.add(new DenseInstance(1.0, values));
        }

        logger.debug("Built {} instances for {} / {}", data.numInstances(), task, unit);
        return data;
    }

    /**
     * Instance with the given feature values and a missing class value, attached to the header.
     */
    public static Instance toPredictionInstance(Instances header, double... features) {
        if (features.length != header.numAttributes() - 1) {
            throw new IllegalArgumentException("Expected " + (header.numAttributes() - 1)
                    + " feature values but got " + features.length);
        }
        double[] values = new double[header.numAttributes()];
        System.arraycopy(features, 0, values, 0, features.length);

        Instance instance = new DenseInstance(1.0, values);
        instance.setDataset(header);
        instance.setClassMissing();
        return instance;
    }
}
