package com.ddosshield.core.scoring;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Versioned, pre-trained model parameters as read from JSON.
 *
 * <pre>
 * {
 *   "id": "logistic", "version": "3.1.0", "type": "logistic",
 *   "features": ["packet_rate", "flag_syn"],
 *   "intercept": -2.0,
 *   "coefficients": {"packet_rate": 1.4, "flag_syn": 2.2},
 *   "means": {"packet_rate": 120.0, "flag_syn": 0.1},
 *   "stddevs": {"packet_rate": 80.0, "flag_syn": 0.2}
 * }
 * </pre>
 *
 * <p>
 * Which fields are used depends on {@link #getType()}: {@code logistic}
 * needs coefficients and standardization parameters, {@code deviation}
 * needs means and stddevs, {@code threshold} needs thresholds.
 * {@code params} carries optional model-specific tuning values.
 * </p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModelArtifact {

    private String id;
    private String version;
    private String type;
    private List<String> features = new ArrayList<>();
    private double intercept;
    private Map<String, Double> coefficients = new LinkedHashMap<>();
    private Map<String, Double> means = new LinkedHashMap<>();
    private Map<String, Double> stddevs = new LinkedHashMap<>();
    private Map<String, Double> thresholds = new LinkedHashMap<>();
    private Map<String, Double> params = new LinkedHashMap<>();

    /**
     * @param name param name
     * @param fallback value when the param is absent
     * @return param value or {@code fallback}
     */
    public double param(String name, double fallback) {
        Double v = params.get(name);
        return v != null ? v : fallback;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public List<String> getFeatures() {
        return features;
    }

    public void setFeatures(List<String> features) {
        this.features = features != null ? features : new ArrayList<>();
    }

    public double getIntercept() {
        return intercept;
    }

    public void setIntercept(double intercept) {
        this.intercept = intercept;
    }

    public Map<String, Double> getCoefficients() {
        return coefficients;
    }

    public void setCoefficients(Map<String, Double> coefficients) {
        this.coefficients = coefficients != null ? coefficients : new LinkedHashMap<>();
    }

    public Map<String, Double> getMeans() {
        return means;
    }

    public void setMeans(Map<String, Double> means) {
        this.means = means != null ? means : new LinkedHashMap<>();
    }

    public Map<String, Double> getStddevs() {
        return stddevs;
    }

    public void setStddevs(Map<String, Double> stddevs) {
        this.stddevs = stddevs != null ? stddevs : new LinkedHashMap<>();
    }

    public Map<String, Double> getThresholds() {
        return thresholds;
    }

    public void setThresholds(Map<String, Double> thresholds) {
        this.thresholds = thresholds != null ? thresholds : new LinkedHashMap<>();
    }

    public Map<String, Double> getParams() {
        return params;
    }

    public void setParams(Map<String, Double> params) {
        this.params = params != null ? params : new LinkedHashMap<>();
    }

    @Override
    public String toString() {
        return "ModelArtifact{id='" + id + "', version='" + version + "', type='" + type
                + "', features=" + features.size() + '}';
    }
}
