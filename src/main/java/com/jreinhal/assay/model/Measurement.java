package com.jreinhal.assay.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * A single recorded value. {@code metric} is the normalized metric key; {@code sourceExcerpt}
 * is the passage of the source document the value was read from.
 */
@Document(collection = "measurements")
public class Measurement {

    @Id
    private String id;
    @Indexed
    private String experimentId;
    private String variantId;
    @Indexed
    private String metric;
    private String rawMetricName;
    private Double value;
    private String unit;
    private Double valueCanonical;
    private String unitCanonical;
    private String confidence;  // high, medium, low
    private String method;
    private String sourceExcerpt;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getExperimentId() {
        return experimentId;
    }

    public void setExperimentId(String experimentId) {
        this.experimentId = experimentId;
    }

    public String getVariantId() {
        return variantId;
    }

    public void setVariantId(String variantId) {
        this.variantId = variantId;
    }

    public String getMetric() {
        return metric;
    }

    public void setMetric(String metric) {
        this.metric = metric;
    }

    public String getRawMetricName() {
        return rawMetricName;
    }

    public void setRawMetricName(String rawMetricName) {
        this.rawMetricName = rawMetricName;
    }

    public Double getValue() {
        return value;
    }

    public void setValue(Double value) {
        this.value = value;
    }

    public String getUnit() {
        return unit;
    }

    public void setUnit(String unit) {
        this.unit = unit;
    }

    public Double getValueCanonical() {
        return valueCanonical;
    }

    public void setValueCanonical(Double valueCanonical) {
        this.valueCanonical = valueCanonical;
    }

    public String getUnitCanonical() {
        return unitCanonical;
    }

    public void setUnitCanonical(String unitCanonical) {
        this.unitCanonical = unitCanonical;
    }

    public String getConfidence() {
        return confidence;
    }

    public void setConfidence(String confidence) {
        this.confidence = confidence;
    }

    public String getMethod() {
        return method;
    }

    public void setMethod(String method) {
        this.method = method;
    }

    public String getSourceExcerpt() {
        return sourceExcerpt;
    }

    public void setSourceExcerpt(String sourceExcerpt) {
        this.sourceExcerpt = sourceExcerpt;
    }
}
