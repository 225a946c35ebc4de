package com.jreinhal.assay.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Numeric grounding policy applied to generated answers.
 */
@Component
@ConfigurationProperties(prefix = "assay.grounding")
public class GroundingProperties {
    /**
     * Absolute difference under which an answer value counts as the same as an evidence value.
     */
    private double tolerance = 0.5;

    /**
     * Answers with more ungrounded values than this fail verification.
     */
    private int maxUngrounded = 2;

    /**
     * Integers up to this value are treated as counts or list numbering and ignored.
     */
    private int smallIntegerCeiling = 10;

    private int yearMin = 1900;

    private int yearMax = 2100;

    private boolean regenerationEnabled = true;

    public double getTolerance() {
        return tolerance;
    }

    public void setTolerance(double tolerance) {
        this.tolerance = tolerance;
    }

    public int getMaxUngrounded() {
        return maxUngrounded;
    }

    public void setMaxUngrounded(int maxUngrounded) {
        this.maxUngrounded = maxUngrounded;
    }

    public int getSmallIntegerCeiling() {
        return smallIntegerCeiling;
    }

    public void setSmallIntegerCeiling(int smallIntegerCeiling) {
        this.smallIntegerCeiling = smallIntegerCeiling;
    }

    public int getYearMin() {
        return yearMin;
    }

    public void setYearMin(int yearMin) {
        this.yearMin = yearMin;
    }

    public int getYearMax() {
        return yearMax;
    }

    public void setYearMax(int yearMax) {
        this.yearMax = yearMax;
    }

    public boolean isRegenerationEnabled() {
        return regenerationEnabled;
    }

    public void setRegenerationEnabled(boolean regenerationEnabled) {
        this.regenerationEnabled = regenerationEnabled;
    }
}
