/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.awpverify;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Tolerances and bounds shared by the verifiers. Immutable; build one with
 * {@link #builder()} or read it from a properties file.
 *
 * @author kafle
 */
public class VerifierConfig {

    public static final String RESOURCE = "verifier.properties";

    public static final double DEFAULT_TOLERANCE = 1e-10;
    public static final int DEFAULT_LOWER_BOUND = 0;
    public static final int DEFAULT_UPPER_BOUND = 1000; //realistic inventory ceiling
    public static final int DEFAULT_TIMEOUT_MILLIS = 10000;
    public static final double DEFAULT_ILL_CONDITION_THRESHOLD = 1e12;
    public static final double DEFAULT_WELL_POSED_CONDITION_LIMIT = 1e10;

    private final double tolerance;
    private final int lowerBound;
    private final int upperBound;
    private final int timeoutMillis;
    private final double illConditionThreshold;
    private final double wellPosedConditionLimit;
    private final int workerThreads;

    private VerifierConfig(Builder b) {
        if (!(b.tolerance > 0)) {
            throw new IllegalArgumentException("tolerance must be positive, was " + b.tolerance);
        }
        if (b.lowerBound > b.upperBound) {
            throw new IllegalArgumentException("lower bound " + b.lowerBound + " exceeds upper bound " + b.upperBound);
        }
        if (b.timeoutMillis <= 0) {
            throw new IllegalArgumentException("timeout must be positive, was " + b.timeoutMillis);
        }
        if (b.workerThreads < 0) {
            throw new IllegalArgumentException("worker threads must not be negative, was " + b.workerThreads);
        }
        this.tolerance = b.tolerance;
        this.lowerBound = b.lowerBound;
        this.upperBound = b.upperBound;
        this.timeoutMillis = b.timeoutMillis;
        this.illConditionThreshold = b.illConditionThreshold;
        this.wellPosedConditionLimit = b.wellPosedConditionLimit;
        this.workerThreads = b.workerThreads == 0 ? Runtime.getRuntime().availableProcessors() : b.workerThreads;
    }

    public static VerifierConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * reads {@value #RESOURCE} from the classpath, defaults when it is absent
     */
    public static VerifierConfig load() {
        Properties p = new Properties();
        try (InputStream in = VerifierConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                p.load(in);
            }
        } catch (IOException ex) {
            throw new IllegalArgumentException("cannot read " + RESOURCE, ex);
        }
        return fromProperties(p);
    }

    public static VerifierConfig fromProperties(Properties p) {
        Builder b = builder();
        try {
            b.tolerance(Double.parseDouble(p.getProperty("verifier.tolerance", String.valueOf(DEFAULT_TOLERANCE)).trim()));
            b.lowerBound(Integer.parseInt(p.getProperty("verifier.smt.lowerBound", String.valueOf(DEFAULT_LOWER_BOUND)).trim()));
            b.upperBound(Integer.parseInt(p.getProperty("verifier.smt.upperBound", String.valueOf(DEFAULT_UPPER_BOUND)).trim()));
            b.timeoutMillis(Integer.parseInt(p.getProperty("verifier.smt.timeoutMillis", String.valueOf(DEFAULT_TIMEOUT_MILLIS)).trim()));
            b.illConditionThreshold(Double.parseDouble(p.getProperty("verifier.illConditionThreshold", String.valueOf(DEFAULT_ILL_CONDITION_THRESHOLD)).trim()));
            b.wellPosedConditionLimit(Double.parseDouble(p.getProperty("verifier.wellPosedConditionLimit", String.valueOf(DEFAULT_WELL_POSED_CONDITION_LIMIT)).trim()));
            b.workerThreads(Integer.parseInt(p.getProperty("verifier.workerThreads", "0").trim()));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("malformed verifier property: " + ex.getMessage(), ex);
        }
        return b.build();
    }

    public double getTolerance() {
        return tolerance;
    }

    public int getLowerBound() {
        return lowerBound;
    }

    public int getUpperBound() {
        return upperBound;
    }

    public int getTimeoutMillis() {
        return timeoutMillis;
    }

    public double getIllConditionThreshold() {
        return illConditionThreshold;
    }

    public double getWellPosedConditionLimit() {
        return wellPosedConditionLimit;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public Builder toBuilder() {
        return builder().tolerance(tolerance).lowerBound(lowerBound).upperBound(upperBound)
                .timeoutMillis(timeoutMillis).illConditionThreshold(illConditionThreshold)
                .wellPosedConditionLimit(wellPosedConditionLimit).workerThreads(workerThreads);
    }

    @Override
    public String toString() {
        return "VerifierConfig{tolerance=" + tolerance + ", bounds=[" + lowerBound + ", " + upperBound
                + "], timeout=" + timeoutMillis + " ms, workers=" + workerThreads + "}";
    }

    public static class Builder {

        private double tolerance = DEFAULT_TOLERANCE;
        private int lowerBound = DEFAULT_LOWER_BOUND;
        private int upperBound = DEFAULT_UPPER_BOUND;
        private int timeoutMillis = DEFAULT_TIMEOUT_MILLIS;
        private double illConditionThreshold = DEFAULT_ILL_CONDITION_THRESHOLD;
        private double wellPosedConditionLimit = DEFAULT_WELL_POSED_CONDITION_LIMIT;
        private int workerThreads = 0;

        public Builder tolerance(double tolerance) {
            this.tolerance = tolerance;
            return this;
        }

        public Builder lowerBound(int lowerBound) {
            this.lowerBound = lowerBound;
            return this;
        }

        public Builder upperBound(int upperBound) {
            this.upperBound = upperBound;
            return this;
        }

        public Builder timeoutMillis(int timeoutMillis) {
            this.timeoutMillis = timeoutMillis;
            return this;
        }

        public Builder illConditionThreshold(double illConditionThreshold) {
            this.illConditionThreshold = illConditionThreshold;
            return this;
        }

        public Builder wellPosedConditionLimit(double wellPosedConditionLimit) {
            this.wellPosedConditionLimit = wellPosedConditionLimit;
            return this;
        }

        //0 selects one worker per available processor
        public Builder workerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }

        public VerifierConfig build() {
            return new VerifierConfig(this);
        }
    }
}
