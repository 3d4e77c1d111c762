/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.awpverify;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Outcome of the numerical analysis of a masked system. The condition number
 * is only present for square, full rank systems.
 *
 * @author kafle
 */
public class VerificationResult {

    public static final String UNIQUE = "unique";
    public static final String INCONSISTENT = "inconsistent";

    private final boolean solvable;
    private final boolean unique;
    private final int rankDeficiency;
    private final OptionalDouble conditionNumber;
    private final List<Integer> redundantRows;
    private final String message;

    public VerificationResult(boolean solvable, boolean unique, int rankDeficiency, OptionalDouble conditionNumber,
            List<Integer> redundantRows, String message) {
        this.solvable = solvable;
        this.unique = unique;
        this.rankDeficiency = rankDeficiency;
        this.conditionNumber = conditionNumber;
        this.redundantRows = Collections.unmodifiableList(new ArrayList<>(redundantRows));
        this.message = message;
    }

    static VerificationResult trivial() {
        return new VerificationResult(true, true, 0, OptionalDouble.empty(), Collections.<Integer>emptyList(), UNIQUE);
    }

    static String underDetermined(int degreesOfFreedom) {
        return "under-determined: " + degreesOfFreedom + " degrees of freedom";
    }

    public boolean isSolvable() {
        return solvable;
    }

    public boolean isUnique() {
        return unique;
    }

    public int getRankDeficiency() {
        return rankDeficiency;
    }

    public OptionalDouble getConditionNumber() {
        return conditionNumber;
    }

    public List<Integer> getRedundantRows() {
        return redundantRows;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "VerificationResult{solvable=" + solvable + ", unique=" + unique + ", rankDeficiency=" + rankDeficiency
                + ", cond=" + (conditionNumber.isPresent() ? String.valueOf(conditionNumber.getAsDouble()) : "undefined")
                + ", redundant=" + redundantRows + ", message=" + message + "}";
    }
}
