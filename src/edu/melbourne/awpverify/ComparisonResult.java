/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.awpverify;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 *
 * @author kafle
 */
public class ComparisonResult {

    private final VerificationResult linearAlgebra;
    private final SMTResult smt;
    private final Agreement agreement; //null when the SMT answer is not conclusive
    private final List<String> disagreements;

    public ComparisonResult(VerificationResult linearAlgebra, SMTResult smt, Agreement agreement, List<String> disagreements) {
        this.linearAlgebra = linearAlgebra;
        this.smt = smt;
        this.agreement = agreement;
        this.disagreements = Collections.unmodifiableList(new ArrayList<>(disagreements));
    }

    public VerificationResult getLinearAlgebra() {
        return linearAlgebra;
    }

    public SMTResult getSmt() {
        return smt;
    }

    public Optional<Agreement> getAgreement() {
        return Optional.ofNullable(agreement);
    }

    public List<String> getDisagreements() {
        return disagreements;
    }

    public boolean isConsistent() {
        return disagreements.isEmpty();
    }

    public static class Agreement {

        private final boolean solvability;
        private final boolean uniqueness;

        public Agreement(boolean solvability, boolean uniqueness) {
            this.solvability = solvability;
            this.uniqueness = uniqueness;
        }

        public boolean isSolvability() {
            return solvability;
        }

        public boolean isUniqueness() {
            return uniqueness;
        }

        public boolean isFull() {
            return solvability && uniqueness;
        }
    }
}
