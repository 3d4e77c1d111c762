/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.awpverify;

import java.util.ArrayList;
import java.util.List;
import org.apache.log4j.Logger;

/**
 * Runs the numerical and the SMT verifier on the same system and reports
 * whether they agree. Meant for offline validation and fuzzing; SMT solving is
 * far too slow for the generation path. Disagreements are reported, never
 * resolved.
 *
 * @author kafle
 */
public class VerificationComparator {

    private static final Logger logger = Logger.getLogger(VerificationComparator.class);

    private final UniquenessVerifier uniquenessVerifier;
    private final SMTVerifier smtVerifier;

    public VerificationComparator(UniquenessVerifier uniquenessVerifier, SMTVerifier smtVerifier) {
        this.uniquenessVerifier = uniquenessVerifier;
        this.smtVerifier = smtVerifier;
    }

    public ComparisonResult compare(ConstraintSystem system) {
        VerificationResult la = uniquenessVerifier.verify(system);
        SMTResult smt = smtVerifier.verify(system);
        if (!smt.getStatus().isConclusive()) {
            logger.info("no comparison for " + system + ", SMT status " + smt.getStatus());
            return new ComparisonResult(la, smt, null, new ArrayList<String>());
        }
        List<String> disagreements = new ArrayList<>();
        boolean solvability = la.isSolvable() == smt.isSatisfiable();
        if (!solvability) {
            disagreements.add("solvable: linear algebra=" + la.isSolvable() + ", smt=" + smt.isSatisfiable());
        }
        boolean uniqueness = true;
        if (la.isSolvable() && smt.isSatisfiable()) {
            uniqueness = la.isUnique() == smt.isUnique();
            if (!uniqueness) {
                disagreements.add("unique: linear algebra=" + la.isUnique() + ", smt=" + smt.isUnique());
            }
        }
        ComparisonResult result = new ComparisonResult(la, smt, new ComparisonResult.Agreement(solvability, uniqueness), disagreements);
        if (!disagreements.isEmpty()) {
            logger.error("verifiers disagree on " + system + ": " + disagreements);
        } else {
            logger.debug(Message.showComparison(result));
        }
        return result;
    }
}
