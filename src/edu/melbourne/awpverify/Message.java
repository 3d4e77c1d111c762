/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.awpverify;

import java.util.List;
import org.apache.log4j.PropertyConfigurator;

/**
 * One line summaries of verification outcomes for the logs.
 *
 * @author kafle
 */
public class Message {

    public static String showVerification(ConstraintSystem system, VerificationResult r) {
        String cond = r.getConditionNumber().isPresent() ? String.valueOf(r.getConditionNumber().getAsDouble()) : "undefined";
        return "{System=" + system.getNumRows() + "x" + system.getNumColumns() + ", Masked=" + system.getMaskedVariables()
                + ", Result=" + (r.isSolvable() ? (r.isUnique() ? "UNIQUE" : "NOT_UNIQUE") : "INCONSISTENT")
                + ", RankDeficiency=" + r.getRankDeficiency() + ", Cond=" + cond
                + ", Redundant=" + printRows(r.getRedundantRows()) + ", Message=" + r.getMessage() + "}";
    }

    public static String showSMT(SMTResult r) {
        String output = "{Result=" + r.getStatus() + ", Unique=" + r.isUnique() + ", Time=" + r.getElapsedMillis() + " ms";
        if (r.getWitness().isPresent()) {
            output += ", Model=" + r.getWitness().get();
        }
        if (r.getDiagnostic().isPresent()) {
            output += ", Diagnostic=" + r.getDiagnostic().get();
        }
        return output + "}";
    }

    public static String showComparison(ComparisonResult c) {
        String agreement;
        if (c.getAgreement().isPresent()) {
            agreement = c.getAgreement().get().isFull() ? "AGREE" : "DISAGREE " + c.getDisagreements();
        } else {
            agreement = "NOT_COMPARED";
        }
        return "{LA=" + c.getLinearAlgebra().getMessage() + ", SMT=" + c.getSmt().getStatus()
                + ", Agreement=" + agreement + "}";
    }

    public static String printRows(List<Integer> rows) {
        String output;
        output = "[";
        for (int i = 0; i < rows.size(); i++) {
            if (i != rows.size() - 1) {
                output = output + rows.get(i) + ", ";
            } else {
                output += rows.get(i);
            }
        }
        output += "]";
        return output;
    }

    /**
     * re-reads the log4j setup from a properties file, for runs that do not
     * want the one on the classpath
     */
    public static void configureLogger(String propertiesFile) {
        PropertyConfigurator.configure(propertiesFile);
    }

}
