/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.awpverify;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Result of the formal cross-check. The witness is the satisfying assignment
 * found by the solver; it is present whenever the system was satisfiable.
 *
 * @author kafle
 */
public class SMTResult {

    private final SmtStatus status;
    private final boolean satisfiable;
    private final boolean unique;
    private final Map<String, Integer> witness;
    private final long elapsedMillis;
    private final String diagnostic;

    SMTResult(SmtStatus status, boolean satisfiable, boolean unique, Map<String, Integer> witness,
            long elapsedMillis, String diagnostic) {
        this.status = status;
        this.satisfiable = satisfiable;
        this.unique = unique;
        this.witness = witness == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(witness));
        this.elapsedMillis = elapsedMillis;
        this.diagnostic = diagnostic;
    }

    public static SMTResult unavailable(String reason) {
        return new SMTResult(SmtStatus.UNAVAILABLE, false, false, null, 0, reason);
    }

    public static SMTResult sat(Map<String, Integer> witness, boolean unique, long elapsedMillis) {
        return new SMTResult(SmtStatus.SAT, true, unique, witness, elapsedMillis, null);
    }

    public static SMTResult unsat(long elapsedMillis) {
        return unsat(elapsedMillis, "system is unsatisfiable");
    }

    public static SMTResult unsat(long elapsedMillis, String reason) {
        return new SMTResult(SmtStatus.UNSAT, false, false, null, elapsedMillis, reason);
    }

    /**
     * @param witness the model of the first check when only the uniqueness
     * check was inconclusive, null otherwise
     */
    public static SMTResult unknown(Map<String, Integer> witness, long elapsedMillis, String reason) {
        return new SMTResult(SmtStatus.UNKNOWN, witness != null, false, witness, elapsedMillis, reason);
    }

    public static SMTResult error(long elapsedMillis, String reason) {
        return new SMTResult(SmtStatus.ERROR, false, false, null, elapsedMillis, reason);
    }

    public boolean isAvailable() {
        return status != SmtStatus.UNAVAILABLE;
    }

    public SmtStatus getStatus() {
        return status;
    }

    public boolean isSatisfiable() {
        return satisfiable;
    }

    public boolean isUnique() {
        return unique;
    }

    public Optional<Map<String, Integer>> getWitness() {
        return Optional.ofNullable(witness);
    }

    public long getElapsedMillis() {
        return elapsedMillis;
    }

    public Optional<String> getDiagnostic() {
        return Optional.ofNullable(diagnostic);
    }

    @Override
    public String toString() {
        return "SMTResult{status=" + status + ", satisfiable=" + satisfiable + ", unique=" + unique
                + ", time=" + elapsedMillis + " ms" + (diagnostic == null ? "" : ", diagnostic=" + diagnostic) + "}";
    }
}
