/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.awpverify;

/**
 * Outcome of one SMT run. The failure kinds are kept apart: UNAVAILABLE is an
 * environment issue, UNKNOWN is inconclusive (timeout), UNSAT means no model
 * exists within the bounds (the diagnostic tells a bound violation apart from
 * a contradictory scenario) and ERROR is a solver failure.
 *
 * @author kafle
 */
public enum SmtStatus {
    UNAVAILABLE,
    SAT,
    UNSAT,
    UNKNOWN,
    ERROR;

    //SAT and UNSAT are the only conclusive answers
    public boolean isConclusive() {
        return this == SAT || this == UNSAT;
    }
}
