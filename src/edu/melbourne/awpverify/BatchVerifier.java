/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.awpverify;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.apache.log4j.Logger;

/**
 * Verifies many candidate questions on a fixed pool of workers. Candidates are
 * independent: every task builds its own system, and the SMT verifier opens a
 * fresh solver context per call.
 *
 * @author kafle
 */
public class BatchVerifier {

    private static final Logger logger = Logger.getLogger(BatchVerifier.class);

    private final UniquenessVerifier uniquenessVerifier;
    private final SMTVerifier smtVerifier; //null for linear algebra only
    private final int workers;

    public BatchVerifier(UniquenessVerifier uniquenessVerifier, SMTVerifier smtVerifier) {
        this.uniquenessVerifier = uniquenessVerifier;
        this.smtVerifier = smtVerifier;
        this.workers = uniquenessVerifier.getConfig().getWorkerThreads();
    }

    public static class Candidate {

        private final Scenario scenario;
        private final MaskingSpec maskingSpec;

        public Candidate(Scenario scenario, MaskingSpec maskingSpec) {
            this.scenario = scenario;
            this.maskingSpec = maskingSpec;
        }

        public Scenario getScenario() {
            return scenario;
        }

        public MaskingSpec getMaskingSpec() {
            return maskingSpec;
        }
    }

    public static class Outcome {

        private final Candidate candidate;
        private final VerificationResult verification;
        private final SMTResult smt;

        Outcome(Candidate candidate, VerificationResult verification, SMTResult smt) {
            this.candidate = candidate;
            this.verification = verification;
            this.smt = smt;
        }

        public Candidate getCandidate() {
            return candidate;
        }

        public VerificationResult getVerification() {
            return verification;
        }

        //null when the batch ran without an SMT verifier
        public SMTResult getSmt() {
            return smt;
        }

        //a question is kept only when its hidden quantities have exactly one answer
        public boolean isAccepted() {
            return verification.isSolvable() && verification.isUnique();
        }
    }

    /**
     * @return one outcome per candidate, in input order
     * @throws MaskingException if a candidate masks something its scenario
     * does not contain
     */
    public List<Outcome> verifyAll(List<Candidate> candidates) {
        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, Math.min(workers, candidates.size())));
        try {
            List<Future<Outcome>> futures = new ArrayList<>();
            for (final Candidate c : candidates) {
                futures.add(pool.submit(new Callable<Outcome>() {
                    @Override
                    public Outcome call() {
                        return verifyOne(c);
                    }
                }));
            }
            List<Outcome> outcomes = new ArrayList<>();
            for (Future<Outcome> f : futures) {
                outcomes.add(f.get());
            }
            logger.info("verified " + outcomes.size() + " candidates on " + workers + " workers");
            return outcomes;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("batch verification interrupted", ex);
        } catch (ExecutionException ex) {
            if (ex.getCause() instanceof RuntimeException) {
                throw (RuntimeException) ex.getCause();
            }
            throw new IllegalStateException("batch verification failed", ex.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    Outcome verifyOne(Candidate c) {
        ConstraintSystem system = new ConstraintSystemBuilder().build(c.getScenario(), c.getMaskingSpec());
        VerificationResult verification = uniquenessVerifier.verify(system);
        SMTResult smt = smtVerifier == null ? null : smtVerifier.verify(system);
        return new Outcome(c, verification, smt);
    }
}
