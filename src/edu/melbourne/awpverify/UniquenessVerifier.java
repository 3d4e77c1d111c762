/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.awpverify;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import org.apache.log4j.Logger;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.SingularOps_DDRM;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.dense.row.factory.LinearSolverFactory_DDRM;
import org.ejml.interfaces.decomposition.QRPDecomposition_F64;
import org.ejml.interfaces.decomposition.SingularValueDecomposition_F64;
import org.ejml.interfaces.linsol.LinearSolverDense;

/**
 * Decides whether the masked quantities of a system can be deduced, and
 * whether exactly one assignment fits, from the ranks of the reduced matrix
 * and its augmented form. All thresholds use the configured tolerance.
 *
 * @author kafle
 */
public class UniquenessVerifier {

    private static final Logger logger = Logger.getLogger(UniquenessVerifier.class);

    private final VerifierConfig config;
    private final ConstraintSystemBuilder builder;

    public UniquenessVerifier() {
        this(VerifierConfig.defaults());
    }

    public UniquenessVerifier(VerifierConfig config) {
        this.config = config;
        this.builder = new ConstraintSystemBuilder();
    }

    public VerifierConfig getConfig() {
        return config;
    }

    public VerificationResult verify(ConstraintSystem system) {
        if (system.getMaskedVariables().isEmpty()) {
            return VerificationResult.trivial();
        }
        MaskedSystem masked = builder.extractMaskedSystem(system);
        if (masked.isEmpty()) {
            return VerificationResult.trivial();
        }
        VerificationResult result;
        try {
            result = analyze(masked);
        } catch (RuntimeException ex) {
            logger.error("numerical analysis failed for " + system + ": " + ex.getMessage(), ex);
            result = new VerificationResult(false, false, -1, OptionalDouble.empty(),
                    Collections.<Integer>emptyList(), "error: " + ex.getMessage());
        }
        logger.debug(Message.showVerification(system, result));
        return result;
    }

    public VerificationResult verifyScenario(Scenario scenario, MaskingSpec maskingSpec) {
        return verify(builder.build(scenario, maskingSpec));
    }

    VerificationResult analyze(MaskedSystem masked) {
        int m = masked.getNumRows();
        int n = masked.getNumColumns();
        DMatrixRMaj a = new DMatrixRMaj(masked.getMatrix());
        DMatrixRMaj ab = new DMatrixRMaj(m, n + 1);
        CommonOps_DDRM.insert(a, ab, 0, 0);
        double[] rhs = masked.getRhs();
        for (int i = 0; i < m; i++) {
            ab.set(i, n, rhs[i]);
        }

        double[] sigma = singularValues(a);
        int rankA = rank(sigma);
        int rankAb = rank(singularValues(ab));
        logger.debug("masked system " + m + "x" + n + ", rank(A)=" + rankA + ", rank(A|b)=" + rankAb);

        if (rankA != rankAb) {
            return new VerificationResult(false, false, rankA - Math.min(m, n), OptionalDouble.empty(),
                    Collections.<Integer>emptyList(), VerificationResult.INCONSISTENT);
        }
        int deficiency = n - rankA;
        boolean unique = deficiency == 0;

        OptionalDouble cond = OptionalDouble.empty();
        if (m == n && rankA == n) {
            cond = OptionalDouble.of(sigma[0] / sigma[sigma.length - 1]);
        }
        List<Integer> redundant = findRedundantRows(a);

        //redundant rows do not change the verdict of a unique system
        String message = unique ? VerificationResult.UNIQUE : VerificationResult.underDetermined(deficiency);
        return new VerificationResult(true, unique, deficiency, cond, redundant, message);
    }

    /**
     * singular values in descending order
     */
    double[] singularValues(DMatrixRMaj m) {
        SingularValueDecomposition_F64<DMatrixRMaj> svd = DecompositionFactory_DDRM.svd(m.numRows, m.numCols, false, false, true);
        if (!svd.decompose(m.copy())) {
            throw new IllegalStateException("singular value decomposition did not converge");
        }
        double[] s = Arrays.copyOf(svd.getSingularValues(), svd.numberOfSingularValues());
        Arrays.sort(s);
        for (int i = 0, j = s.length - 1; i < j; i++, j--) {
            double t = s[i];
            s[i] = s[j];
            s[j] = t;
        }
        return s;
    }

    int rank(double[] sigma) {
        int r = 0;
        for (double s : sigma) {
            if (s > config.getTolerance()) {
                r++;
            }
        }
        return r;
    }

    /**
     * Rows that are linear combinations of the other rows. Runs a column
     * pivoted QR on the transpose: pivots past the numerical rank are the
     * dependent rows. Only an over-determined matrix (m > n) reports any.
     */
    List<Integer> findRedundantRows(DMatrixRMaj a) {
        int m = a.numRows;
        int n = a.numCols;
        if (m <= n) {
            return Collections.emptyList();
        }
        DMatrixRMaj at = CommonOps_DDRM.transpose(a, null);
        QRPDecomposition_F64<DMatrixRMaj> qrp = DecompositionFactory_DDRM.qrp(n, m);
        qrp.setSingularThreshold(config.getTolerance());
        if (!qrp.decompose(at)) {
            logger.debug("pivoted QR failed, falling back to SVD null space");
            return redundantRowsBySvd(a);
        }
        DMatrixRMaj r = qrp.getR(null, true);
        int[] pivots = qrp.getColPivots();
        int rank = 0;
        while (rank < Math.min(r.numRows, r.numCols) && Math.abs(r.get(rank, rank)) > config.getTolerance()) {
            rank++;
        }
        List<Integer> redundant = new ArrayList<>();
        for (int i = rank; i < m; i++) {
            redundant.add(pivots[i]);
        }
        Collections.sort(redundant);
        return redundant;
    }

    //each left null space vector names the row it leans on most
    List<Integer> redundantRowsBySvd(DMatrixRMaj a) {
        SingularValueDecomposition_F64<DMatrixRMaj> svd = DecompositionFactory_DDRM.svd(a.numRows, a.numCols, true, false, false);
        if (!svd.decompose(a.copy())) {
            return Collections.emptyList();
        }
        DMatrixRMaj u = svd.getU(null, false);
        DMatrixRMaj w = svd.getW(null);
        SingularOps_DDRM.descendingOrder(u, false, w, null, false);
        int rank = 0;
        for (int i = 0; i < Math.min(w.numRows, w.numCols); i++) {
            if (w.get(i, i) > config.getTolerance()) {
                rank++;
            }
        }
        List<Integer> redundant = new ArrayList<>();
        for (int col = rank; col < a.numRows; col++) {
            int best = 0;
            for (int row = 1; row < a.numRows; row++) {
                if (Math.abs(u.get(row, col)) > Math.abs(u.get(best, col))) {
                    best = row;
                }
            }
            if (!redundant.contains(best)) {
                redundant.add(best);
            }
        }
        Collections.sort(redundant);
        return redundant;
    }

    /**
     * Deduces the masked values when they are uniquely determined.
     *
     * @param system
     * @return masked variable name to its deduced value, empty when the masked
     * quantities are not uniquely determined
     */
    public Map<String, Integer> solveUnique(ConstraintSystem system) {
        Map<String, Integer> values = new LinkedHashMap<>();
        VerificationResult result = verify(system);
        MaskedSystem masked = builder.extractMaskedSystem(system);
        if (!result.isSolvable() || !result.isUnique() || masked.isEmpty()) {
            return values;
        }
        DMatrixRMaj a = new DMatrixRMaj(masked.getMatrix());
        DMatrixRMaj b = new DMatrixRMaj(masked.getRhs().length, 1, true, masked.getRhs());
        DMatrixRMaj x = new DMatrixRMaj(a.numCols, 1);
        LinearSolverDense<DMatrixRMaj> solver = LinearSolverFactory_DDRM.leastSquares(a.numRows, a.numCols);
        if (!solver.setA(a)) {
            logger.warn("least squares solver rejected a full column rank matrix");
            return values;
        }
        solver.solve(b, x);
        for (int j = 0; j < a.numCols; j++) {
            values.put(masked.getVariableNames().get(j), (int) Math.round(x.get(j, 0)));
        }
        return values;
    }

    public List<String> suggestFixes(VerificationResult result) {
        List<String> suggestions = new ArrayList<>();
        if (!result.isSolvable()) {
            suggestions.add("System is inconsistent. Check for contradictory constraints.");
            suggestions.add("Verify that transfer quantities and inventories are compatible.");
        } else if (!result.isUnique() && result.getRankDeficiency() > 0) {
            suggestions.add("System is under-determined (" + result.getRankDeficiency() + " degrees of freedom).");
            suggestions.add("Mask fewer quantities or keep one more quantity of the same equation in the text.");
        }
        if (!result.getRedundantRows().isEmpty()) {
            suggestions.add("Redundant constraints at rows " + result.getRedundantRows() + ".");
        }
        if (result.getConditionNumber().isPresent()
                && result.getConditionNumber().getAsDouble() > config.getIllConditionThreshold()) {
            suggestions.add("System is ill-conditioned. Small changes may cause large solution changes.");
        }
        return suggestions;
    }

    /**
     * unique, solvable and, where a condition number is defined, not ill
     * conditioned
     */
    public boolean isWellPosed(ConstraintSystem system) {
        VerificationResult result = verify(system);
        if (!result.isSolvable() || !result.isUnique()) {
            return false;
        }
        OptionalDouble cond = result.getConditionNumber();
        return !cond.isPresent() || cond.getAsDouble() < config.getWellPosedConditionLimit();
    }
}
