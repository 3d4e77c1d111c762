/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.awpverify;

import java.util.Arrays;
import java.util.Map;
import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.Test;

import static edu.melbourne.awpverify.Scenarios.MARBLE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.assertj.core.api.Assertions.within;

class UniquenessVerifierTest {

    private final ConstraintSystemBuilder builder = new ConstraintSystemBuilder();
    private final UniquenessVerifier verifier = new UniquenessVerifier();

    @Test
    void nothingMaskedIsTriviallyUnique() {
        VerificationResult r = verifier.verify(builder.build(Scenarios.twoObjects()));

        assertThat(r.isSolvable()).isTrue();
        assertThat(r.isUnique()).isTrue();
        assertThat(r.getRankDeficiency()).isZero();
        assertThat(r.getConditionNumber()).isEmpty();
        assertThat(r.getMessage()).isEqualTo("unique");
    }

    @Test
    void maskedInitialCountIsDeducedFromFinalAndOutgoingTransfer() {
        ConstraintSystem system = builder.build(Scenarios.marbles(), MaskingSpec.initialCount("A", MARBLE));

        VerificationResult r = verifier.verify(system);

        assertThat(r.isSolvable()).isTrue();
        assertThat(r.isUnique()).isTrue();
        assertThat(r.getRankDeficiency()).isZero();
        //two rows, one unknown: B's equation does not mention it
        assertThat(r.getConditionNumber()).isEmpty();
        assertThat(r.getRedundantRows()).containsExactly(1);
        assertThat(r.getMessage()).isEqualTo("unique");
        assertThat(verifier.solveUnique(system)).containsExactly(entry("init_A_marble", 10));
    }

    @Test
    void hidingTheTransferAndBothEndsLeavesOneDegreeOfFreedom() {
        MaskingSpec spec = MaskingSpec.initialCount("A", MARBLE)
                .and(MaskingSpec.transfers(1))
                .and(MaskingSpec.finalCount("B", MARBLE));
        ConstraintSystem system = builder.build(Scenarios.marbles(), spec);

        VerificationResult r = verifier.verify(system);

        assertThat(r.isSolvable()).isTrue();
        assertThat(r.isUnique()).isFalse();
        assertThat(r.getRankDeficiency()).isEqualTo(1);
        assertThat(r.getMessage()).isEqualTo("under-determined: 1 degrees of freedom");
        assertThat(verifier.solveUnique(system)).isEmpty();
        assertThat(verifier.suggestFixes(r)).anyMatch(s -> s.contains("under-determined"));
    }

    @Test
    void twoUnknownsInOneEquationAreNotUnique() {
        MaskingSpec spec = MaskingSpec.initialCount("A", MARBLE).and(MaskingSpec.finalCount("A", MARBLE));

        VerificationResult r = verifier.verifyScenario(Scenarios.lonelyAgent(), spec);

        assertThat(r.isSolvable()).isTrue();
        assertThat(r.getRankDeficiency()).isEqualTo(1);
        assertThat(r.isUnique()).isFalse();
    }

    @Test
    void oneUnknownPerEquationIsUniqueAndWellConditioned() {
        MaskingSpec spec = MaskingSpec.initialCount("A", MARBLE).and(MaskingSpec.initialCount("B", MARBLE));
        ConstraintSystem system = builder.build(Scenarios.marbles(), spec);

        VerificationResult r = verifier.verify(system);

        assertThat(r.isUnique()).isTrue();
        assertThat(r.getMessage()).isEqualTo("unique");
        assertThat(r.getRedundantRows()).isEmpty();
        assertThat(r.getConditionNumber().getAsDouble()).isCloseTo(1.0, within(1e-9));
        assertThat(verifier.isWellPosed(system)).isTrue();
        Map<String, Integer> values = verifier.solveUnique(system);
        assertThat(values).containsEntry("init_A_marble", 10).containsEntry("init_B_marble", 0);
    }

    @Test
    void duplicatedSubScenarioReportsItsRowsAsRedundant() {
        ConstraintSystem system = builder.build(Scenarios.duplicatedMarbles(), MaskingSpec.transfers(1, 2));

        VerificationResult r = verifier.verify(system);

        assertThat(r.isUnique()).isTrue();
        assertThat(r.getRedundantRows()).hasSize(2);
        assertThat(r.getRedundantRows()).anyMatch(row -> row == 0 || row == 1);
        assertThat(r.getRedundantRows()).anyMatch(row -> row == 2 || row == 3);
        assertThat(r.getMessage()).isEqualTo("unique");
        assertThat(verifier.suggestFixes(r)).anyMatch(s -> s.startsWith("Redundant constraints"));
        assertThat(verifier.solveUnique(system)).containsEntry("transfer_1_A_B_marble", 4)
                .containsEntry("transfer_2_C_D_marble", 4);
    }

    @Test
    void contradictoryGroundTruthIsInconsistent() {
        VerificationResult r = verifier.verifyScenario(Scenarios.inconsistent(), MaskingSpec.finalCount("B", MARBLE));

        assertThat(r.isSolvable()).isFalse();
        assertThat(r.isUnique()).isFalse();
        assertThat(r.getRankDeficiency()).isZero();
        assertThat(r.getConditionNumber()).isEmpty();
        assertThat(r.getMessage()).isEqualTo("inconsistent");
        assertThat(verifier.suggestFixes(r)).first().asString().contains("inconsistent");
        assertThat(verifier.isWellPosed(builder.build(Scenarios.inconsistent(), MaskingSpec.finalCount("B", MARBLE))))
                .isFalse();
    }

    @Test
    void toleranceDrivesRankDecisions() {
        UniquenessVerifier coarse = new UniquenessVerifier(VerifierConfig.builder().tolerance(2.0).build());

        //sigma(A) = 1 falls under the tolerance while sigma([A|b]) ~ 10 does not
        VerificationResult r = coarse.verifyScenario(Scenarios.marbles(), MaskingSpec.initialCount("A", MARBLE));

        assertThat(r.isSolvable()).isFalse();
    }

    @Test
    void degenerateMatricesDoNotThrow() {
        UniquenessVerifier v = new UniquenessVerifier();
        MaskedSystem zeroRows = new MaskedSystem(new double[][]{{0, 0}, {0, 0}, {0, 0}}, new double[3],
                Arrays.asList("x", "y"));

        VerificationResult r = v.analyze(zeroRows);

        assertThat(r.isSolvable()).isTrue();
        assertThat(r.getRankDeficiency()).isEqualTo(2);
        assertThat(r.getRedundantRows()).containsExactly(0, 1, 2);
        assertThat(v.redundantRowsBySvd(new DMatrixRMaj(new double[][]{{1}, {1}})))
                .hasSize(1);
        assertThat(v.findRedundantRows(new DMatrixRMaj(new double[][]{{1, 0}, {0, 1}})))
                .isEmpty();
    }
}
