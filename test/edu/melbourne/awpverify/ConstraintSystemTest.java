/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.awpverify;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConstraintSystemTest {

    private final List<Variable> vars = Arrays.asList(Variable.initial("A", "pen"), Variable.finalCount("A", "pen"));

    @Test
    void knownAndMaskedMustPartitionTheVariables() {
        Map<String, Integer> known = new HashMap<>();
        known.put("init_A_pen", 1);

        assertThatThrownBy(() -> new ConstraintSystem(new double[][]{{-1, 1}}, new double[]{0}, vars, known,
                Collections.<String>emptyList()))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("partition");

        known.put("final_A_pen", 1);
        assertThatThrownBy(() -> new ConstraintSystem(new double[][]{{-1, 1}}, new double[]{0}, vars, known,
                Collections.singletonList("final_A_pen")))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("both known and masked");
    }

    @Test
    void columnsMustMatchTheVariables() {
        Map<String, Integer> known = new HashMap<>();
        known.put("init_A_pen", 1);
        known.put("final_A_pen", 1);

        assertThatThrownBy(() -> new ConstraintSystem(new double[][]{{-1}}, new double[]{0}, vars, known,
                Collections.<String>emptyList()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void accessorsDoNotExposeInternalArrays() {
        ConstraintSystem system = new ConstraintSystemBuilder().build(Scenarios.marbles());

        system.getMatrix()[0][0] = 42;
        system.getRhs()[0] = 42;

        assertThat(system.getCoefficient(0, 0)).isEqualTo(-1.0);
        assertThat(system.getRhs()[0]).isZero();
        assertThat(system.getVariableIndex("nope")).isEqualTo(-1);
        assertThat(system.getVariable("nope")).isNull();
        assertThat(system.isMasked("init_A_marble")).isFalse();
    }
}
