/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.awpverify;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static edu.melbourne.awpverify.Scenarios.MARBLE;
import static edu.melbourne.awpverify.Scenarios.inventory;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScenarioTest {

    @Test
    void simulateReplaysTransfersInOrder() {
        Scenario s = Scenarios.twoObjects();

        assertThat(s.getAgent("A").getFinalCount(MARBLE)).isEqualTo(4);
        assertThat(s.getAgent("B").getFinalCount(MARBLE)).isEqualTo(6);
        assertThat(s.getAgent("A").getFinalCount("apple")).isEqualTo(1);
        assertThat(s.getAgent("C").getFinalCount("apple")).isEqualTo(2);
        assertThat(s.getAgent("C").getInitialCount(MARBLE)).isZero();
        assertThat(s.getTotalTransfers()).isEqualTo(3);
    }

    @Test
    void lookupsReturnNullForUnknownNames() {
        Scenario s = Scenarios.marbles();

        assertThat(s.getAgent("Z")).isNull();
        assertThat(s.getTransfer(99)).isNull();
        assertThat(s.getTransfer(1).getQuantity()).isEqualTo(4);
        assertThat(s.hasObjectType(MARBLE)).isTrue();
    }

    @Test
    void rejectsDuplicateAgents() {
        Agent a = new Agent("A", inventory(MARBLE, 1), inventory(MARBLE, 1));
        assertThatThrownBy(() -> new Scenario(1, Arrays.asList(a, a), Collections.<Transfer>emptyList(),
                Collections.singletonList(MARBLE)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("duplicate agent");
    }

    @Test
    void rejectsTransfersBetweenUnknownAgents() {
        Agent a = new Agent("A", inventory(MARBLE, 1), inventory(MARBLE, 0));
        assertThatThrownBy(() -> new Scenario(1, Collections.singletonList(a),
                Collections.singletonList(new Transfer("A", "Z", MARBLE, 1, 1)), Collections.singletonList(MARBLE)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("unknown agent");
    }

    @Test
    void rejectsNegativeQuantitiesAndDuplicateIds() {
        Map<String, Map<String, Integer>> initial = new LinkedHashMap<>();
        initial.put("A", inventory(MARBLE, 3));
        initial.put("B", new HashMap<String, Integer>());

        assertThatThrownBy(() -> Scenario.simulate(1, Collections.singletonList(MARBLE), initial,
                Collections.singletonList(new Transfer("A", "B", MARBLE, -1, 1))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("negative");
        assertThatThrownBy(() -> Scenario.simulate(1, Collections.singletonList(MARBLE), initial,
                Arrays.asList(new Transfer("A", "B", MARBLE, 1, 1), new Transfer("B", "A", MARBLE, 1, 1))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("duplicate transfer id");
    }
}
