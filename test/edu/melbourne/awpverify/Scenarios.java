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
import java.util.List;
import java.util.Map;

/**
 * Small hand made scenarios shared by the tests.
 *
 * @author kafle
 */
final class Scenarios {

    static final String MARBLE = "marble";

    private Scenarios() {
    }

    static Map<String, Integer> inventory(String object, int count) {
        Map<String, Integer> m = new HashMap<>();
        m.put(object, count);
        return m;
    }

    /**
     * A holds 10 marbles, B none; A gives B 4 (transfer 1). Final: A=6, B=4.
     */
    static Scenario marbles() {
        Map<String, Map<String, Integer>> initial = new LinkedHashMap<>();
        initial.put("A", inventory(MARBLE, 10));
        initial.put("B", inventory(MARBLE, 0));
        return Scenario.simulate(1, Collections.singletonList(MARBLE), initial,
                Collections.singletonList(new Transfer("A", "B", MARBLE, 4, 1)));
    }

    /**
     * the marble exchange twice over: A gives B 4 (transfer 1), C gives D 4
     * (transfer 2)
     */
    static Scenario duplicatedMarbles() {
        Map<String, Map<String, Integer>> initial = new LinkedHashMap<>();
        initial.put("A", inventory(MARBLE, 10));
        initial.put("B", inventory(MARBLE, 0));
        initial.put("C", inventory(MARBLE, 10));
        initial.put("D", inventory(MARBLE, 0));
        List<Transfer> transfers = Arrays.asList(
                new Transfer("A", "B", MARBLE, 4, 1),
                new Transfer("C", "D", MARBLE, 4, 2));
        return Scenario.simulate(2, Collections.singletonList(MARBLE), initial, transfers);
    }

    /**
     * a single agent keeping 5 marbles, no transfers
     */
    static Scenario lonelyAgent() {
        Map<String, Map<String, Integer>> initial = new LinkedHashMap<>();
        initial.put("A", inventory(MARBLE, 5));
        return Scenario.simulate(3, Collections.singletonList(MARBLE), initial, Collections.<Transfer>emptyList());
    }

    /**
     * ground truth that breaks conservation: A ends with 7 after giving away
     * 4 of 10
     */
    static Scenario inconsistent() {
        List<Agent> agents = Arrays.asList(
                new Agent("A", inventory(MARBLE, 10), inventory(MARBLE, 7)),
                new Agent("B", inventory(MARBLE, 0), inventory(MARBLE, 4)));
        return new Scenario(4, agents, Collections.singletonList(new Transfer("A", "B", MARBLE, 4, 1)),
                Collections.singletonList(MARBLE));
    }

    /**
     * two object types, B never holds an apple and C only watches
     */
    static Scenario twoObjects() {
        Map<String, Map<String, Integer>> initial = new LinkedHashMap<>();
        Map<String, Integer> a = new HashMap<>();
        a.put(MARBLE, 8);
        a.put("apple", 3);
        initial.put("A", a);
        initial.put("B", inventory(MARBLE, 2));
        initial.put("C", new HashMap<String, Integer>());
        List<Transfer> transfers = Arrays.asList(
                new Transfer("A", "B", MARBLE, 5, 1),
                new Transfer("B", "A", MARBLE, 1, 2),
                new Transfer("A", "C", "apple", 2, 3));
        return Scenario.simulate(5, Arrays.asList(MARBLE, "apple"), initial, transfers);
    }
}
