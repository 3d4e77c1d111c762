/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.awpverify;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * An agent of a scenario together with its ground-truth inventories.
 *
 * @author kafle
 */
public class Agent {

    private final String name;
    private final Map<String, Integer> initialInventory;
    private final Map<String, Integer> finalInventory;

    public Agent(String name, Map<String, Integer> initialInventory, Map<String, Integer> finalInventory) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("agent name must not be empty");
        }
        this.name = name;
        this.initialInventory = Collections.unmodifiableMap(new HashMap<>(initialInventory));
        this.finalInventory = Collections.unmodifiableMap(new HashMap<>(finalInventory));
    }

    public String getName() {
        return name;
    }

    public Map<String, Integer> getInitialInventory() {
        return initialInventory;
    }

    public Map<String, Integer> getFinalInventory() {
        return finalInventory;
    }

    //object types the agent never held count as 0
    public int getInitialCount(String objectType) {
        return initialInventory.getOrDefault(objectType, 0);
    }

    public int getFinalCount(String objectType) {
        return finalInventory.getOrDefault(objectType, 0);
    }

    @Override
    public String toString() {
        return "Agent{" + name + ", initial=" + initialInventory + ", final=" + finalInventory + "}";
    }
}
