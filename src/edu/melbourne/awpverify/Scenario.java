/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.awpverify;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A fully simulated world: agents with ground-truth inventories, the object
 * types in play and the ordered transfer sequence between agents.
 *
 * @author kafle
 */
public class Scenario {

    private final int scenarioId;
    private final List<Agent> agents;
    private final List<Transfer> transfers;
    private final List<String> objectTypes;
    private final Map<String, Agent> agentsByName;
    private final Map<Integer, Transfer> transfersById;

    public Scenario(int scenarioId, List<Agent> agents, List<Transfer> transfers, List<String> objectTypes) {
        this.scenarioId = scenarioId;
        this.agents = Collections.unmodifiableList(new ArrayList<>(agents));
        this.transfers = Collections.unmodifiableList(new ArrayList<>(transfers));
        this.objectTypes = Collections.unmodifiableList(new ArrayList<>(objectTypes));
        this.agentsByName = new LinkedHashMap<>();
        this.transfersById = new LinkedHashMap<>();
        validate();
    }

    private void validate() {
        for (Agent a : agents) {
            if (agentsByName.put(a.getName(), a) != null) {
                throw new IllegalArgumentException("duplicate agent " + a.getName() + " in scenario " + scenarioId);
            }
        }
        Set<String> objects = new HashSet<>();
        for (String o : objectTypes) {
            if (!objects.add(o)) {
                throw new IllegalArgumentException("duplicate object type " + o + " in scenario " + scenarioId);
            }
        }
        for (Transfer t : transfers) {
            if (transfersById.put(t.getTransferId(), t) != null) {
                throw new IllegalArgumentException("duplicate transfer id " + t.getTransferId() + " in scenario " + scenarioId);
            }
            if (!agentsByName.containsKey(t.getFromAgent()) || !agentsByName.containsKey(t.getToAgent())) {
                throw new IllegalArgumentException("transfer " + t.getTransferId() + " references an unknown agent");
            }
            if (!objects.contains(t.getObjectType())) {
                throw new IllegalArgumentException("transfer " + t.getTransferId() + " references unknown object type " + t.getObjectType());
            }
            if (t.getQuantity() < 0) {
                throw new IllegalArgumentException("transfer " + t.getTransferId() + " has a negative quantity");
            }
        }
    }

    /**
     * Replays the transfers in order over the given initial inventories and
     * returns the scenario with the resulting final inventories as ground
     * truth.
     *
     * @param scenarioId
     * @param objectTypes
     * @param initialInventories agent name to (object type to count), in agent
     * order
     * @param transfers
     * @return
     */
    public static Scenario simulate(int scenarioId, List<String> objectTypes,
            Map<String, Map<String, Integer>> initialInventories, List<Transfer> transfers) {
        Map<String, Map<String, Integer>> current = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, Integer>> e : initialInventories.entrySet()) {
            current.put(e.getKey(), new HashMap<>(e.getValue()));
        }
        for (Transfer t : transfers) {
            Map<String, Integer> from = current.get(t.getFromAgent());
            Map<String, Integer> to = current.get(t.getToAgent());
            if (from == null || to == null) {
                throw new IllegalArgumentException("transfer " + t.getTransferId() + " references an unknown agent");
            }
            from.put(t.getObjectType(), count(from, t.getObjectType()) - t.getQuantity());
            to.put(t.getObjectType(), count(to, t.getObjectType()) + t.getQuantity());
        }
        List<Agent> agents = new ArrayList<>();
        for (Map.Entry<String, Map<String, Integer>> e : initialInventories.entrySet()) {
            agents.add(new Agent(e.getKey(), e.getValue(), current.get(e.getKey())));
        }
        return new Scenario(scenarioId, agents, transfers, objectTypes);
    }

    private static int count(Map<String, Integer> inventory, String objectType) {
        Integer c = inventory.get(objectType);
        return c == null ? 0 : c;
    }

    public int getScenarioId() {
        return scenarioId;
    }

    public List<Agent> getAgents() {
        return agents;
    }

    public List<Transfer> getTransfers() {
        return transfers;
    }

    public List<String> getObjectTypes() {
        return objectTypes;
    }

    public int getTotalTransfers() {
        return transfers.size();
    }

    public boolean hasAgent(String name) {
        return agentsByName.containsKey(name);
    }

    public boolean hasObjectType(String objectType) {
        return objectTypes.contains(objectType);
    }

    /**
     * @return the agent, null if the scenario has none with that name
     */
    public Agent getAgent(String name) {
        return agentsByName.get(name);
    }

    public Transfer getTransfer(int transferId) {
        return transfersById.get(transferId);
    }

    @Override
    public String toString() {
        return "Scenario{id=" + scenarioId + ", agents=" + agents.size() + ", objects=" + objectTypes
                + ", transfers=" + transfers.size() + "}";
    }
}
