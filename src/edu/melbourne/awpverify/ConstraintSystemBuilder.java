/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.awpverify;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.log4j.Logger;

/**
 * Turns a simulated scenario and a masking spec into the conservation system
 * of the scenario. One row per (agent, object type) pair:
 * final - initial - sum(received) + sum(given) = 0.
 *
 * @author kafle
 */
public class ConstraintSystemBuilder {

    private static final Logger logger = Logger.getLogger(ConstraintSystemBuilder.class);

    /**
     * maps a masking target to the names of the variables it hides
     */
    interface TargetResolver {

        List<String> resolve(Scenario scenario, MaskTarget target);
    }

    private static final Map<MaskingType, TargetResolver> RESOLVERS = new EnumMap<>(MaskingType.class);

    static {
        RESOLVERS.put(MaskingType.NONE, new TargetResolver() {
            @Override
            public List<String> resolve(Scenario scenario, MaskTarget target) {
                return new ArrayList<>();
            }
        });
        RESOLVERS.put(MaskingType.INITIAL_COUNT, new TargetResolver() {
            @Override
            public List<String> resolve(Scenario scenario, MaskTarget target) {
                checkPair(scenario, target);
                List<String> names = new ArrayList<>();
                names.add(Variable.initialName(target.getAgent(), target.getObjectType()));
                return names;
            }
        });
        RESOLVERS.put(MaskingType.FINAL_COUNT, new TargetResolver() {
            @Override
            public List<String> resolve(Scenario scenario, MaskTarget target) {
                checkPair(scenario, target);
                List<String> names = new ArrayList<>();
                names.add(Variable.finalName(target.getAgent(), target.getObjectType()));
                return names;
            }
        });
        RESOLVERS.put(MaskingType.QUANTITY_SUBSTITUTION, new TargetResolver() {
            @Override
            public List<String> resolve(Scenario scenario, MaskTarget target) {
                List<String> names = new ArrayList<>();
                for (Integer id : target.getTransferIds()) {
                    Transfer t = id == null ? null : scenario.getTransfer(id);
                    if (t == null) {
                        throw new MaskingException("transfer " + id + " does not occur in scenario " + scenario.getScenarioId());
                    }
                    names.add(Variable.transferName(t));
                }
                return names;
            }
        });
    }

    private static void checkPair(Scenario scenario, MaskTarget target) {
        if (!scenario.hasAgent(target.getAgent())) {
            throw new MaskingException("agent " + target.getAgent() + " does not occur in scenario " + scenario.getScenarioId());
        }
        if (!scenario.hasObjectType(target.getObjectType())) {
            throw new MaskingException("object type " + target.getObjectType() + " does not occur in scenario " + scenario.getScenarioId());
        }
    }

    public ConstraintSystem build(Scenario scenario) {
        return build(scenario, MaskingSpec.none());
    }

    public ConstraintSystem build(Scenario scenario, MaskingSpec maskingSpec) {
        List<Variable> variables = new ArrayList<>();
        Map<String, Integer> knownValues = new LinkedHashMap<>();

        //the full cross product, zero counts included
        for (Agent agent : scenario.getAgents()) {
            for (String obj : scenario.getObjectTypes()) {
                Variable init = Variable.initial(agent.getName(), obj);
                Variable fin = Variable.finalCount(agent.getName(), obj);
                variables.add(init);
                variables.add(fin);
                knownValues.put(init.getName(), agent.getInitialCount(obj));
                knownValues.put(fin.getName(), agent.getFinalCount(obj));
            }
        }
        for (Transfer t : scenario.getTransfers()) {
            Variable tv = Variable.transfer(t);
            variables.add(tv);
            knownValues.put(tv.getName(), t.getQuantity());
        }

        List<String> masked = applyMasking(scenario, maskingSpec, variables, knownValues);
        double[][] matrix = buildMatrix(scenario, variables);
        double[] rhs = new double[matrix.length];

        logger.debug("built " + matrix.length + "x" + variables.size() + " system for scenario "
                + scenario.getScenarioId() + ", masked " + masked);
        return new ConstraintSystem(matrix, rhs, variables, knownValues, masked);
    }

    private List<String> applyMasking(Scenario scenario, MaskingSpec maskingSpec,
            List<Variable> variables, Map<String, Integer> knownValues) {
        List<String> masked = new ArrayList<>();
        for (MaskTarget target : maskingSpec.getTargets()) {
            TargetResolver resolver = RESOLVERS.get(target.getType());
            if (resolver == null) {
                throw new MaskingException("no resolver for masking type " + target.getType());
            }
            for (String name : resolver.resolve(scenario, target)) {
                if (masked.contains(name)) {
                    continue;
                }
                masked.add(name);
                knownValues.remove(name);
            }
        }
        for (int i = 0; i < variables.size(); i++) {
            if (masked.contains(variables.get(i).getName())) {
                variables.set(i, variables.get(i).withMasked());
            }
        }
        return masked;
    }

    private double[][] buildMatrix(Scenario scenario, List<Variable> variables) {
        Map<String, Integer> index = new LinkedHashMap<>();
        for (int i = 0; i < variables.size(); i++) {
            index.put(variables.get(i).getName(), i);
        }
        int rows = scenario.getAgents().size() * scenario.getObjectTypes().size();
        double[][] matrix = new double[rows][variables.size()];
        int row = 0;
        for (Agent agent : scenario.getAgents()) {
            for (String obj : scenario.getObjectTypes()) {
                matrix[row][index.get(Variable.finalName(agent.getName(), obj))] = 1;
                matrix[row][index.get(Variable.initialName(agent.getName(), obj))] = -1;
                for (Transfer t : scenario.getTransfers()) {
                    if (!t.getObjectType().equals(obj)) {
                        continue;
                    }
                    int col = index.get(Variable.transferName(t));
                    //a self transfer cancels out
                    if (t.getToAgent().equals(agent.getName())) {
                        matrix[row][col] -= 1;
                    }
                    if (t.getFromAgent().equals(agent.getName())) {
                        matrix[row][col] += 1;
                    }
                }
                row++;
            }
        }
        return matrix;
    }

    /**
     * Restricts the system to its masked columns, moving the known columns to
     * the right hand side: b' = b - A_known * x_known. Columns follow the order
     * of the masked variable list.
     *
     * @param system
     * @return the reduced system, empty when nothing is masked
     */
    public MaskedSystem extractMaskedSystem(ConstraintSystem system) {
        List<String> masked = system.getMaskedVariables();
        if (masked.isEmpty()) {
            return MaskedSystem.empty();
        }
        int m = system.getNumRows();
        int[] maskedCols = new int[masked.size()];
        for (int j = 0; j < maskedCols.length; j++) {
            maskedCols[j] = system.getVariableIndex(masked.get(j));
        }
        double[][] reduced = new double[m][maskedCols.length];
        double[] rhs = system.getRhs();
        Map<String, Integer> known = system.getKnownValues();
        for (int i = 0; i < m; i++) {
            for (int j = 0; j < maskedCols.length; j++) {
                reduced[i][j] = system.getCoefficient(i, maskedCols[j]);
            }
            for (int c = 0; c < system.getNumColumns(); c++) {
                Integer value = known.get(system.getVariables().get(c).getName());
                if (value != null) {
                    rhs[i] -= system.getCoefficient(i, c) * value;
                }
            }
        }
        return new MaskedSystem(reduced, rhs, masked);
    }
}
