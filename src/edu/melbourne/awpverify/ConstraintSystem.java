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
 * Linear system A x = b over the inventory and transfer variables of one
 * scenario. Column i of A belongs to variables[i]; every variable is either
 * known (ground truth retained in the text) or masked. Instances are never
 * modified after construction.
 *
 * @author kafle
 */
public class ConstraintSystem {

    private final double[][] matrix;
    private final double[] rhs;
    private final List<Variable> variables;
    private final Map<String, Integer> knownValues;
    private final List<String> maskedVariables;
    private final Map<String, Integer> indexByName;

    public ConstraintSystem(double[][] matrix, double[] rhs, List<Variable> variables,
            Map<String, Integer> knownValues, List<String> maskedVariables) {
        this.matrix = copy(matrix);
        this.rhs = rhs.clone();
        this.variables = Collections.unmodifiableList(new ArrayList<>(variables));
        this.knownValues = Collections.unmodifiableMap(new LinkedHashMap<>(knownValues));
        this.maskedVariables = Collections.unmodifiableList(new ArrayList<>(maskedVariables));
        this.indexByName = new HashMap<>();
        checkInvariants();
    }

    private void checkInvariants() {
        if (matrix.length != rhs.length) {
            throw new IllegalArgumentException("matrix has " + matrix.length + " rows but rhs has " + rhs.length);
        }
        for (int i = 0; i < matrix.length; i++) {
            if (matrix[i].length != variables.size()) {
                throw new IllegalArgumentException("row " + i + " has " + matrix[i].length + " columns, expected " + variables.size());
            }
        }
        for (int i = 0; i < variables.size(); i++) {
            if (indexByName.put(variables.get(i).getName(), i) != null) {
                throw new IllegalArgumentException("duplicate variable " + variables.get(i).getName());
            }
        }
        Set<String> masked = new HashSet<>(maskedVariables);
        if (masked.size() != maskedVariables.size()) {
            throw new IllegalArgumentException("masked variables contain duplicates: " + maskedVariables);
        }
        for (String name : masked) {
            if (knownValues.containsKey(name)) {
                throw new IllegalArgumentException(name + " is both known and masked");
            }
        }
        Set<String> covered = new HashSet<>(knownValues.keySet());
        covered.addAll(masked);
        if (!covered.equals(indexByName.keySet())) {
            throw new IllegalArgumentException("known and masked variables do not partition the system variables");
        }
    }

    private static double[][] copy(double[][] m) {
        double[][] c = new double[m.length][];
        for (int i = 0; i < m.length; i++) {
            c[i] = m[i].clone();
        }
        return c;
    }

    public int getNumRows() {
        return matrix.length;
    }

    public int getNumColumns() {
        return variables.size();
    }

    public double[][] getMatrix() {
        return copy(matrix);
    }

    public double getCoefficient(int row, int column) {
        return matrix[row][column];
    }

    public double[] getRhs() {
        return rhs.clone();
    }

    public List<Variable> getVariables() {
        return variables;
    }

    public Map<String, Integer> getKnownValues() {
        return knownValues;
    }

    public List<String> getMaskedVariables() {
        return maskedVariables;
    }

    public boolean isMasked(String name) {
        return maskedVariables.contains(name);
    }

    /**
     * @return column of the variable, -1 when the system has no such variable
     */
    public int getVariableIndex(String name) {
        Integer i = indexByName.get(name);
        return i == null ? -1 : i;
    }

    public Variable getVariable(String name) {
        int i = getVariableIndex(name);
        return i < 0 ? null : variables.get(i);
    }

    @Override
    public String toString() {
        return "ConstraintSystem{" + matrix.length + "x" + variables.size() + ", masked=" + maskedVariables + "}";
    }
}
