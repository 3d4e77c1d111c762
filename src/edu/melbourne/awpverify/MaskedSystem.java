/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.awpverify;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The sub-system over the masked variables only: the masked columns of A and
 * the right hand side with every known contribution folded in.
 *
 * @author kafle
 */
public class MaskedSystem {

    private final double[][] matrix;
    private final double[] rhs;
    private final List<String> variableNames;

    public MaskedSystem(double[][] matrix, double[] rhs, List<String> variableNames) {
        this.matrix = copy(matrix);
        this.rhs = rhs.clone();
        this.variableNames = Collections.unmodifiableList(new ArrayList<>(variableNames));
    }

    public static MaskedSystem empty() {
        return new MaskedSystem(new double[0][0], new double[0], Collections.<String>emptyList());
    }

    private static double[][] copy(double[][] m) {
        double[][] c = new double[m.length][];
        for (int i = 0; i < m.length; i++) {
            c[i] = m[i].clone();
        }
        return c;
    }

    public double[][] getMatrix() {
        return copy(matrix);
    }

    public double[] getRhs() {
        return rhs.clone();
    }

    public List<String> getVariableNames() {
        return variableNames;
    }

    public int getNumRows() {
        return matrix.length;
    }

    public int getNumColumns() {
        return variableNames.size();
    }

    public boolean isEmpty() {
        return matrix.length == 0 || variableNames.isEmpty();
    }
}
