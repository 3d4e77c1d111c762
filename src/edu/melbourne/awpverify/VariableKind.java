/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.awpverify;

/**
 *
 * @author kafle
 */
public enum VariableKind {
    INITIAL("init"),
    FINAL("final"),
    TRANSFER("transfer");

    private final String prefix;

    VariableKind(String prefix) {
        this.prefix = prefix;
    }

    //prefix of the variable names of this kind
    public String getPrefix() {
        return prefix;
    }
}
