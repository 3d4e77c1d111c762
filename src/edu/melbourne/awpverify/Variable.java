/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.awpverify;

import java.util.Objects;

/**
 * One column of a constraint system. Identity is the name.
 *
 * @author kafle
 */
public class Variable {

    private final String name;
    private final VariableKind kind;
    private final String agent; //owner; the sender for transfer variables
    private final String objectType;
    private final Integer transferId; //null unless kind is TRANSFER
    private final boolean masked;

    public Variable(String name, VariableKind kind, String agent, String objectType, Integer transferId, boolean masked) {
        this.name = name;
        this.kind = kind;
        this.agent = agent;
        this.objectType = objectType;
        this.transferId = transferId;
        this.masked = masked;
    }

    public static Variable initial(String agent, String objectType) {
        return new Variable(initialName(agent, objectType), VariableKind.INITIAL, agent, objectType, null, false);
    }

    public static Variable finalCount(String agent, String objectType) {
        return new Variable(finalName(agent, objectType), VariableKind.FINAL, agent, objectType, null, false);
    }

    public static Variable transfer(Transfer t) {
        return new Variable(transferName(t), VariableKind.TRANSFER, t.getFromAgent(), t.getObjectType(), t.getTransferId(), false);
    }

    public static String initialName(String agent, String objectType) {
        return VariableKind.INITIAL.getPrefix() + "_" + escape(agent) + "_" + escape(objectType);
    }

    public static String finalName(String agent, String objectType) {
        return VariableKind.FINAL.getPrefix() + "_" + escape(agent) + "_" + escape(objectType);
    }

    public static String transferName(Transfer t) {
        return VariableKind.TRANSFER.getPrefix() + "_" + t.getTransferId() + "_" + escape(t.getFromAgent())
                + "_" + escape(t.getToAgent()) + "_" + escape(t.getObjectType());
    }

    /**
     * Percent-encodes '%' and '_' so that a name part never contains the
     * separator and distinct parts always give distinct names.
     */
    static String escape(String part) {
        return part.replace("%", "%25").replace("_", "%5F");
    }

    public Variable withMasked() {
        return masked ? this : new Variable(name, kind, agent, objectType, transferId, true);
    }

    public String getName() {
        return name;
    }

    public VariableKind getKind() {
        return kind;
    }

    public String getAgent() {
        return agent;
    }

    public String getObjectType() {
        return objectType;
    }

    public Integer getTransferId() {
        return transferId;
    }

    public boolean isMasked() {
        return masked;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Variable)) {
            return false;
        }
        return name.equals(((Variable) o).name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return masked ? name + "?" : name;
    }
}
