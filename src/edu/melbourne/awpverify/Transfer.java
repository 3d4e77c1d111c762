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
public class Transfer {

    private final String fromAgent;
    private final String toAgent;
    private final String objectType;
    private final int quantity;
    private final int transferId;

    public Transfer(String fromAgent, String toAgent, String objectType, int quantity, int transferId) {
        this.fromAgent = fromAgent;
        this.toAgent = toAgent;
        this.objectType = objectType;
        this.quantity = quantity;
        this.transferId = transferId;
    }

    public String getFromAgent() {
        return fromAgent;
    }

    public String getToAgent() {
        return toAgent;
    }

    public String getObjectType() {
        return objectType;
    }

    public int getQuantity() {
        return quantity;
    }

    public int getTransferId() {
        return transferId;
    }

    @Override
    public String toString() {
        return "Transfer{" + transferId + ": " + fromAgent + " -> " + toAgent + ", " + quantity + " " + objectType + "}";
    }
}
