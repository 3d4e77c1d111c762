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
 * One thing to hide: an inventory count of an (agent, object type) pair or the
 * quantities of a list of transfers.
 *
 * @author kafle
 */
public class MaskTarget {

    private final MaskingType type;
    private final String agent;
    private final String objectType;
    private final List<Integer> transferIds;

    private MaskTarget(MaskingType type, String agent, String objectType, List<Integer> transferIds) {
        this.type = type;
        this.agent = agent;
        this.objectType = objectType;
        this.transferIds = Collections.unmodifiableList(new ArrayList<>(transferIds));
    }

    public static MaskTarget initialCount(String agent, String objectType) {
        return new MaskTarget(MaskingType.INITIAL_COUNT, agent, objectType, Collections.<Integer>emptyList());
    }

    public static MaskTarget finalCount(String agent, String objectType) {
        return new MaskTarget(MaskingType.FINAL_COUNT, agent, objectType, Collections.<Integer>emptyList());
    }

    public static MaskTarget transfers(List<Integer> transferIds) {
        if (transferIds.isEmpty()) {
            throw new IllegalArgumentException("a transfer target needs at least one transfer id");
        }
        return new MaskTarget(MaskingType.QUANTITY_SUBSTITUTION, null, null, transferIds);
    }

    public MaskingType getType() {
        return type;
    }

    public String getAgent() {
        return agent;
    }

    public String getObjectType() {
        return objectType;
    }

    public List<Integer> getTransferIds() {
        return transferIds;
    }

    @Override
    public String toString() {
        if (type == MaskingType.QUANTITY_SUBSTITUTION) {
            return type + transferIds.toString();
        }
        return type + "(" + agent + ", " + objectType + ")";
    }
}
