/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.awpverify;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * What the rendered problem text leaves out. Specs are immutable; {@link #and}
 * returns a new spec with the extra targets appended.
 *
 * @author kafle
 */
public class MaskingSpec {

    private static final MaskingSpec NONE = new MaskingSpec(Collections.<MaskTarget>emptyList());

    private final List<MaskTarget> targets;

    private MaskingSpec(List<MaskTarget> targets) {
        this.targets = Collections.unmodifiableList(new ArrayList<>(targets));
    }

    public static MaskingSpec none() {
        return NONE;
    }

    public static MaskingSpec of(MaskTarget... targets) {
        return new MaskingSpec(Arrays.asList(targets));
    }

    public static MaskingSpec initialCount(String agent, String objectType) {
        return of(MaskTarget.initialCount(agent, objectType));
    }

    public static MaskingSpec finalCount(String agent, String objectType) {
        return of(MaskTarget.finalCount(agent, objectType));
    }

    public static MaskingSpec transfers(Integer... transferIds) {
        return of(MaskTarget.transfers(Arrays.asList(transferIds)));
    }

    public MaskingSpec and(MaskingSpec other) {
        List<MaskTarget> all = new ArrayList<>(targets);
        all.addAll(other.targets);
        return new MaskingSpec(all);
    }

    public List<MaskTarget> getTargets() {
        return targets;
    }

    public boolean isEmpty() {
        return targets.isEmpty();
    }

    //type of the first target, used when a single label is needed for reporting
    public MaskingType getPrimaryType() {
        return targets.isEmpty() ? MaskingType.NONE : targets.get(0).getType();
    }

    @Override
    public String toString() {
        return "MaskingSpec" + targets;
    }
}
