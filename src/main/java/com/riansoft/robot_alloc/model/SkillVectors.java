package com.riansoft.robot_alloc.model;

import java.util.BitSet;

final class SkillVectors {

    private SkillVectors() {}

    static BitSet toBitSet(int[] vector) {
        BitSet bits = new BitSet(vector.length);
        for (int i = 0; i < vector.length; i++) {
            if (vector[i] == 1) {
                bits.set(i);
            }
        }
        return bits;
    }
}
