package com.riansoft.robot_alloc.model;

import java.util.BitSet;

public class Robot {
    public final int id;
    private final BitSet skills;

    public Robot(int id, int[] skills) {
        this.id = id;
        this.skills = SkillVectors.toBitSet(skills);
    }

    public BitSet getSkills() {
        return (BitSet) skills.clone();
    }

    /**
     * 요구 벡터에서 1인 모든 위치에 이 로봇의 스킬도 1이면 true.
     */
    public boolean hasSkills(BitSet required) {
        BitSet missing = (BitSet) required.clone();
        missing.andNot(skills);
        return missing.isEmpty();
    }

    /**
     * 아직 충족되지 않은 스킬 중 이 로봇이 채울 수 있는 개수.
     */
    public int countCoverable(BitSet uncovered) {
        BitSet covered = (BitSet) uncovered.clone();
        covered.and(skills);
        return covered.cardinality();
    }

    @Override
    public String toString() {
        return "Robot{id=" + id + ", skills=" + skills + "}";
    }
}
