package com.riansoft.robot_alloc.model;

import java.util.BitSet;

public class Task {
    public final int id;
    public final double executionTime;
    public final double x;
    public final double y;
    public final boolean dummy;
    private final BitSet requirements;

    public Task(int id, double executionTime, double x, double y, int[] requirements, boolean dummy) {
        this.id = id;
        this.executionTime = executionTime;
        this.x = x;
        this.y = y;
        this.dummy = dummy;
        this.requirements = SkillVectors.toBitSet(requirements);
    }

    /**
     * 요구 스킬 벡터를 복사본으로 반환합니다. (수정해도 원본에 영향 없음)
     */
    public BitSet getRequirements() {
        return (BitSet) requirements.clone();
    }

    @Override
    public String toString() {
        return "Task{id=" + id + ", executionTime=" + executionTime + ", requirements=" + requirements + (dummy ? ", dummy" : "") + "}";
    }
}
