package com.riansoft.robot_alloc.model;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 하나의 작업을 함께 수행할 로봇 집합.
 * "로봇이 필요 없음"(EMPTY)과 "구성 불가"(INFEASIBLE)를 서로 구분합니다.
 */
public final class Coalition {

    public static final Coalition EMPTY = new Coalition(Collections.emptyList(), true);
    public static final Coalition INFEASIBLE = new Coalition(Collections.emptyList(), false);

    private final List<Robot> members;
    private final boolean feasible;

    private Coalition(List<Robot> members, boolean feasible) {
        this.members = members;
        this.feasible = feasible;
    }

    public static Coalition of(List<Robot> members) {
        if (members.isEmpty()) {
            return EMPTY;
        }
        return new Coalition(List.copyOf(members), true);
    }

    public boolean isFeasible() {
        return feasible;
    }

    public boolean isEmpty() {
        return feasible && members.isEmpty();
    }

    public List<Robot> getMembers() {
        return members;
    }

    public List<Integer> getMemberIds() {
        return members.stream().map(r -> r.id).collect(Collectors.toList());
    }

    public int size() {
        return members.size();
    }

    @Override
    public String toString() {
        if (!feasible) return "Coalition{INFEASIBLE}";
        return "Coalition" + getMemberIds();
    }
}
