package com.riansoft.robot_alloc.service;

import com.riansoft.robot_alloc.model.Coalition;
import com.riansoft.robot_alloc.model.Robot;
import com.riansoft.robot_alloc.model.Task;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * 탐욕적 집합 덮개(greedy set cover)로 연합을 구성합니다.
 * 최소 크기 연합을 보장하지는 않지만, 가능한 연합이 있으면 항상 찾아냅니다.
 */
@Service
public class GreedyCoalitionService implements CoalitionFinder {

    @Override
    public Coalition findCoalition(Task task, List<Robot> robots) {
        BitSet required = task.getRequirements();
        if (required.isEmpty()) {
            return Coalition.EMPTY; // 필요한 스킬 없음
        }

        // 1. 혼자서 모든 스킬을 가진 로봇이 있으면 ID 순으로 첫 번째 로봇을 사용합니다.
        for (Robot robot : robots) {
            if (robot.hasSkills(required)) {
                return Coalition.of(List.of(robot));
            }
        }

        // 2. 남은 스킬을 가장 많이 채우는 로봇을 하나씩 추가합니다.
        BitSet uncovered = (BitSet) required.clone();
        List<Robot> available = new ArrayList<>(robots);
        List<Robot> coalition = new ArrayList<>();

        while (!uncovered.isEmpty()) {
            Robot best = null;
            int bestCount = 0;
            for (Robot robot : available) {
                int count = robot.countCoverable(uncovered);
                if (count > bestCount) { // 동점이면 먼저 나온(ID가 낮은) 로봇 유지
                    bestCount = count;
                    best = robot;
                }
            }
            if (best == null) {
                return Coalition.INFEASIBLE;
            }
            coalition.add(best);
            uncovered.andNot(best.getSkills());
            available.remove(best);
        }
        return Coalition.of(coalition);
    }
}
