package com.riansoft.robot_alloc.service;

import com.riansoft.robot_alloc.model.Coalition;
import com.riansoft.robot_alloc.model.ProblemInstance;
import com.riansoft.robot_alloc.model.Robot;
import com.riansoft.robot_alloc.model.ScheduleEntry;
import com.riansoft.robot_alloc.model.SchedulingResult;
import com.riansoft.robot_alloc.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 연합을 고려하는 탐욕적 리스트 스케줄러.
 * 매 반복마다 준비된(선행 작업이 모두 끝난) 작업들 중 가장 일찍 끝나는 배정 하나를 확정합니다.
 * 한 번 확정된 배정은 다시 바꾸지 않습니다.
 */
@Service
public class ListSchedulingService {

    private static final Logger log = LoggerFactory.getLogger(ListSchedulingService.class);

    private final GreedyCoalitionService greedyCoalitionService;
    private final ExactCoalitionService exactCoalitionService;
    private final CoalitionStrategy defaultStrategy;

    @Autowired
    public ListSchedulingService(GreedyCoalitionService greedyCoalitionService, ExactCoalitionService exactCoalitionService,
                                 @Value("${scheduler.coalition-strategy:greedy}") String defaultStrategy) {
        this.greedyCoalitionService = greedyCoalitionService;
        this.exactCoalitionService = exactCoalitionService;
        this.defaultStrategy = CoalitionStrategy.parse(defaultStrategy);
    }

    public SchedulingResult schedule(ProblemInstance problem) {
        return schedule(problem, defaultStrategy);
    }

    public SchedulingResult schedule(ProblemInstance problem, CoalitionStrategy strategy) {
        return schedule(problem, finderFor(strategy));
    }

    public CoalitionFinder finderFor(CoalitionStrategy strategy) {
        return strategy == CoalitionStrategy.EXACT ? exactCoalitionService : greedyCoalitionService;
    }

    /**
     * 주어진 연합 탐색기로 모든 실제 작업을 스케줄링합니다.
     * 어떤 준비 작업도 연합을 구성하지 못하면 그 시점에서 멈추고 부분 스케줄을 반환합니다.
     */
    public SchedulingResult schedule(ProblemInstance problem, CoalitionFinder coalitionFinder) {
        int numRobots = problem.getNumRobots();
        List<Robot> robots = problem.getRobots();

        // --- 실행 상태 (로봇 ID로 인덱싱) ---
        double[] robotAvailableTime = new double[numRobots];
        int[] robotCurrentLocation = new int[numRobots];
        Arrays.fill(robotCurrentLocation, ProblemInstance.DEPOT_ID); // 모든 로봇은 차고지에서 출발
        List<List<ScheduleEntry>> robotSchedules = new ArrayList<>(numRobots);
        for (int r = 0; r < numRobots; r++) {
            robotSchedules.add(new ArrayList<>());
        }

        List<Task> realTasks = problem.getRealTasks();
        List<Task> pending = new ArrayList<>(realTasks);
        Set<Integer> scheduledTaskIds = new HashSet<>();
        scheduledTaskIds.add(ProblemInstance.DEPOT_ID);
        Map<Integer, Double> taskFinishTimes = new HashMap<>();
        taskFinishTimes.put(ProblemInstance.DEPOT_ID, 0.0);

        // 연합은 작업과 전체 로봇 목록에만 의존하므로 실행당 작업마다 한 번만 구합니다.
        Coalition[] coalitionCache = new Coalition[problem.getNumTasks()];

        log.info("[SCHEDULER] 스케줄링 시작: 실제 작업 {}개, 로봇 {}대", realTasks.size(), numRobots);

        while (!pending.isEmpty()) {
            Candidate best = null;

            for (Task task : pending) {
                Set<Integer> predecessors = problem.getPredecessors(task.id);
                if (!scheduledTaskIds.containsAll(predecessors)) {
                    continue;
                }

                double maxPredFinish = 0.0;
                for (int p : predecessors) {
                    maxPredFinish = Math.max(maxPredFinish, taskFinishTimes.getOrDefault(p, 0.0));
                }

                Coalition coalition = coalitionCache[task.id];
                if (coalition == null) {
                    coalition = coalitionFinder.findCoalition(task, robots);
                    coalitionCache[task.id] = coalition;
                }
                if (!coalition.isFeasible()) {
                    log.debug("[SCHEDULER] 작업 {}: 가능한 연합 없음", task.id);
                    continue;
                }

                // 연합이 준비되는 시각 = 마지막 로봇이 작업 위치에 도착하는 시각
                double coalitionReadyTime = 0.0;
                for (Robot robot : coalition.getMembers()) {
                    double arrival = robotAvailableTime[robot.id]
                            + problem.getTravelTime(robotCurrentLocation[robot.id], task.id);
                    coalitionReadyTime = Math.max(coalitionReadyTime, arrival);
                }

                double startTime = Math.max(coalitionReadyTime, maxPredFinish);
                double finishTime = startTime + task.executionTime;

                if (best == null || finishTime < best.finishTime) {
                    best = new Candidate(task, coalition, startTime, finishTime);
                }
            }

            if (best == null) {
                List<Integer> stuck = pending.stream().map(t -> t.id).collect(Collectors.toList());
                log.warn("[SCHEDULER] 휴리스틱 실패: 남은 작업 {} 을(를) 수행할 수 있는 로봇 조합이 없습니다.", stuck);
                break;
            }

            for (Robot robot : best.coalition.getMembers()) {
                robotAvailableTime[robot.id] = best.finishTime;
                robotCurrentLocation[robot.id] = best.task.id;
                robotSchedules.get(robot.id).add(new ScheduleEntry(best.task.id, best.startTime, best.finishTime));
            }
            scheduledTaskIds.add(best.task.id);
            taskFinishTimes.put(best.task.id, best.finishTime);
            pending.remove(best.task);

            if (log.isDebugEnabled()) {
                log.debug("[SCHEDULER] 작업 {} 확정: 연합 {}, 시작 {}, 종료 {}",
                        best.task.id, best.coalition.getMemberIds(), best.startTime, best.finishTime);
            }
        }

        double makespan = 0.0;
        for (double t : robotAvailableTime) {
            makespan = Math.max(makespan, t);
        }

        List<Integer> unscheduled = pending.stream().map(t -> t.id).collect(Collectors.toList());
        log.info("[SCHEDULER] 스케줄링 종료: makespan {}, 미배정 작업 {}개", makespan, unscheduled.size());

        return new SchedulingResult(makespan, realTasks.size(), numRobots, robotSchedules, taskFinishTimes, unscheduled);
    }

    private static class Candidate {
        final Task task;
        final Coalition coalition;
        final double startTime;
        final double finishTime;

        Candidate(Task task, Coalition coalition, double startTime, double finishTime) {
            this.task = task;
            this.coalition = coalition;
            this.startTime = startTime;
            this.finishTime = finishTime;
        }
    }
}
