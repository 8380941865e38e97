package com.riansoft.robot_alloc.service;

import com.riansoft.robot_alloc.ProblemFixtures;
import com.riansoft.robot_alloc.model.ProblemInstance;
import com.riansoft.robot_alloc.model.Robot;
import com.riansoft.robot_alloc.model.ScheduleEntry;
import com.riansoft.robot_alloc.model.SchedulingResult;
import com.riansoft.robot_alloc.model.Task;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ListSchedulingServiceTest {

    private final ListSchedulingService scheduler =
            new ListSchedulingService(new GreedyCoalitionService(), new ExactCoalitionService(), "greedy");

    private static void assertEntry(ScheduleEntry entry, int taskId, double start, double end) {
        assertEquals(taskId, entry.taskId);
        assertEquals(start, entry.startTime, 1e-9);
        assertEquals(end, entry.endTime, 1e-9);
    }

    @Test
    @DisplayName("단일 로봇 작업: 차고지에서 이동한 뒤 시작하고 makespan 은 그 종료 시각이다")
    void singleRobotSingleTask() {
        ProblemInstance problem = ProblemFixtures.withSkills(1)
                .task(5, 1)
                .robot(1).robot(0)
                .travel(0, 1, 2)
                .build();

        SchedulingResult result = scheduler.schedule(problem);

        assertTrue(result.isComplete());
        assertEquals(7.0, result.getMakespan(), 1e-9);
        assertEquals(1, result.getNumTasks());
        assertEquals(2, result.getNumRobots());
        assertEquals(1, result.getRobotSchedule(0).size());
        assertEntry(result.getRobotSchedule(0).get(0), 1, 2, 7);
        assertTrue(result.getRobotSchedule(1).isEmpty());
    }

    @Test
    @DisplayName("연합 작업은 마지막 로봇이 도착한 뒤 시작하고 모든 구성원의 스케줄에 기록된다")
    void coalitionWaitsForLastArrival() {
        // 로봇0은 1번 작업을 마친 뒤 2번 위치로 이동하므로 로봇1보다 늦게 도착한다
        ProblemInstance problem = ProblemFixtures.withSkills(2)
                .task(6, 1, 0)
                .task(4, 1, 1)
                .robot(1, 0).robot(0, 1)
                .defaultTravel(1)
                .travel(1, 2, 3)
                .precedence(1, 2)
                .build();

        SchedulingResult result = scheduler.schedule(problem);

        assertEntry(result.getRobotSchedule(0).get(0), 1, 1, 7);
        // 로봇0 도착 = 7 + 3 = 10, 로봇1 도착 = 0 + 1 = 1
        assertEntry(result.getRobotSchedule(0).get(1), 2, 10, 14);
        assertEquals(1, result.getRobotSchedule(1).size());
        assertEntry(result.getRobotSchedule(1).get(0), 2, 10, 14);
        assertEquals(14.0, result.getMakespan(), 1e-9);
    }

    @Test
    @DisplayName("어떤 로봇도 가지지 않은 스킬이 필요하면 그 작업과 후행 작업은 미배정으로 남는다")
    void stallsWhenNoRobotHasRequiredSkill() {
        ProblemInstance problem = ProblemFixtures.withSkills(2)
                .task(2, 1, 0)
                .task(3, 0, 1)
                .task(1, 1, 0)
                .robot(1, 0)
                .defaultTravel(1)
                .precedence(2, 3)
                .build();

        SchedulingResult result = scheduler.schedule(problem);

        assertFalse(result.isComplete());
        assertEquals(List.of(2, 3), result.getUnscheduledTaskIds());
        assertEquals(1, result.getRobotSchedule(0).size());
        assertEntry(result.getRobotSchedule(0).get(0), 1, 1, 3);
        assertEquals(3.0, result.getMakespan(), 1e-9);
        assertFalse(result.getTaskFinishTimes().containsKey(2));
    }

    @Test
    @DisplayName("후행 작업은 선행 작업의 종료 시각 이전에 시작하지 않는다")
    void successorWaitsForPredecessor() {
        ProblemInstance problem = ProblemFixtures.withSkills(2)
                .task(10, 1, 0)
                .task(1, 0, 1)
                .robot(1, 0).robot(0, 1)
                .defaultTravel(1)
                .precedence(1, 2)
                .build();

        SchedulingResult result = scheduler.schedule(problem);

        assertEntry(result.getRobotSchedule(0).get(0), 1, 1, 11);
        assertEntry(result.getRobotSchedule(1).get(0), 2, 11, 12);
        for (int taskId = 1; taskId <= 2; taskId++) {
            for (int pred : problem.getPredecessors(taskId)) {
                double predFinish = result.getTaskFinishTimes().get(pred);
                double start = result.getTaskFinishTimes().get(taskId) - problem.getTask(taskId).executionTime;
                assertTrue(start >= predFinish);
            }
        }
    }

    @Test
    @DisplayName("로봇은 마지막으로 끝낸 작업 위치에서 다음 작업으로 이동한다")
    void robotTravelsFromLastCompletedTask() {
        ProblemInstance problem = ProblemFixtures.withSkills(1)
                .task(2, 1)
                .task(3, 1)
                .robot(1)
                .defaultTravel(1)
                .travel(1, 2, 5)
                .build();

        SchedulingResult result = scheduler.schedule(problem);

        List<ScheduleEntry> schedule = result.getRobotSchedule(0);
        assertEntry(schedule.get(0), 1, 1, 3);
        assertEntry(schedule.get(1), 2, 8, 11);
        assertEquals(11.0, result.getMakespan(), 1e-9);
    }

    @Test
    @DisplayName("매 반복에서 준비된 작업 중 가장 일찍 끝나는 배정을 먼저 확정한다")
    void picksEarliestFinishAcrossReadyTasks() {
        ProblemInstance problem = ProblemFixtures.withSkills(1)
                .task(10, 1)
                .task(1, 1)
                .robot(1)
                .defaultTravel(1)
                .build();

        SchedulingResult result = scheduler.schedule(problem);

        List<ScheduleEntry> schedule = result.getRobotSchedule(0);
        assertEntry(schedule.get(0), 2, 1, 2);
        assertEntry(schedule.get(1), 1, 3, 13);
    }

    @Test
    @DisplayName("종료 시각이 같으면 작업 목록에서 먼저 평가된 작업이 선택된다 (구현 정의 동작)")
    void equalFinishTimesKeepTaskListOrder() {
        ProblemInstance problem = ProblemFixtures.withSkills(2)
                .task(3, 1, 0)
                .task(3, 0, 1)
                .robot(1, 0).robot(0, 1)
                .defaultTravel(1)
                .build();

        SchedulingResult result = scheduler.schedule(problem);

        // 두 작업 모두 종료 시각 4. 1번이 먼저 확정되지만 결과 시각은 같다
        assertEntry(result.getRobotSchedule(0).get(0), 1, 1, 4);
        assertEntry(result.getRobotSchedule(1).get(0), 2, 1, 4);
        assertEquals(4.0, result.getMakespan(), 1e-9);
    }

    @Test
    @DisplayName("스킬이 필요 없는 작업은 로봇 없이 선행 작업 종료 + 실행 시간에 끝난다")
    void emptyCoalitionTaskIsScheduledWithoutRobots() {
        ProblemInstance problem = ProblemFixtures.withSkills(1)
                .task(2, 1)
                .task(4, 0)
                .robot(1)
                .defaultTravel(1)
                .precedence(1, 2)
                .build();

        SchedulingResult result = scheduler.schedule(problem);

        assertTrue(result.isComplete());
        assertEquals(7.0, result.getTaskFinishTimes().get(2), 1e-9);
        assertEquals(1, result.getRobotSchedule(0).size());
        // makespan 은 로봇의 가용 시각 기준
        assertEquals(3.0, result.getMakespan(), 1e-9);
    }

    @Test
    @DisplayName("로봇이 없으면 makespan 은 0 이다")
    void noRobotsGivesZeroMakespan() {
        ProblemInstance free = ProblemFixtures.withSkills(1).task(4, 0).build();
        SchedulingResult freeResult = scheduler.schedule(free);
        assertTrue(freeResult.isComplete());
        assertEquals(0.0, freeResult.getMakespan());
        assertEquals(0, freeResult.getNumRobots());

        ProblemInstance needsRobot = ProblemFixtures.withSkills(1).task(4, 1).build();
        SchedulingResult stalled = scheduler.schedule(needsRobot);
        assertFalse(stalled.isComplete());
        assertEquals(List.of(1), stalled.getUnscheduledTaskIds());
        assertEquals(0.0, stalled.getMakespan());
    }

    @Test
    @DisplayName("같은 인스턴스를 두 번 실행하면 같은 스케줄과 makespan 을 얻는다")
    void schedulingIsDeterministic() {
        ProblemInstance problem = ProblemFixtures.withSkills(3)
                .task(3, 1, 1, 0)
                .task(2, 0, 0, 1)
                .task(4, 1, 0, 1)
                .task(1, 0, 1, 0)
                .robot(1, 0, 0).robot(0, 1, 1).robot(1, 1, 0)
                .defaultTravel(2)
                .travel(1, 3, 5)
                .precedence(1, 3).precedence(2, 4)
                .build();

        SchedulingResult first = scheduler.schedule(problem);
        SchedulingResult second = scheduler.schedule(problem);

        assertEquals(first.getMakespan(), second.getMakespan());
        assertEquals(first.getTaskFinishTimes(), second.getTaskFinishTimes());
        for (int r = 0; r < problem.getNumRobots(); r++) {
            List<ScheduleEntry> a = first.getRobotSchedule(r);
            List<ScheduleEntry> b = second.getRobotSchedule(r);
            assertEquals(a.size(), b.size());
            for (int i = 0; i < a.size(); i++) {
                assertEntry(b.get(i), a.get(i).taskId, a.get(i).startTime, a.get(i).endTime);
            }
        }
        // makespan 은 모든 확정 배정 중 가장 늦은 종료 시각
        double latest = first.getRobotSchedules().stream().flatMap(List::stream)
                .mapToDouble(e -> e.endTime).max().orElse(0.0);
        assertEquals(latest, first.getMakespan());
    }

    @Test
    @DisplayName("exact 전략은 더 작은 연합을 사용한다")
    void exactStrategyUsesSmallerCoalition() {
        ProblemInstance problem = ProblemFixtures.withSkills(6)
                .task(5, 1, 1, 1, 1, 1, 1)
                .robot(1, 1, 1, 0, 0, 0).robot(0, 0, 0, 1, 1, 1).robot(1, 1, 0, 1, 1, 0)
                .defaultTravel(1)
                .build();

        SchedulingResult greedy = scheduler.schedule(problem, CoalitionStrategy.GREEDY);
        SchedulingResult exact = scheduler.schedule(problem, CoalitionStrategy.EXACT);

        assertEquals(1, greedy.getRobotSchedule(2).size());
        assertTrue(exact.getRobotSchedule(2).isEmpty());
        assertEquals(greedy.getMakespan(), exact.getMakespan());
    }

    @Test
    @DisplayName("알 수 없는 전략 이름은 거부된다")
    void rejectsUnknownStrategy() {
        assertThrows(IllegalArgumentException.class, () -> CoalitionStrategy.parse("random"));
        assertEquals(CoalitionStrategy.EXACT, CoalitionStrategy.parse(" Exact "));
        assertEquals(CoalitionStrategy.GREEDY, CoalitionStrategy.parse(null));
    }

    @Test
    @DisplayName("연합은 한 번의 실행 동안 작업마다 한 번만 계산된다")
    void findsEachCoalitionOnce() {
        ProblemFixtures fixtures = ProblemFixtures.withSkills(1).robot(1).defaultTravel(1);
        for (int i = 0; i < 20; i++) {
            fixtures.task(1, 1);
        }
        ProblemInstance problem = fixtures.build();

        GreedyCoalitionService greedy = new GreedyCoalitionService();
        Map<Integer, Integer> calls = new HashMap<>();
        CoalitionFinder counting = (Task task, List<Robot> robots) -> {
            calls.merge(task.id, 1, Integer::sum);
            return greedy.findCoalition(task, robots);
        };

        SchedulingResult result = scheduler.schedule(problem, counting);

        assertTrue(result.isComplete());
        assertEquals(20, calls.size());
        assertTrue(calls.values().stream().allMatch(c -> c == 1));
    }

    @Test
    @DisplayName("구성 불가 결과도 다시 계산하지 않는다")
    void infeasibleCoalitionIsNotRecomputed() {
        ProblemInstance problem = ProblemFixtures.withSkills(2)
                .task(1, 1, 0).task(1, 1, 0).task(1, 0, 1)
                .robot(1, 0)
                .build();

        Map<Integer, Integer> calls = new HashMap<>();
        CoalitionFinder counting = (Task task, List<Robot> robots) -> {
            calls.merge(task.id, 1, Integer::sum);
            return new GreedyCoalitionService().findCoalition(task, robots);
        };

        SchedulingResult result = scheduler.schedule(problem, counting);

        assertEquals(List.of(3), result.getUnscheduledTaskIds());
        assertEquals(Integer.valueOf(1), calls.get(3));
    }
}
