package com.riansoft.robot_alloc.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 리스트 스케줄링 1회 실행 결과. 중단(stall)된 경우에도 그때까지 확정된 부분 스케줄을 담습니다.
 */
public class SchedulingResult {
    private final double makespan;
    private final int numTasks;
    private final int numRobots;
    private final List<List<ScheduleEntry>> robotSchedules; // 로봇 ID로 인덱싱
    private final Map<Integer, Double> taskFinishTimes;
    private final List<Integer> unscheduledTaskIds;

    public SchedulingResult(double makespan, int numTasks, int numRobots, List<List<ScheduleEntry>> robotSchedules,
                            Map<Integer, Double> taskFinishTimes, List<Integer> unscheduledTaskIds) {
        this.makespan = makespan;
        this.numTasks = numTasks;
        this.numRobots = numRobots;
        this.robotSchedules = robotSchedules;
        this.taskFinishTimes = Collections.unmodifiableMap(taskFinishTimes);
        this.unscheduledTaskIds = Collections.unmodifiableList(unscheduledTaskIds);
    }

    public double getMakespan() { return makespan; }
    public int getNumTasks() { return numTasks; }
    public int getNumRobots() { return numRobots; }
    public List<List<ScheduleEntry>> getRobotSchedules() { return robotSchedules; }

    public List<ScheduleEntry> getRobotSchedule(int robotId) {
        return robotSchedules.get(robotId);
    }

    /**
     * 작업 ID -> 완료 시각. 차고지(0번)는 항상 0.0 으로 들어 있습니다.
     */
    public Map<Integer, Double> getTaskFinishTimes() { return taskFinishTimes; }

    public List<Integer> getUnscheduledTaskIds() { return unscheduledTaskIds; }

    public boolean isComplete() {
        return unscheduledTaskIds.isEmpty();
    }
}
