package com.riansoft.robot_alloc.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

// 휴리스틱 스케줄 결과. robot_schedules 의 키는 로봇 ID 문자열입니다.
public class HeuristicSolutionDto {
    @JsonProperty("makespan")
    private double makespan;
    @JsonProperty("n_tasks")
    private int numTasks;
    @JsonProperty("n_robots")
    private int numRobots;
    @JsonProperty("robot_schedules")
    private Map<String, List<ScheduleEntryDto>> robotSchedules;
    @JsonProperty("complete")
    private boolean complete;
    @JsonProperty("unscheduled_tasks")
    private List<Integer> unscheduledTasks;

    public HeuristicSolutionDto() {}

    public HeuristicSolutionDto(double makespan, int numTasks, int numRobots, Map<String, List<ScheduleEntryDto>> robotSchedules,
                                boolean complete, List<Integer> unscheduledTasks) {
        this.makespan = makespan;
        this.numTasks = numTasks;
        this.numRobots = numRobots;
        this.robotSchedules = robotSchedules;
        this.complete = complete;
        this.unscheduledTasks = unscheduledTasks;
    }

    // --- Getters and Setters ---
    public double getMakespan() { return makespan; }
    public void setMakespan(double makespan) { this.makespan = makespan; }
    public int getNumTasks() { return numTasks; }
    public void setNumTasks(int numTasks) { this.numTasks = numTasks; }
    public int getNumRobots() { return numRobots; }
    public void setNumRobots(int numRobots) { this.numRobots = numRobots; }
    public Map<String, List<ScheduleEntryDto>> getRobotSchedules() { return robotSchedules; }
    public void setRobotSchedules(Map<String, List<ScheduleEntryDto>> robotSchedules) { this.robotSchedules = robotSchedules; }
    public boolean isComplete() { return complete; }
    public void setComplete(boolean complete) { this.complete = complete; }
    public List<Integer> getUnscheduledTasks() { return unscheduledTasks; }
    public void setUnscheduledTasks(List<Integer> unscheduledTasks) { this.unscheduledTasks = unscheduledTasks; }
}
