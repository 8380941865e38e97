package com.riansoft.robot_alloc.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

// 문제 인스턴스 JSON 파일의 원본 구조를 그대로 담는 DTO
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProblemDataDto {
    @JsonProperty("T_t")
    private double[][] travelTimes;
    @JsonProperty("precedence_constraints")
    private List<int[]> precedenceConstraints;
    @JsonProperty("T_e")
    private double[] executionTimes;
    @JsonProperty("task_locations")
    private double[][] taskLocations;
    @JsonProperty("R")
    private int[][] requirements;
    @JsonProperty("Q")
    private int[][] robotSkills;

    public ProblemDataDto() {}

    public ProblemDataDto(double[][] travelTimes, List<int[]> precedenceConstraints, double[] executionTimes,
                          double[][] taskLocations, int[][] requirements, int[][] robotSkills) {
        this.travelTimes = travelTimes;
        this.precedenceConstraints = precedenceConstraints;
        this.executionTimes = executionTimes;
        this.taskLocations = taskLocations;
        this.requirements = requirements;
        this.robotSkills = robotSkills;
    }

    // --- Getters and Setters ---
    public double[][] getTravelTimes() { return travelTimes; }
    public void setTravelTimes(double[][] travelTimes) { this.travelTimes = travelTimes; }
    public List<int[]> getPrecedenceConstraints() { return precedenceConstraints; }
    public void setPrecedenceConstraints(List<int[]> precedenceConstraints) { this.precedenceConstraints = precedenceConstraints; }
    public double[] getExecutionTimes() { return executionTimes; }
    public void setExecutionTimes(double[] executionTimes) { this.executionTimes = executionTimes; }
    public double[][] getTaskLocations() { return taskLocations; }
    public void setTaskLocations(double[][] taskLocations) { this.taskLocations = taskLocations; }
    public int[][] getRequirements() { return requirements; }
    public void setRequirements(int[][] requirements) { this.requirements = requirements; }
    public int[][] getRobotSkills() { return robotSkills; }
    public void setRobotSkills(int[][] robotSkills) { this.robotSkills = robotSkills; }
}
