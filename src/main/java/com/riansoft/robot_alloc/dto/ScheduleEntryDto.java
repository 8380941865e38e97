package com.riansoft.robot_alloc.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class ScheduleEntryDto {
    @JsonProperty("task")
    private int task;
    @JsonProperty("start_time")
    private double startTime;
    @JsonProperty("end_time")
    private double endTime;

    public ScheduleEntryDto() {}

    public ScheduleEntryDto(int task, double startTime, double endTime) {
        this.task = task;
        this.startTime = startTime;
        this.endTime = endTime;
    }

    // --- Getters and Setters ---
    public int getTask() { return task; }
    public void setTask(int task) { this.task = task; }
    public double getStartTime() { return startTime; }
    public void setStartTime(double startTime) { this.startTime = startTime; }
    public double getEndTime() { return endTime; }
    public void setEndTime(double endTime) { this.endTime = endTime; }
}
