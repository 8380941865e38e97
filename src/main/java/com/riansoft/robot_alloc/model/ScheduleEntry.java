package com.riansoft.robot_alloc.model;

public class ScheduleEntry {
    public final int taskId;
    public final double startTime;
    public final double endTime;

    public ScheduleEntry(int taskId, double startTime, double endTime) {
        this.taskId = taskId;
        this.startTime = startTime;
        this.endTime = endTime;
    }

    @Override
    public String toString() {
        return "{task=" + taskId + ", start=" + startTime + ", end=" + endTime + "}";
    }
}
