package com.riansoft.robot_alloc.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

// 인스턴스 하나에 대한 휴리스틱 vs 최적 비교 결과
public class BenchmarkResultDto {
    @JsonProperty("instance_id")
    private int instanceId;
    @JsonProperty("optimal_makespan")
    private double optimalMakespan;
    @JsonProperty("heuristic_makespan")
    private double heuristicMakespan;
    @JsonProperty("ratio")
    private double ratio;
    @JsonProperty("duration")
    private double duration;

    public BenchmarkResultDto() {}

    public BenchmarkResultDto(int instanceId, double optimalMakespan, double heuristicMakespan, double ratio, double duration) {
        this.instanceId = instanceId;
        this.optimalMakespan = optimalMakespan;
        this.heuristicMakespan = heuristicMakespan;
        this.ratio = ratio;
        this.duration = duration;
    }

    // --- Getters and Setters ---
    public int getInstanceId() { return instanceId; }
    public void setInstanceId(int instanceId) { this.instanceId = instanceId; }
    public double getOptimalMakespan() { return optimalMakespan; }
    public void setOptimalMakespan(double optimalMakespan) { this.optimalMakespan = optimalMakespan; }
    public double getHeuristicMakespan() { return heuristicMakespan; }
    public void setHeuristicMakespan(double heuristicMakespan) { this.heuristicMakespan = heuristicMakespan; }
    public double getRatio() { return ratio; }
    public void setRatio(double ratio) { this.ratio = ratio; }
    public double getDuration() { return duration; }
    public void setDuration(double duration) { this.duration = duration; }
}
