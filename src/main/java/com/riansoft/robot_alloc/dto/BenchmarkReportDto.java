package com.riansoft.robot_alloc.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public class BenchmarkReportDto {
    @JsonProperty("results")
    private List<BenchmarkResultDto> results;
    @JsonProperty("processed_instances")
    private int processedInstances;
    @JsonProperty("average_ratio")
    private double averageRatio;
    @JsonProperty("average_duration")
    private double averageDuration;

    public BenchmarkReportDto() {}

    public BenchmarkReportDto(List<BenchmarkResultDto> results, double averageRatio, double averageDuration) {
        this.results = results;
        this.processedInstances = results.size();
        this.averageRatio = averageRatio;
        this.averageDuration = averageDuration;
    }

    // --- Getters and Setters ---
    public List<BenchmarkResultDto> getResults() { return results; }
    public void setResults(List<BenchmarkResultDto> results) { this.results = results; }
    public int getProcessedInstances() { return processedInstances; }
    public void setProcessedInstances(int processedInstances) { this.processedInstances = processedInstances; }
    public double getAverageRatio() { return averageRatio; }
    public void setAverageRatio(double averageRatio) { this.averageRatio = averageRatio; }
    public double getAverageDuration() { return averageDuration; }
    public void setAverageDuration(double averageDuration) { this.averageDuration = averageDuration; }
}
