package com.riansoft.robot_alloc.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

// 최적 해 파일에서는 makespan 만 사용합니다.
@JsonIgnoreProperties(ignoreUnknown = true)
public class OptimalSolutionDto {
    @JsonProperty("makespan")
    private double makespan;

    public OptimalSolutionDto() {}

    public OptimalSolutionDto(double makespan) {
        this.makespan = makespan;
    }

    public double getMakespan() { return makespan; }
    public void setMakespan(double makespan) { this.makespan = makespan; }
}
