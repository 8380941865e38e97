package com.riansoft.robot_alloc.service;

import com.riansoft.robot_alloc.dto.HeuristicSolutionDto;
import com.riansoft.robot_alloc.dto.ScheduleEntryDto;
import com.riansoft.robot_alloc.model.ScheduleEntry;
import com.riansoft.robot_alloc.model.SchedulingResult;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
public class SolutionFormatterService {

    /**
     * 스케줄링 결과를 JSON 응답용 DTO 로 변환합니다.
     * 배정이 없는 로봇도 빈 목록으로 포함됩니다.
     */
    public HeuristicSolutionDto formatSolutionToDto(SchedulingResult result) {
        Map<String, List<ScheduleEntryDto>> robotSchedules = new LinkedHashMap<>();
        for (int robotId = 0; robotId < result.getNumRobots(); robotId++) {
            List<ScheduleEntryDto> entries = result.getRobotSchedule(robotId).stream()
                    .map(this::toDto)
                    .collect(Collectors.toList());
            robotSchedules.put(String.valueOf(robotId), entries);
        }
        return new HeuristicSolutionDto(result.getMakespan(), result.getNumTasks(), result.getNumRobots(),
                robotSchedules, result.isComplete(), result.getUnscheduledTaskIds());
    }

    private ScheduleEntryDto toDto(ScheduleEntry entry) {
        return new ScheduleEntryDto(entry.taskId, entry.startTime, entry.endTime);
    }
}
