package com.riansoft.robot_alloc.controller;

import com.riansoft.robot_alloc.dto.BenchmarkReportDto;
import com.riansoft.robot_alloc.dto.HeuristicSolutionDto;
import com.riansoft.robot_alloc.dto.ProblemDataDto;
import com.riansoft.robot_alloc.exception.InvalidProblemException;
import com.riansoft.robot_alloc.model.ProblemInstance;
import com.riansoft.robot_alloc.model.SchedulingResult;
import com.riansoft.robot_alloc.service.BenchmarkService;
import com.riansoft.robot_alloc.service.CoalitionStrategy;
import com.riansoft.robot_alloc.service.ListSchedulingService;
import com.riansoft.robot_alloc.service.ProblemDataService;
import com.riansoft.robot_alloc.service.SolutionFormatterService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Optional;

@RestController
@RequestMapping("/api")
public class SchedulingController {

    private static final Logger log = LoggerFactory.getLogger(SchedulingController.class);

    private final ListSchedulingService schedulingService;
    private final SolutionFormatterService formatterService;
    private final ProblemDataService problemDataService;
    private final BenchmarkService benchmarkService;

    @Autowired
    public SchedulingController(ListSchedulingService schedulingService, SolutionFormatterService formatterService,
                                ProblemDataService problemDataService, BenchmarkService benchmarkService) {
        this.schedulingService = schedulingService;
        this.formatterService = formatterService;
        this.problemDataService = problemDataService;
        this.benchmarkService = benchmarkService;
    }

    /**
     * 요청 본문으로 받은 문제 인스턴스를 스케줄링합니다.
     * strategy 를 생략하면 설정된 기본 전략(scheduler.coalition-strategy)을 사용합니다.
     */
    @PostMapping("/schedule")
    public ResponseEntity<HeuristicSolutionDto> schedule(@RequestBody ProblemDataDto request,
                                                         @RequestParam(name = "strategy", required = false) String strategy) {
        ProblemInstance problem = ProblemInstance.from(request);
        SchedulingResult result = strategy == null
                ? schedulingService.schedule(problem)
                : schedulingService.schedule(problem, CoalitionStrategy.parse(strategy));
        return ResponseEntity.ok(formatterService.formatSolutionToDto(result));
    }

    /**
     * 데이터셋에 저장된 인스턴스를 불러와 스케줄링합니다.
     */
    @GetMapping("/instances/{id}/schedule")
    public ResponseEntity<HeuristicSolutionDto> scheduleStoredInstance(@PathVariable("id") int instanceId) {
        Optional<ProblemDataDto> data = problemDataService.loadProblem(instanceId);
        if (data.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        SchedulingResult result = schedulingService.schedule(ProblemInstance.from(data.get()));
        return ResponseEntity.ok(formatterService.formatSolutionToDto(result));
    }

    @GetMapping("/benchmark")
    public ResponseEntity<BenchmarkReportDto> benchmark(@RequestParam(name = "start", defaultValue = "0") int start,
                                                        @RequestParam(name = "end", defaultValue = "9") int end) {
        return ResponseEntity.ok(benchmarkService.runBenchmark(start, end));
    }

    @ExceptionHandler({InvalidProblemException.class, IllegalArgumentException.class})
    public ResponseEntity<String> handleBadRequest(RuntimeException e) {
        log.warn("[CONTROLLER LOG] 잘못된 요청: {}", e.getMessage());
        return ResponseEntity.badRequest().body(e.getMessage());
    }
}
