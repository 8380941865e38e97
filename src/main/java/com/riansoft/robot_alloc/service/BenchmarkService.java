package com.riansoft.robot_alloc.service;

import com.riansoft.robot_alloc.dto.BenchmarkReportDto;
import com.riansoft.robot_alloc.dto.BenchmarkResultDto;
import com.riansoft.robot_alloc.dto.OptimalSolutionDto;
import com.riansoft.robot_alloc.dto.ProblemDataDto;
import com.riansoft.robot_alloc.model.ProblemInstance;
import com.riansoft.robot_alloc.model.SchedulingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StopWatch;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 인스턴스 범위를 돌며 휴리스틱 makespan 을 알려진 최적 makespan 과 비교합니다.
 */
@Service
public class BenchmarkService {

    private static final Logger log = LoggerFactory.getLogger(BenchmarkService.class);

    private final ProblemDataService problemDataService;
    private final ListSchedulingService listSchedulingService;

    @Autowired
    public BenchmarkService(ProblemDataService problemDataService, ListSchedulingService listSchedulingService) {
        this.problemDataService = problemDataService;
        this.listSchedulingService = listSchedulingService;
    }

    /**
     * heuristic / optimal. 최적 makespan 이 0 이면 휴리스틱도 0 일 때만 1.0, 아니면 무한대.
     */
    public static double performanceRatio(double heuristicMakespan, double optimalMakespan) {
        if (optimalMakespan > 0) {
            return heuristicMakespan / optimalMakespan;
        }
        return heuristicMakespan > 0 ? Double.POSITIVE_INFINITY : 1.0;
    }

    public BenchmarkReportDto runBenchmark(int startInstance, int endInstance) {
        if (endInstance < startInstance) {
            throw new IllegalArgumentException("end instance " + endInstance + " is before start instance " + startInstance);
        }
        log.info("[BENCHMARK] --- Running Benchmark for Instances {} to {} ---", startInstance, endInstance);

        List<BenchmarkResultDto> results = new ArrayList<>();
        double totalTime = 0.0;

        for (int id = startInstance; id <= endInstance; id++) {
            log.info("[BENCHMARK] Processing instance {}...", id);
            Optional<BenchmarkResultDto> result = runInstance(id);
            if (result.isEmpty()) {
                log.info("[BENCHMARK] Skipping instance {} due to missing data.", id);
                continue;
            }
            BenchmarkResultDto row = result.get();
            totalTime += row.getDuration();
            results.add(row);

            log.info("[BENCHMARK]   Optimal Makespan: {}", String.format("%.2f", row.getOptimalMakespan()));
            log.info("[BENCHMARK]   Heuristic Makespan: {} (Ratio: {})",
                    String.format("%.2f", row.getHeuristicMakespan()), String.format("%.3f", row.getRatio()));
            log.info("[BENCHMARK]   Time taken: {}s", String.format("%.4f", row.getDuration()));
        }

        if (results.isEmpty()) {
            log.info("[BENCHMARK] No instances were processed.");
            return new BenchmarkReportDto(results, 0.0, 0.0);
        }

        double averageRatio = results.stream().mapToDouble(BenchmarkResultDto::getRatio).sum() / results.size();
        double averageDuration = totalTime / results.size();

        log.info("[BENCHMARK] --- Benchmark Summary ---");
        log.info("[BENCHMARK] Processed {} instances.", results.size());
        log.info("[BENCHMARK] Average Heuristic/Optimal Ratio: {}", String.format("%.4f", averageRatio));
        log.info("[BENCHMARK] Average Time per Instance: {}s", String.format("%.4f", averageDuration));
        return new BenchmarkReportDto(results, averageRatio, averageDuration);
    }

    /**
     * 인스턴스 하나를 로드해 스케줄링하고 비교 결과를 반환합니다. 파일이 하나라도 없으면 empty.
     */
    public Optional<BenchmarkResultDto> runInstance(int instanceId) {
        Optional<ProblemDataDto> problemData = problemDataService.loadProblem(instanceId);
        if (problemData.isEmpty()) {
            return Optional.empty();
        }
        Optional<OptimalSolutionDto> optimal = problemDataService.loadOptimalSolution(instanceId);
        if (optimal.isEmpty()) {
            return Optional.empty();
        }

        ProblemInstance problem = ProblemInstance.from(problemData.get());

        StopWatch stopWatch = new StopWatch("instance-" + instanceId);
        stopWatch.start();
        SchedulingResult heuristic = listSchedulingService.schedule(problem);
        stopWatch.stop();

        double optimalMakespan = optimal.get().getMakespan();
        double heuristicMakespan = heuristic.getMakespan();
        double ratio = performanceRatio(heuristicMakespan, optimalMakespan);
        return Optional.of(new BenchmarkResultDto(instanceId, optimalMakespan, heuristicMakespan, ratio,
                stopWatch.getTotalTimeSeconds()));
    }
}
