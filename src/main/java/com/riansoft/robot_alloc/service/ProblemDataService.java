package com.riansoft.robot_alloc.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.riansoft.robot_alloc.dto.OptimalSolutionDto;
import com.riansoft.robot_alloc.dto.ProblemDataDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * 벤치마크 데이터셋에서 문제 인스턴스와 최적 해 JSON 파일을 읽어옵니다.
 * <pre>
 * {base}/problem_instances/problem_instance_1p_{id:06d}.json
 * {base}/solutions/optimal_schedule_1p_{id:06d}.json
 * </pre>
 */
@Service
public class ProblemDataService {

    private static final Logger log = LoggerFactory.getLogger(ProblemDataService.class);

    private final ObjectMapper objectMapper;
    private final Path basePath;

    @Autowired
    public ProblemDataService(ObjectMapper objectMapper, @Value("${scheduler.data.base-path:.}") String basePath) {
        this.objectMapper = objectMapper;
        this.basePath = Paths.get(basePath);
    }

    public Path problemFile(int instanceId) {
        return basePath.resolve("problem_instances").resolve(String.format("problem_instance_1p_%06d.json", instanceId));
    }

    public Path solutionFile(int instanceId) {
        return basePath.resolve("solutions").resolve(String.format("optimal_schedule_1p_%06d.json", instanceId));
    }

    public Optional<ProblemDataDto> loadProblem(int instanceId) {
        return read(problemFile(instanceId), ProblemDataDto.class, "Problem");
    }

    public Optional<OptimalSolutionDto> loadOptimalSolution(int instanceId) {
        return read(solutionFile(instanceId), OptimalSolutionDto.class, "Solution");
    }

    private <T> Optional<T> read(Path file, Class<T> type, String kind) {
        if (!Files.isRegularFile(file)) {
            log.error("[DATA LOG] {} 파일을 찾을 수 없습니다: {}", kind, file);
            return Optional.empty();
        }
        try {
            T value = objectMapper.readValue(file.toFile(), type);
            log.debug("[DATA LOG] {} 로드 완료", file);
            return Optional.of(value);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }
}
