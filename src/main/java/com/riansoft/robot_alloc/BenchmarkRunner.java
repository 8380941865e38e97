package com.riansoft.robot_alloc;

import com.riansoft.robot_alloc.service.BenchmarkService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * benchmark.enabled=true 이면 애플리케이션 시작 시 벤치마크를 한 번 실행합니다.
 * 예: --benchmark.enabled=true --benchmark.start-instance=0 --benchmark.end-instance=9
 */
@Component
@ConditionalOnProperty(name = "benchmark.enabled", havingValue = "true")
public class BenchmarkRunner implements ApplicationRunner {

    private final BenchmarkService benchmarkService;
    private final int startInstance;
    private final int endInstance;

    @Autowired
    public BenchmarkRunner(BenchmarkService benchmarkService,
                           @Value("${benchmark.start-instance:0}") int startInstance,
                           @Value("${benchmark.end-instance:9}") int endInstance) {
        this.benchmarkService = benchmarkService;
        this.startInstance = startInstance;
        this.endInstance = endInstance;
    }

    @Override
    public void run(ApplicationArguments args) {
        benchmarkService.runBenchmark(startInstance, endInstance);
    }
}
