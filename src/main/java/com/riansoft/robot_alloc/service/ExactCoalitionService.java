package com.riansoft.robot_alloc.service;

import com.google.ortools.Loader;
import com.google.ortools.sat.BoolVar;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.CpSolver;
import com.google.ortools.sat.CpSolverStatus;
import com.google.ortools.sat.LinearExpr;
import com.google.ortools.sat.LinearExprBuilder;
import com.riansoft.robot_alloc.model.Coalition;
import com.riansoft.robot_alloc.model.Robot;
import com.riansoft.robot_alloc.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * OR-Tools CP-SAT 으로 최소 크기 연합을 구합니다 (가중 집합 덮개).
 * 크기가 같은 해가 여럿이면 ID 합이 작은 쪽, 즉 낮은 ID 로봇을 우선합니다.
 */
@Service
public class ExactCoalitionService implements CoalitionFinder {

    private static final Logger log = LoggerFactory.getLogger(ExactCoalitionService.class);
    private static final double SEARCH_TIME_LIMIT_SECONDS = 10.0;

    // 시간 제한으로 최적성이 증명되지 않으면 결정적인 탐욕 덮개를 대신 사용합니다.
    private final GreedyCoalitionService fallback = new GreedyCoalitionService();

    private boolean nativeLoaded = false;

    /**
     * 네이티브 라이브러리는 처음 사용할 때 한 번만 로드합니다.
     */
    private synchronized void ensureNativeLibraries() {
        if (nativeLoaded) return;
        try {
            log.info("[LOG] Google OR-Tools 네이티브 라이브러리 로드를 시도합니다...");
            Loader.loadNativeLibraries();
            nativeLoaded = true;
            log.info("[LOG] 라이브러리 로드 성공!");
        } catch (RuntimeException | LinkageError e) {
            log.error("!!! [FATAL] Google OR-Tools 라이브러리 로드 실패 !!!", e);
            throw new IllegalStateException("OR-Tools native libraries are not available", e);
        }
    }

    @Override
    public Coalition findCoalition(Task task, List<Robot> robots) {
        BitSet required = task.getRequirements();
        if (required.isEmpty()) {
            return Coalition.EMPTY;
        }
        for (Robot robot : robots) {
            if (robot.hasSkills(required)) {
                return Coalition.of(List.of(robot));
            }
        }

        BitSet union = new BitSet();
        robots.forEach(r -> union.or(r.getSkills()));
        BitSet missing = (BitSet) required.clone();
        missing.andNot(union);
        if (!missing.isEmpty()) {
            return Coalition.INFEASIBLE;
        }

        ensureNativeLibraries();

        CpModel model = new CpModel();
        BoolVar[] chosen = new BoolVar[robots.size()];
        for (int i = 0; i < robots.size(); i++) {
            chosen[i] = model.newBoolVar("robot_" + robots.get(i).id);
        }

        // 요구 스킬마다 그 스킬을 가진 로봇이 최소 한 대는 선택되어야 합니다.
        for (int skill = required.nextSetBit(0); skill >= 0; skill = required.nextSetBit(skill + 1)) {
            LinearExprBuilder cover = LinearExpr.newBuilder();
            for (int i = 0; i < robots.size(); i++) {
                if (robots.get(i).getSkills().get(skill)) {
                    cover.add(chosen[i]);
                }
            }
            model.addGreaterOrEqual(cover, 1);
        }

        // 인원 수가 항상 우선: 위치 가중치의 총합보다 큰 값을 인원 가중치로 사용합니다.
        long n = robots.size();
        long sizeWeight = n * (n - 1) / 2 + 1;
        LinearExprBuilder objective = LinearExpr.newBuilder();
        for (int i = 0; i < robots.size(); i++) {
            objective.addTerm(chosen[i], sizeWeight + i);
        }
        model.minimize(objective);

        CpSolver solver = new CpSolver();
        solver.getParameters().setNumWorkers(1);
        solver.getParameters().setMaxTimeInSeconds(SEARCH_TIME_LIMIT_SECONDS);
        CpSolverStatus status = solver.solve(model);

        List<Robot> coalition = new ArrayList<>();
        if (status == CpSolverStatus.OPTIMAL) {
            for (int i = 0; i < robots.size(); i++) {
                if (solver.booleanValue(chosen[i])) {
                    coalition.add(robots.get(i));
                }
            }
        }
        return resolve(task, robots, status, coalition);
    }

    /**
     * 솔버 상태에 따라 최종 연합을 정합니다.
     * OPTIMAL 이 아니면 (FEASIBLE 포함) 실행마다 달라질 수 있으므로 탐욕 덮개를 반환합니다.
     */
    Coalition resolve(Task task, List<Robot> robots, CpSolverStatus status, List<Robot> solverChoice) {
        if (status == CpSolverStatus.OPTIMAL) {
            return Coalition.of(solverChoice);
        }
        log.warn("[SOLVER] 작업 {} 의 최소 연합이 증명되지 않았습니다 (status: {}). 탐욕 연합으로 대체합니다.", task.id, status);
        return fallback.findCoalition(task, robots);
    }
}
