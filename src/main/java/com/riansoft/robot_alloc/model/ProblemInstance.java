package com.riansoft.robot_alloc.model;

import com.riansoft.robot_alloc.dto.ProblemDataDto;
import com.riansoft.robot_alloc.exception.InvalidProblemException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 하나의 문제 인스턴스(작업, 로봇, 이동 시간 행렬, 선행 관계)를 담는 읽기 전용 모델입니다.
 * 0번 작업은 항상 출발 더미(차고지)이고, 작업이 2개 이상이면 마지막 작업은 종료 더미입니다.
 */
public class ProblemInstance {
    public static final int DEPOT_ID = 0;

    private final List<Task> tasks;
    private final List<Robot> robots;
    private final double[][] travelTimes;
    private final Map<Integer, Set<Integer>> predecessors; // 후행 작업 -> 선행 작업들
    private final int skillDimension;

    public ProblemInstance(List<Task> tasks, List<Robot> robots, double[][] travelTimes,
                           Map<Integer, Set<Integer>> predecessors, int skillDimension) {
        this.tasks = Collections.unmodifiableList(new ArrayList<>(tasks));
        this.robots = Collections.unmodifiableList(new ArrayList<>(robots));
        this.travelTimes = Arrays.stream(travelTimes).map(double[]::clone).toArray(double[][]::new);
        Map<Integer, Set<Integer>> copy = new HashMap<>();
        predecessors.forEach((succ, preds) -> copy.put(succ, Collections.unmodifiableSet(new LinkedHashSet<>(preds))));
        this.predecessors = Collections.unmodifiableMap(copy);
        this.skillDimension = skillDimension;
    }

    /**
     * JSON 원본 데이터로부터 모델을 생성합니다. 차원이 맞지 않으면 즉시 실패합니다.
     */
    public static ProblemInstance from(ProblemDataDto data) {
        if (data == null) {
            throw new InvalidProblemException("Problem data is missing");
        }
        double[] executionTimes = data.getExecutionTimes() != null ? data.getExecutionTimes() : new double[0];
        double[][] locations = data.getTaskLocations() != null ? data.getTaskLocations() : new double[0][];
        int[][] requirements = data.getRequirements() != null ? data.getRequirements() : new int[0][];
        int[][] robotSkills = data.getRobotSkills() != null ? data.getRobotSkills() : new int[0][];
        double[][] travelTimes = data.getTravelTimes() != null ? data.getTravelTimes() : new double[0][];
        List<int[]> precedencePairs = data.getPrecedenceConstraints() != null ? data.getPrecedenceConstraints() : List.of();

        int numTasks = executionTimes.length;
        if (locations.length != numTasks) {
            throw new InvalidProblemException("task_locations has " + locations.length + " entries, expected " + numTasks + " (length of T_e)");
        }
        if (requirements.length != numTasks) {
            throw new InvalidProblemException("R has " + requirements.length + " entries, expected " + numTasks + " (length of T_e)");
        }
        validateTravelTimes(travelTimes, numTasks);

        int skillDimension = requirements.length > 0 ? lengthOf(requirements[0], "R[0]")
                : robotSkills.length > 0 ? lengthOf(robotSkills[0], "Q[0]") : 0;

        List<Task> tasks = new ArrayList<>(numTasks);
        for (int i = 0; i < numTasks; i++) {
            double executionTime = executionTimes[i];
            if (!Double.isFinite(executionTime) || executionTime < 0) {
                throw new InvalidProblemException("T_e[" + i + "] must be a non-negative finite number but was " + executionTime);
            }
            double[] location = locations[i];
            if (location == null || location.length != 2) {
                throw new InvalidProblemException("task_locations[" + i + "] must be a 2D coordinate");
            }
            validateBinaryVector(requirements[i], skillDimension, "R[" + i + "]");
            if (i == DEPOT_ID && Arrays.stream(requirements[i]).anyMatch(v -> v != 0)) {
                throw new InvalidProblemException("R[0] belongs to the depot and must not require any skill");
            }
            boolean dummy = i == DEPOT_ID || (i == numTasks - 1 && numTasks > 1);
            tasks.add(new Task(i, executionTime, location[0], location[1], requirements[i], dummy));
        }

        List<Robot> robots = new ArrayList<>(robotSkills.length);
        for (int r = 0; r < robotSkills.length; r++) {
            validateBinaryVector(robotSkills[r], skillDimension, "Q[" + r + "]");
            robots.add(new Robot(r, robotSkills[r]));
        }

        // [선행 관계] (선행, 후행) 쌍 목록을 후행 -> 선행 집합으로 뒤집습니다.
        Map<Integer, Set<Integer>> predecessors = new HashMap<>();
        for (int[] pair : precedencePairs) {
            if (pair == null || pair.length != 2) {
                throw new InvalidProblemException("Each precedence constraint must be a [predecessor, successor] pair");
            }
            int pre = pair[0];
            int suc = pair[1];
            if (pre < 0 || pre >= numTasks || suc < 0 || suc >= numTasks) {
                throw new InvalidProblemException("Precedence constraint [" + pre + ", " + suc + "] references an unknown task (N=" + numTasks + ")");
            }
            predecessors.computeIfAbsent(suc, k -> new LinkedHashSet<>()).add(pre);
        }

        return new ProblemInstance(tasks, robots, travelTimes, predecessors, skillDimension);
    }

    private static void validateTravelTimes(double[][] travelTimes, int numTasks) {
        if (travelTimes.length != numTasks) {
            throw new InvalidProblemException("T_t has " + travelTimes.length + " rows, expected " + numTasks);
        }
        for (int i = 0; i < travelTimes.length; i++) {
            if (travelTimes[i] == null || travelTimes[i].length != numTasks) {
                throw new InvalidProblemException("T_t row " + i + " must have " + numTasks + " columns");
            }
            for (int j = 0; j < numTasks; j++) {
                double t = travelTimes[i][j];
                if (!Double.isFinite(t) || t < 0) {
                    throw new InvalidProblemException("T_t[" + i + "][" + j + "] must be a non-negative finite number but was " + t);
                }
            }
        }
    }

    private static int lengthOf(int[] vector, String name) {
        if (vector == null) {
            throw new InvalidProblemException(name + " is missing");
        }
        return vector.length;
    }

    private static void validateBinaryVector(int[] vector, int skillDimension, String name) {
        if (lengthOf(vector, name) != skillDimension) {
            throw new InvalidProblemException(name + " has length " + vector.length + ", expected skill dimension " + skillDimension);
        }
        for (int k = 0; k < vector.length; k++) {
            if (vector[k] != 0 && vector[k] != 1) {
                throw new InvalidProblemException(name + "[" + k + "] must be 0 or 1 but was " + vector[k]);
            }
        }
    }

    public int getNumRobots() {
        return robots.size();
    }

    public int getNumTasks() {
        return tasks.size();
    }

    public List<Task> getTasks() {
        return tasks;
    }

    /**
     * 더미(시작/종료) 작업을 제외한 실제 작업 목록. 작업 ID 순서를 유지합니다.
     */
    public List<Task> getRealTasks() {
        return tasks.stream().filter(t -> !t.dummy).collect(Collectors.toList());
    }

    public Task getTask(int taskId) {
        return tasks.get(taskId);
    }

    public List<Robot> getRobots() {
        return robots;
    }

    public double getTravelTime(int fromTaskId, int toTaskId) {
        return travelTimes[fromTaskId][toTaskId];
    }

    public Set<Integer> getPredecessors(int taskId) {
        return predecessors.getOrDefault(taskId, Collections.emptySet());
    }

    public int getSkillDimension() {
        return skillDimension;
    }
}
