package com.riansoft.robot_alloc.service;

import com.riansoft.robot_alloc.model.Coalition;
import com.riansoft.robot_alloc.model.Robot;
import com.riansoft.robot_alloc.model.Task;

import java.util.List;

/**
 * 작업의 스킬 요구를 만족시키는 로봇 팀(연합)을 찾습니다.
 * 반환값은 {@link Coalition#EMPTY}, {@link Coalition#INFEASIBLE}, 또는 요구 스킬을 모두 덮는 로봇 목록입니다.
 */
public interface CoalitionFinder {

    Coalition findCoalition(Task task, List<Robot> robots);
}
