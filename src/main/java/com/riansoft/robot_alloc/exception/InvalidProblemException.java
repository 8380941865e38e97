package com.riansoft.robot_alloc.exception;

/**
 * 문제 인스턴스의 차원이나 값이 서로 맞지 않을 때 발생합니다.
 */
public class InvalidProblemException extends RuntimeException {

    public InvalidProblemException(String message) {
        super(message);
    }
}
