package com.riansoft.robot_alloc;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RobotAllocApplication {

    public static void main(String[] args) {
        SpringApplication.run(RobotAllocApplication.class, args);
    }
}
