package com.company.workflowsla;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class WorkflowSlaServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(WorkflowSlaServiceApplication.class, args);
    }
}
