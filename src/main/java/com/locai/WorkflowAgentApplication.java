package com.locai;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class WorkflowAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(WorkflowAgentApplication.class, args);
    }
}
