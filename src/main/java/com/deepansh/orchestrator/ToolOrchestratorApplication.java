package com.deepansh.orchestrator;

import com.deepansh.orchestrator.config.AgentLoopProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(AgentLoopProperties.class)
public class ToolOrchestratorApplication {
    public static void main(String[] args) {
        SpringApplication.run(ToolOrchestratorApplication.class, args);
    }
}
