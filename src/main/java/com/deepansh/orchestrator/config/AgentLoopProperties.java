package com.deepansh.orchestrator.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Strongly-typed configuration for the agent loop.
 * Bound from application.yml under the "agent" prefix.
 */
@ConfigurationProperties(prefix = "agent")
@Validated
@Data
public class AgentLoopProperties {

    @Min(1)
    private int maxIterations = 100;

    /** Default per-call timeout; a tool's own timeout is clamped to this */
    @NotNull
    private Duration toolTimeout = Duration.ofSeconds(30);

    /** Oracle attempts per iteration, and the budget for repeated parse/tool errors */
    @Min(1)
    private int retryAttempts = 3;

    /** Initial oracle backoff; doubles after every failed attempt */
    @NotNull
    private Duration retryDelay = Duration.ofSeconds(1);

    /** false = strict proposal order, first failure halts the batch */
    private boolean parallelExecution = true;

    @NotNull
    private Duration sleepBetweenIterations = Duration.ofSeconds(2);

    @Valid
    private Stagnation stagnation = new Stagnation();

    @Valid
    private Oracle oracle = new Oracle();

    @Data
    public static class Stagnation {

        @Min(2)
        private int windowSize = 12;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double similarityThreshold = 0.75;

        private boolean timeBasedDetection = true;

        @Min(2)
        private int repeatedCallThreshold = 4;

        @Min(2)
        private int errorLoopThreshold = 4;

        @Min(2)
        private int cyclicPatternThreshold = 4;

        /** Confidence strictly above this logs a warning and disables automatic retry */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double warnConfidence = 0.7;

        /** Confidence at or above this forces a terminal answer */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double terminateConfidence = 0.9;

        /** Occurrences of an identical batch that force a terminal answer */
        @Min(2)
        private int repeatedBatchTerminationThreshold = 3;
    }

    @Data
    public static class Oracle {
        private String model;
        private double temperature = 0.2;
        private int maxTokens = 2048;
    }
}
