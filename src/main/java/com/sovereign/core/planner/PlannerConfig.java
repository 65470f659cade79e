package com.sovereign.core.planner;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class PlannerConfig {

    @Bean
    @ConditionalOnMissingBean(SubtaskHandler.class)
    public SubtaskHandler simulatedSubtaskHandler(PlannerProperties properties) {
        return new SimulatedSubtaskHandler(Duration.ofMillis(properties.getSimulatedWorkMillis()));
    }
}
