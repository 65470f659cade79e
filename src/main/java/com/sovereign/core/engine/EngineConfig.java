package com.sovereign.core.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sovereign.core.events.EventLogExporter;
import com.sovereign.core.exec.ActionExecutor;
import com.sovereign.core.exec.ExecProperties;
import com.sovereign.core.exec.ShellActionExecutor;
import com.sovereign.core.scope.TaskExecutors;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;

/**
 * Wires the process-level collaborators of the engine.
 */
@Configuration
public class EngineConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService sovereignTaskExecutor() {
        return TaskExecutors.newTaskExecutor("sovereign-task");
    }

    @Bean
    @ConditionalOnMissingBean(ActionExecutor.class)
    public ActionExecutor shellActionExecutor(ExecProperties execProperties) {
        return new ShellActionExecutor(execProperties);
    }

    @Bean
    public EventLogExporter eventLogExporter(ObjectMapper objectMapper) {
        return new EventLogExporter(objectMapper);
    }
}
