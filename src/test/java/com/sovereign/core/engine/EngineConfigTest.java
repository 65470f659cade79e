package com.sovereign.core.engine;

import com.sovereign.core.context.ExecutionContext;
import com.sovereign.core.context.ExecutionMode;
import com.sovereign.core.events.EventBus;
import com.sovereign.core.events.EventLogExporter;
import com.sovereign.core.exec.ExecProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(JacksonAutoConfiguration.class))
            .withBean(ExecProperties.class)
            .withUserConfiguration(EngineConfig.class);

    @Test
    @DisplayName("event log exporter serializes with the application's ObjectMapper")
    void exporterUsesApplicationMapper() {
        contextRunner
                .withPropertyValues("spring.jackson.property-naming-strategy=SNAKE_CASE")
                .run(context -> {
                    EventLogExporter exporter = context.getBean(EventLogExporter.class);
                    var root = ExecutionContext.root("deploy_20241225_093000", ExecutionMode.ARCHITECT, Map.of());

                    String line = exporter.toJsonLine(new EventBus().emit("deploy.started", Map.of(), root));

                    assertTrue(line.contains("\"trace_id\":\"deploy_20241225_093000\""), line);
                    assertTrue(line.matches(".*\"timestamp\":\"\\d{4}-\\d{2}-\\d{2}T.*"), line);
                });
    }
}
