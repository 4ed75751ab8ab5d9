package com.taskenv.adapter.spring;

import com.taskenv.core.TaskFixtures;
import com.taskenv.environment.TaskEnvironment;
import com.taskenv.rule.RuleCatalog;
import com.taskenv.service.ValidationService;
import com.taskenv.store.InMemoryTaskStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the Spring Boot auto-configuration.
 */
class TaskEnvironmentAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(TaskEnvironmentAutoConfiguration.class))
            .withPropertyValues("taskenv.config-path=classpath:taskenv-test.yaml");

    @Test
    @DisplayName("Creates the environment beans and seeds on startup")
    void createsBeans() {
        contextRunner.run(context -> {
            assertNotNull(context.getBean(RuleCatalog.class));
            assertNotNull(context.getBean(ValidationService.class));
            assertEquals(3, context.getBean(InMemoryTaskStore.class).size());
            assertEquals(24, context.getBean(TaskEnvironment.class).listRules().size());
        });
    }

    @Test
    @DisplayName("Seeding can be switched off")
    void seedingDisabled() {
        contextRunner.withPropertyValues("taskenv.seed-on-startup=false").run(context ->
                assertTrue(context.getBean(InMemoryTaskStore.class).isEmpty()));
    }

    @Test
    @DisplayName("Disabled environment creates no beans")
    void disabled() {
        contextRunner.withPropertyValues("taskenv.enabled=false").run(context ->
                assertTrue(context.getBeansOfType(TaskEnvironment.class).isEmpty()));
    }

    @Test
    @DisplayName("A user-supplied clock replaces the default")
    void customClock() {
        contextRunner.withBean(Clock.class, () -> TaskFixtures.CLOCK).run(context -> {
            TaskEnvironment environment = context.getBean(TaskEnvironment.class);
            assertEquals(TaskFixtures.NOW, environment.getTask(1).orElseThrow().updatedAt());
        });
    }

    @Test
    @DisplayName("Missing configuration fails the context")
    void missingConfiguration() {
        contextRunner.withPropertyValues("taskenv.config-path=classpath:absent.yaml").run(context ->
                assertNotNull(context.getStartupFailure()));
    }
}
