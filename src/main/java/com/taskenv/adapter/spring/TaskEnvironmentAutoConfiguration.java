package com.taskenv.adapter.spring;

import com.taskenv.config.ConfigLoader;
import com.taskenv.config.EnvironmentConfig;
import com.taskenv.environment.TaskEnvironment;
import com.taskenv.environment.TaskSeeder;
import com.taskenv.rule.RuleCatalog;
import com.taskenv.service.DefaultValidationService;
import com.taskenv.service.ValidationService;
import com.taskenv.store.InMemoryTaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring Boot auto-configuration for the task environment.
 */
@Configuration
@ConditionalOnProperty(prefix = "taskenv", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(TaskEnvironmentProperties.class)
public class TaskEnvironmentAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(TaskEnvironmentAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock taskEnvironmentClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public EnvironmentConfig environmentConfig(TaskEnvironmentProperties properties) {
        log.info("Loading task environment configuration from: {}", properties.getConfigPath());
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public RuleCatalog ruleCatalog() {
        return RuleCatalog.standard();
    }

    @Bean
    @ConditionalOnMissingBean
    public ValidationService validationService(RuleCatalog ruleCatalog, Clock clock) {
        return new DefaultValidationService(ruleCatalog, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public InMemoryTaskStore taskStore(Clock clock) {
        return new InMemoryTaskStore(clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskEnvironment taskEnvironment(InMemoryTaskStore taskStore,
                                           ValidationService validationService,
                                           EnvironmentConfig environmentConfig,
                                           Clock clock,
                                           TaskEnvironmentProperties properties) {
        TaskEnvironment environment = new TaskEnvironment(
                taskStore, validationService, new TaskSeeder(environmentConfig, clock));
        if (properties.isSeedOnStartup()) {
            environment.initialize();
        }
        log.info("Task environment '{}' ready", environmentConfig.name());
        return environment;
    }
}
