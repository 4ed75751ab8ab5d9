package com.taskenv.config;

import java.util.List;

/**
 * Root configuration of the task environment.
 *
 * @param name      Environment name (for logs)
 * @param version   Configuration version
 * @param seedTasks Tasks placed in the store at the start of each episode
 */
public record EnvironmentConfig(
        String name,
        String version,
        List<SeedTaskConfig> seedTasks
) {
    public EnvironmentConfig {
        seedTasks = seedTasks == null ? List.of() : List.copyOf(seedTasks);
    }
}
