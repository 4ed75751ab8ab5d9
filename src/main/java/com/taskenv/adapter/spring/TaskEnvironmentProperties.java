package com.taskenv.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the task environment.
 */
@ConfigurationProperties(prefix = "taskenv")
public class TaskEnvironmentProperties {

    /**
     * Whether the task environment is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the environment configuration file (seed tasks).
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:taskenv.yaml";

    /**
     * Seed the task store when the environment bean is created.
     */
    private boolean seedOnStartup = true;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }

    public boolean isSeedOnStartup() {
        return seedOnStartup;
    }

    public void setSeedOnStartup(boolean seedOnStartup) {
        this.seedOnStartup = seedOnStartup;
    }
}
