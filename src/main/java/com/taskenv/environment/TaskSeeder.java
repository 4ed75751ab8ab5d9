package com.taskenv.environment;

import com.taskenv.config.EnvironmentConfig;
import com.taskenv.config.SeedTaskConfig;
import com.taskenv.store.InMemoryTaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Places the configured seed tasks into a store.
 * Due dates are relative to the seeding instant, so every episode starts
 * with the same shape of board.
 */
public class TaskSeeder {

    private static final Logger log = LoggerFactory.getLogger(TaskSeeder.class);

    private final EnvironmentConfig config;
    private final Clock clock;

    public TaskSeeder(EnvironmentConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * Seed the store unless it already holds tasks.
     *
     * @return Number of tasks inserted (0 if the store was not empty)
     */
    public int populate(InMemoryTaskStore store) {
        if (!store.isEmpty()) {
            log.debug("Store already holds {} tasks, skipping seed", store.size());
            return 0;
        }
        Instant now = clock.instant();
        for (SeedTaskConfig seed : config.seedTasks()) {
            store.insert(seed.toDraft(now), seed.createdAt(now), now);
        }
        log.info("Seeded {} tasks for environment '{}'", config.seedTasks().size(), config.name());
        return config.seedTasks().size();
    }
}
