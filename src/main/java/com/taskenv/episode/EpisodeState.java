package com.taskenv.episode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-episode bookkeeping: action count, action log and cumulative reward.
 * <p>
 * All reads and writes go through a single monitor so concurrent callers
 * never lose counter updates or interleave log entries. {@link #reset()} is
 * the only operation that lowers the counters; the episode number only grows.
 */
public class EpisodeState {

    private static final Logger log = LoggerFactory.getLogger(EpisodeState.class);

    private final Clock clock;
    private final Object monitor = new Object();
    private final List<ActionRecord> actionHistory = new ArrayList<>();
    private int actionsTaken;
    private double cumulativeReward;
    private int episodeNumber = 1;

    public EpisodeState(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * Record one agent action. No upper bound within an episode.
     */
    public ActionRecord trackAction(String type, Map<String, Object> payload) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Action type cannot be null or blank");
        }
        ActionRecord record = new ActionRecord(type, payload, clock.instant());
        synchronized (monitor) {
            actionsTaken++;
            actionHistory.add(record);
        }
        log.debug("Tracked action '{}' (episode={})", type, episodeNumber());
        return record;
    }

    /**
     * Add a completed rule's reward.
     *
     * @return Cumulative reward after the addition
     */
    public double addReward(double reward) {
        if (reward < 0) {
            throw new IllegalArgumentException("Reward cannot be negative: " + reward);
        }
        synchronized (monitor) {
            cumulativeReward += reward;
            return cumulativeReward;
        }
    }

    /**
     * Start a new episode: clear counters and log, bump the episode number.
     *
     * @return The new episode number
     */
    public int reset() {
        synchronized (monitor) {
            actionsTaken = 0;
            cumulativeReward = 0.0;
            actionHistory.clear();
            episodeNumber++;
            log.info("Episode reset, now at episode {}", episodeNumber);
            return episodeNumber;
        }
    }

    public EpisodeSnapshot snapshot() {
        synchronized (monitor) {
            return new EpisodeSnapshot(actionsTaken, cumulativeReward, episodeNumber);
        }
    }

    /**
     * Copy of the action log in tracking order.
     */
    public List<ActionRecord> actionHistory() {
        synchronized (monitor) {
            return List.copyOf(actionHistory);
        }
    }

    public int actionsTaken() {
        synchronized (monitor) {
            return actionsTaken;
        }
    }

    public double cumulativeReward() {
        synchronized (monitor) {
            return cumulativeReward;
        }
    }

    public int episodeNumber() {
        synchronized (monitor) {
            return episodeNumber;
        }
    }
}
