package com.taskenv.episode;

/**
 * Consistent read of the episode counters.
 *
 * @param actionsTaken     Actions tracked since the last reset
 * @param cumulativeReward Reward accumulated since the last reset
 * @param episodeNumber    Current episode (starts at 1)
 */
public record EpisodeSnapshot(int actionsTaken, double cumulativeReward, int episodeNumber) {
}
