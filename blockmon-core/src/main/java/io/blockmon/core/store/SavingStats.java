package io.blockmon.core.store;

/**
 * How much work selection saved, for the current run and over the lifetime
 * of the environment. Durations are in seconds.
 */
public record SavingStats(
        int runSavedTests,
        int runAllTests,
        double runSavedTime,
        double runAllTime,
        int totalSavedTests,
        int totalAllTests,
        double totalSavedTime,
        double totalAllTime
) {

    public static final SavingStats EMPTY = new SavingStats(0, 0, 0, 0, 0, 0, 0, 0);
}
