package org.carball.querymon.monitor;

/**
 * Nearest-rank percentiles over an ascending array.
 */
public final class Percentiles {

    private Percentiles() {
        // Utility class - prevent instantiation
    }

    /**
     * Value at index {@code ceil(percentile / 100 * n) - 1}, clamped to {@code [0, n-1]}.
     * Returns 0 for an empty array.
     */
    public static long of(long[] sortedAscending, double percentile) {
        int n = sortedAscending.length;
        if (n == 0) {
            return 0;
        }
        int index = (int) Math.ceil(percentile / 100.0 * n) - 1;
        index = Math.max(0, Math.min(n - 1, index));
        return sortedAscending[index];
    }
}
