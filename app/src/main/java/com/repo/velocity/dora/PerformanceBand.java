package com.repo.velocity.dora;

/**
 * DORA performance categories, declared worst first so that the natural
 * ordering makes {@code min} the bottleneck band.
 */
public enum PerformanceBand {
    LOW,
    MEDIUM,
    HIGH,
    ELITE;

    public static PerformanceBand worstOf(PerformanceBand... bands) {
        PerformanceBand worst = ELITE;
        for (PerformanceBand band : bands) {
            if (band.compareTo(worst) < 0) {
                worst = band;
            }
        }
        return worst;
    }
}
