package fr.lapetina.inference.router.domain.ring;

import java.util.Collection;

/**
 * Dispersion of per-node loads.
 */
public final class LoadBalance {

    private LoadBalance() {
    }

    /**
     * Population standard deviation divided by the mean.
     * Returns 0 for fewer than two values or a zero mean.
     */
    public static double coefficientOfVariation(Collection<? extends Number> counts) {
        if (counts.size() < 2) {
            return 0.0;
        }
        double mean = counts.stream().mapToDouble(Number::doubleValue).average().orElse(0.0);
        if (mean == 0.0) {
            return 0.0;
        }
        double variance = counts.stream()
                .mapToDouble(c -> {
                    double d = c.doubleValue() - mean;
                    return d * d;
                })
                .average()
                .orElse(0.0);
        return Math.sqrt(variance) / mean;
    }
}
