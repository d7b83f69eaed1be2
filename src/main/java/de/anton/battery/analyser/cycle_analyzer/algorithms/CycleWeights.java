package de.anton.battery.analyser.cycle_analyzer.algorithms;

import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration.WeightingScheme;

import java.util.EnumMap;
import java.util.Map;

/**
 * Weights used when comparing retention curves: per-cycle weights that grow towards late life,
 * and the renormalized per-metric weights of the composite score.
 */
public final class CycleWeights {

    /** Late-life boost only applies to curves longer than this. */
    static final int MIN_POINTS_FOR_LATE_EMPHASIS = 10;

    public enum CurveMetric { CAPACITY, VOLTAGE, ENERGY }

    private CycleWeights() { throw new IllegalStateException("Utility class"); }

    /**
     * Per-cycle weights for {@code n} grid points, normalized so that they sum to {@code n}.
     * <ul>
     *   <li>CONSTANT: 1</li>
     *   <li>LINEAR: {@code 1 + factor * t / (n - 1)}</li>
     *   <li>EXPONENTIAL: {@code exp(factor * t / (n - 1))}</li>
     * </ul>
     * The last {@code lateFraction} of the points is multiplied by {@code lateEmphasis} when the emphasis
     * is above 1 and the curve has more than ten points.
     */
    public static double[] cycleWeights(int n, WeightingScheme scheme, double factor, double lateEmphasis, double lateFraction) {
        if (n <= 0) return new double[0];
        double[] weights = new double[n];
        for (int t = 0; t < n; t++) {
            double position = n > 1 ? (double) t / (n - 1) : 0.0;
            switch (scheme) {
                case LINEAR:
                    weights[t] = 1.0 + factor * position;
                    break;
                case EXPONENTIAL:
                    weights[t] = Math.exp(factor * position);
                    break;
                case CONSTANT:
                default:
                    weights[t] = 1.0;
                    break;
            }
        }

        if (lateEmphasis > 1.0 && n > MIN_POINTS_FOR_LATE_EMPHASIS) {
            int lateStart = (int) (n * (1.0 - lateFraction));
            for (int t = lateStart; t < n; t++) {
                weights[t] *= lateEmphasis;
            }
        }

        double sum = 0;
        for (double w : weights) sum += w;
        if (sum > 0) {
            for (int t = 0; t < n; t++) {
                weights[t] = weights[t] * n / sum;
            }
        }
        return weights;
    }

    /**
     * Composite-score weights of the enabled metrics, rescaled to sum to 1.
     * Capacity is always enabled.
     */
    public static Map<CurveMetric, Double> metricWeights(double capacity, double voltage, double energy,
                                                        boolean voltageEnabled, boolean energyEnabled) {
        Map<CurveMetric, Double> weights = new EnumMap<>(CurveMetric.class);
        weights.put(CurveMetric.CAPACITY, capacity);
        if (voltageEnabled) weights.put(CurveMetric.VOLTAGE, voltage);
        if (energyEnabled) weights.put(CurveMetric.ENERGY, energy);

        double total = weights.values().stream().mapToDouble(Double::doubleValue).sum();
        if (total <= 0) {
            // all enabled weights zero: fall back to equal shares
            double share = 1.0 / weights.size();
            weights.replaceAll((metric, w) -> share);
            return weights;
        }
        weights.replaceAll((metric, w) -> w / total);
        return weights;
    }

    /** Sum of {@code w * (a - b)^2} divided by the sum of the weights. */
    public static double weightedMse(double[] curve, double[] mean, double[] weights) {
        if (curve.length != mean.length || curve.length != weights.length) {
            throw new IllegalArgumentException("Curve, mean and weights must have the same length: "
                    + curve.length + ", " + mean.length + ", " + weights.length);
        }
        double sum = 0, weightSum = 0;
        for (int i = 0; i < curve.length; i++) {
            double d = curve[i] - mean[i];
            sum += weights[i] * d * d;
            weightSum += weights[i];
        }
        return weightSum > 0 ? sum / weightSum : Double.NaN;
    }
}
