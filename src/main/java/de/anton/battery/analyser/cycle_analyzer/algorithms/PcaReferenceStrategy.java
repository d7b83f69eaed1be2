package de.anton.battery.analyser.cycle_analyzer.algorithms;

import de.anton.battery.analyser.cycle_analyzer.model.ChannelMetric;
import de.anton.battery.analyser.cycle_analyzer.model.ChannelSummary;
import de.anton.battery.analyser.cycle_analyzer.model.ReferenceMethod;
import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration.PcaSettings;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.stat.correlation.Covariance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.IntStream;

/**
 * Picks the candidate closest to the centroid of the batch in principal-component space.
 * <p>
 * Features with no value on any candidate are dropped; remaining gaps are filled with the column median.
 * The standardized matrix is projected onto the leading components and the candidate with the smallest
 * Euclidean distance to the projected centroid wins (earlier candidate on ties).
 */
public class PcaReferenceStrategy implements ReferenceSelectionStrategy {

    private static final Logger logger = LoggerFactory.getLogger(PcaReferenceStrategy.class);

    private final PcaSettings settings;

    public PcaReferenceStrategy(PcaSettings settings) {
        this.settings = Objects.requireNonNull(settings, "PCA settings cannot be null.");
    }

    @Override
    public ReferenceMethod method() {
        return ReferenceMethod.PCA;
    }

    @Override
    public Optional<Selection> select(List<ChannelSummary> candidates) {
        Objects.requireNonNull(candidates, "Candidates cannot be null.");
        if (candidates.size() < settings.minSamples()) {
            logger.debug("PCA selection skipped: {} candidates, need {}.", candidates.size(), settings.minSamples());
            return Optional.empty();
        }

        List<ChannelMetric> usable = new ArrayList<>();
        for (ChannelMetric feature : settings.features()) {
            if (candidates.stream().anyMatch(c -> feature.extract(c) != null)) {
                usable.add(feature);
            }
        }
        if (usable.size() < settings.minFeatures()) {
            logger.debug("PCA selection skipped: {} usable features {}, need {}.", usable.size(), usable, settings.minFeatures());
            return Optional.empty();
        }

        double[][] raw = new double[candidates.size()][usable.size()];
        for (int i = 0; i < candidates.size(); i++) {
            for (int j = 0; j < usable.size(); j++) {
                Double v = usable.get(j).extract(candidates.get(i));
                raw[i][j] = v != null ? v : Double.NaN;
            }
        }
        double[][] standardized = DataScaler.standardize(DataScaler.imputeColumnMedians(raw));
        double[][] projected = project(standardized, Math.min(settings.components(), usable.size()));

        int dims = projected[0].length;
        double[] centroid = new double[dims];
        for (double[] row : projected) {
            for (int k = 0; k < dims; k++) centroid[k] += row[k] / projected.length;
        }

        Map<String, Double> scores = new LinkedHashMap<>();
        int bestIndex = -1;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (int i = 0; i < projected.length; i++) {
            double sq = 0;
            for (int k = 0; k < dims; k++) {
                double d = projected[i][k] - centroid[k];
                sq += d * d;
            }
            double distance = Math.sqrt(sq);
            scores.put(candidates.get(i).getChannelKey(), distance);
            if (distance < bestDistance) {
                bestDistance = distance;
                bestIndex = i;
            }
        }
        ChannelSummary chosen = candidates.get(bestIndex);
        logger.debug("PCA selection over {} features: chosen={} (distance={})", usable.size(), chosen.getChannelKey(), bestDistance);
        return Optional.of(new Selection(method(), chosen, scores, null));
    }

    /** Scores of the rows on the {@code components} eigenvectors of the covariance matrix with the largest eigenvalues. */
    static double[][] project(double[][] standardized, int components) {
        RealMatrix data = new Array2DRowRealMatrix(standardized, false);
        RealMatrix covariance = new Covariance(data).getCovarianceMatrix();
        EigenDecomposition eigen = new EigenDecomposition(covariance);
        double[] eigenvalues = eigen.getRealEigenvalues();

        int[] order = IntStream.range(0, eigenvalues.length).boxed()
                .sorted(Comparator.comparingDouble((Integer k) -> eigenvalues[k]).reversed())
                .mapToInt(Integer::intValue)
                .toArray();

        double[][] scores = new double[standardized.length][components];
        for (int c = 0; c < components; c++) {
            RealVector axis = eigen.getEigenvector(order[c]);
            for (int i = 0; i < standardized.length; i++) {
                double dot = 0;
                for (int j = 0; j < standardized[i].length; j++) {
                    dot += standardized[i][j] * axis.getEntry(j);
                }
                scores[i][c] = dot;
            }
        }
        return scores;
    }
}
