package de.anton.battery.analyser.cycle_analyzer.model;

/**
 * How a batch's reference channel was chosen.
 * The last two constants are not scoring methods and cannot appear in a priority list.
 */
public enum ReferenceMethod {
    CURVE_RETENTION_MSE("Curve retention MSE"),
    PCA("PCA centroid"),
    TRADITIONAL("Nearest to mean"),
    SINGLE_CANDIDATE("Single candidate"),
    FIRST_CANDIDATE_FALLBACK("First candidate (fallback)");

    private final String displayName;

    ReferenceMethod(String displayName) {
        this.displayName = displayName;
    }

    public boolean isScoringMethod() {
        return this == CURVE_RETENTION_MSE || this == PCA || this == TRADITIONAL;
    }

    @Override
    public String toString() {
        return displayName;
    }

    /**
     * Parses configuration values such as "pca", "capacity_retention" or "CURVE_RETENTION_MSE".
     *
     * @return the method, or null if the name is unknown.
     */
    public static ReferenceMethod fromConfigName(String name) {
        if (name == null) {
            return null;
        }
        String normalized = name.trim().toUpperCase().replace('-', '_');
        switch (normalized) {
            case "CAPACITY_RETENTION":
            case "CURVE":
            case "CURVE_RETENTION_MSE":
                return CURVE_RETENTION_MSE;
            case "PCA":
                return PCA;
            case "TRADITIONAL":
                return TRADITIONAL;
            default:
                return null;
        }
    }
}
