package io.schemagate.core.engine;

/**
 * Thresholds for {@link SchemaEvolutionEngine#suggestImprovements}.
 *
 * @param unknownFieldMinRate minimum share of samples an unknown field must
 *                            appear in to be suggested for addition
 * @param deprecateBelowRate  optional non-core fields used less often than this
 *                            are suggested for deprecation
 * @param requireAboveRate    optional fields used more often than this are
 *                            suggested to become required
 */
public record SuggestionPolicy(double unknownFieldMinRate, double deprecateBelowRate, double requireAboveRate) {

    public static final SuggestionPolicy DEFAULT = new SuggestionPolicy(0.0, 0.1, 0.9);

    public SuggestionPolicy {
        checkRate("unknownFieldMinRate", unknownFieldMinRate);
        checkRate("deprecateBelowRate", deprecateBelowRate);
        checkRate("requireAboveRate", requireAboveRate);
    }

    private static void checkRate(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be within [0, 1], got " + value);
        }
    }
}
