package io.citysense.metrics.forecast;

import io.citysense.metrics.InvalidInputException;

/**
 * Goodness-of-fit helpers shared by regression strategies.
 */
final class RegressionScores {

    private RegressionScores() {}

    /**
     * R² = 1 - SSres / SStot.
     *
     * <p>With constant labels the ratio is 0/0: an exact fit scores 1.0, anything else is
     * rejected.
     */
    static double rSquared(double[] actual, double[] predicted) {
        if (actual.length != predicted.length || actual.length == 0) {
            throw new InvalidInputException("Cannot score " + predicted.length
                    + " predictions against " + actual.length + " labels");
        }

        if (isConstant(actual)) {
            for (int i = 0; i < actual.length; i++) {
                if (predicted[i] != actual[i]) {
                    throw new InvalidInputException(
                            "R² undefined: labels are constant but residuals are not zero");
                }
            }
            return 1.0;
        }

        double mean = 0.0;
        for (double y : actual) {
            mean += y;
        }
        mean /= actual.length;

        double ssRes = 0.0;
        double ssTot = 0.0;
        for (int i = 0; i < actual.length; i++) {
            double residual = actual[i] - predicted[i];
            double deviation = actual[i] - mean;
            ssRes += residual * residual;
            ssTot += deviation * deviation;
        }

        return 1.0 - ssRes / ssTot;
    }

    /**
     * True when every value equals the first. Exact comparison, not a variance test, so that
     * constant values without an exact binary form (0.1) still count as constant.
     */
    static boolean isConstant(double[] values) {
        for (int i = 1; i < values.length; i++) {
            if (values[i] != values[0]) {
                return false;
            }
        }
        return true;
    }

    static void requireMatchingLengths(double[][] features, double[] labels) {
        if (features.length != labels.length) {
            throw new InvalidInputException("Feature rows (" + features.length
                    + ") and labels (" + labels.length + ") differ in length");
        }
    }
}
