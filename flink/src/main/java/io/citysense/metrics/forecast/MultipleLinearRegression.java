package io.citysense.metrics.forecast;

import io.citysense.metrics.InvalidInputException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;

/**
 * Ordinary least squares over any number of features, with an intercept.
 * Backed by the QR decomposition of commons-math.
 */
public class MultipleLinearRegression implements RegressionStrategy {

    // QR pivots below this are treated as a singular design matrix
    private static final double SINGULARITY_THRESHOLD = 1e-10;

    // beta[0] is the intercept, beta[i + 1] the coefficient of feature i
    private double[] beta;

    @Override
    public void fit(double[][] features, double[] labels) {
        RegressionScores.requireMatchingLengths(features, labels);
        if (features.length == 0) {
            throw new InvalidInputException("No samples to fit");
        }

        OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression(SINGULARITY_THRESHOLD);
        try {
            ols.newSampleData(labels, features);
            this.beta = RegressionScores.isConstant(labels)
                    ? constantFit(labels[0], features[0].length)
                    : ols.estimateRegressionParameters();
        } catch (MathIllegalArgumentException e) {
            throw new InvalidInputException("Cannot fit linear model: " + e.getMessage());
        }
    }

    @Override
    public double predict(double[] features) {
        double[] coefficients = requireFitted();
        if (features.length != coefficients.length - 1) {
            throw new InvalidInputException("Expected " + (coefficients.length - 1)
                    + " features, got " + features.length);
        }
        double y = coefficients[0];
        for (int i = 0; i < features.length; i++) {
            y += coefficients[i + 1] * features[i];
        }
        return y;
    }

    @Override
    public double score(double[][] features, double[] labels) {
        RegressionScores.requireMatchingLengths(features, labels);
        double[] predicted = new double[features.length];
        for (int i = 0; i < features.length; i++) {
            predicted[i] = predict(features[i]);
        }
        return RegressionScores.rSquared(labels, predicted);
    }

    /**
     * @return intercept followed by one coefficient per feature
     */
    public double[] getCoefficients() {
        return requireFitted().clone();
    }

    // The QR solve leaves rounding noise on flat labels; an intercept-only model reproduces them exactly
    private static double[] constantFit(double label, int featureCount) {
        double[] coefficients = new double[featureCount + 1];
        coefficients[0] = label;
        return coefficients;
    }

    private double[] requireFitted() {
        if (beta == null) {
            throw new IllegalStateException("Model has not been fitted");
        }
        return beta;
    }
}
