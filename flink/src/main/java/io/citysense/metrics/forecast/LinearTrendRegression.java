package io.citysense.metrics.forecast;

import io.citysense.metrics.InvalidInputException;

/**
 * Ordinary least squares fit of one feature: {@code y = slope * x + intercept}.
 */
public class LinearTrendRegression implements RegressionStrategy {

    private double slope;
    private double intercept;
    private boolean fitted;

    @Override
    public void fit(double[][] features, double[] labels) {
        RegressionScores.requireMatchingLengths(features, labels);
        double[] x = new double[features.length];
        for (int i = 0; i < features.length; i++) {
            x[i] = singleFeature(features[i]);
        }
        fit(x, labels);
    }

    /**
     * Fit directly on parallel x / y arrays.
     */
    public void fit(double[] x, double[] y) {
        if (x.length != y.length) {
            throw new InvalidInputException("x (" + x.length + ") and y (" + y.length + ") differ in length");
        }
        if (x.length < 2) {
            throw new InvalidInputException("At least 2 samples are required, got " + x.length);
        }
        if (RegressionScores.isConstant(x)) {
            throw new InvalidInputException("Slope undefined: all x values are " + x[0]);
        }

        // Flat series: fit exactly rather than through a rounded mean
        if (RegressionScores.isConstant(y)) {
            this.slope = 0.0;
            this.intercept = y[0];
            this.fitted = true;
            return;
        }

        int n = x.length;
        double meanX = 0.0;
        double meanY = 0.0;
        for (int i = 0; i < n; i++) {
            meanX += x[i];
            meanY += y[i];
        }
        meanX /= n;
        meanY /= n;

        double sxy = 0.0;
        double sxx = 0.0;
        for (int i = 0; i < n; i++) {
            double dx = x[i] - meanX;
            sxy += dx * (y[i] - meanY);
            sxx += dx * dx;
        }

        this.slope = sxy / sxx;
        this.intercept = meanY - slope * meanX;
        this.fitted = true;
    }

    @Override
    public double predict(double[] features) {
        return predict(singleFeature(features));
    }

    public double predict(double x) {
        requireFitted();
        return slope * x + intercept;
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

    public double getSlope() {
        requireFitted();
        return slope;
    }

    public double getIntercept() {
        requireFitted();
        return intercept;
    }

    public boolean isFitted() {
        return fitted;
    }

    private void requireFitted() {
        if (!fitted) {
            throw new IllegalStateException("Model has not been fitted");
        }
    }

    private static double singleFeature(double[] row) {
        if (row.length != 1) {
            throw new InvalidInputException("Linear trend expects exactly one feature, got " + row.length);
        }
        return row[0];
    }
}
