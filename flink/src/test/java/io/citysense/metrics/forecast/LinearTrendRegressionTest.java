package io.citysense.metrics.forecast;

import io.citysense.metrics.InvalidInputException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class LinearTrendRegressionTest {

    @Test
    void testPerfectLine() {
        LinearTrendRegression model = new LinearTrendRegression();
        double[] x = {0, 1, 2, 3, 4, 5};
        double[] y = {1, 3, 5, 7, 9, 11};

        model.fit(x, y);

        assertThat(model.getSlope()).isCloseTo(2.0, within(1e-9));
        assertThat(model.getIntercept()).isCloseTo(1.0, within(1e-9));
        assertThat(model.predict(10)).isCloseTo(21.0, within(1e-9));
        assertThat(model.score(column(x), y)).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void testNoisyFit() {
        LinearTrendRegression model = new LinearTrendRegression();
        double[] x = {0, 1, 2, 3};
        double[] y = {1, 3, 2, 4};

        model.fit(x, y);

        assertThat(model.getSlope()).isCloseTo(0.8, within(1e-9));
        assertThat(model.getIntercept()).isCloseTo(1.3, within(1e-9));
        assertThat(model.score(column(x), y)).isCloseTo(0.64, within(1e-9));
    }

    @Test
    void testConstantValues() {
        LinearTrendRegression model = new LinearTrendRegression();
        double[] x = {0, 1, 2, 3};
        double[] y = {5, 5, 5, 5};

        model.fit(x, y);

        assertThat(model.getSlope()).isZero();
        assertThat(model.predict(100)).isEqualTo(5.0);
        assertThat(model.score(column(x), y)).isEqualTo(1.0);
    }

    @Test
    void testConstantValuesWithoutExactBinaryForm() {
        LinearTrendRegression model = new LinearTrendRegression();
        double[] x = {0, 1, 2, 3, 4};
        double[] y = {0.1, 0.1, 0.1, 0.1, 0.1};

        model.fit(x, y);

        assertThat(model.getSlope()).isZero();
        assertThat(model.getIntercept()).isEqualTo(0.1);
        assertThat(model.score(column(x), y)).isEqualTo(1.0);
    }

    @Test
    void testIdenticalXRejected() {
        LinearTrendRegression model = new LinearTrendRegression();

        assertThatThrownBy(() -> model.fit(new double[]{2, 2, 2}, new double[]{1, 2, 3}))
                .isInstanceOf(InvalidInputException.class);
        assertThat(model.isFitted()).isFalse();
    }

    @Test
    void testTooFewSamples() {
        assertThatThrownBy(() -> new LinearTrendRegression().fit(new double[]{1}, new double[]{1}))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void testMismatchedLengths() {
        assertThatThrownBy(() -> new LinearTrendRegression().fit(new double[]{1, 2}, new double[]{1}))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void testPredictBeforeFit() {
        assertThatThrownBy(() -> new LinearTrendRegression().predict(1.0))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testRejectsMultipleFeatures() {
        LinearTrendRegression model = new LinearTrendRegression();

        assertThatThrownBy(() -> model.fit(new double[][]{{0, 1}, {1, 2}}, new double[]{0, 1}))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void testNegativeRSquared() {
        assertThat(RegressionScores.rSquared(new double[]{1, 2, 3}, new double[]{3, 2, 1}))
                .isCloseTo(-3.0, within(1e-9));
    }

    @Test
    void testConstantLabelsWithExactFit() {
        assertThat(RegressionScores.rSquared(new double[]{0.7, 0.7, 0.7}, new double[]{0.7, 0.7, 0.7}))
                .isEqualTo(1.0);
    }

    @Test
    void testConstantLabelsWithResiduals() {
        assertThatThrownBy(() -> RegressionScores.rSquared(new double[]{5, 5}, new double[]{5, 6}))
                .isInstanceOf(InvalidInputException.class);
    }

    private static double[][] column(double[] x) {
        double[][] features = new double[x.length][];
        for (int i = 0; i < x.length; i++) {
            features[i] = new double[]{x[i]};
        }
        return features;
    }
}
