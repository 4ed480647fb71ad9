package com.pulsebrief.insights.stats;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class LeastSquaresTest {

    @Test
    void fitsExactLine() {
        LeastSquares.LineFit fit = LeastSquares.fitLine(new double[]{3, 5, 7, 9});

        assertThat(fit.slope()).isCloseTo(2d, within(1e-12));
        assertThat(fit.intercept()).isCloseTo(3d, within(1e-12));
        assertThat(fit.rSquared()).isCloseTo(1d, within(1e-12));
    }

    @Test
    void multipleRegressionRecoversCoefficients() {
        double[][] design = {{1, 0}, {0, 1}, {1, 1}, {2, 1}, {1, 3}};
        double[] y = new double[design.length];
        for (int i = 0; i < design.length; i++) {
            y[i] = 1 + 2 * design[i][0] - 0.5 * design[i][1];
        }

        LeastSquares.MultipleFit fit = LeastSquares.fit(design, y);

        assertThat(fit.coefficients()).containsExactly(new double[]{1, 2, -0.5}, within(1e-9));
        assertThat(fit.residualSumOfSquares()).isCloseTo(0d, within(1e-9));
    }

    @Test
    void singularDesignIsRejected() {
        double[][] design = {{1, 2}, {2, 4}, {3, 6}};

        assertThatThrownBy(() -> LeastSquares.fit(design, new double[]{1, 2, 3}))
                .isInstanceOf(ArithmeticException.class);
    }
}
