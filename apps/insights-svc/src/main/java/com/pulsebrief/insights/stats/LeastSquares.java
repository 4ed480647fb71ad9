package com.pulsebrief.insights.stats;

/**
 * Ordinary least squares by normal equations, sized for the handful of regressors
 * used in trend lines and lagged-causality tests.
 */
public final class LeastSquares {

    private LeastSquares() {
    }

    /** Simple regression of y on its index 0..n-1. */
    public static LineFit fitLine(double[] y) {
        int n = y.length;
        if (n < 2) {
            throw new IllegalArgumentException("need at least two points to fit a line");
        }
        double meanX = (n - 1) / 2.0;
        double meanY = Statistics.mean(y);
        double sxy = 0d;
        double sxx = 0d;
        for (int i = 0; i < n; i++) {
            double dx = i - meanX;
            sxy += dx * (y[i] - meanY);
            sxx += dx * dx;
        }
        double slope = sxy / sxx;
        double intercept = meanY - slope * meanX;
        double ssTotal = 0d;
        double ssResidual = 0d;
        for (int i = 0; i < n; i++) {
            double fitted = intercept + slope * i;
            ssResidual += Math.pow(y[i] - fitted, 2);
            ssTotal += Math.pow(y[i] - meanY, 2);
        }
        double rSquared = ssTotal == 0d ? 1d : Statistics.clamp(1d - ssResidual / ssTotal, 0d, 1d);
        return new LineFit(slope, intercept, rSquared, ssResidual);
    }

    /**
     * Multiple regression with an intercept column added. Rows of {@code design} are
     * observations.
     *
     * @throws ArithmeticException when the normal matrix is singular
     */
    public static MultipleFit fit(double[][] design, double[] y) {
        int n = y.length;
        int k = design.length == 0 ? 1 : design[0].length + 1;
        double[][] xtx = new double[k][k];
        double[] xty = new double[k];
        for (int row = 0; row < n; row++) {
            double[] x = withIntercept(design[row]);
            for (int i = 0; i < k; i++) {
                xty[i] += x[i] * y[row];
                for (int j = 0; j < k; j++) {
                    xtx[i][j] += x[i] * x[j];
                }
            }
        }
        double[] beta = solve(xtx, xty);
        double rss = 0d;
        for (int row = 0; row < n; row++) {
            double[] x = withIntercept(design[row]);
            double fitted = 0d;
            for (int i = 0; i < k; i++) {
                fitted += beta[i] * x[i];
            }
            rss += Math.pow(y[row] - fitted, 2);
        }
        return new MultipleFit(beta, rss, n, k);
    }

    private static double[] withIntercept(double[] row) {
        double[] x = new double[row.length + 1];
        x[0] = 1d;
        System.arraycopy(row, 0, x, 1, row.length);
        return x;
    }

    private static double[] solve(double[][] matrix, double[] rhs) {
        int n = rhs.length;
        double[][] a = new double[n][];
        for (int i = 0; i < n; i++) {
            a[i] = matrix[i].clone();
        }
        double[] b = rhs.clone();
        for (int col = 0; col < n; col++) {
            int pivot = col;
            for (int row = col + 1; row < n; row++) {
                if (Math.abs(a[row][col]) > Math.abs(a[pivot][col])) {
                    pivot = row;
                }
            }
            if (Math.abs(a[pivot][col]) < 1e-12) {
                throw new ArithmeticException("singular normal matrix at column " + col);
            }
            double[] tmpRow = a[col];
            a[col] = a[pivot];
            a[pivot] = tmpRow;
            double tmp = b[col];
            b[col] = b[pivot];
            b[pivot] = tmp;
            for (int row = col + 1; row < n; row++) {
                double factor = a[row][col] / a[col][col];
                b[row] -= factor * b[col];
                for (int k = col; k < n; k++) {
                    a[row][k] -= factor * a[col][k];
                }
            }
        }
        double[] x = new double[n];
        for (int row = n - 1; row >= 0; row--) {
            double sum = b[row];
            for (int k = row + 1; k < n; k++) {
                sum -= a[row][k] * x[k];
            }
            x[row] = sum / a[row][row];
        }
        return x;
    }

    public record LineFit(double slope, double intercept, double rSquared, double residualSumOfSquares) {
    }

    public record MultipleFit(double[] coefficients, double residualSumOfSquares, int observations, int parameters) {
    }
}
