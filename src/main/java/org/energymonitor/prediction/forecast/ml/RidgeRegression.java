/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.forecast.ml;

import static org.apache.commons.math3.linear.MatrixUtils.createRealMatrix;

import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import com.google.common.base.Preconditions;

/**
 * Penalized least squares: minimizes ||y - X b||^2 + sum_j penalty[j] * b[j]^2
 * through the normal equations (X'X + diag(penalty)) b = X'y, solved by a
 * Cholesky decomposition.
 */
final class RidgeRegression {
    // smallest accepted pivot of the decomposition
    private static final double SINGULAR_EPSILON = 1e-12;

    private RidgeRegression() {}

    /**
     * @param design n x p design matrix
     * @param target n targets
     * @param penalty p non-negative penalty weights
     * @return p coefficients
     * @throws IllegalStateException if the system is singular
     */
    static double[] solve(double[][] design, double[] target, double[] penalty) {
        Preconditions.checkArgument(design.length == target.length, "design and target sizes differ");
        Preconditions.checkArgument(design.length > 0, "empty design");
        int p = penalty.length;
        for (double[] row : design) {
            Preconditions.checkArgument(row.length == p, "design row width differs from penalty size");
        }

        RealMatrix x = createRealMatrix(design);
        RealMatrix xt = x.transpose();
        RealMatrix normal = xt.multiply(x);
        for (int i = 0; i < p; i++) {
            normal.addToEntry(i, i, penalty[i]);
        }
        RealVector rhs = xt.operate(new ArrayRealVector(target, false));

        try {
            return new CholeskyDecomposition(normal, CholeskyDecomposition.DEFAULT_RELATIVE_SYMMETRY_THRESHOLD, SINGULAR_EPSILON)
                .getSolver()
                .solve(rhs)
                .toArray();
        } catch (MathIllegalArgumentException e) {
            throw new IllegalStateException("Regression system is singular: " + e.getMessage(), e);
        }
    }
}
