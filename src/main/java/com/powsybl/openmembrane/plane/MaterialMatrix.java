/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmembrane.plane;

import com.powsybl.math.matrix.DenseMatrix;
import com.powsybl.math.matrix.LUDecomposition;
import com.powsybl.math.matrix.MatrixException;
import com.powsybl.openmembrane.util.Angles;
import net.jafama.FastMath;

import java.util.Objects;

/**
 * 3x3 material stiffness matrix relating (x, y, xy) strains to (x, y, xy) stresses.
 *
 * @author Open Membrane team
 */
public class MaterialMatrix {

    public static final int SIZE = 3;

    private static final double SINGULARITY_THRESHOLD = 1E-14;

    private final DenseMatrix matrix;

    public MaterialMatrix() {
        this(new DenseMatrix(SIZE, SIZE));
    }

    private MaterialMatrix(DenseMatrix matrix) {
        this.matrix = Objects.requireNonNull(matrix);
    }

    public static MaterialMatrix zero() {
        return new MaterialMatrix();
    }

    public static MaterialMatrix of(double[][] values) {
        Objects.requireNonNull(values);
        if (values.length != SIZE) {
            throw new IllegalArgumentException("Material matrix must have " + SIZE + " rows");
        }
        MaterialMatrix result = new MaterialMatrix();
        for (int i = 0; i < SIZE; i++) {
            if (values[i].length != SIZE) {
                throw new IllegalArgumentException("Material matrix must have " + SIZE + " columns");
            }
            for (int j = 0; j < SIZE; j++) {
                result.matrix.set(i, j, values[i][j]);
            }
        }
        return result;
    }

    public static MaterialMatrix diagonal(double d1, double d2, double d3) {
        MaterialMatrix result = new MaterialMatrix();
        result.matrix.set(0, 0, d1);
        result.matrix.set(1, 1, d2);
        result.matrix.set(2, 2, d3);
        return result;
    }

    /**
     * Stiffness of an orthotropic material with modules e1 and e2 along directions theta and theta + 90 degrees,
     * expressed in the horizontal frame (T^t.D.T). The shear module is e1.e2 / (e1 + e2), zero when e1 + e2 = 0.
     */
    public static MaterialMatrix fromPrincipal(double e1, double e2, double theta) {
        double sum = e1 + e2;
        double g = sum == 0 ? 0 : e1 * e2 / sum;

        double cos = Angles.cos(theta);
        double sin = Angles.sin(theta);
        double cos2 = cos * cos;
        double sin2 = sin * sin;
        double cosSin = cos * sin;
        double[][] t = {
            {cos2, sin2, cosSin},
            {sin2, cos2, -cosSin},
            {-2 * cosSin, 2 * cosSin, cos2 - sin2}
        };
        double[] d = {e1, e2, g};

        MaterialMatrix result = new MaterialMatrix();
        for (int i = 0; i < SIZE; i++) {
            for (int j = 0; j < SIZE; j++) {
                double value = 0;
                for (int k = 0; k < SIZE; k++) {
                    value += t[k][i] * d[k] * t[k][j];
                }
                result.matrix.set(i, j, value);
            }
        }
        return result;
    }

    /**
     * a (x) b, i.e. m(i, j) = a(i) * b(j).
     */
    public static MaterialMatrix outerProduct(double[] a, double[] b) {
        checkVector(a);
        checkVector(b);
        MaterialMatrix result = new MaterialMatrix();
        for (int i = 0; i < SIZE; i++) {
            for (int j = 0; j < SIZE; j++) {
                result.matrix.set(i, j, a[i] * b[j]);
            }
        }
        return result;
    }

    public double get(int i, int j) {
        return matrix.get(i, j);
    }

    public MaterialMatrix add(MaterialMatrix other) {
        MaterialMatrix result = copy();
        for (int i = 0; i < SIZE; i++) {
            for (int j = 0; j < SIZE; j++) {
                result.matrix.add(i, j, other.matrix.get(i, j));
            }
        }
        return result;
    }

    public MaterialMatrix subtract(MaterialMatrix other) {
        MaterialMatrix result = copy();
        for (int i = 0; i < SIZE; i++) {
            for (int j = 0; j < SIZE; j++) {
                result.matrix.add(i, j, -other.matrix.get(i, j));
            }
        }
        return result;
    }

    public MaterialMatrix scale(double factor) {
        MaterialMatrix result = new MaterialMatrix();
        for (int i = 0; i < SIZE; i++) {
            for (int j = 0; j < SIZE; j++) {
                result.matrix.set(i, j, matrix.get(i, j) * factor);
            }
        }
        return result;
    }

    public double[] multiply(double[] vector) {
        checkVector(vector);
        double[] result = new double[SIZE];
        for (int i = 0; i < SIZE; i++) {
            for (int j = 0; j < SIZE; j++) {
                result[i] += matrix.get(i, j) * vector[j];
            }
        }
        return result;
    }

    public StressState multiply(StrainState strains) {
        return StressState.fromArray(multiply(strains.toArray()));
    }

    /**
     * Solve m.x = b with a LU decomposition.
     *
     * @throws MatrixException if the matrix is singular
     */
    public double[] solve(double[] b) {
        checkVector(b);
        double det = determinant();
        double scale = maxAbs();
        if (scale == 0 || !Double.isFinite(det) || FastMath.abs(det) <= SINGULARITY_THRESHOLD * scale * scale * scale) {
            throw new MatrixException("Singular material matrix (determinant " + det + ")");
        }
        double[] x = b.clone();
        DenseMatrix a = copy().matrix;
        try (LUDecomposition lu = a.decomposeLU()) {
            lu.solve(x);
        }
        return x;
    }

    public StrainState solve(StressState stresses) {
        return StrainState.fromArray(solve(stresses.toArray()));
    }

    public double determinant() {
        double a = matrix.get(0, 0);
        double b = matrix.get(0, 1);
        double c = matrix.get(0, 2);
        double d = matrix.get(1, 0);
        double e = matrix.get(1, 1);
        double f = matrix.get(1, 2);
        double g = matrix.get(2, 0);
        double h = matrix.get(2, 1);
        double i = matrix.get(2, 2);
        return a * (e * i - f * h) - b * (d * i - f * g) + c * (d * h - e * g);
    }

    public boolean isFinite() {
        for (int i = 0; i < SIZE; i++) {
            for (int j = 0; j < SIZE; j++) {
                if (!Double.isFinite(matrix.get(i, j))) {
                    return false;
                }
            }
        }
        return true;
    }

    public double[][] toArray() {
        double[][] values = new double[SIZE][SIZE];
        for (int i = 0; i < SIZE; i++) {
            for (int j = 0; j < SIZE; j++) {
                values[i][j] = matrix.get(i, j);
            }
        }
        return values;
    }

    public MaterialMatrix copy() {
        MaterialMatrix result = new MaterialMatrix();
        for (int i = 0; i < SIZE; i++) {
            for (int j = 0; j < SIZE; j++) {
                result.matrix.set(i, j, matrix.get(i, j));
            }
        }
        return result;
    }

    private double maxAbs() {
        double max = 0;
        for (int i = 0; i < SIZE; i++) {
            for (int j = 0; j < SIZE; j++) {
                max = Math.max(max, FastMath.abs(matrix.get(i, j)));
            }
        }
        return max;
    }

    private static void checkVector(double[] vector) {
        if (vector.length != SIZE) {
            throw new IllegalArgumentException("Vector length " + vector.length + " differs from " + SIZE);
        }
    }
}
