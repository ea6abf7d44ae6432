package io.progtools.estimators;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.progtools.model.ConfigurationException;
import io.progtools.model.LinearModel;
import io.progtools.model.PrognosticsModel;
import io.progtools.uncertain.KeySchema;
import io.progtools.uncertain.LabeledVector;
import io.progtools.uncertain.MultivariateNormalDist;
import io.progtools.uncertain.UncertainData;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/// Linear Kalman filter for a [LinearModel].
///
/// The continuous system `dx/dt = A·x + B·u + E` is discretized per sub-step as
/// `F = I + A·dt` and `B' = [B | E]·dt`, with the input augmented by a constant 1
/// so that `E` enters as a control term.
///
/// | Step | Equations |
/// |------|-----------|
/// | predict | `x = F·x + B'·[u; 1]`, `P = α²·F·P·Fᵀ + Q` |
/// | correct | `y = z - D - C·x`, `S = C·P·Cᵀ + R`, `K = P·Cᵀ·S⁻¹`, `x = x + K·y` |
///
/// The covariance correction uses the Joseph form
/// `P = (I - K·C)·P·(I - K·C)ᵀ + K·R·Kᵀ`, which stays symmetric under round-off.
/// A singular `S` surfaces as a commons-math `SingularMatrixException`.
public class KalmanFilter extends StateEstimator {

    public static final double DEFAULT_T0 = -1e-10;
    public static final double DEFAULT_DT = 1.0;
    public static final double DEFAULT_NOISE = 1e-3;

    private final RealMatrix a;
    private final RealMatrix bAugmented;
    private final RealMatrix c;
    private final RealVector d;
    private final RealMatrix q;
    private final RealMatrix r;
    private final RealMatrix identity;
    private final double alpha;

    private RealVector x;
    private RealMatrix p;

    public KalmanFilter(PrognosticsModel model, UncertainData x0) {
        this(model, x0, null);
    }

    /// @throws ConfigurationException if the model is not a [LinearModel], or a matrix has the wrong size
    public KalmanFilter(PrognosticsModel model, UncertainData x0, EstimatorConfig config) {
        super(requireLinear(model), x0, config, DEFAULT_T0, DEFAULT_DT);
        LinearModel linear = (LinearModel) model;
        KeySchema states = model.states();
        int n = states.size();
        int m = model.inputs().size();

        this.a = MatrixUtils.createRealMatrix(linear.a());
        double[][] b = linear.b();
        double[] e = linear.e();
        double[][] be = new double[n][m + 1];
        for (int i = 0; i < n; i++) {
            System.arraycopy(b[i], 0, be[i], 0, m);
            be[i][m] = e[i];
        }
        this.bAugmented = new Array2DRowRealMatrix(be, false);
        this.c = MatrixUtils.createRealMatrix(linear.c());
        this.d = new ArrayRealVector(linear.d());
        this.identity = MatrixUtils.createRealIdentityMatrix(n);

        double[][] qm = this.config.getQ() == null
            ? diagonal(n, DEFAULT_NOISE) : requireSquare("Q", this.config.getQ(), n);
        double[][] rm = this.config.getR() == null
            ? diagonal(model.outputs().size(), DEFAULT_NOISE)
            : requireSquare("R", this.config.getR(), model.outputs().size());
        this.q = MatrixUtils.createRealMatrix(qm);
        this.r = MatrixUtils.createRealMatrix(rm);
        this.alpha = this.config.getAlpha() == null ? 1.0 : this.config.getAlpha();

        this.x = new ArrayRealVector(x0.mean().reorder(states).toArray());
        this.p = MatrixUtils.createRealMatrix(initialCovariance(x0, states, qm));
    }

    private static PrognosticsModel requireLinear(PrognosticsModel model) {
        if (!(model instanceof LinearModel)) {
            throw new ConfigurationException("model", "Kalman filter only supports linear models (LinearModel), got "
                + model.getClass().getName());
        }
        return model;
    }

    @Override
    protected void predict(LabeledVector u, double dt) {
        RealMatrix f = identity.add(a.scalarMultiply(dt));
        RealMatrix bd = bAugmented.scalarMultiply(dt);
        double[] uAug = new double[u.size() + 1];
        System.arraycopy(u.toArray(), 0, uAug, 0, u.size());
        uAug[u.size()] = 1.0;
        x = f.operate(x).add(bd.operate(new ArrayRealVector(uAug, false)));
        p = f.multiply(p).multiply(f.transpose()).scalarMultiply(alpha * alpha).add(q);
    }

    @Override
    protected void correct(LabeledVector z) {
        RealVector y = new ArrayRealVector(z.toArray()).subtract(d).subtract(c.operate(x));
        RealMatrix pct = p.multiply(c.transpose());
        RealMatrix s = c.multiply(pct).add(r);
        RealMatrix k = pct.multiply(new LUDecomposition(s).getSolver().getInverse());
        x = x.add(k.operate(y));
        RealMatrix ikc = identity.subtract(k.multiply(c));
        p = ikc.multiply(p).multiply(ikc.transpose()).add(k.multiply(r).multiply(k.transpose()));
    }

    @Override
    public MultivariateNormalDist getState() {
        return new MultivariateNormalDist(model.states(), x.toArray(), p.getData());
    }
}
