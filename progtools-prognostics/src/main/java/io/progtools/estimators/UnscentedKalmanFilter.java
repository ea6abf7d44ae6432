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

import io.progtools.math.MerweScaledSigmaPoints;
import io.progtools.math.UnscentedTransform;
import io.progtools.model.PrognosticsModel;
import io.progtools.uncertain.KeySchema;
import io.progtools.uncertain.LabeledVector;
import io.progtools.uncertain.MultivariateNormalDist;
import io.progtools.uncertain.UncertainData;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/// Unscented Kalman filter for nonlinear models.
///
/// Each sub-step draws scaled sigma points from `(x, P)`, pushes every point
/// through the noise-free [PrognosticsModel#nextState] and recombines them with
/// the process noise `Q`. The correction maps the last propagated points through
/// [PrognosticsModel#output]:
///
/// ```
/// (zp, S) = UT(h(σ), R)
///     Pxz = Σ Wc·(σ - x)(h(σ) - zp)ᵀ
///       K = Pxz·S⁻¹
///       x = x + K·(z - zp)
///       P = P - K·S·Kᵀ
/// ```
///
/// Defaults are `alpha = 1`, `beta = 0`, `kappa = -1`, `Q = R = 1e-3·I` and an
/// unbounded sub-step.
public class UnscentedKalmanFilter extends StateEstimator {

    private static final Logger logger = LogManager.getLogger(UnscentedKalmanFilter.class);

    public static final double DEFAULT_T0 = -1e-10;
    public static final double DEFAULT_DT = Double.POSITIVE_INFINITY;
    public static final double DEFAULT_ALPHA = 1.0;
    public static final double DEFAULT_BETA = 0.0;
    public static final double DEFAULT_KAPPA = -1.0;
    public static final double DEFAULT_NOISE = 1e-3;

    private final MerweScaledSigmaPoints points;
    private final double[][] q;
    private final double[][] r;

    private double[] x;
    private double[][] p;
    private double[][] sigmasF;

    public UnscentedKalmanFilter(PrognosticsModel model, UncertainData x0) {
        this(model, x0, null);
    }

    public UnscentedKalmanFilter(PrognosticsModel model, UncertainData x0, EstimatorConfig config) {
        super(model, x0, config, DEFAULT_T0, DEFAULT_DT);
        KeySchema states = model.states();
        int n = states.size();
        this.points = new MerweScaledSigmaPoints(n,
            valueOr(this.config.getAlpha(), DEFAULT_ALPHA),
            valueOr(this.config.getBeta(), DEFAULT_BETA),
            valueOr(this.config.getKappa(), DEFAULT_KAPPA));
        this.q = this.config.getQ() == null ? diagonal(n, DEFAULT_NOISE) : requireSquare("Q", this.config.getQ(), n);
        int outputs = model.outputs().size();
        this.r = this.config.getR() == null
            ? diagonal(outputs, DEFAULT_NOISE) : requireSquare("R", this.config.getR(), outputs);
        this.x = x0.mean().reorder(states).toArray();
        this.p = initialCovariance(x0, states, q);
        this.sigmasF = points.sigmaPoints(x, p);
        logger.debug("UKF with {} sigma points, lambda={}", points.numSigmas(), points.lambda());
    }

    private static double valueOr(Double value, double fallback) {
        return value == null ? fallback : value;
    }

    @Override
    protected void predict(LabeledVector u, double dt) {
        KeySchema states = model.states();
        double[][] sigmas = points.sigmaPoints(x, p);
        double[][] propagated = new double[sigmas.length][];
        for (int i = 0; i < sigmas.length; i++) {
            propagated[i] = model.nextState(LabeledVector.of(states, sigmas[i]), u, dt).toArray();
        }
        UnscentedTransform.Result result =
            UnscentedTransform.transform(propagated, points.meanWeights(), points.covarianceWeights(), q);
        sigmasF = propagated;
        x = result.mean();
        p = result.cov();
    }

    @Override
    protected void correct(LabeledVector z) {
        KeySchema states = model.states();
        double[][] sigmasH = new double[sigmasF.length][];
        for (int i = 0; i < sigmasF.length; i++) {
            sigmasH[i] = model.output(LabeledVector.of(states, sigmasF[i])).reorder(model.outputs()).toArray();
        }
        double[] wc = points.covarianceWeights();
        UnscentedTransform.Result predicted = UnscentedTransform.transform(sigmasH, points.meanWeights(), wc, r);
        double[] zp = predicted.mean();
        RealMatrix s = MatrixUtils.createRealMatrix(predicted.cov());
        RealMatrix pxz = MatrixUtils.createRealMatrix(UnscentedTransform.crossCovariance(sigmasF, x, sigmasH, zp, wc));
        RealMatrix k = pxz.multiply(new LUDecomposition(s).getSolver().getInverse());

        double[] residual = z.toArray();
        for (int i = 0; i < residual.length; i++) {
            residual[i] -= zp[i];
        }
        x = MatrixUtils.createRealVector(x).add(k.operate(MatrixUtils.createRealVector(residual))).toArray();
        p = MatrixUtils.createRealMatrix(p).subtract(k.multiply(s).multiply(k.transpose())).getData();
    }

    @Override
    public MultivariateNormalDist getState() {
        return new MultivariateNormalDist(model.states(), x.clone(), p);
    }
}
