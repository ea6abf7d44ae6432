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

import io.progtools.model.AbstractPrognosticsModel;
import io.progtools.model.ConfigurationException;
import io.progtools.model.ThrownObject;
import io.progtools.uncertain.KeySchema;
import io.progtools.uncertain.LabeledVector;
import io.progtools.uncertain.MultivariateNormalDist;
import io.progtools.uncertain.ScalarData;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static io.progtools.estimators.EstimatorTestSupport.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class KalmanFilterTest {

    private final ThrownObject model = new ThrownObject();

    @Test
    void convergesFromBiasedGuess() {
        LabeledVector[] truth = truth(model);
        KalmanFilter kf = new KalmanFilter(model, biasedBelief(model));
        run(kf, model, truth);

        MultivariateNormalDist state = kf.getState();
        assertThat(state.mean().get("x")).isCloseTo(truth[STEPS].get("x"), within(0.5));
        assertThat(state.mean().get("v")).isCloseTo(truth[STEPS].get("v"), within(0.5));
        assertEquals(STEPS * DT, kf.getTime(), 1e-12);
    }

    @Test
    void subStepsMatchSingleSteps() {
        LabeledVector[] truth = truth(model);
        KalmanFilter coarse = new KalmanFilter(model, biasedBelief(model), new EstimatorConfig().setDt(DT));
        KalmanFilter fine = new KalmanFilter(model, biasedBelief(model), new EstimatorConfig().setDt(DT / 4));
        run(coarse, model, truth);
        run(fine, model, truth);
        assertThat(fine.getState().mean().get("x")).isCloseTo(coarse.getState().mean().get("x"), within(0.5));
    }

    @Test
    void scalarInitialStateUsesScaledProcessNoise() {
        KalmanFilter kf = new KalmanFilter(model, new ScalarData(model.initialize(null, null)));
        double[][] p = kf.getState().cov();
        assertEquals(1e-4, p[0][0], 1e-15);
        assertEquals(0.0, p[0][1]);
    }

    @Test
    void rejectsNonLinearModel() {
        AbstractPrognosticsModel nonlinear = new AbstractPrognosticsModel(KeySchema.of("x"), KeySchema.empty(),
            KeySchema.of("z"), KeySchema.of("e")) {
            @Override
            public LabeledVector initialize(LabeledVector u, LabeledVector z) {
                return states().vector(1.0);
            }

            @Override
            public LabeledVector nextState(LabeledVector x, LabeledVector u, double dt) {
                return x.withValues(new double[]{x.get(0) * x.get(0)});
            }

            @Override
            public LabeledVector output(LabeledVector x) {
                return outputs().vector(x.get(0));
            }

            @Override
            public LabeledVector eventState(LabeledVector x) {
                return events().vector(1.0);
            }
        };
        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> new KalmanFilter(nonlinear, new ScalarData(KeySchema.of("x"), 1.0)));
        assertEquals("model", e.getParameter());
    }

    @Test
    void timeMustIncrease() {
        KalmanFilter kf = new KalmanFilter(model, biasedBelief(model));
        LabeledVector z = model.outputs().vector(2.0);
        kf.estimate(0.5, null, z);
        TimeOrderingException e = assertThrows(TimeOrderingException.class, () -> kf.estimate(0.5, null, z));
        assertEquals(0.5, e.getCurrentTime());
        assertEquals(0.5, e.getRequestedTime());
        assertThrows(TimeOrderingException.class, () -> kf.estimate(0.2, null, z));
    }

    @Test
    void missingStateKeyIsNamed() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> new KalmanFilter(model, new ScalarData(KeySchema.of("x"), 1.0)));
        assertEquals("v", e.getParameter());
    }

    @Test
    void wrongSizedNoiseRejected() {
        EstimatorConfig config = new EstimatorConfig().setQ(new double[][]{{1.0}});
        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> new KalmanFilter(model, biasedBelief(model), config));
        assertEquals("Q", e.getParameter());
    }
}
