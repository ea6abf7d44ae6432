package io.progtools.math;

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
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class MerweScaledSigmaPointsTest {

    @Test
    void weightsSumToOne() {
        MerweScaledSigmaPoints points = new MerweScaledSigmaPoints(3, 0.5, 2.0, 0.0);
        assertEquals(7, points.numSigmas());
        assertThat(Arrays.stream(points.meanWeights()).sum()).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void transformRecoversMeanAndCovariance() {
        MerweScaledSigmaPoints points = new MerweScaledSigmaPoints(2, 1.0, 0.0, -1.0);
        double[] mean = {1.0, -2.0};
        double[][] cov = {{2.0, 0.3}, {0.3, 0.5}};
        double[][] sigmas = points.sigmaPoints(mean, cov);
        assertArrayEquals(mean, sigmas[0]);

        UnscentedTransform.Result result =
            UnscentedTransform.transform(sigmas, points.meanWeights(), points.covarianceWeights(), null);
        assertArrayEquals(mean, result.mean(), 1e-12);
        for (int i = 0; i < 2; i++) {
            assertArrayEquals(cov[i], result.cov()[i], 1e-12);
        }
    }

    @Test
    void noiseIsAddedToCovariance() {
        MerweScaledSigmaPoints points = new MerweScaledSigmaPoints(1, 1.0, 0.0, 0.0);
        double[][] sigmas = points.sigmaPoints(new double[]{0.0}, new double[][]{{1.0}});
        UnscentedTransform.Result result = UnscentedTransform.transform(sigmas, points.meanWeights(),
            points.covarianceWeights(), new double[][]{{0.5}});
        assertThat(result.cov()[0][0]).isCloseTo(1.5, within(1e-12));
    }

    @Test
    void crossCovarianceOfIdentityMapIsCovariance() {
        MerweScaledSigmaPoints points = new MerweScaledSigmaPoints(2, 1.0, 0.0, -1.0);
        double[] mean = {0.0, 0.0};
        double[][] cov = {{1.0, 0.2}, {0.2, 3.0}};
        double[][] sigmas = points.sigmaPoints(mean, cov);
        double[][] cross = UnscentedTransform.crossCovariance(sigmas, mean, sigmas, mean, points.covarianceWeights());
        assertArrayEquals(cov[0], cross[0], 1e-12);
        assertArrayEquals(cov[1], cross[1], 1e-12);
    }

    @Test
    void unresolvedPointPropagatesNaN() {
        MerweScaledSigmaPoints points = new MerweScaledSigmaPoints(1, 1.0, 0.0, 0.0);
        double[][] values = {{1.0}, {Double.NaN}, {2.0}};
        UnscentedTransform.Result result =
            UnscentedTransform.transform(values, points.meanWeights(), points.covarianceWeights(), null);
        assertTrue(Double.isNaN(result.mean()[0]));
    }

    @Test
    void degenerateScalingRejected() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> new MerweScaledSigmaPoints(1, 1.0, 0.0, -1.0));
        assertEquals("kappa", e.getParameter());
    }
}
