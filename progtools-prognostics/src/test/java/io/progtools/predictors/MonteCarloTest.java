package io.progtools.predictors;

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
import io.progtools.model.ThrownObject;
import io.progtools.model.TwoEventModel;
import io.progtools.uncertain.KeySchema;
import io.progtools.uncertain.LabeledVector;
import io.progtools.uncertain.MultivariateNormalDist;
import io.progtools.uncertain.ScalarData;
import io.progtools.uncertain.UnweightedSamples;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class MonteCarloTest {

    private final TwoEventModel counter = new TwoEventModel();
    private final ScalarData atZero = new ScalarData(KeySchema.of("x"), 0.0);

    @Test
    void thrownObjectImpact() {
        ThrownObject model = new ThrownObject();
        MonteCarlo mc = new MonteCarlo(model);
        PredictionResult result = mc.predict(new ScalarData(model.initialize(null, null)), null,
            new PredictorConfig().setNSamples(1).setDt(0.01).setEvents(List.of("impact")));

        LabeledVector toe = ((UnweightedSamples) result.timeOfEvent()).get(0);
        assertThat(toe.get("impact")).isCloseTo(ThrownObject.IMPACT_TIME, within(0.01 * ThrownObject.IMPACT_TIME));
        LabeledVector impact = result.finalState("impact").mean();
        assertThat(impact.get("x")).isLessThanOrEqualTo(0.0);
    }

    @Test
    void allStrategyResolvesEveryEvent() {
        PredictionResult result = new MonteCarlo(counter).predict(atZero, null,
            new PredictorConfig().setNSamples(3).setDt(0.5));

        UnweightedSamples toe = (UnweightedSamples) result.timeOfEvent();
        assertEquals(3, toe.size());
        for (LabeledVector row : toe) {
            assertEquals(2.0, row.get("early"));
            assertEquals(5.0, row.get("late"));
        }
        assertThat(result.times()).containsExactly(0.0, 2.0, 5.0);
        assertEquals(2.0, result.finalState("early").mean().get("x"));
        assertEquals(5.0, result.finalState("late").mean().get("x"));
    }

    @Test
    void firstStrategyStopsAtFirstEvent() {
        PredictionResult result = new MonteCarlo(counter).predict(atZero, null,
            new PredictorConfig().setNSamples(2).setDt(0.5).setEventStrategy(EventStrategy.FIRST));

        UnweightedSamples toe = (UnweightedSamples) result.timeOfEvent();
        assertEquals(2.0, toe.get(0).get("early"));
        assertTrue(Double.isNaN(toe.get(0).get("late")));
        assertThat(result.times()).containsExactly(0.0, 2.0);

        UnweightedSamples lateStates = (UnweightedSamples) result.finalState("late");
        assertEquals(2, lateStates.size());
        assertNull(lateStates.get(0));
        assertEquals(0, lateStates.presentCount());
    }

    @Test
    void horizonLeavesLaterEventsUnresolved() {
        PredictionResult result = new MonteCarlo(counter).predict(atZero, null,
            new PredictorConfig().setNSamples(1).setDt(0.5).setHorizon(3.0));

        LabeledVector toe = ((UnweightedSamples) result.timeOfEvent()).get(0);
        assertEquals(2.0, toe.get("early"));
        assertTrue(Double.isNaN(toe.get("late")));
        assertThat(result.times().get(result.times().size() - 1)).isCloseTo(3.0, within(1e-9));
    }

    @Test
    void sampleStateIsUsedAsGiven() {
        UnweightedSamples starts = new UnweightedSamples(counter.states());
        for (double x0 : new double[]{0.0, 0.5, 1.0, 1.5}) {
            starts.add(counter.states().vector(x0));
        }
        PredictionResult result = new MonteCarlo(counter).predict(starts, null,
            new PredictorConfig().setDt(0.5).setEvents(List.of("early")));

        UnweightedSamples toe = (UnweightedSamples) result.timeOfEvent();
        assertThat(toe.key("early")).containsExactly(2.0, 1.5, 1.0, 0.5);

        UnweightedSamplesPrediction states = (UnweightedSamplesPrediction) result.states();
        assertEquals(4, states.numSamples());
        assertEquals(starts, states.snapshot(0));
    }

    @Test
    void sameSeedSameResult() {
        ThrownObject model = new ThrownObject();
        model.setProcessNoise(0.5);
        MultivariateNormalDist belief = new MultivariateNormalDist(model.states(),
            new double[]{ThrownObject.X0, ThrownObject.V0}, new double[][]{{0.1, 0.0}, {0.0, 0.1}});
        PredictorConfig config = new PredictorConfig().setNSamples(20).setDt(0.05).setSeed(4L);

        PredictionResult a = new MonteCarlo(model, config).predict(belief, null);
        PredictionResult b = new MonteCarlo(model, config).predict(belief, null);
        assertEquals(a.timeOfEvent(), b.timeOfEvent());
        assertThat(a.timeOfEvent().mean().get("impact"))
            .isCloseTo(ThrownObject.IMPACT_TIME, within(0.05 * ThrownObject.IMPACT_TIME));
    }

    @Test
    void saveFrequencyStaysOnTheGridAcrossEvents() {
        PredictionResult result = new MonteCarlo(counter).predict(atZero, null,
            new PredictorConfig().setNSamples(1).setDt(0.25).setSaveFreq(1.5));
        assertThat(result.times()).containsExactly(0.0, 1.5, 2.0, 3.0, 4.5, 5.0);
    }

    @Test
    void lazyOutputsFollowStates() {
        PredictionResult result = new MonteCarlo(counter).predict(atZero, null,
            new PredictorConfig().setNSamples(2).setDt(0.5).setSaveFreq(1.0));
        UnweightedSamples outputs = (UnweightedSamples) result.outputs().snapshot(1);
        assertEquals(2, outputs.size());
        assertEquals(1.0, outputs.get(0).get("x"));
        assertEquals(0.5, result.eventStates().snapshot(1).mean().get("early"));
    }

    @Test
    void unknownEventIsRejected() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> new MonteCarlo(counter).predict(atZero, null, new PredictorConfig().setEvents(List.of("never"))));
        assertEquals("never", e.getParameter());
    }

    @Test
    void noEventsNeedAHorizon() {
        MonteCarlo mc = new MonteCarlo(counter);
        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> mc.predict(atZero, null, new PredictorConfig().setEvents(List.of())));
        assertEquals("horizon", e.getParameter());

        PredictionResult result = mc.predict(atZero, null,
            new PredictorConfig().setEvents(List.of()).setHorizon(2.0).setDt(0.5).setNSamples(1));
        assertThat(result.times()).containsExactly(0.0, 2.0);
        assertTrue(result.finalStates().isEmpty());
    }

    @Test
    void missingStateKeyIsNamed() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> new MonteCarlo(counter).predict(new ScalarData(KeySchema.of("y"), 0.0), null));
        assertEquals("x", e.getParameter());
    }

    @Test
    void constructorDefaultsAreOverlaid() {
        MonteCarlo mc = new MonteCarlo(counter, new PredictorConfig().setDt(0.1));
        PredictorConfig defaults = mc.getDefaults();
        assertEquals(0.1, defaults.getDt());
        assertEquals(0.0, defaults.getT0());
        assertEquals(EventStrategy.ALL, defaults.getEventStrategy());
    }
}
