package com.phillippitts.factopinion.service.fusion;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FusionEngineTest {

    private final FusionEngine engine = new FusionEngine(FusionEngine.DEFAULT_WEIGHT);

    @Test
    void addsWeightedLogicScore() {
        assertThat(engine.fuse(0.5, 1.0)).isCloseTo(0.6, within(1e-9));
        assertThat(engine.fuse(0.5, -1.5)).isCloseTo(0.35, within(1e-9));
        assertThat(engine.fuse(0.42, 0.0)).isCloseTo(0.42, within(1e-9));
    }

    @Test
    void clampsToUnitInterval() {
        assertThat(engine.fuse(0.95, 3.0)).isEqualTo(1.0);
        assertThat(engine.fuse(0.05, -3.0)).isEqualTo(0.0);
        assertThat(engine.fuse(1.0, 1e9)).isEqualTo(1.0);
        assertThat(engine.fuse(0.0, Double.NEGATIVE_INFINITY)).isEqualTo(0.0);
    }

    @Test
    void alwaysWithinBoundsAcrossGrid() {
        for (double p = 0.0; p <= 1.0; p += 0.05) {
            for (double s = -20.0; s <= 20.0; s += 0.5) {
                assertThat(engine.fuse(p, s)).isBetween(0.0, 1.0);
            }
        }
    }

    @Test
    void monotoneInLogicScore() {
        for (double p = 0.0; p <= 1.0; p += 0.1) {
            double previous = -1.0;
            for (double s = -15.0; s <= 15.0; s += 0.25) {
                double fused = engine.fuse(p, s);
                assertThat(fused).isGreaterThanOrEqualTo(previous);
                previous = fused;
            }
        }
    }

    @Test
    void zeroWeightIgnoresLogicScore() {
        FusionEngine off = new FusionEngine(0.0);

        assertThat(off.fuse(0.3, 100.0)).isEqualTo(0.3);
        assertThat(off.fuse(0.3, Double.POSITIVE_INFINITY)).isEqualTo(0.3);
    }

    @Test
    void rejectsNaNInputs() {
        assertThatThrownBy(() -> engine.fuse(Double.NaN, 0.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.fuse(0.5, Double.NaN)).isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest
    @ValueSource(doubles = {-0.1, Double.NaN, Double.POSITIVE_INFINITY})
    void rejectsInvalidWeights(double weight) {
        assertThatThrownBy(() -> new FusionEngine(weight)).isInstanceOf(IllegalArgumentException.class);
    }
}
