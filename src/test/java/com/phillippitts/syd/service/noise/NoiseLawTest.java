package com.phillippitts.syd.service.noise;

import com.phillippitts.syd.exception.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class NoiseLawTest {

    private final HarveyModels models = mock(HarveyModels.class);

    @ParameterizedTest
    @EnumSource(NoiseLaw.class)
    void parameterCountsFollowComponentCount(NoiseLaw law) {
        assertThat(law.pinnedParameterCount()).isEqualTo(2 * law.components());
        assertThat(law.freeParameterCount()).isEqualTo(2 * law.components() + 1);
        assertThat(NoiseLaw.forComponents(law.components())).isSameAs(law);
    }

    @Test
    void rejectsUnsupportedComponentCount() {
        assertThatThrownBy(() -> NoiseLaw.forComponents(4))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("n_laws")
                .hasMessageContaining("0..3");
    }

    @Test
    void pinnedModelPassesFixedWhiteNoise() {
        when(models.one(10.0, 1.0, 2.0, 0.5)).thenReturn(42.0);

        double value = NoiseLaw.ONE.pinned(models, 0.5).evaluate(10.0, 1.0, 2.0);

        assertThat(value).isEqualTo(42.0);
        verify(models).one(10.0, 1.0, 2.0, 0.5);
    }

    @Test
    void pinnedNoneTakesNoParameters() {
        when(models.none(3.0, 0.7)).thenReturn(0.7);

        assertThat(NoiseLaw.NONE.pinned(models, 0.7).evaluate(3.0)).isEqualTo(0.7);
    }

    @Test
    void freeModelFitsWhiteNoiseAsLastParameter() {
        NoiseLaw.TWO.free(models).evaluate(5.0, 1.0, 2.0, 3.0, 4.0, 0.1);

        verify(models).two(5.0, 1.0, 2.0, 3.0, 4.0, 0.1);
    }

    @Test
    void wrongParameterCountRejected() {
        BackgroundModel model = NoiseLaw.THREE.free(models);

        assertThatThrownBy(() -> model.evaluate(1.0, 1.0, 2.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Expected 7");
    }
}
