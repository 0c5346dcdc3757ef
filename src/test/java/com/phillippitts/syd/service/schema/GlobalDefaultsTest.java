package com.phillippitts.syd.service.schema;

import com.phillippitts.syd.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GlobalDefaultsTest {

    private final ParameterCatalog catalog = ParameterCatalog.standard();

    @Test
    void seededFromCatalog() {
        GlobalDefaults defaults = GlobalDefaults.of(catalog);

        assertThat(defaults.values()).containsOnlyKeys(catalog.names().toArray(String[]::new));
        assertThat(defaults.get(ParameterNames.N_TRIALS)).isEqualTo(3);
        assertThat(defaults.get(ParameterNames.NUMAX)).isNull();
        assertThat(defaults.isEnabled(ParameterNames.SAVE)).isTrue();
    }

    @Test
    void builderSetsAndCastsText() {
        GlobalDefaults defaults = GlobalDefaults.builder(catalog)
                .set(ParameterNames.MC_ITER, 200)
                .setText(ParameterNames.BIN_MODE, "median")
                .setText(ParameterNames.N_TRIALS, "5")
                .setText(ParameterNames.NUMAX, " ")
                .build();

        assertThat(defaults.get(ParameterNames.MC_ITER)).isEqualTo(200);
        assertThat(defaults.getString(ParameterNames.BIN_MODE)).isEqualTo("median");
        assertThat(defaults.get(ParameterNames.N_TRIALS)).isEqualTo(5);
        assertThat(defaults.get(ParameterNames.NUMAX)).isNull();
    }

    @Test
    void rejectsUnknownNames() {
        assertThatThrownBy(() -> GlobalDefaults.builder(catalog).set("bogus", 1))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> GlobalDefaults.of(catalog).get("bogus"))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void uncastableTextIsConfigurationError() {
        assertThatThrownBy(() -> GlobalDefaults.builder(catalog).setText(ParameterNames.N_TRIALS, "three"))
                .isInstanceOf(ConfigurationException.class)
                .extracting("parameter").isEqualTo(ParameterNames.N_TRIALS);
    }

    @Test
    void immutableAndDerivable() {
        GlobalDefaults base = GlobalDefaults.of(catalog);
        GlobalDefaults variant = base.toBuilder().set(ParameterNames.OVERWRITE, true).build();

        assertThat(base.isEnabled(ParameterNames.OVERWRITE)).isFalse();
        assertThat(variant.isEnabled(ParameterNames.OVERWRITE)).isTrue();
        assertThat(base).isEqualTo(GlobalDefaults.of(catalog));
        assertThatThrownBy(() -> base.values().put(ParameterNames.OVERWRITE, true))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
