package com.phillippitts.syd.config;

import com.phillippitts.syd.config.properties.SydProperties;
import com.phillippitts.syd.exception.ConfigurationException;
import com.phillippitts.syd.service.schema.GlobalDefaults;
import com.phillippitts.syd.service.schema.ParameterCatalog;
import com.phillippitts.syd.service.schema.ParameterNames;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParameterDefaultsConfigTest {

    private final ParameterDefaultsConfig config = new ParameterDefaultsConfig();
    private final ParameterCatalog catalog = config.parameterCatalog();

    @Test
    void seedsPathsAndRunOptions() {
        SydProperties properties = new SydProperties();
        properties.getPaths().setOutdir("out");
        properties.getRun().setParallel(true);
        properties.getRun().setThreads(4);
        properties.getRun().setOverwrite(true);

        GlobalDefaults defaults = config.globalDefaults(catalog, properties);

        assertThat(defaults.getString(ParameterNames.OUTDIR)).isEqualTo("out");
        assertThat(defaults.get(ParameterNames.N_THREADS)).isEqualTo(4);
        assertThat(defaults.getString(ParameterNames.MODE)).isEqualTo("parallel");
        assertThat(defaults.isEnabled(ParameterNames.OVERWRITE)).isTrue();
        assertThat(defaults.isEnabled(ParameterNames.SAVE)).isTrue();
    }

    @Test
    void castsConfiguredDefaultsByDeclaredType() {
        SydProperties properties = new SydProperties();
        properties.getDefaults().put(ParameterNames.MC_ITER, "200");
        properties.getDefaults().put(ParameterNames.BIN_MODE, "median");

        GlobalDefaults defaults = config.globalDefaults(catalog, properties);

        assertThat(defaults.get(ParameterNames.MC_ITER)).isEqualTo(200);
        assertThat(defaults.getString(ParameterNames.BIN_MODE)).isEqualTo("median");
    }

    @Test
    void rejectsUnknownConfiguredDefault() {
        SydProperties properties = new SydProperties();
        properties.getDefaults().put("not_a_parameter", "1");

        assertThatThrownBy(() -> config.globalDefaults(catalog, properties))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("not_a_parameter");
    }

    @Test
    void rejectsUncastableConfiguredDefault() {
        SydProperties properties = new SydProperties();
        properties.getDefaults().put(ParameterNames.MC_ITER, "many");

        assertThatThrownBy(() -> config.globalDefaults(catalog, properties))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining(ParameterNames.MC_ITER);
    }
}
