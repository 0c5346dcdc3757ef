package com.phillippitts.syd.config;

import com.phillippitts.syd.config.properties.SydProperties;
import com.phillippitts.syd.service.schema.GlobalDefaults;
import com.phillippitts.syd.service.schema.ParameterCatalog;
import com.phillippitts.syd.service.schema.ParameterNames;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * Builds the parameter catalog and the process-wide defaults from {@link SydProperties}.
 */
@Configuration
public class ParameterDefaultsConfig {

    private static final Logger LOG = LogManager.getLogger(ParameterDefaultsConfig.class);

    @Bean
    public ParameterCatalog parameterCatalog() {
        return ParameterCatalog.standard();
    }

    /**
     * Declared defaults, then {@code syd.paths.*} and {@code syd.run.*}, then
     * {@code syd.defaults[...]} entries (cast per declared type, failing on unknown names).
     */
    @Bean
    public GlobalDefaults globalDefaults(ParameterCatalog catalog, SydProperties properties) {
        SydProperties.Paths paths = properties.getPaths();
        SydProperties.Run run = properties.getRun();

        GlobalDefaults.Builder builder = GlobalDefaults.builder(catalog)
                .set(ParameterNames.OUTDIR, paths.getOutdir())
                .set(ParameterNames.INFO, paths.getInfo())
                .set(ParameterNames.TODO, paths.getTodo())
                .set(ParameterNames.OVERWRITE, run.isOverwrite())
                .set(ParameterNames.SAVE, run.isSave())
                .set(ParameterNames.IGNORE, run.isIgnoreCatalog())
                .set(ParameterNames.N_THREADS, run.getThreads())
                .set(ParameterNames.MODE, run.isParallel() ? "parallel" : "load");

        for (Map.Entry<String, String> e : properties.getDefaults().entrySet()) {
            builder.setText(e.getKey(), e.getValue());
        }
        GlobalDefaults defaults = builder.build();
        LOG.info("Global defaults ready: {} parameters, {} configured overrides",
                defaults.values().size(), properties.getDefaults().size());
        return defaults;
    }
}
