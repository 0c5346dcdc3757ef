package com.phillippitts.syd.runner;

import com.phillippitts.syd.config.properties.SydProperties;
import com.phillippitts.syd.service.aggregate.AggregationResult;
import com.phillippitts.syd.service.aggregate.ResultAggregator;
import com.phillippitts.syd.service.parallel.PipelineReport;
import com.phillippitts.syd.service.parallel.PipelineService;
import com.phillippitts.syd.service.parallel.StarProcessor;
import com.phillippitts.syd.service.resolve.ParameterResolver;
import com.phillippitts.syd.service.resolve.ResolutionRequest;
import com.phillippitts.syd.service.resolve.ResolvedStars;
import com.phillippitts.syd.service.schema.GlobalDefaults;
import com.phillippitts.syd.service.schema.ParameterNames;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs the pipeline at startup: resolve the stars, dispatch the fitting stage, then
 * consolidate the per-star artifacts.
 *
 * <p>Stars come from the non-option arguments, else {@code syd.stars}, else the star list file.
 * Without a {@link StarProcessor} bean only resolution and aggregation run. Disabled with
 * {@code syd.runner.enabled=false}.
 */
@Component
@ConditionalOnProperty(prefix = "syd.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PipelineRunner implements ApplicationRunner {

    private static final Logger LOG = LogManager.getLogger(PipelineRunner.class);

    private final ParameterResolver resolver;
    private final GlobalDefaults defaults;
    private final SydProperties properties;
    private final PipelineService pipelineService;
    private final ResultAggregator aggregator;
    private final ObjectProvider<StarProcessor> processorProvider;

    public PipelineRunner(ParameterResolver resolver,
                          GlobalDefaults defaults,
                          SydProperties properties,
                          PipelineService pipelineService,
                          ResultAggregator aggregator,
                          ObjectProvider<StarProcessor> processorProvider) {
        this.resolver = resolver;
        this.defaults = defaults;
        this.properties = properties;
        this.pipelineService = pipelineService;
        this.aggregator = aggregator;
        this.processorProvider = processorProvider;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> stars = args.getNonOptionArgs().isEmpty() ? properties.getStars() : args.getNonOptionArgs();
        ResolutionRequest request = ResolutionRequest.builder(defaults)
                .stars(stars)
                .build();
        ResolvedStars resolved = resolver.resolve(request);

        StarProcessor processor = processorProvider.getIfAvailable();
        if (processor == null) {
            LOG.info("No fitting stage configured, skipping per-star processing of {} star(s)", resolved.size());
        } else {
            SydProperties.Run run = properties.getRun();
            PipelineReport report = pipelineService.run(resolved, processor, run.isParallel(), run.getThreads());
            if (report.hasFailures()) {
                LOG.warn("{} of {} star(s) failed: {}", report.failures().size(), report.total(),
                        report.failures().keySet());
            } else {
                LOG.info("All {} star(s) processed", report.total());
            }
        }

        Path outdir = Path.of(defaults.getString(ParameterNames.OUTDIR));
        AggregationResult result = aggregator.aggregate(outdir, defaults.isEnabled(ParameterNames.OVERWRITE));
        LOG.info("Ensemble tables: estimates={}, global={}", result.estimates().isPresent(),
                result.global().isPresent());
    }
}
