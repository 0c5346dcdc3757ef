package com.phillippitts.syd.service.parallel;

import com.phillippitts.syd.service.resolve.ResolvedStars;

/**
 * Runs the fitting stage over a set of resolved stars.
 */
public interface PipelineService {

    /**
     * Processes every star and returns once all have finished.
     *
     * @param stars     resolved configurations
     * @param processor fitting stage
     * @param parallel  run star groups concurrently on the star executor
     * @param nThreads  worker count in parallel mode; 0 means all available processors
     * @return which stars succeeded and which failed
     */
    PipelineReport run(ResolvedStars stars, StarProcessor processor, boolean parallel, int nThreads);
}
