package com.phillippitts.syd.service.parallel;

import com.phillippitts.syd.domain.StarConfiguration;

/**
 * The fitting stage run once per star: loads data, searches for the power excess, fits the
 * background and global parameters, and writes the star's artifacts.
 *
 * <p>Implementations must be safe to call from several worker threads at once for
 * different stars, and must never prompt for input.
 */
@FunctionalInterface
public interface StarProcessor {

    /**
     * @throws RuntimeException on failure; the pipeline records it and moves on to the next star
     */
    void process(StarConfiguration config);
}
