package com.phillippitts.syd.service.aggregate;

import java.util.Optional;

/**
 * Ensemble tables written by one aggregation; a kind is empty when no star had that artifact.
 */
public record AggregationResult(Optional<EnsembleTable> estimates, Optional<EnsembleTable> global) {
}
