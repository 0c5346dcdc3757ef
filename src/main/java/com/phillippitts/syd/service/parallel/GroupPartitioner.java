package com.phillippitts.syd.service.parallel;

import com.phillippitts.syd.domain.StarGroup;
import com.phillippitts.syd.exception.ConfigurationException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntSupplier;

/**
 * Splits stars round-robin into balanced worker groups.
 *
 * <p>The star at position {@code p} goes to group {@code p mod N}, so group sizes differ by at
 * most one and each group keeps request order.
 */
@Component
public class GroupPartitioner {

    private final IntSupplier availableProcessors;

    @Autowired
    public GroupPartitioner() {
        this(() -> Runtime.getRuntime().availableProcessors());
    }

    public GroupPartitioner(IntSupplier availableProcessors) {
        this.availableProcessors = availableProcessors;
    }

    /**
     * @param stars     star ids in request order
     * @param requested worker count; 0 means one per available processor
     * @return {@code min(workers, stars.size())} groups, none for an empty star list
     * @throws ConfigurationException if {@code requested} is negative
     */
    public List<StarGroup> partition(List<String> stars, int requested) {
        if (requested < 0) {
            throw new ConfigurationException("Worker count must not be negative: " + requested, "n_threads");
        }
        if (stars.isEmpty()) {
            return List.of();
        }
        int workers = requested == 0 ? Math.max(1, availableProcessors.getAsInt()) : requested;
        int n = Math.min(workers, stars.size());

        List<List<String>> buckets = new ArrayList<>(n);
        for (int g = 0; g < n; g++) {
            buckets.add(new ArrayList<>());
        }
        for (int p = 0; p < stars.size(); p++) {
            buckets.get(p % n).add(stars.get(p));
        }
        List<StarGroup> groups = new ArrayList<>(n);
        for (int g = 0; g < n; g++) {
            groups.add(new StarGroup(g, buckets.get(g)));
        }
        return groups;
    }
}
