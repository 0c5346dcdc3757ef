package com.phillippitts.syd.service.resolve;

import java.util.Optional;

/**
 * Source of per-star information rows.
 */
@FunctionalInterface
public interface StarCatalog {

    /**
     * @param star normalized star id
     * @return the row for that star, empty if the catalog has none
     */
    Optional<CatalogEntry> find(String star);
}
