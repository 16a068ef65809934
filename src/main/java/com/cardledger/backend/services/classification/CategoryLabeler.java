package com.cardledger.backend.services.classification;

import java.util.List;

/**
 * External labeling service. Outputs are free strings; callers validate them against
 * {@link com.cardledger.backend.enums.SpendingCategory}.
 */
public interface CategoryLabeler {

    /**
     * One category label per description, same order.
     */
    List<String> label(List<String> descriptions);

    /**
     * One subcategory per description given its already chosen category label; null when none fits.
     */
    List<String> sublabel(List<String> descriptions, List<String> categories);
}
