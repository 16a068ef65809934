package com.cardledger.backend.services.classification;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.cardledger.backend.enums.SpendingCategory;

public class DefaultCategoryLabeler implements CategoryLabeler {

    @Override
    public List<String> label(List<String> descriptions) {
        return Collections.nCopies(descriptions == null ? 0 : descriptions.size(), SpendingCategory.OTHER.getLabel());
    }

    @Override
    public List<String> sublabel(List<String> descriptions, List<String> categories) {
        int size = descriptions == null ? 0 : descriptions.size();
        List<String> out = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            out.add(null);
        }
        return out;
    }
}
