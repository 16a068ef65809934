package com.cardledger.backend.enums;

import java.util.List;
import java.util.Locale;

/**
 * Fixed category vocabulary. Each category owns the only subcategories it accepts.
 */
public enum SpendingCategory {
    INSURANCE("Insurance", List.of("Car", "Health", "Life", "Property")),
    DIGITAL_SUBSCRIPTION("Subscription/Digital", List.of("Netflix/Streaming", "Spotify/Music", "Games", "Cloud/Software")),
    CONVENIENCE_STORE("Convenience Store", List.of("CJ", "7-11", "Family Mart", "Lotus Go", "Other")),
    ONLINE_SHOPPING("Online Shopping", List.of("Shopee", "Lazada", "Amazon", "Other")),
    TOLLS_TRANSPORT("Tolls/Transport", List.of("Expressway", "Taxi/Grab", "Skytrain", "Fuel")),
    FOOD_DRINK("Food/Drinks", List.of("Restaurant", "Cafe", "Food Delivery", "Takeaway")),
    SUPERMARKET("Supermarket", List.of("Lotus", "Big C", "Tops", "Villa Market", "Makro")),
    TELECOM("Phone/Internet", List.of("AIS", "True", "DTAC", "NT", "3BB/Fiber")),
    TRAVEL("Travel", List.of("Hotel", "Flights", "Tours", "Attractions", "Car Rental")),
    CAR_SERVICE("Car Service", List.of("Tires/Brakes", "Fuel", "Battery", "Maintenance", "Car Wash")),
    HEALTH("Health", List.of("Hospital", "Clinic", "Pharmacy", "Dental", "Checkup")),
    SHOPPING("Shopping", List.of("Sports", "Clothing", "Household", "Department Store", "Electronics")),
    OTHER("Other", List.of());

    private final String label;
    private final List<String> subcategories;

    SpendingCategory(String label, List<String> subcategories) {
        this.label = label;
        this.subcategories = subcategories;
    }

    public String getLabel() {
        return label;
    }

    public List<String> getSubcategories() {
        return subcategories;
    }

    /**
     * Resolves a labeler output by display label or constant name; anything else is OTHER.
     */
    public static SpendingCategory fromLabel(String value) {
        if (value == null || value.isBlank()) {
            return OTHER;
        }
        String v = value.trim();
        for (SpendingCategory c : values()) {
            if (c.label.equalsIgnoreCase(v) || c.name().equalsIgnoreCase(v.replace(' ', '_'))) {
                return c;
            }
        }
        return OTHER;
    }

    /**
     * Returns the canonical subcategory when it belongs to this category, otherwise null.
     */
    public String validSubcategory(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (String sub : subcategories) {
            if (sub.toLowerCase(Locale.ROOT).equals(v)) {
                return sub;
            }
        }
        return null;
    }
}
