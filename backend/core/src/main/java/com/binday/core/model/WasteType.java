package com.binday.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum WasteType {
    REFUSE("Refuse"),
    RECYCLING("Recycling"),
    GARDEN_WASTE("Garden Waste"),
    FOOD_WASTE("Food Waste");

    private final String label;

    WasteType(String label) {
        this.label = label;
    }

    /**
     * Stream name as printed by the council site; used in JSON payloads, calendar summaries and UIDs.
     */
    @JsonValue
    public String label() {
        return label;
    }
}
