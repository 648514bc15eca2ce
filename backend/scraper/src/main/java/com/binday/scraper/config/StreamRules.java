package com.binday.scraper.config;

import com.binday.core.model.WasteType;

import java.util.List;

public final class StreamRules {
    public static final String SCHEDULE_CONTAINER = ".your-collection-schedule-container";
    public static final String DETAIL_BLOCK = ".collectionDetail";
    public static final String INSTRUCTION_PARAGRAPH = "p.instructions";
    public static final String NOTICE = ".collectionDates-container .upcoming-dates";
    public static final String ASTERISK_NOTE = ".asterisk-note";

    private static final String DATE_ENTRY = ".collectionDates-container .garden-collection-postdate";

    /**
     * Council page layout as of the last markup change, in output order.
     */
    public static final List<StreamRule> DEFAULT = List.of(
            new StreamRule(".refuse-container", DATE_ENTRY,
                    ".refuse-garden-collection-day-numeric", ".refuse-collection-month", WasteType.REFUSE),
            new StreamRule(".recycle-container", DATE_ENTRY,
                    ".recycling-garden-collection-day-numeric", ".recycling-collection-month", WasteType.RECYCLING),
            new StreamRule(".garden-container", DATE_ENTRY,
                    ".garden-collection-day-numeric", ".garden-collection-month", WasteType.GARDEN_WASTE),
            new StreamRule(".foodwasteCollectionDay", DATE_ENTRY,
                    ".food-garden-collection-day-numeric", ".food-collection-month", WasteType.FOOD_WASTE)
    );

    private StreamRules() {
    }
}
